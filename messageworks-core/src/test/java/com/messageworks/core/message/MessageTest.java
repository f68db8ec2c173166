package com.messageworks.core.message;

import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 消息模型测试：三种变体的字段填充规则
 */
class MessageTest {

    @Test
    void testGeneralMessageDefaults() {
        GeneralMessage message = new GeneralMessage("ping", Address.of("a"));
        assertEquals(MessageType.GENERAL, message.getType());
        assertEquals("ping", message.getName());
        assertEquals(Address.of("a"), message.getDestination());
        assertEquals(Address.root(), message.getSource());
        assertFalse(message.isBroadcast());
        assertNull(message.getId(), "id 由发送方服务分配");
        assertNull(message.getData());
        assertTrue(message.getTimestamp() > 0);
    }

    @Test
    void testRequestMessageFixesType() {
        RequestMessage request = new RequestMessage("lookup", Address.of("a", "b"), "payload");
        assertEquals(MessageType.REQUEST, request.getType());
        assertEquals("payload", request.getData());
        assertEquals(MessageType.REQUEST, new RequestMessage().getType());
    }

    @Test
    @DisplayName("响应在构造时绑定请求的 id 与 source")
    void testResponseBindsToRequest() {
        RequestMessage request = new RequestMessage("lookup", Address.of("a", "b"));
        request.setId("req-1").setSource(Address.of("x", "y"));

        ResponseMessage response = new ResponseMessage("lookup_result", request, 42);
        assertEquals(MessageType.RESPONSE, response.getType());
        assertEquals("req-1", response.getRequestId());
        assertEquals(Address.of("x", "y"), response.getDestination());
        assertEquals(42, response.getData());
        assertNull(response.getId());
    }

    @Test
    void testResponseRequiresRequest() {
        assertThrows(IllegalArgumentException.class, () -> new ResponseMessage("r", null));
    }

    @Test
    void testChainedSetters() {
        Message message = new GeneralMessage("news", Address.root())
                .setBroadcast(true)
                .setData(Map.of("headline", "hello"));
        assertTrue(message.isBroadcast());
        assertEquals(Map.of("headline", "hello"), message.getData(Map.class));
    }

    @Test
    @DisplayName("经过复制后的 data 可以按类型读取")
    void testTypedDataAfterCopy() {
        GeneralMessage message = new GeneralMessage("point", Address.of("a"), new Point(3, 4));
        Message copy = message.copy();

        assertNotSame(message, copy);
        assertTrue(copy.getData() instanceof Map, "跨通道后 data 还原为 Map");
        Point point = copy.getData(Point.class);
        assertEquals(3, point.getX());
        assertEquals(4, point.getY());
        assertNull(new GeneralMessage("empty", Address.root()).getData(Point.class));
    }

    @Test
    void testDebugString() {
        RequestMessage request = new RequestMessage("lookup", Address.of("a"));
        request.setId("r1").setSource(Address.of("b"));
        ResponseMessage response = new ResponseMessage("done", request);
        String text = MessageUtils.toDebugString(response);
        assertTrue(text.contains("requestId=r1"));
        assertTrue(text.contains("/ -> /b"));
        assertEquals("null", MessageUtils.toDebugString(null));
    }

    static class Point {
        private int x;
        private int y;

        Point() {
        }

        Point(int x, int y) {
            this.x = x;
            this.y = y;
        }

        public int getX() {
            return x;
        }

        public void setX(int x) {
            this.x = x;
        }

        public int getY() {
            return y;
        }

        public void setY(int y) {
            this.y = y;
        }
    }
}
