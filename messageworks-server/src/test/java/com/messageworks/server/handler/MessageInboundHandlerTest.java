package com.messageworks.server.handler;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.messageworks.core.environment.RootEnvironment;
import com.messageworks.core.message.Address;
import com.messageworks.core.message.GeneralMessage;
import com.messageworks.core.message.Message;
import com.messageworks.core.message.MessageUtils;
import com.messageworks.core.message.RequestMessage;
import com.messageworks.core.message.ResponseMessage;
import com.messageworks.core.service.MessagingService;
import com.messageworks.server.connection.NettyChannelAdapter;
import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 服务端接入握手与子上下文注册测试，不经过网络和编解码。
 */
class MessageInboundHandlerTest {

    private MessagingService service;
    private ConcurrentMap<String, NettyChannelAdapter> attachedChildren;
    private final List<Message> received = new ArrayList<>();

    @BeforeEach
    void setUp() {
        service = new MessagingService(new RootEnvironment());
        service.initialize();
        service.setMessageReceived(message -> {
            received.add(message);
            if (message instanceof RequestMessage) {
                service.send(new ResponseMessage("pong", (RequestMessage) message, "from-root"));
            }
        });
        attachedChildren = new ConcurrentHashMap<>();
    }

    @AfterEach
    void tearDown() {
        service.cleanUp();
    }

    private EmbeddedChannel newConnection() {
        return new EmbeddedChannel(new MessageInboundHandler(service, null, attachedChildren));
    }

    @Test
    @DisplayName("握手后连接注册为子上下文")
    void testAttach() {
        EmbeddedChannel channel = newConnection();
        channel.writeInbound(MessageUtils.attachMessage("worker"));

        assertEquals(Address.of("worker"), service.getChildren().get("worker"));
        assertTrue(attachedChildren.containsKey("worker"));
        assertEquals("tcp:worker", attachedChildren.get("worker").getName());
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("握手前的消息被丢弃")
    void testMessageBeforeAttachDropped() {
        EmbeddedChannel channel = newConnection();
        channel.writeInbound(new GeneralMessage("early", Address.root()));

        assertTrue(received.isEmpty());
        assertTrue(service.getChildren().isEmpty());
        assertTrue(channel.isOpen());
        channel.finishAndReleaseAll();
    }

    @Test
    void testBlankNameClosesConnection() {
        EmbeddedChannel channel = newConnection();
        channel.writeInbound(MessageUtils.attachMessage("  "));

        assertFalse(channel.isOpen());
        assertTrue(service.getChildren().isEmpty());
    }

    @Test
    @DisplayName("子上下文的请求在父上下文处理，响应写回同一连接")
    void testRequestFromChild() {
        EmbeddedChannel channel = newConnection();
        channel.writeInbound(MessageUtils.attachMessage("worker"));

        RequestMessage request = new RequestMessage("ping", Address.root());
        request.setId("w-1");
        request.setSource(Address.of("worker"));
        channel.writeInbound(request);

        assertEquals(1, received.size());
        Message reply = channel.readOutbound();
        assertTrue(reply instanceof ResponseMessage);
        assertEquals("w-1", ((ResponseMessage) reply).getRequestId());
        assertEquals(Address.of("worker"), reply.getDestination());
        assertEquals("from-root", reply.getData(String.class));
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("断开连接后注销子上下文")
    void testDisconnectRemovesChild() {
        EmbeddedChannel channel = newConnection();
        channel.writeInbound(MessageUtils.attachMessage("worker"));
        NettyChannelAdapter adapter = attachedChildren.get("worker");

        channel.close();

        assertTrue(service.getChildren().isEmpty());
        assertTrue(attachedChildren.isEmpty());
        assertTrue(adapter.isClosed());
    }

    @Test
    @DisplayName("多段接入名称关闭连接且不登记")
    void testMultiSegmentNameClosesConnection() {
        EmbeddedChannel channel = newConnection();
        channel.writeInbound(MessageUtils.attachMessage("a/b"));

        assertFalse(channel.isOpen());
        assertTrue(attachedChildren.isEmpty());
        assertTrue(service.getChildren().isEmpty());
    }

    @Test
    @DisplayName("非规范接入名称按规范名登记，断开后注销")
    void testUnnormalizedNameAttachAndDisconnect() {
        EmbeddedChannel channel = newConnection();
        channel.writeInbound(MessageUtils.attachMessage("/worker/"));

        assertEquals(Address.of("worker"), service.getChildren().get("worker"));
        assertTrue(attachedChildren.containsKey("worker"));

        channel.close();
        assertTrue(service.getChildren().isEmpty());
        assertTrue(attachedChildren.isEmpty());
    }

    @Test
    @DisplayName("写出的是发送时刻的副本，之后修改原消息不影响已发送的内容")
    void testSendWritesSnapshot() {
        EmbeddedChannel channel = newConnection();
        channel.writeInbound(MessageUtils.attachMessage("worker"));
        NettyChannelAdapter adapter = attachedChildren.get("worker");

        GeneralMessage original = new GeneralMessage("job", Address.of("worker"), "v1");
        original.setId("first");
        adapter.send(original);
        original.setId("second").setData("v2");

        Message written = channel.readOutbound();
        assertNotSame(original, written);
        assertEquals("first", written.getId());
        assertEquals("v1", written.getData(String.class));
        channel.finishAndReleaseAll();
    }

    @Test
    @DisplayName("同名子上下文重新接入时关闭旧连接，旧连接断开不影响新注册")
    void testReattachReplacesOldConnection() {
        EmbeddedChannel first = newConnection();
        first.writeInbound(MessageUtils.attachMessage("worker"));
        EmbeddedChannel second = newConnection();
        second.writeInbound(MessageUtils.attachMessage("worker"));

        assertFalse(first.isOpen());
        assertTrue(second.isOpen());
        assertEquals(Address.of("worker"), service.getChildren().get("worker"));
        assertSame(second, attachedChildren.get("worker").getChannel());
        second.finishAndReleaseAll();
    }
}
