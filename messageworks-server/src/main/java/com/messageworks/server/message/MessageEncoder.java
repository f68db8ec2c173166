package com.messageworks.server.message;

import java.util.List;

import com.messageworks.core.message.Message;
import com.messageworks.core.message.MessageCodec;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageEncoder;
import lombok.extern.slf4j.Slf4j;

/**
 * 将 Message 编码为 MsgPack EXT 字节，输出 ByteBuf，由后续的 LengthFieldPrepender 加上长度前缀。
 */
@Slf4j
public class MessageEncoder extends MessageToMessageEncoder<Message> {

    @Override
    protected void encode(ChannelHandlerContext ctx, Message msg, List<Object> out) {
        byte[] bytes = MessageCodec.encode(msg);
        log.debug("MessageEncoder: 消息 '{}' (type: {}) 编码为 {} 字节", msg.getName(), msg.getType(), bytes.length);
        out.add(Unpooled.wrappedBuffer(bytes));
    }
}
