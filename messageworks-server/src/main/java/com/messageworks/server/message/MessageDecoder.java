package com.messageworks.server.message;

import java.util.List;

import com.messageworks.core.message.Message;
import com.messageworks.core.message.MessageCodec;
import com.messageworks.core.message.MessageCodecException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.MessageToMessageDecoder;
import lombok.extern.slf4j.Slf4j;

/**
 * 将一个完整帧（已由 LengthFieldBasedFrameDecoder 切分）解码为 Message。
 * 无法识别的帧记录日志后丢弃，不关闭连接。
 */
@Slf4j
public class MessageDecoder extends MessageToMessageDecoder<ByteBuf> {

    @Override
    protected void decode(ChannelHandlerContext ctx, ByteBuf frame, List<Object> out) {
        if (!frame.isReadable()) {
            log.warn("MessageDecoder: 收到空帧");
            return;
        }
        byte[] bytes = ByteBufUtil.getBytes(frame);
        try {
            Message message = MessageCodec.decode(bytes);
            out.add(message);
        } catch (MessageCodecException e) {
            log.warn("MessageDecoder: 丢弃无法解码的帧 ({} 字节): {}", bytes.length, e.getMessage());
        }
    }
}
