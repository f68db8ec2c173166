package com.messageworks.server.message;

import com.messageworks.core.config.TransportConfig;
import io.netty.channel.ChannelPipeline;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

/**
 * 服务端和客户端共用的编解码管道：4 字节长度前缀 + MsgPack EXT 消息体。
 */
public final class MessagePipeline {

    public static final String FRAME_DECODER = "frameDecoder";
    public static final String FRAME_ENCODER = "frameEncoder";
    public static final String MESSAGE_DECODER = "messageDecoder";
    public static final String MESSAGE_ENCODER = "messageEncoder";

    private static final int LENGTH_FIELD_LENGTH = 4;

    private MessagePipeline() {
        // 私有构造函数，防止实例化
    }

    public static void addCodec(ChannelPipeline pipeline, TransportConfig config) {
        pipeline.addLast(FRAME_DECODER, new LengthFieldBasedFrameDecoder(config.getMaxFrameLength(), 0,
                LENGTH_FIELD_LENGTH, 0, LENGTH_FIELD_LENGTH));
        pipeline.addLast(FRAME_ENCODER, new LengthFieldPrepender(LENGTH_FIELD_LENGTH));
        pipeline.addLast(MESSAGE_DECODER, new MessageDecoder());
        pipeline.addLast(MESSAGE_ENCODER, new MessageEncoder());
    }
}
