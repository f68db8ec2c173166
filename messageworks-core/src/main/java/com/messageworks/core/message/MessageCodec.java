package com.messageworks.core.message;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.msgpack.core.ExtensionTypeHeader;
import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.value.ValueType;

/**
 * 消息编解码器。
 * 先用 MsgPack 序列化 Message 对象，再封装为类型为 {@link MessageConstants#MESSAGE_EXT_TYPE} 的 EXT 值。
 * 进程内通道用它生成独立副本，网络传输用它生成帧内容。
 */
@Slf4j
public final class MessageCodec {

    private MessageCodec() {
        // 私有构造函数，防止实例化
    }

    public static byte[] encode(Message message) {
        if (message == null) {
            throw new MessageCodecException("cannot encode null message");
        }
        ObjectMapper objectMapper = MessagePackMapperProvider.getObjectMapper();
        try {
            // 1. 将Message对象序列化为普通的MsgPack字节数组，type 字段随之写入
            byte[] innerBytes = objectMapper.writeValueAsBytes(message);

            // 2. 封装为自定义的EXT类型
            ExtensionTypeHeader extHeader = new ExtensionTypeHeader(MessageConstants.MESSAGE_EXT_TYPE,
                    innerBytes.length);
            MessageBufferPacker packer = MessagePack.newDefaultBufferPacker();
            packer.packExtensionTypeHeader(extHeader.getType(), extHeader.getLength());
            packer.writePayload(innerBytes);
            packer.close();

            byte[] finalBytes = packer.toByteArray();
            log.debug("消息编码成功: type={}, name={}, innerSize={}, finalSize={} bytes",
                    message.getType(), message.getName(), innerBytes.length, finalBytes.length);
            return finalBytes;
        } catch (IOException e) {
            throw new MessageCodecException("消息编码失败: type=" + message.getType() + ", name=" + message.getName(), e);
        }
    }

    public static Message decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new MessageCodecException("cannot decode empty payload");
        }
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(bytes)) {
            MessageFormat format = unpacker.getNextFormat();
            if (format.getValueType() != ValueType.EXTENSION) {
                throw new MessageCodecException("期望MsgPack EXT类型，但收到: " + format);
            }

            ExtensionTypeHeader extHeader = unpacker.unpackExtensionTypeHeader();
            if (extHeader.getType() != MessageConstants.MESSAGE_EXT_TYPE) {
                throw new MessageCodecException("期望消息EXT类型 (" + MessageConstants.MESSAGE_EXT_TYPE + "), 但收到: "
                        + extHeader.getType());
            }

            byte[] innerBytes = unpacker.readPayload(extHeader.getLength());
            Message message = MessagePackMapperProvider.getObjectMapper().readValue(innerBytes, Message.class);
            if (message == null) {
                throw new MessageCodecException("解码Message对象为空");
            }
            log.debug("消息解码成功: type={}, name={}, size={} bytes", message.getType(), message.getName(),
                    bytes.length);
            return message;
        } catch (IOException | MessagePackException e) {
            throw new MessageCodecException("消息解码失败: " + e.getMessage(), e);
        }
    }

    public static Message copy(Message message) {
        return decode(encode(message));
    }
}
