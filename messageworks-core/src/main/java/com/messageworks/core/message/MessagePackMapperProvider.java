package com.messageworks.core.message;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.msgpack.jackson.dataformat.MessagePackFactory;

/**
 * 提供预配置的 ObjectMapper 实例，用于消息的 MessagePack 序列化和反序列化。
 */
public final class MessagePackMapperProvider {

    private static final ObjectMapper OBJECT_MAPPER;

    static {
        OBJECT_MAPPER = new ObjectMapper(new MessagePackFactory());

        // 配置ObjectMapper忽略未知属性
        OBJECT_MAPPER.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // data 允许携带没有属性的业务对象
        OBJECT_MAPPER.configure(SerializationFeature.FAIL_ON_EMPTY_BEANS, false);
    }

    private MessagePackMapperProvider() {
        // 私有构造函数，防止实例化
    }

    public static ObjectMapper getObjectMapper() {
        return OBJECT_MAPPER;
    }
}
