package com.messageworks.core.message;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.experimental.Accessors;

/**
 * 所有消息变体的抽象基类。
 * <p>
 * {@code id} 和 {@code source} 由发送消息的 MessagingService 填写，创建者只负责 name、destination、broadcast 和 data。
 * 通过 Jackson 注解按 {@code type} 字段做多态序列化；应用自定义的子类在传输中按其基础变体还原。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GeneralMessage.class, name = "general"),
        @JsonSubTypes.Type(value = RequestMessage.class, name = "request"),
        @JsonSubTypes.Type(value = ResponseMessage.class, name = "response"),
})
@JsonIgnoreProperties(ignoreUnknown = true)
@Data
@NoArgsConstructor
@Accessors(chain = true)
public abstract class Message {

    @JsonProperty("type")
    protected MessageType type;

    @JsonProperty("id")
    protected String id;

    @JsonProperty("name")
    protected String name;

    @JsonProperty("broadcast")
    protected boolean broadcast;

    @JsonProperty("source")
    protected Address source = Address.root();

    @JsonProperty("destination")
    protected Address destination = Address.root();

    @JsonProperty("data")
    protected Object data;

    @JsonProperty("timestamp")
    protected long timestamp;

    protected Message(MessageType type, String name, Address destination, Object data) {
        this.type = type;
        this.name = name;
        this.destination = destination != null ? destination : Address.root();
        this.data = data;
        this.timestamp = System.currentTimeMillis();
    }

    /**
     * 以指定类型读取 data。经过序列化通道后 data 可能已还原为 Map/List，此时借助 Jackson 转换。
     *
     * @return 转换后的 data；data 为 null 时返回 null
     */
    public <T> T getData(Class<T> dataType) {
        if (data == null) {
            return null;
        }
        if (dataType.isInstance(data)) {
            return dataType.cast(data);
        }
        return MessagePackMapperProvider.getObjectMapper().convertValue(data, dataType);
    }

    /**
     * 通过编解码器生成一个独立副本，副本与原消息不共享任何可变状态。
     */
    public Message copy() {
        return MessageCodec.copy(this);
    }
}
