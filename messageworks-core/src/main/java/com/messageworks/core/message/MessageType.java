package com.messageworks.core.message;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 消息类型枚举，决定消息在传输中被还原成哪个变体。
 */
public enum MessageType {

    /**
     * 普通消息，发出即完成
     */
    GENERAL("general"),

    /**
     * 请求消息，发送方等待一个关联的响应
     */
    REQUEST("request"),

    /**
     * 响应消息，通过 requestId 关联到请求
     */
    RESPONSE("response");

    private final String value;

    MessageType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static MessageType fromValue(String value) {
        for (MessageType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + value);
    }
}
