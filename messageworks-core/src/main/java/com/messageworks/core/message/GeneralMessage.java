package com.messageworks.core.message;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 普通消息，发送后不等待响应。
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class GeneralMessage extends Message {

    public GeneralMessage() {
        this.type = MessageType.GENERAL;
    }

    public GeneralMessage(String name, Address destination) {
        this(name, destination, null);
    }

    public GeneralMessage(String name, Address destination, Object data) {
        super(MessageType.GENERAL, name, destination, data);
    }
}
