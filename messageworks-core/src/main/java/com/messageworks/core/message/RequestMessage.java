package com.messageworks.core.message;

import lombok.EqualsAndHashCode;
import lombok.ToString;

/**
 * 请求消息。发送方会得到一个在收到关联响应时完成的 future。
 */
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class RequestMessage extends Message {

    public RequestMessage() {
        this.type = MessageType.REQUEST;
    }

    public RequestMessage(String name, Address destination) {
        this(name, destination, null);
    }

    public RequestMessage(String name, Address destination, Object data) {
        super(MessageType.REQUEST, name, destination, data);
    }
}
