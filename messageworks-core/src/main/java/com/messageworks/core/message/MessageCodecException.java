package com.messageworks.core.message;

/**
 * 消息编码或解码失败。
 */
public class MessageCodecException extends RuntimeException {

    public MessageCodecException(String message) {
        super(message);
    }

    public MessageCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
