package com.messageworks.core.service;

/**
 * 消息服务运行时异常：服务已清理、请求无法分发等。
 */
public class MessagingException extends RuntimeException {

    public static final String TORN_DOWN = "service torn down";

    public MessagingException(String message) {
        super(message);
    }

    public MessagingException(String message, Throwable cause) {
        super(message, cause);
    }

    public static MessagingException tornDown() {
        return new MessagingException(TORN_DOWN);
    }
}
