package com.messageworks.core.config;

/**
 * 配置加载失败。
 */
public class MessagingConfigException extends RuntimeException {

    public MessagingConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
