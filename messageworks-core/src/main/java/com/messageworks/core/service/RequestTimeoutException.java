package com.messageworks.core.service;

import java.time.Duration;

import lombok.Getter;

/**
 * 请求在指定时间内没有收到响应。
 */
@Getter
public class RequestTimeoutException extends MessagingException {

    private final String requestId;
    private final Duration timeout;

    public RequestTimeoutException(String requestId, Duration timeout) {
        super("request " + requestId + " timed out after " + timeout.toMillis() + " ms");
        this.requestId = requestId;
        this.timeout = timeout;
    }
}
