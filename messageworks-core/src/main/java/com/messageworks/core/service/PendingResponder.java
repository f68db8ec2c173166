package com.messageworks.core.service;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import com.messageworks.core.message.ResponseMessage;
import io.netty.util.Timeout;
import lombok.Getter;

/**
 * 等待响应的请求。future 只会完成一次：收到响应、超时或服务清理。
 */
@Getter
class PendingResponder {

    private final String requestId;
    private final String requestName;
    private final long createdAt;
    private final CompletableFuture<Optional<ResponseMessage>> future = new CompletableFuture<>();
    private volatile Timeout timeout;

    PendingResponder(String requestId, String requestName) {
        this.requestId = requestId;
        this.requestName = requestName;
        this.createdAt = System.currentTimeMillis();
    }

    void setTimeout(Timeout timeout) {
        this.timeout = timeout;
        if (future.isDone()) {
            timeout.cancel();
        }
    }

    boolean complete(ResponseMessage response) {
        cancelTimeout();
        return future.complete(Optional.of(response));
    }

    boolean fail(Throwable cause) {
        cancelTimeout();
        return future.completeExceptionally(cause);
    }

    private void cancelTimeout() {
        Timeout t = timeout;
        if (t != null) {
            t.cancel();
        }
    }
}
