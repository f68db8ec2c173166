package com.messageworks.core.config;

import java.time.Duration;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 消息服务配置，对应 JSON 配置文件 {@code messageworks.json}。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MessagingConfig {

    /**
     * 未显式指定超时的请求所使用的超时时间（毫秒），0 表示不超时
     */
    @JsonProperty("default_request_timeout_ms")
    @Builder.Default
    private long defaultRequestTimeoutMs = 0L;

    /**
     * 从上游收到的广播是否继续分发给所有子上下文
     */
    @JsonProperty("propagate_broadcasts")
    @Builder.Default
    private boolean propagateBroadcasts = true;

    @JsonProperty("runloop_queue_capacity")
    @Builder.Default
    private int runloopQueueCapacity = 1024;

    @JsonProperty("transport")
    @Builder.Default
    private TransportConfig transport = new TransportConfig();

    public static MessagingConfig defaults() {
        return new MessagingConfig();
    }

    @JsonIgnore
    public Duration getDefaultRequestTimeout() {
        return defaultRequestTimeoutMs > 0 ? Duration.ofMillis(defaultRequestTimeoutMs) : Duration.ZERO;
    }
}
