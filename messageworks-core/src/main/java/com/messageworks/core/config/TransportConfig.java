package com.messageworks.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 网络传输配置，供 Netty 服务端和上游连接器使用。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TransportConfig {

    @JsonProperty("host")
    @Builder.Default
    private String host = "127.0.0.1";

    /**
     * 监听端口，0 表示由系统分配
     */
    @JsonProperty("port")
    @Builder.Default
    private int port = 0;

    @JsonProperty("max_frame_length")
    @Builder.Default
    private int maxFrameLength = 1024 * 1024;

    @JsonProperty("connect_timeout_ms")
    @Builder.Default
    private int connectTimeoutMs = 5000;
}
