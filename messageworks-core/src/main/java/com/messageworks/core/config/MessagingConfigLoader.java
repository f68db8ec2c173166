package com.messageworks.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.messageworks.core.message.MessageConstants;
import lombok.extern.slf4j.Slf4j;

/**
 * 读取 JSON 格式的 {@link MessagingConfig}。
 */
@Slf4j
public final class MessagingConfigLoader {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private MessagingConfigLoader() {
        // 私有构造函数，防止实例化
    }

    /**
     * 从文件加载配置。
     *
     * @throws MessagingConfigException 文件不存在、无法读取或格式错误
     */
    public static MessagingConfig load(Path path) {
        try {
            MessagingConfig config = OBJECT_MAPPER.readValue(Files.readString(path), MessagingConfig.class);
            log.info("已加载配置文件: {}", path);
            return normalize(config);
        } catch (IOException e) {
            throw new MessagingConfigException("无法加载配置文件: " + path, e);
        }
    }

    /**
     * 从类路径资源 {@code messageworks.json} 加载配置，资源不存在时使用默认配置。
     */
    public static MessagingConfig loadDefault() {
        return loadResource(MessageConstants.DEFAULT_CONFIG_RESOURCE);
    }

    public static MessagingConfig loadResource(String resource) {
        ClassLoader classLoader = Thread.currentThread().getContextClassLoader();
        if (classLoader == null) {
            classLoader = MessagingConfigLoader.class.getClassLoader();
        }
        try (InputStream in = classLoader.getResourceAsStream(resource)) {
            if (in == null) {
                log.warn("未找到配置资源 {}，使用默认配置。", resource);
                return MessagingConfig.defaults();
            }
            MessagingConfig config = OBJECT_MAPPER.readValue(in, MessagingConfig.class);
            log.info("已加载配置资源: {}", resource);
            return normalize(config);
        } catch (IOException e) {
            throw new MessagingConfigException("无法解析配置资源: " + resource, e);
        }
    }

    public static MessagingConfig parse(String json) {
        try {
            return normalize(OBJECT_MAPPER.readValue(json, MessagingConfig.class));
        } catch (IOException e) {
            throw new MessagingConfigException("配置内容格式错误", e);
        }
    }

    private static MessagingConfig normalize(MessagingConfig config) {
        if (config == null) {
            return MessagingConfig.defaults();
        }
        if (config.getTransport() == null) {
            config.setTransport(new TransportConfig());
        }
        return config;
    }
}
