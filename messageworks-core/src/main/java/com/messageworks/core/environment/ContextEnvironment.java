package com.messageworks.core.environment;

import java.util.Optional;

import com.messageworks.core.channel.ChannelAdapter;
import com.messageworks.core.message.Address;

/**
 * 执行上下文的身份与环境信息，在构造 MessagingService 时注入。
 */
public interface ContextEnvironment {

    /**
     * 本上下文的地址。
     */
    Address getAddress();

    /**
     * 是否为根上下文。根上下文没有上游。
     */
    default boolean isRoot() {
        return getAddress().isRoot();
    }

    /**
     * 通往父上下文的通道；根上下文返回空。
     */
    Optional<ChannelAdapter> getUpstreamChannel();
}
