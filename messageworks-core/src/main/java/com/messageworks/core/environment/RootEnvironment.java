package com.messageworks.core.environment;

import java.util.Optional;

import com.messageworks.core.channel.ChannelAdapter;
import com.messageworks.core.message.Address;

/**
 * 根上下文：地址为根，没有上游通道。
 */
public class RootEnvironment implements ContextEnvironment {

    @Override
    public Address getAddress() {
        return Address.root();
    }

    @Override
    public boolean isRoot() {
        return true;
    }

    @Override
    public Optional<ChannelAdapter> getUpstreamChannel() {
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "RootEnvironment";
    }
}
