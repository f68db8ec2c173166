package com.messageworks.core.environment;

import java.util.Optional;

import com.messageworks.core.channel.ChannelAdapter;
import com.messageworks.core.message.Address;
import lombok.Getter;

/**
 * 子上下文：具有非根地址，并通过一个上游通道连接到父上下文。
 */
public class ChildEnvironment implements ContextEnvironment {

    @Getter
    private final Address address;
    private final ChannelAdapter upstreamChannel;

    public ChildEnvironment(Address address, ChannelAdapter upstreamChannel) {
        if (address == null || address.isRoot()) {
            throw new IllegalArgumentException("child context requires a non-root address");
        }
        this.address = address;
        this.upstreamChannel = upstreamChannel;
    }

    @Override
    public boolean isRoot() {
        return false;
    }

    @Override
    public Optional<ChannelAdapter> getUpstreamChannel() {
        return Optional.ofNullable(upstreamChannel);
    }

    @Override
    public String toString() {
        return "ChildEnvironment[" + address + "]";
    }
}
