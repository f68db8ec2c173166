package com.messageworks.core.route;

import com.messageworks.core.channel.ChannelAdapter;
import com.messageworks.core.channel.MessageListener;
import com.messageworks.core.message.Address;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 一个已注册的直接子上下文：名称、完整地址、通道以及订阅在通道上的入站监听器。
 */
@Getter
@AllArgsConstructor
@ToString(exclude = "listener")
public class ChildRoute {

    private final String name;
    private final Address address;
    private final ChannelAdapter channel;
    private final MessageListener listener;
}
