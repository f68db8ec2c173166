package com.messageworks.core.channel;

import com.messageworks.core.message.Message;
import com.messageworks.core.message.MessageCodec;
import com.messageworks.core.runloop.Runloop;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 同一 JVM 内两个执行上下文之间的通道端点。
 * <p>
 * 两个端点成对创建：一端发送的消息经编解码器复制后投递给另一端的监听器（在对端的 Runloop 上执行），
 * 因此不会有可变状态跨越通道。关闭任一端点即关闭整条通道。
 */
@Slf4j
public class LocalChannel extends AbstractChannelAdapter {

    private volatile LocalChannel peer;

    private LocalChannel(String name, Runloop runloop) {
        super(name, runloop);
    }

    /**
     * 创建一对连接父子上下文的通道端点。
     *
     * @param childName     子上下文名称，用于命名两个端点
     * @param parentRunloop 父上下文的 Runloop，父端入站消息在其上执行（可为 null）
     * @param childRunloop  子上下文的 Runloop，子端入站消息在其上执行（可为 null）
     */
    public static Pair connect(String childName, Runloop parentRunloop, Runloop childRunloop) {
        LocalChannel parentEnd = new LocalChannel("local:" + childName + ":parent", parentRunloop);
        LocalChannel childEnd = new LocalChannel("local:" + childName + ":child", childRunloop);
        parentEnd.peer = childEnd;
        childEnd.peer = parentEnd;
        log.debug("LocalChannel: 已创建通道对 {} <-> {}", parentEnd.getName(), childEnd.getName());
        return new Pair(parentEnd, childEnd);
    }

    @Override
    public void send(Message message) {
        LocalChannel target = peer;
        if (closed || target == null || target.closed) {
            throw new IllegalStateException("Channel " + name + " is closed");
        }
        target.deliver(MessageCodec.copy(message));
    }

    @Override
    protected void doClose() {
        LocalChannel target = peer;
        if (target != null) {
            target.close();
        }
    }

    /**
     * 一对通道端点：父端交给父上下文的 {@code addChild}，子端作为子上下文的上游通道。
     */
    @Getter
    @RequiredArgsConstructor
    public static class Pair {
        private final LocalChannel parentEnd;
        private final LocalChannel childEnd;
    }
}
