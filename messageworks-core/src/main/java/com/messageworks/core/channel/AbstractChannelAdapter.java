package com.messageworks.core.channel;

import java.util.concurrent.CopyOnWriteArrayList;

import com.messageworks.core.message.Message;
import com.messageworks.core.message.MessageUtils;
import com.messageworks.core.runloop.Runloop;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * ChannelAdapter 的基础实现，负责监听器管理和入站投递。
 * <p>
 * 指定了 Runloop 时，入站消息被投递到该 Runloop 线程上再分发给监听器；否则在调用 {@link #deliver(Message)} 的线程上直接分发。
 * 单个监听器抛出的异常只记录日志，不影响其他监听器。
 */
@Slf4j
public abstract class AbstractChannelAdapter implements ChannelAdapter {

    @Getter
    protected final String name;
    @Getter
    protected final Runloop runloop;
    private final CopyOnWriteArrayList<MessageListener> listeners = new CopyOnWriteArrayList<>();
    protected volatile boolean closed = false;

    protected AbstractChannelAdapter(String name, Runloop runloop) {
        this.name = name;
        this.runloop = runloop;
    }

    @Override
    public void subscribe(MessageListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener must not be null");
        }
        if (closed) {
            throw new IllegalStateException("Channel " + name + " is closed");
        }
        listeners.addIfAbsent(listener);
        log.debug("Channel {}: 已订阅监听器，当前数量 {}", name, listeners.size());
    }

    @Override
    public void unsubscribe(MessageListener listener) {
        if (listener != null && listeners.remove(listener)) {
            log.debug("Channel {}: 已取消订阅监听器，当前数量 {}", name, listeners.size());
        }
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        listeners.clear();
        doClose();
        log.info("Channel {}: 已关闭", name);
    }

    /**
     * 子类释放自身资源。
     */
    protected void doClose() {
    }

    /**
     * 将入站消息交给监听器。
     */
    protected void deliver(Message message) {
        if (closed) {
            log.debug("Channel {}: 已关闭，丢弃入站消息 {}", name, MessageUtils.toDebugString(message));
            return;
        }
        if (runloop == null || runloop.isCurrentThread()) {
            dispatchToListeners(message);
            return;
        }
        if (!runloop.postTask(() -> dispatchToListeners(message))) {
            log.warn("Channel {}: Runloop {} 拒绝任务，丢弃入站消息 {}", name, runloop.getName(),
                    MessageUtils.toDebugString(message));
        }
    }

    private void dispatchToListeners(Message message) {
        if (closed) {
            return;
        }
        for (MessageListener listener : listeners) {
            try {
                listener.onMessage(message);
            } catch (RuntimeException e) {
                log.error("Channel {}: 监听器处理消息 {} 发生异常", name, MessageUtils.toDebugString(message), e);
            }
        }
    }
}
