package com.messageworks.core.testutil;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import com.messageworks.core.channel.ChannelAdapter;
import com.messageworks.core.channel.MessageListener;
import com.messageworks.core.message.Message;

/**
 * 测试用通道：记录发送的消息，并可以模拟对端发来的入站消息。
 */
public class RecordingChannel implements ChannelAdapter {

    private final String name;
    private final List<Message> sent = new CopyOnWriteArrayList<>();
    private final List<MessageListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean failOnSend = false;
    private volatile boolean failOnSubscribe = false;

    public RecordingChannel(String name) {
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void send(Message message) {
        if (failOnSend) {
            throw new IllegalStateException("send failure on " + name);
        }
        sent.add(message.copy());
    }

    @Override
    public void subscribe(MessageListener listener) {
        if (failOnSubscribe) {
            throw new IllegalStateException("subscribe failure on " + name);
        }
        listeners.add(listener);
    }

    @Override
    public void unsubscribe(MessageListener listener) {
        listeners.remove(listener);
    }

    /**
     * 模拟对端发送一条消息：以独立副本同步交给所有监听器。
     */
    public void inject(Message message) {
        for (MessageListener listener : listeners) {
            listener.onMessage(message.copy());
        }
    }

    public List<Message> getSent() {
        return Collections.unmodifiableList(new ArrayList<>(sent));
    }

    public Message lastSent() {
        if (sent.isEmpty()) {
            throw new AssertionError("nothing was sent on " + name);
        }
        return sent.get(sent.size() - 1);
    }

    public int getSentCount() {
        return sent.size();
    }

    public int getListenerCount() {
        return listeners.size();
    }

    public void clear() {
        sent.clear();
    }

    public RecordingChannel failOnSend(boolean fail) {
        this.failOnSend = fail;
        return this;
    }

    public RecordingChannel failOnSubscribe(boolean fail) {
        this.failOnSubscribe = fail;
        return this;
    }

    @Override
    public String toString() {
        return "RecordingChannel[" + name + "]";
    }
}
