package com.messageworks.core.id;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 前缀加递增序号的 id 生成器，结果可预测，适合测试和单进程调试。
 * 不同上下文应使用不同前缀以保证唯一。
 */
public class SequentialIdGenerator implements IdGenerator {

    private final String prefix;
    private final AtomicLong counter = new AtomicLong();

    public SequentialIdGenerator(String prefix) {
        this.prefix = prefix == null ? "" : prefix;
    }

    @Override
    public String nextId() {
        return prefix + counter.incrementAndGet();
    }
}
