package com.messageworks.core.id;

/**
 * 消息 id 生成器。生成的值只用于相等比较，要求在整个路由树内唯一。
 */
@FunctionalInterface
public interface IdGenerator {

    String nextId();
}
