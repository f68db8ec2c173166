package com.messageworks.core.service;

/**
 * MessagingService 生命周期状态：UNINITIALIZED -> READY -> TORN_DOWN。
 */
public enum MessagingServiceState {

    /**
     * 已构造，尚未解析地址和订阅上游
     */
    UNINITIALIZED,

    /**
     * 地址已解析，上游通道（如有）已订阅
     */
    READY,

    /**
     * 已清理，所有通道已取消订阅，待响应请求已拒绝
     */
    TORN_DOWN
}
