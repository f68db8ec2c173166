package com.messageworks.core.message;

public final class MessageConstants {

    // MsgPack 扩展类型，用于 Message 的序列化
    public static final byte MESSAGE_EXT_TYPE = 0x4D;

    // ==================== 传输 ================
    /**
     * 子上下文通过网络接入父上下文时发送的第一条消息名称，data 为子上下文名称
     */
    public static final String ATTACH_MESSAGE_NAME = "__messageworks_attach__";

    // ==================== 配置 ================
    public static final String DEFAULT_CONFIG_RESOURCE = "messageworks.json";

    private MessageConstants() {
        // 私有构造函数，防止实例化
    }
}
