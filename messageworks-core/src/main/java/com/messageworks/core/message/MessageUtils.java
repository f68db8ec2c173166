package com.messageworks.core.message;

/**
 * 消息相关的辅助方法。
 */
public final class MessageUtils {

    private MessageUtils() {
        // 私有构造函数，防止实例化
    }

    public static boolean isRequest(Message message) {
        return message != null && message.getType() == MessageType.REQUEST;
    }

    public static boolean isResponse(Message message) {
        return message != null && message.getType() == MessageType.RESPONSE;
    }

    /**
     * 是否为网络接入握手消息。
     */
    public static boolean isAttachMessage(Message message) {
        return message != null
                && message.getType() == MessageType.GENERAL
                && MessageConstants.ATTACH_MESSAGE_NAME.equals(message.getName());
    }

    /**
     * 构造网络接入握手消息，data 为子上下文名称。
     */
    public static GeneralMessage attachMessage(String childName) {
        return new GeneralMessage(MessageConstants.ATTACH_MESSAGE_NAME, Address.root(), childName);
    }

    /**
     * 日志用的简短描述，不包含 data。
     */
    public static String toDebugString(Message message) {
        if (message == null) {
            return "null";
        }
        StringBuilder sb = new StringBuilder()
                .append(message.getType()).append('[')
                .append("id=").append(message.getId())
                .append(", name=").append(message.getName())
                .append(", ").append(message.getSource()).append(" -> ").append(message.getDestination());
        if (message.isBroadcast()) {
            sb.append(", broadcast");
        }
        if (message instanceof ResponseMessage) {
            sb.append(", requestId=").append(((ResponseMessage) message).getRequestId());
        }
        return sb.append(']').toString();
    }
}
