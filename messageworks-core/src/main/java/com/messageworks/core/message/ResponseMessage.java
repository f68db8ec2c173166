package com.messageworks.core.message;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import lombok.experimental.Accessors;

/**
 * 响应消息。构造时即绑定到所回复的请求：requestId 取请求的 id，destination 取请求的 source。
 */
@Getter
@Setter
@Accessors(chain = true)
@EqualsAndHashCode(callSuper = true)
@ToString(callSuper = true)
public class ResponseMessage extends Message {

    @JsonProperty("request_id")
    private String requestId;

    public ResponseMessage() {
        this.type = MessageType.RESPONSE;
    }

    public ResponseMessage(String name, RequestMessage request) {
        this(name, request, null);
    }

    public ResponseMessage(String name, RequestMessage request, Object data) {
        super(MessageType.RESPONSE, name, requireRequest(request).getSource(), data);
        this.requestId = request.getId();
    }

    private static RequestMessage requireRequest(RequestMessage request) {
        if (request == null) {
            throw new IllegalArgumentException("request must not be null");
        }
        return request;
    }
}
