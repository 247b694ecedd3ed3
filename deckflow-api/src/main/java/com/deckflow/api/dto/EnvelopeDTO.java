package com.deckflow.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * WebSocket 通道上的消息信封。
 * <p>
 * 出站信封的 payload 为各类型对应的 *PayloadDTO；入站信封由路由层按 JSON 树逐字段校验，
 * 不直接反序列化为本类。
 * </p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EnvelopeDTO {

    @JsonProperty("message_id")
    private String messageId;

    /** ISO-8601 时间戳 */
    private String timestamp;

    @JsonProperty("session_id")
    private String sessionId;

    private String type;

    private Object payload;
}
