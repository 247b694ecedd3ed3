package com.deckflow.domain.session.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * 最近一次通过校验、等待处理的入站负载。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PendingRequest {

    private String messageId;
    private String text;
    private Map<String, Object> answers;
    private Instant receivedAt;
}
