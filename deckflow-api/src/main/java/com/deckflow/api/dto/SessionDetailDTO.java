package com.deckflow.api.dto;

import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * 会话详情（REST 查询）。
 */
@Data
public class SessionDetailDTO {

    private String sessionId;
    private String userId;
    private String phase;
    private Integer clarificationRoundCount;
    private Integer retryCount;
    private Boolean degraded;
    private String degradedReason;
    private Boolean suspended;
    private Boolean callInFlight;
    private String failureCode;
    private Instant createdAt;
    private Instant lastActivityAt;
    private List<ClarificationRoundDTO> rounds;
}
