package com.deckflow.api.dto;

import lombok.Data;

/**
 * 服务健康状态。
 */
@Data
public class HealthDTO {

    private String status;
    private String collaboratorMode;
    private Integer activeConnections;
    private Integer liveSessions;
}
