package com.deckflow.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * progress 信封负载。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProgressPayloadDTO {

    private String phase;

    @JsonProperty("percent_complete")
    private Integer percentComplete;

    /** 仅 error_recovery 阶段携带 */
    @JsonProperty("retry_count")
    private Integer retryCount;

    private Boolean degraded;

    /** 断线重连后的状态快照 */
    private Boolean resumed;

    private String message;
}
