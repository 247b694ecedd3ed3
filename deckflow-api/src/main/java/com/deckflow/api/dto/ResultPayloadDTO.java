package com.deckflow.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.Map;

/**
 * result 信封负载：生成协作方产出的演示文稿制品。
 */
@Data
public class ResultPayloadDTO {

    private Map<String, Object> artifact;

    private boolean degraded;

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonProperty("degraded_reason")
    private String degradedReason;
}
