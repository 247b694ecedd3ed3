package com.deckflow.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * question 信封负载：一轮澄清问题。
 */
@Data
public class QuestionPayloadDTO {

    @JsonProperty("round_number")
    private int roundNumber;

    private List<QuestionItemDTO> questions;
}
