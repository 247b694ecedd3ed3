package com.deckflow.api.dto;

import lombok.Data;

import java.util.List;
import java.util.Map;

/**
 * 澄清轮次快照。
 */
@Data
public class ClarificationRoundDTO {

    private Integer roundNumber;
    private List<QuestionItemDTO> questions;
    private Map<String, Object> answers;
    private Boolean complete;
}
