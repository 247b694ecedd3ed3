package com.deckflow.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.util.List;

/**
 * 单个澄清问题。
 */
@Data
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class QuestionItemDTO {

    @JsonProperty("question_id")
    private String questionId;

    private String prompt;

    /** text | choice | multi_choice | scale | boolean */
    private String kind;

    private List<String> options;

    @JsonInclude(JsonInclude.Include.ALWAYS)
    private boolean required;
}
