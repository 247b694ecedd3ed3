package com.deckflow.domain.session.model.valobj;

import com.deckflow.types.enums.QuestionKindEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * 澄清问题值对象。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ClarificationQuestion {

    private String questionId;
    private String prompt;
    private QuestionKindEnum kind;
    private List<String> options;

    @Builder.Default
    private boolean required = true;
}
