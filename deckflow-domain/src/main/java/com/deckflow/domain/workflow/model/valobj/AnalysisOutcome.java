package com.deckflow.domain.workflow.model.valobj;

import com.deckflow.domain.session.model.valobj.ClarificationQuestion;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 需求分析结果值对象。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisOutcome {

    private double completenessScore;
    private List<ClarificationQuestion> questions;
    private Map<String, Object> details;

    public boolean isSufficient(double threshold) {
        return completenessScore >= threshold;
    }
}
