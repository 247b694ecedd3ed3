package com.deckflow.domain.workflow.service;

import com.deckflow.domain.collaborator.exception.CollaboratorException;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorResult;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorRole;
import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import com.deckflow.domain.session.model.valobj.ClarificationQuestion;
import com.deckflow.domain.workflow.model.valobj.AnalysisOutcome;
import com.deckflow.domain.workflow.model.valobj.WorkflowPolicy;
import com.deckflow.types.enums.QuestionKindEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 工作流迁移领域服务：解读协作方结果并决定下一阶段。
 * <p>
 * 协作方结果不满足约定时抛出 CONTRACT_VIOLATION，属于致命失败。
 * </p>
 */
@Service
public class WorkflowTransitionDomainService {

    public static final String DEGRADED_REASON_ROUNDS_EXHAUSTED = "MAX_CLARIFICATION_ROUNDS_REACHED";

    /**
     * 解析分析协作方结果。
     */
    public AnalysisOutcome readAnalysis(WorkflowSessionEntity session,
                                        CollaboratorResult result,
                                        WorkflowPolicy policy) {
        Map<String, Object> payload = result == null ? null : result.getPayload();
        if (payload == null) {
            throw CollaboratorException.contractViolation("Analysis result is empty");
        }
        Object rawScore = payload.get("completeness_score");
        if (!(rawScore instanceof Number number)) {
            throw CollaboratorException.contractViolation("Analysis result misses numeric completeness_score");
        }
        double score = number.doubleValue();
        if (Double.isNaN(score) || score < 0D || score > 1D) {
            throw CollaboratorException.contractViolation("completeness_score out of range: " + score);
        }
        List<ClarificationQuestion> questions = readQuestions(session, payload.get("questions"), policy);
        Map<String, Object> details = new LinkedHashMap<>();
        if (payload.get("analysis") instanceof Map<?, ?> analysis) {
            analysis.forEach((key, value) -> details.put(String.valueOf(key), value));
        }
        return new AnalysisOutcome(score, questions, details);
    }

    public AnalysisDecision decideAfterAnalysis(WorkflowSessionEntity session,
                                                AnalysisOutcome outcome,
                                                WorkflowPolicy policy) {
        if (outcome.isSufficient(policy.getCompletenessThreshold())) {
            return AnalysisDecision.PROCEED;
        }
        if (outcome.getQuestions() == null || outcome.getQuestions().isEmpty()) {
            throw CollaboratorException.contractViolation(
                    "Analysis reported insufficient completeness without candidate questions");
        }
        if (session.getClarificationRoundCount() < policy.getMaxClarificationRounds()) {
            return AnalysisDecision.CLARIFY;
        }
        return AnalysisDecision.PROCEED_DEGRADED;
    }

    /**
     * 合并各生成角色结果为交付制品。
     */
    public Map<String, Object> assembleArtifact(Map<String, CollaboratorResult> resultsByRole, List<String> roles) {
        Map<String, Object> artifact = new LinkedHashMap<>();
        for (String role : roles) {
            CollaboratorResult result = resultsByRole == null ? null : resultsByRole.get(role);
            if (result == null || result.getPayload() == null) {
                throw CollaboratorException.contractViolation("Generation role " + role + " returned no result");
            }
            Map<String, Object> payload = result.getPayload();
            if (CollaboratorRole.STRUCTURE.equals(role)) {
                Object slides = payload.get("slides");
                if (!(slides instanceof List<?> list) || list.isEmpty()) {
                    throw CollaboratorException.contractViolation("Structure result must contain a non-empty slides list");
                }
                artifact.put("presentation", payload);
            } else {
                artifact.put(role, payload);
            }
        }
        return artifact;
    }

    private List<ClarificationQuestion> readQuestions(WorkflowSessionEntity session,
                                                      Object rawQuestions,
                                                      WorkflowPolicy policy) {
        List<ClarificationQuestion> questions = new ArrayList<>();
        if (rawQuestions == null) {
            return questions;
        }
        if (!(rawQuestions instanceof List<?> items)) {
            throw CollaboratorException.contractViolation("questions must be a list");
        }
        int nextRound = session.getClarificationRoundCount() + 1;
        Set<String> seen = new HashSet<>();
        for (Object item : items) {
            if (questions.size() >= Math.max(policy.getMaxQuestionsPerRound(), 1)) {
                break;
            }
            if (!(item instanceof Map<?, ?> map)) {
                throw CollaboratorException.contractViolation("question entry must be an object");
            }
            String prompt = firstText(map, "prompt", "question");
            if (prompt == null) {
                throw CollaboratorException.contractViolation("question entry misses prompt");
            }
            String questionId = firstText(map, "question_id", "id");
            if (questionId == null) {
                questionId = "r" + nextRound + "_q" + (questions.size() + 1);
            }
            if (session.findRoundOfQuestion(questionId) != null) {
                questionId = "r" + nextRound + "_" + questionId;
            }
            if (!seen.add(questionId)) {
                throw CollaboratorException.contractViolation("duplicate question_id " + questionId);
            }
            questions.add(ClarificationQuestion.builder()
                    .questionId(questionId)
                    .prompt(prompt)
                    .kind(QuestionKindEnum.fromCodeOrText(firstText(map, "kind", "question_type")))
                    .options(readOptions(map.get("options")))
                    .required(!Boolean.FALSE.equals(map.get("required")))
                    .build());
        }
        return questions;
    }

    private List<String> readOptions(Object rawOptions) {
        List<String> options = new ArrayList<>();
        if (rawOptions instanceof List<?> list) {
            for (Object option : list) {
                if (option != null && StringUtils.isNotBlank(String.valueOf(option))) {
                    options.add(String.valueOf(option).trim());
                }
            }
        }
        return options;
    }

    private String firstText(Map<?, ?> map, String... keys) {
        for (String key : keys) {
            Object value = map.get(key);
            if (value != null && StringUtils.isNotBlank(String.valueOf(value))) {
                return String.valueOf(value).trim();
            }
        }
        return null;
    }

    public enum AnalysisDecision {
        /** 信息充分，直接生成 */
        PROCEED,
        /** 发出新一轮澄清 */
        CLARIFY,
        /** 轮次已用尽，按最佳默认值降级生成 */
        PROCEED_DEGRADED
    }
}
