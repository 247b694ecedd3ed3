package com.deckflow.domain.session.service;

import com.deckflow.domain.session.model.entity.ClarificationRoundEntity;
import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import com.deckflow.domain.session.model.valobj.ClarificationQuestion;
import com.deckflow.types.enums.QuestionKindEnum;
import com.deckflow.types.enums.SessionPhaseEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 澄清回答领域服务：校验并合并客户端回答，判定轮次是否完成。
 * <p>
 * 校验全部通过后才写入会话；重复提交相同回答不产生任何变化。
 * </p>
 */
@Service
public class ClarificationDomainService {

    public AnswerApplyResult applyAnswers(WorkflowSessionEntity session, Map<String, Object> answers) {
        if (answers == null || answers.isEmpty()) {
            return AnswerApplyResult.rejected("answers must not be empty");
        }
        ClarificationRoundEntity current = session.currentRound();
        boolean awaitingAnswers = session.getPhase() == SessionPhaseEnum.CLARIFYING
                && current != null
                && !current.isComplete();

        Map<String, Object> staged = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : answers.entrySet()) {
            String questionId = entry.getKey();
            ClarificationRoundEntity owner = session.findRoundOfQuestion(questionId);
            if (owner == null) {
                return AnswerApplyResult.rejected("unknown question_id " + questionId);
            }
            ClarificationQuestion question = owner.findQuestion(questionId);
            Object normalized;
            try {
                normalized = normalize(question, entry.getValue());
            } catch (IllegalArgumentException ex) {
                return AnswerApplyResult.rejected(ex.getMessage());
            }
            Object existing = owner.answerOf(questionId);
            if (owner.hasAnswer(questionId) && Objects.equals(existing, normalized)) {
                continue;
            }
            if (!awaitingAnswers || owner != current) {
                return AnswerApplyResult.rejected("question " + questionId + " belongs to closed round " + owner.getRoundNumber());
            }
            staged.put(questionId, normalized);
        }

        if (staged.isEmpty()) {
            return new AnswerApplyResult(Outcome.UNCHANGED, roundNumberOf(current), missingOf(current), null);
        }
        staged.forEach(current::putAnswer);
        Outcome outcome = current.isComplete() ? Outcome.ROUND_COMPLETED : Outcome.PARTIAL;
        return new AnswerApplyResult(outcome, current.getRoundNumber(), current.missingRequired(), null);
    }

    private Object normalize(ClarificationQuestion question, Object value) {
        String questionId = question.getQuestionId();
        if (value == null) {
            throw new IllegalArgumentException("answer for " + questionId + " must not be null");
        }
        QuestionKindEnum kind = question.getKind() == null ? QuestionKindEnum.TEXT : question.getKind();
        switch (kind) {
            case BOOLEAN:
                return normalizeBoolean(questionId, value);
            case SCALE:
                return normalizeNumber(questionId, value);
            case CHOICE:
                return matchOption(question, requireText(questionId, value));
            case MULTI_CHOICE:
                List<String> selected = new ArrayList<>();
                if (value instanceof List<?> list) {
                    for (Object item : list) {
                        selected.add(matchOption(question, requireText(questionId, item)));
                    }
                } else {
                    selected.add(matchOption(question, requireText(questionId, value)));
                }
                if (selected.isEmpty()) {
                    throw new IllegalArgumentException("answer for " + questionId + " must select at least one option");
                }
                return selected;
            default:
                return requireText(questionId, value);
        }
    }

    private String requireText(String questionId, Object value) {
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw new IllegalArgumentException("answer for " + questionId + " must be a scalar value");
        }
        String text = value == null ? null : StringUtils.trimToNull(String.valueOf(value));
        if (text == null) {
            throw new IllegalArgumentException("answer for " + questionId + " must not be blank");
        }
        return text;
    }

    private String matchOption(ClarificationQuestion question, String text) {
        List<String> options = question.getOptions();
        if (options == null || options.isEmpty()) {
            return text;
        }
        for (String option : options) {
            if (option.equalsIgnoreCase(text)) {
                return option;
            }
        }
        throw new IllegalArgumentException("answer for " + question.getQuestionId() + " must be one of " + options);
    }

    private Boolean normalizeBoolean(String questionId, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = requireText(questionId, value).toLowerCase();
        if ("true".equals(text) || "yes".equals(text)) {
            return Boolean.TRUE;
        }
        if ("false".equals(text) || "no".equals(text)) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException("answer for " + questionId + " must be a boolean");
    }

    private Number normalizeNumber(String questionId, Object value) {
        double number;
        if (value instanceof Number raw) {
            number = raw.doubleValue();
        } else {
            try {
                number = Double.parseDouble(requireText(questionId, value));
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("answer for " + questionId + " must be a number");
            }
        }
        if (number == Math.rint(number) && Math.abs(number) < Integer.MAX_VALUE) {
            return (int) number;
        }
        return number;
    }

    private int roundNumberOf(ClarificationRoundEntity round) {
        return round == null ? 0 : round.getRoundNumber();
    }

    private List<String> missingOf(ClarificationRoundEntity round) {
        return round == null ? Collections.emptyList() : round.missingRequired();
    }

    public enum Outcome {
        /** 本次提交使当前轮次完成 */
        ROUND_COMPLETED,
        /** 有新回答，但仍有必答问题未答 */
        PARTIAL,
        /** 全部为重复提交 */
        UNCHANGED,
        /** 校验失败，未做任何修改 */
        REJECTED
    }

    public record AnswerApplyResult(Outcome outcome,
                                    int roundNumber,
                                    List<String> missingQuestionIds,
                                    String violation) {

        static AnswerApplyResult rejected(String violation) {
            return new AnswerApplyResult(Outcome.REJECTED, 0, Collections.emptyList(), violation);
        }
    }
}
