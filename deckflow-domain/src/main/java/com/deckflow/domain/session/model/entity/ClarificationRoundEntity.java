package com.deckflow.domain.session.model.entity;

import com.deckflow.domain.session.model.valobj.ClarificationQuestion;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 澄清轮次实体
 *
 * @author deckflow
 * @since 2026-10-19
 */
@Data
public class ClarificationRoundEntity {

    /**
     * 轮次编号，从 1 开始
     */
    private int roundNumber;

    /**
     * 有序问题列表
     */
    private List<ClarificationQuestion> questions = new ArrayList<>();

    /**
     * 问题 ID -> 回答，增量填充
     */
    private Map<String, Object> answers = new LinkedHashMap<>();

    /**
     * 发出时间
     */
    private Instant openedAt;

    public static ClarificationRoundEntity open(int roundNumber, List<ClarificationQuestion> questions, Instant openedAt) {
        if (roundNumber <= 0) {
            throw new IllegalStateException("Round number must be positive");
        }
        if (questions == null || questions.isEmpty()) {
            throw new IllegalStateException("Clarification round requires at least one question");
        }
        ClarificationRoundEntity round = new ClarificationRoundEntity();
        round.setRoundNumber(roundNumber);
        round.setQuestions(new ArrayList<>(questions));
        round.setOpenedAt(openedAt);
        return round;
    }

    public ClarificationQuestion findQuestion(String questionId) {
        if (questionId == null) {
            return null;
        }
        for (ClarificationQuestion question : questions) {
            if (questionId.equals(question.getQuestionId())) {
                return question;
            }
        }
        return null;
    }

    public boolean hasAnswer(String questionId) {
        return answers.containsKey(questionId);
    }

    public Object answerOf(String questionId) {
        return answers.get(questionId);
    }

    public void putAnswer(String questionId, Object answer) {
        if (findQuestion(questionId) == null) {
            throw new IllegalStateException("Question " + questionId + " is not part of round " + roundNumber);
        }
        answers.put(questionId, answer);
    }

    /**
     * 未回答的必答问题 ID。
     */
    public List<String> missingRequired() {
        List<String> missing = new ArrayList<>();
        for (ClarificationQuestion question : questions) {
            if (question.isRequired() && !answers.containsKey(question.getQuestionId())) {
                missing.add(question.getQuestionId());
            }
        }
        return missing;
    }

    /**
     * 所有必答问题都已回答才算完成；全部为选答时至少需要一个回答。
     */
    public boolean isComplete() {
        if (!missingRequired().isEmpty()) {
            return false;
        }
        boolean anyRequired = questions.stream().anyMatch(ClarificationQuestion::isRequired);
        return anyRequired || !answers.isEmpty();
    }
}
