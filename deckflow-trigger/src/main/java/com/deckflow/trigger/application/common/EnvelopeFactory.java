package com.deckflow.trigger.application.common;

import com.deckflow.api.dto.ControlPayloadDTO;
import com.deckflow.api.dto.EnvelopeDTO;
import com.deckflow.api.dto.ErrorPayloadDTO;
import com.deckflow.api.dto.ProgressPayloadDTO;
import com.deckflow.api.dto.QuestionItemDTO;
import com.deckflow.api.dto.QuestionPayloadDTO;
import com.deckflow.api.dto.ResultPayloadDTO;
import com.deckflow.domain.session.model.entity.ClarificationRoundEntity;
import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import com.deckflow.domain.session.model.valobj.ClarificationQuestion;
import com.deckflow.types.common.Constants;
import com.deckflow.types.enums.ControlActionEnum;
import com.deckflow.types.enums.EnvelopeTypeEnum;
import com.deckflow.types.enums.ErrorCodeEnum;
import com.deckflow.types.enums.QuestionKindEnum;
import com.deckflow.types.enums.SessionPhaseEnum;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * 出站信封组装器。
 */
@Component
public class EnvelopeFactory {

    public EnvelopeDTO control(String sessionId, ControlActionEnum action) {
        return envelope(sessionId, EnvelopeTypeEnum.CONTROL, ControlPayloadDTO.of(action.getCode()));
    }

    public EnvelopeDTO question(String sessionId, ClarificationRoundEntity round) {
        QuestionPayloadDTO payload = new QuestionPayloadDTO();
        payload.setRoundNumber(round.getRoundNumber());
        payload.setQuestions(toQuestionItems(round.getQuestions()));
        return envelope(sessionId, EnvelopeTypeEnum.QUESTION, payload);
    }

    public EnvelopeDTO progress(WorkflowSessionEntity session, boolean resumed, String message) {
        SessionPhaseEnum phase = session.getPhase();
        ProgressPayloadDTO payload = new ProgressPayloadDTO();
        payload.setPhase(phase.getCode());
        payload.setPercentComplete(resolvePercent(session));
        if (phase == SessionPhaseEnum.ERROR_RECOVERY) {
            payload.setRetryCount(session.getRetryCount());
        }
        if (session.isDegraded()) {
            payload.setDegraded(Boolean.TRUE);
        }
        if (resumed) {
            payload.setResumed(Boolean.TRUE);
        }
        payload.setMessage(StringUtils.trimToNull(message));
        return envelope(session.getId(), EnvelopeTypeEnum.PROGRESS, payload);
    }

    public EnvelopeDTO result(WorkflowSessionEntity session) {
        ResultPayloadDTO payload = new ResultPayloadDTO();
        payload.setArtifact(session.getArtifact());
        payload.setDegraded(session.isDegraded());
        payload.setDegradedReason(session.getDegradedReason());
        return envelope(session.getId(), EnvelopeTypeEnum.RESULT, payload);
    }

    public EnvelopeDTO error(String sessionId, ErrorCodeEnum code, String message) {
        ErrorPayloadDTO payload = new ErrorPayloadDTO(
                code.getCode(),
                StringUtils.defaultIfBlank(message, code.getDefaultMessage()),
                code.isRecoverable());
        return envelope(sessionId, EnvelopeTypeEnum.ERROR, payload);
    }

    public List<QuestionItemDTO> toQuestionItems(List<ClarificationQuestion> questions) {
        List<QuestionItemDTO> items = new ArrayList<>();
        if (questions == null) {
            return items;
        }
        for (ClarificationQuestion question : questions) {
            QuestionItemDTO item = new QuestionItemDTO();
            item.setQuestionId(question.getQuestionId());
            item.setPrompt(question.getPrompt());
            item.setKind((question.getKind() == null ? QuestionKindEnum.TEXT : question.getKind()).getCode());
            item.setOptions(question.getOptions());
            item.setRequired(question.isRequired());
            items.add(item);
        }
        return items;
    }

    private int resolvePercent(WorkflowSessionEntity session) {
        SessionPhaseEnum phase = session.getPhase();
        if (phase.getPercentComplete() >= 0) {
            return phase.getPercentComplete();
        }
        if (phase == SessionPhaseEnum.ERROR_RECOVERY && session.getRecoveryPhase() != null) {
            return session.getRecoveryPhase().getPercentComplete();
        }
        return 0;
    }

    private EnvelopeDTO envelope(String sessionId, EnvelopeTypeEnum type, Object payload) {
        return EnvelopeDTO.builder()
                .messageId(Constants.MESSAGE_ID_PREFIX + UUID.randomUUID().toString().replace("-", ""))
                .timestamp(Instant.now().toString())
                .sessionId(sessionId)
                .type(type.getCode())
                .payload(payload)
                .build();
    }
}
