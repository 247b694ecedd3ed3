package com.deckflow.trigger.application.query;

import com.deckflow.api.dto.ClarificationRoundDTO;
import com.deckflow.api.dto.SessionDetailDTO;
import com.deckflow.domain.session.adapter.repository.IWorkflowSessionRepository;
import com.deckflow.domain.session.model.entity.ClarificationRoundEntity;
import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import com.deckflow.trigger.application.common.EnvelopeFactory;
import com.deckflow.types.enums.ResponseCode;
import com.deckflow.types.exception.AppException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.concurrent.locks.Lock;

/**
 * 会话读用例：在会话写锁内生成一致的状态快照。
 */
@Service
public class SessionQueryService {

    private final IWorkflowSessionRepository sessionRepository;
    private final EnvelopeFactory envelopeFactory;

    public SessionQueryService(IWorkflowSessionRepository sessionRepository,
                               EnvelopeFactory envelopeFactory) {
        this.sessionRepository = sessionRepository;
        this.envelopeFactory = envelopeFactory;
    }

    /**
     * 查询会话详情；会话不存在或不属于该用户时均按不存在处理。
     */
    public SessionDetailDTO getSessionDetail(String sessionId, String userId) {
        if (sessionId == null || !sessionRepository.exists(sessionId)) {
            throw new AppException(ResponseCode.NOT_FOUND.getCode(), "会话不存在: " + sessionId);
        }
        Lock lock = sessionRepository.writeLock(sessionId);
        lock.lock();
        try {
            WorkflowSessionEntity session = sessionRepository.findById(sessionId);
            if (session == null || !session.isOwnedBy(userId)) {
                throw new AppException(ResponseCode.NOT_FOUND.getCode(), "会话不存在: " + sessionId);
            }
            return toDetail(session);
        } finally {
            lock.unlock();
            sessionRepository.releaseLock(sessionId);
        }
    }

    public int liveSessions() {
        return sessionRepository.count();
    }

    private SessionDetailDTO toDetail(WorkflowSessionEntity session) {
        SessionDetailDTO dto = new SessionDetailDTO();
        dto.setSessionId(session.getId());
        dto.setUserId(session.getUserId());
        dto.setPhase(session.getPhase().getCode());
        dto.setClarificationRoundCount(session.getClarificationRoundCount());
        dto.setRetryCount(session.getRetryCount());
        dto.setDegraded(session.isDegraded());
        dto.setDegradedReason(session.getDegradedReason());
        dto.setSuspended(session.isSuspended());
        dto.setCallInFlight(session.isCallInFlight());
        dto.setFailureCode(session.getFailureCode() == null ? null : session.getFailureCode().getCode());
        dto.setCreatedAt(session.getCreatedAt());
        dto.setLastActivityAt(session.getLastActivityAt());
        List<ClarificationRoundDTO> rounds = new ArrayList<>();
        for (ClarificationRoundEntity round : session.getRounds()) {
            ClarificationRoundDTO roundDTO = new ClarificationRoundDTO();
            roundDTO.setRoundNumber(round.getRoundNumber());
            roundDTO.setQuestions(envelopeFactory.toQuestionItems(round.getQuestions()));
            roundDTO.setAnswers(new LinkedHashMap<>(round.getAnswers()));
            roundDTO.setComplete(round.isComplete());
            rounds.add(roundDTO);
        }
        dto.setRounds(rounds);
        return dto;
    }
}
