package com.deckflow.domain.session.model.entity;

import com.deckflow.types.enums.CallOutcomeEnum;
import com.deckflow.types.enums.SessionPhaseEnum;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;

/**
 * 协作方调用实体：调用前创建，结果记录到会话后销毁。
 */
@Data
public class CollaboratorCallEntity {

    private String callId;

    /**
     * 发起调用时会话所处阶段
     */
    private SessionPhaseEnum phase;

    private int attemptNumber;

    private Instant startedAt;

    private Instant timeoutAt;

    private CallOutcomeEnum outcome;

    public static CollaboratorCallEntity start(String callId,
                                              SessionPhaseEnum phase,
                                              int attemptNumber,
                                              Instant startedAt,
                                              Duration timeout) {
        if (callId == null || callId.isBlank()) {
            throw new IllegalStateException("Call id cannot be empty");
        }
        CollaboratorCallEntity call = new CollaboratorCallEntity();
        call.setCallId(callId);
        call.setPhase(phase);
        call.setAttemptNumber(Math.max(attemptNumber, 1));
        call.setStartedAt(startedAt);
        call.setTimeoutAt(timeout == null ? null : startedAt.plus(timeout));
        call.setOutcome(CallOutcomeEnum.PENDING);
        return call;
    }

    public boolean isPending() {
        return outcome == CallOutcomeEnum.PENDING;
    }

    public void resolve(CallOutcomeEnum resolvedOutcome) {
        if (resolvedOutcome == null || !resolvedOutcome.isResolved()) {
            throw new IllegalStateException("Call outcome must be resolved");
        }
        if (!isPending()) {
            throw new IllegalStateException("Call " + callId + " already resolved as " + outcome.getCode());
        }
        this.outcome = resolvedOutcome;
    }
}
