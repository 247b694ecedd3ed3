package com.deckflow.test.domain;

import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import com.deckflow.domain.session.model.valobj.ClarificationQuestion;
import com.deckflow.domain.session.model.valobj.PendingRequest;
import com.deckflow.types.enums.CallOutcomeEnum;
import com.deckflow.types.enums.ErrorCodeEnum;
import com.deckflow.types.enums.QuestionKindEnum;
import com.deckflow.types.enums.SessionPhaseEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

public class WorkflowSessionEntityTest {

    @Test
    public void shouldWalkHappyPathPhases() {
        WorkflowSessionEntity session = analyzingSession();
        session.enterGenerating(false, null);
        session.enterDelivering(Map.of("presentation", Map.of("slides", List.of(1))));
        session.complete();

        Assertions.assertEquals(SessionPhaseEnum.COMPLETED, session.getPhase());
        Assertions.assertTrue(session.isTerminal());
    }

    @Test
    public void shouldRejectIllegalTransitions() {
        WorkflowSessionEntity session = WorkflowSessionEntity.create("sess_1", "alice", Instant.now());

        Assertions.assertThrows(IllegalStateException.class, () -> session.enterGenerating(false, null));
        Assertions.assertThrows(IllegalStateException.class, session::complete);

        session.fail(ErrorCodeEnum.CANCELLED, null);
        Assertions.assertThrows(IllegalStateException.class, () -> session.fail(ErrorCodeEnum.INTERNAL_ERROR, null));
    }

    @Test
    public void shouldReturnToRetriedPhaseAfterRecovery() {
        WorkflowSessionEntity session = analyzingSession();

        session.enterErrorRecovery(3);
        Assertions.assertEquals(SessionPhaseEnum.ERROR_RECOVERY, session.getPhase());
        Assertions.assertEquals(1, session.getRetryCount());

        Assertions.assertEquals(SessionPhaseEnum.ANALYZING, session.returnToRetriedPhase());
        session.enterErrorRecovery(3);
        session.returnToRetriedPhase();
        session.enterErrorRecovery(3);
        session.returnToRetriedPhase();

        Assertions.assertThrows(IllegalStateException.class, () -> session.enterErrorRecovery(3));
    }

    @Test
    public void shouldResetRetryCountWhenPhaseAdvances() {
        WorkflowSessionEntity session = analyzingSession();
        session.enterErrorRecovery(3);
        session.returnToRetriedPhase();

        session.enterGenerating(false, null);

        Assertions.assertEquals(0, session.getRetryCount());
    }

    @Test
    public void shouldAllowOnlyOneCallInFlightAndIgnoreStaleResolution() {
        WorkflowSessionEntity session = analyzingSession();
        session.startCall("call-1", Instant.now(), Duration.ofSeconds(30));

        Assertions.assertThrows(IllegalStateException.class,
                () -> session.startCall("call-2", Instant.now(), Duration.ofSeconds(30)));
        Assertions.assertFalse(session.resolveCall("call-0", CallOutcomeEnum.SUCCESS));
        Assertions.assertTrue(session.isCallInFlight());

        Assertions.assertTrue(session.resolveCall("call-1", CallOutcomeEnum.SUCCESS));
        Assertions.assertFalse(session.isCallInFlight());
        Assertions.assertFalse(session.resolveCall("call-1", CallOutcomeEnum.SUCCESS));
    }

    @Test
    public void shouldStopOpeningRoundsAtLimit() {
        WorkflowSessionEntity session = analyzingSession();
        List<ClarificationQuestion> questions = List.of(ClarificationQuestion.builder()
                .questionId("q").prompt("?").kind(QuestionKindEnum.TEXT).build());

        session.openClarificationRound(questions, 1, Instant.now());

        Assertions.assertEquals(1, session.getClarificationRoundCount());
        Assertions.assertThrows(IllegalStateException.class,
                () -> session.openClarificationRound(questions, 1, Instant.now()));
    }

    @Test
    public void shouldMarkDegradedWhenGeneratingWithDefaults() {
        WorkflowSessionEntity session = analyzingSession();

        session.enterGenerating(true, "MAX_CLARIFICATION_ROUNDS_REACHED");

        Assertions.assertTrue(session.isDegraded());
        Assertions.assertEquals("MAX_CLARIFICATION_ROUNDS_REACHED", session.getDegradedReason());
    }

    private WorkflowSessionEntity analyzingSession() {
        WorkflowSessionEntity session = WorkflowSessionEntity.create("sess_1", "alice", Instant.now());
        session.beginAnalysis("deck", new PendingRequest("m1", "deck", null, Instant.now()));
        return session;
    }
}
