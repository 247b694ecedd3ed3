package com.deckflow.test.domain;

import com.deckflow.domain.collaborator.exception.CollaboratorException;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorFailureKind;
import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import com.deckflow.domain.workflow.model.valobj.WorkflowPolicy;
import com.deckflow.domain.workflow.service.FailureRecoveryDomainService;
import com.deckflow.types.enums.ErrorCodeEnum;
import com.deckflow.types.enums.FailureClassEnum;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

public class FailureRecoveryDomainServiceTest {

    private final FailureRecoveryDomainService service = new FailureRecoveryDomainService();

    private final WorkflowPolicy policy = WorkflowPolicy.builder()
            .maxRetries(3)
            .backoffBase(Duration.ofMillis(500))
            .backoffMax(Duration.ofMillis(8000))
            .build();

    @Test
    public void shouldClassifyCollaboratorTimeoutAsRecoverable() {
        CollaboratorException timeout = CollaboratorException.timeout("analysis", Duration.ofSeconds(30));

        Assertions.assertEquals(FailureClassEnum.RECOVERABLE, service.classify(timeout));
        Assertions.assertEquals(FailureClassEnum.RECOVERABLE, service.classify(new CompletionException(timeout)));
    }

    @Test
    public void shouldUnwrapFutureWrappersBeforeClassifying() {
        Throwable wrapped = new ExecutionException(new CompletionException(new TimeoutException("slow")));

        Assertions.assertEquals(FailureClassEnum.RECOVERABLE, service.classify(wrapped));
        Assertions.assertTrue(service.unwrap(wrapped) instanceof TimeoutException);
    }

    @Test
    public void shouldTreatTransportFailuresAsRecoverable() {
        Assertions.assertEquals(FailureClassEnum.RECOVERABLE, service.classify(new RejectedExecutionException("full")));
        Assertions.assertEquals(FailureClassEnum.RECOVERABLE, service.classify(new IOException("reset")));
        Assertions.assertEquals(FailureClassEnum.RECOVERABLE,
                service.classify(new ResourceAccessException("I/O error", new SocketTimeoutException("read timed out"))));
    }

    @Test
    public void shouldTreatContractViolationAndUnknownErrorsAsFatal() {
        Assertions.assertEquals(FailureClassEnum.FATAL,
                service.classify(CollaboratorException.contractViolation("missing score")));
        Assertions.assertEquals(FailureClassEnum.FATAL,
                service.classify(new CollaboratorException(CollaboratorFailureKind.REJECTED_INPUT, "refused")));
        Assertions.assertEquals(FailureClassEnum.FATAL, service.classify(new NullPointerException("boom")));
        Assertions.assertEquals(FailureClassEnum.FATAL, service.classify(null));
    }

    @Test
    public void shouldRetryUntilBudgetExhausted() {
        WorkflowSessionEntity session = WorkflowSessionEntity.create("sess_1", "alice", Instant.now());

        session.setRetryCount(2);
        Assertions.assertEquals(FailureRecoveryDomainService.RecoveryDecision.RETRY,
                service.decide(session, FailureClassEnum.RECOVERABLE, policy));

        session.setRetryCount(3);
        Assertions.assertEquals(FailureRecoveryDomainService.RecoveryDecision.FAIL_RETRIES_EXHAUSTED,
                service.decide(session, FailureClassEnum.RECOVERABLE, policy));

        session.setRetryCount(0);
        Assertions.assertEquals(FailureRecoveryDomainService.RecoveryDecision.FAIL_FATAL,
                service.decide(session, FailureClassEnum.FATAL, policy));
    }

    @Test
    public void shouldGrowBackoffExponentiallyAndCapAtMax() {
        Assertions.assertEquals(500L, service.backoffDelay(1, policy).toMillis());
        Assertions.assertEquals(1000L, service.backoffDelay(2, policy).toMillis());
        Assertions.assertEquals(2000L, service.backoffDelay(3, policy).toMillis());
        Assertions.assertEquals(8000L, service.backoffDelay(6, policy).toMillis());
        Assertions.assertEquals(8000L, service.backoffDelay(60, policy).toMillis());
    }

    @Test
    public void shouldMapTerminalCodes() {
        Assertions.assertEquals(ErrorCodeEnum.RETRIES_EXHAUSTED, service.terminalCode(
                new TimeoutException(), FailureRecoveryDomainService.RecoveryDecision.FAIL_RETRIES_EXHAUSTED));
        Assertions.assertEquals(ErrorCodeEnum.CONTRACT_VIOLATION, service.terminalCode(
                new CompletionException(CollaboratorException.contractViolation("bad")),
                FailureRecoveryDomainService.RecoveryDecision.FAIL_FATAL));
        Assertions.assertEquals(ErrorCodeEnum.INPUT_REJECTED, service.terminalCode(
                new CollaboratorException(CollaboratorFailureKind.REJECTED_INPUT, "refused"),
                FailureRecoveryDomainService.RecoveryDecision.FAIL_FATAL));
        Assertions.assertEquals(ErrorCodeEnum.INTERNAL_ERROR, service.terminalCode(
                new IllegalStateException("bug"), FailureRecoveryDomainService.RecoveryDecision.FAIL_FATAL));
    }
}
