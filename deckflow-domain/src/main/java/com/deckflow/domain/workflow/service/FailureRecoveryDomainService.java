package com.deckflow.domain.workflow.service;

import com.deckflow.domain.collaborator.exception.CollaboratorException;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorFailureKind;
import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import com.deckflow.domain.workflow.model.valobj.WorkflowPolicy;
import com.deckflow.types.enums.ErrorCodeEnum;
import com.deckflow.types.enums.FailureClassEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * 失败分类与重试决策领域服务。
 * <p>
 * 未识别的异常一律判为致命。
 * </p>
 */
@Slf4j
@Service
public class FailureRecoveryDomainService {

    private static final int MAX_CAUSE_DEPTH = 8;

    public FailureClassEnum classify(Throwable error) {
        Throwable root = unwrap(error);
        if (root == null) {
            return FailureClassEnum.FATAL;
        }
        if (root instanceof CollaboratorException collaboratorException) {
            return collaboratorException.isRecoverable() ? FailureClassEnum.RECOVERABLE : FailureClassEnum.FATAL;
        }
        if (root instanceof TimeoutException || root instanceof RejectedExecutionException) {
            return FailureClassEnum.RECOVERABLE;
        }
        if (hasIoCause(root)) {
            return FailureClassEnum.RECOVERABLE;
        }
        if (!(root instanceof IllegalStateException) && !(root instanceof IllegalArgumentException)) {
            log.warn("COLLABORATOR_FAILURE_UNCLASSIFIED errorType={}, error={}, classifiedAs=FATAL",
                    root.getClass().getName(), root.getMessage());
        }
        return FailureClassEnum.FATAL;
    }

    public RecoveryDecision decide(WorkflowSessionEntity session, FailureClassEnum failureClass, WorkflowPolicy policy) {
        if (failureClass != FailureClassEnum.RECOVERABLE) {
            return RecoveryDecision.FAIL_FATAL;
        }
        if (session.getRetryCount() >= policy.getMaxRetries()) {
            return RecoveryDecision.FAIL_RETRIES_EXHAUSTED;
        }
        return RecoveryDecision.RETRY;
    }

    /**
     * 指数退避：base * 2^(retryCount-1)，不超过 max。
     */
    public Duration backoffDelay(int retryCount, WorkflowPolicy policy) {
        long baseMillis = Math.max(policy.getBackoffBase().toMillis(), 0L);
        long maxMillis = Math.max(policy.getBackoffMax().toMillis(), baseMillis);
        int exponent = Math.min(Math.max(retryCount - 1, 0), 30);
        long delay = baseMillis << exponent;
        if (delay < 0L || delay > maxMillis) {
            delay = maxMillis;
        }
        return Duration.ofMillis(delay);
    }

    public ErrorCodeEnum terminalCode(Throwable error, RecoveryDecision decision) {
        if (decision == RecoveryDecision.FAIL_RETRIES_EXHAUSTED) {
            return ErrorCodeEnum.RETRIES_EXHAUSTED;
        }
        Throwable root = unwrap(error);
        if (root instanceof CollaboratorException collaboratorException) {
            CollaboratorFailureKind kind = collaboratorException.getKind();
            if (kind == CollaboratorFailureKind.CONTRACT_VIOLATION) {
                return ErrorCodeEnum.CONTRACT_VIOLATION;
            }
            if (kind == CollaboratorFailureKind.REJECTED_INPUT) {
                return ErrorCodeEnum.INPUT_REJECTED;
            }
        }
        return ErrorCodeEnum.INTERNAL_ERROR;
    }

    /**
     * 剥掉 CompletableFuture 包装异常。
     */
    public Throwable unwrap(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null
                && depth++ < MAX_CAUSE_DEPTH) {
            current = current.getCause();
        }
        return current;
    }

    private boolean hasIoCause(Throwable error) {
        Throwable current = error;
        int depth = 0;
        while (current != null && depth++ < MAX_CAUSE_DEPTH) {
            if (current instanceof IOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    public enum RecoveryDecision {
        RETRY,
        FAIL_RETRIES_EXHAUSTED,
        FAIL_FATAL;

        public boolean isFailure() {
            return this != RETRY;
        }
    }
}
