package com.deckflow.infrastructure.collaborator;

import com.deckflow.domain.collaborator.adapter.gateway.ICollaboratorGateway;
import com.deckflow.domain.collaborator.exception.CollaboratorException;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorFailureKind;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorRequest;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorResult;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 协作方网关基类：在工作线程池上执行同步调用，负责限时与按会话取消。
 */
@Slf4j
public abstract class AbstractCollaboratorGateway implements ICollaboratorGateway {

    private final Executor executor;
    private final ConcurrentMap<String, Set<CompletableFuture<CollaboratorResult>>> outstandingBySession;

    protected AbstractCollaboratorGateway(Executor executor) {
        this.executor = executor;
        this.outstandingBySession = new ConcurrentHashMap<>();
    }

    /**
     * 同步执行一次协作方调用，运行在网关工作线程上。
     */
    protected abstract CollaboratorResult doInvoke(CollaboratorRequest request);

    @Override
    public CompletableFuture<CollaboratorResult> invoke(CollaboratorRequest request, Duration timeout) {
        CompletableFuture<CollaboratorResult> result = new CompletableFuture<>();
        String sessionId = request.getSessionId();
        track(sessionId, result);

        CompletableFuture<CollaboratorResult> work;
        try {
            work = CompletableFuture.supplyAsync(() -> doInvoke(request), executor);
        } catch (RejectedExecutionException ex) {
            untrack(sessionId, result);
            result.completeExceptionally(new CollaboratorException(CollaboratorFailureKind.UNAVAILABLE,
                    "Collaborator worker pool is saturated", ex));
            return result;
        }

        work.orTimeout(Math.max(timeout.toMillis(), 1L), TimeUnit.MILLISECONDS)
                .whenComplete((value, error) -> {
                    untrack(sessionId, result);
                    if (error == null) {
                        result.complete(value);
                        return;
                    }
                    Throwable cause = error instanceof CompletionException && error.getCause() != null
                            ? error.getCause()
                            : error;
                    if (cause instanceof TimeoutException) {
                        log.warn("COLLABORATOR_CALL_TIMEOUT mode={}, sessionId={}, role={}, attempt={}, timeoutMs={}",
                                mode(), sessionId, request.getRole(), request.getAttemptNumber(), timeout.toMillis());
                        result.completeExceptionally(CollaboratorException.timeout(request.getRole(), timeout));
                    } else {
                        result.completeExceptionally(cause);
                    }
                });
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                work.cancel(true);
            }
        });
        return result;
    }

    @Override
    public void cancel(String sessionId) {
        if (sessionId == null) {
            return;
        }
        Set<CompletableFuture<CollaboratorResult>> outstanding = outstandingBySession.remove(sessionId);
        if (outstanding == null || outstanding.isEmpty()) {
            return;
        }
        int cancelled = 0;
        for (CompletableFuture<CollaboratorResult> future : outstanding) {
            if (future.cancel(true)) {
                cancelled++;
            }
        }
        log.info("COLLABORATOR_CALL_CANCELLED mode={}, sessionId={}, cancelled={}", mode(), sessionId, cancelled);
    }

    public int outstandingCount(String sessionId) {
        Set<CompletableFuture<CollaboratorResult>> outstanding = outstandingBySession.get(sessionId);
        return outstanding == null ? 0 : outstanding.size();
    }

    private void track(String sessionId, CompletableFuture<CollaboratorResult> future) {
        if (sessionId == null) {
            return;
        }
        outstandingBySession.computeIfAbsent(sessionId, key -> ConcurrentHashMap.newKeySet()).add(future);
    }

    private void untrack(String sessionId, CompletableFuture<CollaboratorResult> future) {
        if (sessionId == null) {
            return;
        }
        outstandingBySession.computeIfPresent(sessionId, (key, futures) -> {
            futures.remove(future);
            return futures.isEmpty() ? null : futures;
        });
    }
}
