package com.deckflow.trigger.application.command;

import com.deckflow.domain.collaborator.adapter.gateway.ICollaboratorGateway;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorRequest;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorResult;
import com.deckflow.domain.collaborator.model.valobj.CollaboratorRole;
import com.deckflow.domain.session.adapter.repository.IWorkflowSessionRepository;
import com.deckflow.domain.session.model.entity.ClarificationRoundEntity;
import com.deckflow.domain.session.model.entity.WorkflowSessionEntity;
import com.deckflow.domain.session.model.valobj.PendingRequest;
import com.deckflow.domain.session.service.ClarificationDomainService;
import com.deckflow.domain.session.service.InputGuardDomainService;
import com.deckflow.domain.workflow.model.valobj.AnalysisOutcome;
import com.deckflow.domain.workflow.model.valobj.WorkflowPolicy;
import com.deckflow.domain.workflow.service.FailureRecoveryDomainService;
import com.deckflow.domain.workflow.service.WorkflowTransitionDomainService;
import com.deckflow.trigger.application.common.EnvelopeFactory;
import com.deckflow.trigger.connection.IEnvelopeSink;
import com.deckflow.trigger.router.SessionMailboxDispatcher;
import com.deckflow.trigger.router.SessionMailboxDispatcher.WorkItem;
import com.deckflow.types.enums.CallOutcomeEnum;
import com.deckflow.types.enums.ControlActionEnum;
import com.deckflow.types.enums.ErrorCodeEnum;
import com.deckflow.types.enums.FailureClassEnum;
import com.deckflow.types.enums.SessionPhaseEnum;
import com.deckflow.types.exception.AppException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.Lock;

/**
 * 工作流编排写用例：驱动会话状态机、发起协作方调用、执行重试策略并发出出站信封。
 * <p>
 * 所有方法都由会话邮箱串行调用；对会话的每次修改都在该会话写锁内完成。
 * 协作方调用结果以内部工作项回到同一邮箱，调用 ID 不匹配的结果一律丢弃。
 * </p>
 */
@Slf4j
@Service
public class WorkflowOrchestratorService {

    private final IWorkflowSessionRepository sessionRepository;
    private final ICollaboratorGateway collaboratorGateway;
    private final WorkflowTransitionDomainService transitionDomainService;
    private final FailureRecoveryDomainService failureRecoveryDomainService;
    private final ClarificationDomainService clarificationDomainService;
    private final InputGuardDomainService inputGuardDomainService;
    private final IEnvelopeSink envelopeSink;
    private final EnvelopeFactory envelopeFactory;
    private final SessionMailboxDispatcher dispatcher;
    private final TaskScheduler retryScheduler;
    private final WorkflowPolicy policy;
    private final MeterRegistry meterRegistry;
    private final Counter retryCounter;
    private final Counter degradedCounter;
    private final Counter lateResultCounter;

    public WorkflowOrchestratorService(IWorkflowSessionRepository sessionRepository,
                                       ICollaboratorGateway collaboratorGateway,
                                       WorkflowTransitionDomainService transitionDomainService,
                                       FailureRecoveryDomainService failureRecoveryDomainService,
                                       ClarificationDomainService clarificationDomainService,
                                       InputGuardDomainService inputGuardDomainService,
                                       IEnvelopeSink envelopeSink,
                                       EnvelopeFactory envelopeFactory,
                                       SessionMailboxDispatcher dispatcher,
                                       @Qualifier("retryScheduler") TaskScheduler retryScheduler,
                                       WorkflowPolicy policy,
                                       ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.sessionRepository = sessionRepository;
        this.collaboratorGateway = collaboratorGateway;
        this.transitionDomainService = transitionDomainService;
        this.failureRecoveryDomainService = failureRecoveryDomainService;
        this.clarificationDomainService = clarificationDomainService;
        this.inputGuardDomainService = inputGuardDomainService;
        this.envelopeSink = envelopeSink;
        this.envelopeFactory = envelopeFactory;
        this.dispatcher = dispatcher;
        this.retryScheduler = retryScheduler;
        this.policy = policy;
        this.meterRegistry = meterRegistryProvider.getIfAvailable(SimpleMeterRegistry::new);
        this.retryCounter = Counter.builder("deckflow.workflow.retry.total").register(meterRegistry);
        this.degradedCounter = Counter.builder("deckflow.workflow.degraded.total").register(meterRegistry);
        this.lateResultCounter = Counter.builder("deckflow.collaborator.late_result.total").register(meterRegistry);
    }

    /**
     * 创建会话；携带初始请求文本时直接进入分析。会话已存在时按恢复处理。
     */
    public void start(String sessionId, String userId, String messageId, String text) {
        Lock lock = sessionRepository.writeLock(sessionId);
        lock.lock();
        try {
            WorkflowSessionEntity existing = sessionRepository.findById(sessionId);
            if (existing != null) {
                if (!existing.isOwnedBy(userId)) {
                    log.warn("Start ignored, session owned by another user. sessionId={}, userId={}", sessionId, userId);
                    return;
                }
                resumeLocked(existing);
                return;
            }
            WorkflowSessionEntity session = WorkflowSessionEntity.create(sessionId, userId, Instant.now());
            sessionRepository.save(session);
            log.info("WORKFLOW_SESSION_CREATED sessionId={}, userId={}, withRequest={}",
                    sessionId, userId, StringUtils.isNotBlank(text));
            envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
            if (StringUtils.isNotBlank(text)) {
                beginAnalysis(session, messageId, text);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 客户端在新通道上重新绑定会话后补发当前状态。
     */
    public void resume(String sessionId, String userId) {
        Lock lock = sessionRepository.writeLock(sessionId);
        lock.lock();
        try {
            WorkflowSessionEntity session = sessionRepository.findById(sessionId);
            if (session == null) {
                log.info("Resume ignored, session no longer exists. sessionId={}", sessionId);
                forgetIfUnclaimed(sessionId);
                return;
            }
            if (!session.isOwnedBy(userId)) {
                log.warn("Resume ignored, session owned by another user. sessionId={}, userId={}", sessionId, userId);
                return;
            }
            resumeLocked(session);
        } finally {
            lock.unlock();
        }
    }

    public void handleInput(String sessionId, String messageId, String text, Map<String, Object> answers) {
        Lock lock = sessionRepository.writeLock(sessionId);
        lock.lock();
        try {
            WorkflowSessionEntity session = sessionRepository.findById(sessionId);
            if (session == null) {
                log.info("Input dropped, session no longer exists. sessionId={}, messageId={}", sessionId, messageId);
                forgetIfUnclaimed(sessionId);
                return;
            }
            session.touch(Instant.now());
            boolean hasText = StringUtils.isNotBlank(text);
            boolean hasAnswers = answers != null && !answers.isEmpty();

            SessionPhaseEnum phase = session.getPhase();
            if (phase == SessionPhaseEnum.FAILED) {
                envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
                return;
            }
            if (phase == SessionPhaseEnum.COMPLETED) {
                emitError(sessionId, ErrorCodeEnum.SESSION_TERMINAL, null);
                return;
            }
            if (phase == SessionPhaseEnum.INTAKE) {
                if (!hasText) {
                    emitError(sessionId, ErrorCodeEnum.VALIDATION_FAILED, "initial request text is required");
                    return;
                }
                beginAnalysis(session, messageId, text);
                return;
            }
            if (phase == SessionPhaseEnum.CLARIFYING && !session.isCallInFlight()) {
                if (!hasAnswers) {
                    emitError(sessionId, ErrorCodeEnum.VALIDATION_FAILED, "answers are required while clarifying");
                    return;
                }
                applyClarificationAnswers(session, messageId, answers);
                return;
            }
            if (hasAnswers && !hasText) {
                ClarificationDomainService.AnswerApplyResult result =
                        clarificationDomainService.applyAnswers(session, answers);
                if (result.outcome() == ClarificationDomainService.Outcome.UNCHANGED) {
                    envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
                    return;
                }
                emitError(sessionId, ErrorCodeEnum.VALIDATION_FAILED,
                        StringUtils.defaultIfBlank(result.violation(), "session is not accepting answers in phase " + phase.getCode()));
                return;
            }
            emitError(sessionId, ErrorCodeEnum.VALIDATION_FAILED, "session is not accepting input in phase " + phase.getCode());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 客户端取消：活跃阶段直接进入 failed，未完成调用的结果随后丢弃。
     */
    public void cancel(String sessionId) {
        Lock lock = sessionRepository.writeLock(sessionId);
        lock.lock();
        try {
            WorkflowSessionEntity session = sessionRepository.findById(sessionId);
            if (session == null) {
                forgetIfUnclaimed(sessionId);
                return;
            }
            session.touch(Instant.now());
            if (session.isTerminal()) {
                envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
                return;
            }
            log.info("WORKFLOW_CANCEL_REQUESTED sessionId={}, phase={}, callInFlight={}",
                    sessionId, session.getPhase().getCode(), session.isCallInFlight());
            failSession(session, ErrorCodeEnum.CANCELLED, null);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 显式关闭：取消未完成调用并销毁会话。
     */
    public void close(String sessionId) {
        Lock lock = sessionRepository.writeLock(sessionId);
        lock.lock();
        try {
            WorkflowSessionEntity session = sessionRepository.findById(sessionId);
            if (session == null) {
                forgetIfUnclaimed(sessionId);
                return;
            }
            destroy(session, "client_close");
        } finally {
            lock.unlock();
        }
    }

    /**
     * 通道断开后挂起会话，不删除。
     */
    public void suspend(String sessionId) {
        Lock lock = sessionRepository.writeLock(sessionId);
        lock.lock();
        try {
            WorkflowSessionEntity session = sessionRepository.findById(sessionId);
            if (session == null) {
                forgetIfUnclaimed(sessionId);
                return;
            }
            if (session.isSuspended()) {
                return;
            }
            session.suspend(Instant.now());
            log.info("WORKFLOW_SESSION_SUSPENDED sessionId={}, phase={}, callInFlight={}",
                    sessionId, session.getPhase().getCode(), session.isCallInFlight());
        } finally {
            lock.unlock();
        }
    }

    /**
     * 为超过空闲时长的会话投递销毁工作项，实际销毁前在邮箱内再次确认。
     */
    public int expireIdleSessions() {
        Instant cutoff = Instant.now().minus(policy.getSessionIdleTimeout());
        List<WorkflowSessionEntity> idleSessions = sessionRepository.findIdleBefore(cutoff);
        for (WorkflowSessionEntity session : idleSessions) {
            String sessionId = session.getId();
            dispatcher.submit(sessionId, WorkItem.internal("orchestrator.expire", () -> expireIfIdle(sessionId, cutoff)));
        }
        return idleSessions.size();
    }

    void onCallCompleted(String sessionId, String callId, Map<String, CollaboratorResult> results, Throwable error) {
        Lock lock = sessionRepository.writeLock(sessionId);
        lock.lock();
        try {
            WorkflowSessionEntity session = sessionRepository.findById(sessionId);
            if (session == null) {
                discardLateResult(sessionId, callId, "session_destroyed");
                forgetIfUnclaimed(sessionId);
                return;
            }
            FailureClassEnum failureClass = error == null ? null : failureRecoveryDomainService.classify(error);
            CallOutcomeEnum outcome = failureClass == null ? CallOutcomeEnum.SUCCESS : failureClass.toOutcome();
            if (!session.resolveCall(callId, outcome)) {
                discardLateResult(sessionId, callId, "stale_call");
                return;
            }
            dispatcher.markBusy(sessionId, false);
            session.touch(Instant.now());
            log.info("COLLABORATOR_CALL_COMPLETED sessionId={}, callId={}, phase={}, outcome={}, suspended={}",
                    sessionId, callId, session.getPhase().getCode(), outcome.getCode(), session.isSuspended());
            if (error != null) {
                handleFailure(session, error, failureClass);
                return;
            }
            try {
                handleSuccess(session, results);
            } catch (RuntimeException ex) {
                handleFailure(session, ex, failureRecoveryDomainService.classify(ex));
            }
        } finally {
            lock.unlock();
        }
    }

    void retryAfterBackoff(String sessionId, int expectedRetryCount) {
        Lock lock = sessionRepository.writeLock(sessionId);
        lock.lock();
        try {
            WorkflowSessionEntity session = sessionRepository.findById(sessionId);
            if (session == null) {
                log.debug("Retry skipped, session no longer exists. sessionId={}", sessionId);
                forgetIfUnclaimed(sessionId);
                return;
            }
            if (session.getPhase() != SessionPhaseEnum.ERROR_RECOVERY
                    || session.getRetryCount() != expectedRetryCount) {
                log.debug("Stale retry skipped. sessionId={}, expectedRetryCount={}", sessionId, expectedRetryCount);
                return;
            }
            SessionPhaseEnum target = session.returnToRetriedPhase();
            logTransition(session, SessionPhaseEnum.ERROR_RECOVERY);
            log.info("WORKFLOW_RETRY_ATTEMPT sessionId={}, phase={}, attempt={}",
                    sessionId, target.getCode(), session.getRetryCount() + 1);
            envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
            startCall(session);
        } finally {
            lock.unlock();
        }
    }

    private void resumeLocked(WorkflowSessionEntity session) {
        String sessionId = session.getId();
        session.resume();
        session.touch(Instant.now());
        log.info("WORKFLOW_SESSION_RESUMED sessionId={}, phase={}, callInFlight={}",
                sessionId, session.getPhase().getCode(), session.isCallInFlight());
        envelopeSink.emit(sessionId, envelopeFactory.progress(session, true, null));

        SessionPhaseEnum phase = session.getPhase();
        if (phase == SessionPhaseEnum.CLARIFYING && !session.isCallInFlight()) {
            ClarificationRoundEntity round = session.currentRound();
            if (round != null && !round.isComplete()) {
                envelopeSink.emit(sessionId, envelopeFactory.question(sessionId, round));
            }
        } else if (phase == SessionPhaseEnum.DELIVERING) {
            deliver(session);
        } else if (phase == SessionPhaseEnum.COMPLETED) {
            envelopeSink.emit(sessionId, envelopeFactory.result(session));
        } else if (phase == SessionPhaseEnum.FAILED && !session.isTerminalErrorDelivered()) {
            boolean delivered = envelopeSink.emit(sessionId,
                    envelopeFactory.error(sessionId, session.getFailureCode(), session.getFailureMessage()));
            session.setTerminalErrorDelivered(delivered);
        }
    }

    private void beginAnalysis(WorkflowSessionEntity session, String messageId, String text) {
        String sessionId = session.getId();
        String request;
        try {
            request = inputGuardDomainService.requireAcceptableRequest(text);
        } catch (AppException ex) {
            log.info("Initial request rejected. sessionId={}, code={}, reason={}", sessionId, ex.getCode(), ex.getInfo());
            emitError(sessionId, toErrorCode(ex), ex.getInfo());
            return;
        }
        session.beginAnalysis(request, new PendingRequest(messageId, request, null, Instant.now()));
        logTransition(session, SessionPhaseEnum.INTAKE);
        envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
        startCall(session);
    }

    private void applyClarificationAnswers(WorkflowSessionEntity session, String messageId, Map<String, Object> answers) {
        String sessionId = session.getId();
        ClarificationDomainService.AnswerApplyResult result = clarificationDomainService.applyAnswers(session, answers);
        switch (result.outcome()) {
            case REJECTED:
                log.info("Clarification answers rejected. sessionId={}, reason={}", sessionId, result.violation());
                emitError(sessionId, ErrorCodeEnum.VALIDATION_FAILED, result.violation());
                return;
            case UNCHANGED:
                log.debug("Clarification answers unchanged. sessionId={}, round={}", sessionId, result.roundNumber());
                envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
                return;
            case PARTIAL:
                session.setPendingRequest(new PendingRequest(messageId, null, answers, Instant.now()));
                envelopeSink.emit(sessionId, envelopeFactory.progress(session, false,
                        "awaiting answers: " + String.join(", ", result.missingQuestionIds())));
                return;
            default:
                session.setPendingRequest(new PendingRequest(messageId, null, answers, Instant.now()));
                log.info("WORKFLOW_CLARIFICATION_ROUND_COMPLETED sessionId={}, round={}", sessionId, result.roundNumber());
                envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
                startCall(session);
        }
    }

    private void handleSuccess(WorkflowSessionEntity session, Map<String, CollaboratorResult> results) {
        String sessionId = session.getId();
        SessionPhaseEnum phase = session.getPhase();
        if (phase == SessionPhaseEnum.GENERATING) {
            Map<String, Object> artifact = transitionDomainService.assembleArtifact(results, policy.getGenerationRoles());
            session.enterDelivering(artifact);
            logTransition(session, phase);
            envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
            deliver(session);
            return;
        }

        CollaboratorResult analysis = results == null ? null : results.get(CollaboratorRole.ANALYSIS);
        AnalysisOutcome outcome = transitionDomainService.readAnalysis(session, analysis, policy);
        session.getAnalysisDetails().putAll(outcome.getDetails());
        WorkflowTransitionDomainService.AnalysisDecision decision =
                transitionDomainService.decideAfterAnalysis(session, outcome, policy);
        log.info("WORKFLOW_ANALYSIS_DECIDED sessionId={}, score={}, questions={}, rounds={}, decision={}",
                sessionId, outcome.getCompletenessScore(), outcome.getQuestions().size(),
                session.getClarificationRoundCount(), decision);
        switch (decision) {
            case CLARIFY:
                ClarificationRoundEntity round = session.openClarificationRound(
                        outcome.getQuestions(), policy.getMaxClarificationRounds(), Instant.now());
                logTransition(session, phase);
                envelopeSink.emit(sessionId, envelopeFactory.question(sessionId, round));
                return;
            case PROCEED_DEGRADED:
                log.warn("WORKFLOW_DEGRADED_TRANSITION sessionId={}, rounds={}, maxRounds={}, score={}, reason={}",
                        sessionId, session.getClarificationRoundCount(), policy.getMaxClarificationRounds(),
                        outcome.getCompletenessScore(), WorkflowTransitionDomainService.DEGRADED_REASON_ROUNDS_EXHAUSTED);
                degradedCounter.increment();
                session.enterGenerating(true, WorkflowTransitionDomainService.DEGRADED_REASON_ROUNDS_EXHAUSTED);
                break;
            default:
                session.enterGenerating(false, null);
        }
        logTransition(session, phase);
        envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
        startCall(session);
    }

    private void handleFailure(WorkflowSessionEntity session, Throwable error, FailureClassEnum failureClass) {
        String sessionId = session.getId();
        FailureRecoveryDomainService.RecoveryDecision decision =
                failureRecoveryDomainService.decide(session, failureClass, policy);
        if (!decision.isFailure() && !session.getPhase().isRetryable()) {
            decision = FailureRecoveryDomainService.RecoveryDecision.FAIL_FATAL;
        }
        Throwable cause = failureRecoveryDomainService.unwrap(error);
        if (decision.isFailure()) {
            ErrorCodeEnum code = failureRecoveryDomainService.terminalCode(error, decision);
            log.warn("Collaborator failure is terminal. sessionId={}, phase={}, decision={}, errorType={}, error={}",
                    sessionId, session.getPhase().getCode(), decision,
                    cause == null ? null : cause.getClass().getSimpleName(), cause == null ? null : cause.getMessage());
            failSession(session, code, null);
            return;
        }

        SessionPhaseEnum phase = session.getPhase();
        session.enterErrorRecovery(policy.getMaxRetries());
        retryCounter.increment();
        logTransition(session, phase);
        int retryCount = session.getRetryCount();
        Duration delay = failureRecoveryDomainService.backoffDelay(retryCount, policy);
        log.warn("WORKFLOW_RETRY_SCHEDULED sessionId={}, phase={}, retryCount={}, maxRetries={}, delayMs={}, error={}",
                sessionId, phase.getCode(), retryCount, policy.getMaxRetries(), delay.toMillis(),
                cause == null ? null : cause.getMessage());
        envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
        dispatcher.markBusy(sessionId, true);
        try {
            retryScheduler.schedule(() -> {
                if (!sessionRepository.exists(sessionId)) {
                    log.debug("Retry dropped, session no longer exists. sessionId={}", sessionId);
                    return;
                }
                dispatcher.submit(sessionId,
                        WorkItem.internal("orchestrator.retry", () -> retryAfterBackoff(sessionId, retryCount)));
            }, Instant.now().plus(delay));
        } catch (RuntimeException ex) {
            log.error("Failed to schedule retry. sessionId={}, error={}", sessionId, ex.getMessage(), ex);
            failSession(session, ErrorCodeEnum.INTERNAL_ERROR, null);
        }
    }

    private void startCall(WorkflowSessionEntity session) {
        String sessionId = session.getId();
        String callId = UUID.randomUUID().toString();
        session.startCall(callId, Instant.now(), policy.getCollaboratorTimeout());
        dispatcher.markBusy(sessionId, true);
        SessionPhaseEnum phase = session.getPhase();
        int attempt = session.getActiveCall().getAttemptNumber();
        log.info("COLLABORATOR_CALL_STARTED sessionId={}, callId={}, phase={}, attempt={}, mode={}",
                sessionId, callId, phase.getCode(), attempt, collaboratorGateway.mode());
        try {
            if (phase == SessionPhaseEnum.GENERATING) {
                invokeGeneration(session, callId, attempt);
            } else {
                invokeAnalysis(session, callId, attempt);
            }
        } catch (RuntimeException ex) {
            submitCompletion(sessionId, callId, null, ex);
        }
    }

    private void invokeAnalysis(WorkflowSessionEntity session, String callId, int attempt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", session.getRequestText());
        payload.put("answers", session.mergedAnswers());
        payload.put("round_count", session.getClarificationRoundCount());
        payload.put("max_rounds", policy.getMaxClarificationRounds());
        payload.put("analysis", new LinkedHashMap<>(session.getAnalysisDetails()));
        String sessionId = session.getId();
        CompletableFuture<CollaboratorResult> future = collaboratorGateway.invoke(
                buildRequest(session, callId, attempt, CollaboratorRole.ANALYSIS, payload),
                policy.getCollaboratorTimeout());
        future.whenComplete((result, error) -> submitCompletion(sessionId, callId,
                error == null ? singleResult(CollaboratorRole.ANALYSIS, result) : null, error));
    }

    private void invokeGeneration(WorkflowSessionEntity session, String callId, int attempt) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", session.getRequestText());
        payload.put("answers", session.mergedAnswers());
        payload.put("analysis", new LinkedHashMap<>(session.getAnalysisDetails()));
        payload.put("degraded", session.isDegraded());
        String sessionId = session.getId();
        Map<String, CompletableFuture<CollaboratorResult>> futures = new LinkedHashMap<>();
        for (String role : policy.getGenerationRoles()) {
            futures.put(role, collaboratorGateway.invoke(
                    buildRequest(session, callId, attempt, role, new LinkedHashMap<>(payload)),
                    policy.getCollaboratorTimeout()));
        }
        CompletableFuture.allOf(futures.values().toArray(new CompletableFuture<?>[0]))
                .whenComplete((ignored, error) -> {
                    if (error != null) {
                        submitCompletion(sessionId, callId, null, error);
                        return;
                    }
                    Map<String, CollaboratorResult> results = new LinkedHashMap<>();
                    futures.forEach((role, future) -> results.put(role, future.join()));
                    submitCompletion(sessionId, callId, results, null);
                });
    }

    private CollaboratorRequest buildRequest(WorkflowSessionEntity session,
                                             String callId,
                                             int attempt,
                                             String role,
                                             Map<String, Object> payload) {
        return CollaboratorRequest.builder()
                .sessionId(session.getId())
                .callId(callId)
                .phase(session.getPhase())
                .role(role)
                .attemptNumber(attempt)
                .payload(payload)
                .build();
    }

    private Map<String, CollaboratorResult> singleResult(String role, CollaboratorResult result) {
        Map<String, CollaboratorResult> results = new LinkedHashMap<>();
        results.put(role, result);
        return results;
    }

    private void submitCompletion(String sessionId,
                                  String callId,
                                  Map<String, CollaboratorResult> results,
                                  Throwable error) {
        dispatcher.submit(sessionId, WorkItem.internal("orchestrator.callCompleted",
                () -> onCallCompleted(sessionId, callId, results, error)));
    }

    private void deliver(WorkflowSessionEntity session) {
        String sessionId = session.getId();
        if (!envelopeSink.emit(sessionId, envelopeFactory.result(session))) {
            log.info("WORKFLOW_DELIVERY_DEFERRED sessionId={}, suspended={}", sessionId, session.isSuspended());
            return;
        }
        session.complete();
        logTransition(session, SessionPhaseEnum.DELIVERING);
        envelopeSink.emit(sessionId, envelopeFactory.progress(session, false, null));
    }

    private void failSession(WorkflowSessionEntity session, ErrorCodeEnum code, String message) {
        String sessionId = session.getId();
        SessionPhaseEnum from = session.getPhase();
        collaboratorGateway.cancel(sessionId);
        session.fail(code, message);
        dispatcher.markBusy(sessionId, false);
        meterRegistry.counter("deckflow.workflow.failed.total", "code", code.getCode()).increment();
        log.warn("WORKFLOW_FAILED sessionId={}, from={}, code={}, retryCount={}",
                sessionId, from.getCode(), code.getCode(), session.getRetryCount());
        boolean delivered = envelopeSink.emit(sessionId, envelopeFactory.error(sessionId, code, message));
        session.setTerminalErrorDelivered(delivered);
    }

    private void expireIfIdle(String sessionId, Instant cutoff) {
        Lock lock = sessionRepository.writeLock(sessionId);
        lock.lock();
        try {
            WorkflowSessionEntity session = sessionRepository.findById(sessionId);
            if (session == null) {
                forgetIfUnclaimed(sessionId);
                return;
            }
            if (session.getLastActivityAt() == null || !session.getLastActivityAt().isBefore(cutoff)) {
                return;
            }
            destroy(session, "idle_timeout");
        } finally {
            lock.unlock();
        }
    }

    private void destroy(WorkflowSessionEntity session, String reason) {
        String sessionId = session.getId();
        collaboratorGateway.cancel(sessionId);
        sessionRepository.deleteById(sessionId);
        envelopeSink.emit(sessionId, envelopeFactory.control(sessionId, ControlActionEnum.CLOSE));
        envelopeSink.release(sessionId);
        dispatcher.remove(sessionId);
        log.info("WORKFLOW_SESSION_DESTROYED sessionId={}, phase={}, reason={}",
                sessionId, session.getPhase().getCode(), reason);
    }

    /**
     * 会话已销毁且 ID 未被重新占用时，丢弃其邮箱与写锁。
     */
    private void forgetIfUnclaimed(String sessionId) {
        if (sessionRepository.ownerOf(sessionId) != null) {
            return;
        }
        dispatcher.remove(sessionId);
        sessionRepository.releaseLock(sessionId);
    }

    private void discardLateResult(String sessionId, String callId, String reason) {
        lateResultCounter.increment();
        log.info("COLLABORATOR_LATE_RESULT_DISCARDED sessionId={}, callId={}, reason={}", sessionId, callId, reason);
    }

    private void emitError(String sessionId, ErrorCodeEnum code, String message) {
        envelopeSink.emit(sessionId, envelopeFactory.error(sessionId, code, message));
    }

    private void logTransition(WorkflowSessionEntity session, SessionPhaseEnum from) {
        log.info("WORKFLOW_PHASE_TRANSITION sessionId={}, from={}, to={}, retryCount={}, rounds={}",
                session.getId(), from.getCode(), session.getPhase().getCode(),
                session.getRetryCount(), session.getClarificationRoundCount());
    }

    private ErrorCodeEnum toErrorCode(AppException ex) {
        for (ErrorCodeEnum code : ErrorCodeEnum.values()) {
            if (code.getCode().equals(ex.getCode())) {
                return code;
            }
        }
        return ErrorCodeEnum.VALIDATION_FAILED;
    }
}
