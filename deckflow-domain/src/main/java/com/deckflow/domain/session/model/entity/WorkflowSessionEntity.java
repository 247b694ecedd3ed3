package com.deckflow.domain.session.model.entity;

import com.deckflow.domain.session.model.valobj.ClarificationQuestion;
import com.deckflow.domain.session.model.valobj.PendingRequest;
import com.deckflow.types.enums.CallOutcomeEnum;
import com.deckflow.types.enums.ErrorCodeEnum;
import com.deckflow.types.enums.SessionPhaseEnum;
import lombok.Data;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 工作流会话领域实体
 * <p>
 * 只由工作流编排服务在持有会话写锁时修改；路由层只读取 phase。
 * </p>
 *
 * @author deckflow
 * @since 2026-10-19
 */
@Data
public class WorkflowSessionEntity {

    /**
     * 会话 ID
     */
    private String id;

    /**
     * 身份校验后的用户 ID
     */
    private String userId;

    /**
     * 当前阶段
     */
    private volatile SessionPhaseEnum phase;

    private Instant createdAt;

    private volatile Instant lastActivityAt;

    /**
     * 已发出的澄清轮数
     */
    private int clarificationRoundCount;

    /**
     * 当前阶段的重试次数，每次成功推进阶段后归零
     */
    private int retryCount;

    private PendingRequest pendingRequest;

    /**
     * 初始请求文本
     */
    private String requestText;

    private List<ClarificationRoundEntity> rounds = new ArrayList<>();

    /**
     * 分析协作方给出的附加信息（类型、主题等）
     */
    private Map<String, Object> analysisDetails = new LinkedHashMap<>();

    private Map<String, Object> artifact;

    /**
     * 是否以降级模式进入生成
     */
    private boolean degraded;

    private String degradedReason;

    /**
     * 通道断开后挂起，等待同一会话 ID 重连
     */
    private volatile boolean suspended;

    private Instant suspendedAt;

    private CollaboratorCallEntity activeCall;

    /**
     * error_recovery 期间记录被重试的阶段
     */
    private SessionPhaseEnum recoveryPhase;

    private ErrorCodeEnum failureCode;

    private String failureMessage;

    /**
     * 终止 error 信封是否已送达客户端
     */
    private boolean terminalErrorDelivered;

    public static WorkflowSessionEntity create(String id, String userId, Instant now) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalStateException("Session id cannot be empty");
        }
        if (userId == null || userId.trim().isEmpty()) {
            throw new IllegalStateException("User ID cannot be empty");
        }
        WorkflowSessionEntity session = new WorkflowSessionEntity();
        session.setId(id);
        session.setUserId(userId);
        session.setPhase(SessionPhaseEnum.INTAKE);
        session.setCreatedAt(now);
        session.setLastActivityAt(now);
        return session;
    }

    public void touch(Instant now) {
        this.lastActivityAt = now;
    }

    public boolean isOwnedBy(String candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }

    public boolean isTerminal() {
        return phase != null && phase.isTerminal();
    }

    public void beginAnalysis(String text, PendingRequest request) {
        requirePhase(SessionPhaseEnum.INTAKE);
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalStateException("Request text cannot be empty");
        }
        this.requestText = text.trim();
        this.pendingRequest = request;
        moveTo(SessionPhaseEnum.ANALYZING);
        this.retryCount = 0;
    }

    /**
     * 发出新一轮澄清问题。
     */
    public ClarificationRoundEntity openClarificationRound(List<ClarificationQuestion> questions,
                                                           int maxRounds,
                                                           Instant now) {
        if (phase != SessionPhaseEnum.ANALYZING && phase != SessionPhaseEnum.CLARIFYING) {
            throw new IllegalStateException("Cannot open clarification round in phase " + phase.getCode());
        }
        if (clarificationRoundCount >= maxRounds) {
            throw new IllegalStateException("Clarification rounds exhausted: " + clarificationRoundCount + "/" + maxRounds);
        }
        ClarificationRoundEntity round = ClarificationRoundEntity.open(clarificationRoundCount + 1, questions, now);
        rounds.add(round);
        clarificationRoundCount = round.getRoundNumber();
        moveTo(SessionPhaseEnum.CLARIFYING);
        this.retryCount = 0;
        return round;
    }

    public ClarificationRoundEntity currentRound() {
        return rounds.isEmpty() ? null : rounds.get(rounds.size() - 1);
    }

    /**
     * 在所有轮次中查找问题所在轮次。
     */
    public ClarificationRoundEntity findRoundOfQuestion(String questionId) {
        for (ClarificationRoundEntity round : rounds) {
            if (round.findQuestion(questionId) != null) {
                return round;
            }
        }
        return null;
    }

    /**
     * 按轮次顺序合并的全部回答。
     */
    public Map<String, Object> mergedAnswers() {
        Map<String, Object> merged = new LinkedHashMap<>();
        for (ClarificationRoundEntity round : rounds) {
            merged.putAll(round.getAnswers());
        }
        return merged;
    }

    public void enterGenerating(boolean degradedMode, String reason) {
        if (phase != SessionPhaseEnum.ANALYZING && phase != SessionPhaseEnum.CLARIFYING) {
            throw new IllegalStateException("Cannot start generation in phase " + phase.getCode());
        }
        if (degradedMode) {
            this.degraded = true;
            this.degradedReason = reason;
        }
        moveTo(SessionPhaseEnum.GENERATING);
        this.retryCount = 0;
    }

    public void enterDelivering(Map<String, Object> producedArtifact) {
        requirePhase(SessionPhaseEnum.GENERATING);
        if (producedArtifact == null || producedArtifact.isEmpty()) {
            throw new IllegalStateException("Artifact cannot be empty");
        }
        this.artifact = producedArtifact;
        moveTo(SessionPhaseEnum.DELIVERING);
        this.retryCount = 0;
    }

    public void complete() {
        requirePhase(SessionPhaseEnum.DELIVERING);
        moveTo(SessionPhaseEnum.COMPLETED);
    }

    /**
     * 进入错误恢复，重试计数加一。
     */
    public void enterErrorRecovery(int maxRetries) {
        if (phase == null || !phase.isRetryable()) {
            throw new IllegalStateException("Phase " + (phase == null ? "null" : phase.getCode()) + " cannot be retried");
        }
        if (retryCount >= maxRetries) {
            throw new IllegalStateException("Retry budget exhausted: " + retryCount + "/" + maxRetries);
        }
        this.recoveryPhase = phase;
        this.retryCount++;
        moveTo(SessionPhaseEnum.ERROR_RECOVERY);
    }

    /**
     * 退避结束，回到被重试的阶段。
     */
    public SessionPhaseEnum returnToRetriedPhase() {
        requirePhase(SessionPhaseEnum.ERROR_RECOVERY);
        SessionPhaseEnum target = recoveryPhase;
        this.recoveryPhase = null;
        moveTo(target);
        return target;
    }

    public void fail(ErrorCodeEnum code, String message) {
        if (isTerminal()) {
            throw new IllegalStateException("Session " + id + " already terminal: " + phase.getCode());
        }
        if (activeCall != null && activeCall.isPending()) {
            activeCall.resolve(CallOutcomeEnum.FATAL_FAILURE);
        }
        this.activeCall = null;
        this.recoveryPhase = null;
        this.failureCode = code;
        this.failureMessage = message;
        moveTo(SessionPhaseEnum.FAILED);
    }

    public CollaboratorCallEntity startCall(String callId, Instant now, Duration timeout) {
        if (activeCall != null && activeCall.isPending()) {
            throw new IllegalStateException("Session " + id + " already has call " + activeCall.getCallId() + " in flight");
        }
        this.activeCall = CollaboratorCallEntity.start(callId, phase, retryCount + 1, now, timeout);
        return activeCall;
    }

    public boolean isCallInFlight() {
        return activeCall != null && activeCall.isPending();
    }

    /**
     * 记录调用结果；调用 ID 不匹配（过期结果）时返回 false 且不做任何修改。
     */
    public boolean resolveCall(String callId, CallOutcomeEnum outcome) {
        if (activeCall == null || callId == null || !callId.equals(activeCall.getCallId())) {
            return false;
        }
        activeCall.resolve(outcome);
        this.activeCall = null;
        return true;
    }

    public void suspend(Instant now) {
        this.suspended = true;
        this.suspendedAt = now;
    }

    public void resume() {
        this.suspended = false;
        this.suspendedAt = null;
    }

    private void requirePhase(SessionPhaseEnum expected) {
        if (phase != expected) {
            throw new IllegalStateException("Expected phase " + expected.getCode() + " but was " + (phase == null ? "null" : phase.getCode()));
        }
    }

    private void moveTo(SessionPhaseEnum next) {
        if (!phase.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal phase transition: " + phase.getCode() + " -> " + next.getCode());
        }
        this.phase = next;
    }
}
