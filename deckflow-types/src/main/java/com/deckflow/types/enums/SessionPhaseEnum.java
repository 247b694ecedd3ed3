package com.deckflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * 会话阶段枚举（工作流状态机节点）。
 *
 * @author deckflow
 * @since 2026-10-19
 */
public enum SessionPhaseEnum {

    /**
     * 接收 - 会话已创建，等待初始请求
     */
    INTAKE("intake", 0),

    /**
     * 分析中 - 分析协作方正在评估请求完整度
     */
    ANALYZING("analyzing", 10),

    /**
     * 澄清中 - 等待客户端回答澄清问题
     */
    CLARIFYING("clarifying", 25),

    /**
     * 生成中 - 内容生成协作方工作中
     */
    GENERATING("generating", 50),

    /**
     * 交付中 - 结果已产出，等待送达
     */
    DELIVERING("delivering", 90),

    /**
     * 已完成
     */
    COMPLETED("completed", 100),

    /**
     * 错误恢复 - 可恢复失败后的退避等待
     */
    ERROR_RECOVERY("error_recovery", -1),

    /**
     * 失败 - 终态
     */
    FAILED("failed", -1);

    private final String code;
    private final int percentComplete;

    SessionPhaseEnum(String code, int percentComplete) {
        this.code = code;
        this.percentComplete = percentComplete;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 阶段对应的进度百分比，-1 表示沿用上一个阶段的进度。
     */
    public int getPercentComplete() {
        return percentComplete;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * 可以发起协作方调用的阶段，也是 error_recovery 之后可以回到的阶段。
     */
    public boolean isRetryable() {
        return this == ANALYZING || this == CLARIFYING || this == GENERATING;
    }

    public boolean canTransitionTo(SessionPhaseEnum next) {
        if (next == null) {
            return false;
        }
        return allowedTargets().contains(next);
    }

    private Set<SessionPhaseEnum> allowedTargets() {
        switch (this) {
            case INTAKE:
                return EnumSet.of(ANALYZING, FAILED);
            case ANALYZING:
                return EnumSet.of(CLARIFYING, GENERATING, ERROR_RECOVERY, FAILED);
            case CLARIFYING:
                return EnumSet.of(CLARIFYING, GENERATING, ERROR_RECOVERY, FAILED);
            case GENERATING:
                return EnumSet.of(DELIVERING, ERROR_RECOVERY, FAILED);
            case DELIVERING:
                return EnumSet.of(COMPLETED, FAILED);
            case ERROR_RECOVERY:
                return EnumSet.of(ANALYZING, CLARIFYING, GENERATING, FAILED);
            default:
                return EnumSet.noneOf(SessionPhaseEnum.class);
        }
    }

    public static SessionPhaseEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (SessionPhaseEnum phase : SessionPhaseEnum.values()) {
            if (phase.code.equals(code)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown session phase code: " + code);
    }
}
