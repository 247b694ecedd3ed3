package com.deckflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * control 信封动作枚举。
 *
 * @author deckflow
 * @since 2026-10-19
 */
public enum ControlActionEnum {

    /** 创建或恢复会话 */
    START("start"),

    /** 取消当前工作流，会话进入 failed */
    CANCEL("cancel"),

    /** 心跳探测 */
    PING("ping"),

    /** 心跳应答 */
    PONG("pong"),

    /** 显式关闭并销毁会话 */
    CLOSE("close");

    private final String code;

    ControlActionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 可以不携带 session_id 的动作。
     */
    public boolean allowsMissingSession() {
        return this == START || this == PING || this == PONG;
    }

    /**
     * 只作用于连接本身，不进入会话处理队列。
     */
    public boolean isLiveness() {
        return this == PING || this == PONG;
    }

    public static ControlActionEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ControlActionEnum action : ControlActionEnum.values()) {
            if (action.code.equals(code)) {
                return action;
            }
        }
        return null;
    }
}
