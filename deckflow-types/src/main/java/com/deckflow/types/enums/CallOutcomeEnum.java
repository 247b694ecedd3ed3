package com.deckflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 协作方调用结果枚举。
 *
 * @author deckflow
 * @since 2026-10-19
 */
public enum CallOutcomeEnum {

    PENDING("pending"),
    SUCCESS("success"),
    RECOVERABLE_FAILURE("recoverable-failure"),
    FATAL_FAILURE("fatal-failure");

    private final String code;

    CallOutcomeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isResolved() {
        return this != PENDING;
    }
}
