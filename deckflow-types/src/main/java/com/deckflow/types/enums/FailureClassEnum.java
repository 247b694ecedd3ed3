package com.deckflow.types.enums;

/**
 * 失败分类：可恢复或致命。
 */
public enum FailureClassEnum {

    RECOVERABLE,
    FATAL;

    public CallOutcomeEnum toOutcome() {
        return this == RECOVERABLE ? CallOutcomeEnum.RECOVERABLE_FAILURE : CallOutcomeEnum.FATAL_FAILURE;
    }
}
