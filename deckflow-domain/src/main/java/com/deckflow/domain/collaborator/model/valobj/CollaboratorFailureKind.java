package com.deckflow.domain.collaborator.model.valobj;

/**
 * 协作方失败种类。
 */
public enum CollaboratorFailureKind {

    TIMEOUT(true),
    UNAVAILABLE(true),
    TRANSIENT_INCONSISTENCY(true),
    CONTRACT_VIOLATION(false),
    REJECTED_INPUT(false);

    private final boolean recoverable;

    CollaboratorFailureKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    public boolean isRecoverable() {
        return recoverable;
    }
}
