package com.deckflow.domain.collaborator.exception;

import com.deckflow.domain.collaborator.model.valobj.CollaboratorFailureKind;
import com.deckflow.types.exception.AppException;
import lombok.Getter;

import java.time.Duration;

/**
 * 协作方调用失败。
 */
@Getter
public class CollaboratorException extends AppException {

    private static final long serialVersionUID = -6014893358816402211L;

    private final CollaboratorFailureKind kind;

    public CollaboratorException(CollaboratorFailureKind kind, String message) {
        super(kind.name(), message);
        this.kind = kind;
    }

    public CollaboratorException(CollaboratorFailureKind kind, String message, Throwable cause) {
        super(kind.name(), message, cause);
        this.kind = kind;
    }

    public static CollaboratorException timeout(String role, Duration timeout) {
        return new CollaboratorException(CollaboratorFailureKind.TIMEOUT,
                "Collaborator " + role + " timed out after " + timeout.toMillis() + "ms");
    }

    public static CollaboratorException contractViolation(String message) {
        return new CollaboratorException(CollaboratorFailureKind.CONTRACT_VIOLATION, message);
    }

    public boolean isRecoverable() {
        return kind.isRecoverable();
    }
}
