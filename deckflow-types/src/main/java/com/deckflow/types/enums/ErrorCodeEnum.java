package com.deckflow.types.enums;

import lombok.Getter;

/**
 * error 信封的稳定错误码。
 * <p>
 * 协议类与校验类错误不改变会话终态，终止类错误只在会话进入 failed 时发出一次。
 * </p>
 *
 * @author deckflow
 * @since 2026-10-19
 */
@Getter
public enum ErrorCodeEnum {

    INVALID_ENVELOPE(Category.PROTOCOL, true, "Envelope is malformed"),
    UNSUPPORTED_TYPE(Category.PROTOCOL, true, "Envelope type is not accepted from clients"),
    SESSION_NOT_FOUND(Category.PROTOCOL, true, "Session does not exist"),
    SESSION_FORBIDDEN(Category.PROTOCOL, true, "Session belongs to another user"),
    SESSION_TERMINAL(Category.PROTOCOL, false, "Session has already finished"),
    AUTH_FAILED(Category.PROTOCOL, false, "Credential verification failed"),

    VALIDATION_FAILED(Category.VALIDATION, true, "Input failed validation"),
    UNSAFE_INPUT(Category.VALIDATION, true, "Input contains disallowed instructions"),

    RETRIES_EXHAUSTED(Category.TERMINAL, false, "Collaborator kept failing after all retries"),
    CONTRACT_VIOLATION(Category.TERMINAL, false, "Collaborator returned a malformed result"),
    INPUT_REJECTED(Category.TERMINAL, false, "Request cannot be processed"),
    INTERNAL_ERROR(Category.TERMINAL, false, "Unexpected internal error"),
    CANCELLED(Category.TERMINAL, false, "Workflow cancelled by client");

    private final Category category;
    private final boolean recoverable;
    private final String defaultMessage;

    ErrorCodeEnum(Category category, boolean recoverable, String defaultMessage) {
        this.category = category;
        this.recoverable = recoverable;
        this.defaultMessage = defaultMessage;
    }

    public String getCode() {
        return name();
    }

    public boolean isTerminal() {
        return category == Category.TERMINAL;
    }

    public enum Category {
        PROTOCOL,
        VALIDATION,
        TERMINAL
    }
}
