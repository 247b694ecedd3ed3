package com.deckflow.trigger.router;

import com.deckflow.types.enums.ErrorCodeEnum;
import com.deckflow.types.exception.AppException;
import lombok.Getter;

/**
 * 入站信封校验失败，携带协议错误码与出错字段。
 */
@Getter
public class EnvelopeValidationException extends AppException {

    private static final long serialVersionUID = 2917744385201339417L;

    private final ErrorCodeEnum errorCode;

    private final String field;

    /**
     * 能从原始报文中读出的 session_id，用于回显。
     */
    private final String sessionId;

    public EnvelopeValidationException(ErrorCodeEnum errorCode, String field, String sessionId, String message) {
        super(errorCode.getCode(), message);
        this.errorCode = errorCode;
        this.field = field;
        this.sessionId = sessionId;
    }
}
