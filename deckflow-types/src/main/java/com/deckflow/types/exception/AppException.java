package com.deckflow.types.exception;

import lombok.Data;
import lombok.EqualsAndHashCode;

/**
 * 应用自定义异常类。
 * <p>
 * 业务异常统一携带异常码和异常描述，REST 层与 WebSocket 层分别把它翻译成
 * {@code Response} 或 error 信封。
 * </p>
 *
 * @author deckflow
 * @since 2026-10-19
 */
@EqualsAndHashCode(callSuper = true)
@Data
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 4420561930278711532L;

    /** 异常码 */
    private String code;

    /** 异常信息 */
    private String info;

    public AppException(String code) {
        super(code);
        this.code = code;
        this.info = code;
    }

    public AppException(String code, Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
        this.code = code;
        this.info = cause == null ? null : cause.getMessage();
    }

    public AppException(String code, String message) {
        super(message);
        this.code = code;
        this.info = message;
    }

    public AppException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.info = message;
    }

    @Override
    public String getMessage() {
        return info != null ? info : super.getMessage();
    }

    @Override
    public String toString() {
        return "com.deckflow.types.exception.AppException{" +
                "code='" + code + '\'' +
                ", info='" + info + '\'' +
                '}';
    }

}
