package com.deckflow.trigger.http;

import com.deckflow.api.response.Response;
import com.deckflow.types.common.Constants;
import com.deckflow.types.enums.ResponseCode;
import com.deckflow.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理：业务码映射为 HTTP 状态，响应体保持 {@link Response} 结构。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    @ExceptionHandler(AppException.class)
    public ResponseEntity<Response<Object>> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo());
        HttpStatus status = resolveStatus(code);
        log.warn("HTTP_ERROR path={}, method={}, sessionId={}, status={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveSessionId(),
                status.value(),
                ex.getClass().getSimpleName(),
                code,
                info);
        return ResponseEntity.status(status).body(Response.<Object>builder()
                .code(code)
                .info(info)
                .build());
    }

    @ExceptionHandler({
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public ResponseEntity<Response<Object>> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()), 300);
        log.warn("HTTP_ERROR path={}, method={}, sessionId={}, status={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveSessionId(),
                HttpStatus.BAD_REQUEST.value(),
                ex.getClass().getSimpleName(),
                ResponseCode.ILLEGAL_PARAMETER.getCode(),
                info);
        return ResponseEntity.badRequest().body(Response.<Object>builder()
                .code(ResponseCode.ILLEGAL_PARAMETER.getCode())
                .info(info)
                .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Response<Object>> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, sessionId={}, status={}, errorType={}, errorCode={}, errorMessage={}",
                resolvePath(request),
                resolveMethod(request),
                resolveSessionId(),
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                ex.getClass().getSimpleName(),
                ResponseCode.UN_ERROR.getCode(),
                truncate(ex.getMessage(), 300),
                ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(Response.<Object>builder()
                .code(ResponseCode.UN_ERROR.getCode())
                .info(ResponseCode.UN_ERROR.getInfo())
                .build());
    }

    private HttpStatus resolveStatus(String code) {
        if (ResponseCode.NOT_FOUND.getCode().equals(code)) {
            return HttpStatus.NOT_FOUND;
        }
        if (ResponseCode.UNAUTHORIZED.getCode().equals(code)) {
            return HttpStatus.UNAUTHORIZED;
        }
        if (ResponseCode.UN_ERROR.getCode().equals(code)) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return HttpStatus.BAD_REQUEST;
    }

    private String resolvePath(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private String resolveMethod(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }

    private String resolveSessionId() {
        return StringUtils.defaultIfBlank(MDC.get(Constants.MDC_SESSION_ID), "-");
    }

    private String truncate(String text, int maxLength) {
        if (StringUtils.isBlank(text) || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength);
    }
}
