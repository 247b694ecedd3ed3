package com.deckflow.api.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * error 信封负载。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ErrorPayloadDTO {

    /** 稳定错误码 */
    private String code;

    private String message;

    private boolean recoverable;
}
