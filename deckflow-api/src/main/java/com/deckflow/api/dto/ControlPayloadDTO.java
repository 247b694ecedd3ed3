package com.deckflow.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * control 信封负载。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ControlPayloadDTO {

    private String action;

    /** 仅 start 可携带的初始请求文本 */
    private String text;

    public static ControlPayloadDTO of(String action) {
        return new ControlPayloadDTO(action, null);
    }
}
