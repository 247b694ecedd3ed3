package com.deckflow.types.enums;

import lombok.Getter;

/**
 * REST 接口统一响应码枚举。
 *
 * @author deckflow
 * @since 2026-10-19
 */
@Getter
public enum ResponseCode {

    /** 成功 */
    SUCCESS("0000", "成功"),

    /** 未知错误 */
    UN_ERROR("0001", "未知失败"),

    /** 非法参数 */
    ILLEGAL_PARAMETER("0002", "非法参数"),

    /** 未认证 */
    UNAUTHORIZED("0003", "未认证或凭证已失效"),

    /** 资源不存在 */
    NOT_FOUND("0004", "资源不存在");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
