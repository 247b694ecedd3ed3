package com.deckflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 信封类型枚举。
 *
 * @author deckflow
 * @since 2026-10-19
 */
public enum EnvelopeTypeEnum {

    CONTROL("control", true),
    INPUT("input", true),
    QUESTION("question", false),
    PROGRESS("progress", false),
    RESULT("result", false),
    ERROR("error", false);

    private final String code;

    /** 是否允许客户端发送 */
    private final boolean inbound;

    EnvelopeTypeEnum(String code, boolean inbound) {
        this.code = code;
        this.inbound = inbound;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isInbound() {
        return inbound;
    }

    /**
     * 按编码查找，未知编码返回 null，由调用方决定如何报错。
     */
    public static EnvelopeTypeEnum fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (EnvelopeTypeEnum type : EnvelopeTypeEnum.values()) {
            if (type.code.equals(code)) {
                return type;
            }
        }
        return null;
    }
}
