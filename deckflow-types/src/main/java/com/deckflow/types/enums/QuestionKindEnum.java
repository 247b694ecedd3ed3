package com.deckflow.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 澄清问题期望的回答形态。
 *
 * @author deckflow
 * @since 2026-10-19
 */
public enum QuestionKindEnum {

    TEXT("text"),
    CHOICE("choice"),
    MULTI_CHOICE("multi_choice"),
    SCALE("scale"),
    BOOLEAN("boolean");

    private final String code;

    QuestionKindEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 宽松解析，协作方返回未知形态时按自由文本处理。
     */
    public static QuestionKindEnum fromCodeOrText(String code) {
        if (code == null) {
            return TEXT;
        }
        for (QuestionKindEnum kind : QuestionKindEnum.values()) {
            if (kind.code.equalsIgnoreCase(code.trim())) {
                return kind;
            }
        }
        return TEXT;
    }
}
