package com.initialone.jqport.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    /** 仅提示：转换已完成，无需人工处理 */
    INFO,
    /** 行为可能与原策略不同，需要人工复核 */
    WARNING,
    /** 该行已被禁用，必须人工改写 */
    BLOCKED;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
