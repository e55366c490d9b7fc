package com.imperium.searchinsight.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * 结果来源。degraded 表示所有数据源失败后的最小兜底结果。
 */
public enum InsightSource {

    PRIMARY,
    FALLBACK,
    CACHE,
    DEGRADED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
