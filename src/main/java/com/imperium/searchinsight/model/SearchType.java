package com.imperium.searchinsight.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.imperium.searchinsight.exception.SearchValidationException;

import java.util.Locale;

/**
 * 搜索类型：general | news | image。
 */
public enum SearchType {

    GENERAL,
    NEWS,
    IMAGE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * 解析外部传入的类型字符串，空值视为 general。
     *
     * @throws SearchValidationException 未知类型
     */
    @JsonCreator
    public static SearchType fromValue(String value) {
        if (value == null || value.isBlank()) {
            return GENERAL;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "general" -> GENERAL;
            case "news" -> NEWS;
            case "image" -> IMAGE;
            default -> throw new SearchValidationException(
                    "searchType must be one of: general, news, image", "searchType");
        };
    }
}
