package com.imperium.searchinsight.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.imperium.searchinsight.exception.SearchValidationException;

import java.util.Locale;

public enum SearchDepth {

    BASIC,
    ADVANCED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SearchDepth fromValue(String value) {
        if (value == null || value.isBlank()) {
            return BASIC;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "basic" -> BASIC;
            case "advanced" -> ADVANCED;
            default -> throw new SearchValidationException("depth must be one of: basic, advanced", "depth");
        };
    }
}
