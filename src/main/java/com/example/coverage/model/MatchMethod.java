package com.example.coverage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Cascade stage that produced a verdict.
 */
public enum MatchMethod {
    RULE, PART_NUMBER, KEYWORD, LLM;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
