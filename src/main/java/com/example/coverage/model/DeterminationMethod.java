package com.example.coverage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Tier that identified the primary repair of a claim.
 */
public enum DeterminationMethod {
    COVERED_ITEM, REPAIR_CONTEXT, LLM, NONE;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
