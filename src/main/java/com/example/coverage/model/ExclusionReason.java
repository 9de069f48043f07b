package com.example.coverage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Why an item is not paid. Set by the stage or resolver step that denied it and used to
 * group non-covered items for the adjuster.
 */
public enum ExclusionReason {
    FEE,
    EXCLUSION_PATTERN,
    CONSUMABLE,
    NON_COVERED_LABOR,
    COMPONENT_EXCLUDED,
    COMPONENT_NOT_IN_LIST,
    CATEGORY_NOT_COVERED,
    DEMOTED_NO_ANCHOR,
    LABOR_FOR_EXCLUDED_PART,
    NOMINAL_PRICE_LABOR,
    REVIEW_NEEDED,
    OTHER;

    /** Reasons that deny a part on policy grounds rather than for lack of a match. */
    public boolean isPolicyExclusion() {
        return this == COMPONENT_EXCLUDED || this == EXCLUSION_PATTERN || this == CONSUMABLE;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExclusionReason fromValue(String raw) {
        if (raw == null || raw.isBlank()) return null;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
