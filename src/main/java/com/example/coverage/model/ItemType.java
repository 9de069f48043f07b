package com.example.coverage.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kind of line item on a repair cost estimate.
 * Accepts the German and French spellings that extraction produces.
 */
public enum ItemType {
    PARTS, LABOR, FEE;

    @JsonCreator
    public static ItemType fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Item type is required");
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "parts", "part", "piece", "pièce", "teile", "ersatzteil" -> PARTS;
            case "labor", "labour", "arbeit", "main d'oeuvre", "main d'œuvre", "travail" -> LABOR;
            case "fee", "fees", "gebühr", "gebuehr", "frais" -> FEE;
            default -> throw new IllegalArgumentException("Unknown item type: " + raw);
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
