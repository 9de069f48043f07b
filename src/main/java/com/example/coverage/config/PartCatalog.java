package com.example.coverage.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Policy-independent part catalog. Part numbers are stored in normalized form.
 */
public record PartCatalog(
        @JsonProperty("by_part_number") Map<String, PartEntry> byPartNumber,
        @JsonProperty("by_keyword") List<PartKeyword> byKeyword
) {
    public PartCatalog {
        Map<String, PartEntry> normalized = new LinkedHashMap<>();
        if (byPartNumber != null) {
            byPartNumber.forEach((code, entry) -> normalized.put(normalizeCode(code), entry));
        }
        byPartNumber = java.util.Collections.unmodifiableMap(normalized);
        byKeyword = byKeyword == null ? List.of() : List.copyOf(byKeyword);
    }

    public static PartCatalog empty() {
        return new PartCatalog(null, null);
    }

    /** Strips spaces, dashes, dots and slashes and upper-cases the rest. */
    public static String normalizeCode(String code) {
        if (code == null) return "";
        return code.replaceAll("[\\s\\-./]", "").toUpperCase(Locale.ROOT);
    }

    /**
     * @param covered {@code false} marks an accessory that is never covered regardless of category
     */
    public record PartEntry(String component, String category, String description, Boolean covered, String note) {
    }

    public record PartKeyword(String keyword, String component, String category, String description) {
    }
}
