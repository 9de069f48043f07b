package com.example.coverage.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Stream;

/**
 * Deterministic exclusion rules. Patterns are case-insensitive regular expressions evaluated
 * against the normalized description, so umlauts and accents are already folded.
 *
 * @param feeItemTypes             item types denied like fees; fee items are always denied
 * @param exclusionPatterns        always-excluded services (disposal, cleaning, rental car)
 * @param laborExclusionPatterns   labor-only exclusions (diagnosis-only, calibration-only)
 * @param consumablePatterns       parts that are consumables (oils, filters, wear parts)
 */
public record RuleSet(
        @JsonProperty("fee_item_types") List<String> feeItemTypes,
        @JsonProperty("exclusion_patterns") List<PatternRule> exclusionPatterns,
        @JsonProperty("labor_exclusion_patterns") List<PatternRule> laborExclusionPatterns,
        @JsonProperty("consumable_patterns") List<PatternRule> consumablePatterns
) {
    public RuleSet {
        feeItemTypes = feeItemTypes == null ? List.of() : List.copyOf(feeItemTypes);
        exclusionPatterns = exclusionPatterns == null ? List.of() : List.copyOf(exclusionPatterns);
        laborExclusionPatterns = laborExclusionPatterns == null ? List.of() : List.copyOf(laborExclusionPatterns);
        consumablePatterns = consumablePatterns == null ? List.of() : List.copyOf(consumablePatterns);
    }

    public static RuleSet empty() {
        return new RuleSet(null, null, null, null);
    }

    public Stream<PatternRule> allPatterns() {
        return Stream.of(exclusionPatterns, laborExclusionPatterns, consumablePatterns).flatMap(List::stream);
    }

    /**
     * @param pattern regular expression
     * @param label   short name reported in the verdict reasoning
     */
    public record PatternRule(String pattern, String label) {
        public PatternRule {
            if (label == null || label.isBlank()) label = pattern;
        }
    }
}
