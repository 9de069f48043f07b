package com.example.coverage.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Term dictionary for the keyword stage.
 *
 * @param mappings          term groups mapped to a component and category
 * @param contextRules      polysemous terms resolved by nearby words in the claim
 * @param sealIndicators    terms that mark an item as ancillary (gasket, seal, boot)
 * @param sealPenalty       multiplier applied when a seal indicator is present (default 0.7)
 * @param contextBoost      added when a mapping's context hint is present (default 0.05)
 * @param laborPenalty      multiplier for labor mapped to an uncovered category (default 0.9)
 * @param maxConfidence     ceiling after boosts (default 0.90)
 */
public record KeywordDictionary(
        List<KeywordMapping> mappings,
        @JsonProperty("context_rules") List<ContextRule> contextRules,
        @JsonProperty("seal_indicators") List<String> sealIndicators,
        @JsonProperty("seal_penalty") Double sealPenalty,
        @JsonProperty("context_boost") Double contextBoost,
        @JsonProperty("labor_penalty") Double laborPenalty,
        @JsonProperty("max_confidence") Double maxConfidence
) {
    public KeywordDictionary {
        mappings = mappings == null ? List.of() : List.copyOf(mappings);
        contextRules = contextRules == null ? List.of() : List.copyOf(contextRules);
        sealIndicators = sealIndicators == null ? List.of() : List.copyOf(sealIndicators);
        if (sealPenalty == null) sealPenalty = 0.7;
        if (contextBoost == null) contextBoost = 0.05;
        if (laborPenalty == null) laborPenalty = 0.9;
        if (maxConfidence == null) maxConfidence = 0.90;
    }

    public static KeywordDictionary empty() {
        return new KeywordDictionary(null, null, null, null, null, null, null);
    }

    public record KeywordMapping(
            String category,
            String component,
            List<String> keywords,
            @JsonProperty("context_hints") List<String> contextHints,
            Double confidence
    ) {
        public KeywordMapping {
            keywords = keywords == null ? List.of() : List.copyOf(keywords);
            contextHints = contextHints == null ? List.of() : List.copyOf(contextHints);
            if (confidence == null) confidence = 0.85;
        }
    }

    /**
     * A term whose category depends on its neighbours, e.g. "ventil" next to "hydraulik"
     * (chassis) or next to "motor" (engine). Preferences are tried in order.
     */
    public record ContextRule(String term, List<Preference> preferences) {
        public ContextRule {
            preferences = preferences == null ? List.of() : List.copyOf(preferences);
        }
    }

    public record Preference(List<String> near, String category, String component) {
        public Preference {
            near = near == null ? List.of() : List.copyOf(near);
        }
    }
}
