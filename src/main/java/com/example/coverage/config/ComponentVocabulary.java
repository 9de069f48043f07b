package com.example.coverage.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Customer-specific component vocabulary used to compare line items against a policy's
 * covered-parts lists.
 *
 * @param componentSynonyms              component key to multilingual terms
 * @param categoryAliases                category to equivalent category names
 * @param repairContextKeywords          labor phrase to the component it names, tried in document order
 * @param distributionCatchAllComponents components implicitly covered by a catch-all policy entry
 * @param distributionCatchAllKeywords   policy-entry terms that act as a catch-all
 * @param genericLaborDescriptions       labor lines that name no component ("Arbeit", "main d'oeuvre")
 * @param gasketIndicators               terms marking an item as a seal for another component
 * @param ancillaryKeywords              small parts that follow a covered repair (screws, clips)
 */
public record ComponentVocabulary(
        @JsonProperty("component_synonyms") Map<String, List<String>> componentSynonyms,
        @JsonProperty("category_aliases") Map<String, List<String>> categoryAliases,
        @JsonProperty("repair_context_keywords") Map<String, RepairKeyword> repairContextKeywords,
        @JsonProperty("distribution_catch_all_components") List<String> distributionCatchAllComponents,
        @JsonProperty("distribution_catch_all_keywords") List<String> distributionCatchAllKeywords,
        @JsonProperty("generic_labor_descriptions") List<String> genericLaborDescriptions,
        @JsonProperty("gasket_indicators") List<String> gasketIndicators,
        @JsonProperty("ancillary_keywords") List<String> ancillaryKeywords
) {
    public ComponentVocabulary {
        componentSynonyms = ordered(componentSynonyms);
        categoryAliases = ordered(categoryAliases);
        repairContextKeywords = ordered(repairContextKeywords);
        distributionCatchAllComponents = distributionCatchAllComponents == null
                ? List.of() : List.copyOf(distributionCatchAllComponents);
        distributionCatchAllKeywords = distributionCatchAllKeywords == null
                ? List.of() : List.copyOf(distributionCatchAllKeywords);
        genericLaborDescriptions = genericLaborDescriptions == null ? List.of() : List.copyOf(genericLaborDescriptions);
        gasketIndicators = gasketIndicators == null ? List.of() : List.copyOf(gasketIndicators);
        ancillaryKeywords = ancillaryKeywords == null ? List.of() : List.copyOf(ancillaryKeywords);
    }

    private static <V> Map<String, V> ordered(Map<String, V> source) {
        if (source == null) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public static ComponentVocabulary empty() {
        return new ComponentVocabulary(null, null, null, null, null, null, null, null);
    }

    /** Synonyms for a component key, accepting either "egr_valve" or "egr valve". */
    public List<String> synonymsFor(String component) {
        if (component == null) return List.of();
        String key = component.toLowerCase().trim();
        List<String> found = componentSynonyms.get(key);
        if (found == null) found = componentSynonyms.get(key.replace(' ', '_'));
        if (found == null) found = componentSynonyms.get(key.replace('_', ' '));
        return found != null ? found : List.of();
    }

    public List<String> aliasesFor(String category) {
        if (category == null) return List.of();
        return categoryAliases.getOrDefault(category.toLowerCase().trim(), List.of());
    }

    public record RepairKeyword(String component, String category) {
    }
}
