package com.example.coverage.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Adjuster-facing wording for non-covered items, keyed by exclusion reason value
 * ({@code fee}, {@code component_excluded}, ...). Templates may use {@code {category}};
 * the summary template may use {@code {count}}, {@code {currency}}, {@code {total}} and
 * {@code {reasons_list}}. Tenant templates override the built-in English ones per reason.
 *
 * @param templates               explanation and policy reference per reason
 * @param categoryTemplates       per-category wording, preferred over the reason template
 * @param categorySubgroupReasons reasons whose items are grouped per category as well
 * @param summaryTemplate         one-line summary over all groups
 * @param currency                currency code used in the summary (default CHF)
 */
public record ExplanationTemplates(
        Map<String, Template> templates,
        @JsonProperty("category_templates") Map<String, Template> categoryTemplates,
        @JsonProperty("category_subgroup_reasons") List<String> categorySubgroupReasons,
        @JsonProperty("summary_template") String summaryTemplate,
        String currency
) {
    static final String DEFAULT_SUMMARY = "{count} item(s) ({currency} {total}) are not covered. {reasons_list}";

    static final Map<String, Template> DEFAULT_TEMPLATES = builtInTemplates();

    public ExplanationTemplates {
        Map<String, Template> merged = new LinkedHashMap<>(DEFAULT_TEMPLATES);
        if (templates != null) merged.putAll(templates);
        templates = Map.copyOf(merged);
        categoryTemplates = categoryTemplates == null ? Map.of() : Map.copyOf(categoryTemplates);
        categorySubgroupReasons = categorySubgroupReasons == null
                ? List.of("category_not_covered", "component_not_in_list", "component_excluded")
                : List.copyOf(categorySubgroupReasons);
        if (summaryTemplate == null || summaryTemplate.isBlank()) summaryTemplate = DEFAULT_SUMMARY;
        if (currency == null || currency.isBlank()) currency = "CHF";
    }

    public static ExplanationTemplates defaults() {
        return new ExplanationTemplates(null, null, null, null, null);
    }

    public record Template(String explanation, @JsonProperty("policy_reference") String policyReference) {
    }

    private static Map<String, Template> builtInTemplates() {
        Map<String, Template> templates = new LinkedHashMap<>();
        templates.put("fee", new Template("Fee items are not covered by the policy.", null));
        templates.put("consumable", new Template("Consumable items are not covered.", null));
        templates.put("exclusion_pattern", new Template("Items matching standard exclusion patterns.", null));
        templates.put("non_covered_labor", new Template("Diagnostic/investigative labor is not covered.", null));
        templates.put("component_excluded", new Template("Component is on the policy exclusion list.", null));
        templates.put("component_not_in_list", new Template(
                "Component is not in the policy's exhaustive parts list for category '{category}'.", null));
        templates.put("category_not_covered", new Template("Category '{category}' is not covered by the policy.", null));
        templates.put("demoted_no_anchor", new Template("Labor not covered: no covered parts to anchor this work.", null));
        templates.put("labor_for_excluded_part", new Template(
                "Labor not covered: it serves a part the policy excludes.", null));
        templates.put("nominal_price_labor", new Template(
                "Labor billed at a nominal price per operation; hours and rate are needed before payment.", null));
        return Map.copyOf(templates);
    }
}
