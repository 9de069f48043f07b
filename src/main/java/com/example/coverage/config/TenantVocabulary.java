package com.example.coverage.config;

/**
 * Everything the deterministic stages know about one tenant, plus the wording used to
 * explain denied items. {@code explanations} is the only optional section.
 */
public record TenantVocabulary(
        String version,
        ComponentVocabulary components,
        RuleSet rules,
        KeywordDictionary keywords,
        PartCatalog parts,
        ExplanationTemplates explanations
) {
    public TenantVocabulary {
        if (version == null || version.isBlank()) version = "unversioned";
        if (components == null) components = ComponentVocabulary.empty();
        if (rules == null) rules = RuleSet.empty();
        if (keywords == null) keywords = KeywordDictionary.empty();
        if (parts == null) parts = PartCatalog.empty();
        if (explanations == null) explanations = ExplanationTemplates.defaults();
    }

    /** Vocabulary that resolves nothing; every item falls through to the LLM stage or to review. */
    public static TenantVocabulary empty() {
        return new TenantVocabulary("empty", null, null, null, null, null);
    }
}
