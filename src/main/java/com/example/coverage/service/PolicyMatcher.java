package com.example.coverage.service;

import com.example.coverage.config.ComponentVocabulary;
import com.example.coverage.model.PolicyContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Checks components and categories against one claim's policy lists, using the tenant's
 * synonyms and category aliases. All term comparisons go through {@link TermMatcher}.
 */
public class PolicyMatcher {

    private static final Logger log = LoggerFactory.getLogger(PolicyMatcher.class);

    public enum ListStatus {
        /** Confirmed in the policy's covered-parts list. */
        LISTED,
        /** Synonyms are known and none of them is in the list. */
        UNLISTED,
        /** Cannot tell: no parts list for the category or no synonyms for the component. */
        UNKNOWN
    }

    public record ListCheck(ListStatus status, String reason) {
        public boolean listed() {
            return status == ListStatus.LISTED;
        }
    }

    private final PolicyContext policy;
    private final ComponentVocabulary vocabulary;

    public PolicyMatcher(PolicyContext policy, ComponentVocabulary vocabulary) {
        this.policy = policy;
        this.vocabulary = vocabulary;
    }

    public PolicyContext policy() {
        return policy;
    }

    public ComponentVocabulary vocabulary() {
        return vocabulary;
    }

    /**
     * Whether the category, or one of its aliases, is among the policy's covered categories.
     */
    public boolean isCategoryCovered(String category) {
        if (category == null || category.isBlank()) return false;
        for (String name : searchNames(category)) {
            for (String covered : policy.coveredCategories()) {
                if (TermMatcher.isMatch(name, covered)) return true;
            }
        }
        return false;
    }

    /**
     * Covered parts listed for the category (or the first alias that has a list).
     */
    public Optional<Map.Entry<String, List<String>>> coveredPartsFor(String category) {
        return partsFor(category, policy.coveredComponents());
    }

    /**
     * Tri-state check of a component against the category's covered-parts list.
     *
     * @param strict report {@link ListStatus#UNLISTED} instead of UNKNOWN when the component has no synonyms
     */
    public ListCheck componentInPolicyList(String component, String category, String description, boolean strict) {
        if (category == null || category.isBlank()) {
            return new ListCheck(ListStatus.UNKNOWN, "No category to verify");
        }
        Optional<Map.Entry<String, List<String>>> listing = coveredPartsFor(category);
        if (listing.isEmpty() || listing.get().getValue().isEmpty()) {
            return new ListCheck(ListStatus.UNKNOWN, "No parts list for category '" + category + "'");
        }
        String listedCategory = listing.get().getKey();
        List<String> parts = listing.get().getValue();

        if (component == null || component.isBlank()) {
            return descriptionNamesPart(description, parts)
                    .map(part -> new ListCheck(ListStatus.LISTED, "Description contains policy part '" + part + "'"))
                    .orElseGet(() -> new ListCheck(ListStatus.UNKNOWN,
                            "No component and description names none of " + parts.size()
                                    + " policy parts for '" + category + "'"));
        }

        for (String part : parts) {
            if (TermMatcher.isMatch(component, part)) {
                return new ListCheck(ListStatus.LISTED, "Component '" + component + "' listed as '" + part + "'");
            }
        }

        List<String> synonyms = vocabulary.synonymsFor(component);
        for (String synonym : synonyms) {
            for (String part : parts) {
                if (TermMatcher.isMatch(synonym, part)) {
                    return new ListCheck(ListStatus.LISTED,
                            "Component '" + component + "' listed as '" + part + "' (synonym '" + synonym + "')");
                }
            }
        }

        if (isDistributionCatchAll(component)) {
            for (String part : parts) {
                for (String keyword : vocabulary.distributionCatchAllKeywords()) {
                    if (TermMatcher.containsTerm(part, keyword)) {
                        return new ListCheck(ListStatus.LISTED,
                                "Component '" + component + "' covered by catch-all entry '" + part + "'");
                    }
                }
            }
        }

        Optional<String> inDescription = descriptionNamesPart(description, parts);
        if (inDescription.isPresent()) {
            return new ListCheck(ListStatus.LISTED, "Description contains policy part '" + inDescription.get() + "'");
        }

        if (synonyms.isEmpty()) {
            if (strict) {
                return new ListCheck(ListStatus.UNLISTED, "No synonyms for component '" + component + "'");
            }
            log.debug("No synonyms for '{}' in '{}', list membership unknown", component, category);
            return new ListCheck(ListStatus.UNKNOWN, "No synonyms for component '" + component + "'");
        }
        return new ListCheck(ListStatus.UNLISTED, "Component '" + component + "' not in policy's "
                + listedCategory + " list (" + parts.size() + " parts)");
    }

    /**
     * Covered categories, other than {@code excludeCategory}, whose parts list confirms the
     * component or is named by the description. The first hit wins.
     */
    public Optional<String> findListingInOtherCategory(String component, String excludeCategory, String description) {
        for (String category : policy.coveredCategories()) {
            if (excludeCategory != null && TermMatcher.isMatch(category, excludeCategory)) continue;
            ListCheck check = componentInPolicyList(component, category, description, true);
            if (check.listed()) {
                log.debug("Cross-category listing for '{}': {} ({})", component, category, check.reason());
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    /**
     * Whether the component or description is on the policy's exclusion list. A {@code null}
     * category searches every excluded category.
     */
    public boolean isExcluded(String component, String category, String description) {
        if (policy.excludedComponents().isEmpty()) return false;

        List<String> excluded = new ArrayList<>();
        if (category == null || category.isBlank()) {
            policy.excludedComponents().values().forEach(excluded::addAll);
        } else {
            for (String name : searchNames(category)) {
                policy.excludedComponents().forEach((cat, parts) -> {
                    if (TermMatcher.isMatch(name, cat)) excluded.addAll(parts);
                });
            }
        }
        if (excluded.isEmpty()) return false;

        List<String> terms = new ArrayList<>();
        if (component != null && !component.isBlank()) {
            terms.add(component);
            terms.addAll(vocabulary.synonymsFor(component));
        }
        for (String term : terms) {
            for (String exclusion : excluded) {
                if (TermMatcher.isMatch(term, exclusion)) return true;
            }
        }
        if (description != null && !description.isBlank()) {
            for (String exclusion : excluded) {
                if (TermMatcher.containsTerm(description, exclusion) || TermMatcher.isMatch(description, exclusion)) {
                    return true;
                }
            }
        }
        return false;
    }

    private Optional<Map.Entry<String, List<String>>> partsFor(String category, Map<String, List<String>> lists) {
        for (String name : searchNames(category)) {
            for (Map.Entry<String, List<String>> entry : lists.entrySet()) {
                if (TermMatcher.isMatch(name, entry.getKey()) && !entry.getValue().isEmpty()) {
                    return Optional.of(entry);
                }
            }
        }
        return Optional.empty();
    }

    private List<String> searchNames(String category) {
        List<String> names = new ArrayList<>();
        names.add(category);
        names.addAll(vocabulary.aliasesFor(category));
        return names;
    }

    private boolean isDistributionCatchAll(String component) {
        for (String candidate : vocabulary.distributionCatchAllComponents()) {
            if (TextNormalizer.normalize(candidate).equals(TextNormalizer.normalize(component))) return true;
        }
        return false;
    }

    private static Optional<String> descriptionNamesPart(String description, List<String> parts) {
        if (description == null || description.isBlank()) return Optional.empty();
        for (String part : parts) {
            if (TermMatcher.containsTerm(description, part)) return Optional.of(part);
        }
        return Optional.empty();
    }
}
