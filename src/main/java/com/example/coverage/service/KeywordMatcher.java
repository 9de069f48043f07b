package com.example.coverage.service;

import com.example.coverage.config.KeywordDictionary;
import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.ExclusionReason;
import com.example.coverage.model.ItemType;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.MatchMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Multilingual term dictionary matcher, confidence 0.70 to 0.90.
 * <p>
 * The best dictionary hit for the description decides the component and category.
 * Polysemous terms are resolved by context rules that look at the item's own description
 * first and then at the rest of the claim. Seal indicators and labor for uncovered
 * categories lower the confidence. When the category is not covered, the component is
 * searched in the other covered categories' parts lists, with the short-token guard on
 * both sides. A component the policy excludes is NOT_COVERED whatever its category.
 * Verdicts below the acceptance threshold, and COVERED verdicts the policy list
 * contradicts, are left to the next stage.
 */
@Service
public class KeywordMatcher implements CoverageStrategy {

    private static final Logger log = LoggerFactory.getLogger(KeywordMatcher.class);

    /** Confidence of a context-rule resolution when the deciding word is in the item itself. */
    static final double CONTEXT_RULE_OWN = 0.85;
    /** Confidence when the deciding word only appears elsewhere in the claim. */
    static final double CONTEXT_RULE_NEIGHBOUR = 0.80;

    /**
     * Raw dictionary decision for one description, before policy verification.
     */
    public record KeywordMatch(String term, String category, String component, double confidence,
                               CoverageStatus status, String reasoning) {
    }

    private record Candidate(String term, String category, String component, double confidence) {
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.KEYWORD;
    }

    @Override
    public Optional<LineItemCoverage> evaluate(int index, LineItem item, ClaimContext context) {
        Optional<KeywordMatch> found = match(item, context);
        if (found.isEmpty()) {
            return Optional.empty();
        }
        KeywordMatch match = found.get();
        double threshold = context.thresholds().keywordMinConfidence();
        if (match.confidence() < threshold) {
            log.debug("Keyword match for [{}] '{}' below threshold ({} < {}), escalating",
                    index, item.description(), round(match.confidence()), threshold);
            context.hint(index, new StageHint(match.category(), match.component(), "keyword dictionary",
                    "confidence " + round(match.confidence())));
            return Optional.empty();
        }

        if (context.policyMatcher().isExcluded(match.component(), match.category(), item.description())) {
            log.info("Keyword match '{}' ({}) is an excluded component", item.description(), match.component());
            return Optional.of(LineItemCoverage.of(index, item, CoverageStatus.NOT_COVERED, MatchMethod.KEYWORD,
                            match.category(), match.component(), match.confidence(),
                            "Keyword '" + match.term() + "' maps to '" + match.component()
                                    + "', which is explicitly excluded by policy")
                    .withExclusionReason(ExclusionReason.COMPONENT_EXCLUDED));
        }

        String reasoning = match.reasoning();
        if (match.status() == CoverageStatus.COVERED) {
            PolicyMatcher.ListCheck check = context.policyMatcher().componentInPolicyList(
                    match.component(), match.category(), item.description(), false);
            if (check.status() == PolicyMatcher.ListStatus.UNLISTED) {
                log.info("Keyword match '{}' ({}) escalated: {}", item.description(), match.component(), check.reason());
                context.hint(index, new StageHint(match.category(), match.component(), "keyword dictionary",
                        "not confirmed in policy list"));
                return Optional.empty();
            }
            if (check.status() == PolicyMatcher.ListStatus.UNKNOWN && match.component() == null) {
                log.info("Keyword match '{}' (no component) escalated: {}", item.description(), check.reason());
                context.hint(index, new StageHint(match.category(), null, "keyword dictionary",
                        "category-level match only"));
                return Optional.empty();
            }
            if (check.listed()) {
                reasoning = reasoning + ". Policy check: " + check.reason();
            }
        }

        return Optional.of(LineItemCoverage.of(index, item, match.status(), MatchMethod.KEYWORD,
                        match.category(), match.component(), match.confidence(), reasoning)
                .withExclusionReason(ExclusionReason.CATEGORY_NOT_COVERED));
    }

    /**
     * Dictionary decision for an item, without threshold or policy-list verification.
     */
    public Optional<KeywordMatch> match(LineItem item, ClaimContext context) {
        KeywordDictionary dictionary = context.vocabulary().keywords();
        String description = item.description();
        if (TextNormalizer.normalize(description).isEmpty()) {
            return Optional.empty();
        }

        List<Candidate> candidates = new ArrayList<>();
        for (KeywordDictionary.KeywordMapping mapping : dictionary.mappings()) {
            for (String keyword : mapping.keywords()) {
                if (!TermMatcher.containsTerm(description, keyword)) continue;
                double confidence = mapping.confidence();
                for (String hint : mapping.contextHints()) {
                    if (TermMatcher.containsTerm(description, hint)) {
                        confidence = Math.min(dictionary.maxConfidence(), confidence + dictionary.contextBoost());
                        break;
                    }
                }
                candidates.add(new Candidate(keyword, mapping.category(), mapping.component(), confidence));
            }
        }
        contextRuleCandidate(description, context, dictionary).ifPresent(candidates::add);

        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        Candidate best = candidates.stream()
                .max(Comparator.comparingDouble(Candidate::confidence)
                        .thenComparingInt(c -> TextNormalizer.normalize(c.term()).length()))
                .orElseThrow();

        double confidence = best.confidence();
        StringBuilder notes = new StringBuilder();
        for (String indicator : dictionary.sealIndicators()) {
            if (TermMatcher.containsTerm(description, indicator)) {
                confidence *= dictionary.sealPenalty();
                notes.append("; seal indicator '").append(indicator).append("'");
                break;
            }
        }

        PolicyMatcher matcher = context.policyMatcher();
        String category = best.category();
        boolean covered = matcher.isCategoryCovered(category);
        if (!covered) {
            Optional<String> other = matcher.findListingInOtherCategory(best.component(), category, description);
            if (other.isPresent()) {
                notes.append("; listed under covered category '").append(other.get())
                        .append("' instead of '").append(category).append("'");
                category = other.get();
                covered = true;
            }
        }

        if (item.itemType() == ItemType.LABOR && !covered) {
            confidence *= dictionary.laborPenalty();
        }

        String reasoning = covered
                ? "Keyword '" + best.term() + "' maps to covered category '" + category + "'"
                : "Keyword '" + best.term() + "' maps to category '" + category + "' which is not covered";
        return Optional.of(new KeywordMatch(best.term(), category, best.component(), confidence,
                covered ? CoverageStatus.COVERED : CoverageStatus.NOT_COVERED, reasoning + notes));
    }

    private Optional<Candidate> contextRuleCandidate(String description, ClaimContext context,
                                                     KeywordDictionary dictionary) {
        for (KeywordDictionary.ContextRule rule : dictionary.contextRules()) {
            if (!TermMatcher.containsTerm(description, rule.term())) continue;
            for (KeywordDictionary.Preference preference : rule.preferences()) {
                if (preference.near().stream().anyMatch(word -> TermMatcher.containsTerm(description, word))) {
                    return Optional.of(new Candidate(rule.term(), preference.category(), preference.component(),
                            CONTEXT_RULE_OWN));
                }
            }
            for (KeywordDictionary.Preference preference : rule.preferences()) {
                if (preference.near().stream().anyMatch(word -> TermMatcher.containsTerm(context.claimText(), word))) {
                    return Optional.of(new Candidate(rule.term(), preference.category(), preference.component(),
                            CONTEXT_RULE_NEIGHBOUR));
                }
            }
        }
        return Optional.empty();
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
