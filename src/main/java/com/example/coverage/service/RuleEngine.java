package com.example.coverage.service;

import com.example.coverage.config.RuleSet;
import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.ExclusionReason;
import com.example.coverage.model.ItemType;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.MatchMethod;
import com.example.coverage.model.RepairContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Deterministic exclusions, confidence 1.0. Applied in order:
 * <ol>
 *   <li>fee items, plus any item type the tenant lists as a fee type</li>
 *   <li>exclusion patterns (any item type), then labor-only exclusion patterns</li>
 *   <li>consumable patterns (parts only), skipped when the repair context names a covered component</li>
 * </ol>
 * Patterns come from the tenant vocabulary and are matched against the normalized description.
 */
@Service
public class RuleEngine implements CoverageStrategy {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<String, Pattern> compiled = new ConcurrentHashMap<>();

    @Override
    public MatchMethod method() {
        return MatchMethod.RULE;
    }

    @Override
    public Optional<LineItemCoverage> evaluate(int index, LineItem item, ClaimContext context) {
        RuleSet rules = context.vocabulary().rules();

        if (isFee(item.itemType(), rules)) {
            return Optional.of(notCovered(index, item, ExclusionReason.FEE,
                    "Fee items (" + item.itemType().value() + ") are not covered"));
        }

        String normalized = TextNormalizer.normalize(item.description());

        Optional<RuleSet.PatternRule> exclusion = firstMatch(rules.exclusionPatterns(), normalized);
        if (exclusion.isPresent()) {
            return Optional.of(notCovered(index, item, ExclusionReason.EXCLUSION_PATTERN,
                    "Matches exclusion rule '" + exclusion.get().label() + "'"));
        }

        if (item.itemType() == ItemType.LABOR) {
            Optional<RuleSet.PatternRule> labor = firstMatch(rules.laborExclusionPatterns(), normalized);
            if (labor.isPresent()) {
                return Optional.of(notCovered(index, item, ExclusionReason.NON_COVERED_LABOR,
                        "Labor matches exclusion rule '" + labor.get().label() + "'"));
            }
        }

        if (item.itemType() == ItemType.PARTS) {
            Optional<RuleSet.PatternRule> consumable = firstMatch(rules.consumablePatterns(), normalized);
            if (consumable.isPresent()) {
                RepairContext repair = context.repairContext();
                if (repair.hasCoveredRepair()) {
                    log.info("Skipped consumable rule '{}' for '{}': repair context '{}' is covered",
                            consumable.get().label(), item.description(), repair.primaryComponent());
                } else {
                    return Optional.of(notCovered(index, item, ExclusionReason.CONSUMABLE,
                            "Consumable not covered: '" + consumable.get().label() + "'"));
                }
            }
        }
        return Optional.empty();
    }

    private boolean isFee(ItemType type, RuleSet rules) {
        if (type == ItemType.FEE) return true;
        for (String feeType : rules.feeItemTypes()) {
            if (feeType.equalsIgnoreCase(type.value()) || feeType.equalsIgnoreCase(type.name())) return true;
        }
        return false;
    }

    private Optional<RuleSet.PatternRule> firstMatch(List<RuleSet.PatternRule> rules, String normalized) {
        for (RuleSet.PatternRule rule : rules) {
            if (pattern(rule.pattern()).matcher(normalized).find()) {
                return Optional.of(rule);
            }
        }
        return Optional.empty();
    }

    private Pattern pattern(String regex) {
        return compiled.computeIfAbsent(regex,
                r -> Pattern.compile(r, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE));
    }

    private static LineItemCoverage notCovered(int index, LineItem item, ExclusionReason reason, String reasoning) {
        log.debug("Rule verdict for [{}] '{}': {}", index, item.description(), reasoning);
        return LineItemCoverage.of(index, item, CoverageStatus.NOT_COVERED, MatchMethod.RULE,
                null, null, 1.0, reasoning).withExclusionReason(reason);
    }
}
