package com.example.coverage.service;

import com.example.coverage.config.ExplanationTemplates;
import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.ExclusionReason;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.NonCoveredExplanation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Groups unpaid items (NOT_COVERED and REVIEW_NEEDED) by exclusion reason and fills the
 * tenant's templates. Deterministic: no LLM call is made here.
 * <p>
 * Reasons listed as category subgroups are split per category. Groups are ordered by
 * total amount, largest first.
 */
@Service
public class ExplanationGenerator {

    private static final Logger log = LoggerFactory.getLogger(ExplanationGenerator.class);

    public record Explanations(List<NonCoveredExplanation> groups, String summary) {
        public Explanations {
            groups = List.copyOf(groups);
        }

        public static Explanations none() {
            return new Explanations(List.of(), "");
        }
    }

    private record GroupKey(ExclusionReason reason, String category) {
    }

    public Explanations generate(List<LineItemCoverage> items, ExplanationTemplates templates) {
        List<LineItemCoverage> unpaid = items.stream()
                .filter(i -> i.coverageStatus() != CoverageStatus.COVERED)
                .toList();
        if (unpaid.isEmpty()) {
            return Explanations.none();
        }

        Map<GroupKey, List<LineItemCoverage>> groups = new LinkedHashMap<>();
        for (LineItemCoverage item : unpaid) {
            ExclusionReason reason = reasonOf(item);
            String category = templates.categorySubgroupReasons().contains(reason.value())
                    ? item.coverageCategory()
                    : null;
            groups.computeIfAbsent(new GroupKey(reason, category), k -> new ArrayList<>()).add(item);
        }

        List<NonCoveredExplanation> explanations = new ArrayList<>();
        groups.forEach((key, members) -> {
            BigDecimal total = members.stream()
                    .map(LineItemCoverage::notCoveredAmount)
                    .reduce(BigDecimal.ZERO, BigDecimal::add)
                    .setScale(2, RoundingMode.HALF_UP);
            double minConfidence = members.stream().mapToDouble(LineItemCoverage::matchConfidence).min().orElse(0.0);
            ExplanationTemplates.Template template = templateFor(key, templates);
            String text = template != null && template.explanation() != null
                    ? template.explanation().replace("{category}", key.category() != null ? key.category() : "")
                    : members.get(0).matchReasoning();
            explanations.add(new NonCoveredExplanation(
                    key.reason(),
                    members.stream().map(LineItemCoverage::description).toList(),
                    members.stream().map(LineItemCoverage::partCode).collect(Collectors.toList()),
                    key.category(),
                    total,
                    text,
                    policyReference(key, templates),
                    minConfidence));
        });
        explanations.sort(Comparator.comparing(NonCoveredExplanation::totalAmount).reversed());

        BigDecimal total = explanations.stream()
                .map(NonCoveredExplanation::totalAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
        String reasons = explanations.stream()
                .map(e -> e.exclusionReason().value())
                .distinct()
                .sorted()
                .collect(Collectors.joining(", "));
        String summary = templates.summaryTemplate()
                .replace("{count}", String.valueOf(unpaid.size()))
                .replace("{currency}", templates.currency())
                .replace("{total}", total.toPlainString())
                .replace("{reasons_list}", reasons);
        log.debug("{} unpaid items in {} explanation groups", unpaid.size(), explanations.size());
        return new Explanations(explanations, summary);
    }

    static ExclusionReason reasonOf(LineItemCoverage item) {
        if (item.exclusionReason() != null) return item.exclusionReason();
        return item.coverageStatus() == CoverageStatus.REVIEW_NEEDED
                ? ExclusionReason.REVIEW_NEEDED
                : ExclusionReason.OTHER;
    }

    private static ExplanationTemplates.Template templateFor(GroupKey key, ExplanationTemplates templates) {
        if (key.category() != null) {
            ExplanationTemplates.Template byCategory = templates.categoryTemplates().get(key.category());
            if (byCategory != null && byCategory.explanation() != null) return byCategory;
        }
        return templates.templates().get(key.reason().value());
    }

    private static String policyReference(GroupKey key, ExplanationTemplates templates) {
        if (key.category() != null) {
            ExplanationTemplates.Template byCategory = templates.categoryTemplates().get(key.category());
            if (byCategory != null && byCategory.policyReference() != null) return byCategory.policyReference();
        }
        ExplanationTemplates.Template byReason = templates.templates().get(key.reason().value());
        return byReason != null ? byReason.policyReference() : null;
    }
}
