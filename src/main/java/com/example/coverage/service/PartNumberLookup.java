package com.example.coverage.service;

import com.example.coverage.config.PartCatalog;
import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.ExclusionReason;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.MatchMethod;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog lookup of an item's part number, confidence 0.95.
 * <p>
 * Lookup order: normalized part code, then a catalog keyword found in the description,
 * then a catalog keyword found in the part code itself. A hit on a component the policy
 * excludes is NOT_COVERED. Otherwise it is COVERED only when its category is covered and
 * the component is confirmed in that category's parts list.
 * Inconclusive hits are deferred with a {@link StageHint}.
 */
@Service
public class PartNumberLookup implements CoverageStrategy {

    private static final Logger log = LoggerFactory.getLogger(PartNumberLookup.class);

    static final double CONFIDENCE = 0.95;

    /** Categories whose coverage depends on the repair they support. */
    private static final Set<String> ANCILLARY_CATEGORIES = Set.of("labor", "consumables", "parts");

    enum Source { PART_NUMBER, DESCRIPTION_KEYWORD, CODE_KEYWORD }

    record Hit(String reference, String component, String category, String description,
               Boolean covered, String note, Source source) {
        boolean fromKeyword() {
            return source != Source.PART_NUMBER;
        }
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.PART_NUMBER;
    }

    @Override
    public Optional<LineItemCoverage> evaluate(int index, LineItem item, ClaimContext context) {
        Optional<Hit> found = lookup(item, context.vocabulary().parts());
        if (found.isEmpty()) {
            return Optional.empty();
        }
        Hit hit = found.get();
        PolicyMatcher matcher = context.policyMatcher();

        if (hit.fromKeyword()) {
            Optional<String> gasket = gasketIndicator(item.description(),
                    context.vocabulary().components().gasketIndicators());
            if (gasket.isPresent()) {
                log.info("Gasket/seal indicator '{}' in '{}': deferring catalog keyword match {}/{}",
                        gasket.get(), item.description(), hit.category(), hit.component());
                return defer(index, hit, context, "seal for the component, not the component itself");
            }
        }

        if (Boolean.FALSE.equals(hit.covered())) {
            return Optional.of(verdict(index, item, hit, CoverageStatus.NOT_COVERED, CONFIDENCE,
                    "Part " + hit.reference() + " is excluded: "
                            + (hit.note() != null ? hit.note() : hit.component()))
                    .withExclusionReason(ExclusionReason.COMPONENT_EXCLUDED));
        }

        if (matcher.isExcluded(hit.component(), hit.category(), item.description())) {
            log.info("Part {} ('{}') is explicitly excluded by the policy", hit.reference(), hit.component());
            return Optional.of(verdict(index, item, hit, CoverageStatus.NOT_COVERED, CONFIDENCE,
                    "Part " + hit.reference() + " ('" + label(hit) + "') is explicitly excluded by policy")
                    .withExclusionReason(ExclusionReason.COMPONENT_EXCLUDED));
        }

        boolean categoryCovered = matcher.isCategoryCovered(hit.category());
        if (!categoryCovered) {
            if (ANCILLARY_CATEGORIES.contains(hit.category().toLowerCase())) {
                return defer(index, hit, context, "ancillary category '" + hit.category() + "'");
            }
            return Optional.of(verdict(index, item, hit, CoverageStatus.NOT_COVERED, CONFIDENCE,
                    "Part " + hit.reference() + " is '" + hit.component() + "' in category '"
                            + hit.category() + "' which is not covered by this policy")
                    .withExclusionReason(ExclusionReason.CATEGORY_NOT_COVERED));
        }

        PolicyMatcher.ListCheck check = matcher.componentInPolicyList(
                hit.component(), hit.category(), item.description(), false);
        switch (check.status()) {
            case LISTED:
                return Optional.of(verdict(index, item, hit, CoverageStatus.COVERED, CONFIDENCE,
                        "Part " + hit.reference() + " identified as '" + label(hit) + "' in category '"
                                + hit.category() + "' (" + hit.source().name().toLowerCase() + "). "
                                + "Policy check: " + check.reason()));
            case UNLISTED:
                double confidence = context.thresholds().unlistedComponentConfidence();
                if (confidence < context.thresholds().partNumberMinConfidence()) {
                    log.info("Deferring {} ({}): component not in policy list, unlisted confidence {} below {}",
                            hit.reference(), hit.component(), confidence,
                            context.thresholds().partNumberMinConfidence());
                    return defer(index, hit, context, "component not in policy list");
                }
                return Optional.of(verdict(index, item, hit, CoverageStatus.NOT_COVERED, confidence,
                        "Part " + hit.reference() + " ('" + label(hit) + "'): component not in policy list. "
                                + check.reason())
                        .withExclusionReason(ExclusionReason.COMPONENT_NOT_IN_LIST));
            default:
                log.info("Deferring {} ({}): category '{}' covered but component unverifiable. {}",
                        hit.reference(), hit.component(), hit.category(), check.reason());
                return defer(index, hit, context, "component unverifiable against policy list");
        }
    }

    Optional<Hit> lookup(LineItem item, PartCatalog catalog) {
        if (item.partCode() != null) {
            PartCatalog.PartEntry entry = catalog.byPartNumber().get(PartCatalog.normalizeCode(item.partCode()));
            if (entry != null) {
                return Optional.of(new Hit(item.partCode(), entry.component(), entry.category(),
                        entry.description(), entry.covered(), entry.note(), Source.PART_NUMBER));
            }
        }
        Optional<Hit> byDescription = byKeyword(item.description(), item, catalog, Source.DESCRIPTION_KEYWORD);
        if (byDescription.isPresent() || item.partCode() == null) {
            return byDescription;
        }
        return byKeyword(item.partCode(), item, catalog, Source.CODE_KEYWORD);
    }

    private Optional<Hit> byKeyword(String text, LineItem item, PartCatalog catalog, Source source) {
        if (text == null || text.isBlank()) return Optional.empty();
        for (PartCatalog.PartKeyword keyword : catalog.byKeyword()) {
            if (TermMatcher.containsTerm(text, keyword.keyword())) {
                String reference = item.partCode() != null ? item.partCode() : keyword.keyword();
                return Optional.of(new Hit(reference, keyword.component(), keyword.category(),
                        keyword.description(), null, null, source));
            }
        }
        return Optional.empty();
    }

    private static Optional<String> gasketIndicator(String description, List<String> indicators) {
        for (String indicator : indicators) {
            if (TermMatcher.containsTerm(description, indicator)) return Optional.of(indicator);
        }
        return Optional.empty();
    }

    private Optional<LineItemCoverage> defer(int index, Hit hit, ClaimContext context, String note) {
        context.hint(index, new StageHint(hit.category(), label(hit), "part catalog", note));
        return Optional.empty();
    }

    private static LineItemCoverage verdict(int index, LineItem item, Hit hit, CoverageStatus status,
                                            double confidence, String reasoning) {
        log.debug("Part lookup [{}] {} -> {}/{} ({}, {})", index, hit.reference(), hit.category(),
                hit.component(), status, hit.source());
        return LineItemCoverage.of(index, item, status, MatchMethod.PART_NUMBER, hit.category(), hit.component(),
                confidence, reasoning);
    }

    private static String label(Hit hit) {
        return hit.description() != null ? hit.description() : hit.component();
    }
}
