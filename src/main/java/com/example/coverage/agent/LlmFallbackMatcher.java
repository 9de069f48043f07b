package com.example.coverage.agent;

import com.example.coverage.config.CoverageProperties;
import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.ExclusionReason;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.LlmCoverageVerdict;
import com.example.coverage.model.MatchMethod;
import com.example.coverage.service.ClaimContext;
import com.example.coverage.service.CoverageStrategy;
import com.example.coverage.service.LlmCallContext;
import com.example.coverage.service.PolicyMatcher;
import com.example.coverage.service.StageHint;
import com.example.coverage.service.StructuredLlmClient;
import com.example.coverage.service.TermMatcher;
import com.example.coverage.service.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Last-resort classifier for items no deterministic stage resolved. One call per item.
 * <p>
 * Thresholds are asymmetric: a COVERED answer needs more confidence than a NOT_COVERED one.
 * Below the applicable threshold the item goes to review whatever the model said. The
 * answer is then checked against the policy lists. Failures never propagate: the item
 * becomes REVIEW_NEEDED with confidence 0.
 */
@Service
public class LlmFallbackMatcher implements CoverageStrategy {

    private static final Logger log = LoggerFactory.getLogger(LlmFallbackMatcher.class);

    static final double UNCOVERED_CATEGORY_REVIEW_CONFIDENCE = 0.45;
    static final double SYNONYM_OVERRIDE_CONFIDENCE = 0.75;
    private static final int MIN_OVERRIDE_SYNONYM_LENGTH = 4;

    private static final String SYSTEM_PROMPT = """
            You are a claims adjuster for a vehicle warranty insurer. You decide whether ONE line item
            of a repair cost estimate is covered by the customer's warranty policy.

            The estimate is usually written in German or French. Parts may be named by brand-specific
            catalog names, abbreviations or translations of the policy's component names.

            RULES:
            - covered = true ONLY if the item is, or is an integral part of, a component listed in the
              policy's covered components. Category membership alone is NOT enough.
            - Items in the excluded components are never covered.
            - Labor is covered only when it is performed on a covered component. Use the covered parts
              already identified in this claim and the repair context to decide.
            - Consumables (oils, filters, fluids), disposal, cleaning and rental cars are not covered.
            - category = the policy category the item belongs to (use the policy's category names).
            - matchedComponent = the policy component it corresponds to, or null.
            - confidence between 0.0 and 1.0. Use values below 0.6 when you are unsure.
            - reasoning = one or two sentences. Do not invent facts not present in the input.
            """;

    private final StructuredLlmClient llmClient;
    private final CoverageProperties.Thresholds thresholds;

    public LlmFallbackMatcher(StructuredLlmClient llmClient, CoverageProperties properties) {
        this.llmClient = llmClient;
        this.thresholds = properties.thresholds();
    }

    @Override
    public MatchMethod method() {
        return MatchMethod.LLM;
    }

    @Override
    public boolean remote() {
        return true;
    }

    @Override
    public Optional<LineItemCoverage> evaluate(int index, LineItem item, ClaimContext context) {
        return Optional.of(match(index, item, context));
    }

    /**
     * Classifies one item. Never throws.
     */
    public LineItemCoverage match(int index, LineItem item, ClaimContext context) {
        LlmCallContext callContext = LlmCallContext.forItem(context.claimId(), index, context.ledger());
        LlmCoverageVerdict verdict;
        try {
            verdict = llmClient.call(callContext, SYSTEM_PROMPT, userPrompt(index, item, context),
                    LlmCoverageVerdict.class);
        } catch (Exception e) {
            log.error("LlmFallbackMatcher: classification failed for [{}] '{}' (correlation {})",
                    index, item.description(), callContext.correlationId(), e);
            return failed(index, item, "LLM analysis failed: " + e.getMessage());
        }
        if (verdict == null || verdict.covered() == null) {
            log.warn("LlmFallbackMatcher: no verdict for [{}] '{}'", index, item.description());
            return failed(index, item, "LLM returned no coverage verdict");
        }
        LineItemCoverage thresholded = applyThresholds(index, item, verdict);
        return postValidate(thresholded, context);
    }

    LineItemCoverage applyThresholds(int index, LineItem item, LlmCoverageVerdict verdict) {
        double reported = verdict.confidence() != null ? verdict.confidence() : 0.0;
        double confidence = Math.min(reported, thresholds.llmMaxConfidence());
        boolean covered = verdict.covered();
        String reasoning = verdict.reasoning() != null ? verdict.reasoning() : "No reasoning provided";

        CoverageStatus status;
        if (covered && confidence >= thresholds.llmCoveredThreshold()) {
            status = CoverageStatus.COVERED;
        } else if (!covered && confidence >= thresholds.llmNotCoveredThreshold()) {
            status = CoverageStatus.NOT_COVERED;
        } else {
            status = CoverageStatus.REVIEW_NEEDED;
            reasoning = reasoning + " [REVIEW: model said " + (covered ? "covered" : "not covered")
                    + " at confidence " + confidence + ", below threshold]";
        }
        log.debug("LLM verdict [{}] '{}': covered={} conf={} -> {}", index, item.description(), covered,
                confidence, status);
        return LineItemCoverage.of(index, item, status, MatchMethod.LLM, verdict.category(),
                verdict.matchedComponent(), confidence, reasoning);
    }

    /**
     * Checks a model verdict against the explicit policy lists.
     */
    LineItemCoverage postValidate(LineItemCoverage item, ClaimContext context) {
        PolicyMatcher matcher = context.policyMatcher();

        if (matcher.isExcluded(item.matchedComponent(), null, item.description())) {
            if (isAncillaryToCoveredRepair(item, context)) {
                log.info("Skipping exclusion for '{}': ancillary to covered repair '{}'",
                        item.description(), context.repairContext().primaryComponent());
            } else if (item.coverageStatus() != CoverageStatus.NOT_COVERED) {
                log.info("LLM validation override: '{}' changed from {} to NOT_COVERED (in excluded list)",
                        item.description(), item.coverageStatus());
                return rebuild(item, context, CoverageStatus.NOT_COVERED, item.coverageCategory(),
                        item.matchedComponent(), item.matchConfidence(),
                        " [OVERRIDE: component is in excluded list]")
                        .withExclusionReason(ExclusionReason.COMPONENT_EXCLUDED);
            } else {
                return item.withExclusionReason(ExclusionReason.COMPONENT_EXCLUDED);
            }
        }

        if (item.coverageStatus() == CoverageStatus.NOT_COVERED && item.coverageCategory() != null
                && matcher.isCategoryCovered(item.coverageCategory())) {
            for (Map.Entry<String, List<String>> entry : matcher.vocabulary().componentSynonyms().entrySet()) {
                for (String synonym : entry.getValue()) {
                    if (TextNormalizer.normalize(synonym).length() < MIN_OVERRIDE_SYNONYM_LENGTH) continue;
                    if (!TermMatcher.containsTerm(item.description(), synonym)) continue;
                    PolicyMatcher.ListCheck check = matcher.componentInPolicyList(
                            entry.getKey(), item.coverageCategory(), item.description(), false);
                    if (check.listed()) {
                        log.info("Post-LLM synonym override: '{}' NOT_COVERED -> COVERED ('{}' -> '{}', {})",
                                item.description(), synonym, entry.getKey(), check.reason());
                        return rebuild(item, context, CoverageStatus.COVERED, item.coverageCategory(), entry.getKey(),
                                Math.max(item.matchConfidence(), SYNONYM_OVERRIDE_CONFIDENCE),
                                " [SYNONYM OVERRIDE: matches '" + synonym + "' -> '" + entry.getKey()
                                        + "', confirmed in policy: " + check.reason() + "]");
                    }
                }
            }
        }

        if (item.coverageStatus() == CoverageStatus.COVERED && !matcher.isCategoryCovered(item.coverageCategory())) {
            log.info("LLM validation override: '{}' changed from COVERED to REVIEW_NEEDED (category '{}' not covered)",
                    item.description(), item.coverageCategory());
            return rebuild(item, context, CoverageStatus.REVIEW_NEEDED, item.coverageCategory(), item.matchedComponent(),
                    UNCOVERED_CATEGORY_REVIEW_CONFIDENCE,
                    " [REVIEW: category '" + item.coverageCategory() + "' is not covered by policy]")
                    .withExclusionReason(ExclusionReason.CATEGORY_NOT_COVERED);
        }
        return item;
    }

    private boolean isAncillaryToCoveredRepair(LineItemCoverage item, ClaimContext context) {
        if (!context.repairContext().hasCoveredRepair()) return false;
        return context.vocabulary().components().ancillaryKeywords().stream()
                .anyMatch(keyword -> TermMatcher.containsTerm(item.description(), keyword));
    }

    private static LineItemCoverage rebuild(LineItemCoverage item, ClaimContext context, CoverageStatus status,
                                            String category, String component, double confidence, String tag) {
        LineItem source = context.items().get(item.index());
        return LineItemCoverage.of(item.index(), source, status, MatchMethod.LLM, category, component, confidence,
                item.matchReasoning() + tag);
    }

    private static LineItemCoverage failed(int index, LineItem item, String reasoning) {
        return LineItemCoverage.of(index, item, CoverageStatus.REVIEW_NEEDED, MatchMethod.LLM,
                null, null, 0.0, reasoning);
    }

    private String userPrompt(int index, LineItem item, ClaimContext context) {
        String coveredParts = context.coveredParts().stream()
                .map(p -> "  - " + p.description()
                        + (p.partCode() != null ? " (" + p.partCode() + ")" : "")
                        + (p.matchedComponent() != null ? " -> " + p.matchedComponent() : ""))
                .collect(Collectors.joining("\n"));
        String repairContext = context.repairContext().isPresent()
                ? context.repairContext().sourceDescription()
                : "(none)";
        String hint = context.hintFor(index).map(StageHint::describe).orElse("(none)");

        return """
                LINE ITEM:
                  description: %s
                  type: %s
                  price: %s
                  part code: %s

                COVERED COMPONENTS (by category):
                %s

                EXCLUDED COMPONENTS (by category):
                %s

                COVERED PARTS ALREADY IDENTIFIED IN THIS CLAIM:
                %s

                REPAIR CONTEXT: %s
                PRE-IDENTIFICATION: %s

                Decide whether this line item is covered. Return covered, category, matchedComponent,
                confidence and reasoning.
                """.formatted(
                item.description(), item.itemType().value(), item.totalPrice().toPlainString(),
                item.partCode() != null ? item.partCode() : "(none)",
                PromptFormatting.componentLists(context.policy().coveredComponents()),
                PromptFormatting.componentLists(context.policy().excludedComponents()),
                coveredParts.isEmpty() ? "  (none)" : coveredParts,
                repairContext, hint);
    }
}
