package com.example.coverage.agent;

import com.example.coverage.config.CoverageProperties;
import com.example.coverage.model.DeterminationMethod;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.PrimaryRepairResponse;
import com.example.coverage.model.PrimaryRepairResult;
import com.example.coverage.service.ClaimContext;
import com.example.coverage.service.LlmCallContext;
import com.example.coverage.service.PolicyMatcher;
import com.example.coverage.service.StructuredLlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Names the primary repaired component of a claim when no deterministic tier could.
 * One call per claim, run after all item-level calls have finished.
 * <p>
 * The model's answer is never trusted for coverage: the returned component is checked
 * against the policy lists and {@code isCovered} is derived from that check.
 */
@Service
public class PrimaryRepairAgent {

    private static final Logger log = LoggerFactory.getLogger(PrimaryRepairAgent.class);

    private static final String SYSTEM_PROMPT = """
            You are a senior claims adjuster for a vehicle warranty insurer.

            TASK:
            Given every line item of a repair cost estimate, identify the PRIMARY repair: the single
            component whose failure is the reason the vehicle is in the workshop. Other items are
            usually labor, fasteners, seals, fluids or ancillary parts for that repair.

            RULES:
            - primaryItemIndex: index of the line item that best represents the primary repair
              (prefer the part over its labor). null if no item represents it.
            - component: the failed component, using the policy's wording when one fits.
            - category: the policy category the component belongs to.
            - confidence between 0.0 and 1.0.
            - reasoning: one or two sentences.
            - Do NOT decide coverage. Do NOT invent items that are not in the estimate.
            """;

    private final StructuredLlmClient llmClient;
    private final CoverageProperties.Thresholds thresholds;

    public PrimaryRepairAgent(StructuredLlmClient llmClient, CoverageProperties properties) {
        this.llmClient = llmClient;
        this.thresholds = properties.thresholds();
    }

    /**
     * @return the arbitrated primary repair, or empty when the call fails or the answer is unusable
     */
    public Optional<PrimaryRepairResult> determine(List<LineItemCoverage> items, ClaimContext context) {
        if (items.isEmpty()) return Optional.empty();

        LlmCallContext callContext = LlmCallContext.forClaim(context.claimId(), LlmCallContext.PRIMARY_REPAIR,
                context.ledger());
        PrimaryRepairResponse response;
        try {
            response = llmClient.call(callContext, SYSTEM_PROMPT, userPrompt(items, context),
                    PrimaryRepairResponse.class);
        } catch (Exception e) {
            log.error("PrimaryRepairAgent: arbitration failed for claim {} (correlation {})",
                    context.claimId(), callContext.correlationId(), e);
            return Optional.empty();
        }
        if (response == null || response.component() == null || response.component().isBlank()) {
            log.warn("PrimaryRepairAgent: no component named for claim {}", context.claimId());
            return Optional.empty();
        }

        Integer index = response.primaryItemIndex();
        LineItemCoverage source = null;
        if (index != null) {
            if (index < 0 || index >= items.size()) {
                log.warn("PrimaryRepairAgent: index {} out of range for claim {} ({} items), ignoring index",
                        index, context.claimId(), items.size());
                index = null;
            } else {
                source = items.get(index);
            }
        }

        String category = response.category() != null ? response.category()
                : source != null ? source.coverageCategory() : null;
        String description = source != null ? source.description() : null;
        Boolean covered = coverageOf(response.component(), category, description, context.policyMatcher());
        double confidence = Math.min(response.confidence() != null ? response.confidence() : 0.0,
                thresholds.llmMaxConfidence());

        log.info("PrimaryRepairAgent: '{}' in '{}' (index {}, covered={}, confidence {})",
                response.component(), category, index, covered, confidence);
        return Optional.of(new PrimaryRepairResult(response.component(), category, description, covered, confidence,
                DeterminationMethod.LLM, index, false,
                response.reasoning() != null ? response.reasoning() : "Identified by LLM arbitration"));
    }

    /**
     * TRUE when listed, FALSE when the category is uncovered, excluded or the component is
     * confirmed missing from the list, {@code null} when the list cannot tell.
     */
    static Boolean coverageOf(String component, String category, String description, PolicyMatcher matcher) {
        if (category == null || !matcher.isCategoryCovered(category)) return Boolean.FALSE;
        if (matcher.isExcluded(component, category, description)) return Boolean.FALSE;
        PolicyMatcher.ListCheck check = matcher.componentInPolicyList(component, category, description, false);
        return switch (check.status()) {
            case LISTED -> Boolean.TRUE;
            case UNLISTED -> Boolean.FALSE;
            case UNKNOWN -> null;
        };
    }

    private String userPrompt(List<LineItemCoverage> items, ClaimContext context) {
        return """
                LINE ITEMS:
                %s

                POLICY COVERED COMPONENTS (by category):
                %s

                Identify the primary repair.
                """.formatted(
                PromptFormatting.itemLines(items),
                PromptFormatting.componentLists(context.policy().coveredComponents()));
    }
}
