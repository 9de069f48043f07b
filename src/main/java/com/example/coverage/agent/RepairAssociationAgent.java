package com.example.coverage.agent;

import com.example.coverage.config.CoverageProperties;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.PrimaryRepairResult;
import com.example.coverage.model.RepairAssociationResponse;
import com.example.coverage.model.RepairContext;
import com.example.coverage.service.ClaimContext;
import com.example.coverage.service.LlmCallContext;
import com.example.coverage.service.StructuredLlmClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Re-examines parts the LLM denied against the whole estimate and the identified repair.
 * A denied part is often the covered component itself under a supplier-specific name.
 * <p>
 * Only decisions for the submitted candidate indices are returned; anything else the model
 * answers is dropped.
 */
@Service
public class RepairAssociationAgent {

    private static final Logger log = LoggerFactory.getLogger(RepairAssociationAgent.class);

    private static final String SYSTEM_PROMPT = """
            You are a claims adjuster reviewing a vehicle repair estimate whose main repair is covered
            by the warranty.

            Some parts were classified as NOT covered individually. Re-examine ONLY those CANDIDATE parts
            in the context of the whole estimate and the primary repair.

            RULES:
            - covered = true ONLY if the candidate is the covered component itself under another name
              (supplier catalog name, abbreviation, translation) or an integral part of it.
            - Fasteners, seals, fluids, consumables and parts of OTHER systems stay not covered.
            - Never change a part that belongs to an excluded component.
            - One decision per candidate, using its index exactly as given.
            - confidence between 0.0 and 1.0; reasoning in one sentence.
            """;

    private final StructuredLlmClient llmClient;
    private final CoverageProperties.Thresholds thresholds;

    public RepairAssociationAgent(StructuredLlmClient llmClient, CoverageProperties properties) {
        this.llmClient = llmClient;
        this.thresholds = properties.thresholds();
    }

    /**
     * @param items      all verdicts of the claim, in index order
     * @param candidates indices of LLM-denied parts to re-examine
     * @return decisions by index, empty when the call fails
     */
    public Map<Integer, RepairAssociationResponse.Decision> validate(List<LineItemCoverage> items,
                                                                      Set<Integer> candidates,
                                                                      PrimaryRepairResult primary,
                                                                      ClaimContext context) {
        if (candidates.isEmpty()) return Map.of();

        LlmCallContext callContext = LlmCallContext.forClaim(context.claimId(),
                LlmCallContext.REPAIR_ASSOCIATION, context.ledger());
        RepairAssociationResponse response;
        try {
            response = llmClient.call(callContext, SYSTEM_PROMPT, userPrompt(items, candidates, primary, context),
                    RepairAssociationResponse.class);
        } catch (Exception e) {
            log.error("RepairAssociationAgent: validation failed for claim {} (correlation {})",
                    context.claimId(), callContext.correlationId(), e);
            return Map.of();
        }
        if (response == null || response.decisions() == null) {
            log.warn("RepairAssociationAgent: empty response for claim {}", context.claimId());
            return Map.of();
        }

        Map<Integer, RepairAssociationResponse.Decision> decisions = new LinkedHashMap<>();
        for (RepairAssociationResponse.Decision decision : response.decisions()) {
            if (decision == null || decision.index() == null) continue;
            if (!candidates.contains(decision.index())) {
                log.debug("RepairAssociationAgent: ignoring decision for non-candidate index {}", decision.index());
                continue;
            }
            decisions.putIfAbsent(decision.index(), decision);
        }
        log.info("RepairAssociationAgent: {} decisions for {} candidates", decisions.size(), candidates.size());
        return decisions;
    }

    /**
     * Whether a decision is strong enough to flip a denial.
     */
    public boolean accepts(RepairAssociationResponse.Decision decision) {
        return Boolean.TRUE.equals(decision.covered())
                && decision.confidence() != null
                && decision.confidence() >= thresholds.llmCoveredThreshold();
    }

    public double cappedConfidence(RepairAssociationResponse.Decision decision) {
        return Math.min(decision.confidence() != null ? decision.confidence() : 0.0, thresholds.llmMaxConfidence());
    }

    private String userPrompt(List<LineItemCoverage> items, Set<Integer> candidates, PrimaryRepairResult primary,
                              ClaimContext context) {
        RepairContext repair = context.repairContext();
        String primaryText = primary.component() != null
                ? primary.component() + " (" + primary.category() + ", covered=" + primary.isCovered() + ")"
                : "(not determined)";
        String repairText = repair.isPresent()
                ? repair.primaryComponent() + " from '" + repair.sourceDescription() + "'"
                : "(none)";
        String candidateLines = items.stream()
                .filter(i -> candidates.contains(i.index()))
                .map(PromptFormatting::itemLine)
                .collect(Collectors.joining("\n"));
        return """
                PRIMARY REPAIR: %s
                REPAIR CONTEXT FROM LABOR: %s

                ALL LINE ITEMS:
                %s

                CANDIDATES TO RE-EXAMINE:
                %s

                POLICY COVERED COMPONENTS (by category):
                %s

                EXCLUDED COMPONENTS (by category):
                %s
                """.formatted(primaryText, repairText,
                PromptFormatting.itemLines(items), candidateLines,
                PromptFormatting.componentLists(context.policy().coveredComponents()),
                PromptFormatting.componentLists(context.policy().excludedComponents()));
    }
}
