package com.example.coverage.orchestrator;

import com.example.coverage.config.CoverageProperties;
import com.example.coverage.config.TenantVocabulary;
import com.example.coverage.config.VocabularyRegistry;
import com.example.coverage.model.CoverageAnalysisRequest;
import com.example.coverage.model.CoverageAnalysisResult;
import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.CoverageSummary;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.MatchMethod;
import com.example.coverage.model.PayoutResult;
import com.example.coverage.model.RepairContext;
import com.example.coverage.service.ClaimContext;
import com.example.coverage.service.CoverageInvariants;
import com.example.coverage.service.ExplanationGenerator;
import com.example.coverage.service.LlmAuditSink;
import com.example.coverage.service.LlmCallLedger;
import com.example.coverage.service.PayoutCalculator;
import com.example.coverage.service.RepairContextExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Coverage pipeline for one claim.
 * Pipeline:
 * 1. Tenant vocabulary and claim context
 * 2. Repair context from labor descriptions (NO LLM)
 * 3. Item cascade: rules, part numbers, keywords, LLM fallback
 * 4. Claim-level resolution: primary repair, association, labor anchoring, veto
 * 5. Invariant check (amount conservation, one verdict per item)
 * 6. Payout, summary and explanations for unpaid items
 */
@Service
public class CoverageAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(CoverageAnalyzer.class);

    private final VocabularyRegistry vocabularyRegistry;
    private final RepairContextExtractor repairContextExtractor;
    private final CoverageCascade cascade;
    private final ClaimLevelResolver claimLevelResolver;
    private final PayoutCalculator payoutCalculator;
    private final ExplanationGenerator explanationGenerator;
    private final LlmAuditSink auditSink;
    private final CoverageProperties properties;

    public CoverageAnalyzer(VocabularyRegistry vocabularyRegistry,
                            RepairContextExtractor repairContextExtractor,
                            CoverageCascade cascade,
                            ClaimLevelResolver claimLevelResolver,
                            PayoutCalculator payoutCalculator,
                            ExplanationGenerator explanationGenerator,
                            LlmAuditSink auditSink,
                            CoverageProperties properties) {
        this.vocabularyRegistry = vocabularyRegistry;
        this.repairContextExtractor = repairContextExtractor;
        this.cascade = cascade;
        this.claimLevelResolver = claimLevelResolver;
        this.payoutCalculator = payoutCalculator;
        this.explanationGenerator = explanationGenerator;
        this.auditSink = auditSink;
        this.properties = properties;
    }

    public CoverageAnalysisResult analyze(CoverageAnalysisRequest request) {
        long start = System.nanoTime();
        log.info("═══════════════════════════════════════════════");
        log.info("Starting coverage analysis for claim '{}' ({} line items)",
                request.claimId(), request.lineItems().size());
        log.info("═══════════════════════════════════════════════");

        // ── Step 1: Vocabulary and claim context ──
        String tenant = vocabularyRegistry.resolveTenant(request.tenant());
        TenantVocabulary vocabulary = vocabularyRegistry.get(tenant);
        log.info("[1/6] Tenant '{}', vocabulary version {}", tenant, vocabulary.version());
        LlmCallLedger ledger = new LlmCallLedger(auditSink);
        ClaimContext context = new ClaimContext(request.claimId(), request.lineItems(), request.policy(),
                vocabulary, properties.thresholds(), ledger);

        // ── Step 2: Repair context ──
        log.info("[2/6] Extracting repair context from labor lines...");
        RepairContext repairContext = repairContextExtractor.extract(context.items(), context.policyMatcher());
        context.setRepairContext(repairContext);
        log.info("[2/6] Repair context: {}", repairContext.isPresent()
                ? repairContext.primaryComponent() + " (covered=" + repairContext.isCovered() + ")"
                : "none");

        // ── Step 3: Item cascade ──
        log.info("[3/6] Running coverage cascade...");
        List<LineItemCoverage> verdicts = cascade.run(context);
        log.info("[3/6] Cascade completed: {}", countByMethod(verdicts));

        // ── Step 4: Claim-level resolution ──
        log.info("[4/6] Claim-level resolution...");
        ClaimLevelResolver.Resolution resolution = claimLevelResolver.resolve(verdicts, context);
        long adjusted = resolution.lineItems().stream().filter(i -> i.originalVerdict() != null).count();
        log.info("[4/6] Resolution completed: {} items adjusted, primary '{}' via {}",
                adjusted, resolution.primaryRepair().component(),
                resolution.primaryRepair().determinationMethod().value());

        // ── Step 5: Invariants ──
        log.info("[5/6] Verifying invariants...");
        List<LineItemCoverage> lineItems = CoverageInvariants.verify(context.items(), resolution.lineItems(),
                properties.strictInvariants());

        // ── Step 6: Payout and summary ──
        log.info("[6/6] Computing payout...");
        PayoutResult payout = payoutCalculator.compute(lineItems, context.policy());
        long elapsedMs = (System.nanoTime() - start) / 1_000_000;
        CoverageSummary summary = summarize(lineItems, payout, ledger, elapsedMs);
        ExplanationGenerator.Explanations explanations =
                explanationGenerator.generate(lineItems, vocabulary.explanations());
        log.info("[6/6] {} explanation groups for unpaid items", explanations.groups().size());

        log.info("═══════════════════════════════════════════════");
        log.info("Claim '{}' completed: {} covered, {} not covered, {} review; payable {} ({} LLM calls, {} ms)",
                request.claimId(), summary.count(CoverageStatus.COVERED), summary.count(CoverageStatus.NOT_COVERED),
                summary.count(CoverageStatus.REVIEW_NEEDED), summary.payableAmount(), summary.llmCalls(), elapsedMs);
        log.info("═══════════════════════════════════════════════");

        return new CoverageAnalysisResult(request.claimId(), tenant, Instant.now(), lineItems, repairContext,
                resolution.primaryRepair(), payout, summary, explanations.groups(), explanations.summary());
    }

    static CoverageSummary summarize(List<LineItemCoverage> items, PayoutResult payout, LlmCallLedger ledger,
                                     long elapsedMs) {
        BigDecimal claimed = sum(items, i -> true, LineItemCoverage::totalPrice);
        BigDecimal covered = sum(items, i -> true, LineItemCoverage::coveredAmount);
        BigDecimal notCovered = sum(items, i -> i.coverageStatus() == CoverageStatus.NOT_COVERED,
                LineItemCoverage::notCoveredAmount);
        BigDecimal review = sum(items, i -> i.coverageStatus() == CoverageStatus.REVIEW_NEEDED,
                LineItemCoverage::totalPrice);

        Map<CoverageStatus, Long> byStatus = new EnumMap<>(CoverageStatus.class);
        items.forEach(i -> byStatus.merge(i.coverageStatus(), 1L, Long::sum));
        Map<MatchMethod, Long> byMethod = countByMethod(items);

        double effective = claimed.signum() > 0
                ? covered.multiply(BigDecimal.valueOf(100)).divide(claimed, 2, RoundingMode.HALF_UP).doubleValue()
                : 0.0;
        return new CoverageSummary(claimed, covered, notCovered, review, byStatus, byMethod, effective,
                payout.finalPayout(), ledger.attempts(), ledger.promptTokens(), ledger.completionTokens(), elapsedMs);
    }

    private static Map<MatchMethod, Long> countByMethod(List<LineItemCoverage> items) {
        Map<MatchMethod, Long> byMethod = new EnumMap<>(MatchMethod.class);
        items.forEach(i -> byMethod.merge(i.matchMethod(), 1L, Long::sum));
        return byMethod;
    }

    private static BigDecimal sum(List<LineItemCoverage> items, Predicate<LineItemCoverage> filter,
                                  Function<LineItemCoverage, BigDecimal> amount) {
        return items.stream()
                .filter(filter)
                .map(amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add)
                .setScale(2, RoundingMode.HALF_UP);
    }
}
