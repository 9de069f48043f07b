package com.example.coverage.service;

import com.example.coverage.config.CoverageProperties;
import com.example.coverage.config.TenantVocabulary;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.PolicyContext;
import com.example.coverage.model.RepairContext;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * State of one claim run: inputs, the derived repair context, verdicts resolved so far and
 * hints left by stages that deferred. Created per claim and discarded afterwards; nothing
 * here is shared between claims.
 */
public class ClaimContext {

    private final String claimId;
    private final List<LineItem> items;
    private final PolicyContext policy;
    private final TenantVocabulary vocabulary;
    private final PolicyMatcher policyMatcher;
    private final CoverageProperties.Thresholds thresholds;
    private final LlmCallLedger ledger;
    private final String claimText;
    private final Map<Integer, StageHint> hints = new ConcurrentHashMap<>();
    private final Map<Integer, LineItemCoverage> resolved = new ConcurrentHashMap<>();
    private RepairContext repairContext = RepairContext.none();

    public ClaimContext(String claimId, List<LineItem> items, PolicyContext policy, TenantVocabulary vocabulary,
                        CoverageProperties.Thresholds thresholds, LlmCallLedger ledger) {
        this.claimId = claimId;
        this.items = List.copyOf(items);
        this.policy = policy;
        this.vocabulary = vocabulary;
        this.policyMatcher = new PolicyMatcher(policy, vocabulary.components());
        this.thresholds = thresholds;
        this.ledger = ledger;
        this.claimText = this.items.stream()
                .map(i -> TextNormalizer.normalize(i.description()))
                .collect(Collectors.joining(" "));
    }

    public String claimId() {
        return claimId;
    }

    public List<LineItem> items() {
        return items;
    }

    public PolicyContext policy() {
        return policy;
    }

    public TenantVocabulary vocabulary() {
        return vocabulary;
    }

    public PolicyMatcher policyMatcher() {
        return policyMatcher;
    }

    public CoverageProperties.Thresholds thresholds() {
        return thresholds;
    }

    public LlmCallLedger ledger() {
        return ledger;
    }

    /** Normalized descriptions of every item in the claim, space-joined. */
    public String claimText() {
        return claimText;
    }

    public RepairContext repairContext() {
        return repairContext;
    }

    public void setRepairContext(RepairContext repairContext) {
        this.repairContext = repairContext != null ? repairContext : RepairContext.none();
    }

    public void hint(int index, StageHint hint) {
        hints.put(index, hint);
    }

    public Optional<StageHint> hintFor(int index) {
        return Optional.ofNullable(hints.get(index));
    }

    public void resolve(LineItemCoverage coverage) {
        resolved.put(coverage.index(), coverage);
    }

    public boolean isResolved(int index) {
        return resolved.containsKey(index);
    }

    /** Items already resolved as covered parts, in index order. */
    public List<LineItemCoverage> coveredParts() {
        List<LineItemCoverage> parts = new ArrayList<>();
        resolved.values().stream()
                .filter(c -> c.isCovered() && c.isParts())
                .sorted(Comparator.comparingInt(LineItemCoverage::index))
                .forEach(parts::add);
        return parts;
    }
}
