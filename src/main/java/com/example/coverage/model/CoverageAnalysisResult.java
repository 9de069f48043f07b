package com.example.coverage.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one claim run. Immutable once returned.
 */
public record CoverageAnalysisResult(
        String claimId,
        String tenant,
        Instant generatedAt,
        List<LineItemCoverage> lineItems,
        RepairContext repairContext,
        PrimaryRepairResult primaryRepair,
        PayoutResult payout,
        CoverageSummary summary,
        List<NonCoveredExplanation> nonCoveredExplanations,
        String nonCoveredSummary
) {
    public CoverageAnalysisResult {
        lineItems = List.copyOf(lineItems);
        nonCoveredExplanations = nonCoveredExplanations == null ? List.of() : List.copyOf(nonCoveredExplanations);
    }
}
