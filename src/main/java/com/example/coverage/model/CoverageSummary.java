package com.example.coverage.model;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Claim-level totals and counters.
 */
public record CoverageSummary(
        BigDecimal totalClaimed,
        BigDecimal totalCovered,
        BigDecimal totalNotCovered,
        BigDecimal totalReviewNeeded,
        Map<CoverageStatus, Long> countsByStatus,
        Map<MatchMethod, Long> countsByMethod,
        double effectiveCoveragePercent,
        BigDecimal payableAmount,
        long llmCalls,
        long promptTokens,
        long completionTokens,
        long processingTimeMs
) {
    public CoverageSummary {
        countsByStatus = Map.copyOf(countsByStatus);
        countsByMethod = Map.copyOf(countsByMethod);
    }

    public long count(CoverageStatus status) {
        return countsByStatus.getOrDefault(status, 0L);
    }
}
