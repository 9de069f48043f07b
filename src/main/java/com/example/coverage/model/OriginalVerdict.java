package com.example.coverage.model;

/**
 * Verdict an item carried before claim-level resolution changed it. Kept for audit.
 */
public record OriginalVerdict(
        CoverageStatus status,
        MatchMethod method,
        double confidence,
        String reasoning
) {
}
