package com.example.coverage.model;

import java.util.List;

/**
 * Input of one claim run.
 *
 * @param claimId   claim identifier, used for logging and audit correlation
 * @param tenant    vocabulary tenant; the configured default when {@code null}
 * @param lineItems estimate lines in document order
 * @param policy    policy data for the claim
 */
public record CoverageAnalysisRequest(
        String claimId,
        String tenant,
        List<LineItem> lineItems,
        PolicyContext policy
) {
    public CoverageAnalysisRequest {
        lineItems = lineItems == null ? List.of() : List.copyOf(lineItems);
    }
}
