package com.example.coverage.service;

import java.util.UUID;

/**
 * Request context for a single outbound LLM call. A fresh instance is created for every
 * task so concurrent workers never share attribution data.
 *
 * @param claimId       claim being analyzed
 * @param correlationId unique id of this call, echoed in every audit record of its attempts
 * @param purpose       what the call decides (item_coverage, primary_repair, repair_association)
 * @param itemIndex     line item the call is about, {@code null} for claim-level calls
 * @param ledger        the claim's call ledger
 */
public record LlmCallContext(
        String claimId,
        String correlationId,
        String purpose,
        Integer itemIndex,
        LlmCallLedger ledger
) {
    public static final String ITEM_COVERAGE = "item_coverage";
    public static final String PRIMARY_REPAIR = "primary_repair";
    public static final String REPAIR_ASSOCIATION = "repair_association";

    public static LlmCallContext forItem(String claimId, int itemIndex, LlmCallLedger ledger) {
        return new LlmCallContext(claimId, UUID.randomUUID().toString(), ITEM_COVERAGE, itemIndex, ledger);
    }

    public static LlmCallContext forClaim(String claimId, String purpose, LlmCallLedger ledger) {
        return new LlmCallContext(claimId, UUID.randomUUID().toString(), purpose, null, ledger);
    }
}
