package com.example.coverage.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One group of unpaid items sharing an exclusion reason (and category, for reasons that
 * are split per category), with the wording an adjuster can pass on.
 *
 * @param exclusionReason why the group is not paid
 * @param items           item descriptions in index order
 * @param itemCodes       part codes, {@code null} where an item has none
 * @param category        category of the group, {@code null} unless the reason is split per category
 * @param totalAmount     sum of the items' not-covered amounts
 * @param explanation     template text, or the first item's reasoning when no template applies
 * @param policyReference policy clause named by the tenant, if any
 * @param matchConfidence lowest confidence in the group
 */
public record NonCoveredExplanation(
        ExclusionReason exclusionReason,
        List<String> items,
        List<String> itemCodes,
        String category,
        BigDecimal totalAmount,
        String explanation,
        String policyReference,
        double matchConfidence
) {
    public NonCoveredExplanation {
        items = List.copyOf(items);
        itemCodes = itemCodes == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(itemCodes));
    }
}
