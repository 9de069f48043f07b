package com.example.coverage.model;

import java.math.BigDecimal;

/**
 * Coverage verdict for a single line item.
 * <p>
 * Instances are built through {@link #of} so that
 * {@code coveredAmount + notCoveredAmount == totalPrice} holds by construction:
 * COVERED items carry the full price as covered, every other status carries it as
 * not covered (REVIEW_NEEDED is conservatively unpaid until a reviewer decides).
 * Claim-level resolution replaces a verdict through {@link #adjust}, which keeps the
 * first verdict in {@link #originalVerdict()}.
 *
 * @param index            position of the item in the submitted estimate
 * @param description      raw item description
 * @param itemType         parts, labor or fee
 * @param totalPrice       line total
 * @param partCode         catalog identifier, if any
 * @param coverageStatus   terminal verdict
 * @param coverageCategory policy category the item was resolved to
 * @param matchedComponent canonical component name
 * @param matchMethod      stage that produced the verdict
 * @param matchConfidence  confidence in [0, 1]
 * @param matchReasoning   human-readable rationale
 * @param coveredAmount    part of the price that is covered
 * @param notCoveredAmount part of the price that is not covered
 * @param originalVerdict  verdict before claim-level resolution, {@code null} if unchanged
 * @param exclusionReason  why the item is not paid, {@code null} for covered items
 */
public record LineItemCoverage(
        int index,
        String description,
        ItemType itemType,
        BigDecimal totalPrice,
        String partCode,
        CoverageStatus coverageStatus,
        String coverageCategory,
        String matchedComponent,
        MatchMethod matchMethod,
        double matchConfidence,
        String matchReasoning,
        BigDecimal coveredAmount,
        BigDecimal notCoveredAmount,
        OriginalVerdict originalVerdict,
        ExclusionReason exclusionReason
) {

    public static LineItemCoverage of(int index, LineItem item, CoverageStatus status, MatchMethod method,
                                      String category, String component, double confidence, String reasoning) {
        BigDecimal price = item.totalPrice();
        boolean covered = status == CoverageStatus.COVERED;
        return new LineItemCoverage(
                index,
                item.description(),
                item.itemType(),
                price,
                item.partCode(),
                status,
                category,
                component,
                method,
                clamp(confidence),
                reasoning,
                covered ? price : BigDecimal.ZERO,
                covered ? BigDecimal.ZERO : price,
                null,
                null
        );
    }

    /**
     * Returns a copy with a new verdict, recording the current one as original
     * unless an original was already recorded. The match method is preserved and the
     * exclusion reason is cleared.
     */
    public LineItemCoverage adjust(CoverageStatus status, String category, String component,
                                   double confidence, String reasoningTag) {
        OriginalVerdict original = originalVerdict != null
                ? originalVerdict
                : new OriginalVerdict(coverageStatus, matchMethod, matchConfidence, matchReasoning);
        boolean covered = status == CoverageStatus.COVERED;
        String reasoning = matchReasoning == null || matchReasoning.isBlank()
                ? reasoningTag
                : matchReasoning + " " + reasoningTag;
        return new LineItemCoverage(
                index, description, itemType, totalPrice, partCode,
                status, category, component, matchMethod, clamp(confidence), reasoning,
                covered ? totalPrice : BigDecimal.ZERO,
                covered ? BigDecimal.ZERO : totalPrice,
                original,
                null
        );
    }

    /** Copy with explicit amounts; only used to repair a conservation violation. */
    public LineItemCoverage withAmounts(BigDecimal covered, BigDecimal notCovered) {
        return new LineItemCoverage(
                index, description, itemType, totalPrice, partCode,
                coverageStatus, coverageCategory, matchedComponent, matchMethod, matchConfidence,
                matchReasoning, covered, notCovered, originalVerdict, exclusionReason
        );
    }

    /** Copy tagged with the reason it is not paid; ignored for covered items. */
    public LineItemCoverage withExclusionReason(ExclusionReason reason) {
        return new LineItemCoverage(
                index, description, itemType, totalPrice, partCode,
                coverageStatus, coverageCategory, matchedComponent, matchMethod, matchConfidence,
                matchReasoning, coveredAmount, notCoveredAmount, originalVerdict,
                coverageStatus == CoverageStatus.COVERED ? null : reason
        );
    }

    public boolean isCovered() {
        return coverageStatus == CoverageStatus.COVERED;
    }

    public boolean isParts() {
        return itemType == ItemType.PARTS;
    }

    public boolean isLabor() {
        return itemType == ItemType.LABOR;
    }

    private static double clamp(double confidence) {
        if (Double.isNaN(confidence)) return 0.0;
        return Math.max(0.0, Math.min(1.0, confidence));
    }
}
