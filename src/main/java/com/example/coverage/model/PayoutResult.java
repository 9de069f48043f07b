package com.example.coverage.model;

import java.math.BigDecimal;

/**
 * Every intermediate of the payout formula, rounded to cents.
 *
 * @param coveredTotal         sum of covered line items
 * @param mileagePercent       percentage from the km tier
 * @param effectivePercent     percentage actually applied (age rate if applicable)
 * @param ageAdjusted          true when the tier's age rate replaced the mileage rate
 * @param grossCovered         covered total after the percentage
 * @param maxCoverage          policy cap, {@code null} if none
 * @param maxCoverageApplied   true when the cap reduced the amount
 * @param cappedAmount         gross covered after the cap
 * @param vatRate              VAT rate applied
 * @param vatAmount            VAT added on the capped amount
 * @param subtotalWithVat      VAT-inclusive amount
 * @param deductiblePercent    excess percentage, {@code null} if none
 * @param deductibleMinimum    minimum excess, {@code null} if none
 * @param deductibleAmount     deductible actually charged
 * @param afterDeductible      VAT-inclusive amount minus deductible, floored at zero
 * @param policyholderType     company or individual
 * @param policyholderSource   how the policyholder type was established
 * @param vatAdjusted          true when reclaimable VAT was removed
 * @param vatDeduction         amount of VAT removed
 * @param finalPayout          amount payable, never negative
 */
public record PayoutResult(
        BigDecimal coveredTotal,
        double mileagePercent,
        double effectivePercent,
        boolean ageAdjusted,
        BigDecimal grossCovered,
        BigDecimal maxCoverage,
        boolean maxCoverageApplied,
        BigDecimal cappedAmount,
        BigDecimal vatRate,
        BigDecimal vatAmount,
        BigDecimal subtotalWithVat,
        BigDecimal deductiblePercent,
        BigDecimal deductibleMinimum,
        BigDecimal deductibleAmount,
        BigDecimal afterDeductible,
        PolicyholderType policyholderType,
        PolicyholderType.Source policyholderSource,
        boolean vatAdjusted,
        BigDecimal vatDeduction,
        BigDecimal finalPayout
) {
}
