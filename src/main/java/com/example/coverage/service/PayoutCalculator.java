package com.example.coverage.service;

import com.example.coverage.config.CoverageProperties;
import com.example.coverage.model.CoverageTier;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.PayoutResult;
import com.example.coverage.model.PolicyContext;
import com.example.coverage.model.PolicyholderType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Comparator;
import java.util.List;

/**
 * Converts covered line items into the payable amount. Steps, in order:
 * <ol>
 *   <li>sum the covered amounts</li>
 *   <li>coverage percent from the mileage tier, replaced by the tier's age rate when the
 *       vehicle has reached the age threshold and the tier defines one</li>
 *   <li>gross covered = sum × percent</li>
 *   <li>cap at the policy maximum</li>
 *   <li>add VAT</li>
 *   <li>deductible = max(excess percent × VAT-inclusive amount, excess minimum)</li>
 *   <li>subtract the deductible, never below zero</li>
 *   <li>companies reclaim VAT: divide by (1 + VAT rate)</li>
 * </ol>
 * Every step is rounded half-up to cents.
 */
@Service
public class PayoutCalculator {

    private static final Logger log = LoggerFactory.getLogger(PayoutCalculator.class);

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final BigDecimal defaultVatRate;
    private final PolicyholderClassifier classifier;

    public PayoutCalculator(CoverageProperties properties, PolicyholderClassifier classifier) {
        this.defaultVatRate = properties.payout().defaultVatRate();
        this.classifier = classifier;
    }

    public PayoutResult compute(List<LineItemCoverage> items, PolicyContext policy) {
        BigDecimal coveredTotal = cents(items.stream()
                .filter(LineItemCoverage::isCovered)
                .map(LineItemCoverage::coveredAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add));

        CoverageTier tier = selectTier(policy.coverageScale(), policy.vehicleKm());
        double mileagePercent = tier != null ? tier.coveragePercent() : 100.0;
        double effectivePercent = mileagePercent;
        boolean ageAdjusted = false;
        if (tier != null && tier.ageCoveragePercent() != null
                && policy.ageThresholdYears() != null && policy.vehicleAgeYears() != null
                && policy.vehicleAgeYears() >= policy.ageThresholdYears()) {
            effectivePercent = tier.ageCoveragePercent();
            ageAdjusted = true;
            log.info("Age-based coverage: vehicle {} years (>= {}), tier rate {}% instead of {}%",
                    policy.vehicleAgeYears(), policy.ageThresholdYears(), effectivePercent, mileagePercent);
        }

        BigDecimal grossCovered = cents(coveredTotal.multiply(BigDecimal.valueOf(effectivePercent)).divide(HUNDRED));

        BigDecimal capped = grossCovered;
        boolean maxApplied = false;
        if (policy.maxCoverage() != null && grossCovered.compareTo(policy.maxCoverage()) > 0) {
            capped = cents(policy.maxCoverage());
            maxApplied = true;
        }

        BigDecimal vatRate = policy.vatRate() != null ? policy.vatRate() : defaultVatRate;
        BigDecimal vatAmount = cents(capped.multiply(vatRate));
        BigDecimal subtotalWithVat = capped.add(vatAmount);

        BigDecimal deductiblePercent = policy.excessPercent() != null ? policy.excessPercent() : BigDecimal.ZERO;
        BigDecimal deductibleMinimum = policy.excessMinimum() != null ? policy.excessMinimum() : BigDecimal.ZERO;
        BigDecimal deductible = BigDecimal.ZERO.setScale(2);
        if (subtotalWithVat.signum() > 0) {
            BigDecimal byPercent = cents(subtotalWithVat.multiply(deductiblePercent).divide(HUNDRED));
            deductible = cents(byPercent.max(deductibleMinimum));
        }
        BigDecimal afterDeductible = cents(subtotalWithVat.subtract(deductible).max(BigDecimal.ZERO));

        PolicyholderClassifier.Classification holder = classifier.classify(policy);
        BigDecimal finalPayout = afterDeductible;
        BigDecimal vatDeduction = BigDecimal.ZERO.setScale(2);
        boolean vatAdjusted = false;
        if (holder.type() == PolicyholderType.COMPANY && afterDeductible.signum() > 0) {
            finalPayout = afterDeductible.divide(BigDecimal.ONE.add(vatRate), 2, RoundingMode.HALF_UP);
            vatDeduction = afterDeductible.subtract(finalPayout);
            vatAdjusted = true;
        }

        log.debug("Payout: covered {} at {}% = {}, capped {}, +VAT {} = {}, deductible {}, final {} ({} via {})",
                coveredTotal, effectivePercent, grossCovered, capped, vatAmount, subtotalWithVat,
                deductible, finalPayout, holder.type(), holder.source());

        return new PayoutResult(coveredTotal, mileagePercent, effectivePercent, ageAdjusted, grossCovered,
                policy.maxCoverage(), maxApplied, capped, vatRate, vatAmount, subtotalWithVat,
                deductiblePercent, deductibleMinimum, deductible, afterDeductible,
                holder.type(), holder.source(), vatAdjusted, vatDeduction, finalPayout);
    }

    /**
     * Highest tier whose threshold is at or below the mileage; {@code null} below the first
     * threshold, without mileage or without a scale (100%).
     */
    static CoverageTier selectTier(List<CoverageTier> scale, Integer vehicleKm) {
        if (vehicleKm == null || scale == null || scale.isEmpty()) return null;
        CoverageTier selected = null;
        for (CoverageTier tier : scale.stream().sorted(Comparator.comparingInt(CoverageTier::kmThreshold)).toList()) {
            if (vehicleKm >= tier.kmThreshold()) {
                selected = tier;
            } else {
                break;
            }
        }
        return selected;
    }

    private static BigDecimal cents(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
