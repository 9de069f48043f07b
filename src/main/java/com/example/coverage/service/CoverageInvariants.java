package com.example.coverage.service;

import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Final checks on a claim's verdicts: one verdict per item, in input order, and
 * {@code covered + notCovered == total} within a cent for every item.
 * <p>
 * In strict mode a violation throws {@link CoverageInvariantException}; otherwise it is
 * logged at ERROR and the amounts are clamped so that {@code notCovered = total - covered}.
 */
public final class CoverageInvariants {

    private static final Logger log = LoggerFactory.getLogger(CoverageInvariants.class);

    private static final BigDecimal TOLERANCE = new BigDecimal("0.01");

    private CoverageInvariants() {
    }

    public static List<LineItemCoverage> verify(List<LineItem> items, List<LineItemCoverage> verdicts, boolean strict) {
        if (verdicts.size() != items.size()) {
            throw new CoverageInvariantException("Expected " + items.size() + " verdicts, got " + verdicts.size());
        }
        List<LineItemCoverage> checked = new ArrayList<>(verdicts.size());
        for (int i = 0; i < verdicts.size(); i++) {
            LineItemCoverage verdict = verdicts.get(i);
            if (verdict == null || verdict.index() != i) {
                throw new CoverageInvariantException("Item " + i + " has no verdict in position");
            }
            checked.add(conserve(verdict, strict));
        }
        return checked;
    }

    static LineItemCoverage conserve(LineItemCoverage verdict, boolean strict) {
        BigDecimal total = verdict.totalPrice();
        BigDecimal covered = verdict.coveredAmount() != null ? verdict.coveredAmount() : BigDecimal.ZERO;
        BigDecimal notCovered = verdict.notCoveredAmount() != null ? verdict.notCoveredAmount() : BigDecimal.ZERO;
        BigDecimal drift = covered.add(notCovered).subtract(total).abs();
        if (drift.compareTo(TOLERANCE) <= 0) {
            return verdict;
        }
        String message = "Item " + verdict.index() + " '" + verdict.description() + "': covered " + covered
                + " + not covered " + notCovered + " != total " + total;
        if (strict) {
            throw new CoverageInvariantException(message);
        }
        log.error("{}; clamping", message);
        BigDecimal clampedCovered = covered.max(BigDecimal.ZERO).min(total.max(BigDecimal.ZERO));
        return verdict.withAmounts(clampedCovered, total.subtract(clampedCovered));
    }
}
