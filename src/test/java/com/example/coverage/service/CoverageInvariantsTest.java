package com.example.coverage.service;

import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.ItemType;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.MatchMethod;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CoverageInvariants Tests")
class CoverageInvariantsTest {

    private static final LineItem OIL_COOLER = LineItem.of("Ölkühler", ItemType.PARTS, "480.00");
    private static final LineItem DISPOSAL = LineItem.of("Entsorgung", ItemType.FEE, "25.00");

    private static LineItemCoverage verdict(int index, LineItem item, CoverageStatus status) {
        return LineItemCoverage.of(index, item, status, MatchMethod.RULE, null, null, 1.0, "test");
    }

    @Test
    @DisplayName("Consistent verdicts pass unchanged")
    void consistentVerdictsPass() {
        List<LineItemCoverage> verdicts = List.of(
                verdict(0, OIL_COOLER, CoverageStatus.COVERED),
                verdict(1, DISPOSAL, CoverageStatus.NOT_COVERED));

        assertThat(CoverageInvariants.verify(List.of(OIL_COOLER, DISPOSAL), verdicts, true))
                .containsExactlyElementsOf(verdicts);
    }

    @Test
    @DisplayName("Missing verdict is always an error")
    void missingVerdict() {
        assertThatThrownBy(() -> CoverageInvariants.verify(List.of(OIL_COOLER, DISPOSAL),
                List.of(verdict(0, OIL_COOLER, CoverageStatus.COVERED)), false))
                .isInstanceOf(CoverageInvariantException.class)
                .hasMessageContaining("Expected 2 verdicts");
    }

    @Test
    @DisplayName("Out-of-order verdicts are rejected")
    void outOfOrder() {
        List<LineItemCoverage> verdicts = List.of(
                verdict(1, DISPOSAL, CoverageStatus.NOT_COVERED),
                verdict(0, OIL_COOLER, CoverageStatus.COVERED));

        assertThatThrownBy(() -> CoverageInvariants.verify(List.of(OIL_COOLER, DISPOSAL), verdicts, false))
                .isInstanceOf(CoverageInvariantException.class);
    }

    @Test
    @DisplayName("Amount drift throws in strict mode")
    void driftThrowsWhenStrict() {
        LineItemCoverage broken = verdict(0, OIL_COOLER, CoverageStatus.COVERED)
                .withAmounts(new BigDecimal("480.00"), new BigDecimal("20.00"));

        assertThatThrownBy(() -> CoverageInvariants.verify(List.of(OIL_COOLER), List.of(broken), true))
                .isInstanceOf(CoverageInvariantException.class)
                .hasMessageContaining("Ölkühler");
    }

    @Test
    @DisplayName("Amount drift is clamped outside strict mode")
    void driftIsClamped() {
        LineItemCoverage broken = verdict(0, OIL_COOLER, CoverageStatus.COVERED)
                .withAmounts(new BigDecimal("500.00"), new BigDecimal("10.00"));

        LineItemCoverage repaired = CoverageInvariants.verify(List.of(OIL_COOLER), List.of(broken), false).get(0);

        assertThat(repaired.coveredAmount()).isEqualByComparingTo("480.00");
        assertThat(repaired.notCoveredAmount()).isEqualByComparingTo("0.00");
    }

    @Test
    @DisplayName("One-cent rounding difference is tolerated")
    void centToleranceAccepted() {
        LineItemCoverage rounded = verdict(0, OIL_COOLER, CoverageStatus.COVERED)
                .withAmounts(new BigDecimal("479.99"), BigDecimal.ZERO);

        assertThat(CoverageInvariants.conserve(rounded, true)).isSameAs(rounded);
    }
}
