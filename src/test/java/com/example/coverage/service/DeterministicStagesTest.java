package com.example.coverage.service;

import com.example.coverage.CoverageFixtures;
import com.example.coverage.model.ItemType;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Deterministic stages")
class DeterministicStagesTest {

    private static final List<CoverageStrategy> STAGES =
            List.of(new RuleEngine(), new PartNumberLookup(), new KeywordMatcher());

    private static final LineItem[] CLAIM = {
            LineItem.of("Ölkühler Gehäuse", ItemType.PARTS, "458.60"),
            LineItem.of("Gehäuse", ItemType.PARTS, "120.00").withPartCode("06L 115 105 B"),
            LineItem.of("Turbolader", ItemType.PARTS, "2100.00"),
            LineItem.of("Zahnriemen", ItemType.PARTS, "160.00"),
            LineItem.of("Entsorgung", ItemType.FEE, "20.00"),
            LineItem.of("Diagnose Motor", ItemType.LABOR, "90.00"),
            LineItem.of("Motoröl 5W30", ItemType.PARTS, "65.00"),
            LineItem.of("ASR Sensor", ItemType.PARTS, "210.00"),
            LineItem.of("Halter", ItemType.PARTS, "12.00")
    };

    /** First stage that answers wins, as in the cascade; unanswered items stay empty. */
    private static List<Optional<LineItemCoverage>> runStages() {
        ClaimContext context = CoverageFixtures.context(CoverageFixtures.enginePolicy(), CLAIM);
        List<Optional<LineItemCoverage>> verdicts = new ArrayList<>();
        for (int i = 0; i < CLAIM.length; i++) {
            Optional<LineItemCoverage> verdict = Optional.empty();
            for (CoverageStrategy stage : STAGES) {
                verdict = stage.evaluate(i, CLAIM[i], context);
                if (verdict.isPresent()) break;
            }
            verdicts.add(verdict);
        }
        return verdicts;
    }

    @Test
    void sameClaimGivesSameVerdicts() {
        List<Optional<LineItemCoverage>> first = runStages();
        List<Optional<LineItemCoverage>> second = runStages();

        assertThat(second).isEqualTo(first);
        assertThat(first).filteredOn(Optional::isPresent).hasSizeGreaterThanOrEqualTo(6);
    }
}
