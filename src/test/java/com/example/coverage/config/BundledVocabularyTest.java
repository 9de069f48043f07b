package com.example.coverage.config;

import com.example.coverage.CoverageFixtures;
import com.example.coverage.model.CoverageStatus;
import com.example.coverage.model.ItemType;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.service.ClaimContext;
import com.example.coverage.service.RuleEngine;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Bundled vocabulary Tests")
class BundledVocabularyTest {

    private static TenantVocabulary vocabulary;

    @BeforeAll
    static void load() {
        vocabulary = new VocabularyLoader().load("classpath:vocabulary/nsa-default.yaml");
    }

    private static Optional<LineItemCoverage> rule(String description) {
        LineItem item = LineItem.of(description, ItemType.PARTS, "50.00");
        ClaimContext context = CoverageFixtures.context(vocabulary, CoverageFixtures.enginePolicy(), item);
        return new RuleEngine().evaluate(0, item, context);
    }

    @Test
    @DisplayName("Bundled vocabulary passes validation")
    void loads() {
        assertThat(vocabulary.version()).isEqualTo("2026.10-1");
        assertThat(vocabulary.components().componentSynonyms()).isNotEmpty();
        assertThat(vocabulary.keywords().mappings()).isNotEmpty();
        assertThat(vocabulary.parts().byPartNumber()).isNotEmpty();
        assertThat(vocabulary.explanations().templates().get("fee").explanation()).contains("warranty");
        assertThat(vocabulary.explanations().templates()).containsKey("demoted_no_anchor");
    }

    @ParameterizedTest
    @ValueSource(strings = {"Öl 5W30", "Motoröl 5W-30", "Ölfilter", "Huile moteur 5L"})
    @DisplayName("Oils and filters are consumables")
    void consumables(String description) {
        assertThat(rule(description)).hasValueSatisfying(v ->
                assertThat(v.coverageStatus()).isEqualTo(CoverageStatus.NOT_COVERED));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Ölkühler", "Öl Kühler", "Ölpumpe", "Oel Wanne"})
    @DisplayName("Oil-circuit components are not consumables")
    void oilCircuitComponents(String description) {
        assertThat(rule(description)).isEmpty();
    }
}
