package com.example.coverage.service;

import com.example.coverage.config.CoverageProperties;
import com.example.coverage.model.PolicyContext;
import com.example.coverage.model.PolicyholderType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PolicyholderClassifier Tests")
class PolicyholderClassifierTest {

    private final PolicyholderClassifier classifier = new PolicyholderClassifier(CoverageProperties.defaults());

    private static PolicyContext holder(String name, PolicyholderType type) {
        return PolicyContext.builder().policyholder(name, type).build();
    }

    @Test
    @DisplayName("Declared type wins over the name")
    void declaredTypeWins() {
        var result = classifier.classify(holder("Muster AG", PolicyholderType.INDIVIDUAL));

        assertThat(result.type()).isEqualTo(PolicyholderType.INDIVIDUAL);
        assertThat(result.source()).isEqualTo(PolicyholderType.Source.DECLARED);
    }

    @ParameterizedTest
    @ValueSource(strings = {"Muster Transporte AG", "Garage Dupont SA", "Garage Dupont S.A.", "Carrosserie Rossi Sagl",
            "Autohaus Weber GmbH", "Dupont & Fils Sàrl", "Transports Favre, SA", "Müller Logistik (AG)"})
    @DisplayName("Legal-entity suffix marks a company")
    void suffixMarksCompany(String name) {
        var result = classifier.classify(holder(name, null));

        assertThat(result.type()).isEqualTo(PolicyholderType.COMPANY);
        assertThat(result.source()).isEqualTo(PolicyholderType.Source.SUFFIX_HEURISTIC);
        assertThat(result.matchedSuffix()).isNotNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"Hans Agassi", "Sandra Sanchez", "Inca Bauer", "Marco Corti"})
    @DisplayName("Suffix must match a whole token")
    void suffixInsideWordIsIgnored(String name) {
        var result = classifier.classify(holder(name, null));

        assertThat(result.type()).isEqualTo(PolicyholderType.INDIVIDUAL);
        assertThat(result.source()).isEqualTo(PolicyholderType.Source.DEFAULT);
    }

    @Test
    @DisplayName("Missing name defaults to individual")
    void missingNameDefaults() {
        var result = classifier.classify(holder(null, null));

        assertThat(result.type()).isEqualTo(PolicyholderType.INDIVIDUAL);
        assertThat(result.source()).isEqualTo(PolicyholderType.Source.DEFAULT);
        assertThat(result.matchedSuffix()).isNull();
    }

    @Test
    @DisplayName("Configured suffixes replace the built-in list")
    void configuredSuffixes() {
        var properties = new CoverageProperties(null, null, null, null,
                new CoverageProperties.Payout(new BigDecimal("0.081"), List.of("Genossenschaft")), null);
        var custom = new PolicyholderClassifier(properties);

        assertThat(custom.classify(holder("Wohnbau Genossenschaft", null)).type()).isEqualTo(PolicyholderType.COMPANY);
        assertThat(custom.classify(holder("Muster AG", null)).type()).isEqualTo(PolicyholderType.INDIVIDUAL);
    }
}
