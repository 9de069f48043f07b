package com.example.coverage;

import com.example.coverage.config.CoverageProperties;
import com.example.coverage.config.TenantVocabulary;
import com.example.coverage.config.VocabularyLoader;
import com.example.coverage.model.LineItem;
import com.example.coverage.model.PolicyContext;
import com.example.coverage.service.ClaimContext;
import com.example.coverage.service.LlmCallLedger;

import java.util.List;

/**
 * Shared test data: the test vocabulary and a typical engine policy.
 */
public final class CoverageFixtures {

    public static final String TEST_VOCABULARY = "classpath:vocabulary/test-vocabulary.yaml";

    private static TenantVocabulary vocabulary;

    private CoverageFixtures() {
    }

    public static synchronized TenantVocabulary vocabulary() {
        if (vocabulary == null) {
            vocabulary = new VocabularyLoader().load(TEST_VOCABULARY);
        }
        return vocabulary;
    }

    /** Engine covered with oil cooler, turbocharger and EGR; brakes not covered. */
    public static PolicyContext enginePolicy() {
        return PolicyContext.builder()
                .cover("engine", "Ölkühler", "Turbolader", "Abgasrückführung", "Zylinderkopf")
                .cover("cooling_system", "Wasserpumpe", "Thermostat")
                .exclude("engine", "Zahnriemen")
                .build();
    }

    public static LlmCallLedger ledger() {
        return new LlmCallLedger(record -> { });
    }

    public static ClaimContext context(PolicyContext policy, LineItem... items) {
        return context(vocabulary(), policy, items);
    }

    public static ClaimContext context(TenantVocabulary vocabulary, PolicyContext policy, LineItem... items) {
        return new ClaimContext("CLM-TEST", List.of(items), policy, vocabulary,
                CoverageProperties.defaults().thresholds(), ledger());
    }
}
