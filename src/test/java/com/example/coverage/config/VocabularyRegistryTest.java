package com.example.coverage.config;

import com.example.coverage.CoverageFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("VocabularyRegistry Tests")
class VocabularyRegistryTest {

    private final VocabularyLoader loader = new VocabularyLoader();

    private static CoverageProperties properties(String defaultTenant, Map<String, CoverageProperties.Tenant> tenants) {
        return new CoverageProperties(defaultTenant, tenants, null, null, null, null);
    }

    @Test
    @DisplayName("Blank tenant resolves to the default tenant")
    void defaultTenant() {
        Map<String, CoverageProperties.Tenant> tenants = new LinkedHashMap<>();
        tenants.put("nsa", new CoverageProperties.Tenant(CoverageFixtures.TEST_VOCABULARY, false));
        tenants.put("fleet", new CoverageProperties.Tenant(null, true));

        VocabularyRegistry registry = VocabularyRegistry.fromProperties(properties("nsa", tenants), loader);

        assertThat(registry.get(null).version()).isEqualTo("test-1");
        assertThat(registry.get(" ").version()).isEqualTo("test-1");
        assertThat(registry.get("fleet").version()).isEqualTo("empty");
        assertThat(registry.tenants()).containsExactlyInAnyOrder("nsa", "fleet");
    }

    @Test
    @DisplayName("Unknown tenant is rejected")
    void unknownTenant() {
        VocabularyRegistry registry = VocabularyRegistry.fromProperties(properties("nsa",
                Map.of("nsa", new CoverageProperties.Tenant(CoverageFixtures.TEST_VOCABULARY, false))), loader);

        assertThatThrownBy(() -> registry.get("acme"))
                .isInstanceOf(UnknownTenantException.class)
                .hasMessageContaining("acme");
    }

    @Test
    @DisplayName("Tenant without a location must opt in to the empty vocabulary")
    void emptyVocabularyRequiresOptIn() {
        assertThatThrownBy(() -> VocabularyRegistry.fromProperties(properties("nsa",
                Map.of("nsa", new CoverageProperties.Tenant(null, false))), loader))
                .isInstanceOf(VocabularyException.class)
                .hasMessageContaining("does not allow the empty vocabulary");
    }

    @Test
    @DisplayName("A broken vocabulary fails startup")
    void brokenVocabularyFails() {
        assertThatThrownBy(() -> VocabularyRegistry.fromProperties(properties("nsa",
                Map.of("nsa", new CoverageProperties.Tenant("classpath:vocabulary/invalid-regex.yaml", false))), loader))
                .isInstanceOf(VocabularyException.class);
    }

    @Test
    @DisplayName("Default tenant must be configured")
    void defaultTenantMustExist() {
        assertThatThrownBy(() -> VocabularyRegistry.fromProperties(properties("nsa",
                Map.of("other", new CoverageProperties.Tenant(CoverageFixtures.TEST_VOCABULARY, false))), loader))
                .isInstanceOf(VocabularyException.class)
                .hasMessageContaining("Default tenant 'nsa'");
    }
}
