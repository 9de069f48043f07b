package com.example.coverage.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Tenant vocabularies, loaded once at startup. Read-only afterwards.
 */
public class VocabularyRegistry {

    private static final Logger log = LoggerFactory.getLogger(VocabularyRegistry.class);

    private final Map<String, TenantVocabulary> vocabularies;
    private final String defaultTenant;

    public VocabularyRegistry(Map<String, TenantVocabulary> vocabularies, String defaultTenant) {
        this.vocabularies = Map.copyOf(vocabularies);
        this.defaultTenant = defaultTenant;
    }

    /**
     * Loads every configured tenant. A tenant with a location that fails to load aborts
     * startup; a tenant without a location receives the empty vocabulary only when it
     * explicitly allows it.
     */
    public static VocabularyRegistry fromProperties(CoverageProperties properties, VocabularyLoader loader) {
        Map<String, TenantVocabulary> loaded = new LinkedHashMap<>();
        properties.tenants().forEach((tenant, config) -> {
            String location = config != null ? config.vocabulary() : null;
            if (location == null || location.isBlank()) {
                if (config == null || !config.allowEmpty()) {
                    throw new VocabularyException("Tenant '" + tenant + "' has no vocabulary location "
                            + "and does not allow the empty vocabulary");
                }
                log.warn("Tenant '{}' uses the empty vocabulary: every item will go to the LLM stage or review",
                        tenant);
                loaded.put(tenant, TenantVocabulary.empty());
            } else {
                loaded.put(tenant, loader.load(location));
            }
        });
        if (!loaded.containsKey(properties.defaultTenant())) {
            throw new VocabularyException("Default tenant '" + properties.defaultTenant() + "' is not configured");
        }
        return new VocabularyRegistry(loaded, properties.defaultTenant());
    }

    /**
     * @param tenant tenant id, or {@code null} for the default tenant
     * @throws UnknownTenantException if no vocabulary is registered for the tenant
     */
    public TenantVocabulary get(String tenant) {
        String key = resolveTenant(tenant);
        TenantVocabulary vocabulary = vocabularies.get(key);
        if (vocabulary == null) {
            throw new UnknownTenantException(key);
        }
        return vocabulary;
    }

    public String resolveTenant(String tenant) {
        return tenant == null || tenant.isBlank() ? defaultTenant : tenant;
    }

    public Set<String> tenants() {
        return vocabularies.keySet();
    }
}
