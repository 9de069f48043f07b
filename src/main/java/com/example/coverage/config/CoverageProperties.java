package com.example.coverage.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the coverage engine. Omitted values fall back to
 * the defaults documented on each nested record.
 *
 * @param defaultTenant    tenant used when a request names none
 * @param tenants          tenant id to vocabulary location
 * @param thresholds       confidence acceptance thresholds
 * @param llm              fallback classifier settings
 * @param payout           payout formula settings
 * @param strictInvariants raise on a conservation violation instead of clamping
 */
@ConfigurationProperties(prefix = "coverage")
public record CoverageProperties(
        String defaultTenant,
        Map<String, Tenant> tenants,
        Thresholds thresholds,
        Llm llm,
        Payout payout,
        Boolean strictInvariants
) {
    public CoverageProperties {
        if (defaultTenant == null || defaultTenant.isBlank()) defaultTenant = "default";
        tenants = tenants == null ? Map.of() : Map.copyOf(tenants);
        if (thresholds == null) thresholds = new Thresholds(null, null, null, null, null, null);
        if (llm == null) llm = new Llm(null, null, null, null, null, null, null, null, null, null);
        if (payout == null) payout = new Payout(null, null);
        if (strictInvariants == null) strictInvariants = Boolean.FALSE;
    }

    public static CoverageProperties defaults() {
        return new CoverageProperties(null, null, null, null, null, null);
    }

    public CoverageProperties withLlm(Llm newLlm) {
        return new CoverageProperties(defaultTenant, tenants, thresholds, newLlm, payout, strictInvariants);
    }

    public CoverageProperties withThresholds(Thresholds newThresholds) {
        return new CoverageProperties(defaultTenant, tenants, newThresholds, llm, payout, strictInvariants);
    }

    public CoverageProperties strict() {
        return new CoverageProperties(defaultTenant, tenants, thresholds, llm, payout, Boolean.TRUE);
    }

    /**
     * Vocabulary source for one tenant.
     *
     * @param vocabulary resource location (classpath: or file:) of the YAML document
     * @param allowEmpty use the empty vocabulary when no location is given
     */
    public record Tenant(String vocabulary, boolean allowEmpty) {
    }

    /**
     * Confidence thresholds.
     *
     * @param keywordMinConfidence        keyword verdicts below this escalate (default 0.80)
     * @param partNumberMinConfidence     part-number verdicts below this escalate (default 0.80)
     * @param unlistedComponentConfidence confidence of a catalog hit whose component the policy
     *                                    does not list (default 0.95, i.e. strict denial)
     * @param llmCoveredThreshold         minimum confidence to accept an LLM COVERED verdict (default 0.60)
     * @param llmNotCoveredThreshold      minimum confidence to accept an LLM NOT_COVERED verdict;
     *                                    also the review floor (default 0.40)
     * @param llmMaxConfidence            cap applied to model-reported confidence (default 0.85)
     */
    public record Thresholds(
            Double keywordMinConfidence,
            Double partNumberMinConfidence,
            Double unlistedComponentConfidence,
            Double llmCoveredThreshold,
            Double llmNotCoveredThreshold,
            Double llmMaxConfidence
    ) {
        public Thresholds {
            if (keywordMinConfidence == null) keywordMinConfidence = 0.80;
            if (partNumberMinConfidence == null) partNumberMinConfidence = 0.80;
            if (unlistedComponentConfidence == null) unlistedComponentConfidence = 0.95;
            if (llmCoveredThreshold == null) llmCoveredThreshold = 0.60;
            if (llmNotCoveredThreshold == null) llmNotCoveredThreshold = 0.40;
            if (llmMaxConfidence == null) llmMaxConfidence = 0.85;
        }
    }

    /**
     * Fallback classifier settings.
     *
     * @param enabled     whether unresolved items are sent to the model (default true)
     * @param model       model name (default gpt-4o)
     * @param temperature sampling temperature (default 0.0)
     * @param maxTokens   completion budget per call (default 512)
     * @param maxItems    items per claim sent to the model, the rest go to review (default 35)
     * @param concurrency parallel calls per claim (default 4)
     * @param timeout     per-item deadline including retries, counted from the start of the call (default 90s)
     * @param maxAttempts attempts per call (default 3)
     * @param baseDelay   first backoff delay, doubled per attempt (default 1s)
     * @param maxDelay    backoff cap (default 15s)
     */
    public record Llm(
            Boolean enabled,
            String model,
            Double temperature,
            Integer maxTokens,
            Integer maxItems,
            Integer concurrency,
            Duration timeout,
            Integer maxAttempts,
            Duration baseDelay,
            Duration maxDelay
    ) {
        public Llm {
            if (enabled == null) enabled = Boolean.TRUE;
            if (model == null || model.isBlank()) model = "gpt-4o";
            if (temperature == null) temperature = 0.0;
            if (maxTokens == null) maxTokens = 512;
            if (maxItems == null) maxItems = 35;
            if (concurrency == null || concurrency < 1) concurrency = 4;
            if (timeout == null) timeout = Duration.ofSeconds(90);
            if (maxAttempts == null || maxAttempts < 1) maxAttempts = 3;
            if (baseDelay == null) baseDelay = Duration.ofSeconds(1);
            if (maxDelay == null) maxDelay = Duration.ofSeconds(15);
        }

        public static Llm disabled() {
            return new Llm(false, null, null, null, null, null, null, null, null, null);
        }
    }

    /**
     * Payout formula settings.
     *
     * @param defaultVatRate  VAT rate when the policy supplies none (default 0.081)
     * @param companySuffixes legal-entity suffixes that mark a company policyholder
     */
    public record Payout(BigDecimal defaultVatRate, List<String> companySuffixes) {
        public Payout {
            if (defaultVatRate == null) defaultVatRate = new BigDecimal("0.081");
            if (companySuffixes == null || companySuffixes.isEmpty()) {
                companySuffixes = List.of("AG", "SA", "GmbH", "Sàrl", "Sarl", "Sagl", "Ltd", "Inc", "S.A.",
                        "Corp", "KG", "Co.", "LLC", "Srl");
            } else {
                companySuffixes = List.copyOf(companySuffixes);
            }
        }
    }
}
