package com.example.coverage.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Policy data for one claim, populated by the upstream extraction stage.
 * Read-only during analysis.
 * <p>
 * When {@code coveredCategories} is empty it is derived from the categories of
 * {@code coveredComponents} that list at least one part.
 */
public record PolicyContext(
        Set<String> coveredCategories,
        Map<String, List<String>> coveredComponents,
        Map<String, List<String>> excludedComponents,
        List<CoverageTier> coverageScale,
        Integer ageThresholdYears,
        BigDecimal maxCoverage,
        BigDecimal excessPercent,
        BigDecimal excessMinimum,
        Integer vehicleKm,
        Double vehicleAgeYears,
        BigDecimal vatRate,
        String policyholderName,
        PolicyholderType policyholderType
) {
    public PolicyContext {
        coveredComponents = immutableCopy(coveredComponents);
        excludedComponents = immutableCopy(excludedComponents);
        if (coveredCategories == null || coveredCategories.isEmpty()) {
            Set<String> derived = new LinkedHashSet<>();
            coveredComponents.forEach((category, parts) -> {
                if (!parts.isEmpty()) derived.add(category);
            });
            coveredCategories = Set.copyOf(derived);
        } else {
            coveredCategories = Set.copyOf(coveredCategories);
        }
        coverageScale = coverageScale == null ? List.of() : List.copyOf(coverageScale);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Map<String, List<String>> immutableCopy(Map<String, List<String>> source) {
        if (source == null) return Map.of();
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((k, v) -> copy.put(k, v == null ? List.of() : List.copyOf(v)));
        return java.util.Collections.unmodifiableMap(copy);
    }

    public static final class Builder {
        private Set<String> coveredCategories = new LinkedHashSet<>();
        private final Map<String, List<String>> coveredComponents = new LinkedHashMap<>();
        private final Map<String, List<String>> excludedComponents = new LinkedHashMap<>();
        private final List<CoverageTier> coverageScale = new ArrayList<>();
        private Integer ageThresholdYears;
        private BigDecimal maxCoverage;
        private BigDecimal excessPercent;
        private BigDecimal excessMinimum;
        private Integer vehicleKm;
        private Double vehicleAgeYears;
        private BigDecimal vatRate;
        private String policyholderName;
        private PolicyholderType policyholderType;

        private Builder() {
        }

        public Builder coveredCategories(Set<String> categories) {
            this.coveredCategories = new LinkedHashSet<>(categories);
            return this;
        }

        public Builder cover(String category, String... parts) {
            coveredComponents.put(category, List.of(parts));
            return this;
        }

        public Builder exclude(String category, String... parts) {
            excludedComponents.put(category, List.of(parts));
            return this;
        }

        public Builder tier(int kmThreshold, double coveragePercent, Double ageCoveragePercent) {
            coverageScale.add(new CoverageTier(kmThreshold, coveragePercent, ageCoveragePercent));
            return this;
        }

        public Builder ageThresholdYears(Integer years) {
            this.ageThresholdYears = years;
            return this;
        }

        public Builder maxCoverage(String amount) {
            this.maxCoverage = new BigDecimal(amount);
            return this;
        }

        public Builder excess(String percent, String minimum) {
            this.excessPercent = percent == null ? null : new BigDecimal(percent);
            this.excessMinimum = minimum == null ? null : new BigDecimal(minimum);
            return this;
        }

        public Builder vehicle(Integer km, Double ageYears) {
            this.vehicleKm = km;
            this.vehicleAgeYears = ageYears;
            return this;
        }

        public Builder vatRate(String rate) {
            this.vatRate = new BigDecimal(rate);
            return this;
        }

        public Builder policyholder(String name, PolicyholderType type) {
            this.policyholderName = name;
            this.policyholderType = type;
            return this;
        }

        public PolicyContext build() {
            return new PolicyContext(coveredCategories, coveredComponents, excludedComponents, coverageScale,
                    ageThresholdYears, maxCoverage, excessPercent, excessMinimum, vehicleKm, vehicleAgeYears,
                    vatRate, policyholderName, policyholderType);
        }
    }
}
