package com.example.coverage.model;

import java.util.List;

/**
 * Repair being performed, derived from labor descriptions before item-level matching.
 *
 * @param primaryComponent       first component named by a labor line
 * @param primaryCategory        its category
 * @param isCovered              {@code TRUE} listed in the policy, {@code FALSE} not covered,
 *                               {@code null} uncertain (category covered, part not listed, not excluded)
 * @param sourceDescription      labor description that established the context
 * @param allDetectedComponents  every component detected across labor lines
 */
public record RepairContext(
        String primaryComponent,
        String primaryCategory,
        Boolean isCovered,
        String sourceDescription,
        List<String> allDetectedComponents
) {
    public RepairContext {
        allDetectedComponents = allDetectedComponents == null ? List.of() : List.copyOf(allDetectedComponents);
    }

    public static RepairContext none() {
        return new RepairContext(null, null, Boolean.FALSE, null, List.of());
    }

    public boolean isPresent() {
        return primaryComponent != null;
    }

    public boolean hasCoveredRepair() {
        return isPresent() && Boolean.TRUE.equals(isCovered);
    }
}
