package com.example.coverage.model;

/**
 * One row of the policy's coverage scale ("from X km onwards").
 *
 * @param kmThreshold        odometer reading from which the tier applies
 * @param coveragePercent    mileage-based coverage percentage
 * @param ageCoveragePercent percentage used instead once the vehicle reaches the
 *                           policy's age threshold; {@code null} when the tier has no age column
 */
public record CoverageTier(
        int kmThreshold,
        double coveragePercent,
        Double ageCoveragePercent
) {
}
