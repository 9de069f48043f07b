package com.example.coverage.model;

/**
 * The single component judged to be the main reason for the claim.
 *
 * @param component           canonical component name
 * @param category            policy category
 * @param description         description of the item (or labor line) it was derived from
 * @param isCovered           {@code null} when coverage could not be established
 * @param confidence          confidence in [0, 1]; 0.0 when undetermined
 * @param determinationMethod tier that produced it
 * @param sourceItemIndex     index of the anchoring line item, if any
 * @param excludedVeto        true when the highest-value item is an excluded component
 * @param rationale           free-text explanation
 */
public record PrimaryRepairResult(
        String component,
        String category,
        String description,
        Boolean isCovered,
        double confidence,
        DeterminationMethod determinationMethod,
        Integer sourceItemIndex,
        boolean excludedVeto,
        String rationale
) {

    public static PrimaryRepairResult none() {
        return new PrimaryRepairResult(null, null, null, null, 0.0, DeterminationMethod.NONE, null, false,
                "Primary repair could not be determined; refer to a human reviewer");
    }

    public PrimaryRepairResult vetoed(LineItemCoverage excludedItem, String reason) {
        String vetoComponent = excludedItem.matchedComponent() != null
                ? excludedItem.matchedComponent()
                : excludedItem.description();
        return new PrimaryRepairResult(
                vetoComponent,
                excludedItem.coverageCategory() != null ? excludedItem.coverageCategory() : category,
                excludedItem.description(),
                Boolean.FALSE,
                Math.max(confidence, 0.90),
                determinationMethod,
                excludedItem.index(),
                true,
                reason
        );
    }
}
