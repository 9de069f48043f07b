package com.example.coverage.model;

/**
 * Structured answer of the primary-repair arbitration call.
 *
 * @param primaryItemIndex index of the line item that is the main repair
 * @param component        component name, preferably as written in the policy
 * @param category         policy category
 * @param confidence       model confidence in [0, 1]
 * @param reasoning        rationale
 */
public record PrimaryRepairResponse(
        Integer primaryItemIndex,
        String component,
        String category,
        Double confidence,
        String reasoning
) {
}
