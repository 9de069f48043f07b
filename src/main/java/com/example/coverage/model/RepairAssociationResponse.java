package com.example.coverage.model;

import java.util.List;

/**
 * Structured answer of the repair-association validation call.
 */
public record RepairAssociationResponse(List<Decision> decisions) {

    /**
     * @param index            index of the re-evaluated line item
     * @param covered          true when the part belongs to the covered repair
     * @param matchedComponent policy component it corresponds to
     * @param confidence       model confidence in [0, 1]
     * @param reasoning        rationale
     */
    public record Decision(
            Integer index,
            Boolean covered,
            String matchedComponent,
            Double confidence,
            String reasoning
    ) {
    }
}
