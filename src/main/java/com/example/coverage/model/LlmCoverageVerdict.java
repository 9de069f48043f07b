package com.example.coverage.model;

/**
 * Structured answer of the fallback classifier for one line item.
 *
 * @param covered          whether the model considers the item covered
 * @param category         policy category the model assigned
 * @param matchedComponent policy component the item corresponds to
 * @param confidence       model confidence in [0, 1]
 * @param reasoning        one or two sentences of rationale
 */
public record LlmCoverageVerdict(
        Boolean covered,
        String category,
        String matchedComponent,
        Double confidence,
        String reasoning
) {
}
