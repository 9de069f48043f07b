package com.example.coverage.service;

import com.example.coverage.model.LineItem;
import com.example.coverage.model.LineItemCoverage;
import com.example.coverage.model.MatchMethod;

import java.util.Optional;

/**
 * One stage of the coverage cascade. A stage either resolves an item or returns empty
 * so the next stage can see it.
 */
public interface CoverageStrategy {

    MatchMethod method();

    /**
     * Stages that perform network I/O are run concurrently across the pending items;
     * local stages run inline.
     */
    default boolean remote() {
        return false;
    }

    Optional<LineItemCoverage> evaluate(int index, LineItem item, ClaimContext context);
}
