package com.example.coverage.model;

/**
 * Terminal verdict for a single line item.
 */
public enum CoverageStatus {
    COVERED, NOT_COVERED, REVIEW_NEEDED
}
