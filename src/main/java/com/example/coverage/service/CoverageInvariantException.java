package com.example.coverage.service;

/**
 * An internal conservation rule was violated. Indicates a defect, not bad input.
 */
public class CoverageInvariantException extends RuntimeException {

    public CoverageInvariantException(String message) {
        super(message);
    }
}
