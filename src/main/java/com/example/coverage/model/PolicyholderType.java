package com.example.coverage.model;

public enum PolicyholderType {
    INDIVIDUAL, COMPANY;

    /** How the type was established. */
    public enum Source {
        DECLARED, SUFFIX_HEURISTIC, DEFAULT
    }
}
