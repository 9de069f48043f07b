package com.example.coverage.config;

/**
 * A tenant vocabulary is missing or malformed. Fatal at startup.
 */
public class VocabularyException extends RuntimeException {

    public VocabularyException(String message) {
        super(message);
    }

    public VocabularyException(String message, Throwable cause) {
        super(message, cause);
    }
}
