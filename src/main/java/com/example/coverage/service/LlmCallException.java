package com.example.coverage.service;

/**
 * An LLM call failed after all attempts (transport error, timeout, empty or unparseable response).
 */
public class LlmCallException extends RuntimeException {

    public LlmCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
