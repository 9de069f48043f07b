package com.example.coverage.service;

/**
 * Structured-output language model client.
 */
public interface StructuredLlmClient {

    /**
     * Sends one prompt and parses the answer into {@code type}.
     *
     * @throws LlmCallException when every attempt failed
     */
    <T> T call(LlmCallContext context, String systemPrompt, String userPrompt, Class<T> type);
}
