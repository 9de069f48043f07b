package com.example.coverage.model;

import java.time.Instant;

/**
 * One LLM invocation attempt as handed to the audit sink.
 *
 * @param sequence         claim-scoped monotonic call number
 * @param claimId          claim being analyzed
 * @param correlationId    caller-supplied id, unique per call
 * @param purpose          what the call was for (item classification, primary repair, ...)
 * @param itemIndex        line item index, {@code null} for claim-level calls
 * @param attempt          1-based attempt number
 * @param model            model name requested
 * @param systemPrompt     system prompt sent
 * @param userPrompt       user prompt sent
 * @param response         raw response text, {@code null} on transport failure
 * @param error            failure message, {@code null} on success
 * @param promptTokens     prompt tokens reported by the provider
 * @param completionTokens completion tokens reported by the provider
 * @param timestamp        when the attempt finished
 */
public record LlmAuditRecord(
        long sequence,
        String claimId,
        String correlationId,
        String purpose,
        Integer itemIndex,
        int attempt,
        String model,
        String systemPrompt,
        String userPrompt,
        String response,
        String error,
        long promptTokens,
        long completionTokens,
        Instant timestamp
) {
    public boolean succeeded() {
        return error == null;
    }
}
