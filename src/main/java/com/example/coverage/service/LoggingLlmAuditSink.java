package com.example.coverage.service;

import com.example.coverage.model.LlmAuditRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default audit sink: one line per attempt on the {@code llm-audit} logger. Prompts are
 * logged at DEBUG only.
 */
public class LoggingLlmAuditSink implements LlmAuditSink {

    private static final Logger audit = LoggerFactory.getLogger("llm-audit");

    @Override
    public void record(LlmAuditRecord record) {
        audit.info("seq={} claim={} correlation={} purpose={} item={} attempt={} model={} ok={} tokens={}/{}{}",
                record.sequence(), record.claimId(), record.correlationId(), record.purpose(),
                record.itemIndex() != null ? record.itemIndex() : "-", record.attempt(), record.model(),
                record.succeeded(), record.promptTokens(), record.completionTokens(),
                record.error() != null ? " error=" + record.error() : "");
        if (audit.isDebugEnabled()) {
            audit.debug("seq={} system={} user={} response={}", record.sequence(),
                    record.systemPrompt(), record.userPrompt(), record.response());
        }
    }
}
