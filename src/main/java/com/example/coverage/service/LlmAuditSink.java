package com.example.coverage.service;

import com.example.coverage.model.LlmAuditRecord;

/**
 * Receives one record per LLM attempt. Called synchronously while the claim's ledger lock
 * is held, so records arrive in sequence order.
 */
public interface LlmAuditSink {

    void record(LlmAuditRecord record);
}
