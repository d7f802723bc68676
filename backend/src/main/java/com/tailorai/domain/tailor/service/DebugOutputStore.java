package com.tailorai.domain.tailor.service;

/**
 * Write-only sink for raw and parsed generation output, used for post-mortem analysis.
 * Implementations never fail the caller.
 */
public interface DebugOutputStore {

    /**
     * @param requestId null or blank disables persistence for the call
     * @param stageName file-safe name of the stage, e.g. {@code compose_attempt_1}
     * @param payload   text or any JSON-serializable value
     */
    void save(String requestId, String stageName, Object payload);
}
