package com.tailorai.domain.tailor.service;

import com.tailorai.domain.tailor.model.PipelineStage;

/**
 * Receives stage boundary events of a tailoring request.
 */
public interface PipelineStageListener {

    void onStageStarted(String requestId, PipelineStage stage);

    /**
     * @param outcome short description, e.g. {@code ok}, {@code fallback}, {@code failed}
     */
    void onStageCompleted(String requestId, PipelineStage stage, long durationMs, String outcome);

    static PipelineStageListener noop() {
        return new PipelineStageListener() {
            @Override public void onStageStarted(String requestId, PipelineStage stage) {}
            @Override public void onStageCompleted(String requestId, PipelineStage stage, long durationMs, String outcome) {}
        };
    }
}
