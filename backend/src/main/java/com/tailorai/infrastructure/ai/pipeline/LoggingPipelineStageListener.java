package com.tailorai.infrastructure.ai.pipeline;

import com.tailorai.domain.tailor.model.PipelineStage;
import com.tailorai.domain.tailor.service.PipelineStageListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
public class LoggingPipelineStageListener implements PipelineStageListener {

    @Override
    public void onStageStarted(String requestId, PipelineStage stage) {
        log.debug("[Stage] {} started - request {}", stage, requestId);
    }

    @Override
    public void onStageCompleted(String requestId, PipelineStage stage, long durationMs, String outcome) {
        log.info("[Stage] {} {} in {}ms - request {}", stage, outcome, durationMs, requestId);
    }
}
