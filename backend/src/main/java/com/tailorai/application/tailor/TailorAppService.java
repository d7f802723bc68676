package com.tailorai.application.tailor;

import com.fasterxml.jackson.databind.JsonNode;
import com.tailorai.domain.resume.model.JobProfile;
import com.tailorai.domain.resume.model.SecondaryProfile;
import com.tailorai.domain.tailor.model.MergeResult;
import com.tailorai.domain.tailor.model.OrchestrationResult;
import com.tailorai.domain.tailor.model.TailorRequest;
import com.tailorai.domain.tailor.service.PipelineStageListener;
import com.tailorai.infrastructure.ai.merge.ProfileMergeEngine;
import com.tailorai.infrastructure.ai.pipeline.ResumeTailorPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

@Slf4j
@Service
@RequiredArgsConstructor
public class TailorAppService {

    private final ProfileMergeEngine mergeEngine;
    private final ResumeTailorPipeline tailorPipeline;
    private final TailoredResumeAssembler assembler;
    private final PipelineStageListener stageListener;

    /**
     * Merge a parsed resume with the optional secondary profile and check the result.
     */
    public MergeResult mergeProfile(JsonNode resumeJson, JobProfile job, SecondaryProfile secondary) {
        MergeResult result = mergeEngine.merge(resumeJson, job, secondary);
        if (result.success()) {
            log.info("[Merge] +{} skills, +{} certifications, +{} bullets",
                    result.addedSkills().size(), result.addedCertifications().size(), result.addedBullets().size());
        } else {
            log.warn("[Merge] integrity checks failed: {}", result.failureMessages());
        }
        return result;
    }

    /**
     * Full tailoring run (guard → rewrite → compose → rescore → explain → audit).
     */
    public OrchestrationResult tailor(TailorRequest request) {
        long start = System.currentTimeMillis();
        OrchestrationResult result = tailorPipeline.execute(request, stageListener);
        long elapsed = System.currentTimeMillis() - start;

        if (result.success()) {
            log.info("[Tailor] request {} done in {}ms, score {} -> {}, {} AI calls",
                    request.requestId(), elapsed,
                    result.baselineScore().atsScore(), result.finalScore().atsScore(), result.aiCalls().size());
        } else {
            log.warn("[Tailor] request {} failed ({}) in {}ms: {}",
                    request.requestId(), result.failureKind(), elapsed, result.error());
        }
        return result;
    }

    public TailoredResumeDocument toDocument(String requestId, OrchestrationResult result) {
        return assembler.assemble(requestId, result);
    }
}
