package com.tailorai.domain.tailor.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tailorai.domain.resume.model.CandidateProfile;
import com.tailorai.domain.scoring.model.AtsScoreResult;

import java.util.List;

/**
 * Structured outcome of a tailoring request. Every failure path produces one of these.
 *
 * @param error            human-readable failure, null on success
 * @param failureKind      null on success
 * @param fallbackMarkdown deterministic rendering of the source profile, set only when composition failed
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record OrchestrationResult(
        boolean success,
        String error,
        FailureKind failureKind,
        boolean needsUserConfirmation,
        String finalMarkdown,
        ComposeResumeOutput finalResume,
        CandidateProfile rescoredProfile,
        AtsScoreResult baselineScore,
        AtsScoreResult finalScore,
        ScoreDeltaExplanation explanation,
        IntegrityAuditOutput integrity,
        List<BulletRewriteRecord> bulletRecords,
        KeywordSummary keywordSummary,
        List<AttemptLog> composeAttempts,
        List<AiCallRecord> aiCalls,
        String fallbackMarkdown
) {
    public static OrchestrationResult rejected(String error) {
        return new OrchestrationResult(false, error, FailureKind.INPUT_REJECTED, false,
                null, null, null, null, null, null, null,
                List.of(), null, List.of(), List.of(), null);
    }
}
