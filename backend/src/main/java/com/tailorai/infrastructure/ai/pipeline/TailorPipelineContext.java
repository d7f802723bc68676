package com.tailorai.infrastructure.ai.pipeline;

import com.tailorai.domain.resume.model.CandidateProfile;
import com.tailorai.domain.scoring.model.AtsScoreResult;
import com.tailorai.domain.tailor.model.*;
import com.tailorai.infrastructure.ai.parsing.JsonResponseParser;
import com.tailorai.infrastructure.ai.validation.BulletRewriteValidator;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mutable context passed through the tailoring stages.
 * Accumulates results from each stage for the next.
 */
@Data
public class TailorPipelineContext {

    // --- Input ---
    private TailorRequest request;
    private List<String> topKeywords = List.of();
    private int yearsExperience;

    // --- Baseline ---
    private AtsScoreResult baselineScore;

    // --- Bullets ---
    private List<BulletRewriteRecord> bulletRecords = new ArrayList<>();
    private Map<String, List<String>> rewrittenBullets = new LinkedHashMap<>();

    // --- Compose ---
    private ComposeResumeOutput composedResume;
    private List<AttemptLog> composeAttempts = List.of();
    private List<String> composeFailures = List.of();

    // --- Render / rescore ---
    private String finalMarkdown;
    private CandidateProfile rescoredProfile;
    private AtsScoreResult finalScore;

    // --- Explanation / audit ---
    private ScoreDeltaExplanation explanation;
    private IntegrityAuditOutput integrity;

    private List<AiCallRecord> aiCalls = new ArrayList<>();

    public String requestId() {
        return request.requestId();
    }

    public CandidateProfile profile() {
        return request.candidateProfile();
    }

    public boolean needsUserConfirmation() {
        boolean bulletNeedsMetric = bulletRecords.stream().anyMatch(BulletRewriteRecord::needsUserMetric);
        boolean markerLeft = finalMarkdown != null && finalMarkdown.contains(BulletRewriteValidator.METRIC_MARKER);
        return bulletNeedsMetric || markerLeft;
    }

    public KeywordSummary toKeywordSummary() {
        List<String> before = baselineScore.matchedKeywords();
        List<String> after = finalScore.matchedKeywords();
        Set<String> added = new LinkedHashSet<>(after);
        before.forEach(added::remove);
        return new KeywordSummary(
                topKeywords,
                before,
                after,
                List.copyOf(added),
                profile().skills().totalCount(),
                rescoredProfile.skills().totalCount());
    }

    public OrchestrationResult toResult() {
        return new OrchestrationResult(
                true, null, null,
                needsUserConfirmation(),
                finalMarkdown,
                composedResume,
                rescoredProfile,
                baselineScore,
                finalScore,
                explanation,
                integrity,
                List.copyOf(bulletRecords),
                toKeywordSummary(),
                composeAttempts,
                List.copyOf(aiCalls),
                null);
    }

    /**
     * Result of a request whose composition failed on every attempt.
     * The failure kind follows the issues of the last attempt.
     */
    public OrchestrationResult toComposeFailure(String fallbackMarkdown) {
        FailureKind kind = composeFailureKind();
        return new OrchestrationResult(
                false,
                composeFailurePrefix(kind) + ":\n" + String.join("\n", composeFailures),
                kind,
                needsUserConfirmation(),
                null, null, null,
                baselineScore, null, null, null,
                List.copyOf(bulletRecords),
                null,
                composeAttempts,
                List.copyOf(aiCalls),
                fallbackMarkdown);
    }

    FailureKind composeFailureKind() {
        if (composeAttempts.isEmpty()) {
            return FailureKind.GENERATION_FAILURE;
        }
        List<ValidationIssue> issues = composeAttempts.get(composeAttempts.size() - 1).issues();
        if (issues.stream().anyMatch(i -> i.type() == ValidationIssueType.GENERATION_FAILED)) {
            return FailureKind.GENERATION_FAILURE;
        }
        if (issues.stream().anyMatch(i -> i.type() == ValidationIssueType.PARSE_FAILED)) {
            boolean missingFields = issues.stream()
                    .anyMatch(i -> i.message().contains(JsonResponseParser.MISSING_FIELDS));
            return missingFields ? FailureKind.MISSING_FIELD : FailureKind.PARSE_FAILURE;
        }
        if (!issues.isEmpty() && issues.stream().allMatch(i -> i.type() == ValidationIssueType.COMPOSE_FIELD_MISSING)) {
            return FailureKind.MISSING_FIELD;
        }
        return FailureKind.VALIDATION_FAILURE;
    }

    private static String composeFailurePrefix(FailureKind kind) {
        return switch (kind) {
            case GENERATION_FAILURE -> "Resume composition failed, the model call did not succeed";
            case PARSE_FAILURE -> "Resume composition failed, the output could not be parsed";
            case MISSING_FIELD -> "Resume composition failed, required fields are missing";
            default -> "Resume composition failed validation";
        };
    }
}
