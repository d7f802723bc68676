package com.tailorai.application.tailor;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tailorai.domain.tailor.model.AuditSeverity;
import com.tailorai.domain.tailor.model.ComposeResumeOutput;
import com.tailorai.domain.tailor.model.KeywordSummary;

import java.util.List;

/**
 * Persistable form of a successful tailoring result.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TailoredResumeDocument(
        String requestId,
        String markdown,
        ComposeResumeOutput resume,
        int baselineScore,
        int finalScore,
        int scoreDelta,
        String improvementSummary,
        boolean integrityPassed,
        AuditSeverity integritySeverity,
        List<String> integrityIssues,
        boolean needsUserConfirmation,
        KeywordSummary keywordSummary
) {
}
