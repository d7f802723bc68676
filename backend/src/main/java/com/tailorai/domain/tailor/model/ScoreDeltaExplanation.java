package com.tailorai.domain.tailor.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Human-readable account of how the score moved between baseline and tailored resume.
 *
 * @param generated false when the templated fallback was used instead of a generated summary
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScoreDeltaExplanation(
        int baselineScore,
        int finalScore,
        int scoreDelta,
        String improvementSummary,
        List<String> topKeywordsAdded,
        List<String> weakAreasRemaining,
        boolean generated
) {
}
