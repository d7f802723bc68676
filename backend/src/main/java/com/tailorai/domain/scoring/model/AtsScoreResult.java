package com.tailorai.domain.scoring.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Deterministic ATS score of a profile against a job.
 *
 * @param atsScore          sum of the five capped sub-scores, 0..100
 * @param categoryBreakdown the sub-scores
 * @param keywordMatches    top-25 keywords found in the profile, with where they were found
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AtsScoreResult(
        int atsScore,
        CategoryBreakdown categoryBreakdown,
        List<KeywordMatch> keywordMatches
) {
    public List<String> matchedKeywords() {
        return keywordMatches.stream().map(KeywordMatch::keyword).toList();
    }
}
