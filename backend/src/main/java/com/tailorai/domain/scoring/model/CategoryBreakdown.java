package com.tailorai.domain.scoring.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record CategoryBreakdown(
        int keywordMatch,
        int sectionCompleteness,
        int formattingSafety,
        int contentQuality,
        int jobMatchRelevance
) {
    public static final int KEYWORD_MATCH_MAX = 40;
    public static final int SECTION_COMPLETENESS_MAX = 20;
    public static final int FORMATTING_SAFETY_MAX = 15;
    public static final int CONTENT_QUALITY_MAX = 15;
    public static final int JOB_MATCH_RELEVANCE_MAX = 10;

    public int total() {
        return keywordMatch + sectionCompleteness + formattingSafety + contentQuality + jobMatchRelevance;
    }
}
