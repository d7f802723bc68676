package com.tailorai.domain.tailor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Structured output of a single bullet rewrite call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BulletRewriteOutput(
        String rewritten,
        List<String> keywordsUsed,
        boolean needsUserMetric
) {
    public BulletRewriteOutput {
        keywordsUsed = keywordsUsed == null ? List.of() : keywordsUsed;
    }
}
