package com.tailorai.domain.tailor.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record KeywordSummary(
        List<String> targetKeywords,
        List<String> matchedBefore,
        List<String> matchedAfter,
        List<String> added,
        int skillCountBefore,
        int skillCountAfter
) {
}
