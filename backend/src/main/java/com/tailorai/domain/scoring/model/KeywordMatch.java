package com.tailorai.domain.scoring.model;

import java.util.List;

/**
 * @param locations any of "summary", "skills", "experience"
 */
public record KeywordMatch(
        String keyword,
        List<String> locations
) {
}
