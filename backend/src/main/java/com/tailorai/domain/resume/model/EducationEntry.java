package com.tailorai.domain.resume.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record EducationEntry(
        String institution,
        String degree,
        String startDate,
        String endDate,
        String relevantCoursework
) {
    public boolean hasCoursework() {
        return relevantCoursework != null && !relevantCoursework.isBlank();
    }
}
