package com.tailorai.domain.resume.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Parsed professional-network profile. Only used to enrich the resume,
 * and only with content that appears verbatim in {@code rawText}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SecondaryProfile(
        @JsonProperty("raw_text") String rawText,
        List<SecondarySkill> skills,
        List<Certification> certifications,
        List<SecondaryPosition> positions
) {
    public SecondaryProfile {
        rawText = rawText == null ? "" : rawText;
        skills = skills == null ? List.of() : skills;
        certifications = certifications == null ? List.of() : certifications;
        positions = positions == null ? List.of() : positions;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SecondarySkill(String skill) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record SecondaryPosition(
            String title,
            String company,
            String startDate,
            String endDate,
            List<String> bullets
    ) {
        public SecondaryPosition {
            bullets = bullets == null ? List.of() : bullets;
        }
    }
}
