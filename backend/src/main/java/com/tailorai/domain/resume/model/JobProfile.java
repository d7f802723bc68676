package com.tailorai.domain.resume.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Parsed job description.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record JobProfile(
        @JsonProperty("raw_text") String rawText,
        @JsonProperty("top_10_keywords") List<String> top10Keywords,
        @JsonProperty("top_25_keywords") List<String> top25Keywords,
        @JsonProperty("required_skills") List<String> requiredSkills
) {
    public JobProfile {
        top10Keywords = top10Keywords == null ? List.of() : top10Keywords;
        top25Keywords = top25Keywords == null ? List.of() : top25Keywords;
        requiredSkills = requiredSkills == null ? List.of() : requiredSkills;
    }

    /**
     * Top ten keywords, falling back to the head of the top-25 list.
     */
    public List<String> effectiveTop10() {
        if (!top10Keywords.isEmpty()) {
            return top10Keywords;
        }
        return top25Keywords.stream().limit(10).toList();
    }
}
