package com.tailorai.domain.resume.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record Certification(
        String name,
        String issuer,
        String date
) {
}
