package com.tailorai.domain.resume.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ProjectEntry(
        String name,
        String description,
        List<String> bullets
) {
    public ProjectEntry {
        bullets = ModelLists.nonNullElements(bullets);
    }
}
