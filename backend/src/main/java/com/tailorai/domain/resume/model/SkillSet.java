package com.tailorai.domain.resume.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Skills grouped into the three categories used throughout the pipeline.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SkillSet(
        List<String> technical,
        List<String> tools,
        List<String> soft
) {
    public SkillSet {
        technical = technical == null ? List.of() : technical;
        tools = tools == null ? List.of() : tools;
        soft = soft == null ? List.of() : soft;
    }

    public static SkillSet empty() {
        return new SkillSet(List.of(), List.of(), List.of());
    }

    @JsonIgnore
    public List<String> all() {
        return Stream.of(technical, tools, soft)
                .flatMap(List::stream)
                .filter(s -> s != null && !s.isBlank())
                .toList();
    }

    @JsonIgnore
    public int totalCount() {
        return all().size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return totalCount() == 0;
    }

    public boolean containsIgnoreCase(String skill) {
        return all().stream().anyMatch(s -> s.equalsIgnoreCase(skill.trim()));
    }

    public SkillSet withTechnicalAdded(List<String> added) {
        List<String> merged = new ArrayList<>(technical);
        merged.addAll(added);
        return new SkillSet(List.copyOf(merged), tools, soft);
    }
}
