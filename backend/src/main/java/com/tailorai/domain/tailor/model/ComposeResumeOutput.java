package com.tailorai.domain.tailor.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.tailorai.domain.resume.model.*;

import java.util.List;

/**
 * Tailored resume produced by the composer.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ComposeResumeOutput(
        ContactBasics basics,
        String summary,
        SkillSet skills,
        List<ExperienceEntry> experience,
        List<EducationEntry> education,
        List<ProjectEntry> projects,
        List<CommunityEntry> community
) {
    public static final List<String> REQUIRED_FIELDS = List.of(
            "basics", "summary", "skills", "experience", "education", "projects", "community");

    public ComposeResumeOutput {
        basics = basics == null ? ContactBasics.empty() : basics;
        skills = skills == null ? SkillSet.empty() : skills;
        experience = ModelLists.nonNullElements(experience);
        education = ModelLists.nonNullElements(education);
        projects = ModelLists.nonNullElements(projects);
        community = ModelLists.nonNullElements(community);
    }

    /**
     * Experience entries that are part of the tailored resume, i.e. not marked as removed.
     */
    public List<ExperienceEntry> retainedExperience() {
        return experience.stream().filter(e -> !e.hasRemovalReason()).toList();
    }
}
