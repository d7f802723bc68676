package com.tailorai.domain.resume.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Structured resume used as ground truth for every generation stage.
 * Absent collections are normalized to empty lists and null elements are dropped.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CandidateProfile(
        @JsonAlias("contact") ContactBasics basics,
        String summary,
        SkillSet skills,
        List<ExperienceEntry> experience,
        List<EducationEntry> education,
        List<ProjectEntry> projects,
        List<Certification> certifications,
        List<CommunityEntry> community
) {
    public CandidateProfile {
        basics = basics == null ? ContactBasics.empty() : basics;
        skills = skills == null ? SkillSet.empty() : skills;
        experience = ModelLists.nonNullElements(experience);
        education = ModelLists.nonNullElements(education);
        projects = ModelLists.nonNullElements(projects);
        certifications = ModelLists.nonNullElements(certifications);
        community = ModelLists.nonNullElements(community);
    }

    @JsonIgnore
    public List<String> allBullets() {
        return experience.stream()
                .flatMap(e -> e.bullets().stream())
                .toList();
    }

    @JsonIgnore
    public boolean hasSummary() {
        return summary != null && !summary.isBlank();
    }

    public CandidateProfile withSkills(SkillSet newSkills) {
        return new CandidateProfile(basics, summary, newSkills, experience, education, projects, certifications, community);
    }

    public CandidateProfile withExperience(List<ExperienceEntry> newExperience) {
        return new CandidateProfile(basics, summary, skills, newExperience, education, projects, certifications, community);
    }

    public CandidateProfile withCertifications(List<Certification> newCertifications) {
        return new CandidateProfile(basics, summary, skills, experience, education, projects, newCertifications, community);
    }
}
