package com.tailorai;

import com.tailorai.domain.resume.model.*;

import java.util.List;

/**
 * Shared resume and job fixtures.
 */
public final class TestProfiles {

    private TestProfiles() {
    }

    public static final String JOB_TEXT = "We are hiring a backend engineer to build data pipeline services in Python "
            + "on AWS. Experience with SQL, Docker and Kubernetes is a plus.";

    public static ContactBasics contact() {
        return new ContactBasics("Jane Doe", "jane@example.com", "555-0100", "Austin, TX", null);
    }

    public static ExperienceEntry acme() {
        return new ExperienceEntry("Software Engineer", "Acme Corp", "Jan 2020", "Present", "Austin, TX",
                List.of("Built ETL pipeline processing 2 million records daily",
                        "Reduced API latency by 40% using caching"),
                null);
    }

    public static ExperienceEntry beta() {
        return new ExperienceEntry("Junior Developer", "Beta Inc", "Jun 2017", "Dec 2019", "Dallas, TX",
                List.of("Developed internal reporting tools for the finance team"),
                null);
    }

    public static EducationEntry university() {
        return new EducationEntry("State University", "BS Computer Science", "2013", "2017", "Algorithms, Databases");
    }

    public static CandidateProfile candidate() {
        return new CandidateProfile(
                contact(),
                "Backend engineer with 6 years building data pipelines in Python.",
                new SkillSet(List.of("Python", "SQL", "Docker"), List.of("Git", "Jira"), List.of("Communication")),
                List.of(acme(), beta()),
                List.of(university()),
                List.of(new ProjectEntry("Ledger", "Personal budgeting tool", List.of("Wrote a CLI in Python"))),
                List.of(new Certification("Scrum Master", "Scrum Alliance", "2021")),
                List.of(new CommunityEntry("Code for Good", "Volunteer Mentor", "Mentored students on weekends")));
    }

    public static JobProfile job() {
        return new JobProfile(
                JOB_TEXT,
                List.of("python", "aws", "pipeline", "sql"),
                List.of("python", "aws", "pipeline", "sql", "docker", "kubernetes"),
                List.of("python", "aws", "pipeline"));
    }
}
