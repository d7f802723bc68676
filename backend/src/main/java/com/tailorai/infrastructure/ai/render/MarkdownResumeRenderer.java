package com.tailorai.infrastructure.ai.render;

import com.tailorai.domain.resume.model.*;
import com.tailorai.domain.tailor.model.ComposeResumeOutput;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Renders resumes to the markdown layout that {@link MarkdownProfileExtractor} reads back.
 */
@Component
public class MarkdownResumeRenderer {

    static final int FALLBACK_MAX_SKILLS = 12;
    static final int FALLBACK_MAX_BULLETS = 5;

    public String render(ComposeResumeOutput resume) {
        StringBuilder md = new StringBuilder();
        appendHeader(md, resume.basics());
        appendSummary(md, resume.summary());
        appendSkills(md, resume.skills());
        appendExperience(md, resume.retainedExperience(), Integer.MAX_VALUE);
        appendEducation(md, resume.education());
        appendProjects(md, resume.projects());
        appendCommunity(md, resume.community());
        return md.toString().strip() + "\n";
    }

    /**
     * Deterministic rendering of the source profile, used when composition fails.
     * Accepted bullet rewrites replace their originals, keyed by {@code company_title}.
     */
    public String renderFallback(CandidateProfile profile, Map<String, List<String>> rewrittenBullets) {
        List<ExperienceEntry> experience = profile.experience().stream()
                .map(e -> e.withBullets(rewrittenBullets.getOrDefault(bulletKey(e), e.bullets())))
                .toList();

        List<String> skills = profile.skills().all().stream().limit(FALLBACK_MAX_SKILLS).toList();

        StringBuilder md = new StringBuilder();
        appendHeader(md, profile.basics());
        appendSummary(md, profile.summary());
        if (!skills.isEmpty()) {
            md.append("## Skills\n").append(String.join(", ", skills)).append("\n\n");
        }
        appendExperience(md, experience, FALLBACK_MAX_BULLETS);
        appendEducation(md, profile.education());
        appendProjects(md, profile.projects());
        appendCommunity(md, profile.community());
        return md.toString().strip() + "\n";
    }

    /**
     * Key under which an entry's rewritten bullets are grouped.
     */
    public static String bulletKey(ExperienceEntry entry) {
        return entry.company() + "_" + entry.title();
    }

    private void appendHeader(StringBuilder md, ContactBasics basics) {
        if (notBlank(basics.name())) {
            md.append("# ").append(basics.name().strip()).append("\n");
        }
        List<String> contact = Stream.of(basics.email(), basics.phone(), basics.location(), basics.linkedinUrl())
                .filter(MarkdownResumeRenderer::notBlank)
                .map(String::strip)
                .toList();
        if (!contact.isEmpty()) {
            md.append(String.join(" | ", contact)).append("\n");
        }
        md.append("\n");
    }

    private void appendSummary(StringBuilder md, String summary) {
        if (notBlank(summary)) {
            md.append("## Summary\n").append(summary.strip()).append("\n\n");
        }
    }

    private void appendSkills(StringBuilder md, SkillSet skills) {
        if (skills.isEmpty()) {
            return;
        }
        md.append("## Skills\n");
        appendSkillLine(md, "Technical", skills.technical());
        appendSkillLine(md, "Tools", skills.tools());
        appendSkillLine(md, "Soft", skills.soft());
        md.append("\n");
    }

    private void appendSkillLine(StringBuilder md, String label, List<String> skills) {
        List<String> present = skills.stream().filter(MarkdownResumeRenderer::notBlank).toList();
        if (!present.isEmpty()) {
            md.append(label).append(": ").append(String.join(", ", present)).append("\n");
        }
    }

    private void appendExperience(StringBuilder md, List<ExperienceEntry> experience, int maxBullets) {
        if (experience.isEmpty()) {
            return;
        }
        md.append("## Experience\n");
        for (ExperienceEntry entry : experience) {
            md.append("### ").append(joinHeading(entry.title(), entry.company())).append("\n");
            String dates = dateRange(entry.startDate(), entry.endDate());
            List<String> meta = new ArrayList<>();
            if (dates != null) meta.add(dates);
            if (notBlank(entry.location())) meta.add(entry.location().strip());
            if (!meta.isEmpty()) {
                md.append(String.join(" | ", meta)).append("\n");
            }
            entry.bullets().stream()
                    .filter(MarkdownResumeRenderer::notBlank)
                    .limit(maxBullets)
                    .forEach(b -> md.append("- ").append(b.strip()).append("\n"));
            md.append("\n");
        }
    }

    private void appendEducation(StringBuilder md, List<EducationEntry> education) {
        if (education.isEmpty()) {
            return;
        }
        md.append("## Education\n");
        for (EducationEntry entry : education) {
            md.append("### ").append(nullToEmpty(entry.institution())).append("\n");
            List<String> meta = new ArrayList<>();
            if (notBlank(entry.degree())) meta.add(entry.degree().strip());
            String dates = dateRange(entry.startDate(), entry.endDate());
            if (dates != null) meta.add(dates);
            if (!meta.isEmpty()) {
                md.append(String.join(" | ", meta)).append("\n");
            }
            if (entry.hasCoursework()) {
                md.append("Relevant Coursework: ").append(entry.relevantCoursework().strip()).append("\n");
            }
            md.append("\n");
        }
    }

    private void appendProjects(StringBuilder md, List<ProjectEntry> projects) {
        if (projects.isEmpty()) {
            return;
        }
        md.append("## Projects\n");
        for (ProjectEntry project : projects) {
            md.append("### ").append(nullToEmpty(project.name())).append("\n");
            if (notBlank(project.description())) {
                md.append(project.description().strip()).append("\n");
            }
            project.bullets().stream()
                    .filter(MarkdownResumeRenderer::notBlank)
                    .forEach(b -> md.append("- ").append(b.strip()).append("\n"));
            md.append("\n");
        }
    }

    private void appendCommunity(StringBuilder md, List<CommunityEntry> community) {
        if (community.isEmpty()) {
            return;
        }
        md.append("## Community\n");
        for (CommunityEntry entry : community) {
            md.append("### ").append(joinHeading(entry.role(), entry.organization())).append("\n");
            if (notBlank(entry.description())) {
                md.append(entry.description().strip()).append("\n");
            }
            md.append("\n");
        }
    }

    private static String joinHeading(String first, String second) {
        if (notBlank(first) && notBlank(second)) {
            return first.strip() + " - " + second.strip();
        }
        return notBlank(first) ? first.strip() : nullToEmpty(second).strip();
    }

    private static String dateRange(String start, String end) {
        if (!notBlank(start) && !notBlank(end)) {
            return null;
        }
        return "*" + nullToEmpty(start).strip() + " - " + nullToEmpty(end).strip() + "*";
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
