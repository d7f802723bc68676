package com.tailorai.infrastructure.ai.validation;

import com.fasterxml.jackson.databind.JsonNode;
import com.tailorai.domain.resume.model.*;
import com.tailorai.domain.tailor.model.ComposeInput;
import com.tailorai.domain.tailor.model.ComposeResumeOutput;
import com.tailorai.domain.tailor.model.ValidationIssue;
import com.tailorai.domain.tailor.model.ValidationIssueType;
import com.tailorai.domain.tailor.model.ValidationResult;
import com.tailorai.infrastructure.ai.preprocessing.ActionVerbs;
import com.tailorai.infrastructure.ai.preprocessing.ResumeTokenizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Structural guardrails for a composed resume. The composer may reorder, trim and
 * rephrase, but must not drop required sections, shrink the resume below half of
 * its source, fold community work into paid experience, alter positions and dates,
 * invent positions, skills or words, or exceed the length limit for the candidate's seniority.
 */
@Slf4j
@Component
public class ResumeComposeValidator {

    public static final int SENIOR_YEARS = 10;
    public static final int JUNIOR_WORD_LIMIT = 650;
    public static final int SENIOR_WORD_LIMIT = 1200;

    private static final double MIN_RETAINED_RATIO = 0.5;

    // Words that mark a community activity when they show up in an experience title or employer
    private static final List<String> COMMUNITY_MARKERS = List.of(
            "volunteer", "community", "hackathon", "club", "organizer", "meetup", "nonprofit", "non-profit"
    );

    private static final Set<String> SECTION_WORDS = Set.of(
            "email", "phone", "location", "summary", "skills", "experience", "education",
            "certifications", "projects", "community", "present"
    );

    public static int wordLimit(int yearsExperience) {
        return yearsExperience < SENIOR_YEARS ? JUNIOR_WORD_LIMIT : SENIOR_WORD_LIMIT;
    }

    public ValidationResult validate(ComposeInput input, JsonNode outputJson, ComposeResumeOutput output) {
        CandidateProfile source = input.profile();
        List<ValidationIssue> issues = new ArrayList<>();

        checkRequiredFields(outputJson, issues);
        checkRequiredSections(output, issues);
        checkSectionCount(source, output, issues);
        checkRemovedExperience(source, output, issues);
        checkSkillCount(source, output, issues);
        checkCommunity(source, output, issues);
        checkCoursework(source, output, issues);
        checkPositions(source, output, issues);
        checkSkillsExist(source, output, issues);
        checkFacts(source, output, issues);
        checkTokens(input, output, issues);
        checkLength(input.yearsExperience(), output, issues);

        ValidationResult result = ValidationResult.of(issues);
        log.info("[Compose] validation {} - {} issues", result.passed() ? "passed" : "failed", issues.size());
        return result;
    }

    // C-1
    private void checkRequiredFields(JsonNode outputJson, List<ValidationIssue> issues) {
        for (String field : ComposeResumeOutput.REQUIRED_FIELDS) {
            if (outputJson == null || !outputJson.has(field) || outputJson.get(field).isNull()) {
                issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_FIELD_MISSING,
                        "Missing top-level field \"" + field + "\".", field));
            }
        }
    }

    // C-2
    private void checkRequiredSections(ComposeResumeOutput output, List<ValidationIssue> issues) {
        if (output.retainedExperience().isEmpty()) {
            issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_SECTION_EMPTY,
                    "Experience section is empty.", "experience"));
        }
        if (output.education().isEmpty()) {
            issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_SECTION_EMPTY,
                    "Education section is empty.", "education"));
        }
        if (output.skills().isEmpty()) {
            issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_SECTION_EMPTY,
                    "Skills section is empty.", "skills"));
        }
    }

    // C-3
    private void checkSectionCount(CandidateProfile source, ComposeResumeOutput output, List<ValidationIssue> issues) {
        int before = countSections(source.summary(), source.skills(), source.experience().size(),
                source.education().size(), source.projects().size(), source.community().size());
        int after = countSections(output.summary(), output.skills(), output.retainedExperience().size(),
                output.education().size(), output.projects().size(), output.community().size());

        if (after < before * MIN_RETAINED_RATIO) {
            issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_SECTIONS_SHRUNK,
                    "Section count dropped from " + before + " to " + after + ".", null));
        }
    }

    // C-4
    private void checkRemovedExperience(CandidateProfile source, ComposeResumeOutput output, List<ValidationIssue> issues) {
        if (output.retainedExperience().size() >= source.experience().size()) {
            return;
        }
        boolean explained = output.experience().stream().anyMatch(ExperienceEntry::hasRemovalReason);
        if (!explained) {
            issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_REMOVAL_REASON_MISSING,
                    "Experience reduced from " + source.experience().size() + " to "
                            + output.retainedExperience().size() + " entries without a removal reason.", null));
        }
    }

    // C-5
    private void checkSkillCount(CandidateProfile source, ComposeResumeOutput output, List<ValidationIssue> issues) {
        int before = source.skills().totalCount();
        int after = output.skills().totalCount();
        if (after < before * MIN_RETAINED_RATIO) {
            issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_SKILLS_SHRUNK,
                    "Skills reduced by more than 50% (" + before + " -> " + after + ").", null));
        }
    }

    // C-6
    private void checkCommunity(CandidateProfile source, ComposeResumeOutput output, List<ValidationIssue> issues) {
        if (!source.community().isEmpty() && output.community().isEmpty()) {
            issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_COMMUNITY_MISHANDLED,
                    "Community section dropped although the source has " + source.community().size() + " entries.",
                    "community"));
        }

        Set<String> sourceEmployers = lowerSet(source.experience().stream().map(ExperienceEntry::company));
        List<String> communityNames = lowerNonBlank(source.community().stream()
                .flatMap(c -> Stream.of(c.organization(), c.role())));
        List<String> communityDescriptions = lowerNonBlank(source.community().stream().map(CommunityEntry::description));

        for (ExperienceEntry entry : output.retainedExperience()) {
            String company = lower(entry.company());
            boolean absorbed;
            if (sourceEmployers.contains(company)) {
                // A real employer may only carry community wording its source bullets already had
                String sourceBullets = source.experience().stream()
                        .filter(s -> lower(s.company()).equals(company))
                        .flatMap(s -> s.bullets().stream())
                        .map(ResumeComposeValidator::lower)
                        .collect(Collectors.joining("\n"));
                absorbed = entry.bullets().stream()
                        .map(ResumeComposeValidator::lower)
                        .anyMatch(b -> mentionsAny(b, communityNames, communityDescriptions)
                                && !mentionsAny(sourceBullets, communityNames, communityDescriptions));
            } else {
                String text = lower(entry.title()) + " " + company + " "
                        + entry.bullets().stream().map(ResumeComposeValidator::lower).collect(Collectors.joining(" "));
                absorbed = mentionsAny(text, communityNames, communityDescriptions)
                        || COMMUNITY_MARKERS.stream().anyMatch(text::contains);
            }
            if (absorbed) {
                issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_COMMUNITY_MISHANDLED,
                        "Community activity merged into experience: \"" + entry.title() + " - " + entry.company() + "\".",
                        entry.company()));
            }
        }
    }

    // C-7
    private void checkCoursework(CandidateProfile source, ComposeResumeOutput output, List<ValidationIssue> issues) {
        for (EducationEntry sourceEntry : source.education()) {
            if (!sourceEntry.hasCoursework()) {
                continue;
            }
            String institution = lower(sourceEntry.institution());
            boolean kept = output.education().stream()
                    .filter(e -> lower(e.institution()).equals(institution))
                    .anyMatch(EducationEntry::hasCoursework);
            if (!kept) {
                issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_COURSEWORK_DROPPED,
                        "Relevant coursework dropped for \"" + sourceEntry.institution() + "\".",
                        sourceEntry.institution()));
            }
        }
    }

    // C-8: every position comes from the source, with title and employer exactly as written there
    private void checkPositions(CandidateProfile source, ComposeResumeOutput output, List<ValidationIssue> issues) {
        for (ExperienceEntry entry : output.retainedExperience()) {
            if (sourcePosition(source, entry).isEmpty()) {
                issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_UNKNOWN_POSITION,
                        "Position \"" + entry.title() + " - " + entry.company() + "\" not found in source profile.",
                        entry.company()));
            }
        }
    }

    // C-9
    private void checkSkillsExist(CandidateProfile source, ComposeResumeOutput output, List<ValidationIssue> issues) {
        for (String skill : output.skills().all()) {
            if (!source.skills().containsIgnoreCase(skill)) {
                issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_UNKNOWN_SKILL,
                        "Skill \"" + skill + "\" not found in source profile.", skill));
            }
        }
    }

    // C-10: dates of known positions and every education entry are kept exactly
    private void checkFacts(CandidateProfile source, ComposeResumeOutput output, List<ValidationIssue> issues) {
        for (ExperienceEntry entry : output.retainedExperience()) {
            sourcePosition(source, entry).ifPresent(s -> {
                String before = dates(s.startDate(), s.endDate());
                String after = dates(entry.startDate(), entry.endDate());
                if (!before.equals(after)) {
                    issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_FACT_CHANGED,
                            "Dates of \"" + entry.title() + " - " + entry.company() + "\" changed from \""
                                    + before + "\" to \"" + after + "\".", after));
                }
            });
        }

        for (EducationEntry entry : output.education()) {
            boolean known = source.education().stream().anyMatch(s ->
                    exact(s.institution()).equals(exact(entry.institution()))
                            && exact(s.degree()).equals(exact(entry.degree()))
                            && dates(s.startDate(), s.endDate()).equals(dates(entry.startDate(), entry.endDate())));
            if (!known) {
                issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_FACT_CHANGED,
                        "Education \"" + entry.degree() + " - " + entry.institution() + "\" does not match the source profile.",
                        entry.institution()));
            }
        }
    }

    // C-11: every word of the composed resume is backed by the profile, the accepted rewrites or the job keywords
    private void checkTokens(ComposeInput input, ComposeResumeOutput output, List<ValidationIssue> issues) {
        Set<String> allowed = new HashSet<>(SECTION_WORDS);
        allowed.addAll(ActionVerbs.ALL);
        CandidateProfile source = input.profile();
        Stream.concat(sectionTexts(source.basics(), source.summary(), source.skills(), source.experience(),
                                source.education(), source.projects(), source.community()),
                        source.certifications().stream().flatMap(c -> Stream.of(c.name(), c.issuer(), c.date())))
                .flatMap(text -> ResumeTokenizer.wordTokens(text).stream())
                .forEach(allowed::add);
        if (input.rewrittenBullets() != null) {
            input.rewrittenBullets().values().stream()
                    .filter(Objects::nonNull)
                    .flatMap(List::stream)
                    .flatMap(b -> ResumeTokenizer.wordTokens(b).stream())
                    .forEach(allowed::add);
        }
        input.topKeywords().stream()
                .flatMap(k -> ResumeTokenizer.wordTokens(k).stream())
                .forEach(allowed::add);

        Set<String> invented = new LinkedHashSet<>();
        for (String token : composedTokens(output)) {
            if (!allowed.contains(token) && !ResumeTokenizer.isNumeric(token)) {
                invented.add(token);
            }
        }
        for (String token : invented) {
            issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_INVENTED_TOKEN,
                    "Token \"" + token + "\" not found in source profile, accepted rewrites or job keywords.", token));
        }
    }

    // C-12
    private void checkLength(int yearsExperience, ComposeResumeOutput output, List<ValidationIssue> issues) {
        int limit = wordLimit(yearsExperience);
        int words = composedTokens(output).size();
        if (words > limit) {
            issues.add(ValidationIssue.failed(ValidationIssueType.COMPOSE_TOO_LONG,
                    "Word count (" + words + ") exceeds " + limit + ".", null));
        }
    }

    private static Optional<ExperienceEntry> sourcePosition(CandidateProfile source, ExperienceEntry entry) {
        return source.experience().stream()
                .filter(s -> exact(s.company()).equals(exact(entry.company()))
                        && exact(s.title()).equals(exact(entry.title())))
                .findFirst();
    }

    private static List<String> composedTokens(ComposeResumeOutput output) {
        return sectionTexts(output.basics(), output.summary(), output.skills(), output.retainedExperience(),
                output.education(), output.projects(), output.community())
                .flatMap(text -> ResumeTokenizer.wordTokens(text).stream())
                .toList();
    }

    private static Stream<String> sectionTexts(ContactBasics basics, String summary, SkillSet skills,
                                               List<ExperienceEntry> experience, List<EducationEntry> education,
                                               List<ProjectEntry> projects, List<CommunityEntry> community) {
        Stream<String> contact = Stream.of(basics.name(), basics.email(), basics.phone(), basics.location(),
                basics.linkedinUrl());
        Stream<String> positions = experience.stream().flatMap(e -> Stream.concat(
                Stream.of(e.title(), e.company(), e.startDate(), e.endDate(), e.location()), e.bullets().stream()));
        Stream<String> schools = education.stream().flatMap(e -> Stream.of(
                e.institution(), e.degree(), e.startDate(), e.endDate(), e.relevantCoursework()));
        Stream<String> projectTexts = projects.stream().flatMap(p -> Stream.concat(
                Stream.of(p.name(), p.description()), p.bullets().stream()));
        Stream<String> communityTexts = community.stream().flatMap(c -> Stream.of(
                c.organization(), c.role(), c.description()));
        return Stream.of(contact, Stream.of(summary), skills.all().stream(), positions, schools, projectTexts, communityTexts)
                .flatMap(s -> s)
                .filter(Objects::nonNull);
    }

    private static boolean mentionsAny(String text, List<String> names, List<String> descriptions) {
        return names.stream().anyMatch(text::contains) || descriptions.stream().anyMatch(text::contains);
    }

    private static int countSections(String summary, SkillSet skills, int experience, int education,
                                     int projects, int community) {
        int count = 0;
        if (summary != null && !summary.isBlank()) count++;
        if (!skills.isEmpty()) count++;
        if (experience > 0) count++;
        if (education > 0) count++;
        if (projects > 0) count++;
        if (community > 0) count++;
        return count;
    }

    private static String dates(String start, String end) {
        return exact(start) + " - " + exact(end);
    }

    private static List<String> lowerNonBlank(Stream<String> values) {
        return values.filter(s -> s != null && !s.isBlank())
                .map(ResumeComposeValidator::lower)
                .toList();
    }

    private static Set<String> lowerSet(Stream<String> values) {
        return values.map(ResumeComposeValidator::lower).collect(Collectors.toSet());
    }

    private static String exact(String value) {
        return value == null ? "" : value.strip();
    }

    private static String lower(String value) {
        return value == null ? "" : value.strip().toLowerCase(Locale.ROOT);
    }
}
