package com.tailorai.infrastructure.ai.merge;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tailorai.domain.resume.model.*;
import com.tailorai.domain.resume.model.SecondaryProfile.SecondaryPosition;
import com.tailorai.domain.resume.model.SecondaryProfile.SecondarySkill;
import com.tailorai.domain.tailor.model.MergeResult;
import com.tailorai.domain.tailor.model.ValidationIssue;
import com.tailorai.domain.tailor.model.ValidationIssueType;
import com.tailorai.infrastructure.ai.preprocessing.ResumeTokenizer;
import com.tailorai.infrastructure.ai.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Deterministic merge of a resume with an optional professional-network profile.
 * Adds skills, certifications and bullets only when they appear verbatim in the
 * secondary raw text, then checks five integrity invariants. Invariant failures
 * are reported, never corrected.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProfileMergeEngine {

    // Structural words that may legitimately appear in a merged profile without a source token
    private static final Set<String> STRUCTURAL_TOKENS = Set.of("true", "false", "present", "current");

    private static final int MAX_HALLUCINATION_REPORTS = 15;
    private static final int MIN_ADDED_BULLET_WORDS = 6;
    private static final int MAX_ADDED_BULLET_WORDS = 50;

    private final ObjectMapper objectMapper;
    private final TextNormalizer textNormalizer;

    /**
     * @param resumeJson parsed resume, with either {@code basics} or {@code contact} and an optional {@code raw_text}
     * @param job        parsed job description
     * @param secondary  parsed secondary profile, or null to skip enrichment
     */
    public MergeResult merge(JsonNode resumeJson, JobProfile job, SecondaryProfile secondary) {
        CandidateProfile base = readProfile(resumeJson);
        String secondaryRaw = secondary == null ? "" : secondary.rawText();

        Set<String> top25 = job.top25Keywords().stream()
                .filter(Objects::nonNull)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());

        List<String> addedSkills = new ArrayList<>();
        List<Certification> addedCertifications = new ArrayList<>();
        List<String> addedBullets = new ArrayList<>();

        CandidateProfile merged = base;
        if (secondary != null) {
            merged = enrichSkills(merged, secondary, top25, addedSkills);
            merged = enrichCertifications(merged, secondary, addedCertifications);
            merged = enrichBullets(merged, secondary, addedBullets);
        }

        List<ValidationIssue> failures = new ArrayList<>();
        checkResumeIntegrity(base, merged, failures);
        checkPositionCount(base, merged, failures);
        checkSkillLegitimacy(addedSkills, secondary, top25, failures);
        checkBulletIntegrity(addedBullets, secondaryRaw, failures);
        checkHallucination(resumeJson, merged, secondaryRaw, failures);

        log.info("[Merge] added skills={}, certifications={}, bullets={}, failures={}",
                addedSkills.size(), addedCertifications.size(), addedBullets.size(), failures.size());

        return new MergeResult(failures.isEmpty(), List.copyOf(failures), merged,
                List.copyOf(addedSkills), List.copyOf(addedCertifications), List.copyOf(addedBullets));
    }

    // ===== Enrichment =====

    private CandidateProfile enrichSkills(CandidateProfile profile, SecondaryProfile secondary,
                                          Set<String> top25, List<String> added) {
        Set<String> present = profile.skills().all().stream()
                .map(String::toLowerCase)
                .collect(Collectors.toCollection(HashSet::new));

        for (SecondarySkill entry : secondary.skills()) {
            String skill = entry.skill();
            if (skill == null || skill.isBlank()) {
                continue;
            }
            String lower = skill.toLowerCase();
            if (!present.contains(lower) && top25.contains(lower) && isVerbatim(skill, secondary.rawText())) {
                added.add(skill);
                present.add(lower);
            }
        }
        return added.isEmpty() ? profile : profile.withSkills(profile.skills().withTechnicalAdded(added));
    }

    private CandidateProfile enrichCertifications(CandidateProfile profile, SecondaryProfile secondary,
                                                  List<Certification> added) {
        Set<String> present = profile.certifications().stream()
                .map(c -> c.name() == null ? "" : c.name().toLowerCase())
                .collect(Collectors.toCollection(HashSet::new));

        for (Certification cert : secondary.certifications()) {
            if (cert.name() == null || cert.name().isBlank()) {
                continue;
            }
            String lower = cert.name().toLowerCase();
            if (!present.contains(lower) && isVerbatim(cert.name(), secondary.rawText())) {
                added.add(cert);
                present.add(lower);
            }
        }
        if (added.isEmpty()) {
            return profile;
        }
        List<Certification> certifications = new ArrayList<>(profile.certifications());
        certifications.addAll(added);
        return profile.withCertifications(List.copyOf(certifications));
    }

    private CandidateProfile enrichBullets(CandidateProfile profile, SecondaryProfile secondary, List<String> added) {
        List<ExperienceEntry> experience = new ArrayList<>();

        for (ExperienceEntry entry : profile.experience()) {
            String company = entry.company() == null ? "" : entry.company();
            List<String> bullets = new ArrayList<>(entry.bullets());
            Set<String> existing = bullets.stream()
                    .map(textNormalizer::comparisonKey)
                    .collect(Collectors.toCollection(HashSet::new));

            for (SecondaryPosition position : secondary.positions()) {
                if (!company.equalsIgnoreCase(position.company() == null ? "" : position.company())) {
                    continue;
                }
                if (!EmploymentDates.overlaps(entry.startDate(), entry.endDate(),
                        position.startDate(), position.endDate())) {
                    continue;
                }
                for (String bullet : position.bullets()) {
                    if (isAcceptableBullet(bullet, secondary.rawText()) && existing.add(textNormalizer.comparisonKey(bullet))) {
                        bullets.add(bullet);
                        added.add(bullet);
                    }
                }
            }
            experience.add(bullets.size() == entry.bullets().size() ? entry : entry.withBullets(List.copyOf(bullets)));
        }
        return added.isEmpty() ? profile : profile.withExperience(List.copyOf(experience));
    }

    private boolean isAcceptableBullet(String bullet, String secondaryRaw) {
        if (bullet == null || bullet.isBlank()) {
            return false;
        }
        int words = ResumeTokenizer.wordCount(bullet);
        if (words < MIN_ADDED_BULLET_WORDS || words > MAX_ADDED_BULLET_WORDS) {
            return false;
        }
        return ResumeTokenizer.digitRuns(bullet).stream().allMatch(secondaryRaw::contains);
    }

    // ===== Invariants =====

    // M-1: title, company and dates of every source entry are untouched
    private void checkResumeIntegrity(CandidateProfile base, CandidateProfile merged, List<ValidationIssue> failures) {
        for (int i = 0; i < base.experience().size(); i++) {
            if (i >= merged.experience().size()) {
                failures.add(ValidationIssue.failed(ValidationIssueType.MERGE_ENTRY_MODIFIED,
                        "Entry " + i + " missing from candidate profile.", null));
                return;
            }
            ExperienceEntry before = base.experience().get(i);
            ExperienceEntry after = merged.experience().get(i);
            if (!Objects.equals(before.title(), after.title())
                    || !Objects.equals(before.company(), after.company())
                    || !Objects.equals(before.startDate(), after.startDate())
                    || !Objects.equals(before.endDate(), after.endDate())) {
                failures.add(ValidationIssue.failed(ValidationIssueType.MERGE_ENTRY_MODIFIED,
                        "Resume core properties modified for entry " + i + ".", after.title()));
            }
        }
    }

    // M-2
    private void checkPositionCount(CandidateProfile base, CandidateProfile merged, List<ValidationIssue> failures) {
        if (base.experience().size() != merged.experience().size()) {
            failures.add(ValidationIssue.failed(ValidationIssueType.MERGE_POSITION_COUNT_CHANGED,
                    "Merged experience length (" + merged.experience().size() + ") != original ("
                            + base.experience().size() + ").", null));
        }
    }

    // M-3
    private void checkSkillLegitimacy(List<String> addedSkills, SecondaryProfile secondary,
                                      Set<String> top25, List<ValidationIssue> failures) {
        Set<String> secondarySkills = secondary == null ? Set.of() : secondary.skills().stream()
                .map(SecondarySkill::skill)
                .filter(Objects::nonNull)
                .map(String::toLowerCase)
                .collect(Collectors.toSet());

        for (String skill : addedSkills) {
            String lower = skill.toLowerCase();
            if (!secondarySkills.contains(lower) || !top25.contains(lower)) {
                failures.add(ValidationIssue.failed(ValidationIssueType.MERGE_SKILL_NOT_VERBATIM,
                        "Added skill \"" + skill + "\" invalid. Must be in secondary skills and job top 25.", skill));
            }
        }
    }

    // M-4
    private void checkBulletIntegrity(List<String> addedBullets, String secondaryRaw, List<ValidationIssue> failures) {
        for (String bullet : addedBullets) {
            if (!isVerbatim(bullet, secondaryRaw)) {
                failures.add(ValidationIssue.failed(ValidationIssueType.MERGE_BULLET_NOT_VERBATIM,
                        "Added bullet not verbatim in secondary raw text.", bullet));
            }
            int words = ResumeTokenizer.wordCount(bullet);
            if (words < MIN_ADDED_BULLET_WORDS || words > MAX_ADDED_BULLET_WORDS) {
                failures.add(ValidationIssue.failed(ValidationIssueType.MERGE_BULLET_NOT_VERBATIM,
                        "Added bullet word count (" + words + ") out of bounds (6-50).", bullet));
            }
        }
    }

    // M-5: every token of the merged profile comes from the resume or the secondary raw text
    private void checkHallucination(JsonNode resumeJson, CandidateProfile merged, String secondaryRaw,
                                    List<ValidationIssue> failures) {
        Set<String> known = new HashSet<>(ResumeTokenizer.wordTokens(String.join(" ", stringValues(resumeJson))));
        known.addAll(ResumeTokenizer.wordTokens(secondaryRaw));

        JsonNode mergedTree = objectMapper.valueToTree(merged);
        Set<String> mergedTokens = new LinkedHashSet<>(ResumeTokenizer.wordTokens(String.join(" ", stringValues(mergedTree))));

        int reported = 0;
        for (String token : mergedTokens) {
            if (known.contains(token) || STRUCTURAL_TOKENS.contains(token)) {
                continue;
            }
            failures.add(ValidationIssue.failed(ValidationIssueType.MERGE_HALLUCINATED_TOKEN,
                    "Token hallucinated in merge: \"" + token + "\"", token));
            if (++reported >= MAX_HALLUCINATION_REPORTS) {
                break;
            }
        }
    }

    // ===== Helpers =====

    private CandidateProfile readProfile(JsonNode resumeJson) {
        try {
            return objectMapper.treeToValue(resumeJson, CandidateProfile.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Resume JSON does not match the candidate profile shape", e);
        }
    }

    /**
     * All string leaf values of a JSON tree, depth first. Includes {@code raw_text} when present.
     */
    static List<String> stringValues(JsonNode node) {
        List<String> values = new ArrayList<>();
        collectStrings(node, values);
        return values;
    }

    private static void collectStrings(JsonNode node, List<String> values) {
        if (node == null) {
            return;
        }
        if (node.isTextual()) {
            values.add(node.asText());
        } else if (node.isContainerNode()) {
            node.elements().forEachRemaining(child -> collectStrings(child, values));
        }
    }

    private static boolean isVerbatim(String query, String text) {
        return text != null && text.toLowerCase().contains(query.toLowerCase());
    }
}
