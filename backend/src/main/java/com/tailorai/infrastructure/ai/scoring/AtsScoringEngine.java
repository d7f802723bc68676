package com.tailorai.infrastructure.ai.scoring;

import com.tailorai.domain.resume.model.CandidateProfile;
import com.tailorai.domain.resume.model.JobProfile;
import com.tailorai.domain.scoring.model.AtsScoreResult;
import com.tailorai.domain.scoring.model.CategoryBreakdown;
import com.tailorai.domain.scoring.model.KeywordMatch;
import com.tailorai.infrastructure.ai.preprocessing.ActionVerbs;
import com.tailorai.infrastructure.ai.preprocessing.ResumeTokenizer;
import com.tailorai.infrastructure.ai.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Deterministic, rule-based ATS score of a profile against a job.
 * Five capped sub-scores summed into 0..100. No I/O, no randomness.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AtsScoringEngine {

    private static final double SUMMARY_POINTS = 1.5;
    private static final double SKILLS_POINTS = 1.5;
    private static final double EXPERIENCE_POINTS = 1.0;
    private static final double MAX_POINTS_PER_KEYWORD = 2.0;
    private static final double MAX_RAW_KEYWORD_POINTS = 50.0;
    private static final int MAX_KEYWORDS = 25;

    private static final int MIN_SKILLS_FOR_COMPLETENESS = 5;
    private static final int CONTACT_PENALTY = 10;
    private static final int MAX_BULLET_WORDS = 40;
    private static final int FORMATTING_PENALTY = 5;

    private final TextNormalizer textNormalizer;

    public AtsScoreResult score(CandidateProfile profile, JobProfile job) {
        List<KeywordMatch> matches = new ArrayList<>();
        int keywordMatch = scoreKeywordMatch(profile, job, matches);
        int completeness = scoreSectionCompleteness(profile);
        int formatting = scoreFormattingSafety(profile);
        int contentQuality = scoreContentQuality(profile);
        int relevance = scoreJobMatchRelevance(profile, job);

        CategoryBreakdown breakdown = new CategoryBreakdown(
                keywordMatch, completeness, formatting, contentQuality, relevance);

        log.debug("ATS score {} - keyword={}, completeness={}, formatting={}, quality={}, relevance={}",
                breakdown.total(), keywordMatch, completeness, formatting, contentQuality, relevance);

        return new AtsScoreResult(breakdown.total(), breakdown, List.copyOf(matches));
    }

    // ===== KeywordMatch (0..40) =====

    private int scoreKeywordMatch(CandidateProfile profile, JobProfile job, List<KeywordMatch> matches) {
        String summary = profile.summary() == null ? "" : profile.summary().toLowerCase();
        String skills = String.join(" ", profile.skills().all()).toLowerCase();
        String bullets = String.join(" ", profile.allBullets()).toLowerCase();

        double raw = 0;
        for (String keyword : job.top25Keywords().stream().limit(MAX_KEYWORDS).toList()) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            String kw = keyword.toLowerCase();
            double points = 0;
            List<String> locations = new ArrayList<>();

            if (summary.contains(kw)) {
                points += SUMMARY_POINTS;
                locations.add("summary");
            }
            if (skills.contains(kw)) {
                points += SKILLS_POINTS;
                locations.add("skills");
            }
            if (bullets.contains(kw)) {
                points += EXPERIENCE_POINTS;
                locations.add("experience");
            }

            if (!locations.isEmpty()) {
                raw += Math.min(points, MAX_POINTS_PER_KEYWORD);
                matches.add(new KeywordMatch(keyword, List.copyOf(locations)));
            }
        }

        int scaled = (int) Math.floor(raw / MAX_RAW_KEYWORD_POINTS * CategoryBreakdown.KEYWORD_MATCH_MAX);
        return Math.min(scaled, CategoryBreakdown.KEYWORD_MATCH_MAX);
    }

    // ===== SectionCompleteness (0..20) =====

    private int scoreSectionCompleteness(CandidateProfile profile) {
        int points = 0;
        if (profile.hasSummary()) points += 5;
        if (!profile.experience().isEmpty()) points += 5;
        if (!profile.education().isEmpty()) points += 5;
        if (profile.skills().totalCount() >= MIN_SKILLS_FOR_COMPLETENESS) points += 5;

        // Penalized only when there is no way to reach the candidate
        if (!profile.basics().hasEmail() && !profile.basics().hasPhone()) {
            points -= CONTACT_PENALTY;
        }
        return clamp(points, CategoryBreakdown.SECTION_COMPLETENESS_MAX);
    }

    // ===== FormattingSafety (0..15) =====

    private int scoreFormattingSafety(CandidateProfile profile) {
        boolean longBullet = false;
        boolean duplicate = false;
        Set<String> seen = new HashSet<>();

        for (String bullet : profile.allBullets()) {
            if (bullet == null) {
                continue;
            }
            if (ResumeTokenizer.wordCount(bullet) > MAX_BULLET_WORDS) {
                longBullet = true;
            }
            if (!seen.add(textNormalizer.comparisonKey(bullet))) {
                duplicate = true;
            }
        }

        boolean emptyRequired = profile.experience().isEmpty() || profile.education().isEmpty();

        int points = CategoryBreakdown.FORMATTING_SAFETY_MAX;
        if (longBullet) points -= FORMATTING_PENALTY;
        if (emptyRequired) points -= FORMATTING_PENALTY;
        if (duplicate) points -= FORMATTING_PENALTY;
        return clamp(points, CategoryBreakdown.FORMATTING_SAFETY_MAX);
    }

    // ===== ContentQuality (0..15) =====

    private int scoreContentQuality(CandidateProfile profile) {
        int points = 0;
        for (String bullet : profile.allBullets()) {
            List<String> tokens = ResumeTokenizer.wordTokens(bullet);
            if (!tokens.isEmpty() && ActionVerbs.contains(tokens.get(0)) && ResumeTokenizer.hasDigit(bullet)) {
                points++;
            }
        }
        return Math.min(points, CategoryBreakdown.CONTENT_QUALITY_MAX);
    }

    // ===== JobMatchRelevance (0..10) =====

    private int scoreJobMatchRelevance(CandidateProfile profile, JobProfile job) {
        List<String> required = job.requiredSkills();
        if (required.isEmpty()) {
            return 0;
        }
        long matched = required.stream()
                .filter(skill -> skill != null && profile.skills().containsIgnoreCase(skill))
                .count();
        int points = (int) Math.floor((double) matched / required.size() * CategoryBreakdown.JOB_MATCH_RELEVANCE_MAX);
        return clamp(points, CategoryBreakdown.JOB_MATCH_RELEVANCE_MAX);
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(value, max));
    }
}
