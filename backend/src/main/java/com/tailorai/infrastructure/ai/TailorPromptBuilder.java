package com.tailorai.infrastructure.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tailorai.domain.resume.model.CandidateProfile;
import com.tailorai.domain.scoring.model.AtsScoreResult;
import com.tailorai.domain.tailor.model.BulletRewriteInput;
import com.tailorai.infrastructure.ai.preprocessing.ActionVerbs;
import com.tailorai.infrastructure.ai.validation.ResumeComposeValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * System prompts and user messages for every generation stage.
 */
@Component
@RequiredArgsConstructor
public class TailorPromptBuilder {

    private static final String BULLET_REWRITE_SYSTEM_PROMPT = """
            You are a strict ATS optimization assistant in BUILD mode.
            Rewrite a single resume bullet while preserving all factual content.
            You are forbidden from inventing numbers, tools, dates, responsibilities, or achievements.
            You may only use words found in:
            - the original bullet
            - the candidate profile
            - the job description
            - the approved action verb list
            If the original bullet contains no number, append "[add metric]" at the end and set needs_user_metric to true.
            Maximum 28 words.
            Return ONLY JSON in this schema:
            {"rewritten": "", "keywords_used": [], "needs_user_metric": false}""";

    private static final String COMPOSE_SYSTEM_PROMPT = """
            You are a strict ATS resume composer.
            You are assembling a final optimized resume from structured verified data.
            You must not invent or modify factual content.
            You may only reorganize, summarize, and prioritize content.
            Return ONLY valid JSON with exactly these top-level fields:
            {
              "basics": {"name": "", "email": "", "phone": "", "location": "", "linkedin_url": ""},
              "summary": "",
              "skills": {"technical": [], "tools": [], "soft": []},
              "experience": [{"title": "", "company": "", "start_date": "", "end_date": "", "location": "", "bullets": [], "removal_reason": null}],
              "education": [{"institution": "", "degree": "", "start_date": "", "end_date": "", "relevant_coursework": ""}],
              "projects": [{"name": "", "description": "", "bullets": []}],
              "community": [{"organization": "", "role": "", "description": ""}]
            }""";

    private static final String TONE_AUDIT_SYSTEM_PROMPT = """
            You are a professional resume quality auditor.
            Evaluate the resume text for tone, clarity, and professionalism.
            Do not suggest rewrites.
            Return ONLY JSON:
            {"tone_assessment": "clean | minor_issue | major_issue", "notes": ""}""";

    private static final String EXPLANATION_SYSTEM_PROMPT = """
            You are a resume optimization analyst.
            You are given the baseline and final ATS score breakdowns and the keywords matched only after tailoring.
            Explain ONLY the improvement. Do not modify scores.
            Return ONLY JSON:
            {"improvement_summary": "", "top_keywords_added": [], "weak_areas_remaining": []}""";

    private final ObjectMapper objectMapper;

    public String bulletRewriteSystemPrompt() {
        return BULLET_REWRITE_SYSTEM_PROMPT;
    }

    public String bulletRewriteUserMessage(BulletRewriteInput input) {
        return """
                Original bullet:
                %s

                Job top 10 keywords:
                %s

                Approved action verbs:
                %s

                Candidate profile text:
                %s

                Job description:
                %s""".formatted(
                input.originalBullet(),
                toJson(input.topKeywords()),
                toJson(new TreeSet<>(ActionVerbs.ALL)),
                input.candidateText(),
                input.jobText());
    }

    public String composeSystemPrompt() {
        return COMPOSE_SYSTEM_PROMPT;
    }

    public String composeUserMessage(CandidateProfile profile, Map<String, List<String>> rewrittenBullets,
                                     List<String> topKeywords, int yearsExperience) {
        String lengthLimit = "under " + ResumeComposeValidator.wordLimit(yearsExperience);
        return """
                Candidate profile JSON:
                %s

                Rewritten bullets by "company_title":
                %s

                Job top 10 keywords:
                %s

                Years of experience: %d

                Rules:
                - Keep titles, companies, and dates EXACT.
                - Do not add new bullets, roles, or skills.
                - Summary must be 100 words or fewer.
                - Use only verified skills, at most 12, prioritized by keyword relevance.
                - Keep 3-5 top bullets per role, preferring the rewritten bullets.
                - Keep education relevant_coursework when present.
                - Keep community activities in "community", never in "experience".
                - If you drop an experience entry, keep it in "experience" with a non-empty "removal_reason".
                - Total length %s words.""".formatted(
                toJson(profile),
                toJson(rewrittenBullets),
                toJson(topKeywords),
                yearsExperience,
                lengthLimit);
    }

    public String toneAuditSystemPrompt() {
        return TONE_AUDIT_SYSTEM_PROMPT;
    }

    public String toneAuditUserMessage(String markdown) {
        return "Resume text:\n" + markdown;
    }

    public String explanationSystemPrompt() {
        return EXPLANATION_SYSTEM_PROMPT;
    }

    public String explanationUserMessage(AtsScoreResult baseline, AtsScoreResult finalScore, List<String> addedKeywords) {
        return """
                Baseline:
                %s

                Final:
                %s

                Keyword differences:
                %s""".formatted(
                toJson(baseline.categoryBreakdown()),
                toJson(finalScore.categoryBreakdown()),
                toJson(addedKeywords));
    }

    /**
     * Appends the previous attempt's itemized failures to the original user message.
     */
    public String retryUserMessage(String userMessage, List<String> failures) {
        return userMessage
                + "\n\nPREVIOUS FAILURE REASONS:\n"
                + String.join("\n", failures)
                + "\nDO NOT REPEAT THESE MISTAKES.";
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize prompt input", e);
        }
    }
}
