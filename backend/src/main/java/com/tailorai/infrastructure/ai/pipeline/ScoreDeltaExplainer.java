package com.tailorai.infrastructure.ai.pipeline;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.tailorai.domain.scoring.model.AtsScoreResult;
import com.tailorai.domain.scoring.model.CategoryBreakdown;
import com.tailorai.domain.tailor.model.AiCallRecord;
import com.tailorai.domain.tailor.model.GenerationResult;
import com.tailorai.domain.tailor.model.ParseOutcome;
import com.tailorai.domain.tailor.model.ScoreDeltaExplanation;
import com.tailorai.domain.tailor.service.TextGenerationService;
import com.tailorai.infrastructure.ai.TailorPromptBuilder;
import com.tailorai.infrastructure.ai.parsing.JsonResponseParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Explains the score change between the baseline and the tailored resume.
 * Scores are never taken from the model; a templated explanation replaces a failed call.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ScoreDeltaExplainer {

    static final double TEMPERATURE = 0.2;
    static final int FALLBACK_KEYWORDS = 5;

    private final TextGenerationService textGenerationService;
    private final TailorPromptBuilder promptBuilder;
    private final JsonResponseParser responseParser;

    public record ExplanationRun(ScoreDeltaExplanation explanation, AiCallRecord call) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record GeneratedExplanation(
            String improvementSummary,
            List<String> topKeywordsAdded,
            List<String> weakAreasRemaining
    ) {
    }

    public ExplanationRun explain(AtsScoreResult baseline, AtsScoreResult finalScore, List<String> addedKeywords) {
        long start = System.currentTimeMillis();
        GenerationResult result;
        try {
            result = textGenerationService.generate(
                    promptBuilder.explanationSystemPrompt(),
                    promptBuilder.explanationUserMessage(baseline, finalScore, addedKeywords),
                    TEMPERATURE);
        } catch (RuntimeException e) {
            log.warn("[Explain] call failed, using templated explanation: {}", e.getMessage());
            return new ExplanationRun(templated(baseline, finalScore, addedKeywords),
                    AiCallRecord.failed("explain", System.currentTimeMillis() - start, e.getMessage()));
        }

        AiCallRecord call = AiCallRecord.succeeded("explain", result);
        ParseOutcome<GeneratedExplanation> parsed = responseParser.parse(
                result.text(), List.of("improvement_summary"), GeneratedExplanation.class);

        if (parsed instanceof ParseOutcome.ParseSuccess<GeneratedExplanation> success) {
            GeneratedExplanation generated = success.value();
            return new ExplanationRun(new ScoreDeltaExplanation(
                    baseline.atsScore(),
                    finalScore.atsScore(),
                    finalScore.atsScore() - baseline.atsScore(),
                    generated.improvementSummary(),
                    generated.topKeywordsAdded() == null ? List.of() : generated.topKeywordsAdded(),
                    generated.weakAreasRemaining() == null ? List.of() : generated.weakAreasRemaining(),
                    true), call);
        }

        log.warn("[Explain] unreadable response, using templated explanation");
        return new ExplanationRun(templated(baseline, finalScore, addedKeywords), call);
    }

    ScoreDeltaExplanation templated(AtsScoreResult baseline, AtsScoreResult finalScore, List<String> addedKeywords) {
        int delta = finalScore.atsScore() - baseline.atsScore();
        String summary = String.format("Score moved from %d to %d (%s%d). %d job keywords newly matched.",
                baseline.atsScore(), finalScore.atsScore(), delta >= 0 ? "+" : "", delta, addedKeywords.size());

        return new ScoreDeltaExplanation(
                baseline.atsScore(),
                finalScore.atsScore(),
                delta,
                summary,
                addedKeywords.stream().limit(FALLBACK_KEYWORDS).toList(),
                weakAreas(finalScore.categoryBreakdown()),
                false);
    }

    // Categories still below half of their maximum
    private List<String> weakAreas(CategoryBreakdown b) {
        List<String> weak = new ArrayList<>();
        if (b.keywordMatch() * 2 < CategoryBreakdown.KEYWORD_MATCH_MAX) weak.add("keyword_match");
        if (b.sectionCompleteness() * 2 < CategoryBreakdown.SECTION_COMPLETENESS_MAX) weak.add("section_completeness");
        if (b.formattingSafety() * 2 < CategoryBreakdown.FORMATTING_SAFETY_MAX) weak.add("formatting_safety");
        if (b.contentQuality() * 2 < CategoryBreakdown.CONTENT_QUALITY_MAX) weak.add("content_quality");
        if (b.jobMatchRelevance() * 2 < CategoryBreakdown.JOB_MATCH_RELEVANCE_MAX) weak.add("job_match_relevance");
        return weak;
    }
}
