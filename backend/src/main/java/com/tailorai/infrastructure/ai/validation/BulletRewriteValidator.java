package com.tailorai.infrastructure.ai.validation;

import com.tailorai.domain.tailor.model.BulletRewriteInput;
import com.tailorai.domain.tailor.model.BulletRewriteOutput;
import com.tailorai.domain.tailor.model.ValidationIssue;
import com.tailorai.domain.tailor.model.ValidationIssueType;
import com.tailorai.domain.tailor.model.ValidationResult;
import com.tailorai.domain.tailor.service.EmbeddingService;
import com.tailorai.infrastructure.ai.preprocessing.ActionVerbs;
import com.tailorai.infrastructure.ai.preprocessing.ResumeTokenizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Guardrails for a single rewritten bullet. Checks six rules against the
 * original bullet, the candidate text and the job description.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BulletRewriteValidator {

    public static final String METRIC_MARKER = "[add metric]";
    public static final int MAX_WORDS = 28;
    public static final double MIN_SIMILARITY = 0.85;

    private static final Set<String> MARKER_TOKENS = Set.of("add", "metric");

    private final EmbeddingService embeddingService;

    public ValidationResult validate(BulletRewriteInput input, BulletRewriteOutput output) {
        String original = input.originalBullet();
        String rewritten = output.rewritten() == null ? "" : output.rewritten();
        List<ValidationIssue> issues = new ArrayList<>();

        List<String> originalNumbers = ResumeTokenizer.numbers(original);

        checkNumbers(originalNumbers, rewritten, issues);
        checkKeywords(input.topKeywords(), output.keywordsUsed(), rewritten, issues);
        checkVocabulary(input, rewritten, issues);
        checkLength(rewritten, issues);
        checkMeaningDrift(original, rewritten, issues);
        checkMetricFlag(originalNumbers, output, rewritten, issues);

        ValidationResult result = ValidationResult.of(issues);
        if (!result.passed()) {
            log.debug("[Rewrite] guardrail failures for bullet \"{}\": {}", original, result.errorMessages());
        }
        return result;
    }

    // R-1: every number in the rewrite exists in the original
    private void checkNumbers(List<String> originalNumbers, String rewritten, List<ValidationIssue> issues) {
        for (String number : ResumeTokenizer.numbers(rewritten)) {
            if (!originalNumbers.contains(number)) {
                issues.add(ValidationIssue.failed(ValidationIssueType.REWRITE_HALLUCINATED_NUMBER,
                        "Hallucinated number \"" + number + "\"", number));
            }
        }
    }

    // R-2: declared keywords are job keywords and appear in the rewrite
    private void checkKeywords(List<String> topKeywords, List<String> keywordsUsed, String rewritten,
                               List<ValidationIssue> issues) {
        Set<String> allowed = new HashSet<>();
        topKeywords.stream()
                .filter(Objects::nonNull)
                .forEach(k -> allowed.add(k.toLowerCase(Locale.ROOT)));
        String rewrittenLower = rewritten.toLowerCase(Locale.ROOT);

        for (String keyword : keywordsUsed) {
            if (keyword == null) {
                continue;
            }
            String lower = keyword.toLowerCase(Locale.ROOT);
            if (!allowed.contains(lower)) {
                issues.add(ValidationIssue.failed(ValidationIssueType.REWRITE_ILLEGITIMATE_KEYWORD,
                        "Keyword \"" + keyword + "\" not in job top 10.", keyword));
            }
            if (!rewrittenLower.contains(lower)) {
                issues.add(ValidationIssue.failed(ValidationIssueType.REWRITE_ILLEGITIMATE_KEYWORD,
                        "Keyword \"" + keyword + "\" not verbatim in rewritten bullet.", keyword));
            }
        }
    }

    // R-3: closed vocabulary
    private void checkVocabulary(BulletRewriteInput input, String rewritten, List<ValidationIssue> issues) {
        Set<String> vocabulary = new HashSet<>(ResumeTokenizer.wordTokens(input.originalBullet()));
        vocabulary.addAll(ResumeTokenizer.wordTokens(input.candidateText()));
        vocabulary.addAll(ResumeTokenizer.wordTokens(input.jobText()));
        vocabulary.addAll(ActionVerbs.ALL);
        vocabulary.addAll(MARKER_TOKENS);

        for (String token : new LinkedHashSet<>(ResumeTokenizer.wordTokens(rewritten))) {
            // numbers are R-1's concern
            if (vocabulary.contains(token) || ResumeTokenizer.isNumeric(token)) {
                continue;
            }
            issues.add(ValidationIssue.failed(ValidationIssueType.REWRITE_TOKEN_OUTSIDE_VOCABULARY,
                    "Hallucinated token \"" + token + "\" outside boundaries.", token));
        }
    }

    // R-4
    private void checkLength(String rewritten, List<ValidationIssue> issues) {
        int words = ResumeTokenizer.wordCount(rewritten);
        if (words > MAX_WORDS) {
            issues.add(ValidationIssue.failed(ValidationIssueType.REWRITE_TOO_LONG,
                    "Word count (" + words + ") exceeds " + MAX_WORDS + ".", null));
        }
    }

    // R-5
    private void checkMeaningDrift(String original, String rewritten, List<ValidationIssue> issues) {
        double similarity;
        try {
            similarity = VectorMath.cosineSimilarity(
                    embeddingService.embed(original), embeddingService.embed(rewritten));
        } catch (RuntimeException e) {
            log.warn("[Rewrite] Embedding failed: {}", e.getMessage());
            issues.add(ValidationIssue.error(ValidationIssueType.REWRITE_MEANING_DRIFT,
                    "Failed to compute embeddings - " + e.getMessage()));
            return;
        }
        if (similarity < MIN_SIMILARITY) {
            issues.add(ValidationIssue.failed(ValidationIssueType.REWRITE_MEANING_DRIFT,
                    String.format(Locale.ROOT, "Meaning drift too high. Cosine similarity = %.3f < %.2f",
                            similarity, MIN_SIMILARITY), null));
        }
    }

    // R-6: metric marker and flag follow the original's numbers
    private void checkMetricFlag(List<String> originalNumbers, BulletRewriteOutput output, String rewritten,
                                 List<ValidationIssue> issues) {
        if (originalNumbers.isEmpty()) {
            if (!rewritten.contains(METRIC_MARKER)) {
                issues.add(ValidationIssue.failed(ValidationIssueType.REWRITE_METRIC_FLAG_MISMATCH,
                        "Rewritten must contain \"" + METRIC_MARKER + "\" when original lacks numbers.", null));
            }
            if (!output.needsUserMetric()) {
                issues.add(ValidationIssue.failed(ValidationIssueType.REWRITE_METRIC_FLAG_MISMATCH,
                        "needs_user_metric must be true when original lacks numbers.", null));
            }
        } else if (output.needsUserMetric()) {
            issues.add(ValidationIssue.failed(ValidationIssueType.REWRITE_METRIC_FLAG_MISMATCH,
                    "needs_user_metric must be false when original contains numbers.", null));
        }
    }
}
