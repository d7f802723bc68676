package com.tailorai.infrastructure.ai.validation;

import com.tailorai.TestProfiles;
import com.tailorai.domain.tailor.exception.AiGenerationException;
import com.tailorai.domain.tailor.model.BulletRewriteInput;
import com.tailorai.domain.tailor.model.BulletRewriteOutput;
import com.tailorai.domain.tailor.model.ValidationIssueType;
import com.tailorai.domain.tailor.model.ValidationResult;
import com.tailorai.domain.tailor.service.EmbeddingService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BulletRewriteValidatorTest {

    private static final String WITH_NUMBER = "Reduced API latency by 40% using caching";
    private static final String WITHOUT_NUMBER = "Developed internal reporting tools for the finance team";
    private static final String CANDIDATE_TEXT = "Backend engineer with 6 years building data pipelines in Python.\n"
            + "Python, SQL, Docker, Git, Jira, Communication";

    @Mock
    private EmbeddingService embeddingService;

    private BulletRewriteValidator validator;

    @BeforeEach
    void setUp() {
        validator = new BulletRewriteValidator(embeddingService);
        lenient().when(embeddingService.embed(anyString())).thenReturn(new double[]{1.0, 0.0});
    }

    private static BulletRewriteInput input(String original) {
        return new BulletRewriteInput(original, CANDIDATE_TEXT, TestProfiles.JOB_TEXT,
                List.of("python", "aws", "pipeline", "sql"));
    }

    private ValidationResult validate(String original, String rewritten, List<String> keywords, boolean needsMetric) {
        return validator.validate(input(original), new BulletRewriteOutput(rewritten, keywords, needsMetric));
    }

    private static boolean hasType(ValidationResult result, ValidationIssueType type) {
        return result.issues().stream().anyMatch(i -> i.type() == type);
    }

    @Test
    @DisplayName("faithful rewrite passes every check")
    void faithfulRewritePasses() {
        ValidationResult result = validate(WITH_NUMBER,
                "Reduced API latency by 40% using caching in Python services", List.of("python"), false);

        assertThat(result.passed()).isTrue();
        assertThat(result.issues()).isEmpty();
    }

    @Nested
    @DisplayName("R-1: numbers")
    class NumberTests {

        @Test
        void new_number_fails() {
            ValidationResult result = validate(WITH_NUMBER, "Reduced API latency by 45% using caching", List.of(), false);

            assertThat(hasType(result, ValidationIssueType.REWRITE_HALLUCINATED_NUMBER)).isTrue();
            assertThat(result.errorMessages()).contains("TEST R-1 FAILED: Hallucinated number \"45\"");
        }

        @Test
        void decimal_is_one_number() {
            ValidationResult result = validate("Cut costs by 2.5 percent", "Reduced costs by 2.5 percent", List.of(), false);

            assertThat(hasType(result, ValidationIssueType.REWRITE_HALLUCINATED_NUMBER)).isFalse();
        }
    }

    @Nested
    @DisplayName("R-2: keywords")
    class KeywordTests {

        @Test
        void keyword_outside_top_10_fails() {
            ValidationResult result = validate(WITH_NUMBER,
                    "Reduced API latency by 40% using caching and Kubernetes", List.of("kubernetes"), false);

            assertThat(result.errorMessages()).contains("TEST R-2 FAILED: Keyword \"kubernetes\" not in job top 10.");
        }

        @Test
        void declared_keyword_missing_from_text_fails() {
            ValidationResult result = validate(WITH_NUMBER, "Reduced API latency by 40% using caching",
                    List.of("AWS"), false);

            assertThat(result.errorMessages())
                    .contains("TEST R-2 FAILED: Keyword \"AWS\" not verbatim in rewritten bullet.");
        }

        @Test
        void null_job_keyword_is_ignored() {
            BulletRewriteInput input = new BulletRewriteInput(WITH_NUMBER, CANDIDATE_TEXT, TestProfiles.JOB_TEXT,
                    Arrays.asList("python", null, "aws"));

            ValidationResult result = validator.validate(input, new BulletRewriteOutput(
                    "Reduced API latency by 40% using caching in Python services", List.of("python"), false));

            assertThat(result.passed()).isTrue();
        }
    }

    @Nested
    @DisplayName("R-3: vocabulary")
    class VocabularyTests {

        @Test
        void unknown_word_fails() {
            ValidationResult result = validate(WITH_NUMBER, "Reduced API latency by 40% using blockchain caching",
                    List.of(), false);

            assertThat(result.issues())
                    .filteredOn(i -> i.type() == ValidationIssueType.REWRITE_TOKEN_OUTSIDE_VOCABULARY)
                    .extracting(i -> i.matchedText())
                    .containsExactly("blockchain");
        }

        @Test
        void action_verbs_and_job_words_are_allowed() {
            ValidationResult result = validate(WITH_NUMBER, "Optimized API latency by 40% with caching on AWS",
                    List.of("aws"), false);

            assertThat(hasType(result, ValidationIssueType.REWRITE_TOKEN_OUTSIDE_VOCABULARY)).isFalse();
        }
    }

    @Test
    @DisplayName("R-4: more than 28 words fails")
    void tooLong() {
        String rewritten = "Reduced API latency by 40% using caching" + " and Python".repeat(12);

        ValidationResult result = validate(WITH_NUMBER, rewritten, List.of(), false);

        assertThat(hasType(result, ValidationIssueType.REWRITE_TOO_LONG)).isTrue();
        assertThat(result.errorMessages()).contains("TEST R-4 FAILED: Word count (31) exceeds 28.");
    }

    @Nested
    @DisplayName("R-5: meaning drift")
    class MeaningDriftTests {

        @Test
        void low_similarity_fails() {
            String rewritten = "Reduced latency by 40% using caching";
            when(embeddingService.embed(eq(WITH_NUMBER))).thenReturn(new double[]{1.0, 0.0});
            when(embeddingService.embed(eq(rewritten))).thenReturn(new double[]{0.0, 1.0});

            ValidationResult result = validate(WITH_NUMBER, rewritten, List.of(), false);

            assertThat(result.errorMessages())
                    .contains("TEST R-5 FAILED: Meaning drift too high. Cosine similarity = 0.000 < 0.85");
        }

        @Test
        void embedding_failure_fails_the_check() {
            when(embeddingService.embed(anyString())).thenThrow(new AiGenerationException("timeout"));

            ValidationResult result = validate(WITH_NUMBER, "Reduced API latency by 40% using caching",
                    List.of(), false);

            assertThat(result.passed()).isFalse();
            assertThat(result.errorMessages()).contains("TEST R-5 ERROR: Failed to compute embeddings - timeout");
        }
    }

    @Nested
    @DisplayName("R-6: metric flag")
    class MetricFlagTests {

        @Test
        void bullet_without_digits_needs_marker_and_flag() {
            ValidationResult result = validate(WITHOUT_NUMBER,
                    "Developed internal reporting tools for the finance team [add metric]", List.of(), true);

            assertThat(result.passed()).isTrue();
        }

        @Test
        void missing_marker_fails() {
            ValidationResult result = validate(WITHOUT_NUMBER,
                    "Developed internal reporting tools for the finance team", List.of(), true);

            assertThat(result.errorMessages())
                    .containsExactly("TEST R-6 FAILED: Rewritten must contain \"[add metric]\" when original lacks numbers.");
        }

        @Test
        void missing_flag_fails() {
            ValidationResult result = validate(WITHOUT_NUMBER,
                    "Developed internal reporting tools for the finance team [add metric]", List.of(), false);

            assertThat(result.errorMessages())
                    .containsExactly("TEST R-6 FAILED: needs_user_metric must be true when original lacks numbers.");
        }

        @Test
        void flag_set_although_original_has_numbers_fails() {
            ValidationResult result = validate(WITH_NUMBER, "Reduced API latency by 40% using caching",
                    List.of(), true);

            assertThat(hasType(result, ValidationIssueType.REWRITE_METRIC_FLAG_MISMATCH)).isTrue();
        }
    }
}
