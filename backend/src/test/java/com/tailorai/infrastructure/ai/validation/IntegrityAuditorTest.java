package com.tailorai.infrastructure.ai.validation;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tailorai.domain.tailor.exception.AiGenerationException;
import com.tailorai.domain.tailor.model.AuditSeverity;
import com.tailorai.domain.tailor.model.GenerationResult;
import com.tailorai.domain.tailor.model.IntegrityAuditOutput;
import com.tailorai.domain.tailor.service.TextGenerationService;
import com.tailorai.infrastructure.ai.TailorPromptBuilder;
import com.tailorai.infrastructure.ai.parsing.JsonResponseParser;
import com.tailorai.infrastructure.ai.preprocessing.TextNormalizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class IntegrityAuditorTest {

    private static final List<String> KEYWORDS = List.of("python", "aws");

    private static final String CLEAN = """
            # Jane Doe
            jane@example.com | 555-0100

            ## Summary
            Backend engineer building data pipelines in Python.

            ## Experience
            ### Software Engineer - Acme Corp
            *Jan 2020 - Present* | Austin, TX
            - Built ETL pipeline processing 2 million records daily
            - Reduced API latency by 40% using caching
            """;

    @Mock
    private TextGenerationService textGenerationService;

    private IntegrityAuditor auditor;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        auditor = new IntegrityAuditor(textGenerationService, new TailorPromptBuilder(objectMapper),
                new JsonResponseParser(objectMapper, new TextNormalizer()));
    }

    private void toneReturns(String assessment, String notes) {
        String json = "{\"tone_assessment\": \"" + assessment + "\", \"notes\": \"" + notes + "\"}";
        when(textGenerationService.generate(anyString(), anyString(), anyDouble()))
                .thenReturn(new GenerationResult(json, "openai", "gpt-4o-mini", 80, Instant.now()));
    }

    private IntegrityAuditOutput audit(String markdown) {
        return auditor.audit(markdown, KEYWORDS).output();
    }

    @Test
    @DisplayName("clean resume passes with no issues")
    void cleanResume() {
        toneReturns("clean", "");

        IntegrityAuditor.AuditRun run = auditor.audit(CLEAN, KEYWORDS);

        assertThat(run.output().integrityPassed()).isTrue();
        assertThat(run.output().severity()).isEqualTo(AuditSeverity.NONE);
        assertThat(run.output().issues()).isEmpty();
        assertThat(run.toneCall().success()).isTrue();
        assertThat(run.toneCall().stage()).isEqualTo("integrity_tone");
    }

    @Nested
    @DisplayName("Deterministic checks")
    class DeterministicTests {

        @BeforeEach
        void cleanTone() {
            toneReturns("clean", "");
        }

        @Test
        @DisplayName("G-1: duplicated section header is a major issue")
        void duplicateSection() {
            IntegrityAuditOutput output = audit(CLEAN + "\n## Summary\nAgain.\n");

            assertThat(output.severity()).isEqualTo(AuditSeverity.MAJOR_ISSUE);
            assertThat(output.issues()).containsExactly(
                    "TEST G-1 FAILED: Duplicate section header \"## summary\" found 2 times.");
        }

        @Test
        @DisplayName("G-2: bullets identical after whitespace normalization are a major issue")
        void duplicateBullets() {
            IntegrityAuditOutput output = audit(CLEAN + "- Built ETL  pipeline processing 2 million records  daily\n");

            assertThat(output.integrityPassed()).isFalse();
            assertThat(output.severity()).isEqualTo(AuditSeverity.MAJOR_ISSUE);
            assertThat(output.issues()).singleElement()
                    .satisfies(issue -> assertThat(issue).startsWith("TEST G-2 FAILED: Duplicate bullets detected globally"));
        }

        @Test
        @DisplayName("G-3: keyword used more than six times is a major issue")
        void keywordStuffing() {
            IntegrityAuditOutput output = audit(CLEAN + "- Python, python, PYTHON and Python on Python with Python\n");

            assertThat(output.severity()).isEqualTo(AuditSeverity.MAJOR_ISSUE);
            assertThat(output.issues())
                    .containsExactly("TEST G-3 FAILED: Keyword stuffing. \"python\" appears 7 times (Max 6).");
        }

        @Test
        @DisplayName("G-4: sentence over 35 words is a minor issue")
        void longSentence() {
            String sentence = "Built " + "many ".repeat(35) + "services.";

            IntegrityAuditOutput output = audit(CLEAN + "\n" + sentence + "\n");

            assertThat(output.severity()).isEqualTo(AuditSeverity.MINOR_ISSUE);
            assertThat(output.integrityPassed()).isTrue();
            assertThat(output.issues()).singleElement()
                    .satisfies(issue -> assertThat(issue).startsWith("TEST G-4 FAILED: Sentence readability violated. Length = 37 words."));
        }

        @Test
        @DisplayName("G-4: every line break ends a sentence")
        void lineBreaksEndSentences() {
            String question = "Did we " + "ship ".repeat(18) + "it?";
            String exclamation = "We " + "shipped ".repeat(18) + "it!";

            IntegrityAuditOutput output = audit(CLEAN + question + "\r" + exclamation + "\r\n" + question);

            assertThat(output.issues()).isEmpty();
            assertThat(output.severity()).isEqualTo(AuditSeverity.NONE);
        }

        @Test
        @DisplayName("G-5: broken heading is a major issue")
        void brokenHeading() {
            IntegrityAuditOutput output = audit(CLEAN + "### - Beta Inc\n");

            assertThat(output.severity()).isEqualTo(AuditSeverity.MAJOR_ISSUE);
            assertThat(output.issues()).contains("TEST G-5 FAILED: Broken markdown heading detected (e.g. \"### -\").");
        }

        @Test
        @DisplayName("G-5: heading marker inside a bullet is a major issue")
        void headingInBullet() {
            IntegrityAuditOutput output = audit(CLEAN + "- Led team ## Education\n");

            assertThat(output.issues()).contains("TEST G-5 FAILED: Heading markers positioned inside bullets.");
        }
    }

    @Nested
    @DisplayName("G-6: tone")
    class ToneTests {

        @Test
        void major_tone_issue_fails_integrity() {
            toneReturns("major_issue", "Unprofessional wording");

            IntegrityAuditOutput output = audit(CLEAN);

            assertThat(output.integrityPassed()).isFalse();
            assertThat(output.issues())
                    .containsExactly("TEST G-6 FAILED: Tone audit flagged a major issue: Unprofessional wording");
        }

        @Test
        void minor_tone_issue_only_flags() {
            toneReturns("minor_issue", "Slightly informal");

            IntegrityAuditOutput output = audit(CLEAN);

            assertThat(output.integrityPassed()).isTrue();
            assertThat(output.severity()).isEqualTo(AuditSeverity.MINOR_ISSUE);
        }

        @Test
        void failed_call_is_recorded_without_changing_severity() {
            when(textGenerationService.generate(anyString(), anyString(), anyDouble()))
                    .thenThrow(new AiGenerationException("provider down"));

            IntegrityAuditor.AuditRun run = auditor.audit(CLEAN, KEYWORDS);

            assertThat(run.output().severity()).isEqualTo(AuditSeverity.NONE);
            assertThat(run.output().integrityPassed()).isTrue();
            assertThat(run.output().issues()).containsExactly("TEST G-6 ERROR: Tone audit call failed: provider down");
            assertThat(run.toneCall().success()).isFalse();
        }

        @Test
        void unreadable_answer_is_recorded_without_changing_severity() {
            when(textGenerationService.generate(anyString(), anyString(), anyDouble()))
                    .thenReturn(new GenerationResult("looks fine", "openai", "gpt-4o-mini", 80, Instant.now()));

            IntegrityAuditOutput output = audit(CLEAN);

            assertThat(output.severity()).isEqualTo(AuditSeverity.NONE);
            assertThat(output.issues()).singleElement()
                    .satisfies(issue -> assertThat(issue).startsWith("TEST G-6 ERROR: Tone audit response unreadable"));
        }
    }
}
