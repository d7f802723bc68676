package com.tailorai.infrastructure.ai.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tailorai.TestProfiles;
import com.tailorai.domain.resume.model.CandidateProfile;
import com.tailorai.domain.resume.model.ExperienceEntry;
import com.tailorai.domain.tailor.model.*;
import com.tailorai.domain.tailor.service.PipelineStageListener;
import com.tailorai.infrastructure.ai.cache.CacheKeyBuilder;
import com.tailorai.infrastructure.ai.cache.CaffeineContentCache;
import com.tailorai.infrastructure.ai.preprocessing.TextNormalizer;
import com.tailorai.infrastructure.ai.render.MarkdownProfileExtractor;
import com.tailorai.infrastructure.ai.render.MarkdownResumeRenderer;
import com.tailorai.infrastructure.ai.scoring.AtsScoringEngine;
import com.tailorai.infrastructure.ai.validation.IntegrityAuditor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResumeTailorPipelineTest {

    private static final AiCallRecord CALL = new AiCallRecord("stage", "openai", "gpt-4o-mini", 100, Instant.now(), true, null);

    @Mock
    private RequestGuard requestGuard;

    @Mock
    private BulletRewritePipeline bulletRewritePipeline;

    @Mock
    private ResumeComposePipeline composePipeline;

    @Mock
    private ScoreDeltaExplainer explainer;

    @Mock
    private IntegrityAuditor integrityAuditor;

    private ResumeTailorPipeline pipeline;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
        pipeline = new ResumeTailorPipeline(
                requestGuard,
                new AtsScoringEngine(new TextNormalizer()),
                bulletRewritePipeline,
                composePipeline,
                new MarkdownResumeRenderer(),
                new MarkdownProfileExtractor(),
                explainer,
                integrityAuditor,
                new CaffeineContentCache(100),
                new CacheKeyBuilder(objectMapper));

        lenient().when(requestGuard.check(any())).thenReturn(Optional.empty());
        lenient().when(explainer.explain(any(), any(), anyList())).thenAnswer(inv -> new ScoreDeltaExplainer.ExplanationRun(
                new ScoreDeltaExplanation(0, 0, 0, "Improved.", List.of(), List.of(), true), CALL));
        lenient().when(integrityAuditor.audit(anyString(), anyList())).thenReturn(new IntegrityAuditor.AuditRun(
                new IntegrityAuditOutput(true, List.of(), AuditSeverity.NONE), CALL));
    }

    private static TailorRequest request(Integer yearsExperience) {
        return new TailorRequest("req-1", TestProfiles.candidate(), TestProfiles.job(), yearsExperience, null, null, null);
    }

    private void bulletsAreRewritten() {
        when(bulletRewritePipeline.rewrite(any(), anyString(), anyInt())).thenAnswer(inv -> {
            BulletRewriteInput input = inv.getArgument(0);
            BulletRewriteOutput output = new BulletRewriteOutput(
                    input.originalBullet() + " in Python on AWS", List.of("python", "aws"), false);
            return new BulletRewritePipeline.BulletRewriteRun(
                    BulletRewriteRecord.accepted(input.originalBullet(), output, CALL), List.of(CALL));
        });
    }

    private void composeFollowsRewrites() {
        when(composePipeline.compose(any(), anyString())).thenAnswer(inv -> {
            ComposeInput input = inv.getArgument(0);
            CandidateProfile p = input.profile();
            List<ExperienceEntry> experience = p.experience().stream()
                    .map(e -> e.withBullets(input.rewrittenBullets().get(MarkdownResumeRenderer.bulletKey(e))))
                    .toList();
            ComposeResumeOutput output = new ComposeResumeOutput(p.basics(), p.summary(), p.skills(), experience,
                    p.education(), p.projects(), p.community());
            return new GuardedResult<>(output, List.of(new AttemptLog(1, "{}", null, List.of(), CALL)));
        });
    }

    private static AttemptLog failedAttempt(int attempt) {
        return new AttemptLog(attempt, "not json", null,
                List.of(ValidationIssue.plain(ValidationIssueType.PARSE_FAILED, "JSON Parse Error: Expected a JSON object")),
                CALL);
    }

    @Test
    @DisplayName("rejected request makes no generation call")
    void guardRejection() {
        when(requestGuard.check(any())).thenReturn(Optional.of("File exceeds 5MB limit."));

        OrchestrationResult result = pipeline.execute(request(null));

        assertThat(result.success()).isFalse();
        assertThat(result.failureKind()).isEqualTo(FailureKind.INPUT_REJECTED);
        assertThat(result.error()).isEqualTo("File exceeds 5MB limit.");
        verifyNoInteractions(bulletRewritePipeline, composePipeline, explainer, integrityAuditor);
    }

    @Test
    @DisplayName("full run renders, rescores and audits the composed resume")
    void fullRun() {
        bulletsAreRewritten();
        composeFollowsRewrites();
        List<String> events = new ArrayList<>();
        PipelineStageListener listener = new PipelineStageListener() {
            @Override
            public void onStageStarted(String requestId, PipelineStage stage) {
                events.add("start " + stage);
            }

            @Override
            public void onStageCompleted(String requestId, PipelineStage stage, long durationMs, String outcome) {
                events.add("end " + stage + " " + outcome);
            }
        };

        OrchestrationResult result = pipeline.execute(request(null), listener);

        assertThat(result.success()).isTrue();
        assertThat(result.bulletRecords()).hasSize(3).allMatch(BulletRewriteRecord::validationPassed);
        assertThat(result.finalMarkdown()).contains("- Reduced API latency by 40% using caching in Python on AWS");
        assertThat(result.rescoredProfile().experience().get(0).bullets())
                .containsExactly("Built ETL pipeline processing 2 million records daily in Python on AWS",
                        "Reduced API latency by 40% using caching in Python on AWS");
        assertThat(result.finalScore().atsScore()).isGreaterThanOrEqualTo(result.baselineScore().atsScore());
        assertThat(result.keywordSummary().targetKeywords()).containsExactly("python", "aws", "pipeline", "sql");
        assertThat(result.integrity().integrityPassed()).isTrue();
        assertThat(result.needsUserConfirmation()).isFalse();
        // 3 bullets, compose, explain, audit
        assertThat(result.aiCalls()).hasSize(6);
        assertThat(events).containsExactly(
                "start GUARD", "end GUARD ok",
                "start BASELINE_SCORE", "end BASELINE_SCORE ok",
                "start BULLET_REWRITE", "end BULLET_REWRITE ok",
                "start COMPOSE", "end COMPOSE ok",
                "start RESCORE", "end RESCORE ok",
                "start EXPLAIN", "end EXPLAIN ok",
                "start INTEGRITY_AUDIT", "end INTEGRITY_AUDIT none");
    }

    @Test
    @DisplayName("request years of experience take precedence over the estimate")
    void yearsExperienceFromRequest() {
        bulletsAreRewritten();
        composeFollowsRewrites();

        pipeline.execute(request(12));

        ArgumentCaptor<ComposeInput> input = ArgumentCaptor.forClass(ComposeInput.class);
        verify(composePipeline).compose(input.capture(), eq("req-1"));
        assertThat(input.getValue().yearsExperience()).isEqualTo(12);
        assertThat(input.getValue().rewrittenBullets()).containsOnlyKeys("Acme Corp_Software Engineer", "Beta Inc_Junior Developer");
    }

    @Nested
    @DisplayName("content cache")
    class ContentCacheTest {

        @Test
        @DisplayName("second identical run reuses bullets and composition")
        void secondRunHitsCache() {
            bulletsAreRewritten();
            composeFollowsRewrites();

            OrchestrationResult first = pipeline.execute(request(null));
            OrchestrationResult second = pipeline.execute(request(null));

            verify(bulletRewritePipeline, times(3)).rewrite(any(), anyString(), anyInt());
            verify(composePipeline, times(1)).compose(any(), anyString());
            assertThat(second.bulletRecords()).allMatch(BulletRewriteRecord::cacheHit);
            assertThat(second.bulletRecords()).allMatch(r -> r.call() == null);
            assertThat(second.finalMarkdown()).isEqualTo(first.finalMarkdown());
            // explain and audit only
            assertThat(second.aiCalls()).hasSize(2);
        }

        @Test
        @DisplayName("fallback bullets are not cached")
        void fallbackNotCached() {
            when(bulletRewritePipeline.rewrite(any(), anyString(), anyInt())).thenAnswer(inv -> {
                BulletRewriteInput input = inv.getArgument(0);
                return new BulletRewritePipeline.BulletRewriteRun(BulletRewriteRecord.fallback(input.originalBullet(),
                        false, List.of("ATTEMPT 1 FAILS:"), CALL), List.of(CALL, CALL));
            });
            composeFollowsRewrites();

            pipeline.execute(request(null));
            pipeline.execute(request(null));

            verify(bulletRewritePipeline, times(6)).rewrite(any(), anyString(), anyInt());
        }
    }

    @Nested
    @DisplayName("composition failure")
    class CompositionFailureTest {

        @BeforeEach
        void composeFails() {
            bulletsAreRewritten();
            when(composePipeline.compose(any(), anyString()))
                    .thenReturn(new GuardedResult<>(null, List.of(failedAttempt(1), failedAttempt(2))));
        }

        @Test
        @DisplayName("ends the request with a fallback rendering")
        void fallbackRendering() {
            OrchestrationResult result = pipeline.execute(request(null));

            assertThat(result.success()).isFalse();
            assertThat(result.failureKind()).isEqualTo(FailureKind.PARSE_FAILURE);
            assertThat(result.error()).isEqualTo("Resume composition failed, the output could not be parsed:\n"
                    + "ATTEMPT 1 FAILS:\nJSON Parse Error: Expected a JSON object\n"
                    + "ATTEMPT 2 FAILS:\nJSON Parse Error: Expected a JSON object");
            assertThat(result.fallbackMarkdown())
                    .startsWith("# Jane Doe")
                    .contains("- Reduced API latency by 40% using caching in Python on AWS");
            assertThat(result.baselineScore()).isNotNull();
            assertThat(result.finalScore()).isNull();
            assertThat(result.composeAttempts()).hasSize(2);
            verifyNoInteractions(explainer, integrityAuditor);
        }

        @Test
        @DisplayName("failed composition is not cached")
        void notCached() {
            pipeline.execute(request(null));
            pipeline.execute(request(null));

            verify(composePipeline, times(2)).compose(any(), anyString());
        }
    }

    @Nested
    @DisplayName("when the model call fails on every compose attempt")
    class ComposeGenerationFailureTest {

        @Test
        @DisplayName("reports a generation failure with the fallback rendering")
        void generationFailure() {
            bulletsAreRewritten();
            AttemptLog unreachable = new AttemptLog(1, null, null,
                    List.of(ValidationIssue.plain(ValidationIssueType.GENERATION_FAILED, "Generation failed: connection reset")),
                    AiCallRecord.failed("compose", 5, "connection reset"));
            when(composePipeline.compose(any(), anyString()))
                    .thenReturn(new GuardedResult<>(null, List.of(unreachable)));

            OrchestrationResult result = pipeline.execute(request(null));

            assertThat(result.success()).isFalse();
            assertThat(result.failureKind()).isEqualTo(FailureKind.GENERATION_FAILURE);
            assertThat(result.error()).isEqualTo("Resume composition failed, the model call did not succeed:\n"
                    + "ATTEMPT 1 FAILS:\nGeneration failed: connection reset");
            assertThat(result.fallbackMarkdown()).startsWith("# Jane Doe");
        }
    }

    @Test
    @DisplayName("years of experience are estimated from the earliest start year")
    void estimateYears() {
        assertThat(ResumeTailorPipeline.estimateYearsExperience(TestProfiles.candidate()))
                .isEqualTo(Year.now().getValue() - 2017);
        assertThat(ResumeTailorPipeline.estimateYearsExperience(
                TestProfiles.candidate().withExperience(List.of()))).isZero();
    }

    @Test
    void candidate_text_is_summary_and_skills() {
        assertThat(ResumeTailorPipeline.candidateText(TestProfiles.candidate())).isEqualTo(
                "Backend engineer with 6 years building data pipelines in Python.\n"
                        + "Python, SQL, Docker, Git, Jira, Communication");
        assertThat(ResumeTailorPipeline.truncate("abcdef", 3)).isEqualTo("abc");
    }
}
