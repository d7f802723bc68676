package com.tailorai.infrastructure.ai.pipeline;

import com.tailorai.domain.resume.model.CandidateProfile;
import com.tailorai.domain.resume.model.ExperienceEntry;
import com.tailorai.domain.tailor.model.*;
import com.tailorai.domain.tailor.service.PipelineStageListener;
import com.tailorai.infrastructure.ai.cache.CacheKeyBuilder;
import com.tailorai.infrastructure.ai.cache.ContentCache;
import com.tailorai.infrastructure.ai.render.MarkdownProfileExtractor;
import com.tailorai.infrastructure.ai.render.MarkdownResumeRenderer;
import com.tailorai.infrastructure.ai.scoring.AtsScoringEngine;
import com.tailorai.infrastructure.ai.validation.IntegrityAuditor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Year;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.function.Supplier;

/**
 * Orchestrates one tailoring request:
 * <p>
 * guard → baseline score → bullet rewrites (cached) → compose (cached) → render → rescore → explain → audit
 * </p>
 * Stages run strictly in sequence on the calling thread. Bullet failures degrade to the
 * original text; a composition that fails both attempts ends the request with a
 * deterministic fallback rendering.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResumeTailorPipeline {

    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");

    private final RequestGuard requestGuard;
    private final AtsScoringEngine scoringEngine;
    private final BulletRewritePipeline bulletRewritePipeline;
    private final ResumeComposePipeline composePipeline;
    private final MarkdownResumeRenderer renderer;
    private final MarkdownProfileExtractor profileExtractor;
    private final ScoreDeltaExplainer explainer;
    private final IntegrityAuditor integrityAuditor;
    private final ContentCache contentCache;
    private final CacheKeyBuilder cacheKeyBuilder;

    @Value("${tailor.rewrite.candidate-context-chars:1000}")
    private int candidateContextChars = 1000;

    @Value("${tailor.rewrite.job-context-chars:1500}")
    private int jobContextChars = 1500;

    public OrchestrationResult execute(TailorRequest request) {
        return execute(request, PipelineStageListener.noop());
    }

    public OrchestrationResult execute(TailorRequest request, PipelineStageListener listener) {
        String requestId = request.requestId();

        // 0. Guards, before any generation call
        long guardStart = System.currentTimeMillis();
        listener.onStageStarted(requestId, PipelineStage.GUARD);
        Optional<String> rejection = requestGuard.check(request);
        listener.onStageCompleted(requestId, PipelineStage.GUARD,
                System.currentTimeMillis() - guardStart, rejection.isPresent() ? "rejected" : "ok");
        if (rejection.isPresent()) {
            return OrchestrationResult.rejected(rejection.get());
        }

        TailorPipelineContext ctx = new TailorPipelineContext();
        ctx.setRequest(request);
        ctx.setTopKeywords(request.jobProfile().effectiveTop10());
        ctx.setYearsExperience(request.yearsExperience() != null
                ? request.yearsExperience()
                : estimateYearsExperience(request.candidateProfile()));

        // 1. Baseline score
        stage(ctx, listener, PipelineStage.BASELINE_SCORE, () -> {
            ctx.setBaselineScore(scoringEngine.score(ctx.profile(), request.jobProfile()));
            log.info("[Tailor] baseline ATS score {}", ctx.getBaselineScore().atsScore());
            return "ok";
        });

        // 2. Bullet rewrites
        stage(ctx, listener, PipelineStage.BULLET_REWRITE, () -> {
            rewriteBullets(ctx);
            long fallbacks = ctx.getBulletRecords().stream().filter(BulletRewriteRecord::fallbackUsed).count();
            return fallbacks == 0 ? "ok" : fallbacks + " fallback";
        });

        // 3. Compose
        boolean composed = stage(ctx, listener, PipelineStage.COMPOSE, () -> {
            compose(ctx);
            return ctx.getComposedResume() != null ? "ok" : "failed";
        }).equals("ok");

        if (!composed) {
            log.warn("[Tailor] composition failed for request {}, returning fallback rendering", requestId);
            return ctx.toComposeFailure(renderer.renderFallback(ctx.profile(), ctx.getRewrittenBullets()));
        }

        // 4. Render, re-derive and rescore
        stage(ctx, listener, PipelineStage.RESCORE, () -> {
            ctx.setFinalMarkdown(renderer.render(ctx.getComposedResume()));
            ctx.setRescoredProfile(profileExtractor.extract(ctx.getFinalMarkdown()));
            ctx.setFinalScore(scoringEngine.score(ctx.getRescoredProfile(), request.jobProfile()));
            log.info("[Tailor] final ATS score {} (baseline {})",
                    ctx.getFinalScore().atsScore(), ctx.getBaselineScore().atsScore());
            return "ok";
        });

        // 5. Explanation
        stage(ctx, listener, PipelineStage.EXPLAIN, () -> {
            ScoreDeltaExplainer.ExplanationRun run = explainer.explain(
                    ctx.getBaselineScore(), ctx.getFinalScore(), ctx.toKeywordSummary().added());
            ctx.setExplanation(run.explanation());
            ctx.getAiCalls().add(run.call());
            return run.explanation().generated() ? "ok" : "fallback";
        });

        // 6. Integrity audit
        stage(ctx, listener, PipelineStage.INTEGRITY_AUDIT, () -> {
            IntegrityAuditor.AuditRun run = integrityAuditor.audit(ctx.getFinalMarkdown(), ctx.getTopKeywords());
            ctx.setIntegrity(run.output());
            if (run.toneCall() != null) {
                ctx.getAiCalls().add(run.toneCall());
            }
            return run.output().severity().getValue();
        });

        return ctx.toResult();
    }

    private void rewriteBullets(TailorPipelineContext ctx) {
        CandidateProfile profile = ctx.profile();
        String candidateText = truncate(candidateText(profile), candidateContextChars);
        String jobText = truncate(ctx.getRequest().jobProfile().rawText(), jobContextChars);
        String keywordHash = cacheKeyBuilder.keywordHash(ctx.getTopKeywords());

        int bulletIndex = 0;
        for (ExperienceEntry entry : profile.experience()) {
            List<String> accepted = new ArrayList<>();
            for (String bullet : entry.bullets()) {
                bulletIndex++;
                BulletRewriteRecord record = rewriteBullet(ctx, bullet, candidateText, jobText, keywordHash, bulletIndex);
                ctx.getBulletRecords().add(record);
                accepted.add(record.rewritten());
            }
            ctx.getRewrittenBullets().put(MarkdownResumeRenderer.bulletKey(entry), accepted);
        }
        log.info("[Rewrite] {} bullets processed", bulletIndex);
    }

    private BulletRewriteRecord rewriteBullet(TailorPipelineContext ctx, String bullet, String candidateText,
                                              String jobText, String keywordHash, int bulletIndex) {
        String key = cacheKeyBuilder.bulletKey(bullet, keywordHash);
        Optional<BulletRewriteRecord> cached = contentCache.get(key, BulletRewriteRecord.class);
        if (cached.isPresent()) {
            log.debug("[Cache] bullet {} hit", bulletIndex);
            return cached.get().asCacheHit();
        }

        BulletRewriteInput input = new BulletRewriteInput(bullet, candidateText, jobText, ctx.getTopKeywords());
        BulletRewritePipeline.BulletRewriteRun run = bulletRewritePipeline.rewrite(input, ctx.requestId(), bulletIndex);
        ctx.getAiCalls().addAll(run.calls());

        if (run.record().validationPassed()) {
            contentCache.putIfAbsent(key, run.record());
        }
        return run.record();
    }

    private void compose(TailorPipelineContext ctx) {
        String keywordHash = cacheKeyBuilder.keywordHash(ctx.getTopKeywords());
        String key = cacheKeyBuilder.composeKey(ctx.profile(), ctx.getRewrittenBullets(), keywordHash);

        Optional<ComposeResumeOutput> cached = contentCache.get(key, ComposeResumeOutput.class);
        if (cached.isPresent()) {
            log.info("[Cache] compose hit");
            ctx.setComposedResume(cached.get());
            return;
        }

        ComposeInput input = new ComposeInput(
                ctx.profile(), ctx.getRewrittenBullets(), ctx.getTopKeywords(), ctx.getYearsExperience());
        GuardedResult<ComposeResumeOutput> result = composePipeline.compose(input, ctx.requestId());
        ctx.setComposeAttempts(result.attempts());
        ctx.getAiCalls().addAll(result.calls());

        if (result.passed()) {
            ctx.setComposedResume(result.output());
            contentCache.putIfAbsent(key, result.output());
        } else {
            ctx.setComposeFailures(result.attemptFailures());
        }
    }

    private String stage(TailorPipelineContext ctx, PipelineStageListener listener,
                         PipelineStage stage, Supplier<String> body) {
        long start = System.currentTimeMillis();
        listener.onStageStarted(ctx.requestId(), stage);
        String outcome = body.get();
        listener.onStageCompleted(ctx.requestId(), stage, System.currentTimeMillis() - start, outcome);
        return outcome;
    }

    static String candidateText(CandidateProfile profile) {
        StringBuilder text = new StringBuilder();
        if (profile.hasSummary()) {
            text.append(profile.summary().strip()).append("\n");
        }
        text.append(String.join(", ", profile.skills().all()));
        return text.toString().strip();
    }

    static String truncate(String text, int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() <= maxChars ? text : text.substring(0, maxChars);
    }

    /**
     * Years since the earliest year found in any experience start date, 0 when none is readable.
     */
    static int estimateYearsExperience(CandidateProfile profile) {
        OptionalInt earliest = profile.experience().stream()
                .map(ExperienceEntry::startDate)
                .filter(d -> d != null)
                .map(YEAR::matcher)
                .filter(Matcher::find)
                .mapToInt(m -> Integer.parseInt(m.group()))
                .min();
        if (earliest.isEmpty()) {
            return 0;
        }
        return Math.max(0, Year.now().getValue() - earliest.getAsInt());
    }
}
