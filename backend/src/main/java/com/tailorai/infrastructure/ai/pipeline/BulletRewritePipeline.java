package com.tailorai.infrastructure.ai.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.tailorai.domain.tailor.model.*;
import com.tailorai.domain.tailor.service.DebugOutputStore;
import com.tailorai.domain.tailor.service.TextGenerationService;
import com.tailorai.infrastructure.ai.TailorPromptBuilder;
import com.tailorai.infrastructure.ai.parsing.JsonResponseParser;
import com.tailorai.infrastructure.ai.preprocessing.ResumeTokenizer;
import com.tailorai.infrastructure.ai.validation.BulletRewriteValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Rewrites one experience bullet toward the job's keywords. When both attempts
 * fail the original bullet is kept and every failure is attached to the record.
 */
@Slf4j
@Component
public class BulletRewritePipeline extends GuardedGenerationLoop<BulletRewriteInput, BulletRewriteOutput> {

    static final double TEMPERATURE = 0.2;

    private static final List<String> REQUIRED_FIELDS = List.of("rewritten", "keywords_used", "needs_user_metric");

    private final BulletRewriteValidator validator;

    public BulletRewritePipeline(TextGenerationService textGenerationService,
                                 TailorPromptBuilder promptBuilder,
                                 JsonResponseParser responseParser,
                                 DebugOutputStore debugOutputStore,
                                 BulletRewriteValidator validator) {
        super(textGenerationService, promptBuilder, responseParser, debugOutputStore);
        this.validator = validator;
    }

    /**
     * @param record final outcome for the bullet
     * @param calls  provenance of every generation call made for it
     */
    public record BulletRewriteRun(BulletRewriteRecord record, List<AiCallRecord> calls) {
    }

    public BulletRewriteRun rewrite(BulletRewriteInput input, String requestId, int bulletIndex) {
        GuardedResult<BulletRewriteOutput> result = run(input, requestId, "bullet_" + bulletIndex);
        AiCallRecord lastCall = result.lastAttempt().call();

        if (result.passed()) {
            return new BulletRewriteRun(
                    BulletRewriteRecord.accepted(input.originalBullet(), result.output(), lastCall),
                    result.calls());
        }

        log.info("[Rewrite] bullet {} falls back to original", bulletIndex);
        boolean needsMetric = !ResumeTokenizer.hasDigit(input.originalBullet());
        return new BulletRewriteRun(
                BulletRewriteRecord.fallback(input.originalBullet(), needsMetric, result.attemptFailures(), lastCall),
                result.calls());
    }

    @Override
    protected String systemPrompt() {
        return promptBuilder.bulletRewriteSystemPrompt();
    }

    @Override
    protected String userMessage(BulletRewriteInput input) {
        return promptBuilder.bulletRewriteUserMessage(input);
    }

    @Override
    protected Double temperature() {
        return TEMPERATURE;
    }

    @Override
    protected List<String> requiredFields() {
        return REQUIRED_FIELDS;
    }

    @Override
    protected Class<BulletRewriteOutput> outputType() {
        return BulletRewriteOutput.class;
    }

    @Override
    protected ValidationResult validate(BulletRewriteInput input, JsonNode json, BulletRewriteOutput output) {
        return validator.validate(input, output);
    }
}
