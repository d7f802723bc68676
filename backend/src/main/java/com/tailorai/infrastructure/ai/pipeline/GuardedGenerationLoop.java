package com.tailorai.infrastructure.ai.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.tailorai.domain.tailor.model.*;
import com.tailorai.domain.tailor.model.ParseOutcome.ParseFailure;
import com.tailorai.domain.tailor.model.ParseOutcome.ParseSuccess;
import com.tailorai.domain.tailor.service.DebugOutputStore;
import com.tailorai.domain.tailor.service.TextGenerationService;
import com.tailorai.infrastructure.ai.TailorPromptBuilder;
import com.tailorai.infrastructure.ai.parsing.JsonResponseParser;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Generate, parse and validate with at most two attempts. The second attempt
 * carries the first attempt's itemized failures. Generation errors,
 * unparseable output and output the validator cannot evaluate count as failed attempts.
 *
 * @param <I> ground truth the output is validated against
 * @param <O> parsed output type
 */
@Slf4j
public abstract class GuardedGenerationLoop<I, O> {

    public static final int MAX_ATTEMPTS = 2;

    protected final TextGenerationService textGenerationService;
    protected final TailorPromptBuilder promptBuilder;
    protected final JsonResponseParser responseParser;
    protected final DebugOutputStore debugOutputStore;

    protected GuardedGenerationLoop(TextGenerationService textGenerationService,
                                    TailorPromptBuilder promptBuilder,
                                    JsonResponseParser responseParser,
                                    DebugOutputStore debugOutputStore) {
        this.textGenerationService = textGenerationService;
        this.promptBuilder = promptBuilder;
        this.responseParser = responseParser;
        this.debugOutputStore = debugOutputStore;
    }

    protected abstract String systemPrompt();

    protected abstract String userMessage(I input);

    protected abstract Double temperature();

    protected abstract List<String> requiredFields();

    protected abstract Class<O> outputType();

    protected abstract ValidationResult validate(I input, JsonNode json, O output);

    /**
     * @param stageName names the AI call records and debug files, e.g. {@code bullet_3}
     */
    protected GuardedResult<O> run(I input, String requestId, String stageName) {
        String baseMessage = userMessage(input);
        List<AttemptLog> attempts = new ArrayList<>();
        List<String> previousFailures = List.of();

        for (int attempt = 1; attempt <= MAX_ATTEMPTS; attempt++) {
            String message = attempt == 1
                    ? baseMessage
                    : promptBuilder.retryUserMessage(baseMessage, previousFailures);

            Attempt<O> result = attempt(input, message, attempt, requestId, stageName);
            attempts.add(result.attemptLog());

            if (result.attemptLog().passed()) {
                if (attempt > 1) {
                    log.info("[{}] passed on retry", stageName);
                }
                return new GuardedResult<>(result.output(), List.copyOf(attempts));
            }

            previousFailures = result.attemptLog().failureMessages();
            log.info("[{}] attempt {} failed: {}", stageName, attempt, previousFailures);
        }

        log.warn("[{}] all {} attempts failed", stageName, MAX_ATTEMPTS);
        return new GuardedResult<>(null, List.copyOf(attempts));
    }

    private record Attempt<O>(AttemptLog attemptLog, O output) {
    }

    private Attempt<O> attempt(I input, String message, int attempt, String requestId, String stageName) {
        String debugName = stageName + "_attempt_" + attempt;
        long start = System.currentTimeMillis();

        GenerationResult generated;
        try {
            generated = textGenerationService.generate(systemPrompt(), message, temperature());
        } catch (RuntimeException e) {
            long latency = System.currentTimeMillis() - start;
            log.warn("[{}] generation failed on attempt {}: {}", stageName, attempt, e.getMessage());
            List<ValidationIssue> issues = List.of(ValidationIssue.plain(
                    ValidationIssueType.GENERATION_FAILED, "Generation failed: " + e.getMessage()));
            debugOutputStore.save(requestId, debugName + "_error", "ERROR: " + e.getMessage());
            return new Attempt<>(new AttemptLog(attempt, null, null, issues,
                    AiCallRecord.failed(stageName, latency, e.getMessage())), null);
        }

        AiCallRecord call = AiCallRecord.succeeded(stageName, generated);
        debugOutputStore.save(requestId, debugName + "_raw", generated.text());

        ParseOutcome<O> parsed = responseParser.parse(generated.text(), requiredFields(), outputType());
        if (parsed instanceof ParseFailure<O> failure) {
            List<ValidationIssue> issues = List.of(ValidationIssue.plain(
                    ValidationIssueType.PARSE_FAILED, "JSON Parse Error: " + failure.reason()));
            debugOutputStore.save(requestId, debugName + "_failed",
                    "ERROR: " + failure.reason() + "\n\nRAW OUTPUT:\n" + failure.rawText());
            return new Attempt<>(new AttemptLog(attempt, generated.text(), null, issues, call), null);
        }

        ParseSuccess<O> success = (ParseSuccess<O>) parsed;
        debugOutputStore.save(requestId, debugName, success.json());

        ValidationResult validation;
        try {
            validation = validate(input, success.json(), success.value());
        } catch (RuntimeException e) {
            log.warn("[{}] output on attempt {} could not be validated", stageName, attempt, e);
            List<ValidationIssue> issues = List.of(ValidationIssue.plain(
                    ValidationIssueType.PARSE_FAILED, "Output does not match the expected structure: " + e));
            debugOutputStore.save(requestId, debugName + "_failed", "ERROR: " + e + "\n\nRAW OUTPUT:\n" + generated.text());
            return new Attempt<>(new AttemptLog(attempt, generated.text(), success.json(), issues, call), null);
        }

        AttemptLog attemptLog = new AttemptLog(attempt, generated.text(), success.json(), validation.issues(), call);
        return new Attempt<>(attemptLog, validation.passed() ? success.value() : null);
    }
}
