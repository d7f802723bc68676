package com.tailorai.infrastructure.ai.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.tailorai.domain.tailor.model.*;
import com.tailorai.domain.tailor.service.DebugOutputStore;
import com.tailorai.domain.tailor.service.TextGenerationService;
import com.tailorai.infrastructure.ai.TailorPromptBuilder;
import com.tailorai.infrastructure.ai.parsing.JsonResponseParser;
import com.tailorai.infrastructure.ai.validation.ResumeComposeValidator;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Composes the tailored resume from the profile and the accepted bullet rewrites.
 * Every attempt's raw and parsed output goes to the debug store.
 */
@Component
public class ResumeComposePipeline extends GuardedGenerationLoop<ComposeInput, ComposeResumeOutput> {

    static final double TEMPERATURE = 0.2;

    private final ResumeComposeValidator validator;

    public ResumeComposePipeline(TextGenerationService textGenerationService,
                                 TailorPromptBuilder promptBuilder,
                                 JsonResponseParser responseParser,
                                 DebugOutputStore debugOutputStore,
                                 ResumeComposeValidator validator) {
        super(textGenerationService, promptBuilder, responseParser, debugOutputStore);
        this.validator = validator;
    }

    public GuardedResult<ComposeResumeOutput> compose(ComposeInput input, String requestId) {
        return run(input, requestId, "compose");
    }

    @Override
    protected String systemPrompt() {
        return promptBuilder.composeSystemPrompt();
    }

    @Override
    protected String userMessage(ComposeInput input) {
        return promptBuilder.composeUserMessage(
                input.profile(), input.rewrittenBullets(), input.topKeywords(), input.yearsExperience());
    }

    @Override
    protected Double temperature() {
        return TEMPERATURE;
    }

    // Presence of the seven sections is a guardrail of its own, reported by the validator
    @Override
    protected List<String> requiredFields() {
        return List.of();
    }

    @Override
    protected Class<ComposeResumeOutput> outputType() {
        return ComposeResumeOutput.class;
    }

    @Override
    protected ValidationResult validate(ComposeInput input, JsonNode json, ComposeResumeOutput output) {
        return validator.validate(input, json, output);
    }
}
