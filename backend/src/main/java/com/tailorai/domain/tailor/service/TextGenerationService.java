package com.tailorai.domain.tailor.service;

import com.tailorai.domain.tailor.exception.AiGenerationException;
import com.tailorai.domain.tailor.model.GenerationResult;

/**
 * Text-generation provider used by every generation stage.
 */
public interface TextGenerationService {

    /**
     * @param systemPrompt instructions for the model
     * @param userMessage  the request payload
     * @param temperature  sampling temperature, null for the provider default
     * @throws AiGenerationException when the provider call fails or returns no text
     */
    GenerationResult generate(String systemPrompt, String userMessage, Double temperature);
}
