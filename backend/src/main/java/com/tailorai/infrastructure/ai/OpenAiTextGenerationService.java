package com.tailorai.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.ResponseFormatJsonObject;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.tailorai.domain.tailor.exception.AiGenerationException;
import com.tailorai.domain.tailor.model.GenerationResult;
import com.tailorai.domain.tailor.service.TextGenerationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Chat-completion wrapper. Every stage asks for JSON, so the JSON response format is always on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiTextGenerationService implements TextGenerationService {

    static final String PROVIDER = "openai";

    private final OpenAIClient openAIClient;

    @Value("${openai.model}")
    private String model;

    @Value("${openai.temperature}")
    private double temperature;

    @Value("${openai.max-tokens}")
    private int maxTokens;

    @Override
    public GenerationResult generate(String systemPrompt, String userMessage, Double temp) {
        double actualTemp = temp == null ? temperature : temp;
        long start = System.currentTimeMillis();

        try {
            var params = ChatCompletionCreateParams.builder()
                    .model(model)
                    .temperature(actualTemp)
                    .maxCompletionTokens(maxTokens)
                    .addSystemMessage(systemPrompt)
                    .addUserMessage(userMessage)
                    .responseFormat(ResponseFormatJsonObject.builder().build())
                    .build();

            ChatCompletion completion = openAIClient.chat().completions().create(params);

            completion.usage().ifPresent(usage ->
                    log.info("Token usage [{}] - prompt: {}, completion: {}, total: {}",
                            model, usage.promptTokens(), usage.completionTokens(), usage.totalTokens()));

            String content = completion.choices().stream()
                    .findFirst()
                    .flatMap(choice -> choice.message().content())
                    .orElseThrow(() -> new AiGenerationException("OpenAI response had no content"));

            long latency = System.currentTimeMillis() - start;
            return new GenerationResult(content.trim(), PROVIDER, model, latency, Instant.now());
        } catch (AiGenerationException e) {
            throw e;
        } catch (Exception e) {
            log.error("OpenAI API call failed [{}]", model, e);
            throw new AiGenerationException("Text generation failed: " + e.getMessage(), e);
        }
    }
}
