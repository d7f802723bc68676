package com.tailorai.infrastructure.ai;

import com.openai.client.OpenAIClient;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.EmbeddingCreateParams;
import com.tailorai.domain.tailor.exception.AiGenerationException;
import com.tailorai.domain.tailor.service.EmbeddingService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class OpenAiEmbeddingService implements EmbeddingService {

    private final OpenAIClient openAIClient;

    @Value("${openai.embedding-model}")
    private String embeddingModel;

    @Override
    public double[] embed(String text) {
        try {
            var params = EmbeddingCreateParams.builder()
                    .model(embeddingModel)
                    .input(text)
                    .build();

            CreateEmbeddingResponse response = openAIClient.embeddings().create(params);

            List<? extends Number> vector = response.data().stream()
                    .findFirst()
                    .orElseThrow(() -> new AiGenerationException("OpenAI embedding response was empty"))
                    .embedding();

            double[] result = new double[vector.size()];
            for (int i = 0; i < result.length; i++) {
                result[i] = vector.get(i).doubleValue();
            }
            return result;
        } catch (AiGenerationException e) {
            throw e;
        } catch (Exception e) {
            log.error("OpenAI embedding call failed [{}]", embeddingModel, e);
            throw new AiGenerationException("Embedding failed: " + e.getMessage(), e);
        }
    }
}
