package com.tailorai.domain.tailor.service;

import com.tailorai.domain.tailor.exception.AiGenerationException;

public interface EmbeddingService {

    /**
     * @throws AiGenerationException when the provider call fails
     */
    double[] embed(String text);
}
