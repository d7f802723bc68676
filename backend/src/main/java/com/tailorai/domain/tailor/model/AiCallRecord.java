package com.tailorai.domain.tailor.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

/**
 * Provenance of one text-generation or embedding call.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record AiCallRecord(
        String stage,
        String provider,
        String model,
        long latencyMs,
        Instant timestamp,
        boolean success,
        String error
) {
    public static AiCallRecord succeeded(String stage, GenerationResult result) {
        return new AiCallRecord(stage, result.provider(), result.model(),
                result.latencyMs(), result.timestamp(), true, null);
    }

    public static AiCallRecord failed(String stage, long latencyMs, String error) {
        return new AiCallRecord(stage, null, null, latencyMs, Instant.now(), false, error);
    }
}
