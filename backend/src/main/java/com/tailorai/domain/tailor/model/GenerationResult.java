package com.tailorai.domain.tailor.model;

import java.time.Instant;

/**
 * Text returned by a generation provider, with provenance.
 */
public record GenerationResult(
        String text,
        String provider,
        String model,
        long latencyMs,
        Instant timestamp
) {
}
