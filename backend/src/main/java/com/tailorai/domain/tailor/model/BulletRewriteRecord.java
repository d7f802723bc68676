package com.tailorai.domain.tailor.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * Final outcome for one experience bullet.
 *
 * @param original          source bullet, never altered
 * @param rewritten         accepted rewrite, or the original when {@code fallbackUsed}
 * @param validationErrors  itemized failures of every attempt when the rewrite fell back
 * @param call              provenance of the accepted (or last) generation call, null on cache hit
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BulletRewriteRecord(
        String original,
        String rewritten,
        List<String> keywordsUsed,
        boolean needsUserMetric,
        boolean validationPassed,
        List<String> validationErrors,
        boolean fallbackUsed,
        boolean cacheHit,
        AiCallRecord call
) {
    public static BulletRewriteRecord accepted(String original, BulletRewriteOutput output, AiCallRecord call) {
        return new BulletRewriteRecord(original, output.rewritten(), List.copyOf(output.keywordsUsed()),
                output.needsUserMetric(), true, List.of(), false, false, call);
    }

    public static BulletRewriteRecord fallback(String original, boolean needsUserMetric,
                                               List<String> failures, AiCallRecord lastCall) {
        return new BulletRewriteRecord(original, original, List.of(), needsUserMetric,
                false, List.copyOf(failures), true, false, lastCall);
    }

    public BulletRewriteRecord asCacheHit() {
        return new BulletRewriteRecord(original, rewritten, keywordsUsed, needsUserMetric,
                validationPassed, validationErrors, fallbackUsed, true, null);
    }
}
