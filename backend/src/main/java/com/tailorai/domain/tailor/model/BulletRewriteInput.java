package com.tailorai.domain.tailor.model;

import java.util.List;

/**
 * Ground truth for rewriting one bullet.
 *
 * @param candidateText concatenated candidate text, already truncated for the prompt
 * @param jobText       job description raw text, already truncated for the prompt
 * @param topKeywords   the job's top ten keywords
 */
public record BulletRewriteInput(
        String originalBullet,
        String candidateText,
        String jobText,
        List<String> topKeywords
) {
}
