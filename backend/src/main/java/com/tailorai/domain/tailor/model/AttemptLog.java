package com.tailorai.domain.tailor.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Everything observed during one generation attempt.
 *
 * @param attempt    1-based attempt number
 * @param rawText    generated text, null when the call itself failed
 * @param parsedJson parsed output, null on generation or parse failure
 * @param issues     guardrail failures of this attempt, empty when it passed
 * @param call       provenance of the generation call
 */
public record AttemptLog(
        int attempt,
        String rawText,
        JsonNode parsedJson,
        List<ValidationIssue> issues,
        AiCallRecord call
) {
    public boolean passed() {
        return issues.isEmpty();
    }

    public List<String> failureMessages() {
        return issues.stream()
                .map(ValidationIssue::message)
                .toList();
    }
}
