package com.tailorai.domain.tailor.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of turning raw generated text into a schema-checked value.
 */
public sealed interface ParseOutcome<T> permits ParseOutcome.ParseSuccess, ParseOutcome.ParseFailure {

    /**
     * @param value schema-checked value
     * @param json  the parsed JSON tree, kept for debug persistence
     */
    record ParseSuccess<T>(T value, JsonNode json) implements ParseOutcome<T> {
    }

    /**
     * @param rawText the generated text as received
     * @param reason  why it could not be parsed
     */
    record ParseFailure<T>(String rawText, String reason) implements ParseOutcome<T> {
    }
}
