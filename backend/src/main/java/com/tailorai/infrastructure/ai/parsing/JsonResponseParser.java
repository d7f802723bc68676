package com.tailorai.infrastructure.ai.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tailorai.domain.tailor.model.ParseOutcome;
import com.tailorai.domain.tailor.model.ParseOutcome.ParseFailure;
import com.tailorai.domain.tailor.model.ParseOutcome.ParseSuccess;
import com.tailorai.infrastructure.ai.preprocessing.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns generated text into a typed value. Code fences are tolerated, missing
 * required top-level fields are not.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JsonResponseParser {

    public static final String MISSING_FIELDS = "Missing required fields";

    private final ObjectMapper objectMapper;
    private final TextNormalizer textNormalizer;

    public <T> ParseOutcome<T> parse(String rawText, List<String> requiredFields, Class<T> type) {
        String cleaned = textNormalizer.stripCodeFences(textNormalizer.normalize(rawText));
        if (cleaned.isEmpty()) {
            return new ParseFailure<>(rawText, "Empty output");
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(cleaned);
        } catch (JsonProcessingException e) {
            log.debug("Generated text is not JSON: {}", e.getMessage());
            return new ParseFailure<>(rawText, "JSON parse error: " + e.getOriginalMessage());
        }

        if (node == null || !node.isObject()) {
            return new ParseFailure<>(rawText, "Expected a JSON object");
        }

        List<String> missing = requiredFields.stream()
                .filter(f -> !node.has(f) || node.get(f).isNull())
                .toList();
        if (!missing.isEmpty()) {
            return new ParseFailure<>(rawText, MISSING_FIELDS + ": " + String.join(", ", missing));
        }

        try {
            return new ParseSuccess<>(objectMapper.treeToValue(node, type), node);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return new ParseFailure<>(rawText, "Schema mismatch: " + e.getMessage());
        }
    }
}
