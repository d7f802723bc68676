package com.tailorai.infrastructure.ai.preprocessing;

import org.springframework.stereotype.Component;

import java.text.Normalizer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Normalizes generated and source text:
 * - Unicode NFC normalization
 * - Invisible/control character removal
 * - Whitespace normalization (collapse runs, trim)
 * - Markdown code fence removal around JSON payloads
 */
@Component
public class TextNormalizer {

    // Zero-width and invisible Unicode characters
    private static final Pattern INVISIBLE_CHARS = Pattern.compile(
            "[\\u200B\\u200C\\u200D\\uFEFF\\u00AD\\u2060\\u180E]"
    );

    // Control characters except common whitespace (\n, \r, \t)
    private static final Pattern CONTROL_CHARS = Pattern.compile(
            "[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]"
    );

    private static final Pattern MULTIPLE_SPACES = Pattern.compile("[ \\t]{2,}");

    private static final Pattern EXCESSIVE_NEWLINES = Pattern.compile("\\n{3,}");

    private static final Pattern ALL_WHITESPACE = Pattern.compile("\\s+");

    // ```json ... ``` or ``` ... ```
    private static final Pattern CODE_FENCE = Pattern.compile("`{3}(?:json)?\\s*([\\s\\S]*?)\\s*`{3}");

    /**
     * Normalize text for storage and comparison.
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return text;
        }

        String result = Normalizer.normalize(text, Normalizer.Form.NFC);
        result = INVISIBLE_CHARS.matcher(result).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        result = result.replace("\r\n", "\n").replace("\r", "\n");
        result = MULTIPLE_SPACES.matcher(result).replaceAll(" ");
        result = EXCESSIVE_NEWLINES.matcher(result).replaceAll("\n\n");
        return result.strip();
    }

    /**
     * Extract the payload of the first code fence, or return the trimmed text when there is none.
     */
    public String stripCodeFences(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.strip();
        Matcher m = CODE_FENCE.matcher(trimmed);
        return m.find() ? m.group(1).strip() : trimmed;
    }

    /**
     * Key used for duplicate detection: lowercased, all whitespace removed.
     */
    public String comparisonKey(String text) {
        if (text == null) {
            return "";
        }
        return ALL_WHITESPACE.matcher(text.toLowerCase()).replaceAll("");
    }
}
