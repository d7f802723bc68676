package com.tailorai.infrastructure.ai.validation;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tailorai.domain.tailor.model.AiCallRecord;
import com.tailorai.domain.tailor.model.AuditSeverity;
import com.tailorai.domain.tailor.model.GenerationResult;
import com.tailorai.domain.tailor.model.IntegrityAuditOutput;
import com.tailorai.domain.tailor.model.ParseOutcome;
import com.tailorai.domain.tailor.service.TextGenerationService;
import com.tailorai.infrastructure.ai.TailorPromptBuilder;
import com.tailorai.infrastructure.ai.parsing.JsonResponseParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Final audit of the rendered markdown resume. Five deterministic checks plus one
 * tone check by the generation provider. Issues only flag the result; nothing is
 * regenerated here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntegrityAuditor {

    static final int MAX_KEYWORD_OCCURRENCES = 6;
    static final int MAX_SENTENCE_WORDS = 35;
    static final double TONE_TEMPERATURE = 0.1;

    private static final Pattern SECTION_HEADER = Pattern.compile("^##\\s+(.+?)\\s*$", Pattern.MULTILINE);
    private static final Pattern BULLET_LINE = Pattern.compile("^[ \\t]*- (.*)$", Pattern.MULTILINE);
    private static final Pattern BROKEN_HEADING = Pattern.compile("^#{2,6}\\s*-", Pattern.MULTILINE);
    private static final Pattern HEADING_IN_BULLET = Pattern.compile("^- .*#{2,}.*$", Pattern.MULTILINE);
    // Terminal punctuation followed by whitespace or the end of the text, or any line break
    private static final Pattern SENTENCE_BOUNDARY = Pattern.compile("[.!?]+(?:\\s+|$)|\\R");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final TextGenerationService textGenerationService;
    private final TailorPromptBuilder promptBuilder;
    private final JsonResponseParser responseParser;

    /**
     * @param output    the audit verdict
     * @param toneCall  provenance of the tone check call, null when the call never returned
     */
    public record AuditRun(IntegrityAuditOutput output, AiCallRecord toneCall) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ToneAssessment(
            @JsonProperty("tone_assessment") String toneAssessment,
            @JsonProperty("notes") String notes
    ) {
    }

    public AuditRun audit(String markdown, List<String> topKeywords) {
        List<String> issues = new ArrayList<>();
        AuditSeverity severity = AuditSeverity.NONE;

        severity = severity.escalate(checkDuplicateSections(markdown, issues));
        severity = severity.escalate(checkDuplicateBullets(markdown, issues));
        severity = severity.escalate(checkKeywordStuffing(markdown, topKeywords, issues));
        severity = severity.escalate(checkSentenceLength(markdown, issues));
        severity = severity.escalate(checkHeadingMarkers(markdown, issues));

        ToneCheck tone = checkTone(markdown, issues);
        severity = severity.escalate(tone.severity());

        IntegrityAuditOutput output = new IntegrityAuditOutput(
                severity != AuditSeverity.MAJOR_ISSUE, List.copyOf(issues), severity);

        log.info("[Audit] severity={}, issues={}", severity.getValue(), issues.size());
        return new AuditRun(output, tone.call());
    }

    // G-1
    private AuditSeverity checkDuplicateSections(String markdown, List<String> issues) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher m = SECTION_HEADER.matcher(markdown);
        while (m.find()) {
            counts.merge(m.group(1).toLowerCase(Locale.ROOT), 1, Integer::sum);
        }
        AuditSeverity severity = AuditSeverity.NONE;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > 1) {
                issues.add("TEST G-1 FAILED: Duplicate section header \"## " + entry.getKey() + "\" found "
                        + entry.getValue() + " times.");
                severity = AuditSeverity.MAJOR_ISSUE;
            }
        }
        return severity;
    }

    // G-2
    private AuditSeverity checkDuplicateBullets(String markdown, List<String> issues) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        Matcher m = BULLET_LINE.matcher(markdown);
        while (m.find()) {
            counts.merge(WHITESPACE.matcher(m.group().trim()).replaceAll(" "), 1, Integer::sum);
        }
        List<String> duplicates = counts.entrySet().stream()
                .filter(e -> e.getValue() > 1)
                .map(Map.Entry::getKey)
                .toList();
        if (duplicates.isEmpty()) {
            return AuditSeverity.NONE;
        }
        issues.add("TEST G-2 FAILED: Duplicate bullets detected globally: "
                + duplicates.subList(0, Math.min(2, duplicates.size())));
        return AuditSeverity.MAJOR_ISSUE;
    }

    // G-3
    private AuditSeverity checkKeywordStuffing(String markdown, List<String> topKeywords, List<String> issues) {
        AuditSeverity severity = AuditSeverity.NONE;
        for (String keyword : topKeywords) {
            if (keyword == null || keyword.isBlank()) {
                continue;
            }
            Pattern wholeWord = Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b", Pattern.CASE_INSENSITIVE);
            Matcher m = wholeWord.matcher(markdown);
            int count = 0;
            while (m.find()) {
                count++;
            }
            if (count > MAX_KEYWORD_OCCURRENCES) {
                issues.add("TEST G-3 FAILED: Keyword stuffing. \"" + keyword + "\" appears " + count
                        + " times (Max " + MAX_KEYWORD_OCCURRENCES + ").");
                severity = AuditSeverity.MAJOR_ISSUE;
            }
        }
        return severity;
    }

    // G-4: a line break always ends a sentence, so headings never join the following text
    private AuditSeverity checkSentenceLength(String markdown, List<String> issues) {
        AuditSeverity severity = AuditSeverity.NONE;
        for (String sentence : SENTENCE_BOUNDARY.split(markdown)) {
            String trimmed = sentence.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            int words = WHITESPACE.split(trimmed).length;
            if (words > MAX_SENTENCE_WORDS) {
                String excerpt = trimmed.substring(0, Math.min(30, trimmed.length()));
                issues.add("TEST G-4 FAILED: Sentence readability violated. Length = " + words
                        + " words. Excerpt: \"" + excerpt + "...\"");
                severity = AuditSeverity.MINOR_ISSUE;
            }
        }
        return severity;
    }

    // G-5
    private AuditSeverity checkHeadingMarkers(String markdown, List<String> issues) {
        AuditSeverity severity = AuditSeverity.NONE;
        if (BROKEN_HEADING.matcher(markdown).find()) {
            issues.add("TEST G-5 FAILED: Broken markdown heading detected (e.g. \"### -\").");
            severity = AuditSeverity.MAJOR_ISSUE;
        }
        if (HEADING_IN_BULLET.matcher(markdown).find()) {
            issues.add("TEST G-5 FAILED: Heading markers positioned inside bullets.");
            severity = AuditSeverity.MAJOR_ISSUE;
        }
        return severity;
    }

    private record ToneCheck(AuditSeverity severity, AiCallRecord call) {
    }

    // G-6: a failed call or unreadable answer is recorded but never changes severity
    private ToneCheck checkTone(String markdown, List<String> issues) {
        long start = System.currentTimeMillis();
        GenerationResult result;
        try {
            result = textGenerationService.generate(
                    promptBuilder.toneAuditSystemPrompt(),
                    promptBuilder.toneAuditUserMessage(markdown),
                    TONE_TEMPERATURE);
        } catch (RuntimeException e) {
            log.warn("[Audit] Tone check call failed: {}", e.getMessage());
            issues.add("TEST G-6 ERROR: Tone audit call failed: " + e.getMessage());
            return new ToneCheck(AuditSeverity.NONE,
                    AiCallRecord.failed("integrity_tone", System.currentTimeMillis() - start, e.getMessage()));
        }

        AiCallRecord call = AiCallRecord.succeeded("integrity_tone", result);
        ParseOutcome<ToneAssessment> parsed = responseParser.parse(
                result.text(), List.of("tone_assessment"), ToneAssessment.class);

        if (parsed instanceof ParseOutcome.ParseFailure<ToneAssessment> failure) {
            issues.add("TEST G-6 ERROR: Tone audit response unreadable: " + failure.reason());
            return new ToneCheck(AuditSeverity.NONE, call);
        }

        ToneAssessment tone = ((ParseOutcome.ParseSuccess<ToneAssessment>) parsed).value();
        String notes = tone.notes() == null ? "" : tone.notes();
        String assessment = tone.toneAssessment().strip().toLowerCase(Locale.ROOT);

        if (assessment.equals(AuditSeverity.MAJOR_ISSUE.getValue())) {
            issues.add("TEST G-6 FAILED: Tone audit flagged a major issue: " + notes);
            return new ToneCheck(AuditSeverity.MAJOR_ISSUE, call);
        }
        if (assessment.equals(AuditSeverity.MINOR_ISSUE.getValue())) {
            issues.add("TEST G-6 WARNING: Tone audit flagged a minor issue: " + notes);
            return new ToneCheck(AuditSeverity.MINOR_ISSUE, call);
        }
        return new ToneCheck(AuditSeverity.NONE, call);
    }
}
