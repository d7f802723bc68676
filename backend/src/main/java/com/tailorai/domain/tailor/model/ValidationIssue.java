package com.tailorai.domain.tailor.model;

/**
 * Individual guardrail failure found in generated content. Any issue fails the attempt.
 *
 * @param type        the guardrail that failed
 * @param message     itemized failure reason, e.g. {@code TEST R-1 FAILED: ...}
 * @param matchedText the specific text that triggered this issue (nullable)
 */
public record ValidationIssue(
        ValidationIssueType type,
        String message,
        String matchedText
) {
    public static ValidationIssue failed(ValidationIssueType type, String detail, String matchedText) {
        return new ValidationIssue(type, "TEST " + type.getCode() + " FAILED: " + detail, matchedText);
    }

    public static ValidationIssue error(ValidationIssueType type, String detail) {
        return new ValidationIssue(type, "TEST " + type.getCode() + " ERROR: " + detail, null);
    }

    /**
     * Issue whose message is used as given, for failures that are not guardrail rules.
     */
    public static ValidationIssue plain(ValidationIssueType type, String message) {
        return new ValidationIssue(type, message, null);
    }
}
