package com.tailorai.domain.tailor.model;

import java.util.List;

/**
 * Result of guardrail validation.
 *
 * @param passed true if no issues were found
 * @param issues every guardrail failure, in the order the rules ran
 */
public record ValidationResult(
        boolean passed,
        List<ValidationIssue> issues
) {
    public static ValidationResult of(List<ValidationIssue> issues) {
        return new ValidationResult(issues.isEmpty(), List.copyOf(issues));
    }

    public List<String> errorMessages() {
        return issues.stream().map(ValidationIssue::message).toList();
    }
}
