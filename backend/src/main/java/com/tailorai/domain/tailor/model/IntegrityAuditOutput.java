package com.tailorai.domain.tailor.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * @param integrityPassed false only when {@code severity} is MAJOR_ISSUE
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record IntegrityAuditOutput(
        boolean integrityPassed,
        List<String> issues,
        AuditSeverity severity
) {
}
