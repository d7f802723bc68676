package com.tailorai.domain.tailor.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Integrity audit severity. Only ever escalates during an audit.
 */
public enum AuditSeverity {
    NONE("none"),
    MINOR_ISSUE("minor_issue"),
    MAJOR_ISSUE("major_issue");

    private final String value;

    AuditSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public AuditSeverity escalate(AuditSeverity other) {
        return other.ordinal() > ordinal() ? other : this;
    }

    public static AuditSeverity fromValue(String value) {
        for (AuditSeverity s : values()) {
            if (s.value.equalsIgnoreCase(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown audit severity: " + value);
    }
}
