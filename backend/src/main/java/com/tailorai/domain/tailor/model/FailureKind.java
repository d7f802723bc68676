package com.tailorai.domain.tailor.model;

public enum FailureKind {
    INPUT_REJECTED,
    GENERATION_FAILURE,
    VALIDATION_FAILURE,
    PARSE_FAILURE,
    MISSING_FIELD
}
