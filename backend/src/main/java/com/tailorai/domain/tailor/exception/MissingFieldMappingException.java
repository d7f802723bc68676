package com.tailorai.domain.tailor.exception;

import lombok.Getter;

import java.util.List;

/**
 * Raised when a tailoring result is handed to a consumer that needs structured
 * fields the result does not carry.
 */
@Getter
public class MissingFieldMappingException extends RuntimeException {

    private final List<String> missingFields;

    public MissingFieldMappingException(List<String> missingFields) {
        super("Tailoring result is missing required fields: " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }
}
