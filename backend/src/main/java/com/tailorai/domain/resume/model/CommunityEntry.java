package com.tailorai.domain.resume.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Volunteer, club or organizing activity. Kept apart from paid experience.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CommunityEntry(
        String organization,
        String role,
        String description
) {
}
