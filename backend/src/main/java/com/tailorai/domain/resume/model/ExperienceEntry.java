package com.tailorai.domain.resume.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * One position in the experience section.
 *
 * @param removalReason set by the composer only when it drops this entry from the tailored resume
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExperienceEntry(
        String title,
        String company,
        String startDate,
        String endDate,
        String location,
        List<String> bullets,
        String removalReason
) {
    public ExperienceEntry {
        bullets = ModelLists.nonNullElements(bullets);
    }

    public ExperienceEntry withBullets(List<String> newBullets) {
        return new ExperienceEntry(title, company, startDate, endDate, location, newBullets, removalReason);
    }

    public boolean hasRemovalReason() {
        return removalReason != null && !removalReason.isBlank();
    }
}
