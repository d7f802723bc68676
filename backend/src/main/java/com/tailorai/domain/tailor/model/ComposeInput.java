package com.tailorai.domain.tailor.model;

import com.tailorai.domain.resume.model.CandidateProfile;

import java.util.List;
import java.util.Map;

/**
 * @param rewrittenBullets accepted bullet text keyed by {@code company_title}, in source order
 */
public record ComposeInput(
        CandidateProfile profile,
        Map<String, List<String>> rewrittenBullets,
        List<String> topKeywords,
        int yearsExperience
) {
}
