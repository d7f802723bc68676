package com.tailorai.domain.tailor.model;

import com.tailorai.domain.resume.model.CandidateProfile;
import com.tailorai.domain.resume.model.JobProfile;

/**
 * Input of one tailoring request.
 *
 * @param requestId          correlates debug output; null disables debug persistence
 * @param yearsExperience    optional hint for summary length, null to derive from the profile
 * @param fileSizeBytes      size of the uploaded resume file, null when unknown
 * @param pageCount          page count of the uploaded resume, null when unknown
 * @param recentRequestCount requests by the same caller in the rate window, null when unknown
 */
public record TailorRequest(
        String requestId,
        CandidateProfile candidateProfile,
        JobProfile jobProfile,
        Integer yearsExperience,
        Long fileSizeBytes,
        Integer pageCount,
        Integer recentRequestCount
) {
}
