package com.tailorai.domain.tailor.model;

import com.tailorai.domain.resume.model.CandidateProfile;
import com.tailorai.domain.resume.model.Certification;

import java.util.List;

/**
 * Outcome of merging a secondary profile into a resume.
 *
 * @param success     true when every merge invariant holds
 * @param failedTests itemized invariant failures, reported and never corrected
 * @param profile     the merged profile (returned even when invariants fail)
 */
public record MergeResult(
        boolean success,
        List<ValidationIssue> failedTests,
        CandidateProfile profile,
        List<String> addedSkills,
        List<Certification> addedCertifications,
        List<String> addedBullets
) {
    public List<String> failureMessages() {
        return failedTests.stream().map(ValidationIssue::message).toList();
    }
}
