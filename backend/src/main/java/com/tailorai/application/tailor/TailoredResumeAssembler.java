package com.tailorai.application.tailor;

import com.tailorai.domain.tailor.exception.MissingFieldMappingException;
import com.tailorai.domain.tailor.model.OrchestrationResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps an orchestration result onto the persistable document.
 */
@Component
public class TailoredResumeAssembler {

    public TailoredResumeDocument assemble(String requestId, OrchestrationResult result) {
        List<String> missing = new ArrayList<>();
        if (result.finalMarkdown() == null) missing.add("final_markdown");
        if (result.finalResume() == null) missing.add("final_resume");
        if (result.baselineScore() == null) missing.add("baseline_score");
        if (result.finalScore() == null) missing.add("final_score");
        if (result.integrity() == null) missing.add("integrity");
        if (result.keywordSummary() == null) missing.add("keyword_summary");
        if (!missing.isEmpty()) {
            throw new MissingFieldMappingException(missing);
        }

        return new TailoredResumeDocument(
                requestId,
                result.finalMarkdown(),
                result.finalResume(),
                result.baselineScore().atsScore(),
                result.finalScore().atsScore(),
                result.finalScore().atsScore() - result.baselineScore().atsScore(),
                result.explanation() != null ? result.explanation().improvementSummary() : null,
                result.integrity().integrityPassed(),
                result.integrity().severity(),
                result.integrity().issues(),
                result.needsUserConfirmation(),
                result.keywordSummary());
    }
}
