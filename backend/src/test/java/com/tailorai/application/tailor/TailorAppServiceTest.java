package com.tailorai.application.tailor;

import com.tailorai.TestProfiles;
import com.tailorai.domain.tailor.model.OrchestrationResult;
import com.tailorai.domain.tailor.model.TailorRequest;
import com.tailorai.domain.tailor.service.PipelineStageListener;
import com.tailorai.infrastructure.ai.merge.ProfileMergeEngine;
import com.tailorai.infrastructure.ai.pipeline.ResumeTailorPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TailorAppServiceTest {

    @Mock
    private ProfileMergeEngine mergeEngine;

    @Mock
    private ResumeTailorPipeline tailorPipeline;

    @Mock
    private PipelineStageListener stageListener;

    private TailorAppService service;

    @BeforeEach
    void setUp() {
        service = new TailorAppService(mergeEngine, tailorPipeline, new TailoredResumeAssembler(), stageListener);
    }

    @Test
    void tailor_runs_the_pipeline_with_the_stage_listener() {
        TailorRequest request = new TailorRequest("req-1", TestProfiles.candidate(), TestProfiles.job(),
                null, null, null, 9);
        OrchestrationResult rejected = OrchestrationResult.rejected("Abuse block: Rate limit exceeded.");
        when(tailorPipeline.execute(request, stageListener)).thenReturn(rejected);

        OrchestrationResult result = service.tailor(request);

        assertThat(result).isSameAs(rejected);
        verify(tailorPipeline).execute(request, stageListener);
    }
}
