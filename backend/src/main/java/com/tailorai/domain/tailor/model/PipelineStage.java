package com.tailorai.domain.tailor.model;

public enum PipelineStage {
    GUARD,
    BASELINE_SCORE,
    BULLET_REWRITE,
    COMPOSE,
    RESCORE,
    EXPLAIN,
    INTEGRITY_AUDIT
}
