package com.tailorai.domain.tailor.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ValidationIssueType {

    // Profile merge
    MERGE_ENTRY_MODIFIED("M-1"),
    MERGE_POSITION_COUNT_CHANGED("M-2"),
    MERGE_SKILL_NOT_VERBATIM("M-3"),
    MERGE_BULLET_NOT_VERBATIM("M-4"),
    MERGE_HALLUCINATED_TOKEN("M-5"),

    // Bullet rewrite
    REWRITE_HALLUCINATED_NUMBER("R-1"),
    REWRITE_ILLEGITIMATE_KEYWORD("R-2"),
    REWRITE_TOKEN_OUTSIDE_VOCABULARY("R-3"),
    REWRITE_TOO_LONG("R-4"),
    REWRITE_MEANING_DRIFT("R-5"),
    REWRITE_METRIC_FLAG_MISMATCH("R-6"),

    // Resume compose
    COMPOSE_FIELD_MISSING("C-1"),
    COMPOSE_SECTION_EMPTY("C-2"),
    COMPOSE_SECTIONS_SHRUNK("C-3"),
    COMPOSE_REMOVAL_REASON_MISSING("C-4"),
    COMPOSE_SKILLS_SHRUNK("C-5"),
    COMPOSE_COMMUNITY_MISHANDLED("C-6"),
    COMPOSE_COURSEWORK_DROPPED("C-7"),
    COMPOSE_UNKNOWN_POSITION("C-8"),
    COMPOSE_UNKNOWN_SKILL("C-9"),
    COMPOSE_FACT_CHANGED("C-10"),
    COMPOSE_INVENTED_TOKEN("C-11"),
    COMPOSE_TOO_LONG("C-12"),

    // Shared by every generation loop
    GENERATION_FAILED("GEN"),
    PARSE_FAILED("PARSE");

    private final String code;
}
