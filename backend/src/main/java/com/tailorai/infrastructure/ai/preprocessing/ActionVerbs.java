package com.tailorai.infrastructure.ai.preprocessing;

import java.util.Set;

/**
 * Approved past-tense action verbs. Used for content-quality scoring and as part of the
 * closed vocabulary a bullet rewrite may draw from.
 */
public final class ActionVerbs {

    public static final Set<String> ALL = Set.of(
            "achieved", "added", "administered", "advised", "analyzed", "architected", "arranged", "assembled", "assessed",
            "authored", "budgeted", "built", "calculated", "catalyzed", "chaired", "coached", "collaborated", "communicated",
            "completed", "conceived", "conducted", "constructed", "consulted", "controlled", "coordinated", "created",
            "cultivated", "decreased", "delivered", "demonstrated", "designed", "developed", "devised", "directed", "discovered",
            "driven", "drove", "earned", "edited", "educated", "eliminated", "enabled", "engineered", "enhanced", "established",
            "evaluated", "executed", "expanded", "expedited", "facilitated", "forecasted", "formed", "formulated", "founded",
            "generated", "guided", "headed", "identified", "implemented", "improved", "increased", "influenced", "initiated",
            "innovated", "installed", "instituted", "instructed", "integrated", "introduced", "invented", "investigated", "launched",
            "led", "managed", "maximized", "mentored", "minimized", "modeled", "monitored", "motivated", "negotiated", "operated",
            "optimized", "orchestrated", "organized", "originated", "outperformed", "overhauled", "oversaw", "participated",
            "performed", "pioneered", "planned", "prepared", "presented", "produced", "programmed", "projected", "promoted",
            "proposed", "provided", "published", "rebuilt", "redesigned", "reduced", "reengineered", "regulated", "reorganized",
            "resolved", "restructured", "revamped", "reviewed", "revised", "revitalized", "saved", "scheduled", "secured",
            "simplified", "solved", "spearheaded", "standardized", "steered", "streamlined", "structured", "succeeded", "supervised",
            "supported", "surpassed", "synthesized", "systematized", "taught", "tested", "trained", "transformed", "translated",
            "troubleshot", "updated", "upgraded", "utilized", "validated", "wrote"
    );

    private ActionVerbs() {
    }

    public static boolean contains(String token) {
        return token != null && ALL.contains(token.toLowerCase());
    }
}
