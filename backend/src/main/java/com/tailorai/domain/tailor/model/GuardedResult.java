package com.tailorai.domain.tailor.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of a bounded generate-validate-retry loop.
 *
 * @param output   the accepted output, null when every attempt failed
 * @param attempts all attempts in order, including the accepted one
 */
public record GuardedResult<T>(
        T output,
        List<AttemptLog> attempts
) {
    public boolean passed() {
        return output != null;
    }

    public AttemptLog lastAttempt() {
        return attempts.get(attempts.size() - 1);
    }

    /**
     * Failures of every attempt, each block headed by {@code ATTEMPT n FAILS:}.
     */
    public List<String> attemptFailures() {
        List<String> lines = new ArrayList<>();
        for (AttemptLog attempt : attempts) {
            if (attempt.passed()) {
                continue;
            }
            lines.add("ATTEMPT " + attempt.attempt() + " FAILS:");
            lines.addAll(attempt.failureMessages());
        }
        return lines;
    }

    public List<AiCallRecord> calls() {
        return attempts.stream()
                .map(AttemptLog::call)
                .filter(c -> c != null)
                .toList();
    }
}
