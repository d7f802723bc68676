package com.tailorai.infrastructure.ai.pipeline;

import com.tailorai.domain.tailor.model.TailorRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Abuse and size limits checked before any generation call.
 */
@Slf4j
@Component
public class RequestGuard {

    @Value("${tailor.guard.max-file-size-bytes:5242880}")
    private long maxFileSizeBytes;

    @Value("${tailor.guard.max-pages:20}")
    private int maxPages;

    @Value("${tailor.guard.max-recent-requests:5}")
    private int maxRecentRequests;

    /**
     * @return the rejection reason, or empty when the request may proceed
     */
    public Optional<String> check(TailorRequest request) {
        if (request.fileSizeBytes() != null && request.fileSizeBytes() > maxFileSizeBytes) {
            return reject(request, "File exceeds " + maxFileSizeBytes / (1024 * 1024) + "MB limit.");
        }
        if (request.pageCount() != null && request.pageCount() > maxPages) {
            return reject(request, "Resume exceeds " + maxPages + " pages limit.");
        }
        if (request.recentRequestCount() != null && request.recentRequestCount() >= maxRecentRequests) {
            return reject(request, "Abuse block: Rate limit exceeded.");
        }
        return Optional.empty();
    }

    private Optional<String> reject(TailorRequest request, String reason) {
        log.warn("[Guard] request {} rejected: {}", request.requestId(), reason);
        return Optional.of(reason);
    }
}
