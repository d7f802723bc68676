package com.tailorai.infrastructure.debug;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tailorai.domain.tailor.service.DebugOutputStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.regex.Pattern;

/**
 * Writes generation output to {@code <base-dir>/<requestId>/<stage>.json} (or {@code .txt} for text).
 * Write failures are logged and never reach the pipeline.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileDebugOutputStore implements DebugOutputStore {

    private static final Pattern UNSAFE_NAME = Pattern.compile("[^A-Za-z0-9._-]");

    private final ObjectMapper objectMapper;

    @Value("${tailor.debug.enabled:true}")
    private boolean enabled;

    @Value("${tailor.debug.base-dir:${java.io.tmpdir}/resume_tasks}")
    private String baseDir;

    @Override
    public void save(String requestId, String stageName, Object payload) {
        if (!enabled || requestId == null || requestId.isBlank() || payload == null) {
            return;
        }
        Path dir = Path.of(baseDir, safeName(requestId));
        try {
            Files.createDirectories(dir);
            if (payload instanceof CharSequence text) {
                Files.writeString(dir.resolve(safeName(stageName) + ".txt"), text, StandardCharsets.UTF_8);
            } else {
                objectMapper.writerWithDefaultPrettyPrinter()
                        .writeValue(dir.resolve(safeName(stageName) + ".json").toFile(), payload);
            }
        } catch (IOException e) {
            log.warn("[Debug] could not persist {} for request {}: {}", stageName, requestId, e.getMessage());
        }
    }

    private static String safeName(String name) {
        return UNSAFE_NAME.matcher(name).replaceAll("_");
    }
}
