package com.tailorai.infrastructure.ai.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Builds deterministic SHA-256 content keys for generated artifacts.
 */
@Component
@RequiredArgsConstructor
public class CacheKeyBuilder {

    private final ObjectMapper objectMapper;

    /**
     * Hash of the target keyword list, in the order given.
     */
    public String keywordHash(List<String> keywords) {
        return sha256(toJson(keywords));
    }

    /**
     * Key of one bullet rewrite: the bullet text plus the keyword hash.
     */
    public String bulletKey(String bullet, String keywordHash) {
        return sha256(bullet + keywordHash);
    }

    /**
     * Key of one composition: profile, accepted rewrites and keyword hash.
     */
    public String composeKey(Object profile, Object rewrittenBullets, String keywordHash) {
        return sha256(toJson(profile) + toJson(rewrittenBullets) + keywordHash);
    }

    String sha256(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize cache key input", e);
        }
    }
}
