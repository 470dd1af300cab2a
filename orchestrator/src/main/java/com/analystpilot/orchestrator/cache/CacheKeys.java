package com.analystpilot.orchestrator.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Derives cache keys from request payloads.
 *
 * Payloads are serialized with sorted map keys before hashing, so two
 * equivalent requests always land on the same key regardless of field order.
 */
public class CacheKeys {

    private final ObjectMapper sortedJson;

    public CacheKeys(ObjectMapper objectMapper) {
        this.sortedJson = objectMapper.copy()
                .configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    }

    /** Key for a provider reply: {@code llm:<sha256 of {"model":..,"prompt":..}>}. */
    public String forPrompt(String prompt, String model) {
        return "llm:" + hash(Map.of("prompt", prompt, "model", model));
    }

    /** SHA-256 hex digest of the sorted-key JSON form of {@code payload}. */
    public String hash(Object payload) {
        try {
            byte[] bytes = sortedJson.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(bytes));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cache payload is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
