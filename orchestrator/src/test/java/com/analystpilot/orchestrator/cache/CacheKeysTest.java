package com.analystpilot.orchestrator.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    private final CacheKeys keys = new CacheKeys(new ObjectMapper());

    @Test
    void forPrompt_isPrefixedSha256Hex() {
        assertThat(keys.forPrompt("What is 2+2?", "gpt-5")).matches("llm:[0-9a-f]{64}");
    }

    @Test
    void forPrompt_isStableAndDependsOnBothInputs() {
        String key = keys.forPrompt("What is 2+2?", "gpt-5");
        assertThat(keys.forPrompt("What is 2+2?", "gpt-5")).isEqualTo(key);
        assertThat(keys.forPrompt("What is 2+3?", "gpt-5")).isNotEqualTo(key);
        assertThat(keys.forPrompt("What is 2+2?", "gemini-2.5-flash")).isNotEqualTo(key);
    }

    @Test
    void hash_ignoresMapInsertionOrder() {
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("a", 1);
        ab.put("b", 2);
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("b", 2);
        ba.put("a", 1);
        assertThat(keys.hash(ab)).isEqualTo(keys.hash(ba));
    }

    @Test
    void forPrompt_hashesModelAndPromptTogether() {
        assertThat(keys.forPrompt("p", "m"))
                .isEqualTo("llm:" + keys.hash(Map.of("prompt", "p", "model", "m")));
    }
}
