package com.analystpilot.orchestrator.cache;

import com.analystpilot.orchestrator.MutableClock;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;

class FileResponseCacheTest {

    @TempDir Path dir;

    MutableClock      clock;
    FileResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        cache = new FileResponseCache(dir, new ObjectMapper(), clock, Duration.ofSeconds(3600));
    }

    @Test
    void get_missingKey_isEmpty() {
        assertThat(cache.get("llm:abc")).isEmpty();
    }

    @Test
    void put_thenGet_returnsValueBeforeExpiry() {
        cache.put("llm:abc", "{\"final answer\": \"4\"}", Duration.ofSeconds(900));
        clock.advance(Duration.ofSeconds(899));
        assertThat(cache.get("llm:abc")).contains("{\"final answer\": \"4\"}");
    }

    @Test
    void get_afterExpiry_missesAndDeletesEntry() {
        cache.put("llm:abc", "value", Duration.ofSeconds(900));
        clock.advance(Duration.ofSeconds(900));

        assertThat(cache.get("llm:abc")).isEmpty();
        assertThat(dir.resolve("llm_abc.json")).doesNotExist();
    }

    @Test
    void put_withoutTtl_usesDefaultExpiry() {
        cache.put("llm:abc", "value", null);

        clock.advance(Duration.ofSeconds(3599));
        assertThat(cache.get("llm:abc")).contains("value");
        clock.advance(Duration.ofSeconds(1));
        assertThat(cache.get("llm:abc")).isEmpty();
    }

    @Test
    void put_overwritesExistingEntry() {
        cache.put("llm:abc", "old", Duration.ofSeconds(60));
        cache.put("llm:abc", "new", Duration.ofSeconds(60));
        assertThat(cache.get("llm:abc")).contains("new");
    }

    @Test
    void put_leavesNoTempFilesBehind() throws Exception {
        cache.put("llm:abc", "value", Duration.ofSeconds(60));
        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("llm_abc.json");
        }
    }

    @Test
    void get_corruptEntry_isTreatedAsMiss() throws Exception {
        Files.writeString(dir.resolve("llm_abc.json"), "not json{");
        assertThat(cache.get("llm:abc")).isEmpty();
    }

    @Test
    void put_unwritableDirectory_doesNotThrow() throws Exception {
        Path notADir = Files.writeString(dir.resolve("plain-file"), "x");
        FileResponseCache broken = new FileResponseCache(notADir, new ObjectMapper(), clock, Duration.ofSeconds(3600));

        broken.put("llm:abc", "value", Duration.ofSeconds(60));

        assertThat(broken.get("llm:abc")).isEmpty();
    }
}
