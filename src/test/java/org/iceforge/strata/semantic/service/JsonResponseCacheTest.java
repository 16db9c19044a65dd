package org.iceforge.strata.semantic.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsonResponseCacheTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void keyJoinsModelAndQuestion() {
        assertThat(JsonResponseCache.key("gpt-4o", "Show me revenue")).isEqualTo("gpt-4o__Show me revenue");
    }

    @Test
    void startsEmptyWhenFileIsMissing() {
        JsonResponseCache cache = new JsonResponseCache(dir.resolve("llm_cache.json"), mapper);

        assertThat(cache.size()).isZero();
        assertThat(cache.get("gpt-4o__q")).isEmpty();
    }

    @Test
    void persistsEveryPutAndReloads() throws Exception {
        Path file = dir.resolve("llm_cache.json");
        JsonResponseCache cache = new JsonResponseCache(file, mapper);
        JsonNode answer = mapper.readTree("{\"query_json\":{\"metrics\":[\"order_count\"]}}");

        cache.put(JsonResponseCache.key("gpt-4o", "How many orders?"), answer);

        assertThat(file).exists();
        assertThat(mapper.readTree(file.toFile()).get("gpt-4o__How many orders?")).isEqualTo(answer);

        JsonResponseCache reloaded = new JsonResponseCache(file, mapper);
        assertThat(reloaded.get("gpt-4o__How many orders?")).contains(answer);
    }

    @Test
    void leavesNoTempFilesBehind() throws Exception {
        Path file = dir.resolve("llm_cache.json");
        JsonResponseCache cache = new JsonResponseCache(file, mapper);

        for (int i = 0; i < 5; i++) {
            cache.put("m__q" + i, mapper.getNodeFactory().numberNode(i));
        }

        try (Stream<Path> files = Files.list(dir)) {
            assertThat(files).containsExactly(file);
        }
        assertThat(new JsonResponseCache(file, mapper).size()).isEqualTo(5);
    }

    @Test
    void createsMissingParentDirectories() {
        Path file = dir.resolve("nested/cache/llm_cache.json");
        JsonResponseCache cache = new JsonResponseCache(file, mapper);

        cache.put("m__q", mapper.getNodeFactory().textNode("a"));

        assertThat(file).exists();
    }

    @Test
    void lookupChecksModelsInOrder() {
        JsonResponseCache cache = new JsonResponseCache(dir.resolve("llm_cache.json"), mapper);
        cache.put("o1-mini__q", mapper.getNodeFactory().textNode("from o1"));
        cache.put("llama3-70b-8192__q", mapper.getNodeFactory().textNode("from llama"));

        assertThat(cache.lookup("q", List.of("gpt-4o", "llama3-70b-8192", "o1-mini")))
                .get().extracting(JsonNode::asText).isEqualTo("from llama");
        assertThat(cache.lookup("other", List.of("gpt-4o", "o1-mini"))).isEmpty();
    }

    @Test
    void unreadableCacheFileFailsFast() throws Exception {
        Path file = dir.resolve("llm_cache.json");
        Files.writeString(file, "{not json");

        assertThatThrownBy(() -> new JsonResponseCache(file, mapper))
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Failed to read response cache");
    }
}
