package org.iceforge.strata.semantic.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Generator answers keyed by model and question, persisted as one JSON document.
 *
 * <p>Every {@link #put} rewrites the whole file: the document goes to a temp file next to the target
 * and is then moved over it, so readers never see a partial write.
 */
public class JsonResponseCache {

    private static final Logger log = LoggerFactory.getLogger(JsonResponseCache.class);

    static final String KEY_SEPARATOR = "__";

    private final Path path;
    private final ObjectMapper mapper;
    private final Map<String, JsonNode> entries;

    public JsonResponseCache(Path path, ObjectMapper mapper) {
        this.path = Objects.requireNonNull(path).toAbsolutePath();
        this.mapper = Objects.requireNonNull(mapper);
        this.entries = load(this.path, mapper);
    }

    public static String key(String model, String question) {
        return model + KEY_SEPARATOR + question;
    }

    public synchronized Optional<JsonNode> get(String key) {
        return Optional.ofNullable(entries.get(key));
    }

    /**
     * First cached answer for the question among the given models, in order.
     */
    public Optional<JsonNode> lookup(String question, List<String> models) {
        for (String model : models) {
            Optional<JsonNode> hit = get(key(model, question));
            if (hit.isPresent()) {
                return hit;
            }
        }
        return Optional.empty();
    }

    public synchronized void put(String key, JsonNode value) {
        entries.put(key, value);
        write();
    }

    public synchronized int size() {
        return entries.size();
    }

    private void write() {
        Path dir = path.getParent();
        Path tmp = null;
        try {
            Files.createDirectories(dir);
            tmp = Files.createTempFile(dir, path.getFileName().toString(), ".tmp");
            mapper.writerWithDefaultPrettyPrinter().writeValue(tmp.toFile(), entries);
            try {
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            deleteQuietly(tmp);
            throw new UncheckedIOException("Failed to write response cache: " + path, e);
        }
    }

    private static Map<String, JsonNode> load(Path path, ObjectMapper mapper) {
        if (!Files.isRegularFile(path)) {
            return new LinkedHashMap<>();
        }
        try {
            Map<String, JsonNode> loaded = mapper.readValue(path.toFile(), new TypeReference<LinkedHashMap<String, JsonNode>>() {});
            if (loaded == null) return new LinkedHashMap<>();
            log.info("Loaded {} cached generator responses from {}", loaded.size(), path);
            return loaded;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read response cache: " + path, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) return;
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("Could not remove temp cache file {}", tmp, e);
        }
    }
}
