package net.findmymedia.support.cache;

import net.findmymedia.util.LoggingUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * {@link ResponseCache} that keeps one JSON file per entry. Entries never expire.
 *
 * <pre>
 * {cacheDir}/requests/ab/abcd1234....json
 * {cacheDir}/requests/ab/abcd1234....prompt.txt
 * </pre>
 * The first two characters of the key name the subdirectory so no single directory grows too large.
 */
public class FilesystemResponseCache implements ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(FilesystemResponseCache.class);
    private static final Pattern SAFE_KEY = Pattern.compile("[A-Za-z0-9_][A-Za-z0-9_.-]*");

    private final Path requestsDir;
    private final ObjectMapper objectMapper;

    public FilesystemResponseCache(Path cacheDir, ObjectMapper objectMapper) {
        this.requestsDir = cacheDir.resolve("requests");
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<CachedResponse> get(String key) {
        Path path = entryPath(key);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            JsonNode entry = objectMapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
            JsonNode response = entry.path("response");
            if (!response.isObject()) {
                log.warn("Ignoring malformed cache entry {}", path);
                return Optional.empty();
            }
            Instant cachedAt = Instant.ofEpochMilli(response.path("cachedAt").asLong(0L));
            return Optional.of(new CachedResponse(response.path("data").deepCopy(), cachedAt));
        } catch (IOException | JacksonException e) {
            LoggingUtils.warn(log, e, "Unreadable cache entry {}, treating as a miss", path);
            return Optional.empty();
        }
    }

    @Override
    public void set(String key, CachedResponse response) {
        ObjectNode responseNode = objectMapper.createObjectNode();
        responseNode.set("data", response.data());
        responseNode.put("cachedAt", response.cachedAt().toEpochMilli());
        ObjectNode entry = objectMapper.createObjectNode();
        entry.set("response", responseNode);
        entry.put("cachedAt", Instant.now().toEpochMilli());
        write(entryPath(key), objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(entry));
    }

    @Override
    public void setPrompt(String key, String prompt) {
        write(entryPath(key).resolveSibling(key + ".prompt.txt"), prompt);
    }

    Path entryPath(String key) {
        if (key == null || !SAFE_KEY.matcher(key).matches() || key.contains("..")) {
            throw new IllegalArgumentException("Invalid cache key: " + key);
        }
        String prefix = key.length() >= 2 ? key.substring(0, 2) : key;
        return requestsDir.resolve(prefix).resolve(key + ".json");
    }

    private void write(Path target, String content) {
        try {
            Files.createDirectories(target.getParent());
            Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write cache file " + target, e);
        }
    }
}
