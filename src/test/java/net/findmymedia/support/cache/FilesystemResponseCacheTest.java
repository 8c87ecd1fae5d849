package net.findmymedia.support.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.databind.node.NullNode;
import tools.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FilesystemResponseCacheTest {

    private static final String KEY = "ab12cd34ef56";

    @TempDir
    Path cacheDir;

    private ObjectMapper objectMapper;
    private FilesystemResponseCache cache;

    @BeforeEach
    void setUp() {
        objectMapper = JsonMapper.builder().build();
        cache = new FilesystemResponseCache(cacheDir, objectMapper);
    }

    @Test
    void should_StoreEntryUnderTwoCharacterPrefix() throws IOException {
        ObjectNode data = objectMapper.createObjectNode().put("qid", "Q83495");
        Instant cachedAt = Instant.ofEpochMilli(1_700_000_000_000L);

        cache.set(KEY, new CachedResponse(data, cachedAt));

        Path entry = cacheDir.resolve("requests").resolve("ab").resolve(KEY + ".json");
        assertThat(entry).exists();
        String json = Files.readString(entry, StandardCharsets.UTF_8);
        assertThat(objectMapper.readTree(json).path("response").path("data").path("qid").asString()).isEqualTo("Q83495");
        assertThat(cache.get(KEY)).get().satisfies(response -> {
            assertThat(response.data()).isEqualTo(data);
            assertThat(response.cachedAt()).isEqualTo(cachedAt);
            assertThat(response.isNegative()).isFalse();
        });
    }

    @Test
    void should_RoundTripNegativeEntries() {
        cache.set(KEY, new CachedResponse(NullNode.getInstance(), Instant.now()));

        assertThat(cache.get(KEY)).get().extracting(CachedResponse::isNegative).isEqualTo(true);
    }

    @Test
    void should_TreatUnreadableEntriesAsMiss() throws IOException {
        Path entry = cacheDir.resolve("requests").resolve("ab").resolve(KEY + ".json");
        Files.createDirectories(entry.getParent());
        Files.writeString(entry, "{ not json", StandardCharsets.UTF_8);

        assertThat(cache.get(KEY)).isEmpty();
        assertThat(cache.get("ffffffff")).isEmpty();
    }

    @Test
    void should_WritePromptBesideEntry() throws IOException {
        cache.setPrompt(KEY, "Find URLs for this specific media entity");

        Path prompt = cacheDir.resolve("requests").resolve("ab").resolve(KEY + ".prompt.txt");
        assertThat(Files.readString(prompt, StandardCharsets.UTF_8)).isEqualTo("Find URLs for this specific media entity");
    }

    @Test
    void should_RejectKeysThatEscapeTheCacheDirectory() {
        assertThatThrownBy(() -> cache.get("../../etc/passwd")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> cache.set("a/b", new CachedResponse(NullNode.getInstance(), Instant.now())))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
