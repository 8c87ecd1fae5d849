package net.findmymedia;

import net.findmymedia.service.EntityResolutionOrchestrator;
import net.findmymedia.service.ResolverOptions;
import net.findmymedia.support.cache.ResponseCache;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Context load smoke test. Upstream credentials are blanked so no stage needs a real key.
 */
@SpringBootTest(properties = {
    "app.resolution.google.api-key=",
    "app.resolution.ai.api-key=",
    "app.resolution.cache.type=memory"
})
class EntityResolverApplicationTests {

    @Autowired
    private EntityResolutionOrchestrator orchestrator;

    @Autowired
    private ObjectProvider<ResponseCache> responseCache;

    @Test
    void contextLoads_withConfiguredDefaults() {
        ResolverOptions options = orchestrator.defaultOptions();

        assertThat(options.wikidataEnabled()).isTrue();
        assertThat(options.openLibraryEnabled()).isTrue();
        assertThat(options.googleCredentials()).isEmpty();
        assertThat(options.aiCredentials()).isEmpty();
        assertThat(options.cache()).isNotNull().isSameAs(responseCache.getIfAvailable());
        assertThat(options.userAgent()).isEqualTo("FindMyMediaBot/1.0 (+https://findmymedia.net)");
    }

    @Test
    void loadDotEnvFile_keepsExistingSystemProperties(@TempDir Path dir) throws IOException {
        Path envFile = dir.resolve(".env");
        Files.writeString(envFile, "FINDMYMEDIA_TEST_NEW=from-file\nFINDMYMEDIA_TEST_SET=from-file\n");
        System.setProperty("FINDMYMEDIA_TEST_SET", "already-set");
        try {
            EntityResolverApplication.loadDotEnvFile(envFile);

            assertThat(System.getProperty("FINDMYMEDIA_TEST_NEW")).isEqualTo("from-file");
            assertThat(System.getProperty("FINDMYMEDIA_TEST_SET")).isEqualTo("already-set");
        } finally {
            System.clearProperty("FINDMYMEDIA_TEST_NEW");
            System.clearProperty("FINDMYMEDIA_TEST_SET");
        }
    }

    @Test
    void loadDotEnvFile_ignoresMissingFile(@TempDir Path dir) {
        EntityResolverApplication.loadDotEnvFile(dir.resolve("missing.env"));
    }
}
