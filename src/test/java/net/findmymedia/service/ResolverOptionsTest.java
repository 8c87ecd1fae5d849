package net.findmymedia.service;

import net.findmymedia.config.EntityResolutionProperties;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ResolverOptionsTest {

    @Test
    void defaults_enableCatalogStagesOnly() {
        ResolverOptions options = ResolverOptions.defaults();

        assertThat(options.wikidataEnabled()).isTrue();
        assertThat(options.openLibraryEnabled()).isTrue();
        assertThat(options.googleCredentials()).isEmpty();
        assertThat(options.aiCredentials()).isEmpty();
        assertThat(options.userAgent()).isEqualTo(EntityResolutionProperties.DEFAULT_USER_AGENT);
        assertThat(options.timeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    void should_FallBackToDefaults_When_UserAgentOrTimeoutInvalid() {
        ResolverOptions options = ResolverOptions.defaults().toBuilder().userAgent(" ").timeout(Duration.ZERO).build();

        assertThat(options.userAgent()).isEqualTo(EntityResolutionProperties.DEFAULT_USER_AGENT);
        assertThat(options.timeout()).isEqualTo(EntityResolutionProperties.DEFAULT_TIMEOUT);
    }

    @Test
    void from_requiresBothGoogleKeyAndEngineId() {
        EntityResolutionProperties properties = new EntityResolutionProperties();
        properties.getGoogle().setApiKey("key");

        assertThat(ResolverOptions.from(properties, null).googleCredentials()).isEmpty();

        properties.getGoogle().setSearchEngineId("cx");
        properties.getAi().setApiKey(" ai-key ");
        ResolverOptions options = ResolverOptions.from(properties, null);

        assertThat(options.googleCredentials()).get()
            .extracting(ResolverOptions.GoogleSearchCredentials::searchEngineId).isEqualTo("cx");
        assertThat(options.aiCredentials()).get()
            .extracting(ResolverOptions.AiClassifierCredentials::apiKey).isEqualTo("ai-key");
    }

    @Test
    void credentials_hideKeysInToString() {
        assertThat(new ResolverOptions.GoogleSearchCredentials("secret", "cx").toString()).doesNotContain("secret");
        assertThat(new ResolverOptions.AiClassifierCredentials("secret", null, null).toString()).doesNotContain("secret");
    }
}
