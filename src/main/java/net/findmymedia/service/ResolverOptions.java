package net.findmymedia.service;

import jakarta.annotation.Nullable;
import lombok.Builder;
import net.findmymedia.config.EntityResolutionProperties;
import net.findmymedia.support.cache.ResponseCache;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Optional;

/**
 * Per-call settings for one resolution.
 * <p>
 * The Google and AI stages run only when their credentials are present; the cache is optional.
 */
@Builder(toBuilder = true)
public record ResolverOptions(
    boolean wikidataEnabled,
    boolean openLibraryEnabled,
    @Nullable GoogleSearchCredentials googleSearch,
    @Nullable AiClassifierCredentials aiClassifier,
    @Nullable ResponseCache cache,
    String userAgent,
    Duration timeout
) {

    public ResolverOptions {
        if (!StringUtils.hasText(userAgent)) {
            userAgent = EntityResolutionProperties.DEFAULT_USER_AGENT;
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            timeout = EntityResolutionProperties.DEFAULT_TIMEOUT;
        }
    }

    /**
     * Wikidata and Open Library on, no search credentials, no cache.
     */
    public static ResolverOptions defaults() {
        return new ResolverOptions(true, true, null, null, null,
            EntityResolutionProperties.DEFAULT_USER_AGENT, EntityResolutionProperties.DEFAULT_TIMEOUT);
    }

    /**
     * Options derived from application configuration.
     */
    public static ResolverOptions from(EntityResolutionProperties properties, @Nullable ResponseCache cache) {
        EntityResolutionProperties.Google google = properties.getGoogle();
        EntityResolutionProperties.Ai ai = properties.getAi();
        GoogleSearchCredentials googleCredentials = StringUtils.hasText(google.getApiKey()) && StringUtils.hasText(google.getSearchEngineId())
            ? new GoogleSearchCredentials(google.getApiKey().trim(), google.getSearchEngineId().trim())
            : null;
        AiClassifierCredentials aiCredentials = StringUtils.hasText(ai.getApiKey())
            ? new AiClassifierCredentials(ai.getApiKey().trim(), ai.getBaseUrl(), ai.getModel())
            : null;
        return new ResolverOptions(
            properties.getWikidata().isEnabled(),
            properties.getOpenLibrary().isEnabled(),
            googleCredentials,
            aiCredentials,
            cache,
            properties.getUserAgent(),
            properties.getTimeout()
        );
    }

    public Optional<GoogleSearchCredentials> googleCredentials() {
        return Optional.ofNullable(googleSearch);
    }

    public Optional<AiClassifierCredentials> aiCredentials() {
        return Optional.ofNullable(aiClassifier);
    }

    public record GoogleSearchCredentials(String apiKey, String searchEngineId) {
        @Override
        public String toString() {
            return "GoogleSearchCredentials[searchEngineId=" + searchEngineId + "]";
        }
    }

    /**
     * @param baseUrl OpenAI-compatible endpoint; {@code null} selects the default provider
     * @param model chat model name; {@code null} selects the default model
     */
    public record AiClassifierCredentials(String apiKey, @Nullable String baseUrl, @Nullable String model) {
        @Override
        public String toString() {
            return "AiClassifierCredentials[baseUrl=" + baseUrl + ", model=" + model + "]";
        }
    }
}
