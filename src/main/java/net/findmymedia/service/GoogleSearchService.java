/**
 * Service for the general web search fallback (Google Programmable Search).
 *
 * <p>Qualifies the title with a category hint, requests the top five results and
 * returns them in ranking order. Unlike the catalog stages this service surfaces
 * failures as {@link GoogleSearchException} so callers decide how to degrade.</p>
 */
package net.findmymedia.service;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.findmymedia.config.EntityResolutionProperties;
import net.findmymedia.model.EntityType;
import net.findmymedia.model.GoogleSearchResponse;
import net.findmymedia.model.GoogleSearchResult;
import net.findmymedia.support.cache.CachedLookup;
import net.findmymedia.util.CacheKeyGenerator;
import net.findmymedia.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class GoogleSearchService {

    static final int MAX_RESULTS = 5;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final CachedLookup cachedLookup;
    private final RateLimiter rateLimiter;

    public GoogleSearchService(WebClient.Builder webClientBuilder,
                               ObjectMapper objectMapper,
                               CachedLookup cachedLookup,
                               @Qualifier("googleSearchRateLimiter") RateLimiter rateLimiter,
                               EntityResolutionProperties properties) {
        this.webClient = webClientBuilder.clone().baseUrl(properties.getGoogle().getEndpoint()).build();
        this.objectMapper = objectMapper;
        this.cachedLookup = cachedLookup;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Builds the category-qualified query, e.g. {@code "Dune film"} or
     * {@code "Dune book Frank Herbert"} for a book with a known author.
     */
    public static String buildSearchQuery(String title, EntityType category, @Nullable String author) {
        String trimmed = title.trim();
        if (category == EntityType.BOOK && StringUtils.hasText(author)) {
            return trimmed + " book " + author.trim();
        }
        return trimmed + " " + category.getSearchHint();
    }

    /**
     * Searches the web for an entity.
     *
     * @param title entity title
     * @param category entity type, appended as a query hint
     * @param author optional author, used for books only
     * @param credentials API key and search engine id
     * @param options per-call cache and timeout
     * @return up to five results; errors with {@link GoogleSearchException} on any failure
     */
    public Mono<List<GoogleSearchResult>> searchForEntity(String title,
                                                          EntityType category,
                                                          @Nullable String author,
                                                          ResolverOptions.GoogleSearchCredentials credentials,
                                                          ResolverOptions options) {
        return search(buildSearchQuery(title, category, author), credentials, options);
    }

    /**
     * Runs a raw query.
     */
    public Mono<List<GoogleSearchResult>> search(String query,
                                                 ResolverOptions.GoogleSearchCredentials credentials,
                                                 ResolverOptions options) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("query", query);
        payload.put("cx", credentials.searchEngineId());
        String cacheKey = CacheKeyGenerator.generate("google", "search", payload);

        return cachedLookup.lookup(options.cache(), cacheKey, GoogleSearchResponse.class,
                () -> fetch(query, credentials, options))
            .map(GoogleSearchResponse::results)
            .defaultIfEmpty(List.of());
    }

    private Mono<GoogleSearchResponse> fetch(String query,
                                             ResolverOptions.GoogleSearchCredentials credentials,
                                             ResolverOptions options) {
        ExternalApiLogger.logApiCallAttempt(log, "GoogleSearch", "SEARCH", query);
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .queryParam("key", "{key}")
                .queryParam("cx", "{cx}")
                .queryParam("q", "{q}")
                .queryParam("num", MAX_RESULTS)
                .build(credentials.apiKey(), credentials.searchEngineId(), query))
            .header(HttpHeaders.USER_AGENT, options.userAgent())
            .retrieve()
            .onStatus(status -> !status.is2xxSuccessful(), response -> response.bodyToMono(String.class)
                .defaultIfEmpty("")
                .map(body -> new GoogleSearchException(response.statusCode().value(),
                    "Google Search API error " + response.statusCode().value() + ": " + body)))
            .bodyToMono(String.class)
            .defaultIfEmpty("{}")
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .timeout(options.timeout())
            .map(body -> new GoogleSearchResponse(query, parseResults(body)))
            .doOnNext(response -> ExternalApiLogger.logApiCallSuccess(log, "GoogleSearch", "SEARCH", query, response.results().size()))
            .onErrorMap(e -> !(e instanceof GoogleSearchException), this::wrap)
            .doOnError(e -> ExternalApiLogger.logApiCallFailure(log, "GoogleSearch", "SEARCH", query, e.getMessage()));
    }

    List<GoogleSearchResult> parseResults(String body) {
        JsonNode root = objectMapper.readTree(body);
        List<GoogleSearchResult> results = new ArrayList<>();
        for (JsonNode item : root.path("items")) {
            String title = item.path("title").asString("");
            String link = item.path("link").asString("");
            if (!StringUtils.hasText(title) || !StringUtils.hasText(link)) {
                continue;
            }
            String snippet = item.path("snippet").isString() ? item.path("snippet").asString() : null;
            results.add(new GoogleSearchResult(title.trim(), link.trim(), snippet));
            if (results.size() == MAX_RESULTS) {
                break;
            }
        }
        return results;
    }

    private GoogleSearchException wrap(Throwable error) {
        if (error instanceof TimeoutException) {
            return new GoogleSearchException("Google Search request timed out", error);
        }
        if (error instanceof JacksonException) {
            return new GoogleSearchException("Google Search response was not valid JSON", error);
        }
        return new GoogleSearchException("Google Search request failed: " + error.getMessage(), error);
    }
}
