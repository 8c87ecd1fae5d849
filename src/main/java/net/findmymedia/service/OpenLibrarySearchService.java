/**
 * Service for matching book titles against Open Library.
 *
 * <p>Searches works by title (and first author when known), keeps only works whose title
 * matches, then walks their editions looking for a printed edition with a cover.</p>
 */
package net.findmymedia.service;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.findmymedia.config.EntityResolutionProperties;
import net.findmymedia.model.OpenLibraryResult;
import net.findmymedia.support.cache.CachedLookup;
import net.findmymedia.util.CacheKeyGenerator;
import net.findmymedia.util.ExternalApiLogger;
import net.findmymedia.util.LoggingUtils;
import net.findmymedia.util.TitleNormalizer;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Service
@Slf4j
public class OpenLibrarySearchService {

    static final int SEARCH_LIMIT = 5;
    static final int EDITIONS_LIMIT = 20;
    private static final String OPEN_LIBRARY_ROOT = "https://openlibrary.org";
    private static final String COVERS_ROOT = "https://covers.openlibrary.org/b/id/";
    private static final List<String> NON_PRINT_FORMAT_MARKERS = List.of("audio", "cd", "mp3");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final CachedLookup cachedLookup;
    private final RateLimiter rateLimiter;

    public OpenLibrarySearchService(WebClient.Builder webClientBuilder,
                                    ObjectMapper objectMapper,
                                    CachedLookup cachedLookup,
                                    @Qualifier("openLibraryRateLimiter") RateLimiter rateLimiter,
                                    EntityResolutionProperties properties) {
        this.webClient = webClientBuilder.clone().baseUrl(properties.getOpenLibrary().getBaseUrl()).build();
        this.objectMapper = objectMapper;
        this.cachedLookup = cachedLookup;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Searches Open Library for a book.
     *
     * @param title book title
     * @param author optional author credit; only the first author is sent
     * @param options per-call cache, timeout and User-Agent
     * @return the matched work, with cover data when a printed edition has one; empty when
     *         no work title matches or the search failed
     */
    public Mono<OpenLibraryResult> search(String title, @Nullable String author, ResolverOptions options) {
        if (!StringUtils.hasText(title)) {
            return Mono.empty();
        }
        String trimmedTitle = title.trim();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", trimmedTitle);
        payload.put("author", author == null ? "" : author.trim());
        String cacheKey = CacheKeyGenerator.generate("openlibrary", "search", payload);

        return cachedLookup.lookup(options.cache(), cacheKey, OpenLibraryResult.class,
                () -> fetch(trimmedTitle, author, options))
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "Open Library search failed for '{}', continuing without a result", trimmedTitle);
                ExternalApiLogger.logApiCallFailure(log, "OpenLibrary", "SEARCH_TITLE", trimmedTitle, e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<OpenLibraryResult> fetch(String title, @Nullable String author, ResolverOptions options) {
        String authorKeyword = TitleNormalizer.firstAuthor(author);
        ExternalApiLogger.logApiCallAttempt(log, "OpenLibrary", "SEARCH_TITLE", title);
        return getJson(options, uriBuilder -> {
                var builder = uriBuilder.path("/search.json")
                    .queryParam("title", "{title}")
                    .queryParam("limit", SEARCH_LIMIT);
                if (authorKeyword != null) {
                    return builder.queryParam("author", "{author}").build(title, authorKeyword);
                }
                return builder.build(title);
            })
            .flatMap(root -> {
                List<SearchDoc> matching = matchingDocs(root.path("docs"), title);
                ExternalApiLogger.logApiCallSuccess(log, "OpenLibrary", "SEARCH_TITLE", title, matching.size());
                if (matching.isEmpty()) {
                    return Mono.empty();
                }
                return Flux.fromIterable(matching)
                    .concatMap(doc -> findPrintEditionWithCover(doc, options)
                        .map(edition -> withEdition(doc, edition)))
                    .next()
                    .switchIfEmpty(Mono.fromSupplier(() -> withoutEdition(matching.get(0))));
            });
    }

    private Mono<EditionMatch> findPrintEditionWithCover(SearchDoc doc, ResolverOptions options) {
        return getJson(options, uriBuilder -> uriBuilder
                .path("/works/{workId}/editions.json")
                .queryParam("limit", EDITIONS_LIMIT)
                .build(doc.workId()))
            .flatMap(root -> Mono.justOrEmpty(selectEdition(root.path("entries"))))
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "Open Library editions lookup failed for work {}, treating as no editions", doc.workId());
                return Mono.empty();
            });
    }

    private Mono<JsonNode> getJson(ResolverOptions options,
                                   Function<UriBuilder, URI> uri) {
        return webClient.get()
            .uri(uri)
            .header(HttpHeaders.USER_AGENT, options.userAgent())
            .retrieve()
            .bodyToMono(String.class)
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .timeout(options.timeout())
            .map(objectMapper::readTree);
    }

    static List<SearchDoc> matchingDocs(JsonNode docs, String title) {
        if (docs == null || !docs.isArray()) {
            return List.of();
        }
        List<SearchDoc> matches = new ArrayList<>();
        for (JsonNode doc : docs) {
            String docTitle = doc.path("title").asString("");
            String workId = lastPathSegment(doc.path("key").asString(""));
            if (!StringUtils.hasText(workId) || !titlesMatch(title, docTitle)) {
                continue;
            }
            List<String> authors = new ArrayList<>();
            for (JsonNode name : doc.path("author_name")) {
                if (StringUtils.hasText(name.asString(""))) {
                    authors.add(name.asString().trim());
                }
            }
            JsonNode year = doc.path("first_publish_year");
            matches.add(new SearchDoc(
                workId,
                docTitle,
                authors.isEmpty() ? null : String.join(", ", authors),
                year.isIntegralNumber() ? year.asInt() : null
            ));
        }
        return matches;
    }

    /**
     * Exact match on the normalized title, or on the part of the found title before a colon.
     */
    static boolean titlesMatch(String expected, String found) {
        String normalizedExpected = TitleNormalizer.normalizeBookTitle(expected);
        if (normalizedExpected.isEmpty()) {
            return false;
        }
        if (normalizedExpected.equals(TitleNormalizer.normalizeBookTitle(found))) {
            return true;
        }
        int colon = found.indexOf(':');
        return colon >= 0 && normalizedExpected.equals(TitleNormalizer.normalizeBookTitle(found.substring(0, colon)));
    }

    static boolean isPrintFormat(@Nullable String format) {
        if (format == null) {
            return true;
        }
        String lower = format.toLowerCase(Locale.ROOT);
        return NON_PRINT_FORMAT_MARKERS.stream().noneMatch(lower::contains);
    }

    static Optional<EditionMatch> selectEdition(JsonNode entries) {
        if (entries == null || !entries.isArray()) {
            return Optional.empty();
        }
        for (JsonNode edition : entries) {
            JsonNode covers = edition.path("covers");
            if (!covers.isArray() || covers.isEmpty() || !covers.get(0).isNumber()) {
                continue;
            }
            String format = edition.path("physical_format").isString() ? edition.path("physical_format").asString() : null;
            if (!isPrintFormat(format)) {
                continue;
            }
            String editionId = lastPathSegment(edition.path("key").asString(""));
            if (!StringUtils.hasText(editionId)) {
                continue;
            }
            return Optional.of(new EditionMatch(editionId, covers.get(0).asLong(), format));
        }
        return Optional.empty();
    }

    private static OpenLibraryResult withEdition(SearchDoc doc, EditionMatch edition) {
        return new OpenLibraryResult(
            doc.workId(),
            edition.editionId(),
            doc.title(),
            doc.author(),
            COVERS_ROOT + edition.coverId() + "-L.jpg",
            OPEN_LIBRARY_ROOT + "/works/" + doc.workId(),
            OPEN_LIBRARY_ROOT + "/books/" + edition.editionId(),
            edition.format(),
            doc.firstPublishYear()
        );
    }

    private static OpenLibraryResult withoutEdition(SearchDoc doc) {
        return new OpenLibraryResult(
            doc.workId(), null, doc.title(), doc.author(), null,
            OPEN_LIBRARY_ROOT + "/works/" + doc.workId(), null, null, doc.firstPublishYear()
        );
    }

    private static String lastPathSegment(String key) {
        return key.substring(key.lastIndexOf('/') + 1);
    }

    record SearchDoc(String workId, String title, @Nullable String author, @Nullable Integer firstPublishYear) {
    }

    record EditionMatch(String editionId, long coverId, @Nullable String format) {
    }
}
