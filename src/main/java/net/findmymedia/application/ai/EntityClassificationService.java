package net.findmymedia.application.ai;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import lombok.extern.slf4j.Slf4j;
import net.findmymedia.model.ClassificationResult;
import net.findmymedia.model.DeferredItem;
import net.findmymedia.model.GoogleSearchResult;
import net.findmymedia.service.ResolverOptions;
import net.findmymedia.support.cache.CachedLookup;
import net.findmymedia.support.cache.ResponseCache;
import net.findmymedia.util.CacheKeyGenerator;
import net.findmymedia.util.ExternalApiLogger;
import net.findmymedia.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Last-resort ranking of web search results by an LLM.
 *
 * <p>The model sees the numbered candidates and returns 1-based indexes of the results
 * that are really about the requested entity, best first. Indexes outside the candidate
 * list are discarded. Any failure yields an empty classification, which is not cached.</p>
 */
@Service
@Slf4j
public class EntityClassificationService {

    static final int SNIPPET_MAX_LENGTH = 200;

    private final EntityClassificationClient client;
    private final ClassificationJsonParser parser;
    private final CachedLookup cachedLookup;
    private final RateLimiter rateLimiter;

    EntityClassificationService(EntityClassificationClient client,
                                ObjectMapper objectMapper,
                                CachedLookup cachedLookup,
                                @Qualifier("classifierRateLimiter") RateLimiter rateLimiter) {
        this.client = client;
        this.parser = new ClassificationJsonParser(objectMapper);
        this.cachedLookup = cachedLookup;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Ranks one deferred item's search results.
     *
     * @param item title, category and candidate results
     * @param credentials chat completion credentials
     * @param options per-call cache and timeout
     * @return the classification; never errors, failures produce an empty ranking with
     *         {@link ClassificationResult#FAILURE_EXPLANATION}
     */
    public Mono<ClassificationResult> classifyItem(DeferredItem item,
                                                   ResolverOptions.AiClassifierCredentials credentials,
                                                   ResolverOptions options) {
        if (item.searchResults().isEmpty()) {
            return Mono.just(new ClassificationResult(item.title(), item.category(), List.of(), List.of(), "No search results"));
        }
        String model = EntityClassificationClient.resolveModel(credentials);
        List<String> urls = item.searchResults().stream().map(GoogleSearchResult::url).toList();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", item.title());
        payload.put("category", item.category().getWireName());
        payload.put("urls", urls);
        String cacheKey = CacheKeyGenerator.generate("classifier", model, payload);

        return cachedLookup.lookup(options.cache(), cacheKey, ClassificationResult.class,
                () -> classifyUncached(item, credentials, options, cacheKey))
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "AI classification failed for '{}' ({})", item.title(), item.category());
                ExternalApiLogger.logApiCallFailure(log, "AIClassifier", "CLASSIFY", item.title(), e.getMessage());
                return Mono.just(ClassificationResult.failed(item.title(), item.category()));
            })
            .defaultIfEmpty(ClassificationResult.failed(item.title(), item.category()));
    }

    /**
     * Classifies items one after another, in input order.
     */
    public Flux<ClassificationResult> classifyItems(List<DeferredItem> items,
                                                    ResolverOptions.AiClassifierCredentials credentials,
                                                    ResolverOptions options) {
        return Flux.fromIterable(items).concatMap(item -> classifyItem(item, credentials, options));
    }

    private Mono<ClassificationResult> classifyUncached(DeferredItem item,
                                                        ResolverOptions.AiClassifierCredentials credentials,
                                                        ResolverOptions options,
                                                        String cacheKey) {
        String prompt = buildPrompt(item);
        ExternalApiLogger.logApiCallAttempt(log, "AIClassifier", "CLASSIFY", item.title());
        return Mono.fromCallable(() -> client.complete(credentials, prompt, options.timeout()))
            .subscribeOn(Schedulers.boundedElastic())
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .timeout(options.timeout())
            .map(parser::parse)
            .map(parsed -> toResult(item, parsed))
            .doOnNext(result -> {
                ExternalApiLogger.logApiCallSuccess(log, "AIClassifier", "CLASSIFY", item.title(), result.rankedUrls().size());
                storePrompt(options.cache(), cacheKey, prompt);
            });
    }

    static ClassificationResult toResult(DeferredItem item, ClassificationJsonParser.ParsedClassification parsed) {
        List<GoogleSearchResult> candidates = item.searchResults();
        List<Integer> validIndexes = new ArrayList<>();
        List<String> rankedUrls = new ArrayList<>();
        for (Integer index : parsed.urlIndexes()) {
            if (index == null || index < 1 || index > candidates.size()) {
                continue;
            }
            validIndexes.add(index);
            rankedUrls.add(candidates.get(index - 1).url());
        }
        return new ClassificationResult(item.title(), item.category(), validIndexes, rankedUrls, parsed.explanation());
    }

    static String buildPrompt(DeferredItem item) {
        StringBuilder results = new StringBuilder();
        List<GoogleSearchResult> candidates = item.searchResults();
        for (int i = 0; i < candidates.size(); i++) {
            GoogleSearchResult candidate = candidates.get(i);
            results.append(i + 1).append(". ").append(candidate.title()).append('\n');
            results.append("   ").append(candidate.url()).append('\n');
            if (candidate.snippet() != null && !candidate.snippet().isBlank()) {
                String snippet = candidate.snippet();
                results.append("   ")
                    .append(snippet.length() > SNIPPET_MAX_LENGTH ? snippet.substring(0, SNIPPET_MAX_LENGTH) : snippet)
                    .append('\n');
            }
            results.append('\n');
        }

        return """
            Find URLs for this specific media entity that will have an og:image meta tag.

            Entity: "%s" (%s)

            Search results:
            %s
            STRICT RULES:
            1. Only include results that are actually for THIS SPECIFIC entity - not similar titles, not other works by the same creator
            2. NEVER include: reddit.com, facebook.com, instagram.com, linkedin.com, twitter.com, any forum or social media
            3. Rank authoritative sources first: imdb.com, wikipedia.org, goodreads.com, amazon.com, spotify.com, letterboxd.com
            4. Return EMPTY ARRAY if none of the results are for the correct entity

            Return JSON with 1-indexed result numbers, best first:
            {"url_indexes": [2, 5], "explanation": "Result 2 is IMDB, Result 5 is Wikipedia"}

            Empty array if no result matches the entity (a book by the same author is NOT a match).
            """.formatted(item.title(), item.category().getWireName(), results);
    }

    private void storePrompt(ResponseCache cache, String cacheKey, String prompt) {
        if (cache == null) {
            return;
        }
        try {
            cache.setPrompt(cacheKey, prompt);
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Could not store classifier prompt for key {}", cacheKey);
        }
    }
}
