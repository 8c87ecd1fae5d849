/**
 * Service for finding the best Wikidata item for a title.
 *
 * <p>Runs a fuzzy SPARQL entity search restricted to the entity type's Wikidata classes,
 * merges the result rows per item, ranks candidates by title similarity and wiki
 * popularity, and attaches validated external catalog ids to the winner.</p>
 */
package net.findmymedia.service;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.reactor.ratelimiter.operator.RateLimiterOperator;
import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.findmymedia.config.EntityResolutionProperties;
import net.findmymedia.model.EntityType;
import net.findmymedia.model.ExternalIdType;
import net.findmymedia.model.WikidataResult;
import net.findmymedia.support.cache.CachedLookup;
import net.findmymedia.util.CacheKeyGenerator;
import net.findmymedia.util.ExternalApiLogger;
import net.findmymedia.util.LoggingUtils;
import net.findmymedia.util.UrlUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Service
@Slf4j
public class WikidataSearchService {

    static final int RESULT_LIMIT = 20;
    static final int ZERO_SITELINKS_PENALTY = -500;
    static final int SITELINKS_CAP = 100;
    private static final String SPARQL_RESULTS_JSON = "application/sparql-results+json";
    private static final Pattern BARE_QID = Pattern.compile("^Q\\d+$");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final CachedLookup cachedLookup;
    private final RateLimiter rateLimiter;

    public WikidataSearchService(WebClient.Builder webClientBuilder,
                                 ObjectMapper objectMapper,
                                 CachedLookup cachedLookup,
                                 @Qualifier("wikidataRateLimiter") RateLimiter rateLimiter,
                                 EntityResolutionProperties properties) {
        this.webClient = webClientBuilder.clone().baseUrl(properties.getWikidata().getEndpoint()).build();
        this.objectMapper = objectMapper;
        this.cachedLookup = cachedLookup;
        this.rateLimiter = rateLimiter;
    }

    /**
     * Searches Wikidata for the item that best matches a title.
     *
     * @param title free-text title
     * @param type entity type used to restrict the search
     * @param options per-call cache, timeout and User-Agent
     * @return the top ranked candidate, or empty when nothing usable was found or the request failed
     */
    public Mono<WikidataResult> search(String title, EntityType type, ResolverOptions options) {
        if (!StringUtils.hasText(title)) {
            return Mono.empty();
        }
        String trimmedTitle = title.trim();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", trimmedTitle);
        payload.put("category", type.getWireName());
        String cacheKey = CacheKeyGenerator.generate("wikidata", "sparql", payload);

        return cachedLookup.lookup(options.cache(), cacheKey, WikidataResult.class,
                () -> fetch(trimmedTitle, type, options))
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "Wikidata search failed for '{}' ({}), continuing without a result", trimmedTitle, type);
                ExternalApiLogger.logApiCallFailure(log, "Wikidata", "SPARQL_SEARCH", trimmedTitle, e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<WikidataResult> fetch(String title, EntityType type, ResolverOptions options) {
        String query = buildSparqlQuery(title, type);
        ExternalApiLogger.logApiCallAttempt(log, "Wikidata", "SPARQL_SEARCH", title);
        return webClient.get()
            .uri(uriBuilder -> uriBuilder
                .queryParam("query", "{query}")
                .queryParam("format", "json")
                .build(query))
            .header(HttpHeaders.USER_AGENT, options.userAgent())
            .header(HttpHeaders.ACCEPT, SPARQL_RESULTS_JSON)
            .retrieve()
            .bodyToMono(String.class)
            .transformDeferred(RateLimiterOperator.of(rateLimiter))
            .timeout(options.timeout())
            .map(objectMapper::readTree)
            .flatMap(root -> {
                List<WikidataResult> candidates = parseCandidates(root.path("results").path("bindings"), type);
                ExternalApiLogger.logApiCallSuccess(log, "Wikidata", "SPARQL_SEARCH", title, candidates.size());
                return Mono.justOrEmpty(rankCandidates(candidates, title));
            });
    }

    /**
     * Builds the SPARQL query: fuzzy entity search, class restriction, optional image,
     * English Wikipedia article, sitelink count and one optional binding per relevant id type.
     */
    static String buildSparqlQuery(String title, EntityType type) {
        String escapedTitle = title.replace("\\", "\\\\").replace("\"", "\\\"");
        List<ExternalIdType> idTypes = type.getRelevantIdTypes();

        StringBuilder select = new StringBuilder("SELECT ?item ?itemLabel ?itemDescription ?image ?article ?sitelinks");
        StringBuilder optionalIds = new StringBuilder();
        for (ExternalIdType idType : idTypes) {
            select.append(" ?").append(idType.getKey());
            optionalIds.append("  OPTIONAL { ?item wdt:").append(idType.getWikidataProperty())
                .append(" ?").append(idType.getKey()).append(" . }\n");
        }

        String typeClause = "";
        if (!type.getWikidataTypeQids().isEmpty()) {
            String values = type.getWikidataTypeQids().stream()
                .map(qid -> "wd:" + qid)
                .collect(Collectors.joining(" "));
            typeClause = "  VALUES ?type { " + values + " }\n  ?item wdt:P31/wdt:P279* ?type .\n";
        }

        return select + " WHERE {\n"
            + "  SERVICE wikibase:mwapi {\n"
            + "    bd:serviceParam wikibase:endpoint \"www.wikidata.org\" ;\n"
            + "                    wikibase:api \"EntitySearch\" ;\n"
            + "                    mwapi:search \"" + escapedTitle + "\" ;\n"
            + "                    mwapi:language \"en\" .\n"
            + "    ?item wikibase:apiOutputItem mwapi:item .\n"
            + "  }\n"
            + typeClause
            + "  OPTIONAL { ?item wdt:P18 ?image . }\n"
            + "  OPTIONAL { ?article schema:about ?item ; schema:isPartOf <https://en.wikipedia.org/> . }\n"
            + "  OPTIONAL { ?item wikibase:sitelinks ?sitelinks . }\n"
            + optionalIds
            + "  SERVICE wikibase:label { bd:serviceParam wikibase:language \"en\" . }\n"
            + "}\n"
            + "LIMIT " + RESULT_LIMIT;
    }

    /**
     * Merges SPARQL rows per item (first non-empty value wins), repairs bare-QID labels
     * and drops candidates whose label cannot be repaired.
     */
    static List<WikidataResult> parseCandidates(JsonNode bindings, EntityType type) {
        if (bindings == null || !bindings.isArray()) {
            return List.of();
        }
        Map<String, CandidateRow> rows = new LinkedHashMap<>();
        for (JsonNode binding : bindings) {
            String itemUri = bindingValue(binding, "item");
            if (itemUri == null) {
                continue;
            }
            String qid = itemUri.substring(itemUri.lastIndexOf('/') + 1);
            rows.computeIfAbsent(qid, CandidateRow::new).merge(binding, type.getRelevantIdTypes());
        }

        List<WikidataResult> candidates = new ArrayList<>();
        for (CandidateRow row : rows.values()) {
            row.toResult().ifPresent(candidates::add);
        }
        return candidates;
    }

    /**
     * Picks the candidate with the highest combined score; ties keep the earlier candidate.
     */
    static Optional<WikidataResult> rankCandidates(List<WikidataResult> candidates, String query) {
        WikidataResult best = null;
        int bestScore = Integer.MIN_VALUE;
        for (WikidataResult candidate : candidates) {
            int score = combinedScore(candidate, query);
            if (score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return Optional.ofNullable(best);
    }

    static int combinedScore(WikidataResult candidate, String query) {
        return titleScore(candidate.label(), query) * 10 + sitelinksScore(candidate.sitelinks());
    }

    static int titleScore(String label, String query) {
        String l = label == null ? "" : label.trim().toLowerCase(Locale.ROOT);
        String q = query == null ? "" : query.trim().toLowerCase(Locale.ROOT);
        if (l.isEmpty() || q.isEmpty()) {
            return 0;
        }
        if (l.equals(q)) {
            return 100;
        }
        if (l.startsWith(q)) {
            return 80;
        }
        if (q.startsWith(l)) {
            return 60;
        }
        if (l.contains(q) || q.contains(l)) {
            return 40;
        }
        return 0;
    }

    static int sitelinksScore(@Nullable Integer sitelinks) {
        if (sitelinks == null) {
            return 0;
        }
        if (sitelinks == 0) {
            return ZERO_SITELINKS_PENALTY;
        }
        return Math.min(sitelinks, SITELINKS_CAP);
    }

    @Nullable
    private static String bindingValue(JsonNode binding, String variable) {
        JsonNode value = binding.path(variable).path("value");
        if (!value.isString()) {
            return null;
        }
        String text = value.asString();
        return StringUtils.hasText(text) ? text.trim() : null;
    }

    private static final class CandidateRow {
        private final String qid;
        private String label;
        private String description;
        private String imageUrl;
        private String wikipediaUrl;
        private Integer sitelinks;
        private final Map<ExternalIdType, String> externalIds = new EnumMap<>(ExternalIdType.class);

        CandidateRow(String qid) {
            this.qid = qid;
        }

        void merge(JsonNode binding, List<ExternalIdType> idTypes) {
            label = label != null ? label : bindingValue(binding, "itemLabel");
            description = description != null ? description : bindingValue(binding, "itemDescription");
            imageUrl = imageUrl != null ? imageUrl : bindingValue(binding, "image");
            wikipediaUrl = wikipediaUrl != null ? wikipediaUrl : bindingValue(binding, "article");
            if (sitelinks == null) {
                String raw = bindingValue(binding, "sitelinks");
                if (raw != null) {
                    try {
                        sitelinks = Integer.parseInt(raw);
                    } catch (NumberFormatException e) {
                        log.debug("Ignoring non-numeric sitelinks '{}' for {}", raw, qid);
                    }
                }
            }
            for (ExternalIdType idType : idTypes) {
                if (externalIds.containsKey(idType)) {
                    continue;
                }
                String value = bindingValue(binding, idType.getKey());
                if (idType.accepts(value)) {
                    externalIds.put(idType, value);
                }
            }
        }

        Optional<WikidataResult> toResult() {
            String resolvedLabel = label;
            if (resolvedLabel == null || BARE_QID.matcher(resolvedLabel).matches()) {
                resolvedLabel = UrlUtils.wikipediaArticleTitle(wikipediaUrl);
                if (resolvedLabel == null) {
                    return Optional.empty();
                }
            }
            return Optional.of(new WikidataResult(qid, resolvedLabel, description, imageUrl, wikipediaUrl, externalIds, sitelinks));
        }
    }
}
