package net.findmymedia.service;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import net.findmymedia.config.EntityResolutionProperties;
import net.findmymedia.model.EntityType;
import net.findmymedia.model.ExternalIdType;
import net.findmymedia.model.WikidataResult;
import net.findmymedia.support.cache.CachedLookup;
import net.findmymedia.support.cache.CaffeineResponseCache;
import net.findmymedia.support.cache.ResponseCache;
import net.findmymedia.testutil.FixtureExchange;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import reactor.test.StepVerifier;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WikidataSearchServiceTest {

    private ObjectMapper objectMapper;
    private FixtureExchange exchange;

    @BeforeEach
    void setUp() {
        objectMapper = JsonMapper.builder().build();
        exchange = new FixtureExchange();
    }

    @Test
    @DisplayName("search picks the exact-title item and keeps only well-formed ids")
    void search_ranksExactTitleFirst() {
        exchange.route("query.wikidata.org/sparql", "wikidata-matrix.json");

        StepVerifier.create(newService().search("The Matrix", EntityType.MOVIE, ResolverOptions.defaults()))
            .assertNext(result -> {
                assertThat(result.qid()).isEqualTo("Q83495");
                assertThat(result.label()).isEqualTo("The Matrix");
                assertThat(result.wikipediaUrl()).isEqualTo("https://en.wikipedia.org/wiki/The_Matrix");
                assertThat(result.sitelinks()).isEqualTo(95);
                assertThat(result.externalIds())
                    .containsEntry(ExternalIdType.IMDB, "tt0133093")
                    .containsEntry(ExternalIdType.TMDB_MOVIE, "603")
                    .containsEntry(ExternalIdType.LETTERBOXD, "the-matrix")
                    .doesNotContainKey(ExternalIdType.NETFLIX);
            })
            .verifyComplete();
    }

    @Test
    void search_sendsSparqlWithBotHeaders() {
        exchange.route("query.wikidata.org/sparql", "wikidata-clocktower.json");
        ResolverOptions options = ResolverOptions.defaults().toBuilder().userAgent("TestBot/2.0").build();

        StepVerifier.create(newService().search("Blood on the Clocktower", EntityType.PHYSICAL_GAME, options))
            .assertNext(result -> assertThat(result.externalIds()).containsEntry(ExternalIdType.BGG, "240980"))
            .verifyComplete();

        assertThat(exchange.requests()).hasSize(1);
        HttpHeaders headers = exchange.requests().get(0).headers();
        assertThat(headers.getFirst(HttpHeaders.USER_AGENT)).isEqualTo("TestBot/2.0");
        assertThat(headers.getFirst(HttpHeaders.ACCEPT)).isEqualTo("application/sparql-results+json");
        assertThat(exchange.requestedUrls().get(0))
            .contains("mwapi:search \"Blood on the Clocktower\"")
            .contains("wd:Q131436")
            .contains("wdt:P2339 ?bgg");
    }

    @Test
    void search_completesEmpty_When_EndpointFails() {
        exchange.routeBody("query.wikidata.org/sparql", HttpStatus.SERVICE_UNAVAILABLE, "{}");

        StepVerifier.create(newService().search("The Matrix", EntityType.MOVIE, ResolverOptions.defaults()))
            .verifyComplete();
    }

    @Test
    void search_completesEmpty_When_NoCandidates() {
        exchange.route("query.wikidata.org/sparql", "wikidata-empty.json");

        StepVerifier.create(newService().search("Nonexistent Title 12345", EntityType.MOVIE, ResolverOptions.defaults()))
            .verifyComplete();
    }

    @Test
    void search_servesRepeatLookupsFromCache() {
        exchange.route("query.wikidata.org/sparql", "wikidata-clocktower.json");
        ResponseCache cache = new CaffeineResponseCache(Caffeine.newBuilder().maximumSize(10).build());
        ResolverOptions options = ResolverOptions.defaults().toBuilder().cache(cache).build();
        WikidataSearchService service = newService();

        StepVerifier.create(service.search("Blood on the Clocktower", EntityType.PHYSICAL_GAME, options))
            .expectNextCount(1)
            .verifyComplete();
        StepVerifier.create(service.search("Blood on the Clocktower", EntityType.PHYSICAL_GAME, options))
            .assertNext(result -> assertThat(result.qid()).isEqualTo("Q106380040"))
            .verifyComplete();

        assertThat(exchange.requests()).hasSize(1);
    }

    @Test
    void search_skipsBlankTitles() {
        StepVerifier.create(newService().search("  ", EntityType.MOVIE, ResolverOptions.defaults()))
            .verifyComplete();
        assertThat(exchange.requests()).isEmpty();
    }

    @Test
    @DisplayName("parseCandidates repairs bare-QID labels from the article title and drops the rest")
    void parseCandidates_repairsLabels() {
        JsonNode bindings = objectMapper.readTree(FixtureExchange.readFixture("wikidata-matrix.json"))
            .path("results").path("bindings");

        List<WikidataResult> candidates = WikidataSearchService.parseCandidates(bindings, EntityType.MOVIE);

        assertThat(candidates).extracting(WikidataResult::qid)
            .containsExactly("Q207272", "Q83495", "Q18168240");
        assertThat(candidates.get(2).label()).isEqualTo("The Matrix (franchise)");
    }

    @Test
    void titleScore_ordersExactPrefixAndContainment() {
        assertThat(WikidataSearchService.titleScore("The Matrix", "the matrix")).isEqualTo(100);
        assertThat(WikidataSearchService.titleScore("The Matrix Reloaded", "The Matrix")).isEqualTo(80);
        assertThat(WikidataSearchService.titleScore("Dune", "Dune Messiah")).isEqualTo(60);
        assertThat(WikidataSearchService.titleScore("Frank Herbert's Dune", "Dune")).isEqualTo(40);
        assertThat(WikidataSearchService.titleScore("Arrakis", "Dune")).isZero();
    }

    @Test
    void rankCandidates_penalizesItemsWithoutSitelinks() {
        WikidataResult orphan = new WikidataResult("Q1", "Dune", null, null, null, Map.of(), 0);
        WikidataResult popular = new WikidataResult("Q2", "Dune Messiah", null, null, null, Map.of(), 60);

        assertThat(WikidataSearchService.rankCandidates(List.of(orphan, popular), "Dune"))
            .get().extracting(WikidataResult::qid).isEqualTo("Q2");
        assertThat(WikidataSearchService.sitelinksScore(500)).isEqualTo(WikidataSearchService.SITELINKS_CAP);
        assertThat(WikidataSearchService.sitelinksScore(null)).isZero();
    }

    @Test
    void buildSparqlQuery_escapesQuotesAndOmitsTypeFilterForArtists() {
        String query = WikidataSearchService.buildSparqlQuery("Say \"Hi\"", EntityType.ARTIST);

        assertThat(query).contains("mwapi:search \"Say \\\"Hi\\\"\"");
        assertThat(query).doesNotContain("VALUES ?type");
        assertThat(query).contains("?spotify_artist").endsWith("LIMIT 20");
        assertThat(WikidataSearchService.buildSparqlQuery("Serial", EntityType.PODCAST)).doesNotContain("VALUES ?type");
    }

    @Test
    @DisplayName("waiting for a rate-limit permit counts against the call timeout")
    void search_givesUpWithinTimeout_When_RateLimitPermitIsDelayed() {
        exchange.route("query.wikidata.org/sparql", "wikidata-clocktower.json");
        RateLimiter slowLimiter = RateLimiter.of("wikidata-slow", RateLimiterConfig.custom()
            .limitForPeriod(1)
            .limitRefreshPeriod(Duration.ofSeconds(5))
            .timeoutDuration(Duration.ofSeconds(10))
            .build());
        WikidataSearchService service = new WikidataSearchService(exchange.builder(), objectMapper,
            new CachedLookup(objectMapper), slowLimiter, new EntityResolutionProperties());
        ResolverOptions options = ResolverOptions.defaults().toBuilder().timeout(Duration.ofMillis(200)).build();

        StepVerifier.create(service.search("Blood on the Clocktower", EntityType.PHYSICAL_GAME, options))
            .expectNextCount(1)
            .verifyComplete();
        StepVerifier.create(service.search("Wingspan", EntityType.PHYSICAL_GAME, options))
            .expectComplete()
            .verify(Duration.ofSeconds(2));

        assertThat(exchange.requests()).hasSize(1);
    }

    private WikidataSearchService newService() {
        return new WikidataSearchService(exchange.builder(), objectMapper, new CachedLookup(objectMapper),
            RateLimiter.ofDefaults("wikidata-test"), new EntityResolutionProperties());
    }
}
