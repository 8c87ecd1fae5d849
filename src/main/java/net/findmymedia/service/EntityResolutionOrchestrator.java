/**
 * Orchestrates the resolution of a (title, type) pair to one canonical URL.
 *
 * <p>Stages run in a fixed order and the first one that produces an entity wins:</p>
 * <ol>
 *   <li>Wikidata SPARQL search</li>
 *   <li>Open Library (books only)</li>
 *   <li>Google Programmable Search, whose results are deferred to the next two stages</li>
 *   <li>Heuristic matching of the search results</li>
 *   <li>AI classification of the search results</li>
 * </ol>
 *
 * <p>Any stage failure is logged and treated as "not found" for that stage, so a
 * resolution never errors; it completes empty when nothing matched.</p>
 */
package net.findmymedia.service;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.findmymedia.config.EntityResolutionProperties;
import net.findmymedia.model.EntityType;
import net.findmymedia.model.ExternalIdType;
import net.findmymedia.model.ResolvedEntity;
import net.findmymedia.service.pipeline.AiClassificationStage;
import net.findmymedia.service.pipeline.GoogleSearchStage;
import net.findmymedia.service.pipeline.HeuristicStage;
import net.findmymedia.service.pipeline.OpenLibraryStage;
import net.findmymedia.service.pipeline.ResolutionRequest;
import net.findmymedia.service.pipeline.ResolutionStage;
import net.findmymedia.service.pipeline.StageOutcome;
import net.findmymedia.service.pipeline.WikidataStage;
import net.findmymedia.support.cache.ResponseCache;
import net.findmymedia.util.ExternalApiLogger;
import net.findmymedia.util.LoggingUtils;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

@Service
@Slf4j
public class EntityResolutionOrchestrator {

    private final List<ResolutionStage> stages;
    private final EntityResolutionProperties properties;
    private final ResponseCache responseCache;

    @Autowired
    public EntityResolutionOrchestrator(WikidataStage wikidataStage,
                                        OpenLibraryStage openLibraryStage,
                                        GoogleSearchStage googleSearchStage,
                                        HeuristicStage heuristicStage,
                                        AiClassificationStage aiClassificationStage,
                                        EntityResolutionProperties properties,
                                        ObjectProvider<ResponseCache> responseCacheProvider) {
        this(List.of(wikidataStage, openLibraryStage, googleSearchStage, heuristicStage, aiClassificationStage),
            properties, responseCacheProvider.getIfAvailable());
    }

    EntityResolutionOrchestrator(List<ResolutionStage> stages,
                                 EntityResolutionProperties properties,
                                 @Nullable ResponseCache responseCache) {
        this.stages = List.copyOf(stages);
        this.properties = properties;
        this.responseCache = responseCache;
    }

    /**
     * Options built from application configuration, using the configured response cache.
     */
    public ResolverOptions defaultOptions() {
        return ResolverOptions.from(properties, responseCache);
    }

    public Mono<ResolvedEntity> resolveEntity(String query, EntityType type) {
        return resolveEntity(query, type, defaultOptions());
    }

    /**
     * Resolves a free-text title of the given type.
     *
     * @param query title to resolve
     * @param type entity type
     * @param options per-call stage toggles, credentials, cache, timeout and User-Agent
     * @return the resolved entity, or empty when no stage produced one
     */
    public Mono<ResolvedEntity> resolveEntity(String query, EntityType type, ResolverOptions options) {
        return resolve(query, type, null, options);
    }

    public Mono<ResolvedEntity> resolveBook(String title, @Nullable String author) {
        return resolveBook(title, author, defaultOptions());
    }

    /**
     * Resolves a book; the author narrows the Open Library search and the web search query.
     */
    public Mono<ResolvedEntity> resolveBook(String title, @Nullable String author, ResolverOptions options) {
        return resolve(title, EntityType.BOOK, StringUtils.hasText(author) ? author.trim() : null, options);
    }

    /**
     * Builds the catalog URL for an external identifier.
     *
     * @return the URL, or empty when the id type has no URL template
     */
    public static Optional<String> buildCanonicalUrl(ExternalIdType idType, String id) {
        return idType.buildUrl(id);
    }

    private Mono<ResolvedEntity> resolve(String query, EntityType type, @Nullable String author, ResolverOptions options) {
        if (!StringUtils.hasText(query) || type == null) {
            return Mono.empty();
        }
        ResolutionRequest request = new ResolutionRequest(query.trim(), type, author,
            options != null ? options : defaultOptions());

        Mono<StageOutcome> outcome = Mono.just(StageOutcome.NOT_FOUND);
        for (ResolutionStage stage : stages) {
            outcome = outcome.flatMap(previous -> runStage(stage, request, previous));
        }

        return outcome
            .flatMap(result -> {
                if (result instanceof StageOutcome.Found found) {
                    return Mono.just(found.entity());
                }
                ExternalApiLogger.logUnresolved(log, request.query(), type.getWireName());
                return Mono.<ResolvedEntity>empty();
            })
            .onErrorResume(e -> {
                LoggingUtils.error(log, e, "Resolution pipeline failed unexpectedly for '{}' ({})", request.query(), type);
                return Mono.empty();
            });
    }

    private Mono<StageOutcome> runStage(ResolutionStage stage, ResolutionRequest request, StageOutcome previous) {
        if (previous instanceof StageOutcome.Found) {
            return Mono.just(previous);
        }
        if (!stage.isEnabled(request)) {
            ExternalApiLogger.logStageSkipped(log, stage.name(), request.query(), "disabled or not configured");
            return Mono.just(previous);
        }
        return Mono.defer(() -> stage.apply(request, previous))
            .onErrorResume(e -> {
                LoggingUtils.warn(log, e, "{} stage failed for '{}', continuing", stage.name(), request.query());
                return Mono.just(previous);
            })
            .defaultIfEmpty(previous)
            .doOnNext(result -> {
                if (result instanceof StageOutcome.Found found) {
                    ExternalApiLogger.logResolved(log, stage.name(), request.query(), found.entity().url());
                }
            });
    }
}
