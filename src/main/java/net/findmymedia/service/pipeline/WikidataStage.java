package net.findmymedia.service.pipeline;

import net.findmymedia.model.EntitySource;
import net.findmymedia.model.EntityType;
import net.findmymedia.model.ExternalIdType;
import net.findmymedia.model.ResolvedEntity;
import net.findmymedia.model.WikidataResult;
import net.findmymedia.service.WikidataSearchService;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Optional;

/**
 * Accepts the top Wikidata candidate when it has an image, a Wikipedia article or at
 * least one validated external id.
 */
@Component
public class WikidataStage implements ResolutionStage {

    private final WikidataSearchService wikidataSearchService;

    public WikidataStage(WikidataSearchService wikidataSearchService) {
        this.wikidataSearchService = wikidataSearchService;
    }

    @Override
    public String name() {
        return "Wikidata";
    }

    @Override
    public boolean isEnabled(ResolutionRequest request) {
        return request.options().wikidataEnabled();
    }

    @Override
    public Mono<StageOutcome> apply(ResolutionRequest request, StageOutcome previous) {
        return wikidataSearchService.search(request.query(), request.type(), request.options())
            .filter(WikidataStage::isAcceptable)
            .map(result -> (StageOutcome) new StageOutcome.Found(toEntity(result, request)))
            .defaultIfEmpty(previous);
    }

    static boolean isAcceptable(WikidataResult result) {
        return result.hasImage() || result.hasWikipediaUrl() || result.hasExternalIds();
    }

    static ResolvedEntity toEntity(WikidataResult result, ResolutionRequest request) {
        String title = result.label() == null || result.label().isBlank() ? request.query() : result.label();
        return new ResolvedEntity(
            result.qid(),
            EntitySource.WIKIDATA,
            title,
            canonicalUrl(result, request.type()),
            request.type(),
            null,
            result.description(),
            result.imageUrl(),
            result.wikipediaUrl(),
            result.externalIds()
        );
    }

    /**
     * First catalog URL buildable from the type's preferred ids, else the Wikipedia
     * article, else the Wikidata item page.
     */
    static String canonicalUrl(WikidataResult result, EntityType type) {
        for (ExternalIdType idType : type.getRelevantIdTypes()) {
            Optional<String> url = idType.buildUrl(result.externalIds().get(idType));
            if (url.isPresent()) {
                return url.get();
            }
        }
        if (result.hasWikipediaUrl()) {
            return result.wikipediaUrl();
        }
        return "https://www.wikidata.org/wiki/" + result.qid();
    }
}
