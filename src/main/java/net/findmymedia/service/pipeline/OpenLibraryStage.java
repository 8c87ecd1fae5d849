package net.findmymedia.service.pipeline;

import net.findmymedia.model.EntitySource;
import net.findmymedia.model.EntityType;
import net.findmymedia.model.ExternalIdType;
import net.findmymedia.model.OpenLibraryResult;
import net.findmymedia.model.ResolvedEntity;
import net.findmymedia.service.OpenLibrarySearchService;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Book-only stage; accepts an Open Library work only when a printed edition supplied a cover.
 */
@Component
public class OpenLibraryStage implements ResolutionStage {

    private final OpenLibrarySearchService openLibrarySearchService;

    public OpenLibraryStage(OpenLibrarySearchService openLibrarySearchService) {
        this.openLibrarySearchService = openLibrarySearchService;
    }

    @Override
    public String name() {
        return "OpenLibrary";
    }

    @Override
    public boolean isEnabled(ResolutionRequest request) {
        return request.type() == EntityType.BOOK && request.options().openLibraryEnabled();
    }

    @Override
    public Mono<StageOutcome> apply(ResolutionRequest request, StageOutcome previous) {
        return openLibrarySearchService.search(request.query(), request.author(), request.options())
            .filter(OpenLibraryResult::hasCover)
            .map(result -> (StageOutcome) new StageOutcome.Found(toEntity(result, request)))
            .defaultIfEmpty(previous);
    }

    static ResolvedEntity toEntity(OpenLibraryResult result, ResolutionRequest request) {
        return new ResolvedEntity(
            result.workId(),
            EntitySource.OPENLIBRARY,
            result.title() == null || result.title().isBlank() ? request.query() : result.title(),
            result.workUrl(),
            request.type(),
            result.firstPublishYear(),
            result.author() != null ? "by " + result.author() : null,
            result.coverUrl(),
            null,
            Map.of(ExternalIdType.OPENLIBRARY, result.workId())
        );
    }
}
