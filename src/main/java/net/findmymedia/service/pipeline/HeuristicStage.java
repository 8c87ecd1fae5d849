package net.findmymedia.service.pipeline;

import net.findmymedia.model.EntitySource;
import net.findmymedia.model.HeuristicMatch;
import net.findmymedia.model.ResolvedEntity;
import net.findmymedia.service.HeuristicMatcher;
import net.findmymedia.util.SourceClassifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Settles deferred search results with the rule-based matcher.
 */
@Component
public class HeuristicStage implements ResolutionStage {

    private final HeuristicMatcher heuristicMatcher;

    public HeuristicStage(HeuristicMatcher heuristicMatcher) {
        this.heuristicMatcher = heuristicMatcher;
    }

    @Override
    public String name() {
        return "Heuristic";
    }

    @Override
    public boolean isEnabled(ResolutionRequest request) {
        return true;
    }

    @Override
    public Mono<StageOutcome> apply(ResolutionRequest request, StageOutcome previous) {
        if (!(previous instanceof StageOutcome.Deferred deferred)) {
            return Mono.just(previous);
        }
        return Mono.fromSupplier(() -> heuristicMatcher.match(
                deferred.item().title(), deferred.item().category(), deferred.item().searchResults()))
            .map(match -> match
                .map(found -> (StageOutcome) new StageOutcome.Found(toEntity(found, request)))
                .orElse(previous));
    }

    static ResolvedEntity toEntity(HeuristicMatch match, ResolutionRequest request) {
        return new ResolvedEntity(
            match.url(),
            EntitySource.HEURISTIC,
            request.query(),
            match.url(),
            request.type(),
            null,
            null,
            null,
            null,
            SourceClassifier.extractExternalIds(match.url())
        );
    }
}
