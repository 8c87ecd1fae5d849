package net.findmymedia.service.pipeline;

import lombok.extern.slf4j.Slf4j;
import net.findmymedia.model.DeferredItem;
import net.findmymedia.service.GoogleSearchService;
import net.findmymedia.util.LoggingUtils;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Fetches web search candidates for the later ranking stages. A failed search counts
 * as zero results.
 */
@Component
@Slf4j
public class GoogleSearchStage implements ResolutionStage {

    private final GoogleSearchService googleSearchService;

    public GoogleSearchStage(GoogleSearchService googleSearchService) {
        this.googleSearchService = googleSearchService;
    }

    @Override
    public String name() {
        return "GoogleSearch";
    }

    @Override
    public boolean isEnabled(ResolutionRequest request) {
        return request.options().googleCredentials().isPresent();
    }

    @Override
    public Mono<StageOutcome> apply(ResolutionRequest request, StageOutcome previous) {
        return request.options().googleCredentials()
            .map(credentials -> googleSearchService
                .searchForEntity(request.query(), request.type(), request.author(), credentials, request.options())
                .map(results -> results.isEmpty()
                    ? StageOutcome.NOT_FOUND
                    : (StageOutcome) new StageOutcome.Deferred(new DeferredItem(request.query(), request.type(), results)))
                .onErrorResume(e -> {
                    LoggingUtils.warn(log, e, "Web search failed for '{}', treating as zero results", request.query());
                    return Mono.just(StageOutcome.NOT_FOUND);
                }))
            .orElseGet(() -> Mono.just(previous));
    }
}
