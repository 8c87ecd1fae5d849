package net.findmymedia.service.pipeline;

import lombok.extern.slf4j.Slf4j;
import net.findmymedia.application.ai.EntityClassificationService;
import net.findmymedia.model.EntitySource;
import net.findmymedia.model.ResolvedEntity;
import net.findmymedia.util.SourceClassifier;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Lets the AI classifier rank deferred search results and accepts its top URL.
 */
@Component
@Slf4j
public class AiClassificationStage implements ResolutionStage {

    private final EntityClassificationService classificationService;

    public AiClassificationStage(EntityClassificationService classificationService) {
        this.classificationService = classificationService;
    }

    @Override
    public String name() {
        return "AIClassifier";
    }

    @Override
    public boolean isEnabled(ResolutionRequest request) {
        return request.options().aiCredentials().isPresent();
    }

    @Override
    public Mono<StageOutcome> apply(ResolutionRequest request, StageOutcome previous) {
        if (!(previous instanceof StageOutcome.Deferred deferred)) {
            return Mono.just(previous);
        }
        return request.options().aiCredentials()
            .map(credentials -> classificationService.classifyItem(deferred.item(), credentials, request.options())
                .map(result -> result.bestUrl()
                    .map(url -> (StageOutcome) new StageOutcome.Found(toEntity(url, request)))
                    .orElse(previous)))
            .orElseGet(() -> Mono.just(previous));
    }

    static ResolvedEntity toEntity(String url, ResolutionRequest request) {
        log.debug("AI picked {} (attributed to {}) for '{}'", url, SourceClassifier.classify(url).orElse("ai"), request.query());
        return new ResolvedEntity(
            url,
            EntitySource.AI,
            request.query(),
            url,
            request.type(),
            null,
            null,
            null,
            null,
            SourceClassifier.extractExternalIds(url)
        );
    }
}
