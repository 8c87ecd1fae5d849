package net.findmymedia.service.pipeline;

import reactor.core.publisher.Mono;

/**
 * One step of the entity resolution pipeline.
 */
public interface ResolutionStage {

    /**
     * Short name used in logs.
     */
    String name();

    /**
     * Whether the stage applies to this request (type, enabled flags, credentials).
     */
    boolean isEnabled(ResolutionRequest request);

    /**
     * Runs the stage.
     *
     * @param request the query
     * @param previous outcome of the stages before this one, never {@link StageOutcome.Found}
     * @return the new outcome; an empty or failed Mono keeps {@code previous}
     */
    Mono<StageOutcome> apply(ResolutionRequest request, StageOutcome previous);
}
