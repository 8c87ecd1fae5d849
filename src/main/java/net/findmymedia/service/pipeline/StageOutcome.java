package net.findmymedia.service.pipeline;

import net.findmymedia.model.DeferredItem;
import net.findmymedia.model.ResolvedEntity;

/**
 * Result of running one stage, handed to the next stage.
 */
public sealed interface StageOutcome permits StageOutcome.Found, StageOutcome.NotFound, StageOutcome.Deferred {

    StageOutcome NOT_FOUND = new NotFound();

    /**
     * A stage accepted an entity; later stages are skipped.
     */
    record Found(ResolvedEntity entity) implements StageOutcome {
    }

    /**
     * Nothing acceptable so far.
     */
    record NotFound() implements StageOutcome {
    }

    /**
     * Web search produced candidates that still need to be ranked.
     */
    record Deferred(DeferredItem item) implements StageOutcome {
    }
}
