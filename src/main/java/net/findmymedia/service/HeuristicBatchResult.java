package net.findmymedia.service;

import net.findmymedia.model.DeferredItem;
import net.findmymedia.model.HeuristicMatch;

import java.util.List;

/**
 * Split of a batch into items the heuristic matcher settled and items left for AI ranking.
 */
public record HeuristicBatchResult(List<HeuristicMatch> found, List<DeferredItem> deferred) {
    public HeuristicBatchResult {
        found = List.copyOf(found);
        deferred = List.copyOf(deferred);
    }
}
