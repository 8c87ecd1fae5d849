package net.findmymedia.model;

import java.util.List;

/**
 * Query the heuristic matcher could not settle, carried forward with its search results.
 */
public record DeferredItem(String title, EntityType category, List<GoogleSearchResult> searchResults) {
    public DeferredItem {
        searchResults = searchResults == null ? List.of() : List.copyOf(searchResults);
    }
}
