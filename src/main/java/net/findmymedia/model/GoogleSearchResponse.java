package net.findmymedia.model;

import java.util.List;

/**
 * Results of one web search request, in ranking order.
 */
public record GoogleSearchResponse(String query, List<GoogleSearchResult> results) {
    public GoogleSearchResponse {
        results = results == null ? List.of() : List.copyOf(results);
    }
}
