package net.findmymedia.model;

import jakarta.annotation.Nullable;

/**
 * Single web search hit.
 */
public record GoogleSearchResult(String title, String url, @Nullable String snippet) {
}
