package net.findmymedia.model;

import jakarta.annotation.Nullable;

import java.util.Map;

/**
 * Best matching Wikidata item for a title.
 *
 * @param sitelinks number of wiki sitelinks, {@code null} when the endpoint did not report it
 */
public record WikidataResult(
    String qid,
    String label,
    @Nullable String description,
    @Nullable String imageUrl,
    @Nullable String wikipediaUrl,
    Map<ExternalIdType, String> externalIds,
    @Nullable Integer sitelinks
) {
    public WikidataResult {
        externalIds = externalIds == null ? Map.of() : Map.copyOf(externalIds);
    }

    public boolean hasImage() {
        return imageUrl != null && !imageUrl.isBlank();
    }

    public boolean hasWikipediaUrl() {
        return wikipediaUrl != null && !wikipediaUrl.isBlank();
    }

    public boolean hasExternalIds() {
        return !externalIds.isEmpty();
    }
}
