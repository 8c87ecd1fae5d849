package net.findmymedia.model;

import jakarta.annotation.Nullable;

/**
 * Open Library work matched by title, optionally paired with a print edition that has a cover.
 */
public record OpenLibraryResult(
    String workId,
    @Nullable String editionId,
    String title,
    @Nullable String author,
    @Nullable String coverUrl,
    String workUrl,
    @Nullable String editionUrl,
    @Nullable String format,
    @Nullable Integer firstPublishYear
) {
    public boolean hasCover() {
        return coverUrl != null && !coverUrl.isBlank();
    }
}
