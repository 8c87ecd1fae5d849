package net.findmymedia.model;

import jakarta.annotation.Nullable;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Final answer of the resolution pipeline: one canonical URL plus whatever metadata
 * the accepting stage could supply.
 *
 * @param id stage specific identifier (QID, Open Library work id, or the URL itself)
 * @param source stage that accepted the entity
 * @param title display title
 * @param url canonical URL, never blank
 * @param type requested entity type
 * @param year release or first publication year
 * @param description short description
 * @param imageUrl image or cover URL
 * @param wikipediaUrl English Wikipedia article
 * @param externalIds validated external catalog ids
 */
public record ResolvedEntity(
    String id,
    EntitySource source,
    String title,
    String url,
    EntityType type,
    @Nullable Integer year,
    @Nullable String description,
    @Nullable String imageUrl,
    @Nullable String wikipediaUrl,
    Map<ExternalIdType, String> externalIds
) {
    public ResolvedEntity {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(type, "type");
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("ResolvedEntity url must not be blank");
        }
        externalIds = externalIds == null || externalIds.isEmpty()
            ? Map.of()
            : Map.copyOf(new EnumMap<>(externalIds));
    }
}
