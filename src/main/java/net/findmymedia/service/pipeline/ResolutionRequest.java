package net.findmymedia.service.pipeline;

import jakarta.annotation.Nullable;
import net.findmymedia.model.EntityType;
import net.findmymedia.service.ResolverOptions;

/**
 * One query flowing through the pipeline.
 *
 * @param query title as given by the caller, trimmed
 * @param type requested entity type
 * @param author author hint, only set for book lookups
 * @param options per-call settings
 */
public record ResolutionRequest(String query, EntityType type, @Nullable String author, ResolverOptions options) {
}
