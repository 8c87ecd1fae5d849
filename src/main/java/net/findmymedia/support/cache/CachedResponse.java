package net.findmymedia.support.cache;

import tools.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Cached upstream payload with the time it was stored.
 */
public record CachedResponse(JsonNode data, Instant cachedAt) {

    public boolean isNegative() {
        return data == null || data.isNull() || data.isMissingNode();
    }
}
