package net.findmymedia.support.cache;

import java.util.Optional;

/**
 * Pluggable store for upstream responses, keyed by the hashes from
 * {@link net.findmymedia.util.CacheKeyGenerator}.
 * <p>
 * Implementations must be safe for concurrent use. A stored JSON {@code null} means
 * the lookup ran and found nothing.
 */
public interface ResponseCache {

    Optional<CachedResponse> get(String key);

    void set(String key, CachedResponse response);

    /**
     * Stores the prompt that produced an entry, for debugging. No-op unless the
     * implementation keeps prompts.
     */
    default void setPrompt(String key, String prompt) {
    }
}
