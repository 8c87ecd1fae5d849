package net.findmymedia.support.cache;

import com.github.benmanes.caffeine.cache.Cache;

import java.util.Optional;

/**
 * In-memory {@link ResponseCache} backed by a bounded Caffeine cache.
 */
public class CaffeineResponseCache implements ResponseCache {

    private final Cache<String, CachedResponse> delegate;

    public CaffeineResponseCache(Cache<String, CachedResponse> delegate) {
        this.delegate = delegate;
    }

    @Override
    public Optional<CachedResponse> get(String key) {
        return Optional.ofNullable(delegate.getIfPresent(key));
    }

    @Override
    public void set(String key, CachedResponse response) {
        delegate.put(key, response);
    }

    long estimatedSize() {
        return delegate.estimatedSize();
    }
}
