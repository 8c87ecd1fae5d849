package net.findmymedia.support.cache;

import jakarta.annotation.Nullable;
import lombok.extern.slf4j.Slf4j;
import net.findmymedia.util.ExternalApiLogger;
import net.findmymedia.util.LoggingUtils;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.NullNode;

import java.time.Instant;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Read-through caching for upstream lookups.
 * <p>
 * A hit short-circuits the fetch. A miss runs the fetch and stores its value, or a JSON
 * {@code null} when the fetch completes empty. Errors are never stored, so a failed
 * request is retried on the next call.
 */
@Component
@Slf4j
public class CachedLookup {

    private final ObjectMapper objectMapper;

    public CachedLookup(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @param cache cache to consult, or {@code null} to always fetch
     * @param key key from {@link net.findmymedia.util.CacheKeyGenerator}
     * @param type value type stored under the key
     * @param fetch upstream call, subscribed only on a miss
     * @return cached or fetched value; empty when the lookup found nothing
     */
    public <T> Mono<T> lookup(@Nullable ResponseCache cache, String key, Class<T> type, Supplier<Mono<T>> fetch) {
        if (cache == null) {
            return Mono.defer(fetch);
        }
        return Mono.defer(() -> {
            Optional<CachedValue<T>> cached = read(cache, key, type);
            if (cached.isPresent()) {
                ExternalApiLogger.logCacheHit(log, type.getSimpleName(), key, cached.get().value() == null);
                return cached.get().value() == null ? Mono.<T>empty() : Mono.just(cached.get().value());
            }
            return fetch.get()
                .doOnNext(value -> write(cache, key, objectMapper.valueToTree(value)))
                .switchIfEmpty(Mono.defer(() -> {
                    write(cache, key, NullNode.getInstance());
                    return Mono.empty();
                }));
        });
    }

    private <T> Optional<CachedValue<T>> read(ResponseCache cache, String key, Class<T> type) {
        Optional<CachedResponse> entry;
        try {
            entry = cache.get(key);
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Response cache read failed for key {}, fetching upstream", key);
            return Optional.empty();
        }
        if (entry.isEmpty()) {
            return Optional.empty();
        }
        if (entry.get().isNegative()) {
            return Optional.of(new CachedValue<>(null));
        }
        try {
            return Optional.of(new CachedValue<>(objectMapper.treeToValue(entry.get().data(), type)));
        } catch (JacksonException e) {
            LoggingUtils.warn(log, e, "Corrupted cache entry {} for {}, fetching upstream", key, type.getSimpleName());
            return Optional.empty();
        }
    }

    private void write(ResponseCache cache, String key, JsonNode data) {
        try {
            cache.set(key, new CachedResponse(data, Instant.now()));
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Response cache write failed for key {}", key);
        }
    }

    private record CachedValue<T>(@Nullable T value) {
    }
}
