package net.findmymedia.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalListener;
import lombok.extern.slf4j.Slf4j;
import net.findmymedia.support.cache.CachedResponse;
import net.findmymedia.support.cache.CaffeineResponseCache;
import net.findmymedia.support.cache.FilesystemResponseCache;
import net.findmymedia.support.cache.ResponseCache;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import tools.jackson.databind.ObjectMapper;

import java.time.Duration;

/**
 * Factory for Caffeine caches and the pipeline's {@link ResponseCache}.
 * Centralizes cache creation so size and TTL settings stay consistent.
 */
@Configuration
@Slf4j
public class CacheFactory {

    /**
     * Create a cache with specified configuration.
     */
    public <K, V> Cache<K, V> createCache(String name, int maxSize, Duration ttl) {
        log.debug("Creating Caffeine cache '{}' (maxSize={}, ttl={})", name, maxSize, ttl);
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .expireAfterWrite(ttl)
            .recordStats()
            .build();
    }

    /**
     * Create a size-limited cache that hands every evicted or invalidated entry to a listener.
     */
    public <K, V> Cache<K, V> createCacheWithSize(String name, int maxSize, RemovalListener<K, V> removalListener) {
        log.debug("Creating Caffeine cache '{}' (maxSize={}, with removal listener)", name, maxSize);
        return Caffeine.newBuilder()
            .maximumSize(maxSize)
            .removalListener(removalListener)
            .recordStats()
            .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.resolution.cache", name = "type", havingValue = "memory", matchIfMissing = true)
    public ResponseCache memoryResponseCache(EntityResolutionProperties properties) {
        EntityResolutionProperties.Cache settings = properties.getCache();
        Cache<String, CachedResponse> delegate = createCache("responses", settings.getMaxSize(), settings.getTtl());
        log.info("Using in-memory response cache (maxSize={}, ttl={})", settings.getMaxSize(), settings.getTtl());
        return new CaffeineResponseCache(delegate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.resolution.cache", name = "type", havingValue = "filesystem")
    public ResponseCache filesystemResponseCache(EntityResolutionProperties properties, ObjectMapper objectMapper) {
        log.info("Using filesystem response cache at {}", properties.getCache().getDirectory());
        return new FilesystemResponseCache(properties.getCache().getDirectory(), objectMapper);
    }
}
