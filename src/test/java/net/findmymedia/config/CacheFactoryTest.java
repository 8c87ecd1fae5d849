package net.findmymedia.config;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.RemovalCause;
import net.findmymedia.support.cache.CaffeineResponseCache;
import net.findmymedia.support.cache.FilesystemResponseCache;
import net.findmymedia.support.cache.ResponseCache;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CacheFactoryTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(CacheFactory.class, EntityResolutionProperties.class)
        .withBean(ObjectMapper.class, () -> JsonMapper.builder().build());

    @Test
    void should_UseMemoryCache_ByDefault() {
        contextRunner.run(context -> assertThat(context).getBean(ResponseCache.class)
            .isInstanceOf(CaffeineResponseCache.class));
    }

    @Test
    void should_UseFilesystemCache_When_Configured() {
        contextRunner.withPropertyValues("app.resolution.cache.type=filesystem")
            .run(context -> assertThat(context).getBean(ResponseCache.class)
                .isInstanceOf(FilesystemResponseCache.class));
    }

    @Test
    void should_RegisterNoCache_When_TypeIsNone() {
        contextRunner.withPropertyValues("app.resolution.cache.type=none")
            .run(context -> assertThat(context).doesNotHaveBean(ResponseCache.class));
    }

    @Test
    void createCache_boundsEntries() {
        Cache<String, String> cache = new CacheFactory().createCache("test", 10, Duration.ofMinutes(1));
        cache.put("a", "b");

        assertThat(cache.getIfPresent("a")).isEqualTo("b");
        assertThat(cache.policy().eviction()).hasValueSatisfying(eviction ->
            assertThat(eviction.getMaximum()).isEqualTo(10L));
    }

    @Test
    void createCacheWithSize_notifiesListenerOnInvalidation() throws InterruptedException {
        CountDownLatch removed = new CountDownLatch(1);
        Cache<String, String> cache = new CacheFactory().createCacheWithSize("test", 10,
            (String key, String value, RemovalCause cause) -> {
                if ("a".equals(key) && cause == RemovalCause.EXPLICIT) {
                    removed.countDown();
                }
            });
        cache.put("a", "b");

        cache.invalidate("a");

        assertThat(removed.await(2, TimeUnit.SECONDS)).isTrue();
    }
}
