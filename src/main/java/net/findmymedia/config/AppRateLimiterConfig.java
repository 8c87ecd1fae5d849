/**
 * Configuration for upstream rate limiters
 * - One limiter per external service the pipeline calls
 * - Keeps the bot polite toward public endpoints such as Wikidata and Open Library
 */
package net.findmymedia.config;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Rate limiter beans consumed by the stage services through
 * {@code RateLimiterOperator}. A request that cannot get a permit within the wait
 * window fails its stage instead of queueing indefinitely.
 */
@Configuration
public class AppRateLimiterConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppRateLimiterConfig.class);

    @Value("${app.resolution.rate-limit.wikidata-per-second:5}")
    private int wikidataPerSecond;

    @Value("${app.resolution.rate-limit.open-library-per-second:5}")
    private int openLibraryPerSecond;

    @Value("${app.resolution.rate-limit.google-per-second:10}")
    private int googlePerSecond;

    @Value("${app.resolution.rate-limit.classifier-per-second:2}")
    private int classifierPerSecond;

    @Value("${app.resolution.rate-limit.wait:5s}")
    private Duration permitWait;

    @Bean
    public RateLimiter wikidataRateLimiter() {
        return perSecond("wikidataRateLimiter", wikidataPerSecond);
    }

    @Bean
    public RateLimiter openLibraryRateLimiter() {
        return perSecond("openLibraryRateLimiter", openLibraryPerSecond);
    }

    @Bean
    public RateLimiter googleSearchRateLimiter() {
        return perSecond("googleSearchRateLimiter", googlePerSecond);
    }

    @Bean
    public RateLimiter classifierRateLimiter() {
        return perSecond("classifierRateLimiter", classifierPerSecond);
    }

    private RateLimiter perSecond(String name, int limit) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .limitForPeriod(Math.max(1, limit))
                .timeoutDuration(permitWait)
                .build();

        RateLimiter rateLimiter = RateLimiter.of(name, config);

        logger.info("{} initialized with limit of {} requests/second (wait up to {})", name, Math.max(1, limit), permitWait);

        return rateLimiter;
    }
}
