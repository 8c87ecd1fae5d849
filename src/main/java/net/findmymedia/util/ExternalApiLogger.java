package net.findmymedia.util;

import org.slf4j.Logger;

/**
 * Centralized console logging for upstream calls made by the resolution pipeline.
 *
 * These logs make the stage flow easy to follow in production:
 * - Wikidata SPARQL (first stage)
 * - Open Library (books only)
 * - Google Programmable Search (fallback)
 * - AI classifier (last resort)
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query) {
        log.info(String.format("%s [%s] ATTEMPT: %s for query='%s'", PREFIX, apiName, operation, query));
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info(String.format("%s [%s] SUCCESS: %s returned %d result(s) for query='%s'",
            PREFIX, apiName, operation, resultCount, query));
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn(String.format("%s [%s] FAILURE: %s failed for query='%s' - %s",
            PREFIX, apiName, operation, query, reason));
    }

    /**
     * Log a response served from the response cache
     */
    public static void logCacheHit(Logger log, String valueType, String cacheKey, boolean negative) {
        log.debug(String.format("%s [CACHE] HIT: %s key=%s%s", PREFIX, valueType, cacheKey, negative ? " (no result)" : ""));
    }

    /**
     * Log a pipeline stage that was skipped because it is disabled or unconfigured
     */
    public static void logStageSkipped(Logger log, String stage, String query, String reason) {
        log.debug(String.format("%s [PIPELINE] %s SKIPPED: query='%s' - %s", PREFIX, stage, query, reason));
    }

    /**
     * Log the stage that accepted an entity
     */
    public static void logResolved(Logger log, String stage, String query, String url) {
        log.info(String.format("%s [PIPELINE] RESOLVED by %s: query='%s', url=%s", PREFIX, stage, query, url));
    }

    /**
     * Log a query no stage could resolve
     */
    public static void logUnresolved(Logger log, String query, String type) {
        log.info(String.format("%s [PIPELINE] UNRESOLVED: query='%s', type=%s", PREFIX, query, type));
    }
}
