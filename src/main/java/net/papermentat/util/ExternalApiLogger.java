package net.papermentat.util;

import org.slf4j.Logger;

/**
 * Uniform console lines for every scholarly provider call.
 *
 * Grep for {@code [EXTERNAL-API]} to follow one run across providers:
 * - ATTEMPT / SUCCESS / FAILURE per provider operation
 * - CIRCUIT-BREAKER-OPEN when a host is failing fast
 * - DISABLED when a provider lacks its credential
 * - [HTTP] request/response lines at debug level
 */
public final class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query) {
        log.info(String.format("%s [%s] ATTEMPT: %s for query='%s'", PREFIX, apiName, operation, query));
    }

    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info(String.format("%s [%s] SUCCESS: %s returned %d result(s) for query='%s'",
            PREFIX, apiName, operation, resultCount, query));
    }

    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn(String.format("%s [%s] FAILURE: %s failed for query='%s' - %s",
            PREFIX, apiName, operation, query, reason));
    }

    /**
     * Log circuit breaker blocking a call to a failing host
     */
    public static void logCircuitBreakerBlocked(Logger log, String host, String url) {
        log.warn(String.format("%s [%s] CIRCUIT-BREAKER-OPEN: Skipping request to %s", PREFIX, host, url));
    }

    /**
     * Log a provider skipped for missing credentials or configuration
     */
    public static void logProviderDisabled(Logger log, String apiName, String reason) {
        log.warn(String.format("%s [%s] DISABLED: %s", PREFIX, apiName, reason));
    }

    public static void logHttpRequest(Logger log, String method, String url, int attempt) {
        log.debug(String.format("%s [HTTP] %s request to: %s (attempt %d)", PREFIX, method, url, attempt));
    }

    public static void logHttpResponse(Logger log, int statusCode, String url, int bodySize) {
        log.debug(String.format("%s [HTTP] Response: status=%d, url=%s, bodySize=%d bytes",
            PREFIX, statusCode, url, bodySize));
    }

    /**
     * Log progress through a batch of paper-list entries
     */
    public static void logBatchProgress(Logger log, String operation, int currentCount, int targetCount) {
        log.info(String.format("%s [BATCH] %s: %d/%d entries processed", PREFIX, operation, currentCount, targetCount));
    }
}
