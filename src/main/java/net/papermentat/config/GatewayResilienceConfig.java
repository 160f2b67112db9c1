/**
 * Configuration for outbound call resilience
 * - Global request throttle shared by every provider
 * - Retry policy for transient failures
 * - Per-host circuit breakers
 */
package net.papermentat.config;

import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import net.papermentat.gateway.GatewayFailures;
import net.papermentat.gateway.RequestThrottle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
public class GatewayResilienceConfig {
    private static final Logger logger = LoggerFactory.getLogger(GatewayResilienceConfig.class);

    public static final String RETRY_NAME = "scholarly-http";
    private static final Duration MIN_RETRY_WAIT = Duration.ofMillis(1);

    /**
     * Request throttle enforcing {@code papermentat.rate-limit-per-second} across all providers
     *
     * @return Shared throttle instance
     */
    @Bean
    public RequestThrottle requestThrottle(PaperMentatProperties properties) {
        RequestThrottle throttle = new RequestThrottle(properties.effectiveRateLimit());
        logger.info("Scholarly request throttle initialized with a minimum interval of {} ms",
            throttle.minInterval().toMillis());
        return throttle;
    }

    /**
     * Retry for transient provider failures
     * - {@code papermentat.http.max-retries} retries after the first attempt
     * - Fixed wait of {@code papermentat.http.retry-wait}
     *
     * @return Configured retry instance
     */
    @Bean
    public Retry scholarlyHttpRetry(PaperMentatProperties properties) {
        Duration wait = properties.getHttp().getRetryWait();
        RetryConfig config = RetryConfig.custom()
            .maxAttempts(properties.getHttp().getMaxRetries() + 1)
            .waitDuration(wait.compareTo(MIN_RETRY_WAIT) < 0 ? MIN_RETRY_WAIT : wait)
            .retryOnException(GatewayFailures::isTransient)
            .build();
        return Retry.of(RETRY_NAME, config);
    }

    /**
     * Circuit breakers keyed by provider host
     * - Opens when half of the last 10 calls failed transiently (at least 5 calls)
     * - Stays open for 60 seconds
     *
     * @return Registry creating one breaker per host on demand
     */
    @Bean
    public CircuitBreakerRegistry providerCircuitBreakers() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
            .slidingWindowSize(10)
            .minimumNumberOfCalls(5)
            .failureRateThreshold(50.0f)
            .waitDurationInOpenState(Duration.ofSeconds(60))
            .recordException(GatewayFailures::isTransient)
            .build();
        return CircuitBreakerRegistry.of(config);
    }
}
