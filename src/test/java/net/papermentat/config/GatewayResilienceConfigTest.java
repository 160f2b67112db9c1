package net.papermentat.config;

import io.github.resilience4j.retry.Retry;
import net.papermentat.exception.UpstreamStatusException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GatewayResilienceConfigTest {

    private final GatewayResilienceConfig config = new GatewayResilienceConfig();

    @Test
    @DisplayName("retry allows max-retries attempts after the first")
    void retry_attemptsFollowProperties() {
        PaperMentatProperties properties = new PaperMentatProperties();
        properties.getHttp().setMaxRetries(2);
        properties.getHttp().setRetryWait(Duration.ZERO);

        Retry retry = config.scholarlyHttpRetry(properties);

        assertThat(retry.getRetryConfig().getMaxAttempts()).isEqualTo(3);
        assertThat(retry.getRetryConfig().getExceptionPredicate()
            .test(new UpstreamStatusException("https://x.org", 503))).isTrue();
        assertThat(retry.getRetryConfig().getExceptionPredicate()
            .test(new UpstreamStatusException("https://x.org", 404))).isFalse();
    }

    @Test
    @DisplayName("throttle interval follows the configured rate")
    void throttle_followsRate() {
        PaperMentatProperties properties = new PaperMentatProperties();
        properties.setRateLimitPerSecond(4.0);

        assertThat(config.requestThrottle(properties).minInterval()).isEqualTo(Duration.ofMillis(250));
    }

    @Test
    @DisplayName("circuit breakers are created per host")
    void circuitBreakers_perHost() {
        var registry = config.providerCircuitBreakers();

        assertThat(registry.circuitBreaker("api.crossref.org"))
            .isNotSameAs(registry.circuitBreaker("api.openalex.org"));
        assertThat(registry.circuitBreaker("api.crossref.org").getCircuitBreakerConfig().getSlidingWindowSize())
            .isEqualTo(10);
    }
}
