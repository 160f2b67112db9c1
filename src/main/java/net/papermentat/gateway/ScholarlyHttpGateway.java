package net.papermentat.gateway;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import net.papermentat.config.PaperMentatProperties;
import net.papermentat.exception.UpstreamStatusException;
import net.papermentat.util.ExternalApiLogger;
import net.papermentat.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Rate-limited HTTP gateway used by every provider adapter and the artifact downloader.
 *
 * <p>Each call passes through the shared {@link RequestThrottle}, a per-host circuit breaker
 * and the transient-failure retry. No failure escapes: non-2xx answers, transport errors,
 * timeouts and open breakers all yield {@link Optional#empty()} and a warning.</p>
 *
 * <p>Calls block the caller thread. The pipeline is sequential, so blocking keeps the
 * throttle's view of "time since last call" exact.</p>
 */
@Slf4j
@Component
public class ScholarlyHttpGateway {

    private final WebClient webClient;
    private final RequestThrottle throttle;
    private final Retry retry;
    private final CircuitBreakerRegistry circuitBreakers;
    private final Duration timeout;
    private final ObjectMapper objectMapper;
    private final AtomicInteger retryCounter = new AtomicInteger();

    @Autowired
    public ScholarlyHttpGateway(WebClient.Builder webClientBuilder,
                                RequestThrottle throttle,
                                Retry scholarlyHttpRetry,
                                CircuitBreakerRegistry providerCircuitBreakers,
                                PaperMentatProperties properties,
                                ObjectMapper objectMapper) {
        this(webClientBuilder.build(), throttle, scholarlyHttpRetry, providerCircuitBreakers,
            properties.getTimeout(), objectMapper);
    }

    public ScholarlyHttpGateway(WebClient webClient,
                         RequestThrottle throttle,
                         Retry retry,
                         CircuitBreakerRegistry circuitBreakers,
                         Duration timeout,
                         ObjectMapper objectMapper) {
        this.webClient = webClient;
        this.throttle = throttle;
        this.retry = retry;
        this.circuitBreakers = circuitBreakers;
        this.timeout = timeout;
        this.objectMapper = objectMapper;
        this.retry.getEventPublisher().onRetry(event -> {
            retryCounter.incrementAndGet();
            log.info("Retrying outbound request (attempt {}) after: {}",
                event.getNumberOfRetryAttempts() + 1, LoggingUtils.describe(event.getLastThrowable()));
        });
    }

    public Optional<GatewayResponse> get(String url, Map<String, ?> params) {
        return get(url, params, Map.of());
    }

    /**
     * Performs a throttled GET.
     *
     * @param url     absolute base URL
     * @param params  query parameters, {@code null} values skipped
     * @param headers extra request headers
     * @return the buffered 2xx response, or empty on any failure
     */
    public Optional<GatewayResponse> get(String url, Map<String, ?> params, Map<String, String> headers) {
        URI uri;
        try {
            uri = buildUri(url, params);
        } catch (IllegalArgumentException e) {
            LoggingUtils.warn(log, e, "Skipping request to malformed URL '{}'", url);
            return Optional.empty();
        }

        String host = uri.getHost() != null ? uri.getHost() : "unknown-host";
        CircuitBreaker breaker = circuitBreakers.circuitBreaker(host);
        AtomicInteger attempt = new AtomicInteger();
        Supplier<GatewayResponse> guarded = CircuitBreaker.decorateSupplier(breaker,
            () -> exchange(uri, headers, attempt.incrementAndGet()));
        Supplier<GatewayResponse> retried = Retry.decorateSupplier(retry, guarded);

        try {
            return Optional.of(retried.get());
        } catch (CallNotPermittedException e) {
            ExternalApiLogger.logCircuitBreakerBlocked(log, host, uri.toString());
            return Optional.empty();
        } catch (UpstreamStatusException e) {
            log.warn("Request to {} failed: {}", uri, e.getMessage());
            return Optional.empty();
        } catch (RuntimeException e) {
            log.warn("Request to {} failed: {}", uri, LoggingUtils.describe(e));
            return Optional.empty();
        }
    }

    public Optional<JsonNode> getJson(String url, Map<String, ?> params) {
        return getJson(url, params, Map.of());
    }

    /**
     * Throttled GET parsed as a JSON tree. A body that is not JSON counts as a failure.
     */
    public Optional<JsonNode> getJson(String url, Map<String, ?> params, Map<String, String> headers) {
        return get(url, params, headers).flatMap(response -> {
            try {
                return Optional.ofNullable(objectMapper.readTree(response.body()));
            } catch (JacksonException e) {
                log.warn("Response from {} is not valid JSON: {}", url, e.getOriginalMessage());
                return Optional.empty();
            }
        });
    }

    /**
     * Total retries performed by this gateway since startup. Callers diff two readings to
     * attribute retries to one unit of work.
     */
    public int retryCount() {
        return retryCounter.get();
    }

    private GatewayResponse exchange(URI uri, Map<String, String> headers, int attempt) {
        throttle.acquire();
        ExternalApiLogger.logHttpRequest(log, "GET", uri.toString(), attempt);
        GatewayResponse response = webClient.get()
            .uri(uri)
            .headers(h -> headers.forEach(h::set))
            .exchangeToMono(clientResponse -> clientResponse.bodyToMono(byte[].class)
                .defaultIfEmpty(new byte[0])
                .map(body -> new GatewayResponse(
                    clientResponse.statusCode().value(),
                    clientResponse.headers().contentType().map(MediaType::toString).orElse(null),
                    body)))
            .block(timeout);
        if (response == null) {
            throw new IllegalStateException("Empty exchange for " + uri);
        }
        ExternalApiLogger.logHttpResponse(log, response.status(), uri.toString(), response.body().length);
        if (!response.isSuccessful()) {
            throw new UpstreamStatusException(uri.toString(), response.status());
        }
        return response;
    }

    static URI buildUri(String url, Map<String, ?> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url);
        if (params != null) {
            params.forEach((name, value) -> {
                if (value != null) {
                    builder.queryParam(name, value);
                }
            });
        }
        return builder.build().encode().toUri();
    }
}
