package net.papermentat.gateway;

import net.papermentat.exception.UpstreamStatusException;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies gateway failures for the retry and circuit-breaker policies.
 */
public final class GatewayFailures {

    private GatewayFailures() {
    }

    /**
     * Transient failures are worth another attempt: 5xx and 429 answers, transport errors
     * and timeouts anywhere in the cause chain.
     */
    public static boolean isTransient(Throwable throwable) {
        Throwable current = throwable;
        int depth = 0;
        while (current != null && depth < 10) {
            if (current instanceof UpstreamStatusException status) {
                return status.isTransient();
            }
            if (current instanceof WebClientRequestException
                || current instanceof TimeoutException
                || current instanceof IOException
                || current instanceof io.netty.handler.timeout.TimeoutException) {
                return true;
            }
            if (current instanceof InterruptedException) {
                return false;
            }
            current = current.getCause();
            depth++;
        }
        return false;
    }
}
