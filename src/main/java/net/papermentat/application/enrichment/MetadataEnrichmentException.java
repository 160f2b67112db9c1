package net.papermentat.application.enrichment;

import com.openai.errors.OpenAIException;
import com.openai.errors.OpenAIIoException;
import com.openai.errors.OpenAIServiceException;

import java.util.Objects;

/**
 * Thrown inside an enrichment provider when a call or its response parsing fails.
 * Converted to an empty result at the {@link MetadataEnrichmentCapability} boundary.
 */
public class MetadataEnrichmentException extends RuntimeException {

    /**
     * Canonical failure categories.
     */
    public enum ErrorCode {
        PROVIDER_UNAVAILABLE,
        PROVIDER_FAILED,
        INVALID_RESPONSE
    }

    private final ErrorCode errorCode;

    public MetadataEnrichmentException(ErrorCode errorCode, String message) {
        this(errorCode, message, null);
    }

    public MetadataEnrichmentException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "errorCode must not be null");
    }

    public ErrorCode errorCode() {
        return errorCode;
    }

    /**
     * Formats an OpenAI SDK exception as HTTP status plus a short explanation when available.
     */
    public static String describeApiError(OpenAIException ex) {
        if (ex instanceof OpenAIServiceException serviceException) {
            int status = serviceException.statusCode();
            String explanation = switch (status) {
                case 401 -> "unauthorized, check the API key";
                case 404 -> "not found, check base URL and model name";
                case 429 -> "rate limited";
                case 500, 502, 503 -> "server error";
                default -> "unexpected status";
            };
            return "HTTP %d %s".formatted(status, explanation);
        }
        if (ex instanceof OpenAIIoException) {
            return "network error: " + ex.getMessage();
        }
        return ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
    }
}
