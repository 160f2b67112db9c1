package net.papermentat.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of processing one query hit or list entry.
 *
 * @param identifier   input URL or DOI, empty for ad-hoc search hits
 * @param state        final pipeline state
 * @param metadata     resolved record, required for metadata-bearing states
 * @param errorMessage present exactly when {@code state} is {@link ProcessingState#FAILED}
 * @param elapsed      wall-clock processing time
 * @param retryCount   transient-failure retries consumed while processing
 */
public record ProcessingResult(
    String identifier,
    ProcessingState state,
    PaperMetadata metadata,
    String errorMessage,
    Duration elapsed,
    int retryCount
) {

    public ProcessingResult {
        identifier = identifier == null ? "" : identifier;
        Objects.requireNonNull(state, "state must not be null");
        elapsed = elapsed == null ? Duration.ZERO : elapsed;
        if (retryCount < 0) {
            throw new IllegalArgumentException("retryCount must not be negative");
        }
        boolean failed = state == ProcessingState.FAILED;
        boolean hasError = errorMessage != null && !errorMessage.isBlank();
        if (failed != hasError) {
            throw new IllegalArgumentException("errorMessage must be present exactly when state is FAILED, state=" + state);
        }
        if (state.requiresMetadata() && metadata == null) {
            throw new IllegalArgumentException("State " + state + " requires metadata");
        }
        if ((state == ProcessingState.NEW || state == ProcessingState.TRIAGED) && metadata != null) {
            throw new IllegalArgumentException("State " + state + " cannot carry metadata");
        }
    }

    /**
     * Wraps a record that arrives already OA-resolved, e.g. a preprint hit.
     */
    public static ProcessingResult completed(String identifier, PaperMetadata metadata, Duration elapsed) {
        return new ProcessingResult(identifier, ProcessingState.COMPLETED, metadata, null, elapsed, 0);
    }

    public Optional<PaperMetadata> metadataIfPresent() {
        return Optional.ofNullable(metadata);
    }

    public boolean isSuccessful() {
        return state == ProcessingState.COMPLETED;
    }

    public boolean isFailed() {
        return state == ProcessingState.FAILED;
    }
}
