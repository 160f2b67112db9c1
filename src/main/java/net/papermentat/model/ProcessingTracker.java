package net.papermentat.model;

import java.time.Duration;
import java.util.function.LongSupplier;

/**
 * Mutable builder for a {@link ProcessingResult} that enforces forward-only state
 * transitions while an identifier is being processed.
 *
 * <p>A tracker is single-use: once {@link #finish(int)} has produced a result, further
 * transitions are rejected.</p>
 */
public final class ProcessingTracker {

    private final String identifier;
    private final LongSupplier nanoClock;
    private final long startedAt;
    private ProcessingState state = ProcessingState.NEW;
    private PaperMetadata metadata;
    private String errorMessage;
    private boolean finished;

    private ProcessingTracker(String identifier, LongSupplier nanoClock) {
        this.identifier = identifier;
        this.nanoClock = nanoClock;
        this.startedAt = nanoClock.getAsLong();
    }

    public static ProcessingTracker start(String identifier) {
        return new ProcessingTracker(identifier, System::nanoTime);
    }

    static ProcessingTracker start(String identifier, LongSupplier nanoClock) {
        return new ProcessingTracker(identifier, nanoClock);
    }

    public ProcessingState state() {
        return state;
    }

    public ProcessingTracker advance(ProcessingState next) {
        ensureOpen();
        if (!state.canAdvanceTo(next)) {
            throw new IllegalStateException("Illegal transition " + state + " -> " + next + " for '" + identifier + "'");
        }
        state = next;
        return this;
    }

    public ProcessingTracker triaged() {
        return advance(ProcessingState.TRIAGED);
    }

    public ProcessingTracker metadataExtracted(PaperMetadata extracted) {
        advance(ProcessingState.METADATA_EXTRACTED);
        this.metadata = extracted;
        return this;
    }

    /**
     * Records the OA-resolved record. Reaches COMPLETED when it carries a full-text
     * location, otherwise stays in METADATA_EXTRACTED.
     */
    public ProcessingTracker resolved(PaperMetadata resolved) {
        if (state != ProcessingState.METADATA_EXTRACTED) {
            metadataExtracted(resolved);
        } else {
            ensureOpen();
            this.metadata = resolved;
        }
        if (resolved.hasOaLocation()) {
            advance(ProcessingState.OA_VERIFIED);
            advance(ProcessingState.COMPLETED);
        }
        return this;
    }

    public ProcessingTracker fail(String message) {
        advance(ProcessingState.FAILED);
        this.errorMessage = message == null || message.isBlank() ? "Processing failed" : message;
        // metadata stays attached only if extraction had already succeeded
        return this;
    }

    public ProcessingResult finish(int retryCount) {
        ensureOpen();
        finished = true;
        Duration elapsed = Duration.ofNanos(Math.max(0L, nanoClock.getAsLong() - startedAt));
        PaperMetadata carried = state == ProcessingState.NEW || state == ProcessingState.TRIAGED ? null : metadata;
        return new ProcessingResult(identifier, state, carried, errorMessage, elapsed, retryCount);
    }

    private void ensureOpen() {
        if (finished) {
            throw new IllegalStateException("Tracker for '" + identifier + "' already finished");
        }
    }
}
