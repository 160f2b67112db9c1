package net.papermentat.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Pipeline state of one processed identifier.
 *
 * <p>States only move forward in declaration order. {@link #FAILED} can be reached
 * from any non-terminal state; {@link #COMPLETED} and {@link #FAILED} are terminal.</p>
 */
public enum ProcessingState {
    NEW,
    TRIAGED,
    METADATA_EXTRACTED,
    OA_VERIFIED,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * @param next candidate successor
     * @return {@code true} when moving from this state to {@code next} is a forward transition
     */
    public boolean canAdvanceTo(ProcessingState next) {
        if (next == null || isTerminal()) {
            return false;
        }
        if (next == FAILED) {
            return true;
        }
        return next.ordinal() > ordinal();
    }

    /**
     * @return {@code true} for states in which a result must carry metadata
     */
    public boolean requiresMetadata() {
        return this == METADATA_EXTRACTED || this == OA_VERIFIED || this == COMPLETED;
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
