package net.papermentat.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Open-access color of a scholarly work.
 *
 * <ul>
 *   <li>GOLD - published open in an OA venue</li>
 *   <li>GREEN - self-archived copy (repository, preprint server)</li>
 *   <li>HYBRID - open article in a subscription venue</li>
 *   <li>BRONZE - free to read but without an open license</li>
 *   <li>CLOSED - no open copy known</li>
 *   <li>UNKNOWN - the provider reported a color outside this set</li>
 * </ul>
 */
public enum OaStatus {
    GOLD,
    GREEN,
    HYBRID,
    BRONZE,
    CLOSED,
    UNKNOWN;

    /**
     * Maps a provider color string onto the enumeration.
     *
     * @param raw provider value such as {@code "gold"}
     * @return matching status, or {@link #UNKNOWN} for blank or unrecognized values
     */
    public static OaStatus fromProviderValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "gold" -> GOLD;
            case "green" -> GREEN;
            case "hybrid" -> HYBRID;
            case "bronze" -> BRONZE;
            case "closed" -> CLOSED;
            default -> UNKNOWN;
        };
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }
}
