package net.papermentat.model;

import java.util.Objects;

/**
 * Open-access verdict produced by one provider for one DOI.
 *
 * @param status   OA color, never null
 * @param location best full-text URL, always null for {@link OaStatus#CLOSED}
 * @param license  license identifier when the provider reports one
 * @param evidence provider class that produced the verdict
 */
public record OpenAccessInfo(OaStatus status, String location, String license, OaEvidence evidence) {

    public OpenAccessInfo {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(evidence, "evidence must not be null");
        if (status == OaStatus.CLOSED) {
            location = null;
        } else if (location != null && location.isBlank()) {
            location = null;
        }
    }

    public static OpenAccessInfo closed(OaEvidence evidence) {
        return new OpenAccessInfo(OaStatus.CLOSED, null, null, evidence);
    }

    public boolean hasLocation() {
        return location != null;
    }
}
