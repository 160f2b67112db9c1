package net.papermentat.model;

import lombok.Builder;
import net.papermentat.util.DoiUtils;
import net.papermentat.util.TextUtils;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical record for one scholarly work, normalised from a provider payload
 * or an enrichment response.
 *
 * <p>Identity fields (title, DOI, arXiv identifier) are fixed at construction.
 * Open-access fields are set either by the provider that produced the record or
 * once by {@link #withOpenAccess(OpenAccessInfo)} during OA resolution.</p>
 *
 * @param title           required, trimmed, never blank
 * @param authors         ordered author display names, may be empty
 * @param doi             lowercase DOI without resolver prefix
 * @param arxivId         preprint archive identifier, version suffix kept
 * @param publicationYear four-digit year
 * @param journal         journal or venue name
 * @param abstractText    plain-text abstract
 * @param keywords        unordered keywords
 * @param oaStatus        OA color when known
 * @param oaLocation      best full-text URL, absent when {@code oaStatus} is CLOSED
 * @param license         license identifier
 * @param oaEvidence      provider class behind the OA fields
 */
@Builder(toBuilder = true)
public record PaperMetadata(
    String title,
    List<String> authors,
    String doi,
    String arxivId,
    Integer publicationYear,
    String journal,
    String abstractText,
    Set<String> keywords,
    OaStatus oaStatus,
    String oaLocation,
    String license,
    OaEvidence oaEvidence
) {

    public PaperMetadata {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("PaperMetadata title must not be blank");
        }
        title = TextUtils.collapseWhitespace(title);
        authors = authors == null ? List.of() : List.copyOf(authors);
        doi = DoiUtils.normalize(doi);
        arxivId = TextUtils.emptyToNull(arxivId);
        if (publicationYear != null && (publicationYear < 1000 || publicationYear > 9999)) {
            publicationYear = null;
        }
        journal = TextUtils.emptyToNull(journal);
        abstractText = TextUtils.emptyToNull(abstractText);
        keywords = keywords == null || keywords.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(keywords));
        oaLocation = TextUtils.emptyToNull(oaLocation);
        license = TextUtils.emptyToNull(license);
        if (oaStatus == OaStatus.CLOSED) {
            oaLocation = null;
        }
        if (oaStatus == null) {
            oaEvidence = null;
        }
    }

    /**
     * Returns a copy carrying the given OA verdict, license included. Identity fields are untouched.
     */
    public PaperMetadata withOpenAccess(OpenAccessInfo info) {
        Objects.requireNonNull(info, "info must not be null");
        return toBuilder()
            .oaStatus(info.status())
            .oaLocation(info.location())
            .license(info.license())
            .oaEvidence(info.evidence())
            .build();
    }

    public boolean hasOaLocation() {
        return oaLocation != null;
    }

    /**
     * @return {@code true} when the OA color is a guess derived from a binary flag
     */
    public boolean isOaStatusInferred() {
        return oaEvidence != null && oaEvidence.isInferred();
    }

    /**
     * Key under which two records are considered the same work: DOI, else arXiv
     * identifier, else normalised title.
     */
    public String dedupKey() {
        if (doi != null) {
            return "doi:" + doi;
        }
        if (arxivId != null) {
            return "arxiv:" + arxivId.toLowerCase(Locale.ROOT);
        }
        return "title:" + TextUtils.normalizeForComparison(title);
    }
}
