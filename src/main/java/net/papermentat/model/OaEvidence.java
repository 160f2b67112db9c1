package net.papermentat.model;

/**
 * Where the open-access fields of a {@link PaperMetadata} came from.
 * Sources that only expose a binary "is open" flag yield an inferred color.
 */
public enum OaEvidence {
    PREPRINT_ARCHIVE(false),
    OA_STATUS_INDEX(false),
    CITATION_INDEX_FLAG(true),
    REPOSITORY_FULL_TEXT(true);

    private final boolean inferred;

    OaEvidence(boolean inferred) {
        this.inferred = inferred;
    }

    /**
     * @return {@code true} when the color was guessed rather than reported by the provider
     */
    public boolean isInferred() {
        return inferred;
    }
}
