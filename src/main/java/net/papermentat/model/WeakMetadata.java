package net.papermentat.model;

import java.util.List;

/**
 * Partially populated fields scraped from a page before enrichment.
 * Every field may be absent.
 */
public record WeakMetadata(String title, List<String> authors, String doi, String abstractText) {

    public WeakMetadata {
        authors = authors == null ? List.of() : List.copyOf(authors);
    }

    public static WeakMetadata empty() {
        return new WeakMetadata(null, List.of(), null, null);
    }
}
