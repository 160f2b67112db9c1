package net.papermentat.application.enrichment;

import net.papermentat.model.WeakMetadata;
import net.papermentat.util.TextUtils;

/**
 * Builds the metadata-extraction prompt shared by every enrichment provider.
 */
final class EnrichmentPromptFactory {

    static final int MAX_CONTENT_CHARS = 3000;

    static final String SYSTEM_PROMPT = """
        You extract bibliographic metadata for scholarly papers.
        Return ONLY a JSON object, no markdown and no commentary.
        Use null for any field you cannot determine from the content.
        """;

    private EnrichmentPromptFactory() {
    }

    static String buildPrompt(String text, WeakMetadata weak) {
        WeakMetadata fields = weak != null ? weak : WeakMetadata.empty();
        String content = TextUtils.truncate(text != null ? text : "", MAX_CONTENT_CHARS);
        return """
            Extract scholarly paper metadata from the following content.

            Title: %s
            Authors: %s
            DOI: %s
            Abstract: %s

            Content (truncated): %s

            Return ONLY a JSON object:
            {"title": "...", "authors": ["..."], "doi": "...", "arxiv_id": null, "publication_year": 2023, "journal": "...", "abstract": "...", "keywords": ["..."]}"""
            .formatted(
                nullToEmpty(fields.title()),
                String.join(", ", fields.authors()),
                nullToEmpty(fields.doi()),
                nullToEmpty(fields.abstractText()),
                content);
    }

    private static String nullToEmpty(String value) {
        return value != null ? value : "";
    }
}
