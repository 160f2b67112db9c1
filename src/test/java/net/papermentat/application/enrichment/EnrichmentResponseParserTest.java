package net.papermentat.application.enrichment;

import net.papermentat.model.PaperMetadata;
import net.papermentat.model.WeakMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.ObjectMapper;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EnrichmentResponseParserTest {

    private final EnrichmentResponseParser parser = new EnrichmentResponseParser(new ObjectMapper());
    private final WeakMetadata weak = new WeakMetadata("Weak Title", List.of("Weak Author"), "10.1000/weak", null);

    @Test
    @DisplayName("parses a fenced JSON response")
    void parse_fencedJson() {
        String response = """
            ```json
            {"title": "Strong Title", "authors": ["A. One", "B. Two"], "doi": null,
             "arxiv_id": "2101.00001", "publication_year": "2021", "journal": "JMLR",
             "abstract": "Abstract.", "keywords": ["ml", "ml", "graphs"]}
            ```
            """;

        PaperMetadata metadata = parser.parse(response, weak);

        assertThat(metadata.title()).isEqualTo("Strong Title");
        assertThat(metadata.authors()).containsExactly("A. One", "B. Two");
        assertThat(metadata.doi()).isEqualTo("10.1000/weak");
        assertThat(metadata.arxivId()).isEqualTo("2101.00001");
        assertThat(metadata.publicationYear()).isEqualTo(2021);
        assertThat(metadata.journal()).isEqualTo("JMLR");
        assertThat(metadata.keywords()).containsExactly("ml", "graphs");
    }

    @Test
    @DisplayName("extracts the object from surrounding chatter and falls back to weak fields")
    void parse_braceExtraction() {
        PaperMetadata metadata = parser.parse("Sure! Here it is: {\"publication_year\": 2019} Hope that helps.", weak);

        assertThat(metadata.title()).isEqualTo("Weak Title");
        assertThat(metadata.authors()).containsExactly("Weak Author");
        assertThat(metadata.publicationYear()).isEqualTo(2019);
    }

    @Test
    @DisplayName("a response with no title and no fallback is invalid")
    void parse_noTitle() {
        assertThatThrownBy(() -> parser.parse("{\"title\": null}", WeakMetadata.empty()))
            .isInstanceOf(MetadataEnrichmentException.class)
            .extracting(e -> ((MetadataEnrichmentException) e).errorCode())
            .isEqualTo(MetadataEnrichmentException.ErrorCode.INVALID_RESPONSE);
    }

    @Test
    @DisplayName("non-JSON output is invalid")
    void parse_notJson() {
        assertThatThrownBy(() -> parser.parse("I could not find any metadata.", weak))
            .isInstanceOf(MetadataEnrichmentException.class);
        assertThatThrownBy(() -> parser.parse("   ", weak))
            .isInstanceOf(MetadataEnrichmentException.class);
    }

    @Test
    @DisplayName("prompt carries weak fields and truncated content")
    void buildPrompt() {
        String prompt = EnrichmentPromptFactory.buildPrompt("x".repeat(5000), weak);

        assertThat(prompt).contains("Title: Weak Title").contains("Authors: Weak Author").contains("DOI: 10.1000/weak");
        assertThat(prompt).doesNotContain("x".repeat(EnrichmentPromptFactory.MAX_CONTENT_CHARS + 1));
        assertThat(prompt).contains("x".repeat(EnrichmentPromptFactory.MAX_CONTENT_CHARS));
    }
}
