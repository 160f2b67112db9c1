package net.papermentat.mapper;

import net.papermentat.model.OaEvidence;
import net.papermentat.model.OaStatus;
import net.papermentat.model.PaperMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAlexWorkMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final OpenAlexWorkMapper mapper = new OpenAlexWorkMapper();

    @Test
    @DisplayName("open work is recorded as an inferred green")
    void openWork_isInferredGreen() {
        JsonNode work = objectMapper.readTree("""
            {"id": "https://openalex.org/W1", "doi": "https://doi.org/10.1000/OA",
             "title": "Open Work", "publication_year": 2022,
             "authorships": [{"author": {"display_name": "Grace Hopper"}}],
             "primary_location": {"source": {"display_name": "Journal of Things"}},
             "open_access": {"is_oa": true, "oa_url": "https://repo.example.org/w1.pdf"}}
            """);

        PaperMetadata paper = mapper.toMetadata(work).orElseThrow();

        assertThat(paper.doi()).isEqualTo("10.1000/oa");
        assertThat(paper.authors()).containsExactly("Grace Hopper");
        assertThat(paper.publicationYear()).isEqualTo(2022);
        assertThat(paper.journal()).isEqualTo("Journal of Things");
        assertThat(paper.oaStatus()).isEqualTo(OaStatus.GREEN);
        assertThat(paper.oaLocation()).isEqualTo("https://repo.example.org/w1.pdf");
        assertThat(paper.oaEvidence()).isEqualTo(OaEvidence.CITATION_INDEX_FLAG);
        assertThat(paper.isOaStatusInferred()).isTrue();
    }

    @Test
    @DisplayName("closed work carries no OA fields")
    void closedWork_hasNoOaFields() {
        JsonNode work = objectMapper.readTree("""
            {"display_name": "Closed Work", "open_access": {"is_oa": false}, "primary_location": null}
            """);

        PaperMetadata paper = mapper.toMetadata(work).orElseThrow();

        assertThat(paper.title()).isEqualTo("Closed Work");
        assertThat(paper.oaStatus()).isNull();
        assertThat(paper.journal()).isNull();
        assertThat(mapper.toOpenAccess(work)).isEmpty();
    }
}
