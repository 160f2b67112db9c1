package net.papermentat.mapper;

import net.papermentat.model.PaperMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CrossrefWorkMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CrossrefWorkMapper mapper = new CrossrefWorkMapper();

    @Test
    @DisplayName("maps a journal article")
    void toMetadata_mapsArticle() {
        JsonNode work = objectMapper.readTree("""
            {
              "DOI": "10.1016/J.OREGEOREV.2018.12.018",
              "title": ["<i>Porphyry</i> copper deposits"],
              "author": [
                {"given": "Jane", "family": "Doe"},
                {"name": "Geology Consortium"}
              ],
              "container-title": ["Ore Geology Reviews"],
              "published-online": {"date-parts": [[2018, 12, 20]]},
              "published-print": {"date-parts": [[2019, 2]]},
              "abstract": "<jats:p>Copper <jats:bold>matters</jats:bold>.</jats:p>",
              "subject": ["Geology", "Geochemistry"]
            }
            """);

        Optional<PaperMetadata> metadata = mapper.toMetadata(work);

        assertThat(metadata).isPresent();
        PaperMetadata paper = metadata.get();
        assertThat(paper.title()).isEqualTo("Porphyry copper deposits");
        assertThat(paper.doi()).isEqualTo("10.1016/j.oregeorev.2018.12.018");
        assertThat(paper.authors()).containsExactly("Jane Doe", "Geology Consortium");
        assertThat(paper.publicationYear()).isEqualTo(2019);
        assertThat(paper.journal()).isEqualTo("Ore Geology Reviews");
        assertThat(paper.abstractText()).isEqualTo("Copper matters.");
        assertThat(paper.keywords()).containsExactly("Geology", "Geochemistry");
        assertThat(paper.oaStatus()).isNull();
    }

    @Test
    @DisplayName("falls back to the online date, then the creation date")
    void toMetadata_yearFallback() {
        JsonNode onlineOnly = objectMapper.readTree("""
            {"DOI": "10.1000/a", "title": ["A"],
             "published-online": {"date-parts": [[2021]]}, "created": {"date-parts": [[2020]]}}
            """);
        JsonNode createdOnly = objectMapper.readTree("""
            {"DOI": "10.1000/b", "title": ["B"], "created": {"date-parts": [[2020, 1, 1]]}}
            """);

        assertThat(mapper.toMetadata(onlineOnly).orElseThrow().publicationYear()).isEqualTo(2021);
        assertThat(mapper.toMetadata(createdOnly).orElseThrow().publicationYear()).isEqualTo(2020);
    }

    @Test
    @DisplayName("figure, table and supplement DOIs are not articles")
    void toMetadata_skipsComponentDois() {
        JsonNode figure = objectMapper.readTree("""
            {"DOI": "10.7717/peerj.5000/fig-1", "title": ["Figure 1"]}
            """);

        assertThat(mapper.toMetadata(figure)).isEmpty();
    }

    @Test
    @DisplayName("missing title becomes Unknown")
    void toMetadata_missingTitle() {
        JsonNode work = objectMapper.readTree("{\"DOI\": \"10.1000/untitled\"}");

        assertThat(mapper.toMetadata(work).orElseThrow().title()).isEqualTo("Unknown");
    }

    @Test
    @DisplayName("mapping is pure")
    void toMetadata_isPure() {
        JsonNode work = objectMapper.readTree("""
            {"DOI": "10.1000/pure", "title": ["Same"], "author": [{"given": "A", "family": "B"}]}
            """);

        assertThat(mapper.toMetadata(work)).isEqualTo(mapper.toMetadata(work));
    }
}
