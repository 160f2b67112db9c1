package net.papermentat.service;

import net.papermentat.config.PaperMentatProperties;
import net.papermentat.gateway.StubGateways;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import tools.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class CrossrefServiceTest {

    private static PaperMentatProperties properties(String email) {
        PaperMentatProperties properties = new PaperMentatProperties();
        properties.setContactEmail(email);
        return properties;
    }

    @Test
    @DisplayName("search returns message items and sends the polite-pool contact")
    void search_returnsItems() {
        StubGateways.Recorded stub = StubGateways.json("""
            {"status": "ok", "message": {"items": [{"DOI": "10.1000/a"}, {"DOI": "10.1000/b"}]}}
            """);
        CrossrefService service = new CrossrefService(stub.gateway(), properties("me@example.org"),
            "https://api.crossref.org/works");

        List<JsonNode> items = service.search("graph neural networks", 2);

        assertThat(items).hasSize(2);
        assertThat(stub.lastUri())
            .contains("rows=2")
            .contains("sort=relevance")
            .contains("mailto=me@example.org");
    }

    @Test
    @DisplayName("lookup unwraps the message of a DOI record")
    void lookupByDoi_unwrapsMessage() {
        StubGateways.Recorded stub = StubGateways.json("""
            {"status": "ok", "message": {"DOI": "10.1038/nature14539", "title": ["Deep learning"]}}
            """);
        CrossrefService service = new CrossrefService(stub.gateway(), properties(""), "https://api.crossref.org/works");

        Optional<JsonNode> work = service.lookupByDoi("10.1038/nature14539");

        assertThat(work).isPresent();
        assertThat(work.get().path("DOI").asString()).isEqualTo("10.1038/nature14539");
        assertThat(stub.lastUri()).startsWith("https://api.crossref.org/works/10.1038/nature14539");
    }

    @Test
    @DisplayName("unknown DOI yields empty")
    void lookupByDoi_notFound() {
        StubGateways.Recorded stub = StubGateways.responding(
            request -> StubGateways.response(HttpStatus.NOT_FOUND, "text/plain", "Resource not found."));
        CrossrefService service = new CrossrefService(stub.gateway(), properties(""), "https://api.crossref.org/works");

        assertThat(service.lookupByDoi("10.1000/missing")).isEmpty();
    }
}
