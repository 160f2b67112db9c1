package net.papermentat.service;

import net.papermentat.gateway.StubGateways;
import net.papermentat.mapper.ArxivEntryMapper;
import net.papermentat.model.OaStatus;
import net.papermentat.model.PaperMetadata;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ArxivServiceTest {

    private static String feed(int entries) {
        StringBuilder xml = new StringBuilder("""
            <?xml version="1.0" encoding="UTF-8"?>
            <feed xmlns="http://www.w3.org/2005/Atom">
            """);
        for (int i = 1; i <= entries; i++) {
            xml.append("<entry><id>http://arxiv.org/abs/2006.1123").append(i).append("v1</id>")
                .append("<title>Diffusion models ").append(i).append("</title>")
                .append("<published>2020-06-19T17:24:44Z</published>")
                .append("<author><name>Author ").append(i).append("</name></author></entry>");
        }
        return xml.append("</feed>").toString();
    }

    @Test
    @DisplayName("search sends an all-fields relevance query and caps the entries")
    void search_returnsGreenPreprints() {
        StubGateways.Recorded stub = StubGateways.responding(
            request -> StubGateways.response(HttpStatus.OK, "application/atom+xml", feed(5)));
        ArxivService service = new ArxivService(stub.gateway(), "http://export.arxiv.org/api/query");
        ArxivEntryMapper mapper = new ArxivEntryMapper();

        List<Element> entries = service.search("diffusion models", 3);

        assertThat(entries).hasSize(3);
        assertThat(stub.lastUri())
            .contains("search_query=all:diffusion%20models")
            .contains("max_results=3")
            .contains("sortBy=relevance")
            .contains("sortOrder=descending");
        for (Element entry : entries) {
            PaperMetadata paper = mapper.toMetadata(entry).orElseThrow();
            assertThat(paper.oaStatus()).isEqualTo(OaStatus.GREEN);
            assertThat(paper.oaLocation()).endsWith("arxiv.org/pdf/" + paper.arxivId());
        }
    }

    @Test
    @DisplayName("a non-Atom body yields no entries")
    void search_nonAtomBody() {
        StubGateways.Recorded stub = StubGateways.responding(
            request -> StubGateways.response(HttpStatus.OK, "text/html", "<html><body>maintenance</body></html>"));
        ArxivService service = new ArxivService(stub.gateway(), "http://export.arxiv.org/api/query");

        assertThat(service.search("anything", 3)).isEmpty();
    }

    @Test
    @DisplayName("blank query issues no request")
    void search_blankQuery() {
        StubGateways.Recorded stub = StubGateways.json("{}");
        ArxivService service = new ArxivService(stub.gateway(), "http://export.arxiv.org/api/query");

        assertThat(service.search("  ", 3)).isEmpty();
        assertThat(stub.requests()).isEmpty();
    }
}
