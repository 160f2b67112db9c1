package net.papermentat.support.retrieval;

import net.papermentat.config.PaperMentatProperties;
import net.papermentat.gateway.GatewayResponse;
import net.papermentat.gateway.StubGateways;
import net.papermentat.model.OaEvidence;
import net.papermentat.model.OaStatus;
import net.papermentat.model.PaperMetadata;
import net.papermentat.model.ProcessingResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ArtifactDownloadServiceTest {

    @TempDir
    Path tempDir;

    private static ProcessingResult openResult(String title, String location) {
        PaperMetadata metadata = PaperMetadata.builder()
            .title(title)
            .oaStatus(OaStatus.GREEN)
            .oaLocation(location)
            .oaEvidence(OaEvidence.PREPRINT_ARCHIVE)
            .build();
        return ProcessingResult.completed("", metadata, Duration.ZERO);
    }

    private static ArtifactDownloadService service(StubGateways.Recorded stub) {
        return new ArtifactDownloadService(stub.gateway(), new PaperMentatProperties());
    }

    @Test
    @DisplayName("404 writes no file and does not count")
    void notFound_writesNothing() throws IOException {
        StubGateways.Recorded stub = StubGateways.responding(
            request -> StubGateways.response(HttpStatus.NOT_FOUND, "text/html", "missing"));

        int count = service(stub).downloadArtifacts(
            List.of(openResult("Missing Paper", "https://example.org/missing.pdf")), tempDir);

        assertThat(count).isZero();
        try (var files = Files.list(tempDir)) {
            assertThat(files).isEmpty();
        }
    }

    @Test
    @DisplayName("PDF response is written under a sanitised title")
    void pdf_isWritten() {
        StubGateways.Recorded stub = StubGateways.responding(
            request -> StubGateways.response(HttpStatus.OK, "application/pdf", "%PDF-1.7"));

        int count = service(stub).downloadArtifacts(
            List.of(openResult("Deep Learning: A Review?", "https://arxiv.org/pdf/1706.03762")), tempDir);

        assertThat(count).isEqualTo(1);
        assertThat(tempDir.resolve("Deep Learning A Review.pdf")).exists().hasContent("%PDF-1.7");
    }

    @Test
    @DisplayName("titles in non-Latin scripts get distinct files")
    void nonLatinTitles_areWrittenSeparately() {
        assumeTrue(filesystemAccepts("Глубокое обучение") && filesystemAccepts("深度学习综述")
            && filesystemAccepts("Café Résumé"),
            "filesystem encoding cannot represent non-ASCII names");
        StubGateways.Recorded stub = StubGateways.responding(
            request -> StubGateways.response(HttpStatus.OK, "application/pdf", "%PDF-1.7"));

        int count = service(stub).downloadArtifacts(List.of(
            openResult("Глубокое обучение", "https://example.org/ru.pdf"),
            openResult("深度学习综述", "https://example.org/zh.pdf"),
            openResult("Café Résumé", "https://example.org/fr.pdf")), tempDir);

        assertThat(count).isEqualTo(3);
        assertThat(stub.requests()).hasSize(3);
        assertThat(tempDir.resolve("Глубокое обучение.pdf")).exists();
        assertThat(tempDir.resolve("深度学习综述.pdf")).exists();
        assertThat(tempDir.resolve("Café Résumé.pdf")).exists();
        assertThat(tempDir.resolve("paper.pdf")).doesNotExist();
    }

    private boolean filesystemAccepts(String name) {
        try {
            tempDir.resolve(name + ".pdf");
            return true;
        } catch (InvalidPathException e) {
            return false;
        }
    }

    @Test
    @DisplayName("HTML landing page is not accepted as an artifact")
    void htmlLandingPage_isRejected() {
        StubGateways.Recorded stub = StubGateways.responding(
            request -> StubGateways.response(HttpStatus.OK, "text/html", "<html></html>"));

        int count = service(stub).downloadArtifacts(
            List.of(openResult("Landing", "https://journal.example.org/article/1")), tempDir);

        assertThat(count).isZero();
        assertThat(tempDir.resolve("Landing.pdf")).doesNotExist();
    }

    @Test
    @DisplayName("existing files are counted without downloading again")
    void existingFile_isCountedWithoutRequest() throws IOException {
        Files.writeString(tempDir.resolve("Already Here.pdf"), "%PDF");
        StubGateways.Recorded stub = StubGateways.json("{}");

        int count = service(stub).downloadArtifacts(
            List.of(openResult("Already Here", "https://example.org/a.pdf")), tempDir);

        assertThat(count).isEqualTo(1);
        assertThat(stub.requests()).isEmpty();
    }

    @Test
    @DisplayName("artifact acceptance checks status, content type and URL shape")
    void isAcceptedArtifact() {
        GatewayResponse binary = new GatewayResponse(200, "application/octet-stream", new byte[0]);
        assertThat(ArtifactDownloadService.isAcceptedArtifact(binary, "https://x.org/paper.PDF")).isTrue();
        assertThat(ArtifactDownloadService.isAcceptedArtifact(binary, "https://arxiv.org/pdf/1706.03762")).isTrue();
        assertThat(ArtifactDownloadService.isAcceptedArtifact(binary, "https://x.org/paper")).isFalse();
        assertThat(ArtifactDownloadService.isAcceptedArtifact(
            new GatewayResponse(404, "application/pdf", new byte[0]), "https://x.org/a.pdf")).isFalse();
    }

    @Test
    @DisplayName("filenames are sanitised and capped")
    void safeFilename() {
        assertThat(ArtifactDownloadService.safeFilename("a/b\\c:d*e")).isEqualTo("abcde");
        assertThat(ArtifactDownloadService.safeFilename("???")).isEqualTo("paper");
        assertThat(ArtifactDownloadService.safeFilename("Глубокое обучение?")).isEqualTo("Глубокое обучение");
        assertThat(ArtifactDownloadService.safeFilename("深度学习：综述")).isEqualTo("深度学习综述");
        assertThat(ArtifactDownloadService.safeFilename("Café Résumé")).isEqualTo("Café Résumé");
        assertThat(ArtifactDownloadService.safeFilename("x".repeat(200)))
            .hasSize(ArtifactDownloadService.MAX_FILENAME_LENGTH);
    }
}
