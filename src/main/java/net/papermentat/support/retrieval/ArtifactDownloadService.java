package net.papermentat.support.retrieval;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.config.PaperMentatProperties;
import net.papermentat.gateway.GatewayResponse;
import net.papermentat.gateway.ScholarlyHttpGateway;
import net.papermentat.model.PaperMetadata;
import net.papermentat.model.ProcessingResult;
import net.papermentat.util.LoggingUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Downloads full-text PDFs for results that carry an OA location.
 *
 * <p>A response is written only when it is a 2xx answer and looks like a PDF: a PDF content
 * type, a {@code .pdf} URL, or an arXiv PDF path. Failed or rejected downloads are logged and
 * skipped without aborting the remaining results.</p>
 */
@Slf4j
@Service
public class ArtifactDownloadService {

    static final int MAX_FILENAME_LENGTH = 80;
    private static final String DEFAULT_FILENAME = "paper";
    private static final Pattern UNSAFE_CHARACTERS = Pattern.compile("[^\\p{L}\\p{N}_\\s-]");

    private final ScholarlyHttpGateway gateway;
    private final Path outputDir;

    public ArtifactDownloadService(ScholarlyHttpGateway gateway, PaperMentatProperties properties) {
        this.gateway = gateway;
        this.outputDir = properties.getOutputDir();
    }

    public int downloadArtifacts(List<ProcessingResult> results) {
        return downloadArtifacts(results, outputDir);
    }

    /**
     * @param results   processed results; those without an OA location are ignored
     * @param targetDir directory receiving the PDFs, created when missing
     * @return number of artifacts available on disk after the run, counting files that already existed
     */
    public int downloadArtifacts(List<ProcessingResult> results, Path targetDir) {
        if (results == null || results.isEmpty()) {
            return 0;
        }
        try {
            Files.createDirectories(targetDir);
        } catch (IOException e) {
            LoggingUtils.error(log, e, "Cannot create download directory {}", targetDir);
            return 0;
        }

        int count = 0;
        for (ProcessingResult result : results) {
            Optional<PaperMetadata> metadata = result.metadataIfPresent().filter(PaperMetadata::hasOaLocation);
            if (metadata.isEmpty()) {
                continue;
            }
            if (download(metadata.get(), targetDir)) {
                count++;
            }
        }
        log.info("Artifacts available: {} of {} result(s)", count, results.size());
        return count;
    }

    private boolean download(PaperMetadata metadata, Path targetDir) {
        String url = metadata.oaLocation();
        Path target;
        try {
            target = targetDir.resolve(safeFilename(metadata.title()) + ".pdf");
        } catch (InvalidPathException e) {
            LoggingUtils.warn(log, e, "Title cannot be used as a filename on this platform: {}", metadata.title());
            return false;
        }
        if (Files.exists(target)) {
            log.debug("Already downloaded: {}", target);
            return true;
        }

        Optional<GatewayResponse> response = gateway.get(url, Map.of());
        if (response.isEmpty()) {
            log.warn("PDF download failed for {}", url);
            return false;
        }
        if (!isAcceptedArtifact(response.get(), url)) {
            log.warn("Not a PDF response for {} (content-type: {})", url, response.get().contentType());
            return false;
        }
        try {
            Files.write(target, response.get().body());
            log.info("Downloaded: {}", target);
            return true;
        } catch (IOException e) {
            LoggingUtils.warn(log, e, "Failed to write {}", target);
            return false;
        }
    }

    static boolean isAcceptedArtifact(GatewayResponse response, String url) {
        if (!response.isSuccessful()) {
            return false;
        }
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        return response.contentTypeContains("pdf")
            || lowerUrl.endsWith(".pdf")
            || lowerUrl.contains("arxiv.org/pdf");
    }

    /**
     * Keeps letters and digits of any script, underscores, whitespace and hyphens, then cuts to
     * {@value #MAX_FILENAME_LENGTH} characters.
     */
    static String safeFilename(String title) {
        String source = title != null ? title : DEFAULT_FILENAME;
        String cleaned = UNSAFE_CHARACTERS.matcher(source).replaceAll("");
        if (cleaned.length() > MAX_FILENAME_LENGTH) {
            cleaned = cleaned.substring(0, MAX_FILENAME_LENGTH);
        }
        cleaned = cleaned.strip();
        return cleaned.isEmpty() ? DEFAULT_FILENAME : cleaned;
    }
}
