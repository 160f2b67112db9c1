package net.papermentat.support.report;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.config.PaperMentatProperties;
import net.papermentat.model.PaperMetadata;
import net.papermentat.model.ProcessingResult;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Writes results as a pretty-printed JSON array, one object per result.
 * OA status is written as its lowercase name and inferred colors are flagged.
 */
@Slf4j
@Component
public class ResultJsonExporter {

    private static final DateTimeFormatter FILE_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final ObjectMapper objectMapper;
    private final Path outputDir;
    private final Clock clock;

    @Autowired
    public ResultJsonExporter(ObjectMapper objectMapper, PaperMentatProperties properties) {
        this(objectMapper, properties.getOutputDir(), Clock.systemDefaultZone());
    }

    ResultJsonExporter(ObjectMapper objectMapper, Path outputDir, Clock clock) {
        this.objectMapper = objectMapper;
        this.outputDir = outputDir;
        this.clock = clock;
    }

    /**
     * @param filename target file name inside the output directory, or {@code null} for a timestamped default
     * @return path of the written file
     * @throws UncheckedIOException when the file cannot be written
     */
    public Path write(List<ProcessingResult> results, String filename) {
        String name = StringUtils.hasText(filename)
            ? filename
            : "results_" + LocalDateTime.now(clock).format(FILE_TIMESTAMP) + ".json";
        Path target = outputDir.resolve(name);
        try {
            Files.createDirectories(outputDir);
            Files.writeString(target, render(results), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write results to " + target, e);
        }
        log.info("Results saved to {}", target);
        return target;
    }

    String render(List<ProcessingResult> results) {
        ArrayNode array = objectMapper.createArrayNode();
        for (ProcessingResult result : results) {
            array.add(toNode(result));
        }
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(array);
    }

    ObjectNode toNode(ProcessingResult result) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("identifier", result.identifier());
        node.put("state", result.state().value());
        node.put("processing_time", result.elapsed().toNanos() / 1_000_000_000.0);
        node.put("retry_count", result.retryCount());
        if (result.errorMessage() != null) {
            node.put("error_message", result.errorMessage());
        } else {
            node.putNull("error_message");
        }
        if (result.metadata() != null) {
            node.set("metadata", metadataNode(result.metadata()));
        }
        return node;
    }

    private ObjectNode metadataNode(PaperMetadata metadata) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("title", metadata.title());
        ArrayNode authors = node.putArray("authors");
        metadata.authors().forEach(authors::add);
        node.put("doi", metadata.doi());
        node.put("arxiv_id", metadata.arxivId());
        node.put("publication_year", metadata.publicationYear());
        node.put("journal", metadata.journal());
        node.put("abstract", metadata.abstractText());
        ArrayNode keywords = node.putArray("keywords");
        metadata.keywords().forEach(keywords::add);
        node.put("oa_status", metadata.oaStatus() != null ? metadata.oaStatus().value() : null);
        node.put("oa_url", metadata.oaLocation());
        node.put("license", metadata.license());
        node.put("oa_status_inferred", metadata.isOaStatusInferred());
        return node;
    }
}
