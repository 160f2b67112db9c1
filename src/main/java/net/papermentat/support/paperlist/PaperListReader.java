package net.papermentat.support.paperlist;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.util.LoggingUtils;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a paper-list file and returns its DOI and URL entries.
 *
 * <p>{@code .json}, {@code .yaml} and {@code .yml} files are parsed as documents and only their
 * string values are scanned; any other file is scanned as free text. A structured file that
 * fails to parse is scanned as free text instead.</p>
 */
@Slf4j
@Component
public class PaperListReader {

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public PaperListReader(ObjectMapper objectMapper) {
        this.jsonMapper = objectMapper;
        this.yamlMapper = new YAMLMapper();
    }

    /**
     * @return entries in first-seen order, empty when the file is missing or unreadable
     */
    public List<String> read(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            log.error("Paper list not found: {}", path);
            return List.of();
        }
        String content;
        try {
            content = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            LoggingUtils.error(log, e, "Failed to read paper list {}", path);
            return List.of();
        }

        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        List<String> entries;
        if (fileName.endsWith(".json")) {
            entries = parseDocument(content, jsonMapper, path);
        } else if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
            entries = parseDocument(content, yamlMapper, path);
        } else {
            entries = PaperListParser.extractEntries(content);
        }
        log.info("Paper list {} yielded {} entries", path, entries.size());
        return entries;
    }

    private List<String> parseDocument(String content, ObjectMapper mapper, Path path) {
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (JacksonException e) {
            log.warn("Paper list {} is not a valid document ({}), scanning it as free text", path, e.getOriginalMessage());
            return PaperListParser.extractEntries(content);
        }
        Set<String> entries = new LinkedHashSet<>();
        for (String leaf : IdentifierLeafCollector.collect(root)) {
            entries.addAll(PaperListParser.extractEntries(leaf));
        }
        return List.copyOf(entries);
    }
}
