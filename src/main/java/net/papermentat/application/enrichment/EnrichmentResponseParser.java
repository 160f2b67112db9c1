package net.papermentat.application.enrichment;

import net.papermentat.model.PaperMetadata;
import net.papermentat.model.WeakMetadata;
import net.papermentat.util.TextUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.JsonNode;
import tools.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Parses raw LLM output into a {@link PaperMetadata}.
 *
 * <p>Handles markdown fences and a brace-extraction fallback. Title, authors and DOI
 * fall back to the weak fields when the model leaves them out.</p>
 */
class EnrichmentResponseParser {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentResponseParser.class);

    private final ObjectMapper objectMapper;

    EnrichmentResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * @throws MetadataEnrichmentException when the response is empty, not JSON, or yields no title
     */
    PaperMetadata parse(String responseText, WeakMetadata weak) {
        if (!StringUtils.hasText(responseText)) {
            throw new MetadataEnrichmentException(MetadataEnrichmentException.ErrorCode.INVALID_RESPONSE,
                "Enrichment response was empty");
        }
        WeakMetadata fallback = weak != null ? weak : WeakMetadata.empty();
        JsonNode payload = parseJsonPayload(responseText);
        if (!payload.isObject()) {
            throw new MetadataEnrichmentException(MetadataEnrichmentException.ErrorCode.INVALID_RESPONSE,
                "Enrichment response was not a JSON object");
        }

        String title = TextUtils.coalesce(optionalText(payload, "title").orElse(null), fallback.title());
        if (title == null) {
            throw new MetadataEnrichmentException(MetadataEnrichmentException.ErrorCode.INVALID_RESPONSE,
                "Enrichment response had no title and no fallback title was available");
        }
        List<String> authors = stringList(payload, "authors");
        Set<String> keywords = new LinkedHashSet<>(stringList(payload, "keywords"));

        return PaperMetadata.builder()
            .title(title)
            .authors(authors.isEmpty() ? fallback.authors() : authors)
            .doi(TextUtils.coalesce(optionalText(payload, "doi").orElse(null), fallback.doi()))
            .arxivId(optionalText(payload, "arxiv_id").orElse(null))
            .publicationYear(year(payload))
            .journal(optionalText(payload, "journal").orElse(null))
            .abstractText(TextUtils.coalesce(optionalText(payload, "abstract").orElse(null), fallback.abstractText()))
            .keywords(keywords)
            .build();
    }

    private JsonNode parseJsonPayload(String responseText) {
        String cleaned = stripFences(responseText);
        try {
            return objectMapper.readTree(cleaned);
        } catch (JacksonException initialParseException) {
            int openBrace = cleaned.indexOf('{');
            int closeBrace = cleaned.lastIndexOf('}');
            if (openBrace < 0 || closeBrace <= openBrace) {
                throw new MetadataEnrichmentException(MetadataEnrichmentException.ErrorCode.INVALID_RESPONSE,
                    "Enrichment response did not include a JSON object");
            }
            log.debug("Enrichment response required brace extraction (initial parse failed: {})",
                initialParseException.getOriginalMessage());
            try {
                return objectMapper.readTree(cleaned.substring(openBrace, closeBrace + 1));
            } catch (JacksonException exception) {
                throw new MetadataEnrichmentException(MetadataEnrichmentException.ErrorCode.INVALID_RESPONSE,
                    "Enrichment response JSON parsing failed", exception);
            }
        }
    }

    static String stripFences(String text) {
        String trimmed = text.trim();
        int fence = trimmed.indexOf("```");
        if (fence < 0) {
            return trimmed;
        }
        int bodyStart = trimmed.indexOf('\n', fence);
        if (bodyStart < 0) {
            return trimmed.replace("```", "").trim();
        }
        int closing = trimmed.indexOf("```", bodyStart);
        String body = closing < 0 ? trimmed.substring(bodyStart) : trimmed.substring(bodyStart, closing);
        return body.trim();
    }

    private Optional<String> optionalText(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || node.isNull() || !(node.isString() || node.isNumber())) {
            return Optional.empty();
        }
        return Optional.ofNullable(TextUtils.emptyToNull(node.asString()));
    }

    private List<String> stringList(JsonNode payload, String field) {
        JsonNode node = payload.get(field);
        if (node == null || !node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isString() && StringUtils.hasText(element.asString())) {
                values.add(element.asString().trim());
            }
        }
        return values;
    }

    private Integer year(JsonNode payload) {
        JsonNode node = payload.get("publication_year");
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asInt();
        }
        return node.isString() ? TextUtils.leadingYear(node.asString().trim()) : null;
    }
}
