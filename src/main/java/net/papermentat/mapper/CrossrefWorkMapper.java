package net.papermentat.mapper;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.model.PaperMetadata;
import net.papermentat.util.DoiUtils;
import net.papermentat.util.TextUtils;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Maps a Crossref {@code work} message into {@link PaperMetadata}.
 *
 * <p>Figure, table and supplement DOIs are registered by some publishers as standalone works;
 * those map to empty so they never enter a result set.</p>
 */
@Slf4j
@Component
public class CrossrefWorkMapper implements ScholarlyRecordMapper<JsonNode> {

    private static final String SOURCE_NAME = "Crossref";
    private static final String UNKNOWN_TITLE = "Unknown";
    // print date is authoritative, then online-first, then registration
    private static final List<String> YEAR_FIELDS = List.of("published-print", "published-online", "created");

    @Override
    public Optional<PaperMetadata> toMetadata(JsonNode work) {
        if (work == null || !work.isObject()) {
            log.warn("Crossref work payload is not an object, skipping");
            return Optional.empty();
        }

        String rawDoi = ScholarlyJsonSupport.getTextValue(work, "DOI");
        if (DoiUtils.isComponentDoi(rawDoi)) {
            log.debug("Skipping Crossref component DOI {}", rawDoi);
            return Optional.empty();
        }

        try {
            String title = TextUtils.stripMarkup(ScholarlyJsonSupport.getFirstTextValue(work, "title"));
            return Optional.of(PaperMetadata.builder()
                .title(title != null ? title : UNKNOWN_TITLE)
                .authors(extractAuthors(work))
                .doi(rawDoi)
                .publicationYear(extractYear(work))
                .journal(ScholarlyJsonSupport.getFirstTextValue(work, "container-title"))
                .abstractText(TextUtils.stripMarkup(ScholarlyJsonSupport.getTextValue(work, "abstract")))
                .keywords(new LinkedHashSet<>(ScholarlyJsonSupport.getTextValues(work, "subject")))
                .build());
        } catch (RuntimeException e) {
            log.warn("Malformed Crossref work {}: {}", rawDoi, e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String getSourceName() {
        return SOURCE_NAME;
    }

    private List<String> extractAuthors(JsonNode work) {
        List<String> authors = new ArrayList<>();
        JsonNode authorArray = work.get("author");
        if (authorArray == null || !authorArray.isArray()) {
            return authors;
        }
        for (JsonNode author : authorArray) {
            String given = ScholarlyJsonSupport.getTextValue(author, "given");
            String family = ScholarlyJsonSupport.getTextValue(author, "family");
            String name = TextUtils.emptyToNull(String.join(" ",
                given != null ? given : "", family != null ? family : ""));
            if (name == null) {
                // consortium authors carry only a name
                name = ScholarlyJsonSupport.getTextValue(author, "name");
            }
            if (name != null) {
                authors.add(name);
            }
        }
        return authors;
    }

    private Integer extractYear(JsonNode work) {
        for (String field : YEAR_FIELDS) {
            JsonNode dateParts = work.path(field).path("date-parts");
            JsonNode first = dateParts.path(0).path(0);
            if (first.isIntegralNumber()) {
                return first.asInt();
            }
        }
        return null;
    }
}
