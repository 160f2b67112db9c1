package net.papermentat.mapper;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.model.OaEvidence;
import net.papermentat.model.OaStatus;
import net.papermentat.model.OpenAccessInfo;
import net.papermentat.model.PaperMetadata;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps an OpenAlex {@code work} into {@link PaperMetadata}.
 *
 * <p>OpenAlex exposes only a binary {@code is_oa} flag plus a location, so open works are
 * recorded as green with {@link OaEvidence#CITATION_INDEX_FLAG}, marking the color as inferred.</p>
 */
@Slf4j
@Component
public class OpenAlexWorkMapper implements ScholarlyRecordMapper<JsonNode> {

    private static final String SOURCE_NAME = "OpenAlex";
    private static final String UNKNOWN_TITLE = "Unknown";

    @Override
    public Optional<PaperMetadata> toMetadata(JsonNode work) {
        if (work == null || !work.isObject()) {
            log.warn("OpenAlex work payload is not an object, skipping");
            return Optional.empty();
        }
        try {
            String title = ScholarlyJsonSupport.getTextValue(work, "title");
            if (title == null) {
                title = ScholarlyJsonSupport.getTextValue(work, "display_name");
            }
            PaperMetadata.PaperMetadataBuilder builder = PaperMetadata.builder()
                .title(title != null ? title : UNKNOWN_TITLE)
                .authors(extractAuthors(work))
                .doi(ScholarlyJsonSupport.getTextValue(work, "doi"))
                .publicationYear(ScholarlyJsonSupport.getYearValue(work, "publication_year"))
                .journal(ScholarlyJsonSupport.getTextValue(work.path("primary_location").path("source"), "display_name"));

            toOpenAccess(work).ifPresent(info -> builder
                .oaStatus(info.status())
                .oaLocation(info.location())
                .oaEvidence(info.evidence()));
            return Optional.of(builder.build());
        } catch (RuntimeException e) {
            log.warn("Malformed OpenAlex work {}: {}", ScholarlyJsonSupport.getTextValue(work, "id"), e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads the work's own {@code open_access} block.
     *
     * @return green verdict when the work is flagged open, empty otherwise
     */
    public Optional<OpenAccessInfo> toOpenAccess(JsonNode work) {
        JsonNode openAccess = ScholarlyJsonSupport.getObject(work, "open_access");
        if (openAccess == null || !ScholarlyJsonSupport.isTrue(openAccess, "is_oa")) {
            return Optional.empty();
        }
        String location = ScholarlyJsonSupport.getTextValue(openAccess, "oa_url");
        return Optional.of(new OpenAccessInfo(OaStatus.GREEN, location, null, OaEvidence.CITATION_INDEX_FLAG));
    }

    @Override
    public String getSourceName() {
        return SOURCE_NAME;
    }

    private List<String> extractAuthors(JsonNode work) {
        List<String> authors = new ArrayList<>();
        JsonNode authorships = work.get("authorships");
        if (authorships == null || !authorships.isArray()) {
            return authors;
        }
        for (JsonNode authorship : authorships) {
            String name = ScholarlyJsonSupport.getTextValue(authorship.path("author"), "display_name");
            if (name != null) {
                authors.add(name);
            }
        }
        return authors;
    }
}
