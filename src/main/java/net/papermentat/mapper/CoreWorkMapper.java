package net.papermentat.mapper;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.model.OaEvidence;
import net.papermentat.model.OaStatus;
import net.papermentat.model.PaperMetadata;
import net.papermentat.util.TextUtils;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Maps a CORE v3 search hit into {@link PaperMetadata}.
 *
 * <p>A hit with a download URL (or a source full-text URL) is recorded as green with
 * {@link OaEvidence#REPOSITORY_FULL_TEXT}; CORE reports no color of its own.</p>
 */
@Slf4j
@Component
public class CoreWorkMapper implements ScholarlyRecordMapper<JsonNode> {

    private static final String SOURCE_NAME = "CORE";
    private static final String UNKNOWN_TITLE = "Unknown";

    @Override
    public Optional<PaperMetadata> toMetadata(JsonNode hit) {
        if (hit == null || !hit.isObject()) {
            log.warn("CORE hit payload is not an object, skipping");
            return Optional.empty();
        }
        try {
            String title = ScholarlyJsonSupport.getTextValue(hit, "title");
            String downloadUrl = TextUtils.coalesce(
                ScholarlyJsonSupport.getTextValue(hit, "downloadUrl"),
                ScholarlyJsonSupport.getFirstTextValue(hit, "sourceFulltextUrls"));

            PaperMetadata.PaperMetadataBuilder builder = PaperMetadata.builder()
                .title(title != null ? title : UNKNOWN_TITLE)
                .authors(extractAuthors(hit))
                .doi(ScholarlyJsonSupport.getTextValue(hit, "doi"))
                .publicationYear(ScholarlyJsonSupport.getYearValue(hit, "yearPublished"))
                .journal(ScholarlyJsonSupport.getTextValue(hit, "publisher"))
                .abstractText(TextUtils.stripMarkup(ScholarlyJsonSupport.getTextValue(hit, "abstract")));
            if (downloadUrl != null) {
                builder.oaStatus(OaStatus.GREEN)
                    .oaLocation(downloadUrl)
                    .oaEvidence(OaEvidence.REPOSITORY_FULL_TEXT);
            }
            return Optional.of(builder.build());
        } catch (RuntimeException e) {
            log.warn("Malformed CORE hit {}: {}", ScholarlyJsonSupport.getTextValue(hit, "id"), e.getMessage());
            return Optional.empty();
        }
    }

    @Override
    public String getSourceName() {
        return SOURCE_NAME;
    }

    private List<String> extractAuthors(JsonNode hit) {
        List<String> authors = new ArrayList<>();
        JsonNode authorArray = hit.get("authors");
        if (authorArray == null || !authorArray.isArray()) {
            return authors;
        }
        for (JsonNode author : authorArray) {
            String name = author.isObject() ? ScholarlyJsonSupport.getTextValue(author, "name") : null;
            if (name != null) {
                authors.add(name);
            }
        }
        return authors;
    }
}
