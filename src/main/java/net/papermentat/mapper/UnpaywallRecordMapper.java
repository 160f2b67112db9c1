package net.papermentat.mapper;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.model.OaEvidence;
import net.papermentat.model.OaStatus;
import net.papermentat.model.OpenAccessInfo;
import net.papermentat.util.TextUtils;
import org.springframework.stereotype.Component;
import tools.jackson.databind.JsonNode;

import java.util.Optional;

/**
 * Reads the OA verdict from an Unpaywall DOI record.
 *
 * <p>Closed works carry no location. For open works the best location's PDF URL wins over
 * its landing page URL. Colors outside the known set map to {@link OaStatus#UNKNOWN}.</p>
 */
@Slf4j
@Component
public class UnpaywallRecordMapper {

    public Optional<OpenAccessInfo> toOpenAccess(JsonNode record) {
        if (record == null || !record.isObject()) {
            log.warn("Unpaywall payload is not an object, ignoring");
            return Optional.empty();
        }
        if (!ScholarlyJsonSupport.isTrue(record, "is_oa")) {
            return Optional.of(OpenAccessInfo.closed(OaEvidence.OA_STATUS_INDEX));
        }

        OaStatus status = OaStatus.fromProviderValue(ScholarlyJsonSupport.getTextValue(record, "oa_status"));
        if (status == OaStatus.CLOSED) {
            // is_oa=true contradicts a closed color; trust the flag
            status = OaStatus.UNKNOWN;
        }
        JsonNode best = ScholarlyJsonSupport.getObject(record, "best_oa_location");
        String location = TextUtils.coalesce(
            ScholarlyJsonSupport.getTextValue(best, "url_for_pdf"),
            ScholarlyJsonSupport.getTextValue(best, "url"));
        String license = ScholarlyJsonSupport.getTextValue(best, "license");
        return Optional.of(new OpenAccessInfo(status, location, license, OaEvidence.OA_STATUS_INDEX));
    }
}
