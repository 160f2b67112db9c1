/**
 * Adapter for the Unpaywall API, the dedicated OA-status index.
 *
 * <p>Unpaywall requires a contact email on every request. Without one the adapter is
 * disabled and never issues a request.</p>
 */
package net.papermentat.service;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.config.PaperMentatProperties;
import net.papermentat.gateway.ScholarlyHttpGateway;
import net.papermentat.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class UnpaywallService {

    private static final String API_NAME = "Unpaywall";

    private final ScholarlyHttpGateway gateway;
    private final String baseUrl;
    private final String contactEmail;

    public UnpaywallService(ScholarlyHttpGateway gateway,
                            PaperMentatProperties properties,
                            @Value("${papermentat.providers.unpaywall.url:https://api.unpaywall.org/v2}") String baseUrl) {
        this.gateway = gateway;
        this.baseUrl = baseUrl;
        this.contactEmail = properties.getContactEmail();
    }

    public boolean isEnabled() {
        return StringUtils.hasText(contactEmail);
    }

    /**
     * Fetches the OA record for a DOI.
     *
     * @return raw Unpaywall record, empty when disabled, unknown or on failure
     */
    public Optional<JsonNode> lookupByDoi(String doi) {
        if (!isEnabled()) {
            ExternalApiLogger.logProviderDisabled(log, API_NAME, "papermentat.contact-email is not set");
            return Optional.empty();
        }
        if (!StringUtils.hasText(doi)) {
            return Optional.empty();
        }
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "LOOKUP_DOI", doi);
        Optional<JsonNode> record = gateway.getJson(baseUrl + "/" + doi, Map.of("email", contactEmail))
            .filter(JsonNode::isObject);
        if (record.isPresent()) {
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, "LOOKUP_DOI", doi, 1);
        } else {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "LOOKUP_DOI", doi, "no usable response");
        }
        return record;
    }
}
