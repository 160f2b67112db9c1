/**
 * Adapter for the OpenAlex works API, the secondary citation-graph index.
 *
 * <p>Besides search, OpenAlex serves as the OA fallback: its works carry an
 * {@code open_access} block derived from Unpaywall data.</p>
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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class OpenAlexService {

    private static final String API_NAME = "OpenAlex";
    private static final int MAX_PER_PAGE = 200;

    private final ScholarlyHttpGateway gateway;
    private final String worksUrl;
    private final String contactEmail;

    public OpenAlexService(ScholarlyHttpGateway gateway,
                           PaperMentatProperties properties,
                           @Value("${papermentat.providers.openalex.url:https://api.openalex.org/works}") String worksUrl) {
        this.gateway = gateway;
        this.worksUrl = worksUrl;
        this.contactEmail = properties.getContactEmail();
    }

    /**
     * Full-text search over OpenAlex works.
     *
     * @return raw {@code results[]} works, empty on failure
     */
    public List<JsonNode> search(String query, int maxResults) {
        if (!StringUtils.hasText(query) || maxResults <= 0) {
            return List.of();
        }
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "SEARCH", query);

        Map<String, Object> params = politeParams();
        params.put("search", query.trim());
        params.put("per_page", Math.min(maxResults, MAX_PER_PAGE));

        Optional<JsonNode> body = gateway.getJson(worksUrl, params);
        JsonNode works = body.map(json -> json.path("results")).orElse(null);
        if (works == null || !works.isArray()) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "SEARCH", query,
                body.isPresent() ? "response has no results array" : "no usable response");
            return List.of();
        }
        List<JsonNode> results = new ArrayList<>();
        for (JsonNode work : works) {
            results.add(work);
        }
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "SEARCH", query, results.size());
        return results;
    }

    /**
     * Looks up one work by DOI through the {@code works/doi:} external-id route.
     */
    public Optional<JsonNode> lookupByDoi(String doi) {
        if (!StringUtils.hasText(doi)) {
            return Optional.empty();
        }
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "LOOKUP_DOI", doi);
        Optional<JsonNode> work = gateway.getJson(worksUrl + "/doi:" + doi, politeParams())
            .filter(JsonNode::isObject);
        if (work.isPresent()) {
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, "LOOKUP_DOI", doi, 1);
        } else {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "LOOKUP_DOI", doi, "not found");
        }
        return work;
    }

    private Map<String, Object> politeParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        if (StringUtils.hasText(contactEmail)) {
            params.put("mailto", contactEmail);
        }
        return params;
    }
}
