/**
 * Adapter for the Crossref REST API, the primary citation-graph index.
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
public class CrossrefService {

    private static final String API_NAME = "Crossref";
    private static final int MAX_ROWS = 1000;

    private final ScholarlyHttpGateway gateway;
    private final String worksUrl;
    private final String contactEmail;

    public CrossrefService(ScholarlyHttpGateway gateway,
                           PaperMentatProperties properties,
                           @Value("${papermentat.providers.crossref.url:https://api.crossref.org/works}") String worksUrl) {
        this.gateway = gateway;
        this.worksUrl = worksUrl;
        this.contactEmail = properties.getContactEmail();
    }

    /**
     * Relevance-sorted work search.
     *
     * @return raw {@code message.items[]} entries, empty on failure
     */
    public List<JsonNode> search(String query, int maxResults) {
        if (!StringUtils.hasText(query) || maxResults <= 0) {
            return List.of();
        }
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "SEARCH", query);

        Map<String, Object> params = politeParams();
        params.put("query", query.trim());
        params.put("rows", Math.min(maxResults, MAX_ROWS));
        params.put("sort", "relevance");

        Optional<JsonNode> body = gateway.getJson(worksUrl, params);
        JsonNode items = body.map(json -> json.path("message").path("items")).orElse(null);
        if (items == null || !items.isArray()) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "SEARCH", query,
                body.isPresent() ? "response has no message.items array" : "no usable response");
            return List.of();
        }
        List<JsonNode> results = new ArrayList<>();
        for (JsonNode item : items) {
            results.add(item);
        }
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "SEARCH", query, results.size());
        return results;
    }

    /**
     * Looks up one work by DOI.
     *
     * @param doi normalized DOI
     * @return the {@code message} object, or empty when unknown or on failure
     */
    public Optional<JsonNode> lookupByDoi(String doi) {
        if (!StringUtils.hasText(doi)) {
            return Optional.empty();
        }
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "LOOKUP_DOI", doi);
        Optional<JsonNode> message = gateway.getJson(worksUrl + "/" + doi, politeParams())
            .map(json -> json.path("message"))
            .filter(JsonNode::isObject);
        if (message.isPresent()) {
            ExternalApiLogger.logApiCallSuccess(log, API_NAME, "LOOKUP_DOI", doi, 1);
        } else {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "LOOKUP_DOI", doi, "not found");
        }
        return message;
    }

    private Map<String, Object> politeParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        if (StringUtils.hasText(contactEmail)) {
            params.put("mailto", contactEmail);
        }
        return params;
    }
}
