/**
 * Adapter for the CORE v3 search API, a full-text repository index.
 *
 * <p>CORE requires an API key. Without one the adapter is disabled and returns no results.</p>
 */
package net.papermentat.service;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.config.PaperMentatProperties;
import net.papermentat.gateway.ScholarlyHttpGateway;
import net.papermentat.util.ExternalApiLogger;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
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
public class CoreService {

    private static final String API_NAME = "CORE";
    private static final int MAX_LIMIT = 100;
    private static final int PROXIMITY_WINDOW = 10;

    private final ScholarlyHttpGateway gateway;
    private final String searchUrl;
    private final String apiKey;

    public CoreService(ScholarlyHttpGateway gateway,
                       PaperMentatProperties properties,
                       @Value("${papermentat.providers.core.url:https://api.core.ac.uk/v3/search/works}") String searchUrl) {
        this.gateway = gateway;
        this.searchUrl = searchUrl;
        this.apiKey = properties.getCoreApiKey();
    }

    public boolean isEnabled() {
        return StringUtils.hasText(apiKey);
    }

    /**
     * Searches CORE works. Multi-word queries are sent as a proximity phrase.
     *
     * @return raw {@code results[]} hits, empty when disabled or on failure
     */
    public List<JsonNode> search(String query, int maxResults) {
        if (!isEnabled()) {
            ExternalApiLogger.logProviderDisabled(log, API_NAME, "papermentat.core-api-key is not set");
            return List.of();
        }
        if (!StringUtils.hasText(query) || maxResults <= 0) {
            return List.of();
        }
        String effectiveQuery = toProximityQuery(query.trim());
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "SEARCH", effectiveQuery);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("q", effectiveQuery);
        params.put("limit", Math.min(maxResults, MAX_LIMIT));
        params.put("sort", "relevance");

        Optional<JsonNode> body = gateway.getJson(searchUrl, params,
            Map.of(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey));
        JsonNode hits = body.map(json -> json.path("results")).orElse(null);
        if (hits == null || !hits.isArray()) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "SEARCH", effectiveQuery,
                body.isPresent() ? "response has no results array" : "no usable response");
            return List.of();
        }
        List<JsonNode> results = new ArrayList<>();
        for (JsonNode hit : hits) {
            results.add(hit);
        }
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "SEARCH", effectiveQuery, results.size());
        return results;
    }

    /**
     * Wraps a multi-word query as {@code "terms"~10} so the words must occur near each other.
     * Queries that are already quoted or use field syntax ({@code title:...}) pass through.
     */
    public static String toProximityQuery(String query) {
        if (query.contains(" ") && !query.startsWith("\"") && !query.contains(":")) {
            return "\"" + query + "\"~" + PROXIMITY_WINDOW;
        }
        return query;
    }
}
