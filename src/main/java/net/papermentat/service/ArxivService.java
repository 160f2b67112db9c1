/**
 * Adapter for the arXiv export API (Atom feed).
 *
 * <p>Free-text search only; arXiv has no DOI lookup. Entries are returned as raw Atom
 * elements and normalized by {@link net.papermentat.mapper.ArxivEntryMapper}.</p>
 */
package net.papermentat.service;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.gateway.ScholarlyHttpGateway;
import net.papermentat.util.ExternalApiLogger;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.parser.Parser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class ArxivService {

    private static final String API_NAME = "arXiv";

    private final ScholarlyHttpGateway gateway;
    private final String queryUrl;

    public ArxivService(ScholarlyHttpGateway gateway,
                        @Value("${papermentat.providers.arxiv.url:http://export.arxiv.org/api/query}") String queryUrl) {
        this.gateway = gateway;
        this.queryUrl = queryUrl;
    }

    /**
     * Searches all arXiv fields, most relevant first.
     *
     * @param query      free-text query
     * @param maxResults upper bound on returned entries
     * @return raw Atom {@code <entry>} elements, empty on any failure
     */
    public List<Element> search(String query, int maxResults) {
        if (!StringUtils.hasText(query) || maxResults <= 0) {
            return List.of();
        }
        ExternalApiLogger.logApiCallAttempt(log, API_NAME, "SEARCH", query);

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("search_query", "all:" + query.trim());
        params.put("start", 0);
        params.put("max_results", maxResults);
        params.put("sortBy", "relevance");
        params.put("sortOrder", "descending");

        Optional<List<Element>> entries = gateway.get(queryUrl, params)
            .flatMap(response -> parseEntries(response.bodyAsString()));
        if (entries.isEmpty()) {
            ExternalApiLogger.logApiCallFailure(log, API_NAME, "SEARCH", query, "no usable response");
            return List.of();
        }
        List<Element> limited = entries.get().size() > maxResults
            ? entries.get().subList(0, maxResults)
            : entries.get();
        ExternalApiLogger.logApiCallSuccess(log, API_NAME, "SEARCH", query, limited.size());
        return limited;
    }

    private Optional<List<Element>> parseEntries(String atomXml) {
        try {
            Document feed = Jsoup.parse(atomXml, "", Parser.xmlParser());
            if (feed.getElementsByTag("feed").isEmpty()) {
                log.warn("arXiv response is not an Atom feed");
                return Optional.empty();
            }
            return Optional.of(new ArrayList<>(feed.getElementsByTag("entry")));
        } catch (RuntimeException e) {
            log.warn("Failed to parse arXiv Atom feed: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
