package net.papermentat.application.enrichment;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.gateway.GatewayResponse;
import net.papermentat.gateway.ScholarlyHttpGateway;
import net.papermentat.model.WeakMetadata;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Fetches a generic URL and decides whether it looks like a scholarly resource.
 *
 * <p>Only HTML and PDF responses pass triage. HTML pages also yield weak fields and body
 * text for the enrichment capability; a PDF passes with empty text.</p>
 */
@Service
@Slf4j
public class PageTriageService {

    private final ScholarlyHttpGateway gateway;

    public PageTriageService(ScholarlyHttpGateway gateway) {
        this.gateway = gateway;
    }

    /**
     * @return the triaged page, or empty when it cannot be fetched or is neither HTML nor PDF
     */
    public Optional<TriagedPage> triage(String url) {
        Optional<GatewayResponse> response = gateway.get(url, Map.of());
        if (response.isEmpty()) {
            log.info("Triage failed for {}: page could not be fetched", url);
            return Optional.empty();
        }
        GatewayResponse page = response.get();
        if (page.contentTypeContains("pdf")) {
            return Optional.of(new TriagedPage("", WeakMetadata.empty()));
        }
        if (!page.contentTypeContains("html")) {
            log.info("Triage failed for {}: unsupported content type {}", url, page.contentType());
            return Optional.empty();
        }
        PageMetadataScraper.ScrapedPage scraped = PageMetadataScraper.scrape(page.bodyAsString(), url);
        return Optional.of(new TriagedPage(scraped.text(), scraped.weak()));
    }

    /**
     * Text and weak fields of a page that passed triage.
     */
    public record TriagedPage(String text, WeakMetadata weak) {
    }
}
