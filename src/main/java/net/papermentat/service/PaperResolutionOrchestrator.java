package net.papermentat.service;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.application.enrichment.MetadataEnrichmentCapability;
import net.papermentat.application.enrichment.PageTriageService;
import net.papermentat.exception.PaperProcessingException;
import net.papermentat.gateway.ScholarlyHttpGateway;
import net.papermentat.mapper.ArxivEntryMapper;
import net.papermentat.mapper.CoreWorkMapper;
import net.papermentat.mapper.CrossrefWorkMapper;
import net.papermentat.mapper.OpenAlexWorkMapper;
import net.papermentat.model.PaperMetadata;
import net.papermentat.model.ProcessingResult;
import net.papermentat.model.ProcessingTracker;
import net.papermentat.support.paperlist.PaperListReader;
import net.papermentat.util.DoiUtils;
import net.papermentat.util.ExternalApiLogger;
import net.papermentat.util.LoggingUtils;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import tools.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Orchestrates multi-provider resolution of scholarly records.
 *
 * <p>Ad-hoc search fans out in a fixed provider order: arXiv, then Crossref, then OpenAlex.
 * That order is the dedup tie-break: the first provider to yield a given dedup key wins and
 * later duplicates are dropped. Crossref and OpenAlex records then go through OA resolution.</p>
 *
 * <p>Entry processing never throws. Every identifier yields a result, failed ones carrying the
 * error text, so a bad entry cannot abort a batch.</p>
 */
@Service
@Slf4j
public class PaperResolutionOrchestrator {

    private static final int FREE_TEXT_PROVIDER_COUNT = 3;
    private static final int MIN_RESULTS_PER_PROVIDER = 5;
    private static final String ARXIV_ABS_PREFIX = "https://arxiv.org/abs/";
    static final String NOT_FOUND_MESSAGE = "DOI not found in Crossref";
    static final String FAILED_TRIAGE_MESSAGE = "Failed triage - not a scholarly resource";

    private final ArxivService arxivService;
    private final ArxivEntryMapper arxivEntryMapper;
    private final CrossrefService crossrefService;
    private final CrossrefWorkMapper crossrefWorkMapper;
    private final OpenAlexService openAlexService;
    private final OpenAlexWorkMapper openAlexWorkMapper;
    private final CoreService coreService;
    private final CoreWorkMapper coreWorkMapper;
    private final OpenAccessResolver openAccessResolver;
    private final ScholarlyHttpGateway gateway;
    private final PaperListReader paperListReader;
    private final PageTriageService pageTriageService;
    private final Optional<MetadataEnrichmentCapability> enrichmentCapability;

    public PaperResolutionOrchestrator(ArxivService arxivService,
                                       ArxivEntryMapper arxivEntryMapper,
                                       CrossrefService crossrefService,
                                       CrossrefWorkMapper crossrefWorkMapper,
                                       OpenAlexService openAlexService,
                                       OpenAlexWorkMapper openAlexWorkMapper,
                                       CoreService coreService,
                                       CoreWorkMapper coreWorkMapper,
                                       OpenAccessResolver openAccessResolver,
                                       ScholarlyHttpGateway gateway,
                                       PaperListReader paperListReader,
                                       PageTriageService pageTriageService,
                                       Optional<MetadataEnrichmentCapability> enrichmentCapability) {
        this.arxivService = arxivService;
        this.arxivEntryMapper = arxivEntryMapper;
        this.crossrefService = crossrefService;
        this.crossrefWorkMapper = crossrefWorkMapper;
        this.openAlexService = openAlexService;
        this.openAlexWorkMapper = openAlexWorkMapper;
        this.coreService = coreService;
        this.coreWorkMapper = coreWorkMapper;
        this.openAccessResolver = openAccessResolver;
        this.gateway = gateway;
        this.paperListReader = paperListReader;
        this.pageTriageService = pageTriageService;
        // A registered but unconfigured provider behaves as no provider
        this.enrichmentCapability = enrichmentCapability.filter(MetadataEnrichmentCapability::isAvailable);
        this.enrichmentCapability.ifPresent(capability ->
            log.info("Metadata enrichment enabled for generic URLs via {}", capability.providerName()));
    }

    /**
     * Searches arXiv, Crossref and OpenAlex for a free-text query.
     *
     * @param query      free-text query
     * @param maxResults upper bound on returned results
     * @return deduplicated results in provider order, at most {@code maxResults}
     */
    public List<ProcessingResult> searchAdHoc(String query, int maxResults) {
        if (!StringUtils.hasText(query) || maxResults <= 0) {
            return List.of();
        }
        int perProvider = Math.max(maxResults / FREE_TEXT_PROVIDER_COUNT, MIN_RESULTS_PER_PROVIDER);
        log.info("Ad-hoc search for '{}' (max {}, {} per provider)", query, maxResults, perProvider);

        List<ProcessingResult> results = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();

        // preprints arrive OA-resolved
        for (Element entry : arxivService.search(query, perProvider)) {
            arxivEntryMapper.toMetadata(entry)
                .filter(metadata -> seenKeys.add(metadata.dedupKey()))
                .ifPresent(metadata -> results.add(
                    resolvedHit(ARXIV_ABS_PREFIX + metadata.arxivId(), () -> metadata)));
        }

        for (JsonNode work : crossrefService.search(query, perProvider)) {
            crossrefWorkMapper.toMetadata(work)
                .filter(metadata -> seenKeys.add(metadata.dedupKey()))
                .ifPresent(metadata -> results.add(
                    resolvedHit(doiIdentifier(metadata), () -> openAccessResolver.enrichOA(metadata))));
        }

        for (JsonNode work : openAlexService.search(query, perProvider)) {
            openAlexWorkMapper.toMetadata(work)
                .filter(metadata -> seenKeys.add(metadata.dedupKey()))
                .ifPresent(metadata -> results.add(
                    resolvedHit(doiIdentifier(metadata), () -> upgradeSecondaryIndexRecord(metadata))));
        }

        List<ProcessingResult> truncated = results.size() > maxResults ? results.subList(0, maxResults) : results;
        log.info("Ad-hoc search for '{}' produced {} result(s)", query, truncated.size());
        return List.copyOf(truncated);
    }

    /**
     * Runs {@link #searchAdHoc(String, int)} per topic and concatenates the results in topic order.
     */
    public List<ProcessingResult> searchByTopics(List<String> topics, int maxResultsPerTopic) {
        List<ProcessingResult> all = new ArrayList<>();
        if (topics == null) {
            return all;
        }
        for (String topic : topics) {
            if (StringUtils.hasText(topic)) {
                log.info("Topic search: {}", topic);
                all.addAll(searchAdHoc(topic.trim(), maxResultsPerTopic));
            }
        }
        return all;
    }

    /**
     * Searches the CORE full-text repository index. Hits with a download link are complete;
     * hits with only a DOI go through OA resolution.
     *
     * @return deduplicated results, empty when CORE has no credential configured
     */
    public List<ProcessingResult> searchFullTextRepository(String query, int maxResults) {
        if (!StringUtils.hasText(query) || maxResults <= 0) {
            return List.of();
        }
        List<ProcessingResult> results = new ArrayList<>();
        Set<String> seenKeys = new HashSet<>();
        for (JsonNode hit : coreService.search(query, maxResults)) {
            coreWorkMapper.toMetadata(hit)
                .filter(metadata -> seenKeys.add(metadata.dedupKey()))
                .ifPresent(metadata -> results.add(resolvedHit(doiIdentifier(metadata),
                    () -> metadata.hasOaLocation() ? metadata : openAccessResolver.enrichOA(metadata))));
            if (results.size() >= maxResults) {
                break;
            }
        }
        return List.copyOf(results);
    }

    /**
     * Reads a paper list and processes each entry in order.
     */
    public List<ProcessingResult> processPaperList(Path path) {
        log.info("Processing paper list: {}", path);
        List<String> entries = paperListReader.read(path);
        List<ProcessingResult> results = new ArrayList<>(entries.size());
        for (String entry : entries) {
            results.add(processEntry(entry));
            ExternalApiLogger.logBatchProgress(log, "PAPER_LIST", results.size(), entries.size());
        }
        return results;
    }

    /**
     * Resolves one DOI or URL. URLs are told apart by their {@code http} prefix.
     *
     * @return the result; failures are reported as a failed result, never thrown
     */
    public ProcessingResult processEntry(String identifier) {
        String entry = identifier != null ? identifier.trim() : "";
        ProcessingTracker tracker = ProcessingTracker.start(entry);
        int retriesBefore = gateway.retryCount();
        try {
            if (entry.isEmpty()) {
                throw new PaperProcessingException("Empty identifier");
            }
            if (entry.startsWith("http")) {
                processUrl(entry, tracker);
            } else {
                processDoi(entry, tracker);
            }
        } catch (PaperProcessingException e) {
            log.warn("Processing {} failed: {}", entry, e.getMessage());
            failIfOpen(tracker, e.getMessage());
        } catch (RuntimeException e) {
            LoggingUtils.error(log, e, "Unexpected error processing {}", entry);
            failIfOpen(tracker, LoggingUtils.describe(e));
        }
        return tracker.finish(Math.max(0, gateway.retryCount() - retriesBefore));
    }

    private void processDoi(String rawDoi, ProcessingTracker tracker) {
        String doi = DoiUtils.normalize(rawDoi);
        if (doi == null) {
            throw new PaperProcessingException("Not a valid DOI: " + rawDoi);
        }
        JsonNode work = crossrefService.lookupByDoi(doi)
            .orElseThrow(() -> new PaperProcessingException(NOT_FOUND_MESSAGE));
        PaperMetadata metadata = crossrefWorkMapper.toMetadata(work)
            .orElseThrow(() -> new PaperProcessingException(
                "Crossref record for " + doi + " is not an article or could not be read"));
        tracker.metadataExtracted(metadata);
        tracker.resolved(openAccessResolver.enrichOA(metadata));
    }

    private void processUrl(String url, ProcessingTracker tracker) {
        Optional<PaperMetadata> preprint = arxivEntryMapper.fromCanonicalUrl(url);
        if (preprint.isPresent()) {
            tracker.resolved(preprint.get());
            return;
        }
        Optional<String> embeddedDoi = DoiUtils.extractFirst(url);
        if (embeddedDoi.isPresent()) {
            processDoi(embeddedDoi.get(), tracker);
            return;
        }
        if (enrichmentCapability.isEmpty()) {
            tracker.metadataExtracted(PaperMetadata.builder().title(url).build());
            return;
        }
        processGenericUrl(url, tracker, enrichmentCapability.get());
    }

    private void processGenericUrl(String url, ProcessingTracker tracker, MetadataEnrichmentCapability capability) {
        PageTriageService.TriagedPage page = pageTriageService.triage(url)
            .orElseThrow(() -> new PaperProcessingException(FAILED_TRIAGE_MESSAGE));
        tracker.triaged();

        Optional<PaperMetadata> enriched = capability.extract(page.text(), page.weak());
        if (enriched.isPresent()) {
            tracker.metadataExtracted(enriched.get());
            tracker.resolved(openAccessResolver.enrichOA(enriched.get()));
            return;
        }
        String placeholderTitle = page.weak().title() != null ? page.weak().title() : url;
        tracker.metadataExtracted(PaperMetadata.builder()
            .title(placeholderTitle)
            .authors(page.weak().authors())
            .doi(page.weak().doi())
            .abstractText(page.weak().abstractText())
            .build());
    }

    /**
     * Secondary-index records carry an inferred location. With the OA-status index configured the
     * color is confirmed there; a record without a location runs the full chain.
     */
    private PaperMetadata upgradeSecondaryIndexRecord(PaperMetadata metadata) {
        if (metadata.doi() == null) {
            return metadata;
        }
        if (!metadata.hasOaLocation()) {
            return openAccessResolver.enrichOA(metadata);
        }
        if (metadata.isOaStatusInferred() && openAccessResolver.isStatusIndexEnabled()) {
            return openAccessResolver.confirmWithStatusIndex(metadata);
        }
        return metadata;
    }

    private ProcessingResult resolvedHit(String identifier, Supplier<PaperMetadata> resolution) {
        ProcessingTracker tracker = ProcessingTracker.start(identifier);
        int retriesBefore = gateway.retryCount();
        try {
            tracker.resolved(resolution.get());
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "OA resolution failed for {}", identifier);
            failIfOpen(tracker, LoggingUtils.describe(e));
        }
        return tracker.finish(Math.max(0, gateway.retryCount() - retriesBefore));
    }

    private static String doiIdentifier(PaperMetadata metadata) {
        return metadata.doi() != null ? DoiUtils.toResolverUrl(metadata.doi()) : "";
    }

    private static void failIfOpen(ProcessingTracker tracker, String message) {
        if (!tracker.state().isTerminal()) {
            tracker.fail(message);
        }
    }
}
