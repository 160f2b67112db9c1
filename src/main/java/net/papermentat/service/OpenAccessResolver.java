package net.papermentat.service;

import com.github.benmanes.caffeine.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import net.papermentat.mapper.OpenAlexWorkMapper;
import net.papermentat.mapper.UnpaywallRecordMapper;
import net.papermentat.model.OpenAccessInfo;
import net.papermentat.model.PaperMetadata;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Resolves the open-access status of a record through the provider fallback chain.
 *
 * <ol>
 *   <li>Unpaywall, when a contact email is configured. Its answer is definitive.</li>
 *   <li>Otherwise, or when Unpaywall has nothing, OpenAlex's own {@code open_access} flag.
 *       An open work becomes green with its OpenAlex location, marked as inferred.</li>
 * </ol>
 *
 * <p>Verdicts are cached per DOI for the lifetime of the cache entry.</p>
 */
@Service
@Slf4j
public class OpenAccessResolver {

    private static final String CHAIN_KEY_PREFIX = "chain:";
    private static final String PRIMARY_KEY_PREFIX = "primary:";

    private final UnpaywallService unpaywallService;
    private final UnpaywallRecordMapper unpaywallRecordMapper;
    private final OpenAlexService openAlexService;
    private final OpenAlexWorkMapper openAlexWorkMapper;
    private final Cache<String, Optional<OpenAccessInfo>> openAccessCache;

    public OpenAccessResolver(UnpaywallService unpaywallService,
                              UnpaywallRecordMapper unpaywallRecordMapper,
                              OpenAlexService openAlexService,
                              OpenAlexWorkMapper openAlexWorkMapper,
                              Cache<String, Optional<OpenAccessInfo>> openAccessCache) {
        this.unpaywallService = unpaywallService;
        this.unpaywallRecordMapper = unpaywallRecordMapper;
        this.openAlexService = openAlexService;
        this.openAlexWorkMapper = openAlexWorkMapper;
        this.openAccessCache = openAccessCache;
    }

    /**
     * Runs the full fallback chain.
     *
     * @param record record to resolve
     * @return a copy carrying the resolved OA fields, or {@code record} itself when it has no DOI
     *         or no provider produced a verdict
     */
    public PaperMetadata enrichOA(PaperMetadata record) {
        if (record == null || record.doi() == null) {
            return record;
        }
        Optional<OpenAccessInfo> verdict = openAccessCache.get(CHAIN_KEY_PREFIX + record.doi(),
            key -> resolveChain(record.doi()));
        return verdict.map(record::withOpenAccess).orElse(record);
    }

    /**
     * Confirms a record against the OA-status index only, without the citation-index fallback.
     * Used to replace an inferred color with an authoritative one.
     *
     * @return the confirmed copy, or {@code record} unchanged when the index is disabled or silent
     */
    public PaperMetadata confirmWithStatusIndex(PaperMetadata record) {
        if (record == null || record.doi() == null || !unpaywallService.isEnabled()) {
            return record;
        }
        Optional<OpenAccessInfo> verdict = openAccessCache.get(PRIMARY_KEY_PREFIX + record.doi(),
            key -> resolveFromStatusIndex(record.doi()));
        return verdict.map(record::withOpenAccess).orElse(record);
    }

    public boolean isStatusIndexEnabled() {
        return unpaywallService.isEnabled();
    }

    private Optional<OpenAccessInfo> resolveChain(String doi) {
        if (unpaywallService.isEnabled()) {
            Optional<OpenAccessInfo> primary = resolveFromStatusIndex(doi);
            if (primary.isPresent()) {
                return primary;
            }
            log.debug("Unpaywall had no verdict for {}, falling back to OpenAlex", doi);
        }
        Optional<OpenAccessInfo> fallback = openAlexService.lookupByDoi(doi)
            .flatMap(openAlexWorkMapper::toOpenAccess);
        fallback.ifPresent(info -> log.info("OA status for {} inferred as {} from the citation index flag",
            doi, info.status().value()));
        return fallback;
    }

    private Optional<OpenAccessInfo> resolveFromStatusIndex(String doi) {
        return unpaywallService.lookupByDoi(doi).flatMap(unpaywallRecordMapper::toOpenAccess);
    }
}
