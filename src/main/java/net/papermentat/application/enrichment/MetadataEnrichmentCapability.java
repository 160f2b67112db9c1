package net.papermentat.application.enrichment;

import net.papermentat.model.PaperMetadata;
import net.papermentat.model.WeakMetadata;

import java.util.Optional;

/**
 * Optional capability that turns unstructured page text plus weakly populated fields into a
 * better record.
 *
 * <p>At most one implementation is registered, selected by {@code papermentat.enrichment.provider}.
 * Having none is a valid runtime state. Implementations never throw: provider outages and
 * malformed replies yield {@link Optional#empty()}.</p>
 */
public interface MetadataEnrichmentCapability {

    /**
     * @param text raw page or document text
     * @param weak fields already scraped from the page, any of them may be absent
     * @return an improved record, or empty when the provider could not produce one
     */
    Optional<PaperMetadata> extract(String text, WeakMetadata weak);

    /**
     * @return {@code false} when the provider is registered but lacks the settings it needs to run
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Provider name used in log lines.
     */
    String providerName();
}
