package net.papermentat.mapper;

import net.papermentat.model.PaperMetadata;

import java.util.Optional;

/**
 * Contract for normalizing one provider item into {@link PaperMetadata}.
 * <p>
 * Each scholarly provider has its own implementation that knows that provider's payload shape.
 * Implementations must:
 * - tolerate missing/null fields
 * - return empty for items that are not articles (figures, tables, supplements)
 * - return empty and log a warning for malformed payloads rather than throw
 * - be pure: mapping the same raw item twice yields equal records
 *
 * @param <T> raw item type (JSON tree or XML element)
 */
public interface ScholarlyRecordMapper<T> {

    Optional<PaperMetadata> toMetadata(T rawItem);

    /**
     * Provider name used in log lines.
     */
    String getSourceName();
}
