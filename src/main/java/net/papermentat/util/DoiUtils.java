package net.papermentat.util;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for recognising, normalising and rendering DOIs.
 *
 * <p>A normalised DOI is lowercase, carries no resolver prefix and no trailing
 * sentence punctuation, e.g. {@code 10.1016/j.oregeorev.2018.12.018}.</p>
 */
public final class DoiUtils {

    public static final String RESOLVER_PREFIX = "https://doi.org/";

    /** Unanchored pattern used to find DOI-shaped substrings in free text or URLs. */
    public static final Pattern DOI_IN_TEXT = Pattern.compile("10\\.\\d{4,9}/[^\\s]+");

    private static final Pattern NORMALISED_DOI = Pattern.compile("^10\\.\\d{4,9}/\\S+$");
    private static final Pattern RESOLVER_OR_SCHEME_PREFIX = Pattern.compile(
        "^(?:https?://(?:dx\\.)?doi\\.org/|doi:\\s*)", Pattern.CASE_INSENSITIVE);
    // Crossref registers figures, tables and supplements as separate works
    private static final Pattern COMPONENT_SUFFIX = Pattern.compile("/fig-\\d+|/table-\\d+|/supp-\\d+");
    private static final String TRAILING_PUNCTUATION = ".,;)";

    private DoiUtils() {
    }

    /**
     * Normalises a raw DOI string.
     *
     * @param raw DOI with or without resolver prefix, any case
     * @return lowercase DOI, or {@code null} when the input is not DOI-shaped
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String candidate = RESOLVER_OR_SCHEME_PREFIX.matcher(raw.trim()).replaceFirst("");
        candidate = trimTrailingPunctuation(candidate).toLowerCase(Locale.ROOT);
        return NORMALISED_DOI.matcher(candidate).matches() ? candidate : null;
    }

    /**
     * Finds the first DOI embedded in a string (typically a publisher URL).
     */
    public static Optional<String> extractFirst(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = DOI_IN_TEXT.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.ofNullable(normalize(matcher.group()));
    }

    public static String toResolverUrl(String doi) {
        return RESOLVER_PREFIX + doi;
    }

    /**
     * @return {@code true} for {@code doi.org} / {@code dx.doi.org} links
     */
    public static boolean isResolverUrl(String url) {
        return url != null && url.toLowerCase(Locale.ROOT).contains("doi.org/");
    }

    /**
     * @return {@code true} when the DOI names a figure, table or supplement rather than an article
     */
    public static boolean isComponentDoi(String doi) {
        return doi != null && COMPONENT_SUFFIX.matcher(doi).find();
    }

    /**
     * Strips any run of trailing {@code . , ; )} characters picked up from surrounding prose.
     */
    public static String trimTrailingPunctuation(String value) {
        if (value == null) {
            return null;
        }
        int end = value.length();
        while (end > 0 && TRAILING_PUNCTUATION.indexOf(value.charAt(end - 1)) >= 0) {
            end--;
        }
        return value.substring(0, end);
    }
}
