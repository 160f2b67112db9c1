package net.papermentat.util;

import org.jsoup.Jsoup;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Centralized text normalization for provider payloads.
 *
 * <p>Provider strings arrive with stray whitespace, embedded JATS/HTML markup and
 * inconsistent casing; everything that ends up in a {@code PaperMetadata} passes
 * through here first.</p>
 */
public final class TextUtils {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");

    private TextUtils() {
        // Utility class
    }

    /**
     * @return trimmed value, or {@code null} when null or blank
     */
    public static String emptyToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Returns the first non-blank argument, trimmed.
     */
    public static String coalesce(String... values) {
        if (values == null) {
            return null;
        }
        for (String value : values) {
            String candidate = emptyToNull(value);
            if (candidate != null) {
                return candidate;
            }
        }
        return null;
    }

    /**
     * Collapses internal whitespace runs (including newlines from XML feeds) to a single space.
     */
    public static String collapseWhitespace(String value) {
        if (value == null) {
            return null;
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    /**
     * Removes embedded markup such as {@code <jats:p>} and decodes entities.
     *
     * <p>Examples:
     * <ul>
     * <li>{@code "<jats:p>Deep <jats:italic>learning</jats:italic></jats:p>"} → {@code "Deep learning"}</li>
     * <li>{@code "plain"} → {@code "plain"}</li>
     * </ul>
     */
    public static String stripMarkup(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        if (value.indexOf('<') < 0 && value.indexOf('&') < 0) {
            return collapseWhitespace(value);
        }
        return emptyToNull(Jsoup.parse(value).text());
    }

    /**
     * Lowercase, accent-free, punctuation-free form used for title comparison.
     *
     * <p>{@code "Attention Is All You Need!"} and {@code "attention is all you need"}
     * produce the same key.</p>
     */
    public static String normalizeForComparison(String value) {
        if (value == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(value, Normalizer.Form.NFD);
        String stripped = DIACRITICS.matcher(decomposed).replaceAll("");
        return NON_ALPHANUMERIC.matcher(stripped.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
    }

    /**
     * Truncates to at most {@code maxLength} characters.
     */
    public static String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, Math.max(0, maxLength));
    }

    /**
     * Parses the leading four characters of a date string as a year.
     *
     * @return year, or {@code null} when the prefix is not numeric
     */
    public static Integer leadingYear(String date) {
        if (date == null || date.length() < 4) {
            return null;
        }
        String prefix = date.substring(0, 4);
        for (int i = 0; i < prefix.length(); i++) {
            if (!Character.isDigit(prefix.charAt(i))) {
                return null;
            }
        }
        return Integer.valueOf(prefix);
    }
}
