package net.papermentat.support.paperlist;

import net.papermentat.util.DoiUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts DOIs and URLs from free text, in the order they appear.
 *
 * <ul>
 *   <li>DOIs are rendered as resolver URLs ({@code https://doi.org/...}).</li>
 *   <li>Resolver links themselves are not emitted as URLs; the DOI inside them is.</li>
 *   <li>A DOI embedded in another URL is left to that URL, which re-derives it later.</li>
 *   <li>Trailing {@code . , ; )} is trimmed and duplicates are dropped, first occurrence wins.</li>
 * </ul>
 */
public final class PaperListParser {

    private static final Pattern URL = Pattern.compile("https?://[^\\s<>\"]+");

    private PaperListParser() {
    }

    public static List<String> extractEntries(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        List<Match> matches = new ArrayList<>();
        List<int[]> foreignUrlSpans = new ArrayList<>();

        Matcher urlMatcher = URL.matcher(text);
        while (urlMatcher.find()) {
            String url = DoiUtils.trimTrailingPunctuation(urlMatcher.group());
            if (DoiUtils.isResolverUrl(url)) {
                continue;
            }
            foreignUrlSpans.add(new int[]{urlMatcher.start(), urlMatcher.end()});
            matches.add(new Match(urlMatcher.start(), url));
        }

        Matcher doiMatcher = DoiUtils.DOI_IN_TEXT.matcher(text);
        while (doiMatcher.find()) {
            if (insideAny(doiMatcher.start(), foreignUrlSpans)) {
                continue;
            }
            String doi = DoiUtils.normalize(doiMatcher.group());
            if (doi != null) {
                matches.add(new Match(doiMatcher.start(), DoiUtils.toResolverUrl(doi)));
            }
        }

        matches.sort(Comparator.comparingInt(Match::position));
        Set<String> entries = new LinkedHashSet<>();
        for (Match match : matches) {
            entries.add(match.value());
        }
        return new ArrayList<>(entries);
    }

    private static boolean insideAny(int position, List<int[]> spans) {
        for (int[] span : spans) {
            if (position >= span[0] && position < span[1]) {
                return true;
            }
        }
        return false;
    }

    private record Match(int position, String value) {
    }
}
