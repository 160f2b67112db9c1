package net.papermentat.mapper;

import lombok.extern.slf4j.Slf4j;
import net.papermentat.model.OaEvidence;
import net.papermentat.model.OaStatus;
import net.papermentat.model.PaperMetadata;
import net.papermentat.util.TextUtils;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps an arXiv Atom {@code <entry>} into {@link PaperMetadata}.
 *
 * <p>Preprints are open by construction: every record is green with the PDF variant of its
 * canonical {@code /abs/} URL as location. The optional {@code arxiv:doi},
 * {@code arxiv:journal_ref} and {@code category} elements fill DOI, venue and keywords.</p>
 */
@Slf4j
@Component
public class ArxivEntryMapper implements ScholarlyRecordMapper<Element> {

    private static final String SOURCE_NAME = "arXiv";
    private static final Pattern ABS_URL = Pattern.compile("arxiv\\.org/abs/(\\S+)");

    @Override
    public Optional<PaperMetadata> toMetadata(Element entry) {
        if (entry == null) {
            return Optional.empty();
        }
        String canonicalUrl = childText(entry, "id");
        String arxivId = canonicalUrl != null ? extractId(canonicalUrl).orElse(null) : null;
        String title = TextUtils.collapseWhitespace(childText(entry, "title"));
        if (arxivId == null || title == null || title.isEmpty()) {
            log.warn("arXiv entry without id or title, skipping (id={})", canonicalUrl);
            return Optional.empty();
        }

        return Optional.of(PaperMetadata.builder()
            .title(title)
            .authors(extractAuthors(entry))
            .doi(childText(entry, "arxiv:doi"))
            .arxivId(arxivId)
            .publicationYear(TextUtils.leadingYear(childText(entry, "published")))
            .journal(TextUtils.collapseWhitespace(childText(entry, "arxiv:journal_ref")))
            .abstractText(TextUtils.collapseWhitespace(childText(entry, "summary")))
            .keywords(extractCategories(entry))
            .oaStatus(OaStatus.GREEN)
            .oaLocation(toPdfUrl(canonicalUrl))
            .oaEvidence(OaEvidence.PREPRINT_ARCHIVE)
            .build());
    }

    /**
     * Builds a record straight from a canonical {@code arxiv.org/abs/...} URL without a network call.
     * The title is a placeholder of the form {@code arXiv:<id>}.
     */
    public Optional<PaperMetadata> fromCanonicalUrl(String url) {
        return extractId(url).map(arxivId -> PaperMetadata.builder()
            .title("arXiv:" + arxivId)
            .arxivId(arxivId)
            .oaStatus(OaStatus.GREEN)
            .oaLocation(toPdfUrl(url))
            .oaEvidence(OaEvidence.PREPRINT_ARCHIVE)
            .build());
    }

    /**
     * @return the identifier following {@code arxiv.org/abs/}, version suffix kept
     */
    public static Optional<String> extractId(String url) {
        if (url == null) {
            return Optional.empty();
        }
        Matcher matcher = ABS_URL.matcher(url);
        return matcher.find() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    public static boolean isCanonicalUrl(String url) {
        return extractId(url).isPresent();
    }

    public static String toPdfUrl(String canonicalUrl) {
        return canonicalUrl.replace("/abs/", "/pdf/");
    }

    @Override
    public String getSourceName() {
        return SOURCE_NAME;
    }

    private String childText(Element entry, String tagName) {
        for (Element child : entry.children()) {
            if (child.tagName().equalsIgnoreCase(tagName)) {
                return TextUtils.emptyToNull(child.text());
            }
        }
        return null;
    }

    private List<String> extractAuthors(Element entry) {
        List<String> authors = new ArrayList<>();
        for (Element child : entry.children()) {
            if (!child.tagName().equalsIgnoreCase("author")) {
                continue;
            }
            String name = childText(child, "name");
            if (name != null) {
                authors.add(TextUtils.collapseWhitespace(name));
            }
        }
        return authors;
    }

    private Set<String> extractCategories(Element entry) {
        Set<String> categories = new LinkedHashSet<>();
        for (Element child : entry.children()) {
            if (child.tagName().equalsIgnoreCase("category")) {
                String term = TextUtils.emptyToNull(child.attr("term"));
                if (term != null) {
                    categories.add(term);
                }
            }
        }
        return categories;
    }
}
