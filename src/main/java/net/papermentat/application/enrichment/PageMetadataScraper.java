package net.papermentat.application.enrichment;

import net.papermentat.model.WeakMetadata;
import net.papermentat.util.DoiUtils;
import net.papermentat.util.TextUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls weak bibliographic fields and visible text out of a landing page.
 *
 * <p>Publisher pages usually carry Highwire {@code citation_*} meta tags; Open Graph and
 * Dublin Core tags are the fallbacks.</p>
 */
final class PageMetadataScraper {

    private PageMetadataScraper() {
    }

    static ScrapedPage scrape(String html, String baseUrl) {
        Document document = Jsoup.parse(html, baseUrl);
        String title = TextUtils.coalesce(
            meta(document, "citation_title"),
            meta(document, "og:title"),
            document.title());
        String doi = TextUtils.coalesce(meta(document, "citation_doi"), meta(document, "dc.identifier"));
        String abstractText = TextUtils.coalesce(
            meta(document, "citation_abstract"),
            meta(document, "description"),
            meta(document, "og:description"));

        WeakMetadata weak = new WeakMetadata(
            TextUtils.collapseWhitespace(title),
            authors(document),
            DoiUtils.normalize(doi),
            TextUtils.collapseWhitespace(abstractText));
        String bodyText = document.body() != null ? document.body().text() : "";
        return new ScrapedPage(bodyText, weak);
    }

    private static String meta(Document document, String name) {
        for (Element element : document.select("meta[name], meta[property]")) {
            String key = element.hasAttr("name") ? element.attr("name") : element.attr("property");
            if (key.equalsIgnoreCase(name)) {
                String content = TextUtils.emptyToNull(element.attr("content"));
                if (content != null) {
                    return content;
                }
            }
        }
        return null;
    }

    private static List<String> authors(Document document) {
        List<String> authors = new ArrayList<>();
        for (Element element : document.select("meta[name]")) {
            if (element.attr("name").equalsIgnoreCase("citation_author")) {
                String name = TextUtils.emptyToNull(element.attr("content"));
                if (name != null) {
                    authors.add(name);
                }
            }
        }
        return authors;
    }

    record ScrapedPage(String text, WeakMetadata weak) {
    }
}
