package pl.marcinmilkowski.resonant_search.crawler;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * HTML to {@link ExtractedPage} using jsoup.
 */
public class PageExtractor {

    static final String ROBOTS_META = "meta[name=robots], meta[name=googlebot]";
    static final String NON_TEXT_ELEMENTS = "script, style, noscript, iframe, object, embed";

    public ExtractedPage extract(String baseUrl, String html) {
        Document doc = Jsoup.parse(html == null ? "" : html, baseUrl);

        boolean noindex = false;
        for (Element meta : doc.select(ROBOTS_META)) {
            if (meta.attr("content").toLowerCase(Locale.ROOT).contains("noindex")) {
                noindex = true;
                break;
            }
        }

        String title = doc.title().trim();
        if (title.isEmpty()) {
            title = baseUrl;
        }

        List<ExtractedPage.Link> links = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            String target = anchor.absUrl("href");
            if (target.isEmpty()) continue;
            links.add(new ExtractedPage.Link(target, isNofollow(anchor)));
        }

        doc.select(NON_TEXT_ELEMENTS).remove();
        String text = doc.body().text();

        return new ExtractedPage(title, text, noindex, links);
    }

    private static boolean isNofollow(Element anchor) {
        for (String rel : anchor.attr("rel").toLowerCase(Locale.ROOT).split("\\s+")) {
            if (rel.equals("nofollow")) {
                return true;
            }
        }
        return false;
    }
}
