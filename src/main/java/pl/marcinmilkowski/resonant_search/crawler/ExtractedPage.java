package pl.marcinmilkowski.resonant_search.crawler;

import java.util.List;

/**
 * Content pulled out of an HTML page.
 *
 * @param title   title element text, or the page URL when there is none
 * @param text    body text without script, style and embedded-object content
 * @param noindex whether a robots/googlebot meta tag says noindex
 * @param links   outgoing links resolved against the page's base URL
 */
public record ExtractedPage(String title, String text, boolean noindex, List<Link> links) {

    /**
     * @param url      absolute link target, not yet normalized
     * @param nofollow whether the anchor carries rel=nofollow
     */
    public record Link(String url, boolean nofollow) {
    }
}
