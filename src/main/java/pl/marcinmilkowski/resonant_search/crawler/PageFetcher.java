package pl.marcinmilkowski.resonant_search.crawler;

import java.io.IOException;

/**
 * Transport used by the crawler for pages and robots.txt files.
 * Implementations must be safe for use by several workers at once.
 */
public interface PageFetcher {

    /**
     * Fetch a URL. Non-2xx responses are returned, not thrown.
     *
     * @throws IOException on network failure
     */
    FetchedPage fetch(String url) throws IOException;
}
