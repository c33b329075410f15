package pl.marcinmilkowski.resonant_search.crawler;

import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;

/**
 * {@link PageFetcher} over jsoup's HTTP connection. HTTP errors and non-HTML
 * content types come back as responses so the crawler can decide to skip them.
 */
public class JsoupPageFetcher implements PageFetcher {

    private final String userAgent;
    private final int timeoutMillis;

    public JsoupPageFetcher(String userAgent, int timeoutMillis) {
        this.userAgent = userAgent;
        this.timeoutMillis = timeoutMillis;
    }

    public JsoupPageFetcher(CrawlerConfig config) {
        this(config.userAgent(), config.timeoutMillis());
    }

    @Override
    public FetchedPage fetch(String url) throws IOException {
        Connection.Response response;
        try {
            response = Jsoup.connect(url)
                .userAgent(userAgent)
                .timeout(timeoutMillis)
                .followRedirects(true)
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .execute();
        } catch (IllegalArgumentException e) {
            // jsoup rejects malformed URLs this way
            throw new IOException("Cannot fetch " + url + ": " + e.getMessage(), e);
        }
        return new FetchedPage(response.url().toString(), response.statusCode(), response.contentType(), response.body());
    }
}
