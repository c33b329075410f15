package pl.marcinmilkowski.resonant_search.crawler;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory fetcher. Unknown URLs answer 404; URLs registered with
 * {@link #fail(String)} throw.
 */
class StubPageFetcher implements PageFetcher {

    private final Map<String, FetchedPage> pages = new HashMap<>();
    private final Map<String, String> failures = new HashMap<>();
    private final List<String> requests = new ArrayList<>();

    StubPageFetcher html(String url, String body) {
        pages.put(url, new FetchedPage(url, 200, "text/html; charset=UTF-8", body));
        return this;
    }

    StubPageFetcher page(String url, int status, String contentType, String body) {
        pages.put(url, new FetchedPage(url, status, contentType, body));
        return this;
    }

    StubPageFetcher robots(String origin, String body) {
        return page(origin + "/robots.txt", 200, "text/plain", body);
    }

    StubPageFetcher fail(String url) {
        failures.put(url, "connection refused");
        return this;
    }

    @Override
    public synchronized FetchedPage fetch(String url) throws IOException {
        requests.add(url);
        if (failures.containsKey(url)) {
            throw new IOException(failures.get(url));
        }
        FetchedPage page = pages.get(url);
        return page != null ? page : new FetchedPage(url, 404, "text/html", "");
    }

    synchronized List<String> requests() {
        return new ArrayList<>(requests);
    }

    synchronized long requestCount(String url) {
        return requests.stream().filter(url::equals).count();
    }
}
