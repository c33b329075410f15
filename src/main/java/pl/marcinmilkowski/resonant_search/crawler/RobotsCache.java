package pl.marcinmilkowski.resonant_search.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-host robots.txt cache with a time-to-live.
 *
 * <p>robots.txt is fetched on first use of a host and kept for the TTL. A failed
 * fetch or a non-2xx answer is cached as allow-all so the crawl keeps moving.
 * The cache lock is never held during a fetch; two workers may both fetch the same
 * host's file on a cold cache and the later one wins.</p>
 */
public class RobotsCache {

    private static final Logger logger = LoggerFactory.getLogger(RobotsCache.class);

    private record CachedRules(RobotsRules rules, long fetchedAtMillis) {
    }

    private final PageFetcher fetcher;
    private final String userAgent;
    private final Duration ttl;
    private final Clock clock;
    private final Map<String, CachedRules> cache = new HashMap<>();
    private final Object cacheLock = new Object();

    public RobotsCache(PageFetcher fetcher, String userAgent, Duration ttl, Clock clock) {
        this.fetcher = fetcher;
        this.userAgent = userAgent;
        this.ttl = ttl;
        this.clock = clock;
    }

    /**
     * Whether robots.txt of the URL's host permits fetching it.
     */
    public boolean isAllowed(String url) {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            return true;
        }
        if (uri.getHost() == null) {
            return true;
        }
        String origin = origin(uri);
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }
        return rulesFor(origin).isAllowed(path);
    }

    RobotsRules rulesFor(String origin) {
        long now = clock.millis();
        synchronized (cacheLock) {
            CachedRules cached = cache.get(origin);
            if (cached != null && now - cached.fetchedAtMillis() < ttl.toMillis()) {
                return cached.rules();
            }
        }
        RobotsRules rules = fetchRules(origin);
        synchronized (cacheLock) {
            cache.put(origin, new CachedRules(rules, now));
        }
        return rules;
    }

    public int size() {
        synchronized (cacheLock) {
            return cache.size();
        }
    }

    private RobotsRules fetchRules(String origin) {
        String robotsUrl = origin + "/robots.txt";
        try {
            FetchedPage page = fetcher.fetch(robotsUrl);
            if (!page.isSuccess()) {
                logger.debug("No robots.txt at {} (HTTP {}), allowing all", robotsUrl, page.statusCode());
                return RobotsRules.allowAll();
            }
            return RobotsRules.parse(page.body(), userAgent);
        } catch (IOException e) {
            logger.debug("Failed to fetch {}: {}, allowing all", robotsUrl, e.getMessage());
            return RobotsRules.allowAll();
        }
    }

    private static String origin(URI uri) {
        String scheme = uri.getScheme() == null ? "http" : uri.getScheme();
        StringBuilder sb = new StringBuilder().append(scheme).append("://").append(uri.getHost());
        if (uri.getPort() != -1) {
            sb.append(':').append(uri.getPort());
        }
        return sb.toString();
    }
}
