package pl.marcinmilkowski.resonant_search.crawler;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Crawler limits and politeness settings.
 *
 * @param maxPages              documents to emit before workers stop
 * @param maxDepth              links are followed only from pages below this depth
 * @param crawlDelayMillis      base per-host delay, jittered by +/-20%
 * @param respectNoindex        skip pages carrying a robots noindex meta directive
 * @param respectNofollow       skip links marked rel=nofollow
 * @param allowedDomains        hosts the crawler may visit; empty means any host
 * @param maxConcurrentRequests global cap on in-flight fetches
 * @param workers               size of the worker pool
 * @param userAgent             User-Agent header and robots.txt agent name
 * @param timeoutMillis         connect/read timeout per request
 * @param channelCapacity       capacity of the ingestion channel
 * @param robotsTtl             how long a fetched robots.txt stays cached
 * @param idleGraceMillis       pause between the two empty-frontier checks
 */
public record CrawlerConfig(
    int maxPages,
    int maxDepth,
    long crawlDelayMillis,
    boolean respectNoindex,
    boolean respectNofollow,
    Set<String> allowedDomains,
    int maxConcurrentRequests,
    int workers,
    String userAgent,
    int timeoutMillis,
    int channelCapacity,
    Duration robotsTtl,
    long idleGraceMillis
) {

    public static final int DEFAULT_MAX_PAGES = 10_000;
    public static final int DEFAULT_MAX_DEPTH = 3;
    public static final long DEFAULT_CRAWL_DELAY_MILLIS = 500;
    public static final int DEFAULT_MAX_CONCURRENT_REQUESTS = 10;
    public static final int DEFAULT_WORKERS = 10;
    public static final String DEFAULT_USER_AGENT = "ResonantSearchBot/1.0";
    public static final int DEFAULT_TIMEOUT_MILLIS = 30_000;
    public static final int DEFAULT_CHANNEL_CAPACITY = 100;
    public static final Duration DEFAULT_ROBOTS_TTL = Duration.ofHours(24);
    public static final long DEFAULT_IDLE_GRACE_MILLIS = 100;

    public CrawlerConfig {
        requirePositive("max_pages", maxPages);
        if (maxDepth < 0) {
            throw new IllegalArgumentException("max_depth must be non-negative: " + maxDepth);
        }
        if (crawlDelayMillis < 0) {
            throw new IllegalArgumentException("crawl_delay must be non-negative: " + crawlDelayMillis);
        }
        requirePositive("max_concurrent_requests", maxConcurrentRequests);
        requirePositive("workers", workers);
        requirePositive("timeout_ms", timeoutMillis);
        requirePositive("channel_capacity", channelCapacity);
        if (idleGraceMillis < 0) {
            throw new IllegalArgumentException("idle grace must be non-negative: " + idleGraceMillis);
        }
        Objects.requireNonNull(userAgent, "userAgent");
        Objects.requireNonNull(robotsTtl, "robotsTtl");
        Set<String> hosts = new LinkedHashSet<>();
        for (String domain : Objects.requireNonNull(allowedDomains, "allowedDomains")) {
            if (domain != null && !domain.isBlank()) {
                hosts.add(domain.trim().toLowerCase(Locale.ROOT));
            }
        }
        allowedDomains = Set.copyOf(hosts);
    }

    public static CrawlerConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .maxPages(maxPages)
            .maxDepth(maxDepth)
            .crawlDelayMillis(crawlDelayMillis)
            .respectNoindex(respectNoindex)
            .respectNofollow(respectNofollow)
            .allowedDomains(allowedDomains)
            .maxConcurrentRequests(maxConcurrentRequests)
            .workers(workers)
            .userAgent(userAgent)
            .timeoutMillis(timeoutMillis)
            .channelCapacity(channelCapacity)
            .robotsTtl(robotsTtl)
            .idleGraceMillis(idleGraceMillis);
    }

    /**
     * True when no domain filter is set or the host is listed.
     */
    public boolean isHostAllowed(String host) {
        return allowedDomains.isEmpty() || allowedDomains.contains(host.toLowerCase(Locale.ROOT));
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive: " + value);
        }
    }

    public static final class Builder {
        private int maxPages = DEFAULT_MAX_PAGES;
        private int maxDepth = DEFAULT_MAX_DEPTH;
        private long crawlDelayMillis = DEFAULT_CRAWL_DELAY_MILLIS;
        private boolean respectNoindex = true;
        private boolean respectNofollow = true;
        private Set<String> allowedDomains = Set.of();
        private int maxConcurrentRequests = DEFAULT_MAX_CONCURRENT_REQUESTS;
        private int workers = DEFAULT_WORKERS;
        private String userAgent = DEFAULT_USER_AGENT;
        private int timeoutMillis = DEFAULT_TIMEOUT_MILLIS;
        private int channelCapacity = DEFAULT_CHANNEL_CAPACITY;
        private Duration robotsTtl = DEFAULT_ROBOTS_TTL;
        private long idleGraceMillis = DEFAULT_IDLE_GRACE_MILLIS;

        private Builder() {
        }

        public Builder maxPages(int value) {
            this.maxPages = value;
            return this;
        }

        public Builder maxDepth(int value) {
            this.maxDepth = value;
            return this;
        }

        public Builder crawlDelayMillis(long value) {
            this.crawlDelayMillis = value;
            return this;
        }

        public Builder respectNoindex(boolean value) {
            this.respectNoindex = value;
            return this;
        }

        public Builder respectNofollow(boolean value) {
            this.respectNofollow = value;
            return this;
        }

        public Builder allowedDomains(Collection<String> value) {
            this.allowedDomains = new LinkedHashSet<>(value);
            return this;
        }

        public Builder maxConcurrentRequests(int value) {
            this.maxConcurrentRequests = value;
            return this;
        }

        public Builder workers(int value) {
            this.workers = value;
            return this;
        }

        public Builder userAgent(String value) {
            this.userAgent = value;
            return this;
        }

        public Builder timeoutMillis(int value) {
            this.timeoutMillis = value;
            return this;
        }

        public Builder channelCapacity(int value) {
            this.channelCapacity = value;
            return this;
        }

        public Builder robotsTtl(Duration value) {
            this.robotsTtl = value;
            return this;
        }

        public Builder idleGraceMillis(long value) {
            this.idleGraceMillis = value;
            return this;
        }

        public CrawlerConfig build() {
            return new CrawlerConfig(maxPages, maxDepth, crawlDelayMillis, respectNoindex, respectNofollow,
                allowedDomains, maxConcurrentRequests, workers, userAgent, timeoutMillis, channelCapacity,
                robotsTtl, idleGraceMillis);
        }
    }
}
