package pl.marcinmilkowski.resonant_search.crawler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Concurrent, polite web crawler feeding an {@link IngestionChannel}.
 *
 * <p>A fixed pool of workers shares one {@link CrawlFrontier}. For each dequeued URL a
 * worker checks the domain filter, marks the URL visited, takes a global fetch permit,
 * consults robots.txt, waits for the host's rate limiter and fetches. HTML pages with
 * a 2xx status are parsed; their links go back to the frontier one level deeper and
 * the page text is sent to the channel, blocking while it is full.</p>
 *
 * <p>Workers stop when {@code maxPages} documents have been emitted, when
 * {@link #stop()} is called, or when the frontier stays empty across two checks a
 * grace period apart with no other worker holding a URL. The idle check is a
 * heuristic: a worker that finishes just after another gave up still works through
 * the links it found.</p>
 *
 * <p>The crawler does not close the channel; the caller does once {@link #crawl}
 * returns.</p>
 */
public class WebCrawler {

    private static final Logger logger = LoggerFactory.getLogger(WebCrawler.class);

    private final CrawlerConfig config;
    private final PageFetcher fetcher;
    private final IngestionChannel channel;
    private final CrawlFrontier frontier = new CrawlFrontier();
    private final RobotsCache robots;
    private final HostRateLimiter rateLimiter;
    private final Semaphore fetchPermits;
    private final PageExtractor extractor = new PageExtractor();
    private final CrawlStatistics statistics = new CrawlStatistics();
    private final AtomicInteger inFlight = new AtomicInteger();
    private volatile boolean stopped;

    public WebCrawler(CrawlerConfig config, IngestionChannel channel) {
        this(config, new JsoupPageFetcher(config), channel);
    }

    public WebCrawler(CrawlerConfig config, PageFetcher fetcher, IngestionChannel channel) {
        this(config, fetcher, channel, Clock.systemUTC());
    }

    public WebCrawler(CrawlerConfig config, PageFetcher fetcher, IngestionChannel channel, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.robots = new RobotsCache(fetcher, config.userAgent(), config.robotsTtl(), clock);
        this.rateLimiter = new HostRateLimiter(config.crawlDelayMillis());
        this.fetchPermits = new Semaphore(config.maxConcurrentRequests());
    }

    /**
     * Allowed-domain set made of the seeds' hosts, for crawls that stay on the seed sites.
     */
    public static Set<String> seedDomains(Collection<String> seeds) {
        Set<String> hosts = new LinkedHashSet<>();
        for (String seed : seeds) {
            UrlNormalizer.normalize(seed).flatMap(UrlNormalizer::host).ifPresent(hosts::add);
        }
        return hosts;
    }

    /**
     * Crawl from the given seeds until a stop condition holds.
     *
     * @return counters for this crawl
     */
    public CrawlStatistics crawl(Collection<String> seeds) throws InterruptedException {
        for (String seed : seeds) {
            Optional<String> normalized = UrlNormalizer.normalize(seed);
            if (normalized.isPresent()) {
                frontier.enqueue(normalized.get(), 0);
            } else {
                logger.warn("Ignoring seed that is not an http(s) URL: {}", seed);
            }
        }
        logger.info("Starting crawl: {} seeds, {} workers, maxPages={}, maxDepth={}",
            frontier.size(), config.workers(), config.maxPages(), config.maxDepth());

        ExecutorService executor = Executors.newFixedThreadPool(config.workers());
        try {
            for (int i = 0; i < config.workers(); i++) {
                int workerId = i;
                executor.submit(() -> runWorker(workerId));
            }
        } finally {
            executor.shutdown();
        }
        try {
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                logger.info("Crawl in progress: {}", statistics);
            }
        } catch (InterruptedException e) {
            stopped = true;
            executor.shutdownNow();
            throw e;
        }

        logger.info("Crawl finished: {}, {} URLs visited", statistics, frontier.visitedCount());
        return statistics;
    }

    /**
     * Ask workers to finish after their current URL.
     */
    public void stop() {
        stopped = true;
    }

    public CrawlStatistics getStatistics() {
        return statistics;
    }

    private void runWorker(int workerId) {
        try {
            while (!stopped && statistics.getEmitted() < config.maxPages()) {
                inFlight.incrementAndGet();
                CrawlFrontier.Entry entry = frontier.poll();
                if (entry == null) {
                    inFlight.decrementAndGet();
                    if (isIdle()) {
                        break;
                    }
                    continue;
                }
                try {
                    process(entry);
                } finally {
                    inFlight.decrementAndGet();
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Worker {} interrupted", workerId);
        } catch (RuntimeException e) {
            logger.error("Worker {} failed", workerId, e);
        }
        logger.info("Worker {} finished", workerId);
    }

    /**
     * Empty frontier seen twice, a grace sleep apart, with nobody holding a URL.
     */
    private boolean isIdle() throws InterruptedException {
        Thread.sleep(config.idleGraceMillis());
        return frontier.isEmpty() && inFlight.get() == 0;
    }

    private void process(CrawlFrontier.Entry entry) throws InterruptedException {
        String url = entry.url();
        Optional<String> host = UrlNormalizer.host(url);
        if (host.isEmpty() || !config.isHostAllowed(host.get())) {
            logger.debug("Host not allowed: {}", url);
            return;
        }
        if (!frontier.markVisited(url)) {
            logger.debug("Already visited: {}", url);
            return;
        }

        FetchedPage page;
        fetchPermits.acquire();
        try {
            if (!robots.isAllowed(url)) {
                logger.debug("Disallowed by robots.txt: {}", url);
                statistics.recordRobotsDenied();
                return;
            }
            rateLimiter.acquire(host.get());
            page = fetcher.fetch(url);
        } catch (IOException e) {
            logger.warn("Failed to fetch {}: {}", url, e.getMessage());
            statistics.recordFailed();
            return;
        } finally {
            fetchPermits.release();
        }

        if (!page.isSuccess()) {
            logger.debug("Skipping {} with status {}", url, page.statusCode());
            statistics.recordSkipped();
            return;
        }
        if (!page.isHtml()) {
            logger.debug("Skipping non-HTML {} ({})", url, page.contentType());
            statistics.recordSkipped();
            return;
        }

        ExtractedPage extracted;
        try {
            extracted = extractor.extract(page.url(), page.body());
        } catch (RuntimeException e) {
            logger.warn("Failed to parse {}: {}", url, e.getMessage());
            statistics.recordFailed();
            return;
        }
        if (config.respectNoindex() && extracted.noindex()) {
            logger.debug("Skipping noindex page {}", url);
            statistics.recordSkipped();
            return;
        }

        if (entry.depth() < config.maxDepth()) {
            enqueueLinks(extracted, entry.depth() + 1);
        }

        if (!statistics.tryClaimEmission(config.maxPages())) {
            statistics.recordSkipped();
            return;
        }
        try {
            channel.send(new CrawledDocument(url, extracted.title(), extracted.text()));
        } catch (IllegalStateException e) {
            statistics.releaseEmission();
            statistics.recordSkipped();
            logger.info("Ingestion channel closed, stopping crawl");
            stopped = true;
            return;
        }
        int emitted = statistics.getEmitted();
        if (emitted % 10 == 0) {
            logger.info("Crawled {} pages", emitted);
        }
    }

    private void enqueueLinks(ExtractedPage page, int depth) {
        for (ExtractedPage.Link link : page.links()) {
            if (config.respectNofollow() && link.nofollow()) {
                continue;
            }
            Optional<String> target = UrlNormalizer.normalize(link.url());
            if (target.isEmpty()) {
                continue;
            }
            Optional<String> host = UrlNormalizer.host(target.get());
            if (host.isEmpty() || !config.isHostAllowed(host.get())) {
                continue;
            }
            if (!frontier.isVisited(target.get())) {
                frontier.enqueue(target.get(), depth);
            }
        }
    }
}
