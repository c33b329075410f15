package pl.marcinmilkowski.resonant_search.crawler;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counters for one crawler instance, updated by all workers.
 */
public class CrawlStatistics {

    private final AtomicInteger emitted = new AtomicInteger();
    private final AtomicInteger skipped = new AtomicInteger();
    private final AtomicInteger failed = new AtomicInteger();
    private final AtomicInteger robotsDenied = new AtomicInteger();

    void recordSkipped() {
        skipped.incrementAndGet();
    }

    void recordFailed() {
        failed.incrementAndGet();
    }

    void recordRobotsDenied() {
        robotsDenied.incrementAndGet();
    }

    /**
     * Claim one of the {@code maxPages} emission slots.
     *
     * @return false once the limit is reached
     */
    boolean tryClaimEmission(int maxPages) {
        while (true) {
            int current = emitted.get();
            if (current >= maxPages) {
                return false;
            }
            if (emitted.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Give back a slot claimed by {@link #tryClaimEmission} whose document was never sent.
     */
    void releaseEmission() {
        emitted.decrementAndGet();
    }

    /** Documents sent to the ingestion channel. */
    public int getEmitted() {
        return emitted.get();
    }

    /** Pages dropped as non-2xx, non-HTML, noindex or over the page limit. */
    public int getSkipped() {
        return skipped.get();
    }

    /** URLs abandoned after a network or parse error. */
    public int getFailed() {
        return failed.get();
    }

    public int getRobotsDenied() {
        return robotsDenied.get();
    }

    @Override
    public String toString() {
        return "CrawlStatistics{emitted=" + emitted + ", skipped=" + skipped
            + ", failed=" + failed + ", robotsDenied=" + robotsDenied + "}";
    }
}
