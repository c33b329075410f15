package pl.marcinmilkowski.resonant_search.crawler;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Serializes and spaces out requests to the same host.
 *
 * <p>Each host gets a lazily created lock. A caller holds it while sleeping
 * {@code baseDelay * U[0.8, 1.2]}, so consecutive requests to one host are at least
 * one jittered delay apart whichever worker makes them.</p>
 *
 * <p>The map grows with every distinct host and is never evicted.</p>
 */
public class HostRateLimiter {

    static final double JITTER_MIN = 0.8;
    static final double JITTER_MAX = 1.2;

    private final long baseDelayMillis;
    private final Map<String, ReentrantLock> limiters = new HashMap<>();
    private final Object mapLock = new Object();

    public HostRateLimiter(long baseDelayMillis) {
        this.baseDelayMillis = baseDelayMillis;
    }

    /**
     * Block until this host's slot is free, then hold it for one jittered delay.
     */
    public void acquire(String host) throws InterruptedException {
        ReentrantLock lock = lockFor(host);
        lock.lockInterruptibly();
        try {
            long delay = jitteredDelay();
            if (delay > 0) {
                Thread.sleep(delay);
            }
        } finally {
            lock.unlock();
        }
    }

    long jitteredDelay() {
        if (baseDelayMillis == 0) {
            return 0;
        }
        double factor = ThreadLocalRandom.current().nextDouble(JITTER_MIN, JITTER_MAX);
        return Math.round(baseDelayMillis * factor);
    }

    public int hostCount() {
        synchronized (mapLock) {
            return limiters.size();
        }
    }

    private ReentrantLock lockFor(String host) {
        synchronized (mapLock) {
            return limiters.computeIfAbsent(host, h -> new ReentrantLock());
        }
    }
}
