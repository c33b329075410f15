package pl.marcinmilkowski.resonant_search.crawler;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded hand-off from crawler workers to the ingesting consumer.
 *
 * <p>{@link #send} blocks while the channel is full; this is the crawler's
 * backpressure. After {@link #close()} no new documents are accepted and the
 * consumer drains what is left.</p>
 */
public class IngestionChannel {

    private final BlockingQueue<CrawledDocument> queue;
    private final int capacity;
    private volatile boolean closed;

    public IngestionChannel(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Channel capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Put a document, waiting for space.
     *
     * @throws IllegalStateException if the channel is closed
     */
    public void send(CrawledDocument document) throws InterruptedException {
        if (closed) {
            throw new IllegalStateException("Ingestion channel is closed");
        }
        queue.put(document);
    }

    /**
     * Next document, or null if none arrived within the timeout.
     */
    public CrawledDocument receive(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    public void close() {
        closed = true;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Closed and nothing left to receive.
     */
    public boolean isDrained() {
        return closed && queue.isEmpty();
    }

    public int size() {
        return queue.size();
    }

    public int capacity() {
        return capacity;
    }
}
