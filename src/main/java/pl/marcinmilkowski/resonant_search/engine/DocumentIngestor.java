package pl.marcinmilkowski.resonant_search.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.resonant_search.crawler.CrawledDocument;
import pl.marcinmilkowski.resonant_search.crawler.IngestionChannel;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Single consumer that drains an {@link IngestionChannel} into a {@link RankingEngine}.
 * Runs until the channel is closed and empty.
 */
public class DocumentIngestor implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(DocumentIngestor.class);

    static final long POLL_MILLIS = 100;
    static final int PROGRESS_INTERVAL = 10;

    private final RankingEngine engine;
    private final IngestionChannel channel;
    private final AtomicInteger processed = new AtomicInteger();
    private final AtomicInteger dropped = new AtomicInteger();
    private Thread thread;

    public DocumentIngestor(RankingEngine engine, IngestionChannel channel) {
        this.engine = Objects.requireNonNull(engine, "engine");
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Run on a new daemon thread.
     */
    public synchronized Thread start() {
        if (thread != null) {
            throw new IllegalStateException("Ingestor already started");
        }
        thread = new Thread(this, "document-ingestor");
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    /**
     * Wait for the thread started by {@link #start()}.
     *
     * @return true if the ingestor finished within the timeout
     */
    public boolean awaitCompletion(long timeout, TimeUnit unit) throws InterruptedException {
        Thread t;
        synchronized (this) {
            t = thread;
        }
        if (t == null) {
            return true;
        }
        t.join(unit.toMillis(timeout));
        return !t.isAlive();
    }

    @Override
    public void run() {
        try {
            while (!channel.isDrained()) {
                CrawledDocument document = channel.receive(POLL_MILLIS, TimeUnit.MILLISECONDS);
                if (document != null) {
                    handle(document);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Ingestor interrupted after {} documents", processed.get());
            return;
        }
        logger.info("Ingestion finished: {} documents indexed, {} dropped", processed.get(), dropped.get());
    }

    private void handle(CrawledDocument document) {
        if (document.text().isBlank() || !engine.ingest(document)) {
            logger.debug("No indexable text at {}", document.url());
            dropped.incrementAndGet();
            return;
        }
        int count = processed.incrementAndGet();
        if (count % PROGRESS_INTERVAL == 0) {
            logger.info("Indexed {} documents", count);
        }
    }

    public int processedCount() {
        return processed.get();
    }

    public int droppedCount() {
        return dropped.get();
    }
}
