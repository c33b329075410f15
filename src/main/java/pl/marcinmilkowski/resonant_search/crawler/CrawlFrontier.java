package pl.marcinmilkowski.resonant_search.crawler;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Pending-URL queue and visited set shared by all crawl workers.
 *
 * <p>The queue and the visited set each have their own lock, held only for the
 * critical section. Dequeue is FIFO; with several workers interleaving, the global
 * order is not strictly breadth-first.</p>
 */
public class CrawlFrontier {

    /**
     * A queued URL and the link depth it was found at.
     */
    public record Entry(String url, int depth) {
    }

    private final Deque<Entry> queue = new ArrayDeque<>();
    private final Object queueLock = new Object();
    private final Set<String> visited = new HashSet<>();
    private final Object visitedLock = new Object();

    public void enqueue(String url, int depth) {
        synchronized (queueLock) {
            queue.addLast(new Entry(url, depth));
        }
    }

    /**
     * Next entry, or null when the queue is empty.
     */
    public Entry poll() {
        synchronized (queueLock) {
            return queue.pollFirst();
        }
    }

    public boolean isEmpty() {
        synchronized (queueLock) {
            return queue.isEmpty();
        }
    }

    public int size() {
        synchronized (queueLock) {
            return queue.size();
        }
    }

    /**
     * Mark a URL visited.
     *
     * @return true if this call marked it, false if it was already visited
     */
    public boolean markVisited(String url) {
        synchronized (visitedLock) {
            return visited.add(url);
        }
    }

    public boolean isVisited(String url) {
        synchronized (visitedLock) {
            return visited.contains(url);
        }
    }

    public int visitedCount() {
        synchronized (visitedLock) {
            return visited.size();
        }
    }
}
