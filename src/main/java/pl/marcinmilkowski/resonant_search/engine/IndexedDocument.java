package pl.marcinmilkowski.resonant_search.engine;

import pl.marcinmilkowski.resonant_search.entropy.VectorHistory;
import pl.marcinmilkowski.resonant_search.vector.DualVector;
import pl.marcinmilkowski.resonant_search.vector.SparseVector;

import java.util.List;
import java.util.Objects;

/**
 * A document in the engine's corpus.
 *
 * <p>Vectors, entropy and buffering are fixed at ingestion. Reversibility, timestamp
 * and history are mutated by the relationship refresh and by relevance feedback,
 * always under the engine's write lock.</p>
 */
public final class IndexedDocument {

    private final String title;
    private final String identifier;
    private final String text;
    private final SparseVector vector;
    private final DualVector dualVector;
    private final double entropy;
    private final double buffering;
    private final VectorHistory history;

    private long timestampMillis;
    private double reversibility;

    IndexedDocument(String title, String identifier, String text, SparseVector vector, DualVector dualVector,
                    double entropy, double buffering, long timestampMillis) {
        this.title = Objects.requireNonNull(title, "title");
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.text = Objects.requireNonNull(text, "text");
        this.vector = vector;
        this.dualVector = dualVector;
        this.entropy = entropy;
        this.buffering = Math.max(0.0, buffering);
        this.timestampMillis = timestampMillis;
        this.reversibility = 1.0;
        this.history = new VectorHistory();
    }

    public String getTitle() {
        return title;
    }

    /**
     * URL for crawled documents, file path for local ones.
     */
    public String getIdentifier() {
        return identifier;
    }

    public String getText() {
        return text;
    }

    public SparseVector getVector() {
        return vector;
    }

    public DualVector getDualVector() {
        return dualVector;
    }

    public double getEntropy() {
        return entropy;
    }

    public double getBuffering() {
        return buffering;
    }

    public long getTimestampMillis() {
        return timestampMillis;
    }

    public double getReversibility() {
        return reversibility;
    }

    public List<double[]> getHistory() {
        return history.snapshots();
    }

    public int getHistorySize() {
        return history.size();
    }

    void setReversibility(double reversibility) {
        this.reversibility = Math.max(0.0, Math.min(1.0, reversibility));
    }

    void setTimestampMillis(long timestampMillis) {
        this.timestampMillis = timestampMillis;
    }

    void recordSnapshot(double[] dense) {
        history.append(dense);
    }

    @Override
    public String toString() {
        return "IndexedDocument{" + identifier + ", entropy=" + entropy + ", reversibility=" + reversibility + "}";
    }
}
