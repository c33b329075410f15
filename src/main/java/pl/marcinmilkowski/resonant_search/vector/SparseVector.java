package pl.marcinmilkowski.resonant_search.vector;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Immutable sparse term-weight vector keyed by prime term id.
 * Weights are non-negative.
 */
public final class SparseVector {

    private static final SparseVector EMPTY = new SparseVector(Map.of());

    private final Map<Long, Double> weights;

    public SparseVector(Map<Long, Double> weights) {
        Map<Long, Double> copy = new HashMap<>(weights.size() * 2);
        for (Map.Entry<Long, Double> e : weights.entrySet()) {
            double w = e.getValue();
            if (w < 0 || Double.isNaN(w)) {
                throw new IllegalArgumentException("Negative weight " + w + " for term " + e.getKey());
            }
            copy.put(e.getKey(), w);
        }
        this.weights = Collections.unmodifiableMap(copy);
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    /**
     * Weight of a term, 0 when the term is absent.
     */
    public double weight(long termId) {
        Double w = weights.get(termId);
        return w == null ? 0.0 : w;
    }

    public boolean contains(long termId) {
        return weights.containsKey(termId);
    }

    public Set<Long> termIds() {
        return weights.keySet();
    }

    public Map<Long, Double> asMap() {
        return weights;
    }

    public int size() {
        return weights.size();
    }

    public boolean isEmpty() {
        return weights.isEmpty();
    }

    public double totalWeight() {
        double sum = 0.0;
        for (double w : weights.values()) {
            sum += w;
        }
        return sum;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SparseVector other)) return false;
        return weights.equals(other.weights);
    }

    @Override
    public int hashCode() {
        return weights.hashCode();
    }

    @Override
    public String toString() {
        return "SparseVector" + weights;
    }
}
