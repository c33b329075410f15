package pl.marcinmilkowski.resonant_search.vector;

import java.util.HashMap;
import java.util.Map;

/**
 * Vector-space algebra over prime term ids.
 *
 * <p>All operations are total: empty token sequences produce empty vectors and
 * empty vectors produce zero similarities.</p>
 */
public final class PrimeVectorSpace {

    private PrimeVectorSpace() {
    }

    /**
     * Term-frequency vector: raw counts divided by the token count.
     * Weights sum to 1.0 for any non-empty sequence.
     */
    public static SparseVector buildVector(long[] tokens) {
        if (tokens.length == 0) {
            return SparseVector.empty();
        }
        Map<Long, Double> counts = new HashMap<>();
        for (long token : tokens) {
            counts.merge(token, 1.0, Double::sum);
        }
        double total = tokens.length;
        counts.replaceAll((id, count) -> count / total);
        return new SparseVector(counts);
    }

    /**
     * Dual vector: each occurrence puts 0.5 on both halves, normalized by token count.
     */
    public static DualVector buildDualVector(long[] tokens) {
        if (tokens.length == 0) {
            return new DualVector(SparseVector.empty(), SparseVector.empty());
        }
        Map<Long, Double> primary = new HashMap<>();
        Map<Long, Double> secondary = new HashMap<>();
        for (long token : tokens) {
            primary.merge(token, 0.5, Double::sum);
            secondary.merge(token, 0.5, Double::sum);
        }
        double total = tokens.length;
        primary.replaceAll((id, mass) -> mass / total);
        secondary.replaceAll((id, mass) -> mass / total);
        return new DualVector(new SparseVector(primary), new SparseVector(secondary));
    }

    /**
     * Sum of weight products over shared term ids.
     */
    public static double dotProduct(SparseVector a, SparseVector b) {
        // iterate the smaller support
        SparseVector small = a.size() <= b.size() ? a : b;
        SparseVector large = small == a ? b : a;
        double sum = 0.0;
        for (Map.Entry<Long, Double> e : small.asMap().entrySet()) {
            Double other = large.asMap().get(e.getKey());
            if (other != null) {
                sum += e.getValue() * other;
            }
        }
        return sum;
    }

    /**
     * Complex resonance with decay.
     *
     * <p>Real part is {@code dot(a,b) * e^-decay}. Imaginary part is
     * {@code sum(ln(id) * wa * wb) * e^(-decay/2)} over shared ids, so the phase
     * decays at half the rate of the amplitude.</p>
     */
    public static Resonance resonance(SparseVector a, SparseVector b, double decay) {
        double dot = 0.0;
        double phase = 0.0;
        SparseVector small = a.size() <= b.size() ? a : b;
        SparseVector large = small == a ? b : a;
        for (Map.Entry<Long, Double> e : small.asMap().entrySet()) {
            Double other = large.asMap().get(e.getKey());
            if (other != null) {
                double product = e.getValue() * other;
                dot += product;
                phase += Math.log(e.getKey()) * product;
            }
        }
        double real = decay == 0.0 ? dot : dot * Math.exp(-decay);
        double imaginary = phase * Math.exp(-decay * 0.5);
        return new Resonance(real, imaginary);
    }

    /**
     * Auxiliary channel score: primary-with-primary plus secondary-with-secondary.
     */
    public static double dualScore(DualVector query, DualVector document) {
        return dotProduct(query.primary(), document.primary())
            + dotProduct(query.secondary(), document.secondary());
    }

    /**
     * Dense projection indexed directly by term id. Ids at or above
     * {@code dimension} are dropped.
     */
    public static double[] toDense(SparseVector sparse, int dimension) {
        if (dimension < 0) {
            throw new IllegalArgumentException("Negative dense dimension: " + dimension);
        }
        double[] dense = new double[dimension];
        for (Map.Entry<Long, Double> e : sparse.asMap().entrySet()) {
            long id = e.getKey();
            if (id >= 0 && id < dimension) {
                dense[(int) id] = e.getValue();
            }
        }
        return dense;
    }
}
