package pl.marcinmilkowski.resonant_search.entropy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entropy and persistence statistics for documents.
 *
 * <p>Persistence model:</p>
 * <ul>
 *   <li>reversibility: mean mutual information between a dense vector and a set of
 *       reference snapshots, in [0,1]</li>
 *   <li>buffering capacity: redundancy plus symmetry of the dense vector, never negative</li>
 *   <li>entropy pressure: {@code updateFrequency * trendDecay * e^age}</li>
 *   <li>persistence: {@code e^(-fragility * (1 - reversibility) * pressure / buffering)}</li>
 * </ul>
 */
public final class EntropyModel {

    /** Histogram bins per axis for the mutual information estimator. */
    static final int MI_BINS = 8;

    private static final double LN2 = Math.log(2.0);

    private EntropyModel() {
    }

    /**
     * Shannon entropy (bits) of the empirical token distribution.
     * Zero for an empty sequence or a single repeated token.
     */
    public static double shannonEntropy(long[] tokens) {
        if (tokens.length == 0) {
            return 0.0;
        }
        Map<Long, Integer> counts = new HashMap<>();
        for (long token : tokens) {
            counts.merge(token, 1, Integer::sum);
        }
        if (counts.size() == 1) {
            return 0.0;
        }
        double total = tokens.length;
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = count / total;
            entropy -= p * log2(p);
        }
        return entropy;
    }

    /**
     * Mutual information (bits) between two dense vectors, estimated from a joint
     * histogram of paired components. Each vector is binned relative to its own
     * maximum. Result lies in [0, min(H(A), H(B))] of the binned marginals; it is
     * 0 when either vector is constant.
     */
    public static double mutualInformation(double[] a, double[] b) {
        int n = Math.min(a.length, b.length);
        if (n == 0) {
            return 0.0;
        }
        int[] binsA = discretize(a, n);
        int[] binsB = discretize(b, n);

        double[][] joint = new double[MI_BINS][MI_BINS];
        double[] marginalA = new double[MI_BINS];
        double[] marginalB = new double[MI_BINS];
        for (int i = 0; i < n; i++) {
            joint[binsA[i]][binsB[i]] += 1.0;
            marginalA[binsA[i]] += 1.0;
            marginalB[binsB[i]] += 1.0;
        }

        double mi = 0.0;
        for (int x = 0; x < MI_BINS; x++) {
            if (marginalA[x] == 0) continue;
            for (int y = 0; y < MI_BINS; y++) {
                double count = joint[x][y];
                if (count == 0 || marginalB[y] == 0) continue;
                double pxy = count / n;
                double px = marginalA[x] / n;
                double py = marginalB[y] / n;
                mi += pxy * log2(pxy / (px * py));
            }
        }
        return Math.max(0.0, mi);
    }

    /**
     * Mean mutual information between the current vector and each reference
     * snapshot, clamped to [0,1]. An empty reference set gives 1.0: a vector is
     * taken as fully reversible with itself.
     */
    public static double reversibility(double[] current, List<double[]> history) {
        if (history.isEmpty()) {
            return 1.0;
        }
        double sum = 0.0;
        for (double[] past : history) {
            sum += mutualInformation(current, past);
        }
        return clampUnit(sum / history.size());
    }

    /**
     * Redundancy plus symmetry. Both terms are in [0,1], so the result is in [0,2].
     */
    public static double bufferingCapacity(double[] dense) {
        return redundancy(dense) + symmetry(dense);
    }

    /**
     * Compressibility of the mass distribution: {@code 1 - H(p) / log2(n)} where p is
     * the normalized mass over the n components. 0 for an all-zero vector.
     */
    public static double redundancy(double[] dense) {
        double total = positiveMass(dense);
        if (total <= 0 || dense.length < 2) {
            return 0.0;
        }
        double entropy = 0.0;
        for (double v : dense) {
            if (v > 0) {
                double p = v / total;
                entropy -= p * log2(p);
            }
        }
        double maxEntropy = log2(dense.length);
        return clampUnit(1.0 - entropy / maxEntropy);
    }

    /**
     * Evenness of mass about the center: {@code 1 - sum|v[i] - v[n-1-i]| / (2 * mass)}.
     * 1 for a mirror-symmetric vector, 0 for an all-zero vector.
     */
    public static double symmetry(double[] dense) {
        double total = positiveMass(dense);
        if (total <= 0) {
            return 0.0;
        }
        double asymmetry = 0.0;
        for (int i = 0, j = dense.length - 1; i < j; i++, j--) {
            asymmetry += Math.abs(Math.max(dense[i], 0) - Math.max(dense[j], 0));
        }
        // each mirrored pair was counted once, the full sum would count it twice
        return clampUnit(1.0 - asymmetry / total);
    }

    /**
     * Entropy pressure. Grows as {@code e^age}; kept literal.
     */
    public static double entropyPressure(double ageDays, double updateFrequency, double trendDecay) {
        return updateFrequency * trendDecay * Math.exp(ageDays);
    }

    /**
     * Persistence score in (0,1] for positive buffering; 0 when buffering is not positive.
     */
    public static double persistenceScore(double reversibility, double pressure, double buffering, double fragility) {
        if (buffering <= 0) {
            return 0.0;
        }
        double irreversibility = 1.0 - reversibility;
        if (irreversibility == 0.0 || fragility == 0.0) {
            // avoids 0 * Infinity once pressure overflows
            return 1.0;
        }
        return Math.exp(-fragility * irreversibility * (pressure / buffering));
    }

    private static int[] discretize(double[] values, int n) {
        double max = 0.0;
        for (int i = 0; i < n; i++) {
            if (values[i] > max) max = values[i];
        }
        int[] bins = new int[n];
        if (max <= 0) {
            return bins;
        }
        for (int i = 0; i < n; i++) {
            double v = Math.max(values[i], 0.0);
            bins[i] = Math.min(MI_BINS - 1, (int) Math.floor(v / max * (MI_BINS - 1)));
        }
        return bins;
    }

    private static double positiveMass(double[] dense) {
        double total = 0.0;
        for (double v : dense) {
            if (v > 0) total += v;
        }
        return total;
    }

    private static double clampUnit(double value) {
        if (value < 0.0) return 0.0;
        return Math.min(value, 1.0);
    }

    private static double log2(double x) {
        return Math.log(x) / LN2;
    }
}
