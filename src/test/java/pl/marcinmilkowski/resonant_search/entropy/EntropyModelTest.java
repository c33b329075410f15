package pl.marcinmilkowski.resonant_search.entropy;

import org.junit.jupiter.api.*;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EntropyModelTest {

    private static final double EPS = 1e-9;

    @Test
    @DisplayName("Entropy of a single repeated token is zero")
    void testSingleTokenEntropy() {
        assertEquals(0.0, EntropyModel.shannonEntropy(new long[]{7, 7, 7, 7}), 0.0);
        assertEquals(0.0, EntropyModel.shannonEntropy(new long[]{7}), 0.0);
        assertEquals(0.0, EntropyModel.shannonEntropy(new long[0]), 0.0);
    }

    @Test
    @DisplayName("Uniform distributions have log2(n) bits")
    void testUniformEntropy() {
        assertEquals(1.0, EntropyModel.shannonEntropy(new long[]{3, 5}), EPS);
        assertEquals(2.0, EntropyModel.shannonEntropy(new long[]{3, 5, 7, 11}), EPS);
        double skewed = EntropyModel.shannonEntropy(new long[]{3, 3, 3, 5});
        assertTrue(skewed > 0 && skewed < 1.0);
    }

    @Test
    @DisplayName("Reversibility with no history is 1.0")
    void testReversibilityEmptyHistory() {
        assertEquals(1.0, EntropyModel.reversibility(new double[]{0.5, 0.5}, List.of()), 0.0);
    }

    @Test
    @DisplayName("Reversibility stays in [0,1]")
    void testReversibilityBounded() {
        double[] a = {0.0, 1.0, 0.0, 0.5, 0.0, 0.25, 0.0, 0.125};
        double[] b = {1.0, 0.0, 0.5, 0.0, 0.25, 0.0, 0.125, 0.0};
        double[] zero = new double[8];
        for (List<double[]> history : List.of(List.of(a), List.of(b), List.of(zero), List.of(a, b, zero))) {
            double r = EntropyModel.reversibility(a, history);
            assertTrue(r >= 0.0 && r <= 1.0, "out of range: " + r);
        }
        assertEquals(0.0, EntropyModel.reversibility(a, List.of(zero)), EPS);
    }

    @Test
    @DisplayName("Mutual information of a vector with itself equals its binned entropy")
    void testMutualInformationSelf() {
        double[] v = {0.0, 1.0, 0.0, 1.0};
        assertEquals(1.0, EntropyModel.mutualInformation(v, v), EPS);
        assertEquals(0.0, EntropyModel.mutualInformation(v, new double[]{0.3, 0.3, 0.3, 0.3}), EPS);
    }

    @Test
    @DisplayName("Mutual information of independent vectors is zero")
    void testMutualInformationIndependent() {
        double[] a = {1.0, 0.0, 1.0, 0.0};
        double[] b = {1.0, 1.0, 0.0, 0.0};
        assertEquals(0.0, EntropyModel.mutualInformation(a, b), EPS);
        assertEquals(0.0, EntropyModel.mutualInformation(b, a), EPS);
        assertEquals(0.0, EntropyModel.reversibility(a, List.of(b)), EPS);
    }

    @Test
    @DisplayName("Buffering capacity is never negative")
    void testBufferingNonNegative() {
        assertEquals(0.0, EntropyModel.bufferingCapacity(new double[16]), 0.0);
        assertTrue(EntropyModel.bufferingCapacity(new double[]{0, 0.5, 0, 0.5}) >= 0.0);
        double[] symmetric = {0.25, 0.25, 0.25, 0.25};
        assertEquals(1.0, EntropyModel.symmetry(symmetric), EPS);
        assertEquals(0.0, EntropyModel.redundancy(symmetric), EPS);
        assertEquals(1.0, EntropyModel.redundancy(new double[]{1.0, 0, 0, 0}), EPS);
        assertEquals(0.0, EntropyModel.symmetry(new double[]{1.0, 0, 0, 0}), EPS);
    }

    @Test
    @DisplayName("Entropy pressure grows exponentially with age")
    void testEntropyPressure() {
        assertEquals(0.1 * 0.05, EntropyModel.entropyPressure(0.0, 0.1, 0.05), EPS);
        assertEquals(0.1 * 0.05 * Math.E, EntropyModel.entropyPressure(1.0, 0.1, 0.05), EPS);
    }

    @Test
    @DisplayName("Persistence is in (0,1] for positive buffering and 0 otherwise")
    void testPersistenceBounds() {
        double p = EntropyModel.persistenceScore(0.4, 0.005, 0.8, 0.2);
        assertTrue(p > 0.0 && p <= 1.0);
        assertEquals(Math.exp(-0.2 * 0.6 * 0.005 / 0.8), p, EPS);

        assertEquals(0.0, EntropyModel.persistenceScore(0.4, 0.005, 0.0, 0.2), 0.0);
        assertEquals(0.0, EntropyModel.persistenceScore(0.4, 0.005, -1.0, 0.2), 0.0);
        assertEquals(1.0, EntropyModel.persistenceScore(1.0, 0.005, 0.8, 0.2), 0.0);
        assertEquals(1.0, EntropyModel.persistenceScore(1.0, Double.POSITIVE_INFINITY, 0.8, 0.2), 0.0);
    }
}
