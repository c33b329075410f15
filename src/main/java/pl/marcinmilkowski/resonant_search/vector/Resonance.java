package pl.marcinmilkowski.resonant_search.vector;

import java.util.Locale;

/**
 * Complex resonance between a query and a document vector.
 *
 * @param real      decayed dot product (amplitude)
 * @param imaginary decayed phase accumulated from shared term ids
 */
public record Resonance(double real, double imaginary) {

    public double magnitude() {
        return Math.hypot(real, imaginary);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.6f%+.6fi", real, imaginary);
    }
}
