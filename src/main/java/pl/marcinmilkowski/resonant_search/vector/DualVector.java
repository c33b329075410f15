package pl.marcinmilkowski.resonant_search.vector;

import java.util.Objects;

/**
 * Paired sparse representation used by the auxiliary dual-score channel.
 *
 * <p>The base construction gives both halves the same mass; it is a placeholder
 * basis meant to be swapped for a real biorthogonal pair.</p>
 */
public record DualVector(SparseVector primary, SparseVector secondary) {

    public DualVector {
        Objects.requireNonNull(primary, "primary");
        Objects.requireNonNull(secondary, "secondary");
    }
}
