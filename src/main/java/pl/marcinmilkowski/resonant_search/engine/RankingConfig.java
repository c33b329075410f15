package pl.marcinmilkowski.resonant_search.engine;

/**
 * Scoring parameters for the ranking engine.
 *
 * @param useQuantumScore     blend in the resonance/dual-vector score
 * @param usePersistenceScore blend in the persistence score
 * @param entropyWeight       penalty per bit of entropy difference between query and document
 * @param fragility           sensitivity of persistence to irreversibility
 * @param trendDecay          entropy pressure trend factor
 * @param updateFrequency     assumed document update frequency for entropy pressure
 * @param denseDimension      length of dense projections used by the entropy model; token ids
 *                            at or above it are dropped from the projection, so a document
 *                            made only of such tokens gets zero buffering and zero persistence.
 *                            The default covers roughly the first thousand distinct words.
 * @param snippetLength       characters of document text shown in a result snippet
 */
public record RankingConfig(
    boolean useQuantumScore,
    boolean usePersistenceScore,
    double entropyWeight,
    double fragility,
    double trendDecay,
    double updateFrequency,
    int denseDimension,
    int snippetLength
) {

    public static final double DEFAULT_ENTROPY_WEIGHT = 0.1;
    public static final double DEFAULT_FRAGILITY = 0.2;
    public static final double DEFAULT_TREND_DECAY = 0.05;
    public static final double DEFAULT_UPDATE_FREQUENCY = 0.1;
    public static final int DEFAULT_DENSE_DIMENSION = 8192;
    public static final int DEFAULT_SNIPPET_LENGTH = 200;

    public RankingConfig {
        requireNonNegative("entropy_weight", entropyWeight);
        requireNonNegative("fragility", fragility);
        requireNonNegative("trend_decay", trendDecay);
        requireNonNegative("update_frequency", updateFrequency);
        if (denseDimension <= 0) {
            throw new IllegalArgumentException("dense_dimension must be positive: " + denseDimension);
        }
        if (snippetLength <= 0) {
            throw new IllegalArgumentException("snippet_length must be positive: " + snippetLength);
        }
    }

    public static RankingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .useQuantumScore(useQuantumScore)
            .usePersistenceScore(usePersistenceScore)
            .entropyWeight(entropyWeight)
            .fragility(fragility)
            .trendDecay(trendDecay)
            .updateFrequency(updateFrequency)
            .denseDimension(denseDimension)
            .snippetLength(snippetLength);
    }

    /**
     * Weights used to combine standard, quantum and persistence scores.
     */
    public ScoreWeights scoreWeights() {
        return ScoreWeights.forFeatures(useQuantumScore, usePersistenceScore);
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0)) {
            throw new IllegalArgumentException(name + " must be non-negative: " + value);
        }
    }

    public static final class Builder {
        private boolean useQuantumScore = true;
        private boolean usePersistenceScore = true;
        private double entropyWeight = DEFAULT_ENTROPY_WEIGHT;
        private double fragility = DEFAULT_FRAGILITY;
        private double trendDecay = DEFAULT_TREND_DECAY;
        private double updateFrequency = DEFAULT_UPDATE_FREQUENCY;
        private int denseDimension = DEFAULT_DENSE_DIMENSION;
        private int snippetLength = DEFAULT_SNIPPET_LENGTH;

        private Builder() {
        }

        public Builder useQuantumScore(boolean value) {
            this.useQuantumScore = value;
            return this;
        }

        public Builder usePersistenceScore(boolean value) {
            this.usePersistenceScore = value;
            return this;
        }

        public Builder entropyWeight(double value) {
            this.entropyWeight = value;
            return this;
        }

        public Builder fragility(double value) {
            this.fragility = value;
            return this;
        }

        public Builder trendDecay(double value) {
            this.trendDecay = value;
            return this;
        }

        public Builder updateFrequency(double value) {
            this.updateFrequency = value;
            return this;
        }

        public Builder denseDimension(int value) {
            this.denseDimension = value;
            return this;
        }

        public Builder snippetLength(int value) {
            this.snippetLength = value;
            return this;
        }

        public RankingConfig build() {
            return new RankingConfig(useQuantumScore, usePersistenceScore, entropyWeight, fragility,
                trendDecay, updateFrequency, denseDimension, snippetLength);
        }
    }
}
