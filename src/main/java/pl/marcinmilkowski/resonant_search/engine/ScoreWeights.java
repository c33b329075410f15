package pl.marcinmilkowski.resonant_search.engine;

/**
 * Linear blend of the three score channels.
 *
 * <ul>
 *   <li>quantum and persistence: 0.5 / 0.25 / 0.25</li>
 *   <li>one extra channel: 0.7 / 0.3</li>
 *   <li>standard only: 1.0</li>
 * </ul>
 */
public record ScoreWeights(double standard, double quantum, double persistence) {

    public static final ScoreWeights STANDARD_ONLY = new ScoreWeights(1.0, 0.0, 0.0);
    public static final ScoreWeights WITH_QUANTUM = new ScoreWeights(0.7, 0.3, 0.0);
    public static final ScoreWeights WITH_PERSISTENCE = new ScoreWeights(0.7, 0.0, 0.3);
    public static final ScoreWeights ALL = new ScoreWeights(0.5, 0.25, 0.25);

    public static ScoreWeights forFeatures(boolean quantumEnabled, boolean persistenceEnabled) {
        if (quantumEnabled && persistenceEnabled) return ALL;
        if (quantumEnabled) return WITH_QUANTUM;
        if (persistenceEnabled) return WITH_PERSISTENCE;
        return STANDARD_ONLY;
    }

    public double combine(double standardScore, double quantumScore, double persistenceScore) {
        return standard * standardScore + quantum * quantumScore + persistence * persistenceScore;
    }
}
