package pl.marcinmilkowski.resonant_search.engine;

import java.util.Locale;

/**
 * One ranked hit.
 *
 * @param title            document title
 * @param identifier       URL or path
 * @param snippet          leading text of the document
 * @param resonance        plain dot product of query and document vectors
 * @param deltaEntropy     absolute entropy difference between document and query
 * @param score            standard score (resonance minus weighted entropy difference)
 * @param quantumScore     resonance/dual channel score, 0 when disabled
 * @param persistenceScore persistence channel score, 0 when disabled
 * @param combinedScore    weighted blend used for ranking
 */
public record SearchResult(
    String title,
    String identifier,
    String snippet,
    double resonance,
    double deltaEntropy,
    double score,
    double quantumScore,
    double persistenceScore,
    double combinedScore
) {

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s <%s> combined=%.4f score=%.4f quantum=%.4f persistence=%.4f",
            title, identifier, combinedScore, score, quantumScore, persistenceScore);
    }
}
