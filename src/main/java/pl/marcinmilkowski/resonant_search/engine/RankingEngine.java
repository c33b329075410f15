package pl.marcinmilkowski.resonant_search.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.resonant_search.crawler.CrawledDocument;
import pl.marcinmilkowski.resonant_search.entropy.EntropyModel;
import pl.marcinmilkowski.resonant_search.tokenizer.PrimeTokenizer;
import pl.marcinmilkowski.resonant_search.vector.DualVector;
import pl.marcinmilkowski.resonant_search.vector.PrimeVectorSpace;
import pl.marcinmilkowski.resonant_search.vector.Resonance;
import pl.marcinmilkowski.resonant_search.vector.SparseVector;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory corpus with prime-vector resonance ranking.
 *
 * <p>Scoring per document and query:</p>
 * <ul>
 *   <li>standard: {@code dot(q,d) - |H(d) - H(q)| * entropyWeight}</li>
 *   <li>quantum: {@code 0.6 * Re(res) + 0.2 * |Im(res)| + 0.2 * dualScore}, with
 *       resonance decay {@code 0.01 * min(ageDays, 100)}</li>
 *   <li>persistence: persistence score times {@code e^(-entropyWeight * |dH|)}</li>
 * </ul>
 * <p>The channels are blended by {@link ScoreWeights}.</p>
 *
 * <p>Concurrency: the vocabulary is behind its own exclusive lock (query tokenization
 * can allocate term ids too). The corpus is behind a read/write lock: ingest, refresh
 * and feedback take the write lock, search takes the read lock.</p>
 */
public class RankingEngine {

    private static final Logger logger = LoggerFactory.getLogger(RankingEngine.class);

    static final double MILLIS_PER_DAY = 24.0 * 3600.0 * 1000.0;
    static final double MAX_DECAY_AGE_DAYS = 100.0;
    static final double DECAY_PER_DAY = 0.01;
    static final double FEEDBACK_THRESHOLD = 0.1;

    private static final double QUANTUM_REAL_WEIGHT = 0.6;
    private static final double QUANTUM_PHASE_WEIGHT = 0.2;
    private static final double QUANTUM_DUAL_WEIGHT = 0.2;

    private final PrimeTokenizer tokenizer;
    private final ReentrantLock vocabularyLock = new ReentrantLock();
    private final List<IndexedDocument> documents = new ArrayList<>();
    private final ReentrantReadWriteLock corpusLock = new ReentrantReadWriteLock();
    private final RankingConfig config;
    private final ScoreWeights weights;
    private final Clock clock;

    public RankingEngine() {
        this(RankingConfig.defaults());
    }

    public RankingEngine(RankingConfig config) {
        this(config, Clock.systemUTC());
    }

    public RankingEngine(RankingConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.weights = config.scoreWeights();
        this.tokenizer = new PrimeTokenizer();
        logger.info("Ranking engine created (quantum={}, persistence={}, entropyWeight={}, denseDimension={})",
            config.useQuantumScore(), config.usePersistenceScore(), config.entropyWeight(), config.denseDimension());
    }

    public RankingConfig getConfig() {
        return config;
    }

    /**
     * Ingest a crawled document.
     *
     * @return true if the document entered the corpus, false if it had no tokens
     */
    public boolean ingest(CrawledDocument document) {
        return ingest(document.title(), document.url(), document.text());
    }

    /**
     * Ingest a locally supplied document identified by its path.
     */
    public boolean addLocalDocument(String title, String text, String path) {
        return ingest(title, path, text);
    }

    /**
     * Tokenize, vectorize and append a document. Documents with no tokens are
     * dropped silently (false is returned, nothing is thrown).
     */
    public boolean ingest(String title, String identifier, String text) {
        Objects.requireNonNull(identifier, "identifier");
        long[] tokens = tokenize(text);
        if (tokens.length == 0) {
            logger.debug("Dropping document without tokens: {}", identifier);
            return false;
        }

        SparseVector vector = PrimeVectorSpace.buildVector(tokens);
        DualVector dual = PrimeVectorSpace.buildDualVector(tokens);
        double entropy = EntropyModel.shannonEntropy(tokens);
        double[] dense = PrimeVectorSpace.toDense(vector, config.denseDimension());
        double buffering = EntropyModel.bufferingCapacity(dense);

        IndexedDocument doc = new IndexedDocument(
            title == null ? identifier : title, identifier, text, vector, dual, entropy, buffering, clock.millis());
        doc.recordSnapshot(dense);

        corpusLock.writeLock().lock();
        try {
            documents.add(doc);
        } finally {
            corpusLock.writeLock().unlock();
        }
        return true;
    }

    /**
     * Recompute every document's reversibility against the dense projections of all
     * other documents and append the current projection to its history. Quadratic
     * in corpus size. Not called automatically; run it before searching.
     */
    public void refreshRelationships() {
        corpusLock.writeLock().lock();
        try {
            int n = documents.size();
            List<double[]> dense = new ArrayList<>(n);
            for (IndexedDocument doc : documents) {
                dense.add(PrimeVectorSpace.toDense(doc.getVector(), config.denseDimension()));
            }
            for (int i = 0; i < n; i++) {
                List<double[]> others = new ArrayList<>(n - 1);
                for (int j = 0; j < n; j++) {
                    if (j != i) others.add(dense.get(j));
                }
                IndexedDocument doc = documents.get(i);
                doc.setReversibility(EntropyModel.reversibility(dense.get(i), others));
                doc.recordSnapshot(dense.get(i));
            }
            logger.info("Refreshed relationships for {} documents", n);
        } finally {
            corpusLock.writeLock().unlock();
        }
    }

    /**
     * Rank the corpus against a query.
     *
     * @param query query text; tokenizing it may extend the vocabulary
     * @param limit maximum number of results
     * @return results by combined score descending, ties in insertion order
     */
    public List<SearchResult> search(String query, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        long[] queryTokens = tokenize(query);
        if (queryTokens.length == 0) {
            return Collections.emptyList();
        }

        SparseVector queryVector = PrimeVectorSpace.buildVector(queryTokens);
        double queryEntropy = EntropyModel.shannonEntropy(queryTokens);
        long[] queryTerms = queryVector.termIds().stream().mapToLong(Long::longValue).toArray();
        DualVector queryDual = PrimeVectorSpace.buildDualVector(tokenizer.tokenizeWithoutUpdate(queryTerms));
        long now = clock.millis();

        List<SearchResult> results;
        corpusLock.readLock().lock();
        try {
            results = new ArrayList<>(documents.size());
            for (IndexedDocument doc : documents) {
                results.add(score(doc, queryVector, queryDual, queryEntropy, now));
            }
        } finally {
            corpusLock.readLock().unlock();
        }

        // List.sort is stable, so equal scores keep insertion order
        results.sort((a, b) -> Double.compare(b.combinedScore(), a.combinedScore()));
        return results.size() > limit ? new ArrayList<>(results.subList(0, limit)) : results;
    }

    /**
     * Relevance feedback. Every document whose dot product with the query exceeds
     * 0.1 moves its reversibility 10% towards {@code resonance * importance}
     * (clamped to [0,1]); documents older than a day get their age halved.
     *
     * @return number of documents affected
     */
    public int applyQuantumJump(String query, double importance) {
        long[] queryTokens = tokenize(query);
        if (queryTokens.length == 0) {
            return 0;
        }
        SparseVector queryVector = PrimeVectorSpace.buildVector(queryTokens);
        long now = clock.millis();
        int affected = 0;

        corpusLock.writeLock().lock();
        try {
            for (IndexedDocument doc : documents) {
                double resonance = PrimeVectorSpace.dotProduct(queryVector, doc.getVector());
                if (resonance <= FEEDBACK_THRESHOLD) {
                    continue;
                }
                double feedback = Math.max(0.0, Math.min(1.0, resonance * importance));
                doc.setReversibility(0.9 * doc.getReversibility() + 0.1 * feedback);

                long age = now - doc.getTimestampMillis();
                if (age > MILLIS_PER_DAY) {
                    doc.setTimestampMillis(now - age / 2);
                }
                affected++;
            }
        } finally {
            corpusLock.writeLock().unlock();
        }
        logger.debug("Quantum jump for '{}' touched {} documents", query, affected);
        return affected;
    }

    public int size() {
        corpusLock.readLock().lock();
        try {
            return documents.size();
        } finally {
            corpusLock.readLock().unlock();
        }
    }

    public int vocabularySize() {
        vocabularyLock.lock();
        try {
            return tokenizer.vocabularySize();
        } finally {
            vocabularyLock.unlock();
        }
    }

    /**
     * Snapshot of the corpus in insertion order.
     */
    public List<IndexedDocument> documents() {
        corpusLock.readLock().lock();
        try {
            return List.copyOf(documents);
        } finally {
            corpusLock.readLock().unlock();
        }
    }

    private SearchResult score(IndexedDocument doc, SparseVector queryVector, DualVector queryDual,
                               double queryEntropy, long now) {
        double resonance = PrimeVectorSpace.dotProduct(queryVector, doc.getVector());
        double deltaEntropy = Math.abs(doc.getEntropy() - queryEntropy);
        double standard = resonance - deltaEntropy * config.entropyWeight();
        double ageDays = ageDays(doc, now);

        double quantum = 0.0;
        if (config.useQuantumScore()) {
            double decay = DECAY_PER_DAY * Math.min(ageDays, MAX_DECAY_AGE_DAYS);
            Resonance complex = PrimeVectorSpace.resonance(queryVector, doc.getVector(), decay);
            double dual = PrimeVectorSpace.dualScore(queryDual, doc.getDualVector());
            quantum = QUANTUM_REAL_WEIGHT * complex.real()
                + QUANTUM_PHASE_WEIGHT * Math.abs(complex.imaginary())
                + QUANTUM_DUAL_WEIGHT * dual;
        }

        double persistence = 0.0;
        if (config.usePersistenceScore()) {
            double pressure = EntropyModel.entropyPressure(ageDays, config.updateFrequency(), config.trendDecay());
            persistence = EntropyModel.persistenceScore(
                doc.getReversibility(), pressure, doc.getBuffering(), config.fragility())
                * Math.exp(-config.entropyWeight() * deltaEntropy);
        }

        return new SearchResult(
            doc.getTitle(),
            doc.getIdentifier(),
            snippet(doc.getText(), config.snippetLength()),
            resonance,
            deltaEntropy,
            standard,
            quantum,
            persistence,
            weights.combine(standard, quantum, persistence));
    }

    private long[] tokenize(String text) {
        vocabularyLock.lock();
        try {
            return tokenizer.tokenize(text);
        } finally {
            vocabularyLock.unlock();
        }
    }

    private static double ageDays(IndexedDocument doc, long now) {
        return Math.max(0L, now - doc.getTimestampMillis()) / MILLIS_PER_DAY;
    }

    /**
     * First {@code length} characters with line breaks flattened, "..." appended when cut.
     */
    static String snippet(String text, int length) {
        String flat = text.replace('\n', ' ').replace('\r', ' ').trim();
        if (flat.codePointCount(0, flat.length()) <= length) {
            return flat;
        }
        int end = flat.offsetByCodePoints(0, length);
        return flat.substring(0, end).trim() + "...";
    }
}
