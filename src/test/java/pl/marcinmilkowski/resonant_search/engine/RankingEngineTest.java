package pl.marcinmilkowski.resonant_search.engine;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.resonant_search.MutableClock;
import pl.marcinmilkowski.resonant_search.crawler.CrawledDocument;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RankingEngineTest {

    private static final Instant START = Instant.parse("2024-03-01T12:00:00Z");
    private static final double EPS = 1e-9;

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
    }

    private RankingEngine standardOnlyEngine() {
        RankingConfig config = RankingConfig.builder()
            .useQuantumScore(false)
            .usePersistenceScore(false)
            .build();
        return new RankingEngine(config, clock);
    }

    @Test
    @DisplayName("Three-document corpus ranks by dot product minus entropy penalty")
    void testStandardScenario() {
        RankingEngine engine = standardOnlyEngine();
        engine.ingest(new CrawledDocument("http://example.com/1", "doc1", "apple banana"));
        engine.ingest(new CrawledDocument("http://example.com/2", "doc2", "apple apple"));
        engine.ingest(new CrawledDocument("http://example.com/3", "doc3", "cherry"));

        List<SearchResult> results = engine.search("apple", 10);

        assertEquals(3, results.size());
        assertEquals("doc2", results.get(0).title());
        assertEquals("doc1", results.get(1).title());
        assertEquals("doc3", results.get(2).title());

        assertEquals(1.0, results.get(0).score(), EPS);
        assertEquals(0.4, results.get(1).score(), EPS);
        assertEquals(0.0, results.get(2).score(), EPS);
        assertEquals(0.5, results.get(1).resonance(), EPS);
        assertEquals(1.0, results.get(1).deltaEntropy(), EPS);
        assertEquals(results.get(1).score(), results.get(1).combinedScore(), EPS);
        assertEquals(0.0, results.get(1).quantumScore(), 0.0);
        assertEquals(0.0, results.get(1).persistenceScore(), 0.0);
    }

    @Test
    @DisplayName("Documents without tokens are dropped silently at ingest")
    void testEmptyTokenDocumentDropped() {
        RankingEngine engine = new RankingEngine(RankingConfig.defaults(), clock);
        assertFalse(engine.ingest(new CrawledDocument("http://example.com/empty", "empty", "")));
        assertFalse(engine.ingest(new CrawledDocument("http://example.com/punct", "punct", "... !!! ---")));
        assertEquals(0, engine.size());
        assertTrue(engine.search("anything", 5).isEmpty());

        assertTrue(engine.addLocalDocument("note", "real words here", "/tmp/note.txt"));
        assertEquals(1, engine.size());
    }

    @Test
    @DisplayName("Empty query or empty corpus gives no results")
    void testEmptyInputs() {
        RankingEngine engine = new RankingEngine(RankingConfig.defaults(), clock);
        assertTrue(engine.search("apple", 10).isEmpty());

        engine.addLocalDocument("a", "apple pie", "a.txt");
        assertTrue(engine.search("", 10).isEmpty());
        assertTrue(engine.search("  ?! ", 10).isEmpty());
        assertTrue(engine.search("apple", 0).isEmpty());
    }

    @Test
    @DisplayName("Results never exceed the limit and scores never increase")
    void testLimitAndOrdering() {
        RankingEngine engine = new RankingEngine(RankingConfig.defaults(), clock);
        String[] texts = {
            "the quick brown fox jumps over the lazy dog",
            "a fox and a dog are friends",
            "prime numbers and vector spaces",
            "entropy of the fox population",
            "the dog sleeps",
            "search engines rank documents by resonance",
        };
        for (int i = 0; i < texts.length; i++) {
            engine.addLocalDocument("doc" + i, texts[i], "doc" + i + ".txt");
        }
        engine.refreshRelationships();

        List<SearchResult> top = engine.search("fox dog", 4);
        assertEquals(4, top.size());
        for (int i = 1; i < top.size(); i++) {
            assertTrue(top.get(i - 1).combinedScore() >= top.get(i).combinedScore());
        }
        for (SearchResult r : top) {
            assertTrue(r.persistenceScore() >= 0.0 && r.persistenceScore() <= 1.0);
        }
        assertEquals(texts.length, engine.search("fox dog", 100).size());
    }

    @Test
    @DisplayName("Equal scores keep insertion order")
    void testStableTies() {
        RankingEngine engine = standardOnlyEngine();
        engine.addLocalDocument("first", "zebra", "1.txt");
        engine.addLocalDocument("second", "zebra", "2.txt");
        engine.addLocalDocument("third", "zebra", "3.txt");

        List<SearchResult> results = engine.search("zebra", 3);
        assertEquals(List.of("first", "second", "third"),
            results.stream().map(SearchResult::title).toList());
    }

    @Test
    @DisplayName("Quantum jump moves reversibility and halves age above the threshold only")
    void testQuantumJump() {
        RankingEngine engine = standardOnlyEngine();
        engine.addLocalDocument("doc1", "apple banana", "1.txt");
        engine.addLocalDocument("doc2", "apple apple", "2.txt");
        engine.addLocalDocument("doc3", "cherry", "3.txt");
        clock.advance(Duration.ofDays(4));

        int affected = engine.applyQuantumJump("apple", 0.5);

        assertEquals(2, affected);
        List<IndexedDocument> docs = engine.documents();
        assertEquals(0.9 + 0.1 * 0.25, docs.get(0).getReversibility(), EPS);
        assertEquals(0.9 + 0.1 * 0.5, docs.get(1).getReversibility(), EPS);
        assertEquals(1.0, docs.get(2).getReversibility(), 0.0);

        long now = START.plus(Duration.ofDays(4)).toEpochMilli();
        long twoDaysAgo = START.plus(Duration.ofDays(2)).toEpochMilli();
        assertEquals(twoDaysAgo, docs.get(0).getTimestampMillis());
        assertEquals(twoDaysAgo, docs.get(1).getTimestampMillis());
        assertEquals(START.toEpochMilli(), docs.get(2).getTimestampMillis());
        assertTrue(docs.get(0).getTimestampMillis() < now);
    }

    @Test
    @DisplayName("Quantum jump keeps reversibility in [0,1] for large importance")
    void testQuantumJumpBounded() {
        RankingEngine engine = standardOnlyEngine();
        engine.addLocalDocument("doc", "apple", "1.txt");
        engine.applyQuantumJump("apple", 50.0);
        assertEquals(1.0, engine.documents().get(0).getReversibility(), EPS);
        engine.applyQuantumJump("apple", -50.0);
        double r = engine.documents().get(0).getReversibility();
        assertTrue(r >= 0.0 && r <= 1.0);
        assertEquals(0.9, r, EPS);
    }

    @Test
    @DisplayName("Fresh documents are not aged by the jump")
    void testQuantumJumpFreshDocument() {
        RankingEngine engine = standardOnlyEngine();
        engine.addLocalDocument("doc", "apple", "1.txt");
        clock.advance(Duration.ofHours(6));
        engine.applyQuantumJump("apple", 1.0);
        assertEquals(START.toEpochMilli(), engine.documents().get(0).getTimestampMillis());
    }

    @Test
    @DisplayName("Refresh caps history at five snapshots and keeps reversibility in range")
    void testRefreshHistory() {
        RankingEngine engine = new RankingEngine(RankingConfig.defaults(), clock);
        engine.addLocalDocument("a", "apple banana cherry", "a.txt");
        engine.addLocalDocument("b", "banana cherry date", "b.txt");
        assertEquals(1, engine.documents().get(0).getHistorySize());

        for (int i = 0; i < 6; i++) {
            engine.refreshRelationships();
        }
        for (IndexedDocument doc : engine.documents()) {
            assertEquals(5, doc.getHistorySize());
            assertTrue(doc.getReversibility() >= 0.0 && doc.getReversibility() <= 1.0);
        }
    }

    @Test
    @DisplayName("Refresh on a single document keeps full reversibility")
    void testRefreshSingleDocument() {
        RankingEngine engine = new RankingEngine(RankingConfig.defaults(), clock);
        engine.addLocalDocument("solo", "lonely words", "solo.txt");
        engine.refreshRelationships();
        IndexedDocument doc = engine.documents().get(0);
        assertEquals(1.0, doc.getReversibility(), 0.0);
        assertEquals(2, doc.getHistorySize());
    }

    @Test
    @DisplayName("Tokens beyond the dense dimension give zero buffering and zero persistence")
    void testTokensBeyondDenseDimension() {
        RankingConfig config = RankingConfig.builder().denseDimension(2).build();
        RankingEngine engine = new RankingEngine(config, clock);
        engine.addLocalDocument("far", "apple banana", "far.txt");

        assertEquals(0.0, engine.documents().get(0).getBuffering(), 0.0);
        List<SearchResult> results = engine.search("apple", 5);
        assertEquals(1, results.size());
        assertEquals(0.0, results.get(0).persistenceScore(), 0.0);
        assertTrue(results.get(0).resonance() > 0.0);

        RankingEngine wide = new RankingEngine(RankingConfig.defaults(), clock);
        wide.addLocalDocument("near", "apple banana", "near.txt");
        assertTrue(wide.documents().get(0).getBuffering() > 0.0);
    }

    @Test
    @DisplayName("Very old documents get zero persistence instead of NaN")
    void testOldDocumentPersistence() {
        RankingEngine engine = new RankingEngine(RankingConfig.defaults(), clock);
        engine.addLocalDocument("a", "apple banana cherry", "a.txt");
        engine.addLocalDocument("b", "banana date", "b.txt");
        engine.refreshRelationships();
        clock.advance(Duration.ofDays(2000));

        for (SearchResult r : engine.search("banana", 10)) {
            assertFalse(Double.isNaN(r.persistenceScore()));
            assertFalse(Double.isNaN(r.combinedScore()));
            assertTrue(r.persistenceScore() >= 0.0 && r.persistenceScore() <= 1.0);
        }
    }

    @Test
    @DisplayName("Quantum channel contributes when enabled")
    void testQuantumScore() {
        RankingConfig config = RankingConfig.builder().usePersistenceScore(false).build();
        RankingEngine engine = new RankingEngine(config, clock);
        engine.addLocalDocument("a", "apple", "a.txt");

        SearchResult r = engine.search("apple", 1).get(0);
        double expectedQuantum = 0.6 * 1.0 + 0.2 * Math.log(3) + 0.2 * 0.5;
        assertEquals(expectedQuantum, r.quantumScore(), EPS);
        assertEquals(0.7 * r.score() + 0.3 * r.quantumScore(), r.combinedScore(), EPS);
    }

    @Test
    @DisplayName("Snippet flattens line breaks and marks truncation")
    void testSnippet() {
        assertEquals("line one line two", RankingEngine.snippet("line one\nline two", 200));
        assertEquals("abcde...", RankingEngine.snippet("abcdefghij", 5));
        assertEquals("short", RankingEngine.snippet("  short  ", 5));
    }
}
