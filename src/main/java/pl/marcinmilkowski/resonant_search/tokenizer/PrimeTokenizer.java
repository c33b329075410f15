package pl.marcinmilkowski.resonant_search.tokenizer;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.pattern.PatternTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Maps words to prime-number term identifiers.
 *
 * <p>Text is split into runs of word characters ({@code \w+}, Unicode-aware) with
 * Lucene's {@link PatternTokenizer} and lower-cased, so "don't" gives "don" and "t"
 * and "3.14" gives "3" and "14". The first occurrence of a word allocates the next
 * prime above the current counter; later occurrences reuse it. Identifiers are never reassigned and
 * the vocabulary never shrinks.</p>
 *
 * <p>Not thread-safe. One instance owns its vocabulary and callers that share it
 * must serialize access (the ranking engine does this with its vocabulary lock).</p>
 */
public class PrimeTokenizer {

    /** Counter seed; the first allocated id is 3. */
    static final long INITIAL_COUNTER = 2;

    static final Pattern WORD_RUN = Pattern.compile("\\w+", Pattern.UNICODE_CHARACTER_CLASS);

    private final Map<String, Long> wordToId = new HashMap<>();
    private final Map<Long, String> idToWord = new HashMap<>();
    private final Analyzer analyzer;
    private long counter = INITIAL_COUNTER;

    public PrimeTokenizer() {
        this.analyzer = new Analyzer() {
            @Override
            protected TokenStreamComponents createComponents(String fieldName) {
                Tokenizer source = new PatternTokenizer(WORD_RUN, 0);
                TokenStream result = new LowerCaseFilter(source);
                return new TokenStreamComponents(source, result);
            }
        };
    }

    /**
     * Tokenize text into term ids, extending the vocabulary with unseen words.
     *
     * @param text input text (null is treated as empty)
     * @return term ids in text order
     */
    public long[] tokenize(String text) {
        List<String> words = splitWords(text);
        long[] ids = new long[words.size()];
        for (int i = 0; i < ids.length; i++) {
            ids[i] = idFor(words.get(i));
        }
        return ids;
    }

    /**
     * Pass an already-known id sequence through without touching the vocabulary.
     */
    public long[] tokenizeWithoutUpdate(long[] termIds) {
        return termIds.clone();
    }

    public Optional<Long> termId(String word) {
        if (word == null) return Optional.empty();
        return Optional.ofNullable(wordToId.get(word.toLowerCase(Locale.ROOT)));
    }

    public Optional<String> word(long termId) {
        return Optional.ofNullable(idToWord.get(termId));
    }

    public int vocabularySize() {
        return wordToId.size();
    }

    private long idFor(String word) {
        Long existing = wordToId.get(word);
        if (existing != null) {
            return existing;
        }
        counter = PrimeNumbers.nextPrimeAfter(counter);
        wordToId.put(word, counter);
        idToWord.put(counter, word);
        return counter;
    }

    private List<String> splitWords(String text) {
        List<String> words = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return words;
        }
        try (TokenStream stream = analyzer.tokenStream("text", text)) {
            CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                words.add(term.toString());
            }
            stream.end();
        } catch (IOException e) {
            // in-memory reader; only a broken analysis chain gets here
            throw new UncheckedIOException("Word splitting failed", e);
        }
        return words;
    }
}
