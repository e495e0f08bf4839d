package pl.marcinmilkowski.next_word.engine;

import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.LowerCaseFilter;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.analysis.util.CharTokenizer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits typed text into lowercase whitespace-delimited tokens.
 *
 * Backed by a Lucene analysis chain (CharTokenizer + LowerCaseFilter).
 * Separators are Java whitespace plus every Unicode space character, so
 * no-break spaces (U+00A0, U+2007, U+202F) and NEL (U+0085) split tokens
 * too. Lowercasing is per code point, without context-sensitive mappings
 * such as the Greek final sigma.
 * Lucene reuses token stream components per thread, so a single instance
 * can be shared by concurrent callers.
 */
public final class TypingTokenizer {

    private static final String FIELD = "text";
    private static final int NEXT_LINE = 0x85;

    private final Analyzer analyzer = new Analyzer() {
        @Override
        protected TokenStreamComponents createComponents(String fieldName) {
            // Lift the default 255-char cap so long tokens are never split
            Tokenizer source = new CharTokenizer(
                    TokenStream.DEFAULT_TOKEN_ATTRIBUTE_FACTORY, StandardTokenizer.MAX_TOKEN_LENGTH_LIMIT) {
                @Override
                protected boolean isTokenChar(int c) {
                    return !isSeparator(c);
                }
            };
            return new TokenStreamComponents(source, new LowerCaseFilter(source));
        }
    };

    static boolean isSeparator(int c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == NEXT_LINE;
    }

    /**
     * Tokenize text. Null or blank text yields an empty list.
     */
    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }

        List<String> tokens = new ArrayList<>();
        try (TokenStream stream = analyzer.tokenStream(FIELD, text)) {
            CharTermAttribute termAttr = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                tokens.add(termAttr.toString());
            }
            stream.end();
        } catch (IOException e) {
            // Reading from an in-memory string
            throw new UncheckedIOException("Tokenization failed", e);
        }
        return tokens;
    }
}
