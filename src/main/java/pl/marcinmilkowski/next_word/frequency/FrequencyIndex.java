package pl.marcinmilkowski.next_word.frequency;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Global word frequencies with O(1) lookups.
 *
 * Words are stored lowercase, folded per code point the same way the
 * typing tokenizer folds them; counts only ever grow. Shared by all users,
 * so the count of a word is the number of times anyone typed it.
 * Not thread-safe on its own.
 */
public class FrequencyIndex {

    private final Map<String, Long> counts = new HashMap<>();

    /**
     * Count one more occurrence of the word.
     */
    public void increment(String word) {
        counts.merge(fold(word), 1L, Long::sum);
    }

    /**
     * Gets the occurrence count of a word.
     *
     * @param word The word to look up (any case)
     * @return The count, or 0 if never seen
     */
    public long count(String word) {
        if (word == null) {
            return 0;
        }
        Long count = counts.get(fold(word));
        return count != null ? count : 0;
    }

    /**
     * Simple per-code-point lowercase mapping, matching Lucene's LowerCaseFilter.
     */
    static String fold(String word) {
        StringBuilder sb = new StringBuilder(word.length());
        word.codePoints().map(Character::toLowerCase).forEach(sb::appendCodePoint);
        return sb.toString();
    }

    /**
     * Number of distinct words seen.
     */
    public int size() {
        return counts.size();
    }

    /**
     * The most frequent words, count descending, ties alphabetical.
     */
    public List<WordFrequency> topWords(int n) {
        if (n <= 0) {
            return List.of();
        }
        return counts.entrySet().stream()
            .map(e -> new WordFrequency(e.getKey(), e.getValue()))
            .sorted()
            .limit(n)
            .toList();
    }
}
