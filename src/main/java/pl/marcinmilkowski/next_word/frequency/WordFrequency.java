package pl.marcinmilkowski.next_word.frequency;

/**
 * A word together with its global occurrence count.
 *
 * Sorted by count descending, then word ascending.
 */
public record WordFrequency(
    String word,    // Lowercase word
    long count      // Occurrences across all users
) implements Comparable<WordFrequency> {

    @Override
    public int compareTo(WordFrequency other) {
        int byCount = Long.compare(other.count, this.count);
        return byCount != 0 ? byCount : this.word.compareTo(other.word);
    }

    @Override
    public String toString() {
        return word + "=" + count;
    }
}
