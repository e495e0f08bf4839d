package pl.marcinmilkowski.next_word.engine;

/**
 * A possible next word together with its global frequency.
 *
 * Sorted by frequency descending. Equal frequencies compare as equal, so a
 * stable sort keeps discovery order among them.
 */
public record WordCandidate(
    String word,        // Word that followed the prefix in the user's history
    long frequency      // Global occurrence count of the word
) implements Comparable<WordCandidate> {

    @Override
    public int compareTo(WordCandidate other) {
        return Long.compare(other.frequency, this.frequency);
    }

    @Override
    public String toString() {
        return String.format("%s freq=%d", word, frequency);
    }
}
