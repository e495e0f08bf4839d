package pl.marcinmilkowski.next_word.engine;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;

/**
 * Bounded memo of prediction results keyed by user and trailing query text.
 *
 * When an insertion pushes the size over capacity, the oldest batch of
 * entries (by insertion order) is dropped in one go. Entries are never
 * refreshed on access and never invalidated by new typing, so a hit may
 * serve a result computed before the latest history update.
 * Not thread-safe; the engine serializes access.
 */
public class PredictionCache {

    /**
     * Cache key: user plus the trailing fragment of the query text.
     */
    public record Key(String userId, String fragment) {

        /**
         * Build the key for a query, keeping the last {@code fragmentLength}
         * code points of the text verbatim (case preserved).
         */
        public static Key of(String userId, String text, int fragmentLength) {
            String source = text != null ? text : "";
            int codePoints = source.codePointCount(0, source.length());
            if (codePoints <= fragmentLength) {
                return new Key(userId, source);
            }
            int start = source.offsetByCodePoints(source.length(), -fragmentLength);
            return new Key(userId, source.substring(start));
        }
    }

    private final int capacity;
    private final int evictionBatch;
    private final LinkedHashMap<Key, List<String>> entries = new LinkedHashMap<>();

    public PredictionCache(int capacity, int evictionBatch) {
        if (capacity <= 0 || evictionBatch <= 0 || evictionBatch > capacity) {
            throw new IllegalArgumentException("Invalid cache bounds: capacity=" + capacity
                + ", evictionBatch=" + evictionBatch);
        }
        this.capacity = capacity;
        this.evictionBatch = evictionBatch;
    }

    /**
     * @return the cached predictions, or null on a miss
     */
    public List<String> get(Key key) {
        return entries.get(key);
    }

    /**
     * Store an immutable copy of the predictions, then trim if over capacity.
     *
     * @return number of entries evicted by this insertion
     */
    public int put(Key key, List<String> predictions) {
        entries.put(key, List.copyOf(predictions));
        if (entries.size() <= capacity) {
            return 0;
        }
        return evictOldest(evictionBatch);
    }

    private int evictOldest(int count) {
        int removed = 0;
        Iterator<Key> it = entries.keySet().iterator();
        while (removed < count && it.hasNext()) {
            it.next();
            it.remove();
            removed++;
        }
        return removed;
    }

    public int size() {
        return entries.size();
    }
}
