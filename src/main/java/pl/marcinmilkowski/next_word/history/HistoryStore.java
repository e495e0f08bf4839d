package pl.marcinmilkowski.next_word.history;

import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Per-user bounded word history and rolling typing-speed samples.
 *
 * Users are registered lazily on their first event. The store has no
 * locking of its own; the owning engine serializes access.
 */
public class HistoryStore {

    private final int maxWords;
    private final int maxSpeedSamples;
    private final Map<String, UserHistory> users = new HashMap<>();

    /**
     * @param maxWords        words kept per user
     * @param maxSpeedSamples speed samples kept per user
     */
    public HistoryStore(int maxWords, int maxSpeedSamples) {
        if (maxWords <= 0 || maxSpeedSamples <= 0) {
            throw new IllegalArgumentException("History bounds must be positive: words="
                + maxWords + ", speeds=" + maxSpeedSamples);
        }
        this.maxWords = maxWords;
        this.maxSpeedSamples = maxSpeedSamples;
    }

    /**
     * Register the user if needed and stamp its last activity.
     */
    public void touch(String userId, long nowMillis) {
        historyFor(userId, nowMillis).markActive(nowMillis);
    }

    /**
     * Append words to the user's history, dropping the oldest beyond capacity.
     * No-op for an empty list.
     */
    public void append(String userId, List<String> words) {
        if (words.isEmpty()) {
            return;
        }
        UserHistory history = historyFor(userId, 0L);
        for (String word : words) {
            history.addWord(word);
        }
    }

    /**
     * Record one typing-speed sample. Non-positive and non-finite values
     * carry no information and are ignored.
     */
    public void recordSpeed(String userId, double charsPerSecond) {
        if (!(charsPerSecond > 0) || Double.isInfinite(charsPerSecond)) {
            return;
        }
        historyFor(userId, 0L).addSpeedSample(charsPerSecond);
    }

    /**
     * Point-in-time copy of the user's words, oldest first.
     * Empty for unknown users.
     */
    public List<String> snapshot(String userId) {
        UserHistory history = users.get(userId);
        return history != null ? history.copyWords() : List.of();
    }

    /**
     * Mean of the stored speed samples, 0 if there are none.
     */
    public double averageSpeed(String userId) {
        UserHistory history = users.get(userId);
        return history != null ? history.averageSpeed() : 0.0;
    }

    public int wordCount(String userId) {
        UserHistory history = users.get(userId);
        return history != null ? history.wordCount() : 0;
    }

    public int speedSampleCount(String userId) {
        UserHistory history = users.get(userId);
        return history != null ? history.speedSampleCount() : 0;
    }

    public int userCount() {
        return users.size();
    }

    /**
     * Forget users whose last activity is strictly before the cutoff.
     *
     * @return number of users removed
     */
    public int evictIdle(long cutoffMillis) {
        int removed = 0;
        Iterator<UserHistory> it = users.values().iterator();
        while (it.hasNext()) {
            if (it.next().lastActivityMillis() < cutoffMillis) {
                it.remove();
                removed++;
            }
        }
        return removed;
    }

    private UserHistory historyFor(String userId, long createdAtMillis) {
        return users.computeIfAbsent(userId, id -> new UserHistory(maxWords, maxSpeedSamples, createdAtMillis));
    }
}
