package pl.marcinmilkowski.next_word.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.next_word.config.PredictorConfig;
import pl.marcinmilkowski.next_word.frequency.FrequencyIndex;
import pl.marcinmilkowski.next_word.frequency.WordFrequency;
import pl.marcinmilkowski.next_word.history.HistoryStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Adaptive next-word predictor shared by all connected users.
 *
 * Learns each user's recent words and typing speed plus global word
 * frequencies, and predicts continuations of the word being typed from the
 * adjacencies in that user's history, ranked by global frequency.
 *
 * <p>Every operation runs under one engine-wide monitor, so history,
 * frequency and cache updates are mutually consistent and all calls are
 * linearized. Per-call work is bounded by the history size.</p>
 *
 * <p>Predictions are memoized by (user, trailing query text). New typing
 * does not invalidate them; they leave the cache only through the
 * overflow batch eviction.</p>
 *
 * <p>Operations never fail on unknown users, empty or null text, or
 * non-positive elapsed times: they degrade to empty results or no-ops.</p>
 */
public class PredictionEngine {

    private static final Logger logger = LoggerFactory.getLogger(PredictionEngine.class);

    private final PredictorConfig config;
    private final Clock clock;
    private final TypingTokenizer tokenizer = new TypingTokenizer();
    private final HistoryStore historyStore;
    private final FrequencyIndex frequencyIndex = new FrequencyIndex();
    private final PredictionCache cache;
    private final Object lock = new Object();

    // Guarded by lock
    private int eventsSinceSweep = 0;
    private long cacheHits = 0;
    private long cacheMisses = 0;
    private long predictionCount = 0;
    private long predictionNanos = 0;

    public PredictionEngine() {
        this(PredictorConfig.defaults());
    }

    public PredictionEngine(PredictorConfig config) {
        this(config, Clock.systemUTC());
    }

    public PredictionEngine(PredictorConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.historyStore = new HistoryStore(config.historySize(), config.speedSamples());
        this.cache = new PredictionCache(config.cacheCapacity(), config.evictionBatch());
        logger.info("Prediction engine initialized: history={} words, {} speed samples, cache={} (batch {}), idle timeout={} ms",
            config.historySize(), config.speedSamples(), config.cacheCapacity(),
            config.evictionBatch(), config.idleTimeoutMillis());
    }

    /**
     * Learn from a typing event.
     *
     * Appends the lowercase tokens of {@code text} to the user's history,
     * counts each token globally and, if {@code elapsedSeconds > 0}, records
     * a typing-speed sample of characters per second. The prediction cache
     * is left untouched.
     *
     * @param userId         user who typed
     * @param text           typed text; null is treated as empty
     * @param elapsedSeconds time spent typing it
     */
    public void recordTyping(String userId, String text, double elapsedSeconds) {
        Objects.requireNonNull(userId, "userId");
        List<String> tokens = tokenizer.tokenize(text);
        int length = text != null ? text.codePointCount(0, text.length()) : 0;

        synchronized (lock) {
            long now = clock.millis();
            maybeSweepIdleUsers(now);

            historyStore.touch(userId, now);
            historyStore.append(userId, tokens);
            if (elapsedSeconds > 0) {
                historyStore.recordSpeed(userId, length / elapsedSeconds);
            }
            for (String token : tokens) {
                frequencyIndex.increment(token);
            }
        }

        if (logger.isTraceEnabled()) {
            logger.trace("Recorded {} tokens for user {}", tokens.size(), userId);
        }
    }

    /**
     * Predict continuations with the configured default limit.
     */
    public List<String> predictNext(String userId, String currentText) {
        return predictNext(userId, currentText, config.defaultLimit());
    }

    /**
     * Predict the words most likely to follow {@code currentText}.
     *
     * Scans the user's history for every word starting with the last token
     * of the text and collects the word that followed it. Each distinct
     * follower is kept once (first occurrence) and the list is ordered by
     * global frequency descending; equal frequencies keep discovery order.
     *
     * <p>Results are cached under (user, last characters of the text). The
     * key ignores {@code limit}, so a cached result is returned as stored
     * even if a different limit is requested later. Empty queries are not
     * cached.</p>
     *
     * @param userId      user typing
     * @param currentText text typed so far; null is treated as empty
     * @param limit       maximum number of predictions; negative means 0
     * @return predicted words, most likely first; never null
     */
    public List<String> predictNext(String userId, String currentText, int limit) {
        Objects.requireNonNull(userId, "userId");
        PredictionCache.Key key = PredictionCache.Key.of(userId, currentText, config.cacheKeyLength());
        List<String> tokens = tokenizer.tokenize(currentText);

        synchronized (lock) {
            // Latency covers work under the lock, not time spent waiting for it
            long startNanos = System.nanoTime();
            try {
                List<String> cached = cache.get(key);
                if (cached != null) {
                    cacheHits++;
                    return cached;
                }
                cacheMisses++;

                if (tokens.isEmpty()) {
                    return List.of();
                }

                String lastToken = tokens.get(tokens.size() - 1);
                List<WordCandidate> candidates = findCandidates(historyStore.snapshot(userId), lastToken);
                Collections.sort(candidates);

                List<String> result = candidates.stream()
                    .limit(Math.max(limit, 0))
                    .map(WordCandidate::word)
                    .toList();

                int evicted = cache.put(key, result);
                if (evicted > 0) {
                    logger.debug("Prediction cache over capacity, evicted {} oldest entries ({} remain)",
                        evicted, cache.size());
                }
                return result;
            } finally {
                predictionCount++;
                predictionNanos += System.nanoTime() - startNanos;
            }
        }
    }

    /**
     * Collect distinct followers of words starting with {@code prefix},
     * in discovery order.
     */
    private List<WordCandidate> findCandidates(List<String> history, String prefix) {
        List<WordCandidate> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (int i = 0; i + 1 < history.size(); i++) {
            if (!history.get(i).startsWith(prefix)) {
                continue;
            }
            String next = history.get(i + 1);
            if (seen.add(next)) {
                candidates.add(new WordCandidate(next, frequencyIndex.count(next)));
            }
        }
        return candidates;
    }

    /**
     * Learn from a typing event and immediately predict what follows it.
     */
    public List<String> processTypingEvent(String userId, String text, double elapsedSeconds) {
        recordTyping(userId, text, elapsedSeconds);
        return predictNext(userId, text, config.defaultLimit());
    }

    /**
     * Average typing speed in characters per second over the retained
     * samples, 0 if the user has none.
     */
    public double averageTypingSpeed(String userId) {
        synchronized (lock) {
            return historyStore.averageSpeed(userId);
        }
    }

    /**
     * Number of words currently retained in the user's history.
     */
    public int historyLength(String userId) {
        synchronized (lock) {
            return historyStore.wordCount(userId);
        }
    }

    public int speedSampleCount(String userId) {
        synchronized (lock) {
            return historyStore.speedSampleCount(userId);
        }
    }

    /**
     * Global occurrence count of a word, 0 if never typed.
     */
    public long wordCount(String word) {
        synchronized (lock) {
            return frequencyIndex.count(word);
        }
    }

    /**
     * Most frequently typed words across all users.
     */
    public List<WordFrequency> topWords(int n) {
        synchronized (lock) {
            return frequencyIndex.topWords(n);
        }
    }

    public EngineMetrics metrics() {
        synchronized (lock) {
            double avgMicros = predictionCount == 0 ? 0.0 : predictionNanos / 1000.0 / predictionCount;
            return new EngineMetrics(
                historyStore.userCount(),
                frequencyIndex.size(),
                cache.size(),
                cacheHits,
                cacheMisses,
                avgMicros
            );
        }
    }

    /**
     * Forget users idle for longer than the configured timeout. Their words
     * keep counting in the global frequencies.
     *
     * @return number of users removed; always 0 when the timeout is disabled
     */
    public int evictIdleUsers() {
        synchronized (lock) {
            eventsSinceSweep = 0;
            return evictIdleUsersLocked(clock.millis());
        }
    }

    private void maybeSweepIdleUsers(long now) {
        if (config.idleTimeoutMillis() == 0) {
            return;
        }
        if (++eventsSinceSweep >= config.sweepInterval()) {
            eventsSinceSweep = 0;
            evictIdleUsersLocked(now);
        }
    }

    private int evictIdleUsersLocked(long now) {
        if (config.idleTimeoutMillis() == 0) {
            return 0;
        }
        int removed = historyStore.evictIdle(now - config.idleTimeoutMillis());
        if (removed > 0) {
            logger.info("Evicted {} idle users ({} remain)", removed, historyStore.userCount());
        }
        return removed;
    }

    public PredictorConfig getConfig() {
        return config;
    }
}
