package pl.marcinmilkowski.next_word.config;

import com.alibaba.fastjson2.JSONObject;

/**
 * Resource bounds and tuning knobs of the prediction engine.
 *
 * All values are validated on construction, so an engine built from a
 * config can rely on them being usable.
 */
public record PredictorConfig(
    int historySize,          // Words kept per user (ring buffer)
    int speedSamples,         // Typing-speed samples kept per user
    int cacheCapacity,        // Maximum prediction cache entries
    int evictionBatch,        // Entries dropped when the cache overflows
    int cacheKeyLength,       // Trailing code points of the query used as key
    int defaultLimit,         // Predictions returned when no limit is given
    long idleTimeoutMillis,   // Idle users are forgotten after this; 0 = never
    int sweepInterval         // Typing events between idle-user sweeps
) {

    public static final int DEFAULT_HISTORY_SIZE = 100;
    public static final int DEFAULT_SPEED_SAMPLES = 10;
    public static final int DEFAULT_CACHE_CAPACITY = 1000;
    public static final int DEFAULT_EVICTION_BATCH = 100;
    public static final int DEFAULT_CACHE_KEY_LENGTH = 20;
    public static final int DEFAULT_LIMIT = 5;
    public static final long DEFAULT_IDLE_TIMEOUT_MILLIS = 30L * 60L * 1000L;
    public static final int DEFAULT_SWEEP_INTERVAL = 1000;

    public PredictorConfig {
        requirePositive("history_size", historySize);
        requirePositive("speed_samples", speedSamples);
        requirePositive("cache_capacity", cacheCapacity);
        requirePositive("eviction_batch", evictionBatch);
        requirePositive("cache_key_length", cacheKeyLength);
        requirePositive("sweep_interval", sweepInterval);
        if (defaultLimit < 0) {
            throw new IllegalArgumentException("'default_limit' must not be negative: " + defaultLimit);
        }
        if (idleTimeoutMillis < 0) {
            throw new IllegalArgumentException("'idle_timeout_millis' must not be negative: " + idleTimeoutMillis);
        }
        if (evictionBatch > cacheCapacity) {
            throw new IllegalArgumentException("'eviction_batch' (" + evictionBatch
                + ") must not exceed 'cache_capacity' (" + cacheCapacity + ")");
        }
    }

    /**
     * Built-in configuration.
     */
    public static PredictorConfig defaults() {
        return new PredictorConfig(
            DEFAULT_HISTORY_SIZE,
            DEFAULT_SPEED_SAMPLES,
            DEFAULT_CACHE_CAPACITY,
            DEFAULT_EVICTION_BATCH,
            DEFAULT_CACHE_KEY_LENGTH,
            DEFAULT_LIMIT,
            DEFAULT_IDLE_TIMEOUT_MILLIS,
            DEFAULT_SWEEP_INTERVAL
        );
    }

    /**
     * Copy of this config with a different idle timeout.
     */
    public PredictorConfig withIdleTimeoutMillis(long timeoutMillis) {
        return new PredictorConfig(historySize, speedSamples, cacheCapacity, evictionBatch,
            cacheKeyLength, defaultLimit, timeoutMillis, sweepInterval);
    }

    /**
     * Export as a JSONObject, using the same keys the loader reads.
     */
    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("history_size", historySize);
        obj.put("speed_samples", speedSamples);
        obj.put("cache_capacity", cacheCapacity);
        obj.put("eviction_batch", evictionBatch);
        obj.put("cache_key_length", cacheKeyLength);
        obj.put("default_limit", defaultLimit);
        obj.put("idle_timeout_millis", idleTimeoutMillis);
        obj.put("sweep_interval", sweepInterval);
        return obj;
    }

    private static void requirePositive(String field, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("'" + field + "' must be positive: " + value);
        }
    }
}
