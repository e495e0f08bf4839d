package pl.marcinmilkowski.next_word.engine;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time counters of a prediction engine.
 */
public record EngineMetrics(
    int totalUsers,                  // Users currently tracked
    int totalDistinctWords,          // Distinct words in the frequency index
    int cacheSize,                   // Prediction cache entries
    long cacheHits,
    long cacheMisses,
    double averagePredictionMicros   // Mean predictNext time holding the engine lock, 0 before the first call
) {

    /**
     * Fraction of predictNext calls served from the cache.
     */
    public double cacheHitRatio() {
        long total = cacheHits + cacheMisses;
        return total == 0 ? 0.0 : (double) cacheHits / total;
    }

    /**
     * Field map for JSON responses.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("total_users", totalUsers);
        map.put("total_words", totalDistinctWords);
        map.put("cache_size", cacheSize);
        map.put("cache_hits", cacheHits);
        map.put("cache_misses", cacheMisses);
        map.put("cache_hit_ratio", Math.round(cacheHitRatio() * 1000.0) / 1000.0);
        map.put("avg_prediction_micros", Math.round(averagePredictionMicros * 100.0) / 100.0);
        return map;
    }
}
