package pl.marcinmilkowski.next_word.config;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads predictor configuration from JSON.
 *
 * Expected JSON structure (every key except "version" is optional and
 * falls back to the built-in default):
 * {
 *   "version": "1.0",
 *   "history_size": 100,
 *   "speed_samples": 10,
 *   "cache_capacity": 1000,
 *   "eviction_batch": 100,
 *   "cache_key_length": 20,
 *   "default_limit": 5,
 *   "idle_timeout_millis": 1800000,
 *   "sweep_interval": 1000
 * }
 */
public class PredictorConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(PredictorConfigLoader.class);

    private final PredictorConfig config;
    private final String version;

    /**
     * Load predictor configuration from the specified path.
     *
     * @param configPath Path to the JSON config file
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file is invalid
     */
    public PredictorConfigLoader(Path configPath) throws IOException {
        if (!Files.exists(configPath)) {
            throw new IOException("Predictor config file not found: " + configPath);
        }

        JSONObject root;
        try {
            root = JSON.parseObject(Files.readString(configPath));
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed predictor config " + configPath + ": " + e.getMessage(), e);
        }
        if (root == null) {
            throw new IllegalArgumentException("Empty predictor config: " + configPath);
        }

        String parsedVersion = root.getString("version");
        if (parsedVersion == null || parsedVersion.isBlank()) {
            throw new IllegalArgumentException("Missing 'version' field in predictor config");
        }
        this.version = parsedVersion;
        this.config = parse(root);

        logger.info("Loaded predictor config version {} from {}: history={}, cache={}/{}, idle timeout={} ms",
            version, configPath, config.historySize(), config.cacheCapacity(), config.evictionBatch(),
            config.idleTimeoutMillis());
    }

    /**
     * Build a config from a parsed JSON object, using defaults for absent keys.
     */
    static PredictorConfig parse(JSONObject root) {
        try {
            return new PredictorConfig(
                root.getIntValue("history_size", PredictorConfig.DEFAULT_HISTORY_SIZE),
                root.getIntValue("speed_samples", PredictorConfig.DEFAULT_SPEED_SAMPLES),
                root.getIntValue("cache_capacity", PredictorConfig.DEFAULT_CACHE_CAPACITY),
                root.getIntValue("eviction_batch", PredictorConfig.DEFAULT_EVICTION_BATCH),
                root.getIntValue("cache_key_length", PredictorConfig.DEFAULT_CACHE_KEY_LENGTH),
                root.getIntValue("default_limit", PredictorConfig.DEFAULT_LIMIT),
                root.getLongValue("idle_timeout_millis", PredictorConfig.DEFAULT_IDLE_TIMEOUT_MILLIS),
                root.getIntValue("sweep_interval", PredictorConfig.DEFAULT_SWEEP_INTERVAL)
            );
        } catch (JSONException e) {
            throw new IllegalArgumentException("Invalid value in predictor config: " + e.getMessage(), e);
        }
    }

    /**
     * Get the loaded configuration.
     */
    public PredictorConfig getConfig() {
        return config;
    }

    /**
     * Get the configuration version.
     */
    public String getVersion() {
        return version;
    }
}
