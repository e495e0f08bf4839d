package pl.marcinmilkowski.next_word.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.next_word.engine.PredictionEngine;
import pl.marcinmilkowski.next_word.frequency.WordFrequency;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * REST API server exposing a prediction engine to a messaging transport.
 *
 * Endpoints:
 * - GET  /health                             - Health check
 * - POST /api/typing                         - Record a typing event, return predictions
 * - GET  /api/predict?user=u&text=t&limit=5  - Predict next words
 * - GET  /api/typing-speed?user=u            - Average typing speed (chars/second)
 * - GET  /api/metrics                        - Engine counters
 * - GET  /api/words/top?limit=20             - Most frequent words
 * - GET  /api/config                         - Effective engine configuration
 */
public class PredictionApiServer {

    private static final Logger logger = LoggerFactory.getLogger(PredictionApiServer.class);
    private static final int MAX_TOP_WORDS = 1000;

    private final PredictionEngine engine;
    private final int port;
    private final int threads;
    private HttpServer server;
    private ExecutorService executor;

    public PredictionApiServer(PredictionEngine engine, int port) {
        this(engine, port, Math.max(2, Runtime.getRuntime().availableProcessors()));
    }

    /**
     * @param engine  engine shared by all request threads
     * @param port    port to bind; 0 picks a free one
     * @param threads request worker threads
     */
    public PredictionApiServer(PredictionEngine engine, int port, int threads) {
        this.engine = engine;
        this.port = port;
        this.threads = threads;
    }

    /**
     * Start the API server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/health", wrapHandler(this::handleHealth));
        server.createContext("/api/typing", wrapHandler(this::handleTyping));
        server.createContext("/api/predict", wrapHandler(this::handlePredict));
        server.createContext("/api/typing-speed", wrapHandler(this::handleTypingSpeed));
        server.createContext("/api/metrics", wrapHandler(this::handleMetrics));
        server.createContext("/api/words/top", wrapHandler(this::handleTopWords));
        server.createContext("/api/config", wrapHandler(this::handleConfig));

        executor = Executors.newFixedThreadPool(threads);
        server.setExecutor(executor);
        server.start();
        logger.info("API server started on http://localhost:{} ({} worker threads)", getPort(), threads);
        logger.info("Endpoints:");
        logger.info("  GET  /health               - Health check");
        logger.info("  POST /api/typing           - Record typing event and predict");
        logger.info("  GET  /api/predict          - Predict next words");
        logger.info("  GET  /api/typing-speed     - Average typing speed");
        logger.info("  GET  /api/metrics          - Engine metrics");
        logger.info("  GET  /api/words/top        - Most frequent words");
        logger.info("  GET  /api/config           - Effective configuration");
    }

    /**
     * Stop the API server.
     */
    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdown();
            try {
                if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            executor = null;
            logger.info("API server stopped");
        }
    }

    /**
     * Actual bound port, useful when started with port 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : port;
    }

    /**
     * Wrap a handler to map exceptions to JSON errors.
     */
    private HttpHandler wrapHandler(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (IllegalArgumentException | JSONException e) {
                // NumberFormatException is an IllegalArgumentException
                sendErrorSafely(exchange, 400, e.getMessage() != null ? e.getMessage() : "Bad request");
            } catch (Throwable t) {
                if (isClientConnectionIssue(t)) {
                    logger.debug("Client disconnected: {}", t.getMessage());
                    closeQuietly(exchange);
                    return;
                }
                logger.error("Unhandled exception on {}", exchange.getRequestURI(), t);
                sendErrorSafely(exchange, 500, t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName());
            }
        };
    }

    private void sendErrorSafely(HttpExchange exchange, int status, String message) {
        try {
            if (exchange.getResponseCode() != -1) {
                logger.warn("Cannot send error response: headers already sent");
                return;
            }
            sendError(exchange, status, message);
        } catch (IOException e) {
            if (isClientConnectionIssue(e)) {
                logger.debug("Failed to send error response (client disconnected): {}", e.getMessage());
            } else {
                logger.error("Failed to send error response: {}", e.getMessage());
            }
        } finally {
            closeQuietly(exchange);
        }
    }

    private boolean isClientConnectionIssue(Throwable t) {
        Throwable current = t;
        while (current != null) {
            String msg = current.getMessage();
            if (msg != null) {
                String lower = msg.toLowerCase(Locale.ROOT);
                if (lower.contains("broken pipe")
                    || lower.contains("connection reset")
                    || lower.contains("forcibly closed")
                    || lower.contains("insufficient bytes written to stream")) {
                    return true;
                }
            }
            current = current.getCause();
        }
        return false;
    }

    private void closeQuietly(HttpExchange exchange) {
        try {
            exchange.close();
        } catch (RuntimeException e) {
            logger.debug("Error closing exchange: {}", e.getMessage());
        }
    }

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("service", "next-word-predictor");
        response.put("port", getPort());
        sendJson(exchange, 200, response);
    }

    /**
     * POST body: {"userId": "...", "text": "...", "elapsedSeconds": 2.5}
     */
    private void handleTyping(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        JSONObject body = JSON.parseObject(readRequestBody(exchange));
        if (body == null) {
            throw new IllegalArgumentException("Missing request body");
        }
        String userId = requireText(body.getString("userId"), "userId");
        String text = body.getString("text");
        double elapsedSeconds = body.getDoubleValue("elapsedSeconds");

        List<String> predictions = engine.processTypingEvent(userId, text, elapsedSeconds);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("userId", userId);
        response.put("predictions", predictions);
        sendJson(exchange, 200, response);
    }

    private void handlePredict(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        String userId = requireText(params.get("user"), "user");
        String text = params.getOrDefault("text", "");
        int limit = params.containsKey("limit")
            ? Integer.parseInt(params.get("limit"))
            : engine.getConfig().defaultLimit();
        if (limit < 0) {
            throw new IllegalArgumentException("limit must not be negative: " + limit);
        }

        List<String> predictions = engine.predictNext(userId, text, limit);

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("userId", userId);
        response.put("predictions", predictions);
        sendJson(exchange, 200, response);
    }

    private void handleTypingSpeed(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        String userId = requireText(params.get("user"), "user");

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("userId", userId);
        response.put("charsPerSecond", engine.averageTypingSpeed(userId));
        sendJson(exchange, 200, response);
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.putAll(engine.metrics().toMap());
        sendJson(exchange, 200, response);
    }

    private void handleTopWords(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, String> params = parseQueryParams(exchange.getRequestURI().getRawQuery());
        int limit = Integer.parseInt(params.getOrDefault("limit", "20"));
        if (limit < 0 || limit > MAX_TOP_WORDS) {
            throw new IllegalArgumentException("limit must be between 0 and " + MAX_TOP_WORDS + ": " + limit);
        }

        List<Map<String, Object>> words = new ArrayList<>();
        for (WordFrequency wf : engine.topWords(limit)) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("word", wf.word());
            entry.put("count", wf.count());
            words.add(entry);
        }

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.put("words", words);
        sendJson(exchange, 200, response);
    }

    private void handleConfig(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "ok");
        response.putAll(engine.getConfig().toJson());
        sendJson(exchange, 200, response);
    }

    private boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (!method.equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed");
            return false;
        }
        return true;
    }

    private static String requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Missing required parameter: " + name);
        }
        return value;
    }

    private Map<String, String> parseQueryParams(String query) {
        Map<String, String> params = new HashMap<>();
        if (query == null || query.isEmpty()) {
            return params;
        }

        for (String pair : query.split("&")) {
            String[] keyValue = pair.split("=", 2);
            if (keyValue.length == 2) {
                params.put(
                    URLDecoder.decode(keyValue[0], StandardCharsets.UTF_8),
                    URLDecoder.decode(keyValue[1], StandardCharsets.UTF_8)
                );
            }
        }
        return params;
    }

    private String readRequestBody(HttpExchange exchange) throws IOException {
        try (InputStream is = exchange.getRequestBody()) {
            return new String(is.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    private void sendJson(HttpExchange exchange, int status, Map<String, Object> data) throws IOException {
        String json = JSON.toJSONString(data, JSONWriter.Feature.WriteMapNullValue);
        byte[] body = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=UTF-8");
        exchange.getResponseHeaders().set("Cache-Control", "no-store");
        exchange.sendResponseHeaders(status, body.length);

        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("status", "error");
        error.put("message", message);
        error.put("code", status);

        sendJson(exchange, status, error);
    }
}
