package pl.marcinmilkowski.next_word.api;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import org.junit.jupiter.api.*;
import pl.marcinmilkowski.next_word.engine.PredictionEngine;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of the HTTP endpoints on an ephemeral port.
 */
class PredictionApiServerTest {

    private PredictionEngine engine;
    private PredictionApiServer server;
    private HttpClient client;

    @BeforeEach
    void setUp() throws IOException {
        engine = new PredictionEngine();
        server = new PredictionApiServer(engine, 0, 2);
        server.start();
        client = HttpClient.newHttpClient();
    }

    @AfterEach
    void tearDown() {
        server.stop();
    }

    @Test
    @DisplayName("Health check reports ok")
    void health() throws Exception {
        HttpResponse<String> response = get("/health");

        assertEquals(200, response.statusCode());
        JSONObject json = JSON.parseObject(response.body());
        assertEquals("ok", json.getString("status"));
        assertEquals(server.getPort(), json.getIntValue("port"));
    }

    @Test
    @DisplayName("Typing events feed predictions")
    void typingThenPredict() throws Exception {
        HttpResponse<String> first = post("/api/typing",
            "{\"userId\": \"u1\", \"text\": \"Hello how are you\", \"elapsedSeconds\": 2.5}");
        assertEquals(200, first.statusCode());
        post("/api/typing", "{\"userId\": \"u1\", \"text\": \"Hello how are you doing\", \"elapsedSeconds\": 3.0}");

        HttpResponse<String> response = get("/api/predict?user=u1&text=" + encode("Hello how") + "&limit=5");

        assertEquals(200, response.statusCode());
        JSONArray predictions = JSON.parseObject(response.body()).getJSONArray("predictions");
        assertEquals(1, predictions.size());
        assertEquals("are", predictions.getString(0));
    }

    @Test
    @DisplayName("Typing endpoint returns predictions for the typed text")
    void typingReturnsPredictions() throws Exception {
        engine.recordTyping("u1", "see you later", 1.0);

        HttpResponse<String> response = post("/api/typing",
            "{\"userId\": \"u1\", \"text\": \"see you\", \"elapsedSeconds\": 1.0}");

        JSONObject json = JSON.parseObject(response.body());
        assertEquals("ok", json.getString("status"));
        assertEquals("later", json.getJSONArray("predictions").getString(0));
    }

    @Test
    @DisplayName("Typing speed of unknown user is zero")
    void typingSpeedUnknownUser() throws Exception {
        HttpResponse<String> response = get("/api/typing-speed?user=nobody");

        assertEquals(200, response.statusCode());
        assertEquals(0.0, JSON.parseObject(response.body()).getDoubleValue("charsPerSecond"));
    }

    @Test
    @DisplayName("Metrics reflect recorded activity")
    void metrics() throws Exception {
        engine.recordTyping("u1", "one two", 1.0);
        engine.recordTyping("u2", "two three", 1.0);

        JSONObject json = JSON.parseObject(get("/api/metrics").body());

        assertEquals(2, json.getIntValue("total_users"));
        assertEquals(3, json.getIntValue("total_words"));
        assertEquals(0, json.getIntValue("cache_size"));
    }

    @Test
    @DisplayName("Top words are ordered by frequency")
    void topWords() throws Exception {
        engine.recordTyping("u1", "a b b c c c", 1.0);

        JSONArray words = JSON.parseObject(get("/api/words/top?limit=2").body()).getJSONArray("words");

        assertEquals(2, words.size());
        assertEquals("c", words.getJSONObject(0).getString("word"));
        assertEquals(3, words.getJSONObject(0).getLongValue("count"));
        assertEquals("b", words.getJSONObject(1).getString("word"));
    }

    @Test
    @DisplayName("Config endpoint reports the engine's effective bounds")
    void config() throws Exception {
        HttpResponse<String> response = get("/api/config");

        assertEquals(200, response.statusCode());
        JSONObject json = JSON.parseObject(response.body());
        assertEquals("ok", json.getString("status"));
        assertEquals(100, json.getIntValue("history_size"));
        assertEquals(1000, json.getIntValue("cache_capacity"));
        assertEquals(20, json.getIntValue("cache_key_length"));
        assertEquals(5, json.getIntValue("default_limit"));
        assertEquals(405, post("/api/config", "{}").statusCode());
    }

    @Test
    @DisplayName("Missing user parameter is a 400")
    void missingUser() throws Exception {
        HttpResponse<String> response = get("/api/predict?text=hello");

        assertEquals(400, response.statusCode());
        JSONObject json = JSON.parseObject(response.body());
        assertEquals("error", json.getString("status"));
        assertEquals(400, json.getIntValue("code"));
    }

    @Test
    @DisplayName("Invalid limit is a 400")
    void invalidLimit() throws Exception {
        assertEquals(400, get("/api/predict?user=u1&text=hi&limit=abc").statusCode());
        assertEquals(400, get("/api/predict?user=u1&text=hi&limit=-1").statusCode());
    }

    @Test
    @DisplayName("Malformed JSON body is a 400")
    void malformedBody() throws Exception {
        assertEquals(400, post("/api/typing", "{\"userId\": \"u1\", \"text\": ").statusCode());
        assertEquals(400, post("/api/typing", "").statusCode());
        assertEquals(400, post("/api/typing", "{\"text\": \"no user\"}").statusCode());
    }

    @Test
    @DisplayName("Wrong method is a 405")
    void wrongMethod() throws Exception {
        assertEquals(405, post("/api/predict", "{}").statusCode());
        assertEquals(405, get("/api/typing").statusCode());
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path)).GET().build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(uri(path))
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private URI uri(String path) {
        return URI.create("http://localhost:" + server.getPort() + path);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
