package pl.marcinmilkowski.next_word;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import pl.marcinmilkowski.next_word.api.PredictionApiServer;
import pl.marcinmilkowski.next_word.config.PredictorConfig;
import pl.marcinmilkowski.next_word.config.PredictorConfigLoader;
import pl.marcinmilkowski.next_word.engine.EngineMetrics;
import pl.marcinmilkowski.next_word.engine.PredictionEngine;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Locale;

/**
 * Main entry point for the next-word predictor.
 */
public class Main {

    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) {
        if (args.length == 0) {
            showUsage();
            return;
        }

        try {
            String command = args[0].toLowerCase(Locale.ROOT);

            switch (command) {
                case "server":
                    handleServerCommand(args);
                    break;
                case "replay":
                    handleReplayCommand(args);
                    break;
                case "demo":
                    handleDemoCommand();
                    break;
                case "help":
                    showUsage();
                    break;
                default:
                    logger.error("Unknown command: {}", command);
                    showUsage();
            }
        } catch (Exception e) {
            logger.error("Application error", e);
            System.err.println("Error: " + e.getMessage());
            System.err.println("Use 'help' command for usage information.");
        }
    }

    private static void handleServerCommand(String[] args) throws IOException {
        int port = 8080;
        String configFile = null;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--port":
                case "-p":
                    port = Integer.parseInt(requireValue(args, ++i));
                    break;
                case "--config":
                case "-c":
                    configFile = requireValue(args, ++i);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        PredictionEngine engine = new PredictionEngine(loadConfig(configFile));
        PredictionApiServer server = new PredictionApiServer(engine, port);
        server.start();

        System.out.println("Prediction server listening on port " + server.getPort());
        System.out.println("Press Ctrl+C to stop the server.");

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            System.out.println("\nShutting down...");
            server.stop();
        }));

        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void handleReplayCommand(String[] args) throws IOException {
        String inputFile = null;
        String userId = null;
        String query = null;
        String configFile = null;
        int limit = -1;

        for (int i = 1; i < args.length; i++) {
            switch (args[i]) {
                case "--input":
                case "-i":
                    inputFile = requireValue(args, ++i);
                    break;
                case "--user":
                case "-u":
                    userId = requireValue(args, ++i);
                    break;
                case "--query":
                case "-q":
                    query = requireValue(args, ++i);
                    break;
                case "--limit":
                    limit = Integer.parseInt(requireValue(args, ++i));
                    break;
                case "--config":
                case "-c":
                    configFile = requireValue(args, ++i);
                    break;
                default:
                    System.err.println("Unknown option: " + args[i]);
            }
        }

        if (inputFile == null || userId == null) {
            System.err.println("Error: --input and --user are required");
            System.err.println("Usage: java -jar next-word-predictor.jar replay --input <file> --user <id> [--query <text>]");
            return;
        }

        PredictionEngine engine = new PredictionEngine(loadConfig(configFile));
        int events = replay(engine, Paths.get(inputFile), userId);
        System.out.println("Replayed " + events + " typing events for user " + userId);

        if (query != null) {
            int effectiveLimit = limit >= 0 ? limit : engine.getConfig().defaultLimit();
            List<String> predictions = engine.predictNext(userId, query, effectiveLimit);
            System.out.println("Predictions for \"" + query + "\": " + predictions);
        }
        printMetrics(engine.metrics());
    }

    /**
     * Feed every non-blank line of a UTF-8 file to the engine as one typing
     * event without timing information.
     *
     * @return number of events recorded
     */
    static int replay(PredictionEngine engine, Path input, String userId) throws IOException {
        int events = 0;
        try (BufferedReader reader = Files.newBufferedReader(input, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                engine.recordTyping(userId, line, 0);
                events++;
            }
        }
        logger.info("Replayed {} lines from {}", events, input);
        return events;
    }

    private static void handleDemoCommand() {
        PredictionEngine engine = new PredictionEngine();
        engine.recordTyping("user1", "Hello how are you", 2.5);
        engine.recordTyping("user1", "Hello how are you doing", 3.0);

        List<String> predictions = engine.predictNext("user1", "Hello how");
        System.out.println("Predictions: " + predictions);
        System.out.printf(Locale.ROOT, "Typing speed: %.2f chars/s%n", engine.averageTypingSpeed("user1"));
        printMetrics(engine.metrics());
    }

    private static void printMetrics(EngineMetrics metrics) {
        System.out.printf(Locale.ROOT, "Metrics: users=%d, words=%d, cache=%d, hits=%d, misses=%d, avg=%.1f us%n",
            metrics.totalUsers(),
            metrics.totalDistinctWords(),
            metrics.cacheSize(),
            metrics.cacheHits(),
            metrics.cacheMisses(),
            metrics.averagePredictionMicros()
        );
    }

    private static PredictorConfig loadConfig(String configFile) throws IOException {
        if (configFile == null) {
            return PredictorConfig.defaults();
        }
        return new PredictorConfigLoader(Paths.get(configFile)).getConfig();
    }

    private static String requireValue(String[] args, int index) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for option " + args[index - 1]);
        }
        return args[index];
    }

    private static void showUsage() {
        System.out.println("Usage: java -jar next-word-predictor.jar <command> [options]");
        System.out.println();
        System.out.println("Commands:");
        System.out.println("  server   Start the prediction API server");
        System.out.println("           --port <port>      Port to listen on (default 8080)");
        System.out.println("           --config <file>    JSON predictor config");
        System.out.println();
        System.out.println("  replay   Learn from a text file and predict");
        System.out.println("           --input <file>     UTF-8 text, one typing event per line");
        System.out.println("           --user <id>        User the text is attributed to");
        System.out.println("           --query <text>     Text to predict continuations for");
        System.out.println("           --limit <n>        Maximum predictions");
        System.out.println("           --config <file>    JSON predictor config");
        System.out.println();
        System.out.println("  demo     Run a short built-in example");
        System.out.println("  help     Show this message");
    }
}
