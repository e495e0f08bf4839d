package pl.marcinmilkowski.next_word.engine;

import org.junit.jupiter.api.*;
import pl.marcinmilkowski.next_word.config.PredictorConfig;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for forgetting inactive users.
 */
class IdleUserEvictionTest {

    private static final long TIMEOUT = 60_000L;

    private ManualClock clock;
    private PredictionEngine engine;

    @BeforeEach
    void setUp() {
        clock = new ManualClock();
        PredictorConfig config = new PredictorConfig(100, 10, 1000, 100, 20, 5, TIMEOUT, 5);
        engine = new PredictionEngine(config, clock);
    }

    @Test
    @DisplayName("Explicit sweep forgets users idle past the timeout")
    void explicitSweep() {
        engine.recordTyping("old", "good night", 1.0);
        clock.advance(TIMEOUT + 1_000L);
        engine.recordTyping("fresh", "good morning", 1.0);

        assertEquals(1, engine.evictIdleUsers());

        assertEquals(1, engine.metrics().totalUsers());
        assertEquals(0, engine.historyLength("old"));
        assertEquals(0.0, engine.averageTypingSpeed("old"));
        assertEquals(2, engine.historyLength("fresh"));
    }

    @Test
    @DisplayName("Global frequencies survive user eviction")
    void frequenciesSurvive() {
        engine.recordTyping("old", "good night", 1.0);
        clock.advance(TIMEOUT + 1_000L);
        engine.evictIdleUsers();

        assertEquals(0, engine.metrics().totalUsers());
        assertEquals(1, engine.wordCount("night"));
        assertEquals(2, engine.metrics().totalDistinctWords());
    }

    @Test
    @DisplayName("Users active within the timeout are kept")
    void activeUsersKept() {
        engine.recordTyping("u1", "hello", 1.0);
        clock.advance(TIMEOUT - 1_000L);
        engine.recordTyping("u1", "again", 1.0);
        clock.advance(TIMEOUT - 1_000L);

        assertEquals(0, engine.evictIdleUsers());
        assertEquals(2, engine.historyLength("u1"));
    }

    @Test
    @DisplayName("Typing events trigger a sweep every sweep interval")
    void lazySweep() {
        engine.recordTyping("old", "first words", 1.0);
        clock.advance(TIMEOUT + 1_000L);

        for (int i = 0; i < 3; i++) {
            engine.recordTyping("fresh", "more words", 1.0);
        }
        assertEquals(2, engine.metrics().totalUsers());

        // Fifth event since start reaches the interval
        engine.recordTyping("fresh", "more words", 1.0);
        assertEquals(1, engine.metrics().totalUsers());
    }

    @Test
    @DisplayName("Zero timeout keeps users forever")
    void zeroTimeoutDisables() {
        PredictorConfig config = PredictorConfig.defaults().withIdleTimeoutMillis(0);
        PredictionEngine keepForever = new PredictionEngine(config, clock);

        keepForever.recordTyping("u1", "hello", 1.0);
        clock.advance(365L * 24 * 3600 * 1000);

        assertEquals(0, keepForever.evictIdleUsers());
        assertEquals(1, keepForever.metrics().totalUsers());
    }

    /**
     * Clock that only moves when told to.
     */
    private static final class ManualClock extends Clock {
        private long millis = 1_700_000_000_000L;

        void advance(long deltaMillis) {
            millis += deltaMillis;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public long millis() {
            return millis;
        }

        @Override
        public Instant instant() {
            return Instant.ofEpochMilli(millis);
        }
    }
}
