package pl.marcinmilkowski.next_word.history;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Recent words and typing-speed samples of a single user.
 *
 * Both sequences are ring buffers: appending beyond capacity drops the
 * oldest entry. Not thread-safe.
 */
final class UserHistory {

    private final int maxWords;
    private final int maxSpeedSamples;
    private final ArrayDeque<String> words;
    private final ArrayDeque<Double> typingSpeeds;
    private long lastActivityMillis;

    UserHistory(int maxWords, int maxSpeedSamples, long createdAtMillis) {
        this.maxWords = maxWords;
        this.maxSpeedSamples = maxSpeedSamples;
        this.words = new ArrayDeque<>(maxWords);
        this.typingSpeeds = new ArrayDeque<>(maxSpeedSamples);
        this.lastActivityMillis = createdAtMillis;
    }

    void addWord(String word) {
        words.addLast(word);
        while (words.size() > maxWords) {
            words.removeFirst();
        }
    }

    void addSpeedSample(double charsPerSecond) {
        typingSpeeds.addLast(charsPerSecond);
        while (typingSpeeds.size() > maxSpeedSamples) {
            typingSpeeds.removeFirst();
        }
    }

    List<String> copyWords() {
        return new ArrayList<>(words);
    }

    int wordCount() {
        return words.size();
    }

    int speedSampleCount() {
        return typingSpeeds.size();
    }

    double averageSpeed() {
        if (typingSpeeds.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (double speed : typingSpeeds) {
            sum += speed;
        }
        return sum / typingSpeeds.size();
    }

    long lastActivityMillis() {
        return lastActivityMillis;
    }

    void markActive(long nowMillis) {
        if (nowMillis > lastActivityMillis) {
            lastActivityMillis = nowMillis;
        }
    }
}
