package com.critfumble.fumblebot.service.transcription;

import com.critfumble.fumblebot.config.properties.VoiceProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Detects whether an utterance opens with a wake phrase ("hey fumblebot", "fumblebot", ...) and
 * extracts the command that follows.
 *
 * <p>Phrases are every configured wake prefix combined with every bot name, plus each bare bot name.
 * Matching ignores case and punctuation, so "Hey, FumbleBot! Roll d20." addresses the bot with the
 * command "roll d20".
 */
@Component
public class WakePhraseDetector {

    private final List<String> phrases;

    public WakePhraseDetector(VoiceProperties properties) {
        List<String> all = new ArrayList<>();
        for (String name : properties.getBotNames()) {
            String bot = normalize(name);
            for (String prefix : properties.getWakePrefixes()) {
                all.add(normalize(prefix) + " " + bot);
            }
            all.add(bot);
        }
        all.sort(Comparator.comparingInt(String::length).reversed());
        this.phrases = List.copyOf(all);
    }

    /**
     * @param text recognized utterance
     * @return command after the wake phrase (possibly empty), or empty if the utterance is not addressed
     */
    public Optional<String> detect(String text) {
        String normalized = normalize(text);
        for (String phrase : phrases) {
            if (normalized.equals(phrase)) {
                return Optional.of("");
            }
            if (normalized.startsWith(phrase + " ")) {
                return Optional.of(normalized.substring(phrase.length() + 1).trim());
            }
        }
        return Optional.empty();
    }

    List<String> phrases() {
        return phrases;
    }

    /**
     * Lower-cases and replaces punctuation with spaces. Keeps {@code +} and {@code -} for dice notation.
     */
    static String normalize(String text) {
        if (text == null) {
            return "";
        }
        return text.toLowerCase(Locale.ROOT)
                .replaceAll("[^a-z0-9+\\-'\\s]", " ")
                .replaceAll("\\s+", " ")
                .trim();
    }
}
