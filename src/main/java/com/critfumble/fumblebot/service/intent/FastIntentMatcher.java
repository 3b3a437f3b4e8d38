package com.critfumble.fumblebot.service.intent;

import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.domain.IntentReason;
import com.critfumble.fumblebot.domain.IntentResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stage 1 of intent resolution: deterministic patterns for the most common requests.
 *
 * <p>Recognized, in order:
 * <ol>
 *   <li>stop: a command that is exactly goodbye/bye/stop/leave or opens with goodbye/bye, or "stop listening"
 *   anywhere</li>
 *   <li>dice: {@code NdS[+-M]} together with the bot's name or the word "roll"</li>
 *   <li>initiative: implies a d20 roll</li>
 *   <li>greeting: a short utterance opening with a greeting word and naming the bot</li>
 * </ol>
 *
 * <p>A bare "bye" or "goodbye" is deliberately not a stop command: recognizers produce it from silence.
 */
@Component
public class FastIntentMatcher {

    static final String INITIATIVE_EXPRESSION = "1d20";
    static final String INITIATIVE_LABEL = "Initiative";

    private static final Pattern DICE = Pattern.compile("\\b(\\d*)d(\\d+)([+-]\\d+)?\\b");
    private static final Pattern SPOKEN_PLUS = Pattern.compile("(\\d*d\\d+)\\s*(?:\\+|\\bplus\\b)\\s*(\\d+)");
    private static final Pattern SPOKEN_MINUS = Pattern.compile("(\\d*d\\d+)\\s*(?:-|\\bminus\\b)\\s*(\\d+)");
    private static final Pattern STOP_COMMAND = Pattern.compile("^(?:(?:goodbye|bye)\\b.*|stop|leave)$");
    private static final Pattern ROLL_WORD = Pattern.compile("\\broll\\b");
    private static final Pattern GREETING = Pattern.compile(
            "^(hello|hi there|hi|hey there|howdy|greetings|good morning|good afternoon|good evening|yo)\\b");
    private static final int MAX_GREETING_WORDS = 4;

    private final List<String> botNames;

    public FastIntentMatcher(VoiceProperties properties) {
        this.botNames = properties.getBotNames().stream()
                .map(n -> n.toLowerCase(Locale.ROOT))
                .toList();
    }

    /**
     * @param fullText the whole addressed phrase, wake phrase included
     * @param commandText the part after the wake phrase
     * @return matched intent, or empty if Stage 2 is needed
     */
    public Optional<IntentResult> match(String fullText, String commandText) {
        String text = normalizeDice(fullText.toLowerCase(Locale.ROOT).trim());
        String command = normalizeDice(commandText.toLowerCase(Locale.ROOT).trim());
        boolean named = mentionsBot(text);
        String request = command.isEmpty() ? stripBotNames(text) : command;

        if (text.contains("stop listening") || (named && isStopCommand(request))) {
            return Optional.of(new IntentResult.Goodbye(IntentReason.WAKE_WORD));
        }

        Matcher dice = DICE.matcher(text);
        if (dice.find() && (named || ROLL_WORD.matcher(text).find())) {
            String expression = (dice.group(1).isEmpty() ? "1" : dice.group(1)) + "d" + dice.group(2)
                    + (dice.group(3) != null ? dice.group(3) : "");
            String label = text.contains("initiative") ? INITIATIVE_LABEL : null;
            return Optional.of(new IntentResult.RollDice(IntentReason.DICE_REQUEST, expression, label));
        }

        if (text.contains("initiative")) {
            return Optional.of(new IntentResult.RollDice(IntentReason.DICE_REQUEST,
                    INITIATIVE_EXPRESSION, INITIATIVE_LABEL));
        }

        if (named && isGreeting(request, text)) {
            return Optional.of(new IntentResult.Greeting(IntentReason.WAKE_WORD, null));
        }
        return Optional.empty();
    }

    boolean mentionsBot(String lowerText) {
        for (String name : botNames) {
            if (lowerText.contains(name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Rewrites spoken modifiers ("2d6 plus 3", "d20 minus 1") into notation ({@code 2d6+3}, {@code d20-1}).
     */
    static String normalizeDice(String text) {
        String out = SPOKEN_PLUS.matcher(text).replaceAll("$1+$2");
        return SPOKEN_MINUS.matcher(out).replaceAll("$1-$2");
    }

    private static boolean isStopCommand(String command) {
        String stripped = command.replaceAll("[^a-z0-9\\s]", " ").replaceAll("\\s+", " ").trim();
        return STOP_COMMAND.matcher(stripped).matches();
    }

    private boolean isGreeting(String command, String fullText) {
        String stripped = command.replaceAll("[^a-z0-9\\s]", " ").replaceAll("\\s+", " ").trim();
        String full = fullText.replaceAll("[^a-z0-9\\s]", " ").replaceAll("\\s+", " ").trim();
        boolean opensWithGreeting = GREETING.matcher(stripped).find() || GREETING.matcher(full).find();
        int words = stripped.isEmpty() ? 0 : stripped.split(" ").length;
        return opensWithGreeting && words <= MAX_GREETING_WORDS;
    }

    private String stripBotNames(String text) {
        String out = text;
        for (String name : botNames) {
            out = out.replace(name, " ");
        }
        return out.trim();
    }
}
