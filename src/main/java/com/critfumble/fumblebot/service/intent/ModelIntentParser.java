package com.critfumble.fumblebot.service.intent;

import com.critfumble.fumblebot.domain.Intent;
import com.critfumble.fumblebot.domain.IntentReason;
import com.critfumble.fumblebot.domain.IntentResult;
import com.critfumble.fumblebot.domain.TranscriptEntry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Builds the Stage 2 prompt and parses the model's JSON answer into an {@link IntentResult}.
 *
 * <p>The model may wrap its JSON in prose or code fences; the span between the first '{' and the last
 * '}' is parsed.
 */
@Component
public class ModelIntentParser {

    private static final Logger LOG = LogManager.getLogger(ModelIntentParser.class);

    static final String DEFAULT_DICE = "1d20";

    /**
     * Instructions for the intent model. The bot name is substituted at index 0.
     */
    static final String SYSTEM_PROMPT_TEMPLATE = """
            You are the intent classifier for %1$s, a voice assistant listening to a tabletop RPG session.
            Decide whether the latest utterance needs a response from %1$s and what it asks for.

            Respond ONLY when the speaker:
            - addresses %1$s explicitly by name,
            - asks for a dice roll,
            - asks a rules question (spells, conditions, monsters, mechanics),
            - asks to search earlier messages,
            - asks to post something to a text channel,
            - or, rarely, when a short interjection would be highly valuable to the table.
            Never respond to ordinary roleplay, in-character dialogue or table conversation.

            Reply with ONLY a JSON object, no markdown:
            {
              "shouldRespond": true|false,
              "reason": "wake-word|dice-request|rule-question|valuable-info|search-request|post-request|not-for-bot",
              "intent": "roll_dice|lookup_rule|question|greeting|goodbye|search_messages|post_to_channel|other",
              "diceExpression": "dice notation such as 2d6+3, or null",
              "request": "the question or request in plain words, or null",
              "searchQuery": "what to search for, or null",
              "channelName": "target text channel, or null",
              "content": "what to post, or null",
              "suggestedResponse": "a short spoken reply for greetings, or null"
            }""";

    /**
     * @param botName canonical bot name
     * @return system prompt for Stage 2
     */
    public String systemPrompt(String botName) {
        return String.format(SYSTEM_PROMPT_TEMPLATE, botName);
    }

    /**
     * Builds the user prompt: recent conversation followed by the utterance to classify.
     */
    public String userPrompt(String speakerName, String utterance, List<TranscriptEntry> context) {
        StringBuilder sb = new StringBuilder();
        if (!context.isEmpty()) {
            sb.append("RECENT CONVERSATION:\n");
            for (TranscriptEntry entry : context) {
                sb.append(entry.speakerDisplayName()).append(": ").append(entry.text()).append('\n');
            }
            sb.append('\n');
        }
        sb.append("LATEST UTTERANCE:\n").append(speakerName).append(": ").append(utterance);
        return sb.toString();
    }

    /**
     * Parses the model output.
     *
     * @param raw model text
     * @return parsed intent, or empty if the output holds no usable JSON object
     */
    public Optional<IntentResult> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        int start = raw.indexOf('{');
        int end = raw.lastIndexOf('}');
        if (start < 0 || end <= start) {
            LOG.debug("Model output contains no JSON object");
            return Optional.empty();
        }
        JSONObject json;
        try {
            json = new JSONObject(raw.substring(start, end + 1));
        } catch (JSONException e) {
            LOG.debug("Model output is not valid JSON: {}", e.getMessage());
            return Optional.empty();
        }
        return Optional.of(toResult(json));
    }

    private IntentResult toResult(JSONObject json) {
        boolean shouldRespond = json.optBoolean("shouldRespond", false);
        IntentReason reason = IntentReason.parse(text(json, "reason"),
                shouldRespond ? IntentReason.WAKE_WORD : IntentReason.NOT_FOR_BOT);
        if (!shouldRespond || reason == IntentReason.NOT_FOR_BOT) {
            return new IntentResult.NotForBot(IntentReason.NOT_FOR_BOT);
        }

        String request = text(json, "request");
        String suggested = text(json, "suggestedResponse");
        Intent intent = Intent.parse(text(json, "intent"));
        return switch (intent) {
            case ROLL_DICE -> {
                String expression = text(json, "diceExpression");
                yield new IntentResult.RollDice(reason, expression != null ? expression : DEFAULT_DICE, null);
            }
            case LOOKUP_RULE -> new IntentResult.LookupRule(reason, request);
            case QUESTION -> new IntentResult.Question(reason, request);
            case GREETING -> new IntentResult.Greeting(reason, suggested);
            case GOODBYE -> new IntentResult.Goodbye(reason);
            case SEARCH_MESSAGES -> {
                String query = text(json, "searchQuery");
                yield new IntentResult.SearchMessages(reason, query != null ? query : request);
            }
            case POST_TO_CHANNEL -> {
                String channel = text(json, "channelName");
                yield channel == null
                        ? new IntentResult.Other(reason, request, suggested)
                        : new IntentResult.PostToChannel(reason, channel, text(json, "content"));
            }
            case OTHER -> new IntentResult.Other(reason, request, suggested);
        };
    }

    /**
     * @return trimmed string value, or null when absent, JSON null, blank or the literal "null"
     */
    private static String text(JSONObject json, String key) {
        if (!json.has(key) || json.isNull(key)) {
            return null;
        }
        String value = String.valueOf(json.get(key)).trim();
        return value.isEmpty() || "null".equalsIgnoreCase(value) ? null : value;
    }
}
