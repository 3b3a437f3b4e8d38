package com.critfumble.fumblebot.service.action;

import com.critfumble.fumblebot.config.properties.LlmProperties;
import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.domain.IntentResult;
import com.critfumble.fumblebot.domain.ResponsePair;
import com.critfumble.fumblebot.domain.Utterance;
import com.critfumble.fumblebot.platform.ChatPlatform;
import com.critfumble.fumblebot.platform.OutgoingMessage;
import com.critfumble.fumblebot.platform.TextChannelRef;
import com.critfumble.fumblebot.service.llm.LlmClient;
import com.critfumble.fumblebot.service.metrics.VoiceSessionMetrics;
import com.critfumble.fumblebot.service.session.SessionTerminator;
import com.critfumble.fumblebot.service.session.VoiceSession;
import com.critfumble.fumblebot.service.transcript.SessionSummarizer;
import com.critfumble.fumblebot.util.SpokenText;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Lazy;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Executes a resolved intent and produces the answer as a {@link ResponsePair}.
 *
 * <p>Every call into a collaborator (dice roller, message search, channel posting, language model) is
 * wrapped: a failure becomes an apology pair, never an exception. An empty result means the bot
 * decided not to respond.
 *
 * <p>{@link SessionTerminator} is injected lazily because the orchestrator that implements it depends,
 * through the transcription pipeline, on this dispatcher.
 */
@Service
public class ActionDispatcher {

    private static final Logger LOG = LogManager.getLogger(ActionDispatcher.class);

    static final int SEARCH_LIMIT = 5;

    static final String ANSWER_SYSTEM_PROMPT = """
            You are %s, a friendly assistant for a tabletop RPG group, answering by voice during play.
            Answer in one to three short sentences. Be accurate about game rules; say so when unsure.""";

    static final String SEARCH_SYSTEM_PROMPT = """
            You condense chat search results into a spoken answer of one to three sentences.
            Only use the messages given. No markdown.""";

    static final String DICE_APOLOGY = "Sorry, I couldn't roll that.";
    static final String SEARCH_APOLOGY = "Sorry, I couldn't search the messages right now.";
    static final String ANSWER_APOLOGY = "Sorry, I couldn't come up with an answer right now.";
    static final String SEARCH_UNAVAILABLE = "Message search isn't available here.";

    private final DiceRoller diceRoller;
    private final ObjectProvider<MessageSearch> messageSearch;
    private final ChannelResolver channelResolver;
    private final ChatPlatform chatPlatform;
    private final LlmClient llm;
    private final SessionSummarizer summarizer;
    private final SessionTerminator terminator;
    private final VoiceProperties voiceProperties;
    private final LlmProperties llmProperties;
    private final VoiceSessionMetrics metrics;

    public ActionDispatcher(DiceRoller diceRoller,
                            ObjectProvider<MessageSearch> messageSearch,
                            ChannelResolver channelResolver,
                            ChatPlatform chatPlatform,
                            LlmClient llm,
                            SessionSummarizer summarizer,
                            @Lazy SessionTerminator terminator,
                            VoiceProperties voiceProperties,
                            LlmProperties llmProperties,
                            VoiceSessionMetrics metrics) {
        this.diceRoller = Objects.requireNonNull(diceRoller, "diceRoller must not be null");
        this.messageSearch = Objects.requireNonNull(messageSearch, "messageSearch must not be null");
        this.channelResolver = Objects.requireNonNull(channelResolver, "channelResolver must not be null");
        this.chatPlatform = Objects.requireNonNull(chatPlatform, "chatPlatform must not be null");
        this.llm = Objects.requireNonNull(llm, "llm must not be null");
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer must not be null");
        this.terminator = Objects.requireNonNull(terminator, "terminator must not be null");
        this.voiceProperties = Objects.requireNonNull(voiceProperties, "voiceProperties must not be null");
        this.llmProperties = Objects.requireNonNull(llmProperties, "llmProperties must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Executes the intent.
     *
     * @param session session the utterance belongs to
     * @param utterance the addressed utterance
     * @param result resolved intent
     * @return response pair, or empty when the bot stays silent
     */
    public Optional<ResponsePair> dispatch(VoiceSession session, Utterance utterance, IntentResult result) {
        if (!result.shouldRespond()) {
            return Optional.empty();
        }
        long start = System.nanoTime();
        try {
            return result.accept(new Handler(session, utterance));
        } catch (RuntimeException e) {
            LOG.error("Dispatch of intent {} failed unexpectedly", result.intent(), e);
            return Optional.of(ResponsePair.of(ANSWER_APOLOGY));
        } finally {
            metrics.recordDispatch(result.intent().wireName(), System.nanoTime() - start);
        }
    }

    static ResponsePair formatRoll(DiceRoll roll, String label) {
        StringBuilder display = new StringBuilder();
        if (label != null) {
            display.append("**").append(label).append("** ");
        } else {
            display.append("Rolling ");
        }
        display.append(roll.expression()).append(": [")
                .append(roll.rolls().stream().map(String::valueOf).collect(Collectors.joining(", ")))
                .append(']');
        if (roll.modifier() != 0) {
            display.append(' ').append(roll.modifier() > 0 ? "+" : "").append(roll.modifier());
        }
        display.append(" = **").append(roll.total()).append("**");

        String spoken = String.valueOf(roll.total());
        if (roll.isCritical()) {
            display.append(" Critical!");
            spoken += ", critical!";
        } else if (roll.isFumble()) {
            display.append(" Fumble!");
            spoken += ", fumble!";
        }
        return new ResponsePair(display.toString(), spoken);
    }

    static boolean isSummaryRequest(String content) {
        if (content == null) {
            return false;
        }
        String lower = content.toLowerCase(Locale.ROOT);
        return lower.contains("summary") || lower.contains("summarize") || lower.contains("recap");
    }

    /**
     * Per-call visitor carrying the session and utterance.
     */
    private final class Handler implements IntentResult.Visitor<Optional<ResponsePair>> {

        private final VoiceSession session;
        private final Utterance utterance;

        Handler(VoiceSession session, Utterance utterance) {
            this.session = session;
            this.utterance = utterance;
        }

        @Override
        public Optional<ResponsePair> notForBot(IntentResult.NotForBot result) {
            return Optional.empty();
        }

        @Override
        public Optional<ResponsePair> rollDice(IntentResult.RollDice result) {
            try {
                DiceRoll roll = diceRoller.roll(result.expression());
                return Optional.of(formatRoll(roll, result.label()));
            } catch (RuntimeException e) {
                LOG.warn("Dice roll failed for '{}': {}", result.expression(), e.getMessage());
                return Optional.of(ResponsePair.of(DICE_APOLOGY));
            }
        }

        @Override
        public Optional<ResponsePair> lookupRule(IntentResult.LookupRule result) {
            return answer(result.request());
        }

        @Override
        public Optional<ResponsePair> question(IntentResult.Question result) {
            return answer(result.request());
        }

        @Override
        public Optional<ResponsePair> greeting(IntentResult.Greeting result) {
            String text = result.suggestedResponse() != null && !result.suggestedResponse().isBlank()
                    ? result.suggestedResponse()
                    : voiceProperties.getGreetingFallback();
            return Optional.of(ResponsePair.of(text));
        }

        @Override
        public Optional<ResponsePair> goodbye(IntentResult.Goodbye result) {
            boolean stopped = terminator.stopIfActive(session.guildId());
            LOG.info("Goodbye command in guild {} (stopped={})", session.guildId(), stopped);
            return Optional.of(ResponsePair.of(voiceProperties.getFarewell()));
        }

        @Override
        public Optional<ResponsePair> searchMessages(IntentResult.SearchMessages result) {
            String query = result.query() != null ? result.query() : utterance.commandText();
            MessageSearch search = messageSearch.getIfAvailable();
            if (search == null) {
                return Optional.of(ResponsePair.of(SEARCH_UNAVAILABLE));
            }
            List<SearchHit> hits;
            try {
                hits = search.search(session.guildId(), query, SEARCH_LIMIT);
            } catch (RuntimeException e) {
                LOG.warn("Message search failed: {}", e.getMessage());
                metrics.incrementProviderFailure("search", "search");
                return Optional.of(ResponsePair.of(SEARCH_APOLOGY));
            }
            if (hits == null || hits.isEmpty()) {
                return Optional.of(ResponsePair.of("I couldn't find any messages about " + query + "."));
            }

            StringBuilder prompt = new StringBuilder("QUESTION: ").append(query).append("\n\nMESSAGES:\n");
            for (SearchHit hit : hits.subList(0, Math.min(SEARCH_LIMIT, hits.size()))) {
                prompt.append("- #").append(hit.channelName()).append(' ')
                        .append(hit.authorName()).append(": ").append(hit.content()).append('\n');
            }
            try {
                String condensed = llm.complete(prompt.toString(), SEARCH_SYSTEM_PROMPT,
                        llmProperties.getAnswerMaxTokens()).trim();
                if (condensed.isEmpty()) {
                    return Optional.of(ResponsePair.of(SEARCH_APOLOGY));
                }
                return Optional.of(new ResponsePair(condensed, SpokenText.fromMarkdown(condensed)));
            } catch (RuntimeException e) {
                LOG.warn("Search summarization failed: {}", e.getMessage());
                metrics.incrementProviderFailure("llm", "search");
                return Optional.of(ResponsePair.of(SEARCH_APOLOGY));
            }
        }

        @Override
        public Optional<ResponsePair> postToChannel(IntentResult.PostToChannel result) {
            Optional<TextChannelRef> target;
            try {
                target = channelResolver.resolve(session.guildId(), result.channelName());
            } catch (RuntimeException e) {
                LOG.warn("Channel lookup failed: {}", e.getMessage());
                return Optional.of(ResponsePair.of("Sorry, I couldn't look up the channels right now."));
            }
            if (target.isEmpty()) {
                return Optional.of(ResponsePair.of("I couldn't find a channel called " + result.channelName() + "."));
            }
            TextChannelRef channel = target.get();

            String content = result.content();
            if (isSummaryRequest(content)) {
                content = summarizer.summaryOrExcerpt(session.transcript());
            }
            if (content == null || content.isBlank()) {
                return Optional.of(ResponsePair.of("I'm not sure what to post."));
            }

            try {
                chatPlatform.sendMessage(channel.channelId(), OutgoingMessage.text(content));
            } catch (RuntimeException e) {
                LOG.warn("Posting to channel {} failed: {}", channel.name(), e.getMessage());
                return Optional.of(ResponsePair.of("Sorry, I couldn't post to #" + channel.name() + "."));
            }
            return Optional.of(new ResponsePair("Posted to #" + channel.name() + ".",
                    "Done, I posted it to " + channel.name() + "."));
        }

        @Override
        public Optional<ResponsePair> other(IntentResult.Other result) {
            if (result.request() != null && !result.request().isBlank()) {
                return answer(result.request());
            }
            if (result.suggestedResponse() != null && !result.suggestedResponse().isBlank()) {
                return Optional.of(ResponsePair.of(result.suggestedResponse()));
            }
            return Optional.empty();
        }

        private Optional<ResponsePair> answer(String request) {
            String question = request != null && !request.isBlank() ? request : utterance.commandText();
            if (question.isBlank()) {
                return Optional.empty();
            }
            try {
                String text = llm.complete(question,
                        String.format(ANSWER_SYSTEM_PROMPT, voiceProperties.canonicalBotName()),
                        llmProperties.getAnswerMaxTokens()).trim();
                if (text.isEmpty()) {
                    return Optional.of(ResponsePair.of(ANSWER_APOLOGY));
                }
                return Optional.of(new ResponsePair(text, SpokenText.fromMarkdown(text)));
            } catch (RuntimeException e) {
                LOG.warn("Answer generation failed: {}", e.getMessage());
                metrics.incrementProviderFailure("llm", "answer");
                return Optional.of(ResponsePair.of(ANSWER_APOLOGY));
            }
        }
    }
}
