package com.critfumble.fumblebot.service.intent;

import com.critfumble.fumblebot.config.properties.LlmProperties;
import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.domain.IntentReason;
import com.critfumble.fumblebot.domain.IntentResult;
import com.critfumble.fumblebot.domain.TranscriptEntry;
import com.critfumble.fumblebot.domain.Utterance;
import com.critfumble.fumblebot.service.llm.LlmClient;
import com.critfumble.fumblebot.service.metrics.VoiceSessionMetrics;
import com.critfumble.fumblebot.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Two-stage intent classifier for addressed utterances.
 *
 * <ol>
 *   <li>Stage 1: {@link FastIntentMatcher}, no added latency</li>
 *   <li>Stage 2: the language model with a fixed instruction set and recent context</li>
 *   <li>Fallback when the model call fails or its output is unparseable: respond with
 *       {@code intent = other} only if the utterance names the bot</li>
 * </ol>
 *
 * <p>Never throws: a missed classification degrades to silence.
 */
@Service
public class IntentResolver {

    private static final Logger LOG = LogManager.getLogger(IntentResolver.class);

    private final FastIntentMatcher fastMatcher;
    private final ModelIntentParser modelParser;
    private final LlmClient llm;
    private final VoiceProperties voiceProperties;
    private final LlmProperties llmProperties;
    private final VoiceSessionMetrics metrics;

    public IntentResolver(FastIntentMatcher fastMatcher,
                          ModelIntentParser modelParser,
                          LlmClient llm,
                          VoiceProperties voiceProperties,
                          LlmProperties llmProperties,
                          VoiceSessionMetrics metrics) {
        this.fastMatcher = Objects.requireNonNull(fastMatcher, "fastMatcher must not be null");
        this.modelParser = Objects.requireNonNull(modelParser, "modelParser must not be null");
        this.llm = Objects.requireNonNull(llm, "llm must not be null");
        this.voiceProperties = Objects.requireNonNull(voiceProperties, "voiceProperties must not be null");
        this.llmProperties = Objects.requireNonNull(llmProperties, "llmProperties must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Runs both stages.
     *
     * @param utterance addressed utterance
     * @param speakerName display name of the speaker
     * @param context recent transcript entries, oldest first
     * @return resolved intent, never null
     */
    public ResolvedIntent resolve(Utterance utterance, String speakerName, List<TranscriptEntry> context) {
        Optional<IntentResult> fast = matchFast(utterance);
        if (fast.isPresent()) {
            return new ResolvedIntent(fast.get(), ResolutionStage.FAST);
        }
        return resolveWithModel(utterance, speakerName, context);
    }

    /**
     * Stage 1 only.
     */
    public Optional<IntentResult> matchFast(Utterance utterance) {
        try {
            Optional<IntentResult> result = fastMatcher.match(utterance.fullText(), utterance.commandText());
            result.ifPresent(r -> {
                LOG.debug("Stage 1 matched intent {}", r.intent());
                metrics.recordIntent(ResolutionStage.FAST.tag(), r.intent().wireName());
            });
            return result;
        } catch (RuntimeException e) {
            LOG.warn("Stage 1 matcher failed; continuing with model: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Stage 2 plus fallback.
     */
    public ResolvedIntent resolveWithModel(Utterance utterance, String speakerName, List<TranscriptEntry> context) {
        String botName = voiceProperties.canonicalBotName();
        String raw;
        try {
            raw = llm.complete(modelParser.userPrompt(speakerName, utterance.fullText(), context),
                    modelParser.systemPrompt(botName),
                    llmProperties.getIntentMaxTokens());
        } catch (RuntimeException e) {
            LOG.warn("Intent model call failed, using fallback: {}", e.getMessage());
            metrics.incrementProviderFailure("llm", "intent");
            return fallback(utterance);
        }

        Optional<IntentResult> parsed = modelParser.parse(raw);
        if (parsed.isEmpty()) {
            LOG.warn("Unparseable intent model output, using fallback: '{}'", LogSanitizer.preview(raw, 80));
            return fallback(utterance);
        }
        IntentResult result = parsed.get();
        metrics.recordIntent(ResolutionStage.MODEL.tag(),
                result.intent() != null ? result.intent().wireName() : "none");
        LOG.debug("Stage 2 resolved intent {} (reason={})", result.intent(), result.reason().wireName());
        return new ResolvedIntent(result, ResolutionStage.MODEL);
    }

    private ResolvedIntent fallback(Utterance utterance) {
        boolean named = fastMatcher.mentionsBot(utterance.fullText().toLowerCase(Locale.ROOT));
        IntentResult result = named
                ? new IntentResult.Other(IntentReason.WAKE_WORD, utterance.commandText(), null)
                : IntentResult.NotForBot.instance();
        metrics.recordIntent(ResolutionStage.FALLBACK.tag(),
                result.intent() != null ? result.intent().wireName() : "none");
        return new ResolvedIntent(result, ResolutionStage.FALLBACK);
    }
}
