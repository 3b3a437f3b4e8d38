package com.critfumble.fumblebot.service.provider;

import com.critfumble.fumblebot.config.properties.ProviderProperties;
import com.critfumble.fumblebot.exception.ProviderUnavailableException;
import com.critfumble.fumblebot.service.stt.TranscriptionProvider;
import com.critfumble.fumblebot.service.tts.SpeechSynthesizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Chooses the transcription and speech providers for a session.
 *
 * <p><b>Selection Algorithm</b> (same for both kinds):
 * <ol>
 *   <li>If a provider is named explicitly and it is available, use it</li>
 *   <li>If the named provider is missing or unavailable, log and fall through to auto-detect</li>
 *   <li>Auto-detect: the first available provider in the configured preference order</li>
 *   <li>Then any other available provider, in registration order</li>
 * </ol>
 *
 * <p>No available transcription provider is fatal to session start. No available speech provider
 * means the session answers in text only.
 *
 * <p>Selection runs once per session start; availability is not re-checked per event.
 */
@Component
public class ProviderSelector {

    private static final Logger LOG = LogManager.getLogger(ProviderSelector.class);

    static final String TRANSCRIPTION = "transcription";
    static final String SPEECH = "speech";

    private final List<TranscriptionProvider> transcriptionProviders;
    private final List<SpeechSynthesizer> speechSynthesizers;
    private final ProviderProperties properties;

    @Autowired
    public ProviderSelector(ObjectProvider<TranscriptionProvider> transcriptionProviders,
                            ObjectProvider<SpeechSynthesizer> speechSynthesizers,
                            ProviderProperties properties) {
        this(transcriptionProviders.orderedStream().toList(),
                speechSynthesizers.orderedStream().toList(),
                properties);
    }

    public ProviderSelector(List<TranscriptionProvider> transcriptionProviders,
                            List<SpeechSynthesizer> speechSynthesizers,
                            ProviderProperties properties) {
        this.transcriptionProviders = List.copyOf(transcriptionProviders);
        this.speechSynthesizers = List.copyOf(speechSynthesizers);
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
    }

    /**
     * Selects both providers.
     *
     * @return selection with a transcription provider and an optional speech synthesizer
     * @throws ProviderUnavailableException if no transcription provider is available
     */
    public ProviderSelection select() {
        TranscriptionProvider transcription = selectTranscription();
        SpeechSynthesizer speech = selectSpeech().orElse(null);
        LOG.info("Selected providers: transcription={}, speech={}",
                transcription.name(), speech != null ? speech.name() : "none (text only)");
        return new ProviderSelection(transcription, speech);
    }

    /**
     * @throws ProviderUnavailableException if no transcription provider is available
     */
    public TranscriptionProvider selectTranscription() {
        return choose(TRANSCRIPTION, properties.getTranscription(), properties.getTranscriptionPreference(),
                transcriptionProviders, TranscriptionProvider::name, TranscriptionProvider::isAvailable)
                .orElseThrow(() -> new ProviderUnavailableException(TRANSCRIPTION, properties.getTranscription()));
    }

    public Optional<SpeechSynthesizer> selectSpeech() {
        Optional<SpeechSynthesizer> speech = choose(SPEECH, properties.getSpeech(), properties.getSpeechPreference(),
                speechSynthesizers, SpeechSynthesizer::name, SpeechSynthesizer::isAvailable);
        if (speech.isEmpty()) {
            LOG.warn("No speech provider available; responses will be text only");
        }
        return speech;
    }

    /**
     * @return true if at least one transcription provider reports itself available
     */
    public boolean hasAvailableTranscription() {
        return transcriptionProviders.stream().anyMatch(TranscriptionProvider::isAvailable);
    }

    public boolean hasAvailableSpeech() {
        return speechSynthesizers.stream().anyMatch(SpeechSynthesizer::isAvailable);
    }

    private static <T> Optional<T> choose(String kind,
                                          String requested,
                                          List<String> preference,
                                          List<T> candidates,
                                          Function<T, String> nameOf,
                                          Predicate<T> available) {
        if (requested != null && !ProviderProperties.AUTO.equalsIgnoreCase(requested)) {
            Optional<T> named = byName(candidates, nameOf, requested);
            if (named.isPresent() && isAvailable(named.get(), available, nameOf)) {
                LOG.debug("Using configured {} provider {}", kind, requested);
                return named;
            }
            LOG.warn("Configured {} provider '{}' is {}; falling back to auto-detect",
                    kind, requested, named.isPresent() ? "unavailable" : "not registered");
        }

        List<T> ordered = new ArrayList<>();
        for (String name : preference) {
            byName(candidates, nameOf, name).ifPresent(ordered::add);
        }
        for (T candidate : candidates) {
            if (!ordered.contains(candidate)) {
                ordered.add(candidate);
            }
        }
        for (T candidate : ordered) {
            if (isAvailable(candidate, available, nameOf)) {
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    private static <T> Optional<T> byName(List<T> candidates, Function<T, String> nameOf, String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        return candidates.stream()
                .filter(c -> wanted.equals(nameOf.apply(c).toLowerCase(Locale.ROOT)))
                .findFirst();
    }

    private static <T> boolean isAvailable(T candidate, Predicate<T> available, Function<T, String> nameOf) {
        try {
            return available.test(candidate);
        } catch (RuntimeException e) {
            LOG.warn("Availability check failed for provider {}: {}", nameOf.apply(candidate), e.getMessage());
            return false;
        }
    }
}
