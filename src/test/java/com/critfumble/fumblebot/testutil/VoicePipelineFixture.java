package com.critfumble.fumblebot.testutil;

import com.critfumble.fumblebot.config.properties.LlmProperties;
import com.critfumble.fumblebot.config.properties.ProviderProperties;
import com.critfumble.fumblebot.config.properties.SubtitleProperties;
import com.critfumble.fumblebot.config.properties.VoiceProperties;
import com.critfumble.fumblebot.service.action.ActionDispatcher;
import com.critfumble.fumblebot.service.action.ChannelResolver;
import com.critfumble.fumblebot.service.action.DiceRoller;
import com.critfumble.fumblebot.service.action.MessageSearch;
import com.critfumble.fumblebot.service.action.StandardDiceRoller;
import com.critfumble.fumblebot.service.intent.FastIntentMatcher;
import com.critfumble.fumblebot.service.intent.IntentResolver;
import com.critfumble.fumblebot.service.intent.ModelIntentParser;
import com.critfumble.fumblebot.service.metrics.VoiceSessionMetrics;
import com.critfumble.fumblebot.service.occupancy.OccupancyWatcher;
import com.critfumble.fumblebot.service.orchestration.CommandHistory;
import com.critfumble.fumblebot.service.orchestration.VoiceSessionOrchestrator;
import com.critfumble.fumblebot.service.playback.PlaybackCoordinator;
import com.critfumble.fumblebot.service.provider.ProviderSelector;
import com.critfumble.fumblebot.service.session.SessionRegistry;
import com.critfumble.fumblebot.service.subtitle.LiveSubtitleRenderer;
import com.critfumble.fumblebot.service.transcript.SessionSummarizer;
import com.critfumble.fumblebot.service.transcript.TranscriptExporter;
import com.critfumble.fumblebot.service.transcript.TranscriptMarkdownExporter;
import com.critfumble.fumblebot.service.transcript.TranscriptRecorder;
import com.critfumble.fumblebot.service.transcription.ListeningService;
import com.critfumble.fumblebot.service.transcription.TranscriptionRouter;
import com.critfumble.fumblebot.service.transcription.WakePhraseDetector;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.List;
import java.util.Random;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Wires the whole voice pipeline by hand over fakes.
 *
 * <p>Session queues and playback lanes run on {@link SyncExecutor}, so every call returns after its
 * effects are visible. Subtitles are disabled unless a test enables them before {@link #build()}.
 */
public class VoicePipelineFixture implements AutoCloseable {

    public final FakeChatPlatform platform = new FakeChatPlatform();
    public FakeTranscriptionProvider stt = new FakeTranscriptionProvider("deepgram", true);
    public FakeSpeechSynthesizer tts = new FakeSpeechSynthesizer("openai", true);
    public final FakeLlmClient llm = new FakeLlmClient();
    public final EventCapturingPublisher events = new EventCapturingPublisher();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    public final VoiceProperties voiceProperties = new VoiceProperties();
    public final SubtitleProperties subtitleProperties = new SubtitleProperties();
    public final LlmProperties llmProperties = new LlmProperties();

    public MessageSearch messageSearch;
    public DiceRoller diceRoller = new StandardDiceRoller(new Random(42));
    public boolean speechAvailable = true;

    public SessionRegistry registry;
    public VoiceSessionMetrics metrics;
    public ProviderSelector providerSelector;
    public LiveSubtitleRenderer subtitles;
    public TranscriptRecorder recorder;
    public SessionSummarizer summarizer;
    public TranscriptExporter exporter;
    public PlaybackCoordinator playback;
    public IntentResolver resolver;
    public ActionDispatcher dispatcher;
    public CommandHistory commandHistory;
    public TranscriptionRouter router;
    public ListeningService listening;
    public OccupancyWatcher occupancy;
    public VoiceSessionOrchestrator orchestrator;

    private ThreadPoolTaskScheduler scheduler;

    public VoicePipelineFixture() {
        subtitleProperties.setEnabled(false);
    }

    @SuppressWarnings("unchecked")
    public VoicePipelineFixture build() {
        SyncExecutor sync = new SyncExecutor();
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("test-subtitle-");
        scheduler.initialize();

        registry = new SessionRegistry(sync, subtitleProperties);
        metrics = new VoiceSessionMetrics(meterRegistry, registry);
        providerSelector = new ProviderSelector(List.of(stt),
                speechAvailable ? List.of(tts) : List.of(),
                new ProviderProperties(null, null, null, null));
        subtitles = new LiveSubtitleRenderer(platform, scheduler, subtitleProperties);
        recorder = new TranscriptRecorder(platform, subtitles, voiceProperties);
        summarizer = new SessionSummarizer(llm, voiceProperties, llmProperties);
        exporter = new TranscriptExporter(new TranscriptMarkdownExporter(voiceProperties), summarizer, platform,
                events);
        playback = new PlaybackCoordinator(sync, registry, platform, recorder, events, metrics);
        resolver = new IntentResolver(new FastIntentMatcher(voiceProperties), new ModelIntentParser(), llm,
                voiceProperties, llmProperties, metrics);

        ObjectProvider<MessageSearch> searchProvider = mock(ObjectProvider.class);
        when(searchProvider.getIfAvailable()).thenAnswer(invocation -> messageSearch);
        dispatcher = new ActionDispatcher(diceRoller, searchProvider, new ChannelResolver(platform), platform, llm,
                summarizer, guildId -> orchestrator.stopIfActive(guildId), voiceProperties, llmProperties, metrics);

        commandHistory = new CommandHistory(voiceProperties);
        router = new TranscriptionRouter(registry, new WakePhraseDetector(voiceProperties), resolver, dispatcher,
                playback, recorder, platform, commandHistory, events, metrics, voiceProperties);
        listening = new ListeningService(router);
        occupancy = new OccupancyWatcher(platform, registry, listening, events, metrics,
                guildId -> orchestrator.stopIfActive(guildId));
        occupancy.subscribe();
        orchestrator = new VoiceSessionOrchestrator(registry, providerSelector, platform, listening, playback,
                subtitles, exporter, commandHistory, events, voiceProperties);
        return this;
    }

    @Override
    public void close() {
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }
}
