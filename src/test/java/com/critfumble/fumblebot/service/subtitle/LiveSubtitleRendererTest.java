package com.critfumble.fumblebot.service.subtitle;

import com.critfumble.fumblebot.config.properties.SubtitleProperties;
import com.critfumble.fumblebot.domain.SessionMode;
import com.critfumble.fumblebot.domain.TranscriptEntry;
import com.critfumble.fumblebot.platform.TextChannelRef;
import com.critfumble.fumblebot.platform.VoiceChannelRef;
import com.critfumble.fumblebot.service.provider.ProviderSelection;
import com.critfumble.fumblebot.service.session.SessionRegistry;
import com.critfumble.fumblebot.service.session.VoiceSession;
import com.critfumble.fumblebot.testutil.FakeChatPlatform;
import com.critfumble.fumblebot.testutil.FakeTranscriptionProvider;
import com.critfumble.fumblebot.testutil.SyncExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

class LiveSubtitleRendererTest {

    private static final VoiceChannelRef VOICE = new VoiceChannelRef("g1", "vc1", "Table Voice");
    private static final TextChannelRef TEXT = new TextChannelRef("g1", "tc1", "table-chat");
    private static final long DEBOUNCE_MS = 100;

    private FakeChatPlatform platform;
    private SubtitleProperties properties;
    private ThreadPoolTaskScheduler scheduler;
    private LiveSubtitleRenderer renderer;
    private SessionRegistry registry;

    @BeforeEach
    void setUp() {
        platform = new FakeChatPlatform();
        properties = new SubtitleProperties();
        properties.setDebounceMs(DEBOUNCE_MS);
        properties.setCapacity(3);
        properties.setMaxLineLength(20);

        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("test-subtitle-");
        scheduler.initialize();

        renderer = new LiveSubtitleRenderer(platform, scheduler, properties);
        registry = new SessionRegistry(new SyncExecutor(), properties);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private VoiceSession startSession(TextChannelRef text) {
        return registry.start(VOICE, text, SessionMode.ASSISTANT, "admin",
                new ProviderSelection(new FakeTranscriptionProvider("deepgram", true), null), "", false);
    }

    private static TranscriptEntry entry(String name, String text) {
        return new TranscriptEntry("u-" + name, name, text, System.currentTimeMillis(), false);
    }

    @Test
    void burstOfEntriesProducesOneMessage() throws InterruptedException {
        // Arrange
        VoiceSession session = startSession(TEXT);

        // Act
        renderer.onEntry(session, entry("Alice", "I attack"));
        renderer.onEntry(session, entry("Bob", "I heal"));

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> platform.sent.size() == 1);
        Thread.sleep(DEBOUNCE_MS * 3);
        assertThat(platform.sent).hasSize(1);
        assertThat(platform.edits).isEmpty();
        assertThat(platform.contentsSentTo("tc1")).containsExactly(
                LiveSubtitleRenderer.HEADER + "\n**Alice**: I attack\n**Bob**: I heal");
    }

    @Test
    void renderRunsWithSessionLoggingContext() {
        // Arrange
        VoiceSession session = startSession(TEXT);

        // Act
        renderer.onEntry(session, entry("Alice", "I attack"));

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> platform.sent.size() == 1);
        assertThat(platform.sendGuildContexts).containsExactly("g1");
    }

    @Test
    void laterEntriesEditTheLiveMessage() {
        // Arrange
        VoiceSession session = startSession(TEXT);
        renderer.onEntry(session, entry("Alice", "one"));
        await().atMost(Duration.ofSeconds(2)).until(() -> platform.sent.size() == 1);

        // Act
        renderer.onEntry(session, entry("Bob", "two"));

        // Assert
        await().atMost(Duration.ofSeconds(2)).until(() -> platform.edits.size() == 1);
        assertThat(platform.edits.get(0).ref()).isEqualTo(platform.sent.get(0).ref());
        assertThat(platform.edits.get(0).content()).endsWith("**Alice**: one\n**Bob**: two");
        assertThat(platform.sent).hasSize(1);
    }

    @Test
    void windowEvictsOldestLines() {
        VoiceSession session = startSession(TEXT);
        for (int i = 1; i <= 5; i++) {
            session.subtitles().append("line " + i);
        }

        renderer.flush(session);

        assertThat(platform.contentsSentTo("tc1"))
                .containsExactly(LiveSubtitleRenderer.HEADER + "\nline 3\nline 4\nline 5");
    }

    @Test
    void failedEditSendsReplacementInSameRender() {
        // Arrange
        VoiceSession session = startSession(TEXT);
        session.subtitles().append("first");
        renderer.flush(session);
        platform.failEdits(true);
        session.subtitles().append("second");

        // Act
        renderer.flush(session);

        // Assert
        assertThat(platform.sent).hasSize(2);
        assertThat(session.subtitles().message()).isEqualTo(platform.sent.get(1).ref());
        assertThat(platform.sent.get(1).message().content()).endsWith("first\nsecond");
    }

    @Test
    void cancelStopsPendingAndFutureRenders() throws InterruptedException {
        // Arrange
        VoiceSession session = startSession(TEXT);
        renderer.onEntry(session, entry("Alice", "hello"));

        // Act
        renderer.cancel(session);
        renderer.onEntry(session, entry("Bob", "still here"));
        Thread.sleep(DEBOUNCE_MS * 3);

        // Assert
        assertThat(platform.sent).isEmpty();
        assertThat(session.subtitles().hasPending()).isFalse();
    }

    @Test
    void closingSessionIsNotRendered() {
        VoiceSession session = startSession(TEXT);
        session.subtitles().append("late");

        registry.stop("g1", renderer::flush);

        assertThat(platform.sent).isEmpty();
    }

    @Test
    void sessionWithoutTextChannelOrDisabledSubtitlesIsIgnored() {
        VoiceSession noChannel = startSession(null);
        renderer.onEntry(noChannel, entry("Alice", "hi"));
        assertThat(noChannel.subtitles().lines()).isEmpty();

        registry.stop("g1", s -> { });
        properties.setEnabled(false);
        VoiceSession disabled = startSession(TEXT);
        renderer.onEntry(disabled, entry("Alice", "hi"));
        assertThat(disabled.subtitles().lines()).isEmpty();
    }

    @Test
    void formatLineMarksCommandsAndTruncates() {
        TranscriptEntry command = new TranscriptEntry("u1", "Alice", "hey fumblebot roll", 0, true);
        TranscriptEntry longLine = entry("Bob", "this line is far longer than twenty characters");

        assertThat(renderer.formatLine(command)).isEqualTo("🎤 **Alice**: hey fumblebot roll");
        assertThat(renderer.formatLine(longLine)).isEqualTo("**Bob**: this line is far lon...");
    }
}
