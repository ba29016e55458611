package com.phillippitts.truthtell.service.live;

import com.phillippitts.truthtell.config.properties.CredibilityProperties;
import com.phillippitts.truthtell.config.properties.LiveStreamProperties;
import com.phillippitts.truthtell.exception.InvalidRequestException;
import com.phillippitts.truthtell.exception.ProducerException;
import com.phillippitts.truthtell.exception.SessionLimitException;
import com.phillippitts.truthtell.service.cache.CacheNamespace;
import com.phillippitts.truthtell.service.cache.ExpiringCache;
import com.phillippitts.truthtell.service.credibility.DefaultCredibilityAnalyzer;
import com.phillippitts.truthtell.service.credibility.PatternTable;
import com.phillippitts.truthtell.service.credibility.SourceReliabilityPolicy;
import com.phillippitts.truthtell.service.live.event.AudioSourceFailureEvent;
import com.phillippitts.truthtell.service.live.message.ErrorMessage;
import com.phillippitts.truthtell.service.live.message.StatusMessage;
import com.phillippitts.truthtell.service.live.message.TranscriptionMessage;
import com.phillippitts.truthtell.service.metrics.PipelineMetrics;
import com.phillippitts.truthtell.testutil.EventCapturingPublisher;
import com.phillippitts.truthtell.testutil.FakeAudioSource;
import com.phillippitts.truthtell.testutil.FakeTranscriptionClient;
import com.phillippitts.truthtell.testutil.MutableClock;
import com.phillippitts.truthtell.testutil.RecordingSink;
import com.phillippitts.truthtell.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LiveSessionManagerTest {

    private static final String YOUTUBE_URL = "https://www.youtube.com/watch?v=live123";

    private MutableClock clock;
    private FakeAudioSource audioSource;
    private FakeTranscriptionClient client;
    private EventCapturingPublisher publisher;
    private ExpiringCache cache;
    private LiveSessionManager manager;
    private RecordingSink sink;
    private LiveStreamProperties properties;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAtEpoch();
        audioSource = new FakeAudioSource();
        client = new FakeTranscriptionClient();
        publisher = new EventCapturingPublisher();
        cache = new ExpiringCache(clock);
        PipelineMetrics metrics = new PipelineMetrics(new SimpleMeterRegistry());
        CredibilityProperties credibility = new CredibilityProperties();
        DefaultCredibilityAnalyzer analyzer = new DefaultCredibilityAnalyzer(PatternTable.defaultRules(), cache,
                SourceReliabilityPolicy.from(credibility), credibility, metrics, clock);
        properties = new LiveStreamProperties();
        manager = new LiveSessionManager(audioSource, client, analyzer, new SyncExecutor(),
                properties, metrics, publisher, cache, clock);
        sink = new RecordingSink();
    }

    /** Delivers one chunk from the most recently started producer, after the flush interval. */
    private void pushChunk(String text) {
        clock.advance(Duration.ofSeconds(10));
        audioSource.lastHandle().listener().onChunk(text.getBytes(StandardCharsets.UTF_8), Duration.ofSeconds(1));
    }

    @Test
    void shouldStartSessionAndAnnouncePlatform() {
        // Act
        LiveSession session = manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);

        // Assert
        assertThat(session.platform()).isEqualTo("youtube");
        assertThat(manager.activeSessionCount()).isEqualTo(1);
        assertThat(manager.find("conn-1")).containsSame(session);
        assertThat(audioSource.lastHandle().sourceId()).isEqualTo(YOUTUBE_URL);
        assertThat(sink.messagesOfType(StatusMessage.class)).singleElement()
                .satisfies(m -> {
                    assertThat(m.message()).isEqualTo("Live stream processing started for youtube");
                    assertThat(m.platform()).isEqualTo("youtube");
                });
    }

    @Test
    void shouldDeliverTranscriptionsFromProducerChunks() {
        // Arrange
        manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);

        // Act
        pushChunk("experts say turnout is high");

        // Assert
        assertThat(sink.messagesOfType(TranscriptionMessage.class)).singleElement()
                .satisfies(m -> {
                    assertThat(m.text()).isEqualTo("experts say turnout is high");
                    assertThat(m.platform()).isEqualTo("youtube");
                });
    }

    @Test
    void shouldRefuseNewConnectionAtSessionLimit() {
        // Arrange
        properties.setMaxSessions(2);
        manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);
        manager.start("conn-2", new StartLiveRequest(YOUTUBE_URL, "en"), sink);

        // Act & Assert
        assertThatThrownBy(() -> manager.start("conn-3", new StartLiveRequest(YOUTUBE_URL, "en"), sink))
                .isInstanceOf(SessionLimitException.class)
                .hasMessageContaining("max 2");
        assertThat(manager.activeSessionCount()).isEqualTo(2);
        assertThat(audioSource.handles()).hasSize(2);
    }

    @Test
    void shouldAllowReplacementAtSessionLimit() {
        // Arrange
        properties.setMaxSessions(1);
        manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);

        // Act
        LiveSession replacement = manager.start("conn-1",
                new StartLiveRequest("https://www.tiktok.com/@news/live", "en"), sink);

        // Assert
        assertThat(manager.find("conn-1")).containsSame(replacement);
        assertThat(manager.activeSessionCount()).isEqualTo(1);
    }

    @Test
    void shouldAcceptNewConnectionOnceSessionIsClosed() {
        // Arrange
        properties.setMaxSessions(1);
        manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);
        manager.close("conn-1");

        // Act
        LiveSession session = manager.start("conn-2", new StartLiveRequest(YOUTUBE_URL, "en"), sink);

        // Assert
        assertThat(manager.find("conn-2")).containsSame(session);
    }

    @Test
    void shouldReplaceRunningSessionOnSecondStart() {
        // Arrange
        LiveSession first = manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);
        FakeAudioSource.FakeHandle firstHandle = audioSource.lastHandle();

        // Act
        LiveSession second = manager.start("conn-1",
                new StartLiveRequest("https://www.tiktok.com/@news/live", "en"), sink);

        // Assert
        assertThat(first.isClosed()).isTrue();
        assertThat(first.state()).isEqualTo(SessionState.CLOSED);
        assertThat(firstHandle.isStopped()).isTrue();
        assertThat(second.isClosed()).isFalse();
        assertThat(manager.activeSessionCount()).isEqualTo(1);
        assertThat(manager.find("conn-1")).containsSame(second);
    }

    @Test
    void shouldKeepSessionsOfDifferentConnectionsApart() {
        manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);
        manager.start("conn-2", new StartLiveRequest(YOUTUBE_URL, "fr"), new RecordingSink());

        assertThat(manager.activeSessionCount()).isEqualTo(2);
    }

    @Test
    void shouldCloseSessionAndStopProducer() {
        // Arrange
        LiveSession session = manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);

        // Act
        boolean closed = manager.close("conn-1");

        // Assert
        assertThat(closed).isTrue();
        assertThat(session.isClosed()).isTrue();
        assertThat(audioSource.lastHandle().isStopped()).isTrue();
        assertThat(manager.activeSessionCount()).isZero();
        assertThat(manager.close("conn-1")).isFalse();
    }

    @Test
    void shouldIgnoreChunksAfterClose() {
        // Arrange
        manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);
        manager.close("conn-1");

        // Act
        pushChunk("late audio");

        // Assert
        assertThat(sink.messagesOfType(TranscriptionMessage.class)).isEmpty();
        assertThat(client.transcribed()).isEmpty();
    }

    @Test
    void shouldRejectInvalidUrlWithoutStartingProducer() {
        assertThatThrownBy(() -> manager.start("conn-1", new StartLiveRequest("nonsense", "en"), sink))
                .isInstanceOf(InvalidRequestException.class);
        assertThat(audioSource.handles()).isEmpty();
        assertThat(manager.activeSessionCount()).isZero();
    }

    @Test
    void shouldNotRegisterSessionWhenProducerFailsToStart() {
        // Arrange
        audioSource.failOnStart();

        // Act & Assert
        assertThatThrownBy(() -> manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink))
                .isInstanceOf(ProducerException.class);
        assertThat(manager.activeSessionCount()).isZero();
        assertThat(sink.messages()).isEmpty();
    }

    @Test
    void shouldReportProducerFailureAndPublishEvent() {
        // Arrange
        LiveSession session = manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);

        // Act
        audioSource.lastHandle().listener().onError(new ProducerException("yt-dlp exited with code 1", YOUTUBE_URL));

        // Assert
        assertThat(sink.messagesOfType(ErrorMessage.class)).singleElement()
                .satisfies(m -> {
                    assertThat(m.error()).isEqualTo(LiveSession.SOURCE_FAILED);
                    assertThat(m.details()).contains("yt-dlp exited with code 1");
                });
        assertThat(publisher.eventsOfType(AudioSourceFailureEvent.class)).singleElement()
                .satisfies(e -> {
                    assertThat(e.sessionId()).isEqualTo(session.sessionId());
                    assertThat(e.platform()).isEqualTo("youtube");
                    assertThat(e.reason()).isEqualTo("producer-failed");
                });
        assertThat(session.isClosed()).isFalse();
    }

    @Test
    void shouldAnnounceEndOfStream() {
        // Arrange
        manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);

        // Act
        audioSource.lastHandle().listener().onComplete();

        // Assert
        assertThat(sink.messagesOfType(StatusMessage.class))
                .extracting(StatusMessage::message)
                .containsExactly("Live stream processing started for youtube", LiveSession.STREAM_ENDED);
    }

    @Test
    void shouldTearDownSessionWhenSinkFails() {
        // Arrange
        LiveSession session = manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);
        sink.failFromNowOn();

        // Act
        pushChunk("nobody is listening");

        // Assert
        assertThat(session.isClosed()).isTrue();
        assertThat(audioSource.lastHandle().isStopped()).isTrue();
        assertThat(manager.activeSessionCount()).isZero();
    }

    @Test
    void shouldCloseAllSessionsAndClearCacheOnShutdown() {
        // Arrange
        LiveSession first = manager.start("conn-1", new StartLiveRequest(YOUTUBE_URL, "en"), sink);
        LiveSession second = manager.start("conn-2", new StartLiveRequest(YOUTUBE_URL, "en"), new RecordingSink());
        cache.set(CacheNamespace.ANALYSIS, "k", "v", Duration.ofMinutes(1));

        // Act
        manager.shutdown();

        // Assert
        assertThat(first.isClosed()).isTrue();
        assertThat(second.isClosed()).isTrue();
        assertThat(audioSource.handles()).allMatch(FakeAudioSource.FakeHandle::isStopped);
        assertThat(manager.activeSessionCount()).isZero();
        assertThat(cache.size(CacheNamespace.ANALYSIS)).isZero();
    }
}
