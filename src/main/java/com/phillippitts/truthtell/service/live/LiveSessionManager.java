package com.phillippitts.truthtell.service.live;

import com.phillippitts.truthtell.config.properties.LiveStreamProperties;
import com.phillippitts.truthtell.exception.ProducerException;
import com.phillippitts.truthtell.exception.SessionLimitException;
import com.phillippitts.truthtell.service.audio.AudioSource;
import com.phillippitts.truthtell.service.audio.PlatformDetector;
import com.phillippitts.truthtell.service.cache.ExpiringCache;
import com.phillippitts.truthtell.service.credibility.CredibilityAnalyzer;
import com.phillippitts.truthtell.service.live.message.StatusMessage;
import com.phillippitts.truthtell.service.metrics.PipelineMetrics;
import com.phillippitts.truthtell.service.transcription.TranscriptionClient;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Owns the live sessions, at most one per client connection.
 *
 * <p>Starting a session on a connection that already has one closes the old session first.
 * On application shutdown every session is closed and the shared cache is cleared.
 */
@Component
public class LiveSessionManager {

    private static final Logger LOG = LogManager.getLogger(LiveSessionManager.class);

    private final Map<String, LiveSession> sessions = new ConcurrentHashMap<>();

    private final AudioSource audioSource;
    private final TranscriptionClient transcriptionClient;
    private final CredibilityAnalyzer analyzer;
    private final Executor transcriptionExecutor;
    private final LiveStreamProperties properties;
    private final PipelineMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final ExpiringCache cache;
    private final Clock clock;

    public LiveSessionManager(AudioSource audioSource,
                              TranscriptionClient transcriptionClient,
                              CredibilityAnalyzer analyzer,
                              @Qualifier("transcriptionExecutor") Executor transcriptionExecutor,
                              LiveStreamProperties properties,
                              PipelineMetrics metrics,
                              ApplicationEventPublisher publisher,
                              ExpiringCache cache,
                              Clock clock) {
        this.audioSource = audioSource;
        this.transcriptionClient = transcriptionClient;
        this.analyzer = analyzer;
        this.transcriptionExecutor = transcriptionExecutor;
        this.properties = properties;
        this.metrics = metrics;
        this.publisher = publisher;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * Starts a live session for a connection, replacing any session it already runs.
     *
     * @param connectionId client connection identifier
     * @param request      source URL and language
     * @param sink         outbound channel of the connection
     * @return the started session
     * @throws com.phillippitts.truthtell.exception.InvalidRequestException if the URL is malformed
     * @throws ProducerException if the audio producer cannot be started
     * @throws SessionLimitException if {@code live.max-sessions} other sessions are running
     */
    public synchronized LiveSession start(String connectionId, StartLiveRequest request, LiveSessionSink sink) {
        String platform = PlatformDetector.detect(request.url());
        if (!sessions.containsKey(connectionId) && sessions.size() >= properties.getMaxSessions()) {
            LOG.warn("Live session refused on connection {}: {} sessions running", connectionId, sessions.size());
            throw new SessionLimitException(properties.getMaxSessions());
        }
        if (close(connectionId)) {
            LOG.info("Replacing running live session on connection {}", connectionId);
        }

        String sessionId = UUID.randomUUID().toString();
        StreamProcessorBuilder processorBuilder = StreamProcessorBuilder.builder()
                .language(request.language())
                .buffer(new SlidingWindowBuffer(properties.getWindow(), properties.getMinFlushInterval(),
                        properties.getMinSegmentDuration(), clock))
                .maxQueuedSegments(properties.getMaxQueuedSegments())
                .transcriptionClient(transcriptionClient)
                .analyzer(analyzer)
                .sink(sink)
                .drainExecutor(transcriptionExecutor)
                .metrics(metrics);
        LiveSession session = new LiveSession(sessionId, connectionId, request.url(), platform,
                processorBuilder, publisher, clock, this::deregister);

        sessions.put(connectionId, session);
        try {
            session.start(audioSource);
        } catch (ProducerException e) {
            session.close();
            throw e;
        }

        LOG.info("Started live session {} for {} (language={})", sessionId, platform, request.language());
        session.sendNotice(new StatusMessage("Live stream processing started for " + platform, platform));
        return session;
    }

    private void deregister(LiveSession session) {
        sessions.remove(session.connectionId(), session);
    }

    /**
     * Closes the session running on a connection, if any.
     *
     * @return {@code true} if a session was closed
     */
    public boolean close(String connectionId) {
        LiveSession session = sessions.remove(connectionId);
        if (session == null) {
            return false;
        }
        session.close();
        return true;
    }

    public Optional<LiveSession> find(String connectionId) {
        return Optional.ofNullable(sessions.get(connectionId));
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    /**
     * Closes every session and clears the cache.
     */
    @PreDestroy
    public void shutdown() {
        List<LiveSession> open = new ArrayList<>(sessions.values());
        LOG.info("Shutting down {} live session(s)", open.size());
        for (LiveSession session : open) {
            session.close();
        }
        sessions.clear();
        cache.clear();
    }
}
