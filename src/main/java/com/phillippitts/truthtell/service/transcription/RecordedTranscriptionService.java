package com.phillippitts.truthtell.service.transcription;

import com.phillippitts.truthtell.config.properties.CacheProperties;
import com.phillippitts.truthtell.domain.AnalysisResult;
import com.phillippitts.truthtell.exception.TranscriptionException;
import com.phillippitts.truthtell.service.audio.AudioSource;
import com.phillippitts.truthtell.service.audio.PlatformDetector;
import com.phillippitts.truthtell.service.cache.CacheNamespace;
import com.phillippitts.truthtell.service.cache.ExpiringCache;
import com.phillippitts.truthtell.service.credibility.CredibilityAnalyzer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One-shot transcription of a recorded (non-live) video.
 *
 * <p>The downloaded audio is staged in {@link CacheNamespace#AUDIO} for the duration of the
 * request and deleted afterwards, whether or not transcription succeeded. If the request dies
 * before the delete, the entry's TTL bounds how long it lingers.
 */
@Service
public class RecordedTranscriptionService {

    private static final Logger LOG = LogManager.getLogger(RecordedTranscriptionService.class);

    static final String RECORDED_VIDEO_TYPE = "recorded_video";

    private final AudioSource audioSource;
    private final TranscriptionClient transcriptionClient;
    private final CredibilityAnalyzer analyzer;
    private final ExpiringCache cache;
    private final CacheProperties cacheProperties;
    private final Clock clock;

    public RecordedTranscriptionService(AudioSource audioSource,
                                        TranscriptionClient transcriptionClient,
                                        CredibilityAnalyzer analyzer,
                                        ExpiringCache cache,
                                        CacheProperties cacheProperties,
                                        Clock clock) {
        this.audioSource = audioSource;
        this.transcriptionClient = transcriptionClient;
        this.analyzer = analyzer;
        this.cache = cache;
        this.cacheProperties = cacheProperties;
        this.clock = clock;
    }

    /**
     * Downloads, transcribes and scores a recording.
     *
     * @throws com.phillippitts.truthtell.exception.InvalidRequestException if the URL is malformed
     * @throws com.phillippitts.truthtell.exception.ProducerException if the download fails
     * @throws TranscriptionException if transcription fails or yields no text
     */
    public RecordedTranscription transcribe(String videoUrl, String language) {
        String platform = PlatformDetector.detect(videoUrl);
        byte[] audio = audioSource.download(videoUrl);

        String stagingKey = stagingKey(platform);
        cache.set(CacheNamespace.AUDIO, stagingKey, audio, cacheProperties.getAudioTtl());
        try {
            String handle = transcriptionClient.upload(audio);
            String text = transcriptionClient.transcribe(handle, language);
            if (text == null || text.isBlank()) {
                throw new TranscriptionException("Transcription returned no text", transcriptionClient.providerName());
            }

            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("type", RECORDED_VIDEO_TYPE);
            metadata.put("platform", platform);
            metadata.put("url", videoUrl);
            AnalysisResult analysis = analyzer.analyze(text, metadata);

            LOG.info("Recorded {} video transcribed ({} chars, verdict={})",
                    platform, text.length(), analysis.verdict().label());
            return new RecordedTranscription(text, platform, analysis);
        } finally {
            cache.delete(CacheNamespace.AUDIO, stagingKey);
        }
    }

    String stagingKey(String platform) {
        return platform + "-" + clock.millis() + "-" + UUID.randomUUID();
    }
}
