package com.phillippitts.truthtell.service.audio;

import com.phillippitts.truthtell.config.properties.AudioSourceProperties;
import com.phillippitts.truthtell.exception.ProducerException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static com.phillippitts.truthtell.service.audio.AudioTestDoubles.StubProcessFactory;
import static com.phillippitts.truthtell.service.audio.AudioTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

class YtDlpAudioSourceTest {

    private static final String URL = "https://www.youtube.com/watch?v=live123";

    private AudioSourceProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AudioSourceProperties();
        properties.setReadBufferBytes(4);
        properties.setChunkDuration(Duration.ofMillis(500));
    }

    @Test
    void buildsLiveCommandWithLiveFromStart() {
        YtDlpAudioSource source = new YtDlpAudioSource(properties, command -> null);

        List<String> cmd = source.buildCommand(URL, true);

        assertThat(cmd).containsExactly("yt-dlp", "-x", "--audio-format", "mp3", "--output", "-",
                "--no-playlist", "--live-from-start", URL);
    }

    @Test
    void buildsDownloadCommandWithoutLiveFlag() {
        properties.setBinary("/opt/bin/yt-dlp");
        properties.setAudioFormat("wav");
        YtDlpAudioSource source = new YtDlpAudioSource(properties, command -> null);

        List<String> cmd = source.buildCommand(URL, false);

        assertThat(cmd).startsWith("/opt/bin/yt-dlp").contains("wav").doesNotContain("--live-from-start");
        assertThat(cmd.get(cmd.size() - 1)).isEqualTo(URL);
    }

    @Test
    void deliversStdoutAsChunksThenCompletes() {
        // Arrange
        TestProcess process = new TestProcess("abcdefghij".getBytes(StandardCharsets.UTF_8), 0, false);
        YtDlpAudioSource source = new YtDlpAudioSource(properties, new StubProcessFactory(process));
        RecordingListener listener = new RecordingListener();

        // Act
        source.start(URL, listener);

        // Assert
        await().atMost(2, TimeUnit.SECONDS).until(() -> listener.completed.get() == 1);
        assertThat(listener.joined()).isEqualTo("abcdefghij");
        assertThat(listener.chunks).allSatisfy(chunk -> assertThat(chunk.length).isLessThanOrEqualTo(4));
        assertThat(listener.durations).containsOnly(Duration.ofMillis(500));
        assertThat(listener.errors).isEmpty();
    }

    @Test
    void reportsNonZeroExitAsProducerError() {
        // Arrange
        TestProcess process = new TestProcess(new byte[0], 1, false);
        YtDlpAudioSource source = new YtDlpAudioSource(properties, new StubProcessFactory(process));
        RecordingListener listener = new RecordingListener();

        // Act
        source.start(URL, listener);

        // Assert
        await().atMost(2, TimeUnit.SECONDS).until(() -> !listener.errors.isEmpty());
        assertThat(listener.errors.get(0))
                .hasMessageContaining("yt-dlp exited with code 1")
                .satisfies(e -> assertThat(e.getSourceId()).isEqualTo(URL));
        assertThat(listener.completed.get()).isZero();
    }

    @Test
    void stopDestroysProcessAndSuppressesCallbacks() {
        // Arrange
        TestProcess process = new TestProcess("live".getBytes(StandardCharsets.UTF_8), 0, true);
        YtDlpAudioSource source = new YtDlpAudioSource(properties, new StubProcessFactory(process));
        RecordingListener listener = new RecordingListener();
        AudioStreamHandle handle = source.start(URL, listener);
        await().atMost(2, TimeUnit.SECONDS).until(() -> !listener.chunks.isEmpty());

        // Act
        handle.stop();
        handle.stop();

        // Assert
        assertThat(process.wasDestroyCalled()).isTrue();
        assertThat(handle.isRunning()).isFalse();
        assertThat(listener.completed.get()).isZero();
        assertThat(listener.errors).isEmpty();
    }

    @Test
    void failsToStartWhenBinaryIsMissing() {
        YtDlpAudioSource source = new YtDlpAudioSource(properties, command -> {
            throw new IOException("No such file or directory");
        });

        assertThatThrownBy(() -> source.start(URL, new RecordingListener()))
                .isInstanceOf(ProducerException.class)
                .hasMessageContaining("Failed to start yt-dlp");
    }

    @Test
    void downloadReturnsWholeStdout() {
        // Arrange
        TestProcess process = new TestProcess("recorded-audio".getBytes(StandardCharsets.UTF_8), 0, false);
        StubProcessFactory factory = new StubProcessFactory(process);
        YtDlpAudioSource source = new YtDlpAudioSource(properties, factory);

        // Act
        byte[] audio = source.download(URL);

        // Assert
        assertThat(new String(audio, StandardCharsets.UTF_8)).isEqualTo("recorded-audio");
        assertThat(factory.commands.get(0)).doesNotContain("--live-from-start");
    }

    @Test
    void downloadFailsOnNonZeroExit() {
        TestProcess process = new TestProcess("partial".getBytes(StandardCharsets.UTF_8), 2, false);
        YtDlpAudioSource source = new YtDlpAudioSource(properties, new StubProcessFactory(process));

        assertThatThrownBy(() -> source.download(URL))
                .isInstanceOf(ProducerException.class)
                .hasMessageContaining("Download failed with code 2");
    }

    @Test
    void downloadFailsWhenAudioExceedsLimit() {
        properties.setMaxDownloadBytes(8);
        TestProcess process = new TestProcess("0123456789abcdef".getBytes(StandardCharsets.UTF_8), 0, false);
        YtDlpAudioSource source = new YtDlpAudioSource(properties, new StubProcessFactory(process));

        assertThatThrownBy(() -> source.download(URL))
                .isInstanceOf(ProducerException.class)
                .hasMessageContaining("exceeds 8 bytes");
    }

    @Test
    void downloadTimesOutWhenStdoutStalls() {
        // Arrange
        properties.setDownloadTimeout(Duration.ofMillis(200));
        TestProcess process = new TestProcess(new byte[]{1, 2, 3}, 0, true);
        YtDlpAudioSource source = new YtDlpAudioSource(properties, new StubProcessFactory(process));

        // Act & Assert
        assertTimeoutPreemptively(Duration.ofSeconds(3), () ->
                assertThatThrownBy(() -> source.download(URL))
                        .isInstanceOf(ProducerException.class)
                        .hasMessageContaining("timed out"));
        assertThat(process.wasDestroyCalled()).isTrue();
    }

    private static final class RecordingListener implements AudioChunkListener {
        final List<byte[]> chunks = new CopyOnWriteArrayList<>();
        final List<Duration> durations = new CopyOnWriteArrayList<>();
        final List<ProducerException> errors = new CopyOnWriteArrayList<>();
        final AtomicInteger completed = new AtomicInteger();

        @Override
        public void onChunk(byte[] payload, Duration duration) {
            chunks.add(payload);
            durations.add(duration);
        }

        @Override
        public void onError(ProducerException error) {
            errors.add(error);
        }

        @Override
        public void onComplete() {
            completed.incrementAndGet();
        }

        String joined() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            chunks.forEach(out::writeBytes);
            return out.toString(StandardCharsets.UTF_8);
        }
    }
}
