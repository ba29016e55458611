package com.phillippitts.truthtell.service.audio;

import com.phillippitts.truthtell.config.properties.AudioSourceProperties;
import com.phillippitts.truthtell.exception.ProducerException;
import com.phillippitts.truthtell.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link AudioSource} backed by the {@code yt-dlp} command line tool.
 *
 * <p>CLI contract:
 * <pre>
 * ${binary} -x --audio-format ${format} --output - --no-playlist [--live-from-start] ${url}
 * </pre>
 * Audio is read from stdout; stderr carries progress output and is logged at DEBUG.
 *
 * <p><b>Live streaming:</b> a daemon reader thread turns every stdout read into one chunk and
 * delivers it to the listener. At end-of-stream the exit code decides between
 * {@link AudioChunkListener#onComplete()} and {@link AudioChunkListener#onError}. A stopped
 * producer delivers neither.
 *
 * <p><b>Recorded download:</b> stdout is read to the end on a reader thread, bounded by
 * {@code audio.source.max-download-bytes}, and returned once the process exits with code 0.
 * {@code audio.source.download-timeout} covers the whole read; on expiry the process is destroyed.
 */
@Component
public class YtDlpAudioSource implements AudioSource {

    private static final Logger LOG = LogManager.getLogger(YtDlpAudioSource.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final AudioSourceProperties properties;
    private final ProcessFactory processFactory;

    @Autowired
    public YtDlpAudioSource(AudioSourceProperties properties) {
        this(properties, new DefaultProcessFactory());
    }

    YtDlpAudioSource(AudioSourceProperties properties, ProcessFactory processFactory) {
        this.properties = Objects.requireNonNull(properties, "properties must not be null");
        this.processFactory = Objects.requireNonNull(processFactory, "processFactory must not be null");
    }

    @Override
    public AudioStreamHandle start(String sourceId, AudioChunkListener listener) {
        Objects.requireNonNull(sourceId, "sourceId must not be null");
        Objects.requireNonNull(listener, "listener must not be null");

        Process process = launch(sourceId, true);
        LiveProducer producer = new LiveProducer(sourceId, process, listener);
        producer.begin();
        LOG.info("Audio producer started (pid={})", safePid(process));
        return producer;
    }

    @Override
    public byte[] download(String sourceId) {
        Objects.requireNonNull(sourceId, "sourceId must not be null");

        Process process = launch(sourceId, false);
        Thread errReader = startDaemon(new ProgressLogger(process.getErrorStream()), "yt-dlp-err");
        DownloadReader download = new DownloadReader(process.getInputStream(), properties.getMaxDownloadBytes(), sourceId);
        Thread outReader = startDaemon(download, "yt-dlp-out");
        try {
            outReader.join(properties.getDownloadTimeout().toMillis());
            if (outReader.isAlive()) {
                throw new ProducerException("Download timed out after " + properties.getDownloadTimeout(), sourceId);
            }
            byte[] audio = download.result();
            boolean exited = process.waitFor(ProcessTimeouts.EXIT_CODE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited) {
                throw new ProducerException("Downloader did not exit after end of stream", sourceId);
            }
            int code = process.exitValue();
            if (code != 0 || audio.length == 0) {
                throw new ProducerException("Download failed with code " + code, sourceId);
            }
            LOG.info("Downloaded {} bytes of audio", audio.length);
            return audio;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProducerException("Interrupted while downloading audio", sourceId, e);
        } finally {
            destroyProcess(process);
            joinQuietly(outReader, ProcessTimeouts.READER_STOP_TIMEOUT);
            joinQuietly(errReader, ProcessTimeouts.READER_STOP_TIMEOUT);
        }
    }

    List<String> buildCommand(String sourceId, boolean live) {
        List<String> cmd = new ArrayList<>();
        cmd.add(properties.getBinary());
        cmd.add("-x");
        cmd.add("--audio-format");
        cmd.add(properties.getAudioFormat());
        cmd.add("--output");
        cmd.add("-");
        cmd.add("--no-playlist");
        if (live) {
            cmd.add("--live-from-start");
        }
        cmd.add(sourceId);
        return cmd;
    }

    private Process launch(String sourceId, boolean live) {
        List<String> command = buildCommand(sourceId, live);
        try {
            return processFactory.start(command);
        } catch (IOException e) {
            throw new ProducerException("Failed to start " + properties.getBinary() + ": " + e.getMessage(), sourceId, e);
        }
    }

    private static byte[] readBounded(InputStream in, long maxBytes, String sourceId) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] buf = new byte[8192];
        long total = 0;
        int n;
        while ((n = in.read(buf)) != -1) {
            total += n;
            if (total > maxBytes) {
                throw new ProducerException("Download exceeds " + maxBytes + " bytes", sourceId);
            }
            out.write(buf, 0, n);
        }
        return out.toByteArray();
    }

    private static Thread startDaemon(Runnable task, String prefix) {
        Map<String, String> context = ThreadContext.getImmutableContext();
        Thread thread = new Thread(() -> {
            if (context != null && !context.isEmpty()) {
                ThreadContext.putAll(context);
            }
            try {
                task.run();
            } finally {
                ThreadContext.clearAll();
            }
        }, prefix + "-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        thread.start();
        return thread;
    }

    private static void joinQuietly(Thread thread, Duration timeout) {
        if (thread == null || thread == Thread.currentThread()) {
            return;
        }
        try {
            thread.join(timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void destroyProcess(Process process) {
        if (!process.isAlive()) {
            return;
        }
        try {
            process.destroy();
            boolean exited = process.waitFor(ProcessTimeouts.GRACEFUL_SHUTDOWN_TIMEOUT.toMillis(),
                    TimeUnit.MILLISECONDS);
            if (!exited && process.isAlive()) {
                process.destroyForcibly();
                process.waitFor(ProcessTimeouts.FORCEFUL_SHUTDOWN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
                if (process.isAlive()) {
                    LOG.warn("Process still alive after destroyForcibly");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while destroying process");
        }
    }

    private static String safePid(Process process) {
        try {
            return String.valueOf(process.pid());
        } catch (UnsupportedOperationException e) {
            return "n/a";
        }
    }

    /**
     * Reads a whole download from stdout. The outcome is read by the caller once the thread ends.
     */
    private static final class DownloadReader implements Runnable {
        private final InputStream inputStream;
        private final long maxBytes;
        private final String sourceId;
        private volatile byte[] audio;
        private volatile ProducerException failure;

        DownloadReader(InputStream inputStream, long maxBytes, String sourceId) {
            this.inputStream = inputStream;
            this.maxBytes = maxBytes;
            this.sourceId = sourceId;
        }

        @Override
        public void run() {
            try (InputStream in = inputStream) {
                audio = readBounded(in, maxBytes, sourceId);
            } catch (ProducerException e) {
                failure = e;
            } catch (IOException e) {
                failure = new ProducerException("Failed to read audio: " + e.getMessage(), sourceId, e);
            }
        }

        byte[] result() {
            if (failure != null) {
                throw failure;
            }
            return audio == null ? new byte[0] : audio;
        }
    }

    /**
     * Drains a progress stream line by line into the DEBUG log.
     */
    private static final class ProgressLogger implements Runnable {
        private final InputStream inputStream;

        ProgressLogger(InputStream inputStream) {
            this.inputStream = inputStream;
        }

        @Override
        public void run() {
            try (BufferedReader br = new BufferedReader(new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = br.readLine()) != null) {
                    LOG.debug("yt-dlp: {}", line);
                }
            } catch (IOException e) {
                LOG.debug("Progress reader stopped: {}", e.toString());
            }
        }
    }

    /**
     * Running live producer: owns the process and its reader threads.
     */
    private final class LiveProducer implements AudioStreamHandle {
        private final String sourceId;
        private final Process process;
        private final AudioChunkListener listener;
        private volatile boolean stopped;
        private volatile Thread outReader;
        private volatile Thread errReader;

        LiveProducer(String sourceId, Process process, AudioChunkListener listener) {
            this.sourceId = sourceId;
            this.process = process;
            this.listener = listener;
        }

        void begin() {
            errReader = startDaemon(new ProgressLogger(process.getErrorStream()), "yt-dlp-err");
            outReader = startDaemon(this::readAudio, "yt-dlp-out");
        }

        private void readAudio() {
            byte[] buf = new byte[properties.getReadBufferBytes()];
            Duration chunkDuration = properties.getChunkDuration();
            try (InputStream in = process.getInputStream()) {
                int n;
                while (!stopped && (n = in.read(buf)) != -1) {
                    if (n > 0 && !stopped) {
                        listener.onChunk(Arrays.copyOf(buf, n), chunkDuration);
                    }
                }
            } catch (IOException e) {
                if (!stopped) {
                    listener.onError(new ProducerException("Failed to read audio: " + e.getMessage(), sourceId, e));
                }
                return;
            }
            if (!stopped) {
                reportExit();
            }
        }

        private void reportExit() {
            try {
                if (!process.waitFor(ProcessTimeouts.EXIT_CODE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS)) {
                    listener.onError(new ProducerException("Producer did not exit after end of stream", sourceId));
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            if (stopped) {
                return;
            }
            int code = process.exitValue();
            if (code == 0) {
                listener.onComplete();
            } else {
                listener.onError(new ProducerException("yt-dlp exited with code " + code, sourceId));
            }
        }

        @Override
        public void stop() {
            if (stopped) {
                return;
            }
            stopped = true;
            destroyProcess(process);
            joinQuietly(outReader, ProcessTimeouts.READER_STOP_TIMEOUT);
            joinQuietly(errReader, ProcessTimeouts.READER_STOP_TIMEOUT);
            LOG.info("Audio producer stopped");
        }

        @Override
        public boolean isRunning() {
            return !stopped && process.isAlive();
        }
    }
}
