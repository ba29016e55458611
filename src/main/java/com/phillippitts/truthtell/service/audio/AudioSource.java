package com.phillippitts.truthtell.service.audio;

/**
 * Produces audio for a source identifier (typically a stream or video URL).
 *
 * <p>Codec handling is the producer's concern; consumers treat chunks as opaque bytes.
 */
public interface AudioSource {

    /**
     * Starts streaming audio for {@code sourceId} to {@code listener}.
     *
     * @return handle used to stop the producer
     * @throws com.phillippitts.truthtell.exception.ProducerException if the producer cannot be started
     */
    AudioStreamHandle start(String sourceId, AudioChunkListener listener);

    /**
     * Downloads the complete audio of a recorded (non-live) source.
     *
     * @return encoded audio bytes
     * @throws com.phillippitts.truthtell.exception.ProducerException if the download fails
     */
    byte[] download(String sourceId);
}
