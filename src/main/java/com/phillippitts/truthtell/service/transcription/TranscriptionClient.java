package com.phillippitts.truthtell.service.transcription;

/**
 * External speech-to-text capability.
 *
 * <p>Transcription is a two-step exchange: the audio is uploaded once and the returned handle
 * is then submitted for transcription. Both calls block until the provider answers.
 *
 * <p>Implementations must be thread-safe; calls from different sessions may overlap.
 */
public interface TranscriptionClient {

    /**
     * Uploads audio bytes.
     *
     * @param audio encoded audio (must not be empty)
     * @return provider handle referencing the uploaded audio
     * @throws com.phillippitts.truthtell.exception.TranscriptionException if the upload fails
     */
    String upload(byte[] audio);

    /**
     * Transcribes previously uploaded audio.
     *
     * @param handle   value returned by {@link #upload(byte[])}
     * @param language language code, e.g. {@code en}
     * @return transcribed text, possibly empty if no speech was recognized
     * @throws com.phillippitts.truthtell.exception.TranscriptionException on provider error or timeout
     */
    String transcribe(String handle, String language);

    /**
     * Provider name used in logs, metrics and exception messages.
     */
    String providerName();
}
