/**
 * Application-specific exception hierarchy.
 *
 * <p>Every exception extends {@link com.phillippitts.truthtell.exception.TruthTellException}:
 * <ul>
 *   <li>{@link com.phillippitts.truthtell.exception.ProducerException} - audio source failed or ended abnormally</li>
 *   <li>{@link com.phillippitts.truthtell.exception.TranscriptionException} - external transcription failed or returned no text</li>
 *   <li>{@link com.phillippitts.truthtell.exception.AnalysisException} - credibility scoring failed</li>
 *   <li>{@link com.phillippitts.truthtell.exception.CacheException} - cache misuse; callers degrade to no caching</li>
 *   <li>{@link com.phillippitts.truthtell.exception.SinkException} - live client connection can no longer receive messages</li>
 *   <li>{@link com.phillippitts.truthtell.exception.InvalidRequestException} - malformed client input (HTTP 400)</li>
 * </ul>
 *
 * <p>Producer, transcription and analysis failures are converted into {@code error} messages
 * per segment by the live pipeline. Sink failures end the session. At the REST boundary the
 * {@code GlobalExceptionHandler} maps them to HTTP status codes.
 */
package com.phillippitts.truthtell.exception;
