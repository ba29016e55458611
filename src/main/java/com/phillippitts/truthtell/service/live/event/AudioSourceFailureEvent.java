package com.phillippitts.truthtell.service.live.event;

import java.time.Instant;

/**
 * Published when the audio producer of a live session fails.
 *
 * @param sessionId live session identifier
 * @param platform  platform of the failing source
 * @param reason    short failure description, without the source URL
 * @param at        failure time
 */
public record AudioSourceFailureEvent(String sessionId, String platform, String reason, Instant at) { }
