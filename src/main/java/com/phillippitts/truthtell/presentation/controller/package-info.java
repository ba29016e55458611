/**
 * REST API controllers for the one-shot (non-live) HTTP surface.
 *
 * <ul>
 *   <li>{@code POST /api/analyze-text} - credibility analysis of client-supplied text</li>
 *   <li>{@code POST /api/transcribe-recorded} - download, transcribe and analyze a recorded video</li>
 *   <li>{@code POST /api/clear-cache} - run the cache expiry sweep</li>
 * </ul>
 *
 * <p>Controllers validate required fields and delegate to services; exceptions are mapped to
 * HTTP responses by {@code GlobalExceptionHandler}.
 *
 * @see com.phillippitts.truthtell.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.truthtell.presentation.controller;
