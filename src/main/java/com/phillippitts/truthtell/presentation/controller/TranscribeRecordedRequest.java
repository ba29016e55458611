package com.phillippitts.truthtell.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of {@code POST /api/transcribe-recorded}.
 */
record TranscribeRecordedRequest(@JsonProperty("video_url") String videoUrl, String language) { }
