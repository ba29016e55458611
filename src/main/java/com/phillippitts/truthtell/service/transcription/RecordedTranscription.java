package com.phillippitts.truthtell.service.transcription;

import com.phillippitts.truthtell.domain.AnalysisResult;

/**
 * Result of transcribing and scoring a complete recording.
 */
public record RecordedTranscription(String text, String platform, AnalysisResult analysis) { }
