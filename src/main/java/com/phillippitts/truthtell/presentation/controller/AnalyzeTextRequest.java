package com.phillippitts.truthtell.presentation.controller;

/**
 * Body of {@code POST /api/analyze-text}.
 */
record AnalyzeTextRequest(String text, String language) { }
