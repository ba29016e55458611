/**
 * Immutable domain model: audio segments and queue entries of the live pipeline,
 * credibility patterns, and analysis results.
 */
package com.phillippitts.truthtell.domain;
