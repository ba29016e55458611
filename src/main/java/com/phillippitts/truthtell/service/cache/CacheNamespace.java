package com.phillippitts.truthtell.service.cache;

/**
 * Fixed namespaces of the {@link ExpiringCache}.
 */
public enum CacheNamespace {
    /** Credibility analysis results keyed by text prefix. */
    ANALYSIS,
    /** Downloaded audio staged for one-shot transcription. */
    AUDIO
}
