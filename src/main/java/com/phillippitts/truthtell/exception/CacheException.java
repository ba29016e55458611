package com.phillippitts.truthtell.exception;

import com.phillippitts.truthtell.service.cache.CacheNamespace;

/**
 * Thrown by the expiring cache on misuse (unknown namespace, null key).
 * Callers treat it as non-fatal and fall back to uncached behavior.
 */
public class CacheException extends TruthTellException {

    private final CacheNamespace namespace;

    public CacheException(String message, CacheNamespace namespace) {
        super(message + " (namespace: " + namespace + ")");
        this.namespace = namespace;
    }

    public CacheNamespace getNamespace() {
        return namespace;
    }
}
