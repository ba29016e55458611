package com.phillippitts.truthtell.service.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically removes expired entries from the {@link ExpiringCache}, independent of read traffic.
 * Interval is {@code cache.sweep-interval-ms} (default one hour).
 */
@Component
public class CacheSweeper {

    private static final Logger LOG = LogManager.getLogger(CacheSweeper.class);

    private final ExpiringCache cache;

    public CacheSweeper(ExpiringCache cache) {
        this.cache = cache;
    }

    @Scheduled(fixedRateString = "${cache.sweep-interval-ms:3600000}",
            initialDelayString = "${cache.sweep-interval-ms:3600000}")
    public void sweepExpired() {
        int removed = cache.sweep();
        LOG.info("Cache sweep removed {} expired entries, remaining={}", removed, cache.sizes());
    }
}
