package com.phillippitts.truthtell.service.health;

import com.phillippitts.truthtell.service.cache.CacheNamespace;
import com.phillippitts.truthtell.service.cache.ExpiringCache;
import com.phillippitts.truthtell.service.live.LiveSessionManager;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reports cache statistics and the number of running live sessions.
 *
 * <p>Always UP; exposed via /actuator/health under {@code pipeline}.
 */
@Component("pipeline")
public class PipelineHealthIndicator implements HealthIndicator {

    private final ExpiringCache cache;
    private final LiveSessionManager sessionManager;

    public PipelineHealthIndicator(ExpiringCache cache, LiveSessionManager sessionManager) {
        this.cache = cache;
        this.sessionManager = sessionManager;
    }

    @Override
    public Health health() {
        Map<String, Integer> cacheStats = new LinkedHashMap<>();
        for (Map.Entry<CacheNamespace, Integer> entry : cache.sizes().entrySet()) {
            cacheStats.put(entry.getKey().name().toLowerCase(Locale.ROOT), entry.getValue());
        }
        return Health.up()
                .withDetail("cache_stats", cacheStats)
                .withDetail("active_sessions", sessionManager.activeSessionCount())
                .build();
    }
}
