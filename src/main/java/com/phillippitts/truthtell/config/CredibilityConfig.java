package com.phillippitts.truthtell.config;

import com.phillippitts.truthtell.config.properties.CredibilityProperties;
import com.phillippitts.truthtell.service.cache.ExpiringCache;
import com.phillippitts.truthtell.service.credibility.CredibilityAnalyzer;
import com.phillippitts.truthtell.service.credibility.DefaultCredibilityAnalyzer;
import com.phillippitts.truthtell.service.credibility.PatternTable;
import com.phillippitts.truthtell.service.credibility.SourceReliabilityPolicy;
import com.phillippitts.truthtell.service.metrics.PipelineMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the shared pipeline components: clock, expiring cache, pattern table and analyzer.
 */
@Configuration
public class CredibilityConfig {

    private static final Logger LOG = LogManager.getLogger(CredibilityConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ExpiringCache expiringCache(Clock clock) {
        return new ExpiringCache(clock);
    }

    @Bean
    public PatternTable patternTable() {
        PatternTable table = PatternTable.defaultRules();
        LOG.info("Loaded {} credibility patterns", table.size());
        return table;
    }

    @Bean
    public CredibilityAnalyzer credibilityAnalyzer(PatternTable patternTable,
                                                   ExpiringCache cache,
                                                   CredibilityProperties properties,
                                                   PipelineMetrics metrics,
                                                   Clock clock) {
        return new DefaultCredibilityAnalyzer(patternTable, cache, SourceReliabilityPolicy.from(properties),
                properties, metrics, clock);
    }
}
