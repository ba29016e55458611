package com.phillippitts.truthtell.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Exposes the transcription executor via Micrometer.
 *
 * <ul>
 *   <li>transcription.pool.size - current number of threads</li>
 *   <li>transcription.pool.active - threads running a drain loop</li>
 *   <li>transcription.pool.queued - drain tasks waiting for a thread</li>
 *   <li>transcription.pool.completed - cumulative completed drain tasks</li>
 * </ul>
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> executorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("transcriptionExecutor") ObjectProvider<ThreadPoolTaskExecutor> executorProvider) {
        this.executorProvider = executorProvider;
    }

    @Bean
    public MeterBinder transcriptionExecutorMetrics() {
        return registry -> {
            ThreadPoolExecutor executor = this.executorProvider.getObject().getThreadPoolExecutor();

            Gauge.builder("transcription.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                    .description("Current number of threads in the transcription pool")
                    .register(registry);

            Gauge.builder("transcription.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                    .description("Number of threads actively draining live sessions")
                    .register(registry);

            Gauge.builder("transcription.pool.queued", executor, e -> e.getQueue().size())
                    .description("Number of drain tasks waiting in the queue")
                    .register(registry);

            Gauge.builder("transcription.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                    .description("Cumulative count of completed drain tasks")
                    .register(registry);

            LOG.info("Transcription pool metrics registered: transcription.pool.* available via /actuator/metrics");
        };
    }
}
