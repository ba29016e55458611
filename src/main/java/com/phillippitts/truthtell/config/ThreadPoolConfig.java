package com.phillippitts.truthtell.config;

import com.phillippitts.truthtell.config.properties.LiveStreamProperties;
import com.phillippitts.truthtell.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool running live-session drain loops.
 *
 * <p>The core size comes from {@link ThreadPoolProperties}; the maximum size is the live session
 * limit from {@link LiveStreamProperties}, since a draining session holds its thread until its
 * queue is empty.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;
    private final LiveStreamProperties liveStreamProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties, LiveStreamProperties liveStreamProperties) {
        this.threadPoolProperties = threadPoolProperties;
        this.liveStreamProperties = liveStreamProperties;
    }

    /**
     * Creates the executor shared by all live sessions for transcription and analysis.
     *
     * <p>Pool sizing:
     * <ul>
     *   <li>Core pool: {@code threadpool.transcription.core-pool-size}, default 4</li>
     *   <li>Max pool: {@code live.max-sessions}, default 32</li>
     *   <li>Queue: none. A drain task is handed straight to a thread, so a session never waits
     *       behind the drain loops of other sessions.</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. Closed sessions whose
     * transcription call is still in flight can briefly push the pool past the session limit;
     * the submitting producer thread then drains its own session.
     *
     * <p>MDC propagation: copies Log4j2 ThreadContext from the submitting thread so that
     * {@code sessionId} appears in drain-loop logs.
     *
     * @return configured executor for transcription work
     */
    @Bean(name = "transcriptionExecutor")
    public ThreadPoolTaskExecutor transcriptionExecutor() {
        ThreadPoolProperties.TranscriptionPoolProperties props = threadPoolProperties.getTranscription();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(props.getCorePoolSize(), liveStreamProperties.getMaxSessions()));
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Decorator that runs each task with the submitter's ThreadContext and restores the
     * worker's own context afterwards.
     */
    static TaskDecorator mdcPropagatingDecorator() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
