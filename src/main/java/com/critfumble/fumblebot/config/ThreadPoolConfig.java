package com.critfumble.fumblebot.config;

import com.critfumble.fumblebot.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools backing the voice pipeline.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 *
 * <p>Rejection policy for both executors is {@link ThreadPoolExecutor.CallerRunsPolicy}:
 * when the pool and queue are full, the submitting thread runs the task.
 *
 * <p>MDC propagation: the Log4j2 ThreadContext of the submitting thread is copied onto the
 * worker thread so {@code guildId} and {@code sessionId} survive the hop. The subtitle scheduler
 * takes no decorator; its timers carry the session context themselves.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Shared executor under the per-session serial event queues.
     *
     * @return configured executor for session event processing
     */
    @Bean(name = "sessionExecutor")
    public Executor sessionExecutor() {
        return buildExecutor(threadPoolProperties.getSession());
    }

    /**
     * Shared executor under the per-guild playback lanes. Synthesis and playback block,
     * so this pool is kept apart from session processing.
     *
     * @return configured executor for speech playback
     */
    @Bean(name = "playbackExecutor")
    public Executor playbackExecutor() {
        return buildExecutor(threadPoolProperties.getPlayback());
    }

    /**
     * Scheduler for the live subtitle debounce timers.
     *
     * @return initialized task scheduler
     */
    @Bean(name = "subtitleScheduler")
    public TaskScheduler subtitleScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(threadPoolProperties.getSubtitle().getPoolSize());
        scheduler.setThreadNamePrefix(threadPoolProperties.getSubtitle().getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    private Executor buildExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        executor.initialize();
        return executor;
    }

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
