package com.phillippitts.scriptorium.config;

import com.phillippitts.scriptorium.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the clock and the executors used by the editing-session client.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Time source for lease expiry and review stamps. Replaced by a fixed or mutable clock in tests.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Scheduler that fires keep-alive renewals for open editing sessions.
     *
     * <p>Each open session holds one periodic task; the task is cancelled when the session ends.
     * Thread naming: configured via {@code threadpool.keepalive.thread-name-prefix}.
     *
     * <p>MDC propagation: none here. Each keep-alive task carries the ThreadContext of the thread
     * that started it.
     *
     * @return scheduler for keep-alive ticks
     */
    @Bean(name = "keepAliveScheduler")
    public ThreadPoolTaskScheduler keepAliveScheduler() {
        ThreadPoolProperties.KeepAlivePoolProperties props = threadPoolProperties.getKeepalive();

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(props.getCorePoolSize());
        scheduler.setThreadNamePrefix(props.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Creates a bounded executor for best-effort reservation releases.
     *
     * <p>Releases are fire-and-forget: callers never wait on the returned work, and a lost
     * release is tolerated because lease expiry reclaims the reservation anyway.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.DiscardPolicy}. When the queue is full a
     * release is dropped rather than blocking the caller.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext from the submitting thread to the worker.
     *
     * @return executor for release notifications
     */
    @Bean(name = "releaseExecutor")
    public Executor releaseExecutor() {
        ThreadPoolProperties.ReleasePoolProperties props = threadPoolProperties.getRelease();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.DiscardPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
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
