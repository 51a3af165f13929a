package com.phillippitts.pingwatch.config;

import com.phillippitts.pingwatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pools behind probe loops and trace runs.
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
     * Creates the executor running one indefinite probe loop per monitored target.
     *
     * <p>Pool sizing strategy configured via {@code threadpool.probe.*} properties:
     * <ul>
     *   <li>Core pool: default 16 - small sessions never create extra threads</li>
     *   <li>Max pool: default 256 - matches {@code pingwatch.monitor.max-targets}</li>
     *   <li>Queue: default 0 (hand-off) - a loop must start immediately, never wait behind
     *       other loops that never finish</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. Running an indefinite
     * loop on the caller thread would hang the request that started monitoring.
     *
     * @return Configured executor for probe loops
     */
    @Bean(name = "probeExecutor")
    public ThreadPoolTaskExecutor probeExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getProbe());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.initialize();
        return executor;
    }

    /**
     * Creates the executor for trace tasks and their run finalizer.
     *
     * <p>The number of live trace subprocesses is bounded by the trace slot limiter, not
     * by this pool; queued tasks simply wait for a thread before waiting for a slot.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}
     * When the pool and queue are full, the caller thread executes the task,
     * providing backpressure instead of failing fast.
     *
     * @return Configured executor for trace runs
     */
    @Bean(name = "traceExecutor")
    public ThreadPoolTaskExecutor traceExecutor() {
        ThreadPoolTaskExecutor executor = newExecutor(threadPoolProperties.getTrace());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    private static ThreadPoolTaskExecutor newExecutor(ThreadPoolProperties.PoolProperties props) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(5);
        executor.setTaskDecorator(mdcPropagatingDecorator());
        return executor;
    }

    /**
     * Copies Log4j2 ThreadContext (MDC) from the submitting thread to the worker thread.
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
