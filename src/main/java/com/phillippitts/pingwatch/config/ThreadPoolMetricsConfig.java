package com.phillippitts.pingwatch.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for thread pool metrics exposure via Micrometer.
 *
 * <p>Exposes, for both the probe and the trace pool ({@code <pool>} = probe | trace):
 * <ul>
 *   <li>pingwatch.pool.size - Current number of threads in the pool</li>
 *   <li>pingwatch.pool.active - Number of actively executing tasks</li>
 *   <li>pingwatch.pool.queued - Number of tasks waiting in the queue</li>
 *   <li>pingwatch.pool.completed - Cumulative count of completed tasks</li>
 * </ul>
 * Each gauge is tagged {@code pool=<pool>}.
 *
 * <p>These metrics are available via:
 * <ul>
 *   <li>HTTP: {@code GET /actuator/metrics/pingwatch.pool.active?tag=pool:probe}</li>
 *   <li>Prometheus: {@code pingwatch_pool_active{pool="probe"}}</li>
 * </ul>
 *
 * <p>Additionally logs a pool summary every 5 minutes for operational visibility.
 */
@Configuration
public class ThreadPoolMetricsConfig {

    private static final Logger LOG = LogManager.getLogger(ThreadPoolMetricsConfig.class);

    private final ObjectProvider<ThreadPoolTaskExecutor> probeExecutorProvider;
    private final ObjectProvider<ThreadPoolTaskExecutor> traceExecutorProvider;

    public ThreadPoolMetricsConfig(
            @Qualifier("probeExecutor") ObjectProvider<ThreadPoolTaskExecutor> probeExecutorProvider,
            @Qualifier("traceExecutor") ObjectProvider<ThreadPoolTaskExecutor> traceExecutorProvider) {
        this.probeExecutorProvider = probeExecutorProvider;
        this.traceExecutorProvider = traceExecutorProvider;
    }

    /**
     * Binds probe and trace pool metrics to the Micrometer registry.
     *
     * @return MeterBinder that registers custom metrics
     */
    @Bean
    public MeterBinder executorPoolMetrics() {
        return registry -> {
            bind(registry, "probe", probeExecutorProvider.getObject().getThreadPoolExecutor());
            bind(registry, "trace", traceExecutorProvider.getObject().getThreadPoolExecutor());
            LOG.info("Thread pool metrics registered: pingwatch.pool.* available via /actuator/metrics");
        };
    }

    private static void bind(MeterRegistry registry, String pool, ThreadPoolExecutor executor) {
        Gauge.builder("pingwatch.pool.size", executor, ThreadPoolExecutor::getPoolSize)
                .description("Current number of threads in the pool")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("pingwatch.pool.active", executor, ThreadPoolExecutor::getActiveCount)
                .description("Number of threads actively executing tasks")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("pingwatch.pool.queued", executor, e -> e.getQueue().size())
                .description("Number of tasks waiting in the queue")
                .tag("pool", pool)
                .register(registry);

        Gauge.builder("pingwatch.pool.completed", executor, ThreadPoolExecutor::getCompletedTaskCount)
                .description("Cumulative count of completed tasks")
                .tag("pool", pool)
                .register(registry);
    }

    /**
     * Logs pool health summary every 5 minutes for operational monitoring.
     */
    @Scheduled(fixedRate = 300_000) // 5 minutes
    public void logThreadPoolHealth() {
        ThreadPoolExecutor probe = probeExecutorProvider.getObject().getThreadPoolExecutor();
        ThreadPoolExecutor trace = traceExecutorProvider.getObject().getThreadPoolExecutor();

        LOG.info("Thread pools: probe size={}/{} active={}; trace size={}/{} active={} queued={}",
                probe.getPoolSize(), probe.getMaximumPoolSize(), probe.getActiveCount(),
                trace.getPoolSize(), trace.getMaximumPoolSize(), trace.getActiveCount(),
                trace.getQueue().size());
    }
}
