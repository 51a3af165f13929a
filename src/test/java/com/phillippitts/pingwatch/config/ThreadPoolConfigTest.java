package com.phillippitts.pingwatch.config;

import com.phillippitts.pingwatch.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        ThreadContext.clearAll();
        if (executor != null) {
            executor.shutdown();
        }
    }

    @Test
    void shouldCreateProbeExecutorFromDefaults() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).probeExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(16);
        assertThat(executor.getMaxPoolSize()).isEqualTo(256);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("probe-pool-");
        assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
    }

    @Test
    void shouldCreateTraceExecutorWithCallerRunsPolicy() {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).traceExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(8);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("trace-pool-");
        assertThat(executor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.CallerRunsPolicy.class);
    }

    @Test
    void shouldRejectProbeLoopWhenPoolIsFull() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getProbe().setCorePoolSize(1);
        properties.getProbe().setMaxPoolSize(1);
        executor = new ThreadPoolConfig(properties).probeExecutor();
        CountDownLatch release = new CountDownLatch(1);

        executor.execute(() -> {
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        try {
            assertThatThrownBy(() -> executor.execute(() -> { }))
                    .isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
        }
    }

    @Test
    void shouldPropagateThreadContextToWorkers() throws InterruptedException {
        executor = new ThreadPoolConfig(new ThreadPoolProperties()).traceExecutor();
        ThreadContext.put("requestId", "req-42");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            seen.set(ThreadContext.get("requestId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("req-42");
        assertThat(threadName.get()).startsWith("trace-pool-");
    }

    @Test
    void shouldRestoreWorkerContextAfterTask() {
        ThreadContext.put("requestId", "outer");
        Runnable decorated = ThreadPoolConfig.mdcPropagatingDecorator().decorate(() -> ThreadContext.put("target", "x"));
        ThreadContext.clearAll();
        ThreadContext.put("trace", "worker");

        decorated.run();

        assertThat(ThreadContext.get("trace")).isEqualTo("worker");
        assertThat(ThreadContext.get("requestId")).isNull();
        assertThat(ThreadContext.get("target")).isNull();
    }
}
