package com.phillippitts.pingwatch.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for thread pools.
 *
 * <p>Provides tuneable sizing for the probe executor (one long-lived loop per target) and
 * the trace executor (trace tasks plus the run finalizer).
 */
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private PoolProperties probe = new PoolProperties(16, 256, 0, 60, "probe-pool-");
    private PoolProperties trace = new PoolProperties(8, 32, 128, 60, "trace-pool-");

    public PoolProperties getProbe() {
        return probe;
    }

    public void setProbe(PoolProperties probe) {
        this.probe = probe;
    }

    public PoolProperties getTrace() {
        return trace;
    }

    public void setTrace(PoolProperties trace) {
        this.trace = trace;
    }

    /**
     * Executor pool configuration.
     */
    public static class PoolProperties {
        private int corePoolSize;
        private int maxPoolSize;
        private int queueCapacity;
        private int keepAliveSeconds;
        private String threadNamePrefix;

        public PoolProperties() {
        }

        PoolProperties(int corePoolSize, int maxPoolSize, int queueCapacity, int keepAliveSeconds,
                       String threadNamePrefix) {
            this.corePoolSize = corePoolSize;
            this.maxPoolSize = maxPoolSize;
            this.queueCapacity = queueCapacity;
            this.keepAliveSeconds = keepAliveSeconds;
            this.threadNamePrefix = threadNamePrefix;
        }

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public int getMaxPoolSize() {
            return maxPoolSize;
        }

        public void setMaxPoolSize(int maxPoolSize) {
            this.maxPoolSize = maxPoolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }

        public int getKeepAliveSeconds() {
            return keepAliveSeconds;
        }

        public void setKeepAliveSeconds(int keepAliveSeconds) {
            this.keepAliveSeconds = keepAliveSeconds;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }
}
