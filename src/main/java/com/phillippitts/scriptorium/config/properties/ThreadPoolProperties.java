package com.phillippitts.scriptorium.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for thread pools.
 *
 * <p>Sizes the keep-alive scheduler (renewal ticks for open editing sessions) and the
 * release executor (fire-and-forget reservation releases on session end).
 */
@Component
@ConfigurationProperties(prefix = "threadpool")
public class ThreadPoolProperties {

    private KeepAlivePoolProperties keepalive = new KeepAlivePoolProperties();
    private ReleasePoolProperties release = new ReleasePoolProperties();

    public KeepAlivePoolProperties getKeepalive() {
        return keepalive;
    }

    public void setKeepalive(KeepAlivePoolProperties keepalive) {
        this.keepalive = keepalive;
    }

    public ReleasePoolProperties getRelease() {
        return release;
    }

    public void setRelease(ReleasePoolProperties release) {
        this.release = release;
    }

    /**
     * Keep-alive scheduler configuration.
     */
    public static class KeepAlivePoolProperties {
        private int corePoolSize = 2;
        private String threadNamePrefix = "keepalive-";

        public int getCorePoolSize() {
            return corePoolSize;
        }

        public void setCorePoolSize(int corePoolSize) {
            this.corePoolSize = corePoolSize;
        }

        public String getThreadNamePrefix() {
            return threadNamePrefix;
        }

        public void setThreadNamePrefix(String threadNamePrefix) {
            this.threadNamePrefix = threadNamePrefix;
        }
    }

    /**
     * Release executor configuration.
     */
    public static class ReleasePoolProperties {
        private int corePoolSize = 1;
        private int maxPoolSize = 2;
        private int queueCapacity = 100;
        private int keepAliveSeconds = 60;
        private String threadNamePrefix = "release-";

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
