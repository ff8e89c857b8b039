package io.jobflow4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the job system. Read once when the system starts.
 */
@ConfigurationProperties(prefix = "jobflow")
public class JobflowProperties {
    private boolean enabled = true;
    private final Storage storage = new Storage();
    private final Executor executor = new Executor();
    private final Scheduler scheduler = new Scheduler();
    private final Cleanup cleanup = new Cleanup();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Storage getStorage() {
        return storage;
    }

    public Executor getExecutor() {
        return executor;
    }

    public Scheduler getScheduler() {
        return scheduler;
    }

    public Cleanup getCleanup() {
        return cleanup;
    }

    public enum StorageType {
        SQLITE,
        FILE,
        MONGO
    }

    public static class Storage {
        private StorageType type = StorageType.SQLITE;
        /**
         * SQLite database file, or the directory of the file store. Null means the type's default.
         */
        private String path;
        /**
         * Create the MongoDB indexes when the application starts. Off by default; indexes are
         * normally managed by migrations.
         */
        private boolean ensureIndexesOnStartup = false;

        public StorageType getType() {
            return type;
        }

        public void setType(StorageType type) {
            this.type = type;
        }

        public String getPath() {
            return path;
        }

        public void setPath(String path) {
            this.path = path;
        }

        public boolean isEnsureIndexesOnStartup() {
            return ensureIndexesOnStartup;
        }

        public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
            this.ensureIndexesOnStartup = ensureIndexesOnStartup;
        }

        public String resolvedPath() {
            if (path != null && !path.isBlank()) {
                return path;
            }
            return type == StorageType.FILE ? "job_storage" : "jobs.db";
        }
    }

    public static class Executor {
        private int maxWorkers = 4;
        private Duration defaultTimeout = Duration.ofHours(1);
        private Duration shutdownTimeout = Duration.ofSeconds(30);
        private Duration pollInterval = Duration.ofMillis(100);
        private Duration killGracePeriod = Duration.ofSeconds(2);

        public int getMaxWorkers() {
            return maxWorkers;
        }

        public void setMaxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
        }

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }

        public Duration getShutdownTimeout() {
            return shutdownTimeout;
        }

        public void setShutdownTimeout(Duration shutdownTimeout) {
            this.shutdownTimeout = shutdownTimeout;
        }

        public Duration getPollInterval() {
            return pollInterval;
        }

        public void setPollInterval(Duration pollInterval) {
            this.pollInterval = pollInterval;
        }

        public Duration getKillGracePeriod() {
            return killGracePeriod;
        }

        public void setKillGracePeriod(Duration killGracePeriod) {
            this.killGracePeriod = killGracePeriod;
        }
    }

    public static class Scheduler {
        private boolean enabled = true;
        private Duration checkInterval = Duration.ofSeconds(1);
        private Duration errorBackoff = Duration.ofSeconds(5);
        private Duration stopTimeout = Duration.ofSeconds(5);
        private String timezone; // IANA id, null means system default

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
        }

        public Duration getErrorBackoff() {
            return errorBackoff;
        }

        public void setErrorBackoff(Duration errorBackoff) {
            this.errorBackoff = errorBackoff;
        }

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public void setStopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }
    }

    public static class Cleanup {
        private boolean enabled = true;
        private Duration interval = Duration.ofHours(1);
        private int retentionDays = 30;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getInterval() {
            return interval;
        }

        public void setInterval(Duration interval) {
            this.interval = interval;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }
    }
}
