package com.reelforge.config;

import com.reelforge.credits.SubscriptionTier;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

@ConfigurationProperties(prefix = "reelforge")
public class ReelForgeProperties {

    private final Database database = new Database();
    private final Jobs jobs = new Jobs();
    private final Worker worker = new Worker();
    private final Credits credits = new Credits();

    public Database getDatabase() {
        return database;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Worker getWorker() {
        return worker;
    }

    public Credits getCredits() {
        return credits;
    }

    public static class Database {
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Jobs {
        private int defaultMaxAttempts = 3;
        private int retentionDays = 30;
        private String stuckJobTimeout = "30m";
        private long reaperIntervalInSeconds = 60;
        private long cleanupIntervalInSeconds = 3600;
        private String initialBackoff = "0s";
        private double backoffMultiplier = 2.0;
        private String maxBackoff = "1h";

        public int getDefaultMaxAttempts() {
            return defaultMaxAttempts;
        }

        public void setDefaultMaxAttempts(int defaultMaxAttempts) {
            this.defaultMaxAttempts = defaultMaxAttempts;
        }

        public int getRetentionDays() {
            return retentionDays;
        }

        public void setRetentionDays(int retentionDays) {
            this.retentionDays = retentionDays;
        }

        public String getStuckJobTimeout() {
            return stuckJobTimeout;
        }

        public void setStuckJobTimeout(String stuckJobTimeout) {
            this.stuckJobTimeout = stuckJobTimeout;
        }

        public long getReaperIntervalInSeconds() {
            return reaperIntervalInSeconds;
        }

        public void setReaperIntervalInSeconds(long reaperIntervalInSeconds) {
            this.reaperIntervalInSeconds = reaperIntervalInSeconds;
        }

        public long getCleanupIntervalInSeconds() {
            return cleanupIntervalInSeconds;
        }

        public void setCleanupIntervalInSeconds(long cleanupIntervalInSeconds) {
            this.cleanupIntervalInSeconds = cleanupIntervalInSeconds;
        }

        public String getInitialBackoff() {
            return initialBackoff;
        }

        public void setInitialBackoff(String initialBackoff) {
            this.initialBackoff = initialBackoff;
        }

        public double getBackoffMultiplier() {
            return backoffMultiplier;
        }

        public void setBackoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
        }

        public String getMaxBackoff() {
            return maxBackoff;
        }

        public void setMaxBackoff(String maxBackoff) {
            this.maxBackoff = maxBackoff;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int workerCount = Math.max(2, Runtime.getRuntime().availableProcessors());
        private long pollIntervalInSeconds = 5;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getPollIntervalInSeconds() {
            return pollIntervalInSeconds;
        }

        public void setPollIntervalInSeconds(long pollIntervalInSeconds) {
            this.pollIntervalInSeconds = pollIntervalInSeconds;
        }
    }

    public static class Credits {
        private long lockTimeoutMs = 5000;
        private final Map<SubscriptionTier, Integer> tierGrants = new EnumMap<>(SubscriptionTier.class);

        public Credits() {
            tierGrants.put(SubscriptionTier.FREE, 100);
            tierGrants.put(SubscriptionTier.PRO, 500);
            tierGrants.put(SubscriptionTier.ENTERPRISE, 2000);
        }

        public long getLockTimeoutMs() {
            return lockTimeoutMs;
        }

        public void setLockTimeoutMs(long lockTimeoutMs) {
            this.lockTimeoutMs = lockTimeoutMs;
        }

        public Map<SubscriptionTier, Integer> getTierGrants() {
            return tierGrants;
        }

        public int grantFor(SubscriptionTier tier) {
            return tierGrants.getOrDefault(tier, 0);
        }
    }
}
