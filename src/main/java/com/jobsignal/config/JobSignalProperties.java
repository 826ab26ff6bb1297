package com.jobsignal.config;

import com.jobsignal.broker.BrokerPriority;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@ConfigurationProperties(prefix = "jobsignal")
public class JobSignalProperties {

    private final Database database = new Database();
    private final Jobs jobs = new Jobs();
    private final BackgroundJobServer backgroundJobServer = new BackgroundJobServer();
    private final Broker broker = new Broker();

    public Database getDatabase() {
        return database;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public BackgroundJobServer getBackgroundJobServer() {
        return backgroundJobServer;
    }

    public Broker getBroker() {
        return broker;
    }

    public static class Database {
        private String tablePrefix = "";
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

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
        private int defaultMaxAttempts = 25;
        private int retryBackOffTimeSeed = 3;
        private Duration maxRunDuration = Duration.ofHours(4);
        // job priority -> broker priority; unmapped values fall back to NORMAL
        private Map<Integer, BrokerPriority> priorityMap = new HashMap<>(Map.of(0, BrokerPriority.NORMAL));

        public int getDefaultMaxAttempts() {
            return defaultMaxAttempts;
        }

        public void setDefaultMaxAttempts(int defaultMaxAttempts) {
            this.defaultMaxAttempts = defaultMaxAttempts;
        }

        public int getRetryBackOffTimeSeed() {
            return retryBackOffTimeSeed;
        }

        public void setRetryBackOffTimeSeed(int retryBackOffTimeSeed) {
            this.retryBackOffTimeSeed = retryBackOffTimeSeed;
        }

        public Duration getMaxRunDuration() {
            return maxRunDuration;
        }

        public void setMaxRunDuration(Duration maxRunDuration) {
            this.maxRunDuration = maxRunDuration;
        }

        public Map<Integer, BrokerPriority> getPriorityMap() {
            return priorityMap;
        }

        public void setPriorityMap(Map<Integer, BrokerPriority> priorityMap) {
            this.priorityMap = priorityMap;
        }
    }

    public static class BackgroundJobServer {
        private boolean enabled = true;
        private int workerCount = Math.max(2, Runtime.getRuntime().availableProcessors());
        private Duration minIdleDelay = Duration.ofSeconds(1);
        private Duration popTimeout = Duration.ofSeconds(5);

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

        public Duration getMinIdleDelay() {
            return minIdleDelay;
        }

        public void setMinIdleDelay(Duration minIdleDelay) {
            this.minIdleDelay = minIdleDelay;
        }

        public Duration getPopTimeout() {
            return popTimeout;
        }

        public void setPopTimeout(Duration popTimeout) {
            this.popTimeout = popTimeout;
        }
    }

    public static class Broker {

        public enum Type {
            NATS,
            IN_MEMORY
        }

        private Type type = Type.NATS;
        private String url = "nats://localhost:4222";
        private Duration connectionTimeout = Duration.ofSeconds(5);
        private String stream = "jobsignal-jobs";
        private String subjectPrefix = "jobsignal.jobs";
        private String durablePrefix = "jobsignal-worker";
        private Duration ackWait = Duration.ofMinutes(5);
        private long maxDeliver = -1;

        public Type getType() {
            return type;
        }

        public void setType(Type type) {
            this.type = type;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public Duration getConnectionTimeout() {
            return connectionTimeout;
        }

        public void setConnectionTimeout(Duration connectionTimeout) {
            this.connectionTimeout = connectionTimeout;
        }

        public String getStream() {
            return stream;
        }

        public void setStream(String stream) {
            this.stream = stream;
        }

        public String getSubjectPrefix() {
            return subjectPrefix;
        }

        public void setSubjectPrefix(String subjectPrefix) {
            this.subjectPrefix = subjectPrefix;
        }

        public String getDurablePrefix() {
            return durablePrefix;
        }

        public void setDurablePrefix(String durablePrefix) {
            this.durablePrefix = durablePrefix;
        }

        public Duration getAckWait() {
            return ackWait;
        }

        public void setAckWait(Duration ackWait) {
            this.ackWait = ackWait;
        }

        public long getMaxDeliver() {
            return maxDeliver;
        }

        public void setMaxDeliver(long maxDeliver) {
            this.maxDeliver = maxDeliver;
        }
    }
}
