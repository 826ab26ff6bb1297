package com.jobsignal.config;

import com.jobsignal.broker.BrokerPriority;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JobSignalPropertiesTest {

    @Configuration
    @EnableConfigurationProperties(JobSignalProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(Config.class);

    @Test
    void shouldMapDefaultProperties() {
        contextRunner.run(context -> {
            JobSignalProperties properties = context.getBean(JobSignalProperties.class);
            assertEquals(Duration.ofHours(4), properties.getJobs().getMaxRunDuration());
            assertEquals(25, properties.getJobs().getDefaultMaxAttempts());
            assertEquals(BrokerPriority.NORMAL, properties.getJobs().getPriorityMap().get(0));
            assertEquals(Duration.ofSeconds(1), properties.getBackgroundJobServer().getMinIdleDelay());
            assertTrue(properties.getBackgroundJobServer().getWorkerCount() >= 2);
            assertTrue(properties.getBackgroundJobServer().isEnabled());
            assertEquals(JobSignalProperties.Broker.Type.NATS, properties.getBroker().getType());
            assertEquals("nats://localhost:4222", properties.getBroker().getUrl());
            assertEquals("jobsignal.jobs", properties.getBroker().getSubjectPrefix());
            assertFalse(properties.getDatabase().isSkipCreate());
        });
    }

    @Test
    void shouldMapCustomProperties() {
        contextRunner
                .withPropertyValues(
                        "jobsignal.jobs.max-run-duration=10m",
                        "jobsignal.jobs.priority-map.0=normal",
                        "jobsignal.jobs.priority-map.10=high",
                        "jobsignal.jobs.priority-map.20=bulk",
                        "jobsignal.background-job-server.worker-count=5",
                        "jobsignal.background-job-server.min-idle-delay=250ms",
                        "jobsignal.broker.type=in-memory",
                        "jobsignal.broker.ack-wait=30s",
                        "jobsignal.database.skip-create=true")
                .run(context -> {
                    JobSignalProperties properties = context.getBean(JobSignalProperties.class);
                    assertEquals(Duration.ofMinutes(10), properties.getJobs().getMaxRunDuration());
                    assertEquals(BrokerPriority.HIGH, properties.getJobs().getPriorityMap().get(10));
                    assertEquals(BrokerPriority.BULK, properties.getJobs().getPriorityMap().get(20));
                    assertEquals(5, properties.getBackgroundJobServer().getWorkerCount());
                    assertEquals(Duration.ofMillis(250), properties.getBackgroundJobServer().getMinIdleDelay());
                    assertEquals(JobSignalProperties.Broker.Type.IN_MEMORY, properties.getBroker().getType());
                    assertEquals(Duration.ofSeconds(30), properties.getBroker().getAckWait());
                    assertTrue(properties.getDatabase().isSkipCreate());
                });
    }
}
