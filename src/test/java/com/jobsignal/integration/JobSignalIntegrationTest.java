package com.jobsignal.integration;

import com.jobsignal.Job;
import com.jobsignal.JobClient;
import com.jobsignal.JobRepository;
import com.jobsignal.JobWorker;
import com.jobsignal.broker.memory.InMemoryBroker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(classes = { TestApplication.class, JobSignalIntegrationTest.TestConfig.class })
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class JobSignalIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void registerPgProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    JobClient jobClient;

    @Autowired
    JobRepository jobRepository;

    @Autowired
    InMemoryBroker broker;

    static final ConcurrentLinkedQueue<String> processedMessages = new ConcurrentLinkedQueue<>();
    static final AtomicInteger flakyAttempts = new AtomicInteger();

    @com.jobsignal.annotation.Job("GREETING")
    static class GreetingWorker implements JobWorker<GreetingPayload> {
        @Override
        public void process(Long jobId, GreetingPayload payload) {
            processedMessages.add(payload.getMessage());
        }
    }

    @com.jobsignal.annotation.Job(value = "ALWAYS_FAILS", maxAttempts = 2, initialBackoffMs = 100)
    static class FailingWorker implements JobWorker<GreetingPayload> {
        @Override
        public void process(Long jobId, GreetingPayload payload) {
            flakyAttempts.incrementAndGet();
            throw new IllegalStateException("remote service unavailable");
        }
    }

    @Configuration
    static class TestConfig {
        @Bean
        GreetingWorker greetingWorker() {
            return new GreetingWorker();
        }

        @Bean
        FailingWorker failingWorker() {
            return new FailingWorker();
        }
    }

    @BeforeEach
    void setUp() {
        processedMessages.clear();
        flakyAttempts.set(0);
    }

    @Test
    void shouldRunEnqueuedJobAndDeleteItsRow() {
        Long jobId = jobClient.enqueue("GREETING", new GreetingPayload("hello"));

        await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> {
            assertTrue(processedMessages.contains("hello"));
            assertFalse(jobRepository.findById(jobId).isPresent());
        });
    }

    @Test
    void shouldNotRunJobBeforeItsRunAt() {
        Long jobId = jobClient.enqueueAt("GREETING", new GreetingPayload("later"),
                OffsetDateTime.now().plusSeconds(2));

        await().during(Duration.ofMillis(800)).atMost(Duration.ofSeconds(1))
                .until(() -> !processedMessages.contains("later"));
        await().atMost(Duration.ofSeconds(10)).until(() -> processedMessages.contains("later"));
        await().atMost(Duration.ofSeconds(5)).until(() -> jobRepository.findById(jobId).isEmpty());
    }

    @Test
    void shouldRetryAndThenMarkJobFailed() {
        Long jobId = jobClient.enqueue("ALWAYS_FAILS", new GreetingPayload("doomed"));

        await().atMost(Duration.ofSeconds(15)).untilAsserted(() -> {
            Optional<Job> row = jobRepository.findById(jobId);
            assertTrue(row.isPresent());
            assertNotNull(row.get().getFailedAt());
        });

        Job failed = jobRepository.findById(jobId).orElseThrow();
        assertEquals(2, failed.getAttempts());
        assertEquals(2, flakyAttempts.get());
        assertEquals("remote service unavailable", failed.getLastError());
        assertFalse(failed.isLocked());
    }

    @Test
    void shouldIgnoreStaleNotificationAfterReschedule() throws InterruptedException {
        Long jobId = jobClient.enqueueAt("GREETING", new GreetingPayload("moved"),
                OffsetDateTime.now().plusSeconds(1));
        // the second update lands in a later second, so the first notification no longer matches
        Thread.sleep(1_100);
        assertTrue(jobClient.reschedule(jobId, OffsetDateTime.now().plusSeconds(3)));

        await().atMost(Duration.ofSeconds(2)).pollDelay(Duration.ofMillis(1500))
                .until(() -> !processedMessages.contains("moved"));
        await().atMost(Duration.ofSeconds(10)).until(() -> processedMessages.contains("moved"));
        assertEquals(1, processedMessages.stream().filter("moved"::equals).count());
    }

    @Test
    void shouldRepublishPendingJobs() {
        Long jobId = jobClient.enqueueAt("GREETING", new GreetingPayload("recovered"),
                OffsetDateTime.now().plusHours(1));
        int queuedBefore = broker.size();

        int republished = jobClient.republishAll();

        assertTrue(republished >= 1);
        assertTrue(broker.size() > queuedBefore);
        assertTrue(jobClient.delete(jobId));
    }

    public static class GreetingPayload {
        private String message;

        public GreetingPayload() {
        }

        public GreetingPayload(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }

        public void setMessage(String message) {
            this.message = message;
        }
    }
}
