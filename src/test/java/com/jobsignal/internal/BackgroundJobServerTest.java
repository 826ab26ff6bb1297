package com.jobsignal.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobsignal.Job;
import com.jobsignal.JobRepository;
import com.jobsignal.JobWorker;
import com.jobsignal.config.JobSignalProperties;
import com.jobsignal.store.JobChange;
import com.jobsignal.store.JobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BackgroundJobServerTest {

    private static final OffsetDateTime STORE_NOW = OffsetDateTime.of(2026, 10, 19, 12, 0, 0, 0, ZoneOffset.UTC);
    private static final String WORKER = "node-1-worker-0";

    private JobReserver reserver;
    private JobInvoker invoker;
    private JobRepository jobRepository;
    private List<JobChange> changes;
    private JobSignalProperties properties;
    private BackgroundJobServer server;

    @com.jobsignal.annotation.Job(value = "ANNOTATED", initialBackoffMs = 500, backoffMultiplier = 3.0)
    static class AnnotatedWorker implements JobWorker<String> {
        @Override
        public void process(Long jobId, String payload) {
        }
    }

    @BeforeEach
    void setUp() {
        reserver = mock(JobReserver.class);
        invoker = mock(JobInvoker.class);
        jobRepository = mock(JobRepository.class);
        changes = new ArrayList<>();
        when(jobRepository.saveAndFlush(any(Job.class))).thenAnswer(invocation -> invocation.getArgument(0));

        properties = new JobSignalProperties();
        properties.getBackgroundJobServer().setWorkerCount(1);
        properties.getBackgroundJobServer().setMinIdleDelay(Duration.ofMillis(10));
        properties.getJobs().setRetryBackOffTimeSeed(3);

        JobStore jobStore = new JobStore(jobRepository, () -> STORE_NOW, List.of(changes::add));
        JobWorkerRegistry registry = new JobWorkerRegistry(List.of(new AnnotatedWorker()), new ObjectMapper());
        server = new BackgroundJobServer(reserver, invoker, jobRepository, jobStore, () -> STORE_NOW, registry,
                new TransactionTemplate(mock(PlatformTransactionManager.class)), properties);
    }

    @Test
    void shouldDeleteSucceededJob() throws Exception {
        Job job = lockedJob(1L, "PLAIN", 5);
        when(reserver.reserve(WORKER)).thenReturn(Optional.of(job));
        when(jobRepository.findByIdForUpdate(1L)).thenReturn(Optional.of(job));

        assertTrue(server.workOff(WORKER));

        verify(invoker).invoke(job);
        verify(jobRepository).delete(job);
        assertEquals(JobChange.Kind.DESTROY, changes.get(0).kind());
    }

    @Test
    void shouldRescheduleFailedAttemptWithSeedBackoff() throws Exception {
        Job job = lockedJob(2L, "PLAIN", 5);
        when(reserver.reserve(WORKER)).thenReturn(Optional.of(job));
        when(jobRepository.findByIdForUpdate(2L)).thenReturn(Optional.of(job));
        doThrow(new IllegalStateException("downstream timeout")).when(invoker).invoke(job);

        assertTrue(server.workOff(WORKER));

        assertEquals(1, job.getAttempts());
        assertEquals("downstream timeout", job.getLastError());
        assertFalse(job.isLocked());
        assertNull(job.getFailedAt());
        assertEquals(STORE_NOW.plusSeconds(3), job.getRunAt());
        JobChange change = changes.get(0);
        assertEquals(JobChange.Kind.UPDATE, change.kind());
        assertFalse(change.internal(), "a reschedule must be announced");
        verify(jobRepository, never()).delete(any(Job.class));
    }

    @Test
    void shouldMarkJobFailedWhenAttemptsAreExhausted() throws Exception {
        Job job = lockedJob(3L, "PLAIN", 1);
        when(reserver.reserve(WORKER)).thenReturn(Optional.of(job));
        when(jobRepository.findByIdForUpdate(3L)).thenReturn(Optional.of(job));
        doThrow(new IllegalStateException("bad payload")).when(invoker).invoke(job);

        server.workOff(WORKER);

        assertEquals(STORE_NOW, job.getFailedAt());
        assertFalse(job.isLocked());
    }

    @Test
    void shouldLeaveRowAloneWhenLockWasTakenOver() throws Exception {
        Job reserved = lockedJob(4L, "PLAIN", 5);
        Job current = lockedJob(4L, "PLAIN", 5);
        current.lock(STORE_NOW, "node-2-worker-3");
        when(reserver.reserve(WORKER)).thenReturn(Optional.of(reserved));
        when(jobRepository.findByIdForUpdate(4L)).thenReturn(Optional.of(current));

        server.workOff(WORKER);

        verify(jobRepository, never()).delete(any(Job.class));
        assertTrue(changes.isEmpty());
    }

    @Test
    void shouldReportIdleWhenNothingWasReserved() throws Exception {
        when(reserver.reserve(WORKER)).thenReturn(Optional.empty());

        assertFalse(server.workOff(WORKER));
        verify(invoker, never()).invoke(any(Job.class));
    }

    @Test
    void shouldUseAnnotatedBackoffWhenWorkerDeclaresIt() {
        Job job = lockedJob(5L, "ANNOTATED", 5);
        job.setAttempts(3);

        assertEquals(Duration.ofMillis(4_500), server.retryDelay(job));
    }

    @Test
    void shouldRunWorkersUntilStopped() throws Exception {
        when(reserver.reserve(anyString())).thenAnswer(invocation -> {
            Thread.sleep(5);
            return Optional.empty();
        });

        server.start();
        assertTrue(server.isRunning());
        await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> verify(reserver, atLeastOnce()).reserve(anyString()));
        server.stop();

        assertFalse(server.isRunning());
    }

    private static Job lockedJob(Long id, String type, int maxAttempts) {
        Job job = new Job(type, null, maxAttempts, 0);
        job.setId(id);
        job.setUpdatedAt(STORE_NOW.minusMinutes(1));
        job.lock(STORE_NOW.minusSeconds(30), WORKER);
        return job;
    }
}
