package com.jobsignal.internal;

import com.jobsignal.Job;
import com.jobsignal.JobRepository;
import com.jobsignal.config.JobSignalProperties;
import com.jobsignal.store.JobStore;
import com.jobsignal.store.JobStoreClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pool of worker threads, each looping {@code reserve -> invoke -> settle}. A succeeded job is
 * deleted; a failed one is rescheduled with backoff or, once its attempts are used up, marked
 * failed. Settling only touches rows still locked by the worker that ran them.
 */
public class BackgroundJobServer implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(BackgroundJobServer.class);

    private final JobReserver reserver;
    private final JobInvoker invoker;
    private final JobRepository jobRepository;
    private final JobStore jobStore;
    private final JobStoreClock clock;
    private final JobWorkerRegistry registry;
    private final TransactionTemplate transactionTemplate;
    private final JobSignalProperties properties;
    private final int workerCount;
    private final ThreadPoolExecutor workerExecutor;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final String nodeId = "node-" + UUID.randomUUID();

    public BackgroundJobServer(
            JobReserver reserver,
            JobInvoker invoker,
            JobRepository jobRepository,
            JobStore jobStore,
            JobStoreClock clock,
            JobWorkerRegistry registry,
            TransactionTemplate transactionTemplate,
            JobSignalProperties properties) {
        this.reserver = reserver;
        this.invoker = invoker;
        this.jobRepository = jobRepository;
        this.jobStore = jobStore;
        this.clock = clock;
        this.registry = registry;
        this.transactionTemplate = transactionTemplate;
        this.properties = properties;
        this.workerCount = Math.max(1, properties.getBackgroundJobServer().getWorkerCount());
        this.workerExecutor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>());
    }

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        for (int i = 0; i < workerCount; i++) {
            String workerName = nodeId + "-worker-" + i;
            workerExecutor.execute(() -> runWorker(workerName));
        }
        log.info("Background job server started on {} with {} workers", nodeId, workerCount);
    }

    @Override
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        // interrupts workers blocked on the broker
        workerExecutor.shutdownNow();
        try {
            if (!workerExecutor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Background job server workers did not stop within 30s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Background job server on {} stopped", nodeId);
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    private void runWorker(String workerName) {
        while (running.get() && !Thread.currentThread().isInterrupted()) {
            try {
                workOff(workerName);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } catch (RuntimeException e) {
                log.error("Worker {} failed to reserve a job", workerName, e);
                pauseAfterError();
            }
        }
        log.debug("Worker {} exiting", workerName);
    }

    /**
     * Reserves and runs at most one job.
     *
     * @return true when a job was run
     */
    public boolean workOff(String workerName) throws InterruptedException {
        Optional<Job> reserved = reserver.reserve(workerName);
        if (reserved.isEmpty()) {
            return false;
        }

        Job job = reserved.get();
        try {
            invoker.invoke(job);
        } catch (Exception e) {
            log.error("Failed to run job {} of type {}", job.getId(), job.getType(), e);
            handleFailure(job, workerName, e);
            return true;
        }
        markCompleted(job, workerName);
        log.debug("Successfully completed job {} of type {}", job.getId(), job.getType());
        return true;
    }

    private void markCompleted(Job jobSnapshot, String workerName) {
        transactionTemplate.executeWithoutResult(status -> jobRepository.findByIdForUpdate(jobSnapshot.getId())
                .ifPresent(job -> {
                    if (!isHeldBy(job, workerName)) {
                        log.debug("Skipping completion of job {} due to lock mismatch", job.getId());
                        return;
                    }
                    jobStore.delete(job);
                }));
    }

    private void handleFailure(Job jobSnapshot, String workerName, Exception exception) {
        transactionTemplate.executeWithoutResult(status -> jobRepository.findByIdForUpdate(jobSnapshot.getId())
                .ifPresent(job -> {
                    if (!isHeldBy(job, workerName)) {
                        log.debug("Skipping failure update of job {} due to lock mismatch", job.getId());
                        return;
                    }
                    OffsetDateTime now = clock.now();
                    job.incrementAttempts();
                    job.setLastError(describe(exception));
                    job.unlock();
                    if (job.getAttempts() >= job.getMaxAttempts()) {
                        job.setFailedAt(now);
                        log.warn("Job {} of type {} failed permanently after {} attempts", job.getId(),
                                job.getType(), job.getAttempts());
                    } else {
                        job.setRunAt(now.plus(retryDelay(job)));
                    }
                    jobStore.save(job);
                }));
    }

    Duration retryDelay(Job job) {
        com.jobsignal.annotation.Job annotation = registry.find(job.getType())
                .map(JobWorkerRegistry.RegisteredWorker::annotation)
                .orElse(null);
        if (annotation != null) {
            long delayMs = (long) (annotation.initialBackoffMs()
                    * Math.pow(annotation.backoffMultiplier(), job.getAttempts() - 1));
            return Duration.ofMillis(delayMs);
        }

        long delaySeconds = (long) Math.pow(properties.getJobs().getRetryBackOffTimeSeed(),
                Math.max(1, job.getAttempts()));
        return Duration.ofSeconds(delaySeconds);
    }

    private boolean isHeldBy(Job job, String workerName) {
        return job.isLocked() && workerName.equals(job.getLockedBy()) && !job.isFailed();
    }

    private String describe(Exception exception) {
        return exception.getMessage() != null ? exception.getMessage() : exception.getClass().getName();
    }

    private void pauseAfterError() {
        try {
            Thread.sleep(properties.getBackgroundJobServer().getMinIdleDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
