package com.jobsignal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jobsignal.config.JobSignalProperties;
import com.jobsignal.internal.JobWorkerRegistry;
import com.jobsignal.notify.JobNotifier;
import com.jobsignal.store.JobStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

public class JobClient {

    private static final Logger log = LoggerFactory.getLogger(JobClient.class);
    private static final int REPUBLISH_PAGE_SIZE = 500;

    private final JobStore jobStore;
    private final JobRepository jobRepository;
    private final JobNotifier notifier;
    private final JobWorkerRegistry workerRegistry;
    private final ObjectMapper objectMapper;
    private final JobSignalProperties properties;
    private final TransactionTemplate transactionTemplate;

    public JobClient(JobStore jobStore, JobRepository jobRepository, JobNotifier notifier,
            JobWorkerRegistry workerRegistry, ObjectMapper objectMapper, JobSignalProperties properties,
            TransactionTemplate transactionTemplate) {
        this.jobStore = jobStore;
        this.jobRepository = jobRepository;
        this.notifier = notifier;
        this.workerRegistry = workerRegistry;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Enqueue a job to run now with priority 0 and the worker's (or the configured default) number
     * of attempts.
     */
    public Long enqueue(String type, Object payload) {
        String normalizedType = normalizeRequiredType(type);
        return enqueue(normalizedType, payload, defaultMaxAttempts(normalizedType), 0, null);
    }

    /**
     * Enqueue a job to run now with explicit attempts and priority.
     */
    public Long enqueue(String type, Object payload, int maxAttempts, int priority) {
        return enqueue(type, payload, maxAttempts, priority, null);
    }

    /**
     * Enqueue a job to run at the provided instant.
     */
    public Long enqueueAt(String type, Object payload, Instant runAt) {
        return enqueueAt(type, payload, normalizeRequiredRunAt(runAt));
    }

    /**
     * Enqueue a job to run at the provided date-time.
     */
    public Long enqueueAt(String type, Object payload, OffsetDateTime runAt) {
        String normalizedType = normalizeRequiredType(type);
        return enqueue(normalizedType, payload, defaultMaxAttempts(normalizedType), 0, normalizeRequiredRunAt(runAt));
    }

    /**
     * Full enqueue-at method with all options.
     */
    public Long enqueueAt(String type, Object payload, int maxAttempts, int priority, OffsetDateTime runAt) {
        return enqueue(type, payload, maxAttempts, priority, normalizeRequiredRunAt(runAt));
    }

    private Long enqueue(String type, Object payload, int maxAttempts, int priority, OffsetDateTime explicitRunAt) {
        String normalizedType = normalizeRequiredType(type);
        validateMaxAttempts(maxAttempts);
        JsonNode jsonNode = payload != null ? objectMapper.valueToTree(payload) : null;

        Job job = new Job(normalizedType, jsonNode, maxAttempts, priority);
        if (explicitRunAt != null) {
            job.setRunAt(explicitRunAt);
        }
        Job saved = jobStore.save(job);
        log.debug("Enqueued job {} of type {} to run at {}", saved.getId(), normalizedType, saved.getRunAt());
        return saved.getId();
    }

    /**
     * Moves a job to a new run time. A permanently failed job is revived with a fresh attempt
     * counter. The update announces the job again.
     *
     * @return false when no job with that id exists
     */
    public boolean reschedule(Long jobId, OffsetDateTime runAt) {
        validateRequiredId(jobId);
        OffsetDateTime normalizedRunAt = normalizeRequiredRunAt(runAt);
        Boolean updated = transactionTemplate.execute(status -> jobRepository.findByIdForUpdate(jobId)
                .map(job -> {
                    job.setRunAt(normalizedRunAt);
                    if (job.isFailed()) {
                        job.setFailedAt(null);
                        job.setAttempts(0);
                        job.setLastError(null);
                    }
                    jobStore.save(job);
                    return true;
                })
                .orElse(false));
        return Boolean.TRUE.equals(updated);
    }

    /**
     * Deletes a job. Notifications already on the broker for it are dropped by the reserving worker.
     *
     * @return false when no job with that id exists
     */
    public boolean delete(Long jobId) {
        validateRequiredId(jobId);
        Boolean deleted = transactionTemplate.execute(status -> jobRepository.findByIdForUpdate(jobId)
                .map(job -> {
                    jobStore.delete(job);
                    return true;
                })
                .orElse(false));
        return Boolean.TRUE.equals(deleted);
    }

    /**
     * Publishes a fresh notification for every job that has not permanently failed. Used to recover
     * after the broker lost messages; duplicates are harmless because the job row decides.
     *
     * @return the number of jobs announced
     */
    public int republishAll() {
        int published = 0;
        Pageable pageable = PageRequest.of(0, REPUBLISH_PAGE_SIZE);
        Slice<Job> slice;
        do {
            slice = jobRepository.findDispatchableJobs(pageable);
            for (Job job : slice) {
                notifier.publish(job);
                published++;
            }
            pageable = slice.nextPageable();
        } while (slice.hasNext());
        log.info("Republished notifications for {} jobs", published);
        return published;
    }

    private int defaultMaxAttempts(String type) {
        return workerRegistry.find(type)
                .map(JobWorkerRegistry.RegisteredWorker::annotation)
                .filter(annotation -> annotation != null && annotation.maxAttempts() >= 0)
                .map(com.jobsignal.annotation.Job::maxAttempts)
                .orElse(properties.getJobs().getDefaultMaxAttempts());
    }

    private String normalizeRequiredType(String type) {
        if (type == null) {
            throw new IllegalArgumentException("Job type must not be null");
        }
        String trimmed = type.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("Job type must not be blank");
        }
        return trimmed;
    }

    private void validateMaxAttempts(int maxAttempts) {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
    }

    private void validateRequiredId(Long jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId must not be null");
        }
    }

    private OffsetDateTime normalizeRequiredRunAt(Instant runAt) {
        if (runAt == null) {
            throw new IllegalArgumentException("runAt must not be null");
        }
        return OffsetDateTime.ofInstant(runAt, ZoneOffset.UTC);
    }

    private OffsetDateTime normalizeRequiredRunAt(OffsetDateTime runAt) {
        if (runAt == null) {
            throw new IllegalArgumentException("runAt must not be null");
        }
        return runAt;
    }
}
