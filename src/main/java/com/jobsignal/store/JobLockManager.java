package com.jobsignal.store;

import com.jobsignal.Job;
import com.jobsignal.JobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * The single place where row-level mutual exclusion on job rows is implemented.
 * <p>
 * {@link #acquire(Long, String, Predicate)} opens a transaction, takes an exclusive row lock on the
 * job and asks the caller whether to claim it. Concurrent callers for the same id queue on the row
 * lock, so each decision observes the state committed by the previous one.
 */
public class JobLockManager {

    private static final Logger log = LoggerFactory.getLogger(JobLockManager.class);

    private final JobRepository jobRepository;
    private final JobStore jobStore;
    private final JobStoreClock clock;
    private final TransactionTemplate transactionTemplate;

    public JobLockManager(JobRepository jobRepository, JobStore jobStore, JobStoreClock clock,
            TransactionTemplate transactionTemplate) {
        this.jobRepository = jobRepository;
        this.jobStore = jobStore;
        this.clock = clock;
        this.transactionTemplate = transactionTemplate;
    }

    /**
     * Locks the job row and lets {@code decide} accept or reject the claim.
     *
     * @param jobId  the job to lock
     * @param owner  stored in {@code locked_by} when the claim is accepted
     * @param decide sees the row as currently persisted, before any lock stamp is applied
     * @return the stamped job when {@code decide} returned true; empty when the row does not exist
     *         (decide is not called) or the claim was rejected
     */
    public Optional<Job> acquire(Long jobId, String owner, Predicate<Job> decide) {
        if (jobId == null) {
            throw new IllegalArgumentException("jobId must not be null");
        }
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner must not be blank");
        }

        Job locked = transactionTemplate.execute(status -> {
            Optional<Job> row = jobRepository.findByIdForUpdate(jobId);
            if (row.isEmpty()) {
                log.debug("Job {} not found while acquiring lock", jobId);
                return null;
            }

            Job job = row.get();
            if (!decide.test(job)) {
                log.debug("Lock on job {} rejected for {}", jobId, owner);
                return null;
            }

            OffsetDateTime now = clock.now();
            job.lock(now, owner);
            Job saved = jobStore.saveInternal(job);
            log.debug("Job {} locked by {} at {}", jobId, owner, now);
            return saved;
        });
        return Optional.ofNullable(locked);
    }
}
