package com.jobsignal.internal;

import com.jobsignal.Job;
import com.jobsignal.broker.Broker;
import com.jobsignal.broker.BrokerMessage;
import com.jobsignal.config.JobSignalProperties;
import com.jobsignal.internal.JobSignalMetrics.ReservationOutcome;
import com.jobsignal.notify.JobNotifier;
import com.jobsignal.notify.NotificationCodec;
import com.jobsignal.notify.NotificationMessage;
import com.jobsignal.store.JobLockManager;
import com.jobsignal.store.JobStoreClock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Turns one broker notification into a decision about the job it names.
 * <p>
 * The broker only says a job might be ready; the job row decides. Every popped message is either
 * acknowledged before {@link #reserve(String)} returns, or attached to the returned job and
 * acknowledged by {@link JobInvoker} once the job has run. If reserving fails with an exception the
 * message is left unacknowledged so the broker delivers it again.
 */
public class JobReserver {

    private static final Logger log = LoggerFactory.getLogger(JobReserver.class);

    private final Broker broker;
    private final NotificationCodec codec;
    private final JobLockManager lockManager;
    private final JobNotifier notifier;
    private final JobStoreClock clock;
    private final ExternalMessageRouter externalMessageRouter;
    private final JobSignalMetrics metrics;
    private final Duration maxRunDuration;
    private final Duration popTimeout;
    private final Duration minIdleDelay;

    public JobReserver(
            Broker broker,
            NotificationCodec codec,
            JobLockManager lockManager,
            JobNotifier notifier,
            JobStoreClock clock,
            ExternalMessageRouter externalMessageRouter,
            JobSignalMetrics metrics,
            JobSignalProperties properties) {
        this.broker = broker;
        this.codec = codec;
        this.lockManager = lockManager;
        this.notifier = notifier;
        this.clock = clock;
        this.externalMessageRouter = externalMessageRouter;
        this.metrics = metrics;
        this.maxRunDuration = properties.getJobs().getMaxRunDuration();
        this.popTimeout = properties.getBackgroundJobServer().getPopTimeout();
        Duration configuredIdleDelay = properties.getBackgroundJobServer().getMinIdleDelay();
        this.minIdleDelay = configuredIdleDelay == null || configuredIdleDelay.isNegative()
                ? Duration.ZERO
                : configuredIdleDelay;
        if (maxRunDuration == null || maxRunDuration.isNegative() || maxRunDuration.isZero()) {
            throw new IllegalArgumentException("jobsignal.jobs.max-run-duration must be positive");
        }
    }

    /**
     * Pops one notification and decides what to do with the job it names.
     *
     * @param workerName identity written to {@code locked_by} when the job is claimed
     * @return the locked job, carrying the broker message to acknowledge after it ran; empty when
     *         there is nothing to run for this notification
     * @throws InterruptedException if the thread is interrupted while waiting on the broker or during
     *                              the idle delay
     */
    public Optional<Job> reserve(String workerName) throws InterruptedException {
        Optional<BrokerMessage> popped = broker.pop(popTimeout);
        if (popped.isEmpty()) {
            metrics.reservation(ReservationOutcome.IDLE);
            // keeps an empty queue from turning the worker loop into a busy spin
            Thread.sleep(minIdleDelay.toMillis());
            return Optional.empty();
        }

        BrokerMessage message = popped.get();
        Optional<NotificationMessage> notification = codec.decode(message.payload());
        if (notification.isEmpty()) {
            externalMessageRouter.route(message);
            message.ack();
            metrics.reservation(ReservationOutcome.EXTERNAL);
            return Optional.empty();
        }
        return reserve(workerName, message, notification.get());
    }

    private Optional<Job> reserve(String workerName, BrokerMessage message, NotificationMessage notification) {
        Decision decision = new Decision();
        Optional<Job> locked = withInterruptsMasked(() -> lockManager.acquire(
                notification.jobId(), workerName, row -> decide(row, notification, decision)));

        if (locked.isPresent()) {
            Job job = locked.get();
            job.setAttachedMessage(message);
            metrics.reservation(decision.outcome);
            log.debug("Reserved job {} for {} ({})", job.getId(), workerName, decision.outcome);
            return locked;
        }

        ReservationOutcome outcome = decision.outcome == null ? ReservationOutcome.JOB_MISSING : decision.outcome;
        if (outcome == ReservationOutcome.LOCK_HELD) {
            // recheck once the current lock expires, in case its holder never finishes
            Job row = decision.row;
            notifier.publish(row, row.getLockedAt().plus(maxRunDuration));
        }
        message.ack();
        metrics.reservation(outcome);
        log.debug("Dropped notification for job {} ({})", notification.jobId(), outcome);
        return Optional.empty();
    }

    private boolean decide(Job row, NotificationMessage notification, Decision decision) {
        decision.row = row;
        if (row.isFailed()) {
            decision.outcome = ReservationOutcome.JOB_FAILED;
            return false;
        }
        if (!notification.describes(row)) {
            decision.outcome = ReservationOutcome.STALE_NOTIFICATION;
            return false;
        }
        if (!row.isLocked()) {
            decision.outcome = ReservationOutcome.RESERVED;
            return true;
        }

        Duration lockAge = Duration.between(row.getLockedAt(), clock.now());
        if (lockAge.compareTo(maxRunDuration) < 0) {
            decision.outcome = ReservationOutcome.LOCK_HELD;
            return false;
        }
        log.info("Job {} locked by {} since {} exceeded max run duration {}; taking over", row.getId(),
                row.getLockedBy(), row.getLockedAt(), maxRunDuration);
        decision.outcome = ReservationOutcome.RECOVERED_STALE_LOCK;
        return true;
    }

    /**
     * Runs {@code action} with the thread's interrupt status cleared, restoring it afterwards, so a
     * pending interrupt cannot abort the lock transaction halfway.
     */
    private static <T> T withInterruptsMasked(Supplier<T> action) {
        boolean interrupted = Thread.interrupted();
        try {
            return action.get();
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private static final class Decision {
        private ReservationOutcome outcome;
        private Job row;
    }
}
