package com.jobsignal.internal;

import com.jobsignal.JobRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

public class JobSignalMetrics {

    private static final Logger log = LoggerFactory.getLogger(JobSignalMetrics.class);
    private static final long SNAPSHOT_TTL_NANOS = Duration.ofSeconds(1).toNanos();

    /**
     * What a single {@code reserve} call ended with.
     */
    public enum ReservationOutcome {
        IDLE,
        RESERVED,
        RECOVERED_STALE_LOCK,
        JOB_MISSING,
        JOB_FAILED,
        STALE_NOTIFICATION,
        LOCK_HELD,
        EXTERNAL
    }

    private final JobRepository jobRepository;
    private final MeterRegistry meterRegistry;
    private final Object snapshotMonitor = new Object();
    private final Map<ReservationOutcome, Counter> reservationCounters = new EnumMap<>(ReservationOutcome.class);
    private final Counter notificationsPublished;
    private final Counter notificationsFailed;

    private volatile LifecycleSnapshot cachedSnapshot = LifecycleSnapshot.empty();
    private volatile long snapshotCapturedAtNanos = System.nanoTime() - SNAPSHOT_TTL_NANOS - 1;

    public JobSignalMetrics(JobRepository jobRepository, MeterRegistry meterRegistry) {
        this.jobRepository = jobRepository;
        this.meterRegistry = meterRegistry;
        for (ReservationOutcome outcome : ReservationOutcome.values()) {
            reservationCounters.put(outcome, Counter.builder("jobsignal.reservations")
                    .description("Outcomes of job reservation attempts")
                    .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                    .register(meterRegistry));
        }
        this.notificationsPublished = Counter.builder("jobsignal.notifications")
                .description("Job notifications handed to the broker")
                .tag("result", "published")
                .register(meterRegistry);
        this.notificationsFailed = Counter.builder("jobsignal.notifications")
                .description("Job notifications handed to the broker")
                .tag("result", "failed")
                .register(meterRegistry);
    }

    public void registerGauges() {
        log.info("Registering JobSignal gauges...");

        Gauge.builder("jobsignal.jobs.count", this, metrics -> metrics.getSnapshot().pendingCount())
                .description("Number of JobSignal jobs")
                .tag("status", "PENDING")
                .register(meterRegistry);

        Gauge.builder("jobsignal.jobs.count", this, metrics -> metrics.getSnapshot().lockedCount())
                .description("Number of JobSignal jobs")
                .tag("status", "LOCKED")
                .register(meterRegistry);

        Gauge.builder("jobsignal.jobs.count", this, metrics -> metrics.getSnapshot().failedCount())
                .description("Number of JobSignal jobs")
                .tag("status", "FAILED")
                .register(meterRegistry);
    }

    public void reservation(ReservationOutcome outcome) {
        reservationCounters.get(outcome).increment();
    }

    public void notificationPublished() {
        notificationsPublished.increment();
    }

    public void notificationFailed() {
        notificationsFailed.increment();
    }

    private LifecycleSnapshot getSnapshot() {
        long now = System.nanoTime();
        LifecycleSnapshot currentSnapshot = cachedSnapshot;
        if (now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
            return currentSnapshot;
        }

        synchronized (snapshotMonitor) {
            now = System.nanoTime();
            if (now - snapshotCapturedAtNanos <= SNAPSHOT_TTL_NANOS) {
                return cachedSnapshot;
            }
            cachedSnapshot = loadSnapshot();
            snapshotCapturedAtNanos = now;
            return cachedSnapshot;
        }
    }

    private LifecycleSnapshot loadSnapshot() {
        try {
            JobRepository.LifecycleCounts counts = jobRepository.countLifecycleCounts();
            return new LifecycleSnapshot(
                    countOrZero(counts.getPendingCount()),
                    countOrZero(counts.getLockedCount()),
                    countOrZero(counts.getFailedCount()));
        } catch (RuntimeException e) {
            log.trace("Failed to query lifecycle counts for metrics: {}", e.getMessage());
            return LifecycleSnapshot.empty();
        }
    }

    private long countOrZero(Long value) {
        return value == null ? 0L : value;
    }

    private record LifecycleSnapshot(long pendingCount, long lockedCount, long failedCount) {
        private static LifecycleSnapshot empty() {
            return new LifecycleSnapshot(0, 0, 0);
        }
    }
}
