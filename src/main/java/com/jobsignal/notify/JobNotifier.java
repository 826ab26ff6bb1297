package com.jobsignal.notify;

import com.jobsignal.Job;
import com.jobsignal.broker.Broker;
import com.jobsignal.broker.BrokerPriority;
import com.jobsignal.broker.PublishOptions;
import com.jobsignal.config.JobSignalProperties;
import com.jobsignal.internal.JobSignalMetrics;
import com.jobsignal.store.JobChange;
import com.jobsignal.store.JobCommitHook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * Announces job rows on the broker. Subscribed to the job store's commit hook, it publishes after
 * every committed create or update; callers may also publish directly, e.g. to schedule a recheck.
 * A failed publish never fails the caller: the job row is the source of truth and a lost
 * notification is recovered by {@link com.jobsignal.JobClient#republishAll()}.
 */
public class JobNotifier implements JobCommitHook {

    private static final Logger log = LoggerFactory.getLogger(JobNotifier.class);

    private final Broker broker;
    private final NotificationCodec codec;
    private final Map<Integer, BrokerPriority> priorityMap;
    private final ExceptionReporter exceptionReporter;
    private final JobSignalMetrics metrics;

    public JobNotifier(Broker broker, NotificationCodec codec, JobSignalProperties properties,
            ObjectProvider<ExceptionReporter> exceptionReporter, JobSignalMetrics metrics) {
        this(broker, codec, properties, exceptionReporter.getIfAvailable(), metrics);
    }

    JobNotifier(Broker broker, NotificationCodec codec, JobSignalProperties properties,
            ExceptionReporter exceptionReporter, JobSignalMetrics metrics) {
        this.broker = broker;
        this.codec = codec;
        this.priorityMap = Map.copyOf(properties.getJobs().getPriorityMap());
        this.exceptionReporter = exceptionReporter;
        this.metrics = metrics;
    }

    @Override
    public void afterCompletion(JobChange change) {
        Job job = change.job();
        switch (change.kind()) {
            case DESTROY, ROLLBACK -> {
                return;
            }
            case CREATE, UPDATE -> {
                if (change.internal()) {
                    return;
                }
                if (job.isFailed()) {
                    log.debug("Not announcing job {} because it has permanently failed", job.getId());
                    return;
                }
                publish(job);
            }
        }
    }

    /**
     * Publishes a notification due at the job's {@code run_at}.
     *
     * @throws UnpersistedJobException if the job has no id
     */
    public void publish(Job job) {
        publish(job, null);
    }

    /**
     * Publishes a notification due at {@code runAtOverride}, or at the job's {@code run_at} when the
     * override is null.
     *
     * @throws UnpersistedJobException if the job has no id
     */
    public void publish(Job job, OffsetDateTime runAtOverride) {
        if (job.getId() == null) {
            throw new UnpersistedJobException("Cannot publish an unsaved job of type " + job.getType());
        }

        try {
            NotificationMessage message = NotificationMessage.of(job);
            OffsetDateTime runAt = runAtOverride != null ? runAtOverride : job.getRunAt();
            broker.publish(codec.encode(message), new PublishOptions(resolvePriority(job), runAt));
            metrics.notificationPublished();
            log.debug("Published notification for job {} due at {}", job.getId(), runAt);
        } catch (RuntimeException e) {
            metrics.notificationFailed();
            log.error("Failed to publish notification for job {}", job.getId(), e);
            if (exceptionReporter != null) {
                exceptionReporter.report(e);
            }
        }
    }

    BrokerPriority resolvePriority(Job job) {
        BrokerPriority priority = priorityMap.get(job.getPriority());
        if (priority == null) {
            log.warn("No broker priority mapped for job priority {} (job {}); using {}", job.getPriority(),
                    job.getId(), BrokerPriority.NORMAL);
            return BrokerPriority.NORMAL;
        }
        return priority;
    }
}
