package com.jobsignal.notify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.jobsignal.Job;

/**
 * Wire payload announcing that a job may be ready. Disposable: the broker may deliver it any number
 * of times and it may be stale by the time it arrives.
 */
public record NotificationMessage(
        @JsonProperty("job_id") Long jobId,
        @JsonProperty("last_modified_at") String lastModifiedAt,
        @JsonProperty("fingerprint") String fingerprint) {

    public static NotificationMessage of(Job job) {
        if (job.getId() == null) {
            throw new UnpersistedJobException("Cannot build a notification for an unsaved job of type " + job.getType());
        }
        if (job.getUpdatedAt() == null) {
            throw new IllegalStateException("Job " + job.getId() + " has no updated_at timestamp");
        }
        return new NotificationMessage(
                job.getId(),
                JobFingerprint.canonicalTimestamp(job.getUpdatedAt()),
                JobFingerprint.of(job.getId(), job.getUpdatedAt()));
    }

    /**
     * True when the row is still at the version this notification was produced for.
     */
    public boolean describes(Job job) {
        return jobId.equals(job.getId())
                && job.getUpdatedAt() != null
                && fingerprint.equals(JobFingerprint.of(job.getId(), job.getUpdatedAt()));
    }
}
