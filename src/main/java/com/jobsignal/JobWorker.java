package com.jobsignal;

/**
 * Performs jobs of one type. Implementations are picked up as Spring beans by the
 * {@link com.jobsignal.internal.JobWorkerRegistry}.
 *
 * @param <T> payload type; the stored JSON payload is converted to it before {@link #process}
 */
public interface JobWorker<T> {

    /**
     * Runs one attempt of a job. Throwing counts as a failed attempt: the job is retried with
     * backoff until its attempts are used up.
     */
    void process(Long jobId, T payload) throws Exception;

    /**
     * Called when {@link #process(Long, Object)} throws. A failure here is logged and does not
     * replace the original one.
     */
    default void onError(Long jobId, T payload, Exception exception) {
    }

    /**
     * Called after {@link #process(Long, Object)} returned. A failure here is logged; the job
     * still counts as done.
     */
    default void onSuccess(Long jobId, T payload) {
    }

    /**
     * The job type this worker handles. {@code null} (the default) uses the value of the
     * {@link com.jobsignal.annotation.Job} annotation.
     */
    default String getJobType() {
        return null;
    }

    /**
     * The class payloads are converted to. {@code null} (the default) infers it from the type
     * argument of {@code JobWorker<T>}.
     */
    default Class<T> getPayloadClass() {
        return null;
    }
}
