package com.jobsignal.internal;

import com.jobsignal.Job;
import com.jobsignal.broker.BrokerMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a reserved job and settles the broker message that led to its reservation.
 */
public class JobInvoker {

    private static final Logger log = LoggerFactory.getLogger(JobInvoker.class);

    private final JobWorkerRegistry registry;

    public JobInvoker(JobWorkerRegistry registry) {
        this.registry = registry;
    }

    /**
     * Performs the job through its {@link com.jobsignal.JobWorker}. The attached broker message, if
     * any, is acknowledged exactly once after the worker returns or throws, and then cleared. Jobs
     * obtained without a message run without an acknowledgment step.
     *
     * @throws Exception whatever the worker (or payload deserialization) threw, after the
     *                   acknowledgment
     */
    public void invoke(Job job) throws Exception {
        try {
            JobWorkerRegistry.RegisteredWorker registration = registry.require(job.getType());
            Object payload = registration.readPayload(job.getPayload());
            try {
                registration.process(job.getId(), payload);
            } catch (Exception e) {
                invokeOnErrorSafely(registration, job, payload, e);
                throw e;
            }
            invokeOnSuccessSafely(registration, job, payload);
        } finally {
            acknowledge(job);
        }
    }

    private void acknowledge(Job job) {
        BrokerMessage message = job.getAttachedMessage();
        if (message == null) {
            return;
        }
        job.setAttachedMessage(null);
        message.ack();
    }

    private void invokeOnErrorSafely(JobWorkerRegistry.RegisteredWorker registration, Job job, Object payload,
            Exception error) {
        try {
            registration.onError(job.getId(), payload, error);
        } catch (RuntimeException onErrorFailure) {
            log.error("onError callback failed for job {} of type {}", job.getId(), registration.type(),
                    onErrorFailure);
        }
    }

    private void invokeOnSuccessSafely(JobWorkerRegistry.RegisteredWorker registration, Job job, Object payload) {
        try {
            registration.onSuccess(job.getId(), payload);
        } catch (RuntimeException onSuccessFailure) {
            log.error("onSuccess callback failed for job {} of type {}", job.getId(), registration.type(),
                    onSuccessFailure);
        }
    }
}
