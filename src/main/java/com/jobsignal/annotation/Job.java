package com.jobsignal.annotation;

import java.lang.annotation.*;

/**
 * Marks a {@link com.jobsignal.JobWorker} and configures how failed attempts of its jobs are
 * retried.
 */
@Target({ ElementType.TYPE })
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface Job {

    /**
     * The type of job this worker handles.
     */
    String value();

    /**
     * The number of attempts before a job is marked as failed permanently. A negative value defers
     * to {@code jobsignal.jobs.default-max-attempts}.
     */
    int maxAttempts() default -1;

    /**
     * The multiplier used for exponential backoff between attempts.
     */
    double backoffMultiplier() default 2.0;

    /**
     * The delay in milliseconds before the second attempt.
     */
    long initialBackoffMs() default 1000;
}
