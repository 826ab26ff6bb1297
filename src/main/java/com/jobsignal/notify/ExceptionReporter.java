package com.jobsignal.notify;

/**
 * Optional sink for failures that are handled locally and would otherwise only reach the log,
 * e.g. an error tracker. Declare a bean of this type to receive them.
 */
@FunctionalInterface
public interface ExceptionReporter {

    void report(Throwable throwable);
}
