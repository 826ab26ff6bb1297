package com.jobsignal.notify;

/**
 * Raised when a notification is requested for a job that has no identity yet.
 */
public class UnpersistedJobException extends IllegalArgumentException {

    public UnpersistedJobException(String message) {
        super(message);
    }
}
