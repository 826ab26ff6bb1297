package com.jobsignal.broker;

public class BrokerTransportException extends RuntimeException {

    public BrokerTransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
