package com.jobsignal.broker;

/**
 * Delivery priority classes understood by the broker. Higher priorities are drained first.
 */
public enum BrokerPriority {
    HIGH,
    NORMAL,
    LOW,
    BULK
}
