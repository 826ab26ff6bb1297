package com.jobsignal.broker;

/**
 * A message handed out by {@link Broker#pop}. Until it is acknowledged the broker may redeliver it.
 */
public interface BrokerMessage {

    byte[] payload();

    /**
     * Acknowledges the message. Implementations tolerate a repeated call without side effects.
     */
    void ack();
}
