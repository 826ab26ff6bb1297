package com.jobsignal.broker;

import java.time.Duration;
import java.util.Optional;

/**
 * Client side of the message broker carrying job notifications.
 */
public interface Broker {

    /**
     * @throws BrokerTransportException when the broker cannot be reached or rejects the message
     */
    void publish(byte[] payload, PublishOptions options);

    /**
     * Blocks until a message is due or {@code wait} elapses.
     *
     * @return the next message, or empty when none arrived in time
     * @throws InterruptedException when the calling thread is interrupted while waiting
     */
    Optional<BrokerMessage> pop(Duration wait) throws InterruptedException;
}
