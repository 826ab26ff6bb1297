package com.jobsignal.internal;

import com.jobsignal.broker.BrokerMessage;

/**
 * Handles broker traffic that is not a job notification. Declare beans of this type; they are
 * consulted in bean order.
 */
public interface ExternalMessageHandler {

    boolean claims(BrokerMessage message);

    void handle(byte[] payload);
}
