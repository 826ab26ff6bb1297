package com.jobsignal.broker;

import java.time.OffsetDateTime;

/**
 * @param priority delivery priority, never null
 * @param runAt    earliest time the message should be handed out by {@link Broker#pop}; null means
 *                 immediately
 */
public record PublishOptions(BrokerPriority priority, OffsetDateTime runAt) {

    public PublishOptions {
        if (priority == null) {
            throw new IllegalArgumentException("priority must not be null");
        }
    }
}
