package com.jobsignal.broker.memory;

import com.jobsignal.broker.Broker;
import com.jobsignal.broker.BrokerMessage;
import com.jobsignal.broker.BrokerPriority;
import com.jobsignal.broker.PublishOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.DelayQueue;
import java.util.concurrent.Delayed;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single-process broker backed by a {@link DelayQueue}. Messages become visible at their
 * {@code runAt}; among messages due at the same instant higher priorities come first. A popped
 * message that is not acknowledged within {@code ackWait} is delivered again.
 */
public class InMemoryBroker implements Broker {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBroker.class);

    private final DelayQueue<Delivery> queue = new DelayQueue<>();
    private final AtomicLong sequence = new AtomicLong();
    private final Duration ackWait;

    public InMemoryBroker(Duration ackWait) {
        if (ackWait == null || ackWait.isNegative() || ackWait.isZero()) {
            throw new IllegalArgumentException("ackWait must be positive");
        }
        this.ackWait = ackWait;
    }

    @Override
    public void publish(byte[] payload, PublishOptions options) {
        long dueAtMillis = options.runAt() == null
                ? System.currentTimeMillis()
                : options.runAt().toInstant().toEpochMilli();
        InMemoryMessage message = new InMemoryMessage(payload.clone(), options.priority());
        queue.put(new Delivery(message, dueAtMillis, sequence.incrementAndGet()));
    }

    @Override
    public Optional<BrokerMessage> pop(Duration wait) throws InterruptedException {
        long deadline = System.nanoTime() + wait.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            Delivery delivery = queue.poll(Math.max(0L, remaining), TimeUnit.NANOSECONDS);
            if (delivery == null) {
                return Optional.empty();
            }
            InMemoryMessage message = delivery.message();
            if (message.isAcknowledged()) {
                continue;
            }
            // redelivered unless acknowledged before ackWait runs out
            long redeliverAt = System.currentTimeMillis() + ackWait.toMillis();
            queue.put(new Delivery(message, redeliverAt, sequence.incrementAndGet()));
            return Optional.of(message);
        }
    }

    /**
     * Number of deliveries still pending, including scheduled redeliveries of unacknowledged
     * messages.
     */
    public int size() {
        return (int) queue.stream().filter(delivery -> !delivery.message().isAcknowledged()).count();
    }

    private static final class Delivery implements Delayed {

        private final InMemoryMessage message;
        private final long dueAtMillis;
        private final long seq;

        private Delivery(InMemoryMessage message, long dueAtMillis, long seq) {
            this.message = message;
            this.dueAtMillis = dueAtMillis;
            this.seq = seq;
        }

        InMemoryMessage message() {
            return message;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(dueAtMillis - System.currentTimeMillis(), TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed other) {
            Delivery that = (Delivery) other;
            int byDue = Long.compare(dueAtMillis, that.dueAtMillis);
            if (byDue != 0) {
                return byDue;
            }
            int byPriority = message.priority().compareTo(that.message.priority());
            if (byPriority != 0) {
                return byPriority;
            }
            return Long.compare(seq, that.seq);
        }
    }

    private static final class InMemoryMessage implements BrokerMessage {

        private final byte[] payload;
        private final BrokerPriority priority;
        private final AtomicBoolean acknowledged = new AtomicBoolean(false);

        private InMemoryMessage(byte[] payload, BrokerPriority priority) {
            this.payload = payload;
            this.priority = priority;
        }

        BrokerPriority priority() {
            return priority;
        }

        boolean isAcknowledged() {
            return acknowledged.get();
        }

        @Override
        public byte[] payload() {
            return payload.clone();
        }

        @Override
        public void ack() {
            if (!acknowledged.compareAndSet(false, true)) {
                log.debug("Ignoring repeated ack of in-memory message");
            }
        }
    }
}
