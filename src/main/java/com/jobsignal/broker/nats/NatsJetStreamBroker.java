package com.jobsignal.broker.nats;

import com.jobsignal.broker.Broker;
import com.jobsignal.broker.BrokerMessage;
import com.jobsignal.broker.BrokerPriority;
import com.jobsignal.broker.BrokerTransportException;
import com.jobsignal.broker.PublishOptions;
import com.jobsignal.config.JobSignalProperties;
import io.nats.client.Connection;
import io.nats.client.JetStream;
import io.nats.client.JetStreamApiException;
import io.nats.client.JetStreamManagement;
import io.nats.client.JetStreamSubscription;
import io.nats.client.Message;
import io.nats.client.PullSubscribeOptions;
import io.nats.client.api.AckPolicy;
import io.nats.client.api.ConsumerConfiguration;
import io.nats.client.api.StreamConfiguration;
import io.nats.client.impl.Headers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link Broker} on NATS JetStream. Each priority has its own subject
 * ({@code <subject-prefix>.<priority>}) and durable pull consumer; {@link #pop(Duration)} drains
 * them in priority order. JetStream has no scheduled delivery, so the target time travels in the
 * {@value #RUN_AT_HEADER} header and a message popped too early is handed back with
 * {@code nakWithDelay} until it is due.
 */
public class NatsJetStreamBroker implements Broker {

    static final String RUN_AT_HEADER = "Jobsignal-Run-At";

    private static final Logger log = LoggerFactory.getLogger(NatsJetStreamBroker.class);
    private static final int STREAM_NOT_FOUND_ERROR = 404;
    private static final int STREAM_NOT_FOUND_API_ERROR = 10059;
    private static final Duration MAX_FETCH_SLICE = Duration.ofMillis(100);

    private final Connection connection;
    private final JobSignalProperties.Broker properties;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final Map<BrokerPriority, JetStreamSubscription> subscriptions = new EnumMap<>(BrokerPriority.class);
    private JetStream jetStream;

    public NatsJetStreamBroker(Connection connection, JobSignalProperties.Broker properties) {
        this.connection = connection;
        this.properties = properties;
    }

    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }
        try {
            ensureStream();
            jetStream = connection.jetStream();
            for (BrokerPriority priority : BrokerPriority.values()) {
                subscriptions.put(priority, jetStream.subscribe(subjectFor(priority), pullOptionsFor(priority)));
            }
            log.info("JetStream broker started stream={} subjects={}.*", properties.getStream(),
                    properties.getSubjectPrefix());
        } catch (IOException | JetStreamApiException e) {
            started.set(false);
            throw new IllegalStateException("Failed to start JetStream job notification consumers", e);
        }
    }

    public void stop() {
        for (JetStreamSubscription subscription : subscriptions.values()) {
            try {
                subscription.unsubscribe();
            } catch (IllegalStateException e) {
                log.debug("Subscription already closed: {}", e.getMessage());
            }
        }
        subscriptions.clear();
        started.set(false);
    }

    @Override
    public void publish(byte[] payload, PublishOptions options) {
        if (jetStream == null) {
            throw new IllegalStateException("JetStream broker has not been started");
        }
        Headers headers = new Headers();
        if (options.runAt() != null) {
            headers.add(RUN_AT_HEADER, options.runAt().toString());
        }
        try {
            jetStream.publish(subjectFor(options.priority()), headers, payload);
        } catch (IOException | JetStreamApiException e) {
            throw new BrokerTransportException("Failed to publish job notification", e);
        }
    }

    @Override
    public Optional<BrokerMessage> pop(Duration wait) throws InterruptedException {
        if (subscriptions.isEmpty()) {
            throw new IllegalStateException("JetStream broker has not been started");
        }
        long deadline = System.nanoTime() + wait.toNanos();
        do {
            for (BrokerPriority priority : BrokerPriority.values()) {
                Duration slice = fetchSlice(deadline);
                List<Message> fetched = subscriptions.get(priority).fetch(1, slice);
                if (Thread.interrupted()) {
                    fetched.forEach(this::nakQuietly);
                    throw new InterruptedException("Interrupted while waiting for job notifications");
                }
                for (Message message : fetched) {
                    Optional<Duration> notYetDue = remainingDelay(message);
                    if (notYetDue.isPresent()) {
                        message.nakWithDelay(notYetDue.get());
                        continue;
                    }
                    return Optional.of(new JetStreamMessage(message));
                }
            }
        } while (System.nanoTime() < deadline);
        return Optional.empty();
    }

    private Duration fetchSlice(long deadlineNanos) {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            return Duration.ofMillis(1);
        }
        Duration left = Duration.ofNanos(remaining);
        return left.compareTo(MAX_FETCH_SLICE) < 0 ? left : MAX_FETCH_SLICE;
    }

    private Optional<Duration> remainingDelay(Message message) {
        Headers headers = message.getHeaders();
        String runAt = headers == null ? null : headers.getFirst(RUN_AT_HEADER);
        if (runAt == null) {
            return Optional.empty();
        }
        try {
            Duration delay = Duration.between(OffsetDateTime.now(), OffsetDateTime.parse(runAt));
            return delay.isNegative() || delay.isZero() ? Optional.empty() : Optional.of(delay);
        } catch (DateTimeParseException e) {
            log.warn("Ignoring unparseable {} header '{}'", RUN_AT_HEADER, runAt);
            return Optional.empty();
        }
    }

    private void nakQuietly(Message message) {
        try {
            message.nak();
        } catch (IllegalStateException e) {
            log.warn("Failed to nak JetStream message", e);
        }
    }

    private String subjectFor(BrokerPriority priority) {
        return properties.getSubjectPrefix() + "." + priority.name().toLowerCase(Locale.ROOT);
    }

    private void ensureStream() throws IOException, JetStreamApiException {
        StreamConfiguration streamConfiguration = StreamConfiguration.builder()
                .name(properties.getStream())
                .subjects(properties.getSubjectPrefix() + ".*")
                .build();
        JetStreamManagement jetStreamManagement = connection.jetStreamManagement();
        try {
            jetStreamManagement.updateStream(streamConfiguration);
        } catch (JetStreamApiException e) {
            if (e.getApiErrorCode() != STREAM_NOT_FOUND_API_ERROR && e.getErrorCode() != STREAM_NOT_FOUND_ERROR) {
                throw e;
            }
            jetStreamManagement.addStream(streamConfiguration);
        }
    }

    private PullSubscribeOptions pullOptionsFor(BrokerPriority priority) {
        ConsumerConfiguration consumerConfiguration = ConsumerConfiguration.builder()
                .ackPolicy(AckPolicy.Explicit)
                .ackWait(properties.getAckWait())
                .maxDeliver(properties.getMaxDeliver())
                .filterSubject(subjectFor(priority))
                .build();
        return PullSubscribeOptions.builder()
                .stream(properties.getStream())
                .durable(properties.getDurablePrefix() + "-" + priority.name().toLowerCase(Locale.ROOT))
                .configuration(consumerConfiguration)
                .build();
    }

    private static final class JetStreamMessage implements BrokerMessage {

        private final Message message;
        private final AtomicBoolean acknowledged = new AtomicBoolean(false);

        private JetStreamMessage(Message message) {
            this.message = message;
        }

        @Override
        public byte[] payload() {
            return message.getData();
        }

        @Override
        public void ack() {
            if (!acknowledged.compareAndSet(false, true)) {
                log.debug("Ignoring repeated ack of JetStream message {}", message.getSID());
                return;
            }
            message.ack();
        }
    }
}
