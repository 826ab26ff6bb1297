package com.jobsignal;

import com.jobsignal.broker.Broker;
import com.jobsignal.broker.memory.InMemoryBroker;
import com.jobsignal.config.JobSignalProperties;
import io.nats.client.Connection;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BrokerSelectionTest {

    @Configuration
    @EnableConfigurationProperties(JobSignalProperties.class)
    static class Config {
    }

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(Config.class,
                    JobSignalAutoConfiguration.InMemoryBrokerConfiguration.class,
                    JobSignalAutoConfiguration.NatsBrokerConfiguration.class);

    @Test
    void shouldSelectInMemoryBrokerForAnyRelaxedSpelling() {
        for (String spelling : new String[] { "in-memory", "IN_MEMORY", "in_memory" }) {
            contextRunner.withPropertyValues("jobsignal.broker.type=" + spelling).run(context -> {
                assertInstanceOf(InMemoryBroker.class, context.getBean(Broker.class));
                assertTrue(context.getBeansOfType(Connection.class).isEmpty(),
                        "no NATS connection expected for " + spelling);
            });
        }
    }

    @Test
    void shouldKeepUserSuppliedBroker() {
        Broker custom = new InMemoryBroker(Duration.ofSeconds(1));
        contextRunner.withPropertyValues("jobsignal.broker.type=in-memory")
                .withBean("customBroker", Broker.class, () -> custom)
                .run(context -> assertSame(custom, context.getBean(Broker.class)));
    }
}
