package com.jobsignal;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.jobsignal.broker.Broker;
import com.jobsignal.broker.memory.InMemoryBroker;
import com.jobsignal.broker.nats.NatsJetStreamBroker;
import com.jobsignal.config.JobSignalProperties;
import com.jobsignal.internal.BackgroundJobServer;
import com.jobsignal.internal.ExternalMessageHandler;
import com.jobsignal.internal.ExternalMessageRouter;
import com.jobsignal.internal.JobInvoker;
import com.jobsignal.internal.JobReserver;
import com.jobsignal.internal.JobSignalMetrics;
import com.jobsignal.internal.JobWorkerRegistry;
import com.jobsignal.notify.ExceptionReporter;
import com.jobsignal.notify.JobNotifier;
import com.jobsignal.notify.NotificationCodec;
import com.jobsignal.store.JdbcJobStoreClock;
import com.jobsignal.store.JobCommitHook;
import com.jobsignal.store.JobLockManager;
import com.jobsignal.store.JobStore;
import com.jobsignal.store.JobStoreClock;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.nats.client.Connection;
import io.nats.client.Nats;
import io.nats.client.Options;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.AutoConfigurationPackage;
import org.springframework.boot.autoconfigure.condition.ConditionMessage;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.autoconfigure.orm.jpa.HibernateJpaAutoConfiguration;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Conditional;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.type.AnnotatedTypeMetadata;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.io.IOException;
import java.util.Locale;

@AutoConfiguration(before = HibernateJpaAutoConfiguration.class)
@AutoConfigurationPackage(basePackageClasses = Job.class)
@EnableConfigurationProperties(JobSignalProperties.class)
public class JobSignalAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(name = "jobsignalObjectMapper")
    public ObjectMapper jobsignalObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    @ConditionalOnMissingBean(name = "jobsignalHibernatePropertiesCustomizer")
    public HibernatePropertiesCustomizer jobsignalHibernatePropertiesCustomizer(JobSignalProperties properties) {
        return hibernateProperties -> {
            String prefix = properties.getDatabase().getTablePrefix();
            if (prefix != null && !prefix.trim().isEmpty()) {
                String trimmedPrefix = prefix.trim();
                hibernateProperties.put("hibernate.physical_naming_strategy",
                        new CamelCaseToUnderscoresNamingStrategy() {
                            @Override
                            public Identifier toPhysicalTableName(Identifier name, JdbcEnvironment jdbcEnvironment) {
                                Identifier original = super.toPhysicalTableName(name, jdbcEnvironment);
                                // only our own tables get the prefix
                                if (original.getText().toLowerCase(Locale.ROOT).startsWith("jobsignal_")) {
                                    return new Identifier(trimmedPrefix + original.getText(), original.isQuoted());
                                }
                                return original;
                            }
                        });
            }
        };
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobsignal.database", name = "skip-create", havingValue = "false",
            matchIfMissing = true)
    public JobSchemaInitializer jobsignalSchemaInitializer(DataSource dataSource, JobSignalProperties properties) {
        return new JobSchemaInitializer(dataSource, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobStoreClock jobStoreClock(JdbcTemplate jdbcTemplate) {
        return new JdbcJobStoreClock(jdbcTemplate);
    }

    @Bean
    public JobSignalMetrics jobsignalMetrics(JobRepository jobRepository, ObjectProvider<MeterRegistry> meterRegistry) {
        JobSignalMetrics metrics = new JobSignalMetrics(jobRepository,
                meterRegistry.getIfAvailable(() -> Metrics.globalRegistry));
        metrics.registerGauges();
        return metrics;
    }

    @Bean
    public NotificationCodec jobNotificationCodec(@Qualifier("jobsignalObjectMapper") ObjectMapper objectMapper) {
        return new NotificationCodec(objectMapper);
    }

    @Bean
    public JobNotifier jobNotifier(Broker broker, NotificationCodec codec, JobSignalProperties properties,
            ObjectProvider<ExceptionReporter> exceptionReporter, JobSignalMetrics metrics) {
        return new JobNotifier(broker, codec, properties, exceptionReporter, metrics);
    }

    @Bean
    public JobStore jobStore(JobRepository jobRepository, JobStoreClock clock, ObjectProvider<JobCommitHook> hooks) {
        return new JobStore(jobRepository, clock, hooks.orderedStream().toList());
    }

    @Bean
    public JobLockManager jobLockManager(JobRepository jobRepository, JobStore jobStore, JobStoreClock clock,
            TransactionTemplate transactionTemplate) {
        return new JobLockManager(jobRepository, jobStore, clock, transactionTemplate);
    }

    @Bean
    public ExternalMessageRouter externalMessageRouter(ObjectProvider<ExternalMessageHandler> handlers) {
        return new ExternalMessageRouter(handlers.orderedStream().toList());
    }

    @Bean
    public JobWorkerRegistry jobWorkerRegistry(ObjectProvider<JobWorker<?>> workers,
            @Qualifier("jobsignalObjectMapper") ObjectMapper objectMapper) {
        return new JobWorkerRegistry(workers.orderedStream().toList(), objectMapper);
    }

    @Bean
    public JobReserver jobReserver(Broker broker, NotificationCodec codec, JobLockManager lockManager,
            JobNotifier notifier, JobStoreClock clock, ExternalMessageRouter externalMessageRouter,
            JobSignalMetrics metrics, JobSignalProperties properties) {
        return new JobReserver(broker, codec, lockManager, notifier, clock, externalMessageRouter, metrics,
                properties);
    }

    @Bean
    public JobInvoker jobInvoker(JobWorkerRegistry registry) {
        return new JobInvoker(registry);
    }

    @Bean
    public JobClient jobClient(JobStore jobStore, JobRepository jobRepository, JobNotifier notifier,
            JobWorkerRegistry registry, @Qualifier("jobsignalObjectMapper") ObjectMapper objectMapper,
            JobSignalProperties properties, TransactionTemplate transactionTemplate) {
        return new JobClient(jobStore, jobRepository, notifier, registry, objectMapper, properties,
                transactionTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "jobsignal.background-job-server", name = "enabled", havingValue = "true",
            matchIfMissing = true)
    public BackgroundJobServer backgroundJobServer(JobReserver reserver, JobInvoker invoker,
            JobRepository jobRepository, JobStore jobStore, JobStoreClock clock, JobWorkerRegistry registry,
            TransactionTemplate transactionTemplate, JobSignalProperties properties) {
        return new BackgroundJobServer(reserver, invoker, jobRepository, jobStore, clock, registry,
                transactionTemplate, properties);
    }

    @Configuration(proxyBeanMethods = false)
    @Conditional(NatsBrokerCondition.class)
    static class NatsBrokerConfiguration {

        @Bean(destroyMethod = "close")
        @ConditionalOnMissingBean
        public Connection jobsignalNatsConnection(JobSignalProperties properties)
                throws IOException, InterruptedException {
            Options options = new Options.Builder()
                    .server(properties.getBroker().getUrl())
                    .connectionTimeout(properties.getBroker().getConnectionTimeout())
                    .build();
            return Nats.connect(options);
        }

        @Bean(initMethod = "start", destroyMethod = "stop")
        @ConditionalOnMissingBean(Broker.class)
        public NatsJetStreamBroker natsJetStreamBroker(Connection connection, JobSignalProperties properties) {
            return new NatsJetStreamBroker(connection, properties.getBroker());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @Conditional(InMemoryBrokerCondition.class)
    static class InMemoryBrokerConfiguration {

        @Bean
        @ConditionalOnMissingBean(Broker.class)
        public InMemoryBroker inMemoryBroker(JobSignalProperties properties) {
            return new InMemoryBroker(properties.getBroker().getAckWait());
        }
    }

    /**
     * Matches when {@code jobsignal.broker.type} binds to the given type, accepting any relaxed
     * spelling ({@code in-memory}, {@code IN_MEMORY}).
     */
    abstract static class BrokerTypeCondition extends SpringBootCondition {

        private final JobSignalProperties.Broker.Type type;

        BrokerTypeCondition(JobSignalProperties.Broker.Type type) {
            this.type = type;
        }

        @Override
        public ConditionOutcome getMatchOutcome(ConditionContext context, AnnotatedTypeMetadata metadata) {
            JobSignalProperties.Broker.Type configured = Binder.get(context.getEnvironment())
                    .bind("jobsignal.broker.type", JobSignalProperties.Broker.Type.class)
                    .orElse(JobSignalProperties.Broker.Type.NATS);
            ConditionMessage.Builder message = ConditionMessage.forCondition("JobSignal broker type");
            return configured == type
                    ? ConditionOutcome.match(message.foundExactly(configured))
                    : ConditionOutcome.noMatch(message.because("configured type is " + configured));
        }
    }

    static class NatsBrokerCondition extends BrokerTypeCondition {
        NatsBrokerCondition() {
            super(JobSignalProperties.Broker.Type.NATS);
        }
    }

    static class InMemoryBrokerCondition extends BrokerTypeCondition {
        InMemoryBrokerCondition() {
            super(JobSignalProperties.Broker.Type.IN_MEMORY);
        }
    }
}
