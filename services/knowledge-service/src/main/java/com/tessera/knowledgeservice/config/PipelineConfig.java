package com.tessera.knowledgeservice.config;

import com.tessera.eventmodel.DefaultSchemas;
import com.tessera.eventmodel.EventFactory;
import com.tessera.eventmodel.SchemaRegistry;
import com.tessera.eventstore.EventStore;
import com.tessera.eventstore.InMemoryEventStore;
import com.tessera.eventstore.JdbcEventStore;
import com.tessera.observability.MetricFactory;
import com.tessera.observability.SpanHelper;
import com.tessera.pipeline.dispatch.Dispatcher;
import com.tessera.pipeline.dispatch.HandlerRegistry;
import com.tessera.pipeline.execution.DocumentsWorker;
import com.tessera.pipeline.execution.EntitiesWorker;
import com.tessera.pipeline.execution.ExecutionSupport;
import com.tessera.pipeline.execution.FailureLedger;
import com.tessera.pipeline.execution.InMemoryFailureLedger;
import com.tessera.pipeline.execution.InMemoryStepResultStore;
import com.tessera.pipeline.execution.StepResultStore;
import com.tessera.pipeline.governor.ApprovalService;
import com.tessera.pipeline.governor.PermissionGovernor;
import com.tessera.pipeline.notification.HttpRealtimeNotifier;
import com.tessera.pipeline.notification.LoggingRealtimeNotifier;
import com.tessera.pipeline.notification.RealtimeNotifier;
import com.tessera.pipeline.projection.InMemoryProjectionStore;
import com.tessera.pipeline.projection.ProjectionMaterializer;
import com.tessera.pipeline.projection.ProjectionStore;
import com.tessera.pipeline.publish.CommandSubmitter;
import com.tessera.pipeline.publish.EventPublisher;
import com.tessera.pipeline.storage.InMemoryDocumentRepository;
import com.tessera.pipeline.storage.InMemoryEntityRepository;
import com.tessera.pipeline.storage.InMemoryObjectStore;
import com.tessera.pipeline.storage.InMemoryTaskDetailsRepository;
import com.tessera.pipeline.storage.ObjectStore;
import com.tessera.security.InMemoryMembershipDirectory;
import com.tessera.security.InMemoryWorkspaceDirectory;
import com.tessera.security.PermissionResolver;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import org.flywaydb.core.Flyway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.web.client.RestClient;

/**
 * Wires the command pipeline: schemas, event store, dispatcher, governor, workers and projections.
 *
 * <p>Domain rows, object storage, memberships and projections are held in memory; the event log
 * is the only durable store.
 */
@Configuration
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SchemaRegistry schemaRegistry() {
        return DefaultSchemas.registry();
    }

    @Bean
    public EventFactory eventFactory(SchemaRegistry schemas, Clock clock) {
        return new EventFactory(schemas, clock);
    }

    /** Asks for the event log Flyway bean first, so the schema is migrated before the store is used. */
    @Bean
    @ConditionalOnProperty(
            prefix = "tessera.pipeline",
            name = "event-store",
            havingValue = "jdbc",
            matchIfMissing = true)
    public EventStore jdbcEventStore(
            JdbcClient jdbc, SchemaRegistry schemas, ObjectProvider<Flyway> eventlogFlyway) {
        eventlogFlyway.ifAvailable(
                flyway -> log.info("Event log migrations applied: {}", flyway.info().applied().length));
        log.info("Using the JDBC event store");
        return new JdbcEventStore(jdbc, schemas);
    }

    @Bean
    @ConditionalOnProperty(prefix = "tessera.pipeline", name = "event-store", havingValue = "memory")
    public EventStore inMemoryEventStore(SchemaRegistry schemas) {
        log.warn("Using the in-memory event store; events are lost on restart");
        return new InMemoryEventStore(schemas);
    }

    @Bean
    public MetricFactory metricFactory(MeterRegistry registry, ServiceProperties service) {
        return new MetricFactory(registry, service.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer("com.tessera.pipeline"));
    }

    /** Handler pool; a direct executor when {@code dispatcher-threads} is 0. Shut down with the context. */
    @Bean
    public Executor dispatchExecutor(PipelineProperties properties) {
        if (properties.dispatcherThreads() == 0) {
            log.info("Dispatching handlers inline");
            return Runnable::run;
        }
        AtomicInteger counter = new AtomicInteger();
        int threads = properties.dispatcherThreads();
        return Executors.newFixedThreadPool(
                threads,
                runnable -> {
                    Thread thread = new Thread(runnable, "tessera-dispatch-" + counter.incrementAndGet());
                    thread.setDaemon(true);
                    return thread;
                });
    }

    @Bean
    public HandlerRegistry handlerRegistry() {
        return new HandlerRegistry();
    }

    @Bean
    public Dispatcher dispatcher(
            HandlerRegistry handlers, Executor dispatchExecutor, MetricFactory metrics, SpanHelper spans) {
        return new Dispatcher(handlers, dispatchExecutor, metrics, spans);
    }

    @Bean
    public EventPublisher eventPublisher(EventStore store, Dispatcher dispatcher) {
        return new EventPublisher(store, dispatcher);
    }

    @Bean
    public CommandSubmitter commandSubmitter(
            EventFactory factory, EventPublisher publisher, MetricFactory metrics) {
        return new CommandSubmitter(factory, publisher, metrics);
    }

    @Bean
    public InMemoryMembershipDirectory membershipDirectory() {
        return new InMemoryMembershipDirectory();
    }

    @Bean
    public InMemoryWorkspaceDirectory workspaceDirectory() {
        return new InMemoryWorkspaceDirectory();
    }

    @Bean
    public PermissionGovernor permissionGovernor(
            EventFactory factory,
            EventPublisher publisher,
            InMemoryMembershipDirectory memberships,
            InMemoryWorkspaceDirectory workspaces,
            MetricFactory metrics) {
        return new PermissionGovernor(
                factory, publisher, new PermissionResolver(memberships), workspaces, metrics);
    }

    @Bean
    public ApprovalService approvalService(
            EventFactory factory, EventPublisher publisher, MetricFactory metrics) {
        return new ApprovalService(factory, publisher, metrics);
    }

    @Bean
    public RealtimeNotifier realtimeNotifier(
            RealtimeProperties realtime, RestClient.Builder restClientBuilder, MetricFactory metrics) {
        if (!realtime.enabled()) {
            log.info("No real-time URL configured, notifications are logged only");
            return new LoggingRealtimeNotifier();
        }
        return new HttpRealtimeNotifier(restClientBuilder, realtime.url(), metrics);
    }

    @Bean
    public StepResultStore stepResultStore() {
        return new InMemoryStepResultStore();
    }

    @Bean
    public FailureLedger failureLedger() {
        return new InMemoryFailureLedger();
    }

    @Bean
    public ObjectStore objectStore(PipelineProperties properties) {
        return new InMemoryObjectStore(properties.objectBaseUrl());
    }

    @Bean
    public InMemoryEntityRepository entityRepository() {
        return new InMemoryEntityRepository();
    }

    @Bean
    public InMemoryDocumentRepository documentRepository() {
        return new InMemoryDocumentRepository();
    }

    @Bean
    public ExecutionSupport executionSupport(
            EventFactory factory,
            EventPublisher publisher,
            StepResultStore steps,
            PipelineProperties properties,
            FailureLedger failures,
            RealtimeNotifier notifier,
            MetricFactory metrics,
            Clock clock) {
        return new ExecutionSupport(
                factory, publisher, steps, properties.retry().toPolicy(), failures, notifier, metrics, clock);
    }

    @Bean
    public EntitiesWorker entitiesWorker(
            ExecutionSupport support, InMemoryEntityRepository entities, ObjectStore objects) {
        return new EntitiesWorker(support, entities, new InMemoryTaskDetailsRepository(), objects);
    }

    @Bean
    public DocumentsWorker documentsWorker(
            ExecutionSupport support, InMemoryDocumentRepository documents, ObjectStore objects) {
        return new DocumentsWorker(support, documents, objects);
    }

    @Bean
    public ProjectionStore projectionStore() {
        return new InMemoryProjectionStore();
    }

    @Bean
    public ProjectionMaterializer projectionMaterializer(EventStore store, ProjectionStore projections) {
        return new ProjectionMaterializer(store, projections);
    }

    /**
     * Registers every handler once the context is complete, then rebuilds the approval index and
     * the projections from the log.
     */
    @Bean
    public SmartInitializingSingleton pipelineStartup(
            HandlerRegistry handlers,
            PermissionGovernor governor,
            ApprovalService approvals,
            EntitiesWorker entitiesWorker,
            DocumentsWorker documentsWorker,
            ProjectionMaterializer materializer) {
        return () -> {
            handlers.register(PermissionGovernor.NAME, PermissionGovernor.PATTERN, governor)
                    .register(ApprovalService.NAME, ApprovalService.PATTERN, approvals)
                    .register(entitiesWorker.name(), entitiesWorker.pattern(), entitiesWorker)
                    .register(documentsWorker.name(), documentsWorker.pattern(), documentsWorker)
                    .register(ProjectionMaterializer.NAME, ProjectionMaterializer.PATTERN, materializer);
            int open = approvals.recover();
            materializer.rebuild(Optional.empty());
            log.info("Pipeline ready: {} handlers, {} open proposals", handlers.registrations().size(), open);
        };
    }
}
