package com.tessera.pipeline.execution;

import com.tessera.eventmodel.DefaultSchemas;
import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.payload.EntityCompletedPayload;
import com.tessera.eventmodel.payload.EntityCreatePayload;
import com.tessera.eventmodel.payload.EntityDeletePayload;
import com.tessera.eventmodel.payload.EntityUpdatePayload;
import com.tessera.eventmodel.payload.FileAttachment;
import com.tessera.pipeline.storage.EntityRepository;
import com.tessera.pipeline.storage.EntityRow;
import com.tessera.pipeline.storage.ObjectStore;
import com.tessera.pipeline.storage.StoredObject;
import com.tessera.pipeline.storage.TaskDetails;
import com.tessera.pipeline.storage.TaskDetailsRepository;
import com.tessera.security.TenantIsolationEnforcer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Executes validated {@code entities.create|update|delete} commands.
 *
 * <p>Create steps: {@code upload-file} (only with a body), {@code insert-entity}, {@code
 * insert-task-details} (only for tasks), {@code emit-completion}, {@code broadcast-notification}.
 * The entity id is the caller's or the command's subject id, both stable across redeliveries, so a
 * replayed insert finds its own row instead of adding a second one. Updates and deletes stamp the
 * row with the command's id; a retry that finds its own stamp treats the write as done instead of
 * re-applying it or reporting a version conflict.
 */
public class EntitiesWorker extends AbstractExecutionWorker {

    public static final String TASK_TYPE = "task";

    private static final Logger log = LoggerFactory.getLogger(EntitiesWorker.class);

    private final EntityRepository entities;
    private final TaskDetailsRepository tasks;
    private final ObjectStore objects;

    public EntitiesWorker(
            ExecutionSupport support,
            EntityRepository entities,
            TaskDetailsRepository tasks,
            ObjectStore objects) {
        super(DefaultSchemas.ENTITIES, support);
        this.entities = entities;
        this.tasks = tasks;
        this.objects = objects;
    }

    @Override
    protected Object execute(String action, EventEnvelope event, StepContext steps) {
        return switch (action) {
            case "create" -> create(event, (EntityCreatePayload) event.data(), steps);
            case "update" -> update(event, (EntityUpdatePayload) event.data(), steps);
            case "delete" -> delete(event, (EntityDeletePayload) event.data(), steps);
            default -> throw unsupported(action);
        };
    }

    private String create(EventEnvelope event, EntityCreatePayload payload, StepContext steps) {
        String entityId = payload.id() != null ? payload.id() : deterministicId(event);

        StoredObject file =
                payload.hasContent()
                        ? steps.run(
                                "upload-file",
                                StoredObject.class,
                                () -> upload(event.userId(), payload.entityType(), entityId, payload))
                        : null;

        EntityRow row =
                steps.run(
                        "insert-entity",
                        EntityRow.class,
                        () -> {
                            Instant now = support.clock().instant();
                            EntityRow stored =
                                    entities.insertIfAbsent(
                                            new EntityRow(
                                                    entityId,
                                                    event.userId(),
                                                    payload.workspaceId(),
                                                    payload.entityType(),
                                                    payload.title(),
                                                    payload.preview(),
                                                    file != null ? file.path() : null,
                                                    file != null ? file.url() : null,
                                                    file != null ? file.size() : null,
                                                    file != null ? file.checksum() : null,
                                                    payload.tags(),
                                                    payload.projectIds(),
                                                    payload.metadata(),
                                                    1,
                                                    now,
                                                    now,
                                                    null,
                                                    event.id().toString()));
                            TenantIsolationEnforcer.enforce(
                                    entityId,
                                    event.userId(),
                                    payload.workspaceId(),
                                    stored.userId(),
                                    stored.workspaceId());
                            return stored;
                        });

        if (TASK_TYPE.equals(payload.entityType())) {
            steps.run(
                    "insert-task-details",
                    TaskDetails.class,
                    () -> tasks.insertIfAbsent(taskDetails(entityId, payload.metadata())));
        }

        var completion =
                new EntityCompletedPayload(
                        row.id(),
                        row.entityType(),
                        row.title(),
                        row.fileUrl(),
                        row.filePath(),
                        row.fileSize(),
                        row.checksum(),
                        row.version());
        emitCompletion(steps, "emit-completion", event, entityId, completion);
        broadcast(steps, event, notification(row));
        return "created " + entityId;
    }

    private String update(EventEnvelope event, EntityUpdatePayload payload, StepContext steps) {
        String entityId = payload.entityId();

        EntityRow row =
                steps.run(
                        "update-entity",
                        EntityRow.class,
                        () -> {
                            EntityRow current = loadScoped(event, entityId, payload.workspaceId());
                            if (current.writtenBy(event.id().toString())) {
                                log.info("Update {} of entity {} already applied", event.id(), entityId);
                                return current;
                            }
                            if (payload.expectedVersion() != null
                                    && payload.expectedVersion() != current.version()) {
                                throw new NonRetryableExecutionException(
                                        "version conflict on entity "
                                                + entityId
                                                + ": expected "
                                                + payload.expectedVersion()
                                                + ", found "
                                                + current.version());
                            }
                            StoredObject file =
                                    payload.content() == null
                                            ? null
                                            : put(
                                                    pathFor(current.userId(), current.entityType(), entityId, "md"),
                                                    payload.content().getBytes(StandardCharsets.UTF_8),
                                                    "text/markdown");
                            var metadata = new LinkedHashMap<>(current.metadata());
                            metadata.putAll(payload.metadata());
                            EntityRow updated =
                                    new EntityRow(
                                            current.id(),
                                            current.userId(),
                                            current.workspaceId(),
                                            current.entityType(),
                                            payload.title() != null ? payload.title() : current.title(),
                                            payload.preview() != null ? payload.preview() : current.preview(),
                                            file != null ? file.path() : current.filePath(),
                                            file != null ? file.url() : current.fileUrl(),
                                            file != null ? Long.valueOf(file.size()) : current.fileSize(),
                                            file != null ? file.checksum() : current.checksum(),
                                            current.tags(),
                                            current.projectIds(),
                                            metadata,
                                            current.version() + 1,
                                            current.createdAt(),
                                            support.clock().instant(),
                                            null,
                                            event.id().toString());
                            if (!entities.replace(updated, current.version())) {
                                throw new NonRetryableExecutionException(
                                        "entity " + entityId + " changed concurrently");
                            }
                            return updated;
                        });

        var completion =
                new EntityCompletedPayload(
                        row.id(), null, row.title(), row.fileUrl(), row.filePath(), row.fileSize(),
                        row.checksum(), row.version());
        emitCompletion(steps, "emit-update-completion", event, entityId, completion);
        broadcast(steps, event, notification(row));
        return "updated " + entityId + " to version " + row.version();
    }

    private String delete(EventEnvelope event, EntityDeletePayload payload, StepContext steps) {
        String entityId = payload.entityId();

        EntityRow row =
                steps.run(
                        "soft-delete-entity",
                        EntityRow.class,
                        () -> {
                            var deleted =
                                    entities.findById(entityId)
                                            .filter(r -> r.isDeleted() && r.writtenBy(event.id().toString()));
                            if (deleted.isPresent()) {
                                log.info("Delete {} of entity {} already applied", event.id(), entityId);
                                return deleted.get();
                            }
                            loadScoped(event, entityId, payload.workspaceId());
                            return entities.softDelete(entityId, support.clock().instant(), event.id().toString())
                                    .orElseThrow(() -> missing(entityId));
                        });

        var completion =
                new EntityCompletedPayload(
                        row.id(), null, row.title(), null, null, null, null, row.version());
        emitCompletion(steps, "emit-delete-completion", event, entityId, completion);
        broadcast(steps, event, notification(row));
        return "deleted " + entityId;
    }

    private EntityRow loadScoped(EventEnvelope event, String entityId, String workspaceId) {
        EntityRow current =
                entities.findById(entityId)
                        .filter(row -> !row.isDeleted())
                        .orElseThrow(() -> missing(entityId));
        TenantIsolationEnforcer.enforce(
                entityId, event.userId(), workspaceId, current.userId(), current.workspaceId());
        return current;
    }

    private StoredObject upload(String userId, String entityType, String entityId, EntityCreatePayload payload) {
        FileAttachment file = payload.file();
        if (file == null) {
            return put(
                    pathFor(userId, entityType, entityId, "md"),
                    payload.content().getBytes(StandardCharsets.UTF_8),
                    "text/markdown");
        }
        byte[] bytes;
        if (file.encoding() == FileAttachment.Encoding.BASE64) {
            try {
                bytes = Base64.getDecoder().decode(file.content());
            } catch (IllegalArgumentException e) {
                throw new NonRetryableExecutionException("file content is not valid base64", e);
            }
        } else {
            bytes = file.content().getBytes(StandardCharsets.UTF_8);
        }
        return put(pathFor(userId, entityType, entityId, file.extension()), bytes, file.contentType());
    }

    private StoredObject put(String path, byte[] bytes, String contentType) {
        StoredObject stored = objects.put(path, bytes, contentType);
        log.debug("Stored {} ({} bytes, {})", path, stored.size(), stored.checksum());
        return stored;
    }

    private static String pathFor(String userId, String entityType, String entityId, String extension) {
        return userId + "/" + entityType + "s/" + entityId + "." + extension;
    }

    private static TaskDetails taskDetails(String entityId, Map<String, Object> metadata) {
        Instant due = null;
        if (metadata.get("dueDate") instanceof String raw && !raw.isBlank()) {
            try {
                due = Instant.parse(raw);
            } catch (DateTimeParseException e) {
                throw new NonRetryableExecutionException("dueDate is not an ISO-8601 instant: " + raw, e);
            }
        }
        return new TaskDetails(
                entityId,
                metadata.get("status") instanceof String status ? status : null,
                metadata.get("priority") instanceof String priority ? priority : null,
                due);
    }

    private static Map<String, Object> notification(EntityRow row) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("entityId", row.id());
        data.put("entityType", row.entityType());
        data.put("title", row.title());
        data.put("version", row.version());
        data.put("deleted", row.isDeleted());
        return data;
    }

    /**
     * Subject ids are assigned once per command and inherited by every phase, so they are stable
     * across redeliveries. Non-UUID subjects are hashed into one.
     */
    private static String deterministicId(EventEnvelope event) {
        try {
            return UUID.fromString(event.subjectId()).toString();
        } catch (IllegalArgumentException e) {
            return UUID.nameUUIDFromBytes(
                            ("entity:" + event.subjectId()).getBytes(StandardCharsets.UTF_8))
                    .toString();
        }
    }

    private static NonRetryableExecutionException missing(String entityId) {
        return new NonRetryableExecutionException("entity not found: " + entityId);
    }
}
