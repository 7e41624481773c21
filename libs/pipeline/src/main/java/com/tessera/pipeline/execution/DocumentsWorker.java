package com.tessera.pipeline.execution;

import com.tessera.eventmodel.DefaultSchemas;
import com.tessera.eventmodel.EventEnvelope;
import com.tessera.eventmodel.payload.DocumentCompletedPayload;
import com.tessera.eventmodel.payload.DocumentCreatePayload;
import com.tessera.eventmodel.payload.DocumentDeletePayload;
import com.tessera.eventmodel.payload.DocumentUpdatePayload;
import com.tessera.pipeline.storage.DocumentRepository;
import com.tessera.pipeline.storage.DocumentRow;
import com.tessera.pipeline.storage.ObjectStore;
import com.tessera.pipeline.storage.StoredObject;
import com.tessera.security.TenantIsolationEnforcer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Executes validated {@code documents.create|update|delete} commands. Each version of a document's
 * body is written to its own object path, {@code documents/<id>/v<version>.<ext>}.
 */
public class DocumentsWorker extends AbstractExecutionWorker {

    private final DocumentRepository documents;
    private final ObjectStore objects;

    public DocumentsWorker(ExecutionSupport support, DocumentRepository documents, ObjectStore objects) {
        super(DefaultSchemas.DOCUMENTS, support);
        this.documents = documents;
        this.objects = objects;
    }

    @Override
    protected Object execute(String action, EventEnvelope event, StepContext steps) {
        return switch (action) {
            case "create" -> create(event, (DocumentCreatePayload) event.data(), steps);
            case "update" -> update(event, (DocumentUpdatePayload) event.data(), steps);
            case "delete" -> delete(event, (DocumentDeletePayload) event.data(), steps);
            default -> throw unsupported(action);
        };
    }

    private String create(EventEnvelope event, DocumentCreatePayload payload, StepContext steps) {
        String documentId = payload.documentId() != null ? payload.documentId() : deterministicId(event);

        StoredObject body =
                steps.run(
                        "upload-content",
                        StoredObject.class,
                        () ->
                                objects.put(
                                        pathFor(documentId, 1, payload.mimeType()),
                                        payload.content().getBytes(StandardCharsets.UTF_8),
                                        payload.mimeType()));

        DocumentRow row =
                steps.run(
                        "insert-document",
                        DocumentRow.class,
                        () -> {
                            Instant now = support.clock().instant();
                            DocumentRow stored =
                                    documents.insertIfAbsent(
                                            new DocumentRow(
                                                    documentId,
                                                    event.userId(),
                                                    payload.workspaceId(),
                                                    payload.title(),
                                                    payload.mimeType(),
                                                    body.path(),
                                                    body.size(),
                                                    body.checksum(),
                                                    1,
                                                    now,
                                                    now,
                                                    null,
                                                    event.id().toString()));
                            TenantIsolationEnforcer.enforce(
                                    documentId,
                                    event.userId(),
                                    payload.workspaceId(),
                                    stored.userId(),
                                    stored.workspaceId());
                            return stored;
                        });

        emitCompletion(steps, "emit-completion", event, documentId, completion(row));
        broadcast(steps, event, notification(row));
        return "created document " + documentId;
    }

    private String update(EventEnvelope event, DocumentUpdatePayload payload, StepContext steps) {
        String documentId = payload.documentId();

        DocumentRow row =
                steps.run(
                        "update-document",
                        DocumentRow.class,
                        () -> {
                            DocumentRow current = loadScoped(event, documentId, payload.workspaceId());
                            if (current.writtenBy(event.id().toString())) {
                                return current;
                            }
                            if (payload.expectedVersion() != null
                                    && payload.expectedVersion() != current.version()) {
                                throw new NonRetryableExecutionException(
                                        "version conflict on document "
                                                + documentId
                                                + ": expected "
                                                + payload.expectedVersion()
                                                + ", found "
                                                + current.version());
                            }
                            long next = current.version() + 1;
                            StoredObject body =
                                    payload.content() == null
                                            ? null
                                            : objects.put(
                                                    pathFor(documentId, next, current.mimeType()),
                                                    payload.content().getBytes(StandardCharsets.UTF_8),
                                                    current.mimeType());
                            DocumentRow updated =
                                    new DocumentRow(
                                            current.id(),
                                            current.userId(),
                                            current.workspaceId(),
                                            payload.title() != null ? payload.title() : current.title(),
                                            current.mimeType(),
                                            body != null ? body.path() : current.storagePath(),
                                            body != null ? body.size() : current.size(),
                                            body != null ? body.checksum() : current.checksum(),
                                            next,
                                            current.createdAt(),
                                            support.clock().instant(),
                                            null,
                                            event.id().toString());
                            if (!documents.replace(updated, current.version())) {
                                throw new NonRetryableExecutionException(
                                        "document " + documentId + " changed concurrently");
                            }
                            return updated;
                        });

        emitCompletion(steps, "emit-update-completion", event, documentId, completion(row));
        broadcast(steps, event, notification(row));
        return "updated document " + documentId + " to version " + row.version();
    }

    private String delete(EventEnvelope event, DocumentDeletePayload payload, StepContext steps) {
        String documentId = payload.documentId();

        DocumentRow row =
                steps.run(
                        "soft-delete-document",
                        DocumentRow.class,
                        () -> {
                            var deleted =
                                    documents.findById(documentId)
                                            .filter(r -> r.isDeleted() && r.writtenBy(event.id().toString()));
                            if (deleted.isPresent()) {
                                return deleted.get();
                            }
                            loadScoped(event, documentId, payload.workspaceId());
                            return documents
                                    .softDelete(documentId, support.clock().instant(), event.id().toString())
                                    .orElseThrow(() -> missing(documentId));
                        });

        emitCompletion(steps, "emit-delete-completion", event, documentId, completion(row));
        broadcast(steps, event, notification(row));
        return "deleted document " + documentId;
    }

    private DocumentRow loadScoped(EventEnvelope event, String documentId, String workspaceId) {
        DocumentRow current =
                documents.findById(documentId)
                        .filter(row -> !row.isDeleted())
                        .orElseThrow(() -> missing(documentId));
        TenantIsolationEnforcer.enforce(
                documentId, event.userId(), workspaceId, current.userId(), current.workspaceId());
        return current;
    }

    private static DocumentCompletedPayload completion(DocumentRow row) {
        return new DocumentCompletedPayload(
                row.id(), row.title(), row.storagePath(), row.size(), row.checksum(), row.version());
    }

    private static Map<String, Object> notification(DocumentRow row) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("documentId", row.id());
        data.put("title", row.title());
        data.put("version", row.version());
        data.put("deleted", row.isDeleted());
        return data;
    }

    static String pathFor(String documentId, long version, String mimeType) {
        return "documents/" + documentId + "/v" + version + "." + extensionOf(mimeType);
    }

    private static String extensionOf(String mimeType) {
        return switch (mimeType) {
            case "text/markdown" -> "md";
            case "text/plain" -> "txt";
            case "text/html" -> "html";
            case "application/pdf" -> "pdf";
            case "application/json" -> "json";
            default -> "bin";
        };
    }

    private static String deterministicId(EventEnvelope event) {
        try {
            return UUID.fromString(event.subjectId()).toString();
        } catch (IllegalArgumentException e) {
            return UUID.nameUUIDFromBytes(
                            ("document:" + event.subjectId()).getBytes(StandardCharsets.UTF_8))
                    .toString();
        }
    }

    private static NonRetryableExecutionException missing(String documentId) {
        return new NonRetryableExecutionException("document not found: " + documentId);
    }
}
