package com.tessera.pipeline.storage;

import java.util.Optional;

/**
 * Blob storage for entity and document bodies. Writes are keyed by path, so writing the same path
 * twice overwrites rather than duplicates.
 */
public interface ObjectStore {

    StoredObject put(String path, byte[] content, String contentType);

    Optional<byte[]> get(String path);

    boolean delete(String path);
}
