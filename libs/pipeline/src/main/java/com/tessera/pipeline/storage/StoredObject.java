package com.tessera.pipeline.storage;

/**
 * An object written to the object store.
 *
 * @param path key inside the bucket
 * @param url where clients fetch it
 * @param size size in bytes
 * @param checksum {@code sha256:<hex>} of the bytes
 * @param contentType MIME type
 */
public record StoredObject(String path, String url, long size, String checksum, String contentType) {}
