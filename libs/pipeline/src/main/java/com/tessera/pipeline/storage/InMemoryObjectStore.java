package com.tessera.pipeline.storage;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/** Object store held in memory, for tests and single-node runs. */
public class InMemoryObjectStore implements ObjectStore {

    private final String baseUrl;
    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final AtomicLong writes = new AtomicLong();

    public InMemoryObjectStore(String baseUrl) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    public InMemoryObjectStore() {
        this("memory://objects");
    }

    @Override
    public StoredObject put(String path, byte[] content, String contentType) {
        objects.put(path, content.clone());
        writes.incrementAndGet();
        return new StoredObject(
                path, baseUrl + "/" + path, content.length, Checksums.sha256(content), contentType);
    }

    @Override
    public Optional<byte[]> get(String path) {
        return Optional.ofNullable(objects.get(path)).map(byte[]::clone);
    }

    @Override
    public boolean delete(String path) {
        return objects.remove(path) != null;
    }

    public int size() {
        return objects.size();
    }

    /** Total number of put calls, including overwrites. */
    public long writeCount() {
        return writes.get();
    }
}
