package com.example.gateway.session.support;

import com.example.gateway.session.credentials.CredentialStore;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

public class InMemoryCredentialStore implements CredentialStore {

    private final Map<String, byte[]> blobs = new ConcurrentHashMap<>();
    private final AtomicInteger deletes = new AtomicInteger();

    @Override
    public Optional<byte[]> load(String tenantId) {
        return Optional.ofNullable(blobs.get(tenantId));
    }

    @Override
    public void save(String tenantId, byte[] blob) {
        blobs.put(tenantId, blob);
    }

    @Override
    public void delete(String tenantId) {
        deletes.incrementAndGet();
        blobs.remove(tenantId);
    }

    public boolean contains(String tenantId) {
        return blobs.containsKey(tenantId);
    }

    public int deleteCount() {
        return deletes.get();
    }
}
