package com.example.gateway.session.credentials;

import java.util.Optional;

/**
 * The slice of a {@link CredentialStore} a protocol client may touch: its own tenant's blob.
 */
public final class TenantCredentials {

    private final CredentialStore store;
    private final String tenantId;

    TenantCredentials(CredentialStore store, String tenantId) {
        this.store = store;
        this.tenantId = tenantId;
    }

    public String tenantId() {
        return tenantId;
    }

    public Optional<byte[]> load() {
        return store.load(tenantId);
    }

    public void save(byte[] blob) {
        store.save(tenantId, blob);
    }

    public void delete() {
        store.delete(tenantId);
    }
}
