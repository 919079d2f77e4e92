package com.example.gateway.session.credentials;

import java.util.Optional;

/**
 * Key/value blob store for protocol credentials, keyed by tenant id. Blobs are opaque here;
 * only the protocol client reads or writes their content.
 */
public interface CredentialStore {

    Optional<byte[]> load(String tenantId);

    void save(String tenantId, byte[] blob);

    /**
     * Removes the blob. Deleting a missing blob is not an error.
     */
    void delete(String tenantId);

    default TenantCredentials forTenant(String tenantId) {
        return new TenantCredentials(this, tenantId);
    }
}
