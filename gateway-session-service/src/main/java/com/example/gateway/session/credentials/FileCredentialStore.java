package com.example.gateway.session.credentials;

import com.example.gateway.shared.config.AppProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * One file per tenant under {@code gateway.credentials.dir}. Tenant ids are validated at the
 * HTTP boundary, so they are safe to use as file names.
 */
@Component
@Slf4j
public class FileCredentialStore implements CredentialStore {

    private static final String SUFFIX = ".creds";

    private final Path root;

    public FileCredentialStore(AppProperties appProperties) {
        this.root = Path.of(appProperties.getCredentials().getDir()).toAbsolutePath().normalize();
        log.info("Credential store rooted at {}", root);
    }

    @Override
    public Optional<byte[]> load(String tenantId) {
        Path file = fileFor(tenantId);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new CredentialStoreException("Cannot read credentials for tenant " + tenantId, e);
        }
    }

    @Override
    public void save(String tenantId, byte[] blob) {
        Path file = fileFor(tenantId);
        try {
            Files.createDirectories(root);
            Path tmp = Files.createTempFile(root, tenantId, ".tmp");
            Files.write(tmp, blob);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CredentialStoreException("Cannot write credentials for tenant " + tenantId, e);
        }
    }

    @Override
    public void delete(String tenantId) {
        try {
            if (Files.deleteIfExists(fileFor(tenantId))) {
                log.info("Deleted stored credentials for tenant {}", tenantId);
            }
        } catch (IOException e) {
            throw new CredentialStoreException("Cannot delete credentials for tenant " + tenantId, e);
        }
    }

    private Path fileFor(String tenantId) {
        Path file = root.resolve(tenantId + SUFFIX).normalize();
        if (!file.getParent().equals(root)) {
            throw new IllegalArgumentException("Tenant id escapes the credential directory: " + tenantId);
        }
        return file;
    }
}
