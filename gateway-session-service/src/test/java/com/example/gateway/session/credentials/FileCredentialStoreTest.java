package com.example.gateway.session.credentials;

import com.example.gateway.shared.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileCredentialStoreTest {

    @TempDir
    Path dir;

    private FileCredentialStore store;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getCredentials().setDir(dir.resolve("creds").toString());
        store = new FileCredentialStore(properties);
    }

    @Test
    void missingTenantLoadsEmpty() {
        assertThat(store.load("acme")).isEmpty();
    }

    @Test
    void savedBlobSurvivesANewStoreInstance() {
        store.save("acme", "device-1".getBytes(StandardCharsets.UTF_8));

        AppProperties properties = new AppProperties();
        properties.getCredentials().setDir(dir.resolve("creds").toString());
        FileCredentialStore reopened = new FileCredentialStore(properties);

        assertThat(reopened.load("acme")).hasValueSatisfying(blob ->
                assertThat(new String(blob, StandardCharsets.UTF_8)).isEqualTo("device-1"));
    }

    @Test
    void saveReplacesAndLeavesNoTemporaryFiles() throws Exception {
        store.save("acme", new byte[]{1});
        store.save("acme", new byte[]{2});

        assertThat(store.load("acme")).hasValueSatisfying(blob -> assertThat(blob).containsExactly(2));
        try (Stream<Path> files = Files.list(dir.resolve("creds"))) {
            assertThat(files.map(path -> path.getFileName().toString())).containsExactly("acme.creds");
        }
    }

    @Test
    void deleteIsIdempotent() {
        store.save("acme", new byte[]{1});

        store.delete("acme");
        store.delete("acme");

        assertThat(store.load("acme")).isEmpty();
    }

    @Test
    void tenantsAreIsolated() {
        TenantCredentials acme = store.forTenant("acme");
        TenantCredentials globex = store.forTenant("globex");

        acme.save(new byte[]{7});

        assertThat(globex.load()).isEmpty();
        assertThat(acme.load()).isPresent();
    }

    @Test
    void pathTraversalIsRefused() {
        assertThatThrownBy(() -> store.save("../outside", new byte[]{1}))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
