package com.example.gateway.session.support;

import com.example.gateway.session.protocol.ProtocolClient;
import com.example.gateway.session.protocol.ProtocolClientFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

public class FakeProtocolClientFactory implements ProtocolClientFactory {

    private final List<FakeProtocolClient> created = new CopyOnWriteArrayList<>();
    private volatile Consumer<FakeProtocolClient> onCreate = client -> { };

    @Override
    public ProtocolClient create(String tenantId) {
        FakeProtocolClient client = new FakeProtocolClient(tenantId);
        onCreate.accept(client);
        created.add(client);
        return client;
    }

    /**
     * Runs before each new client is handed out, e.g. to script a connect failure.
     */
    public void onCreate(Consumer<FakeProtocolClient> hook) {
        this.onCreate = hook;
    }

    public List<FakeProtocolClient> created() {
        return created;
    }

    public long createdFor(String tenantId) {
        return created.stream().filter(client -> client.tenantId().equals(tenantId)).count();
    }

    public FakeProtocolClient last() {
        if (created.isEmpty()) {
            throw new IllegalStateException("no client created yet");
        }
        return created.get(created.size() - 1);
    }
}
