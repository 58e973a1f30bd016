package io.forthic.bridge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class RuntimeManager {
    private final Map<String, RuntimeClient> clients = new ConcurrentHashMap<>();

    /**
     * Connects {@code name} to {@code address}, replacing any earlier connection under that name.
     */
    public RuntimeClient connect(String name, String address) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("runtime name must not be empty");
        }
        RuntimeClient client = new RuntimeClient(address);
        clients.put(name, client);
        return client;
    }

    public Optional<RuntimeClient> find(String name) {
        return Optional.ofNullable(clients.get(name));
    }

    public boolean isConnected(String name) {
        return clients.containsKey(name);
    }

    public boolean disconnect(String name) {
        return clients.remove(name) != null;
    }

    public void disconnectAll() {
        clients.clear();
    }

    public List<String> listConnections() {
        List<String> names = new ArrayList<>(clients.keySet());
        Collections.sort(names);
        return names;
    }
}
