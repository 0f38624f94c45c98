package cloud.anchorwatch.sdk.store;

import cloud.anchorwatch.sdk.PairingException;
import cloud.anchorwatch.sdk.StoreUnavailableException;
import cloud.anchorwatch.sdk.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * {@link RemoteStore} view of a {@link MemoryDatabase} for one device identity. Connectivity can be switched off to
 * exercise offline behaviour: every operation then fails with {@link StoreUnavailableException} while existing
 * watches stay registered.
 */
public final class MemoryRemoteStore implements RemoteStore {

    private final MemoryDatabase database;
    private final String identity;
    private final Executor callbacks;
    private volatile boolean online = true;

    MemoryRemoteStore(MemoryDatabase database, String identity, Executor callbacks) {
        this.database = Objects.requireNonNull(database, "database");
        this.identity = StorePaths.segment(identity);
        this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
    }

    public void setOnline(boolean online) {
        this.online = online;
    }

    public MemoryDatabase database() {
        return database;
    }

    @Override
    public String identity() throws PairingException {
        return identity;
    }

    @Override
    public JsonNode get(String path) throws PairingException {
        ensureOnline("get " + path);
        return database.read(path);
    }

    @Override
    public boolean probe(String path) throws PairingException {
        ensureOnline("probe " + path);
        return database.read(path) != null;
    }

    @Override
    public void set(String path, Object value) throws PairingException {
        ensureOnline("set " + path);
        database.write(path, Json.toNode(value));
    }

    @Override
    public void update(String path, Map<String, ?> values) throws PairingException {
        Objects.requireNonNull(values, "values");
        ensureOnline("update " + path);
        Map<String, JsonNode> nodes = new LinkedHashMap<>();
        values.forEach((key, value) -> nodes.put(key, Json.toNode(value)));
        database.merge(path, nodes);
    }

    @Override
    public void delete(String path) throws PairingException {
        ensureOnline("delete " + path);
        database.write(path, null);
    }

    @Override
    public Subscription watch(String path, StoreListener listener) {
        return database.watch(path, listener, callbacks);
    }

    private void ensureOnline(String operation) throws StoreUnavailableException {
        if (!online) {
            throw new StoreUnavailableException(operation + ": store offline", null);
        }
    }
}
