package cloud.anchorwatch.sdk.store;

import cloud.anchorwatch.sdk.internal.Json;
import cloud.anchorwatch.sdk.internal.JsonTree;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process document tree shared by any number of {@link MemoryRemoteStore} views, one per device identity. It
 * mirrors the realtime database semantics the SDK relies on (null deletes, empty objects are pruned, watchers get
 * the value at their path after every change that touches it) so several simulated devices can pair with each
 * other inside one JVM.
 */
public final class MemoryDatabase {

    private final Object lock = new Object();
    private final ObjectNode root = Json.mapper().createObjectNode();
    private final List<Watcher> watchers = new CopyOnWriteArrayList<>();
    private final AtomicLong writes = new AtomicLong();

    /**
     * Opens a client view acting as {@code identity}; watch callbacks are delivered through {@code callbacks}.
     */
    public MemoryRemoteStore connect(String identity, Executor callbacks) {
        return new MemoryRemoteStore(this, identity, callbacks);
    }

    /**
     * @return number of mutations applied so far.
     */
    public long writeCount() {
        return writes.get();
    }

    public JsonNode snapshot(String path) {
        synchronized (lock) {
            return JsonTree.get(root, JsonTree.split(path));
        }
    }

    JsonNode read(String path) {
        return snapshot(path);
    }

    void write(String path, JsonNode value) {
        List<String> segments = JsonTree.split(path);
        List<Runnable> notifications;
        synchronized (lock) {
            JsonTree.set(root, segments, value);
            writes.incrementAndGet();
            notifications = collect(segments);
        }
        notifications.forEach(Runnable::run);
    }

    void merge(String path, Map<String, JsonNode> values) {
        List<String> segments = JsonTree.split(path);
        List<Runnable> notifications;
        synchronized (lock) {
            JsonTree.merge(root, segments, values);
            writes.incrementAndGet();
            notifications = collect(segments);
        }
        notifications.forEach(Runnable::run);
    }

    Subscription watch(String path, StoreListener listener, Executor callbacks) {
        Watcher watcher = new Watcher(JsonTree.split(path), listener, callbacks);
        Runnable initial;
        synchronized (lock) {
            watchers.add(watcher);
            initial = watcher.offer(JsonTree.get(root, watcher.segments), true);
        }
        initial.run();
        return watcher;
    }

    private List<Runnable> collect(List<String> changed) {
        List<Runnable> notifications = new ArrayList<>();
        for (Watcher watcher : watchers) {
            if (!related(watcher.segments, changed)) {
                continue;
            }
            Runnable notification = watcher.offer(JsonTree.get(root, watcher.segments), false);
            if (notification != null) {
                notifications.add(notification);
            }
        }
        return notifications;
    }

    private static boolean related(List<String> a, List<String> b) {
        int common = Math.min(a.size(), b.size());
        for (int i = 0; i < common; i++) {
            if (!a.get(i).equals(b.get(i))) {
                return false;
            }
        }
        return true;
    }

    private final class Watcher implements Subscription {
        private final List<String> segments;
        private final StoreListener listener;
        private final Executor callbacks;
        private JsonNode lastDelivered;
        private volatile boolean closed;

        private Watcher(List<String> segments, StoreListener listener, Executor callbacks) {
            this.segments = segments;
            this.listener = Objects.requireNonNull(listener, "listener");
            this.callbacks = Objects.requireNonNull(callbacks, "callbacks");
        }

        // Called under the database lock.
        private Runnable offer(JsonNode value, boolean initial) {
            if (!initial && Objects.equals(lastDelivered, value)) {
                return null;
            }
            lastDelivered = value;
            JsonNode delivered = value == null ? null : value.deepCopy();
            return () -> callbacks.execute(() -> {
                if (!closed) {
                    listener.onValue(delivered);
                }
            });
        }

        @Override
        public void close() {
            closed = true;
            watchers.remove(this);
        }
    }
}
