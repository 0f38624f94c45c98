package cloud.anchorwatch.sdk.local;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Volatile {@link LocalStore}; state lives as long as the instance. Handy for tests and for simulating a process
 * restart by handing the same instance to a second client.
 */
public final class InMemoryLocalStore implements LocalStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();

    @Override
    public String getString(String key) {
        Objects.requireNonNull(key, "key");
        return values.get(key);
    }

    @Override
    public void setString(String key, String value) {
        Objects.requireNonNull(key, "key");
        if (value == null) {
            values.remove(key);
        } else {
            values.put(key, value);
        }
    }

    public Map<String, String> snapshot() {
        return Map.copyOf(values);
    }
}
