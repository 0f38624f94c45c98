package cloud.anchorwatch.sdk.stream;

import cloud.anchorwatch.sdk.PairingException;
import cloud.anchorwatch.sdk.internal.EventLoop;
import cloud.anchorwatch.sdk.store.RemoteStore;
import cloud.anchorwatch.sdk.store.StoreListener;
import cloud.anchorwatch.sdk.store.StorePaths;
import cloud.anchorwatch.sdk.store.Subscription;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Live view of the record at {@code sessions/{token}} for whichever token is currently selected. Switching tokens
 * closes the previous watch before the new one is opened, and values still queued for the old token are dropped.
 * Runs on the event loop.
 *
 * @param <T> emitted value type
 */
public final class SessionDataView<T> implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SessionDataView.class.getName());

    /**
     * Turns a raw record into the emitted value; may start self-healing as a side effect.
     */
    @FunctionalInterface
    interface Handler<T> {
        Optional<T> handle(SessionDataView<T> view, String token, JsonNode record);
    }

    private final String name;
    private final RemoteStore store;
    private final EventLoop loop;
    private final Handler<T> handler;
    private final LiveValue<Optional<T>> value = new LiveValue<>(Optional.empty());

    private String token;
    private JsonNode lastRecord;
    private Subscription watch = Subscription.NONE;
    private ScheduledFuture<?> recheck;

    SessionDataView(String name, RemoteStore store, EventLoop loop, Handler<T> handler) {
        this.name = Objects.requireNonNull(name, "name");
        this.store = Objects.requireNonNull(store, "store");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    public LiveValue<Optional<T>> value() {
        return value;
    }

    /**
     * @return token currently watched, or {@code null}.
     */
    public String token() {
        return token;
    }

    void retarget(String next) {
        if (Objects.equals(token, next)) {
            return;
        }
        stopWatching();
        token = next;
        lastRecord = null;
        if (next == null) {
            value.update(Optional.empty());
            return;
        }
        LOGGER.fine(() -> String.format(Locale.ROOT, "[anchorwatch] %s view now watching session %s", name, next));
        value.update(Optional.empty());
        watch = store.watch(StorePaths.session(next), new StoreListener() {
            @Override
            public void onValue(JsonNode record) {
                loop.execute(() -> deliver(next, record));
            }

            @Override
            public void onError(PairingException error) {
                LOGGER.log(Level.FINE, "[anchorwatch] " + name + " view watch error for session " + next, error);
            }
        });
    }

    /**
     * Re-evaluates the last record for the current token after {@code delay}; used to notice expiry without a
     * store change.
     */
    void recheckAfter(Duration delay) {
        cancelRecheck();
        String expected = token;
        recheck = loop.schedule(() -> {
            if (expected != null && expected.equals(token)) {
                deliver(expected, lastRecord);
            }
        }, delay);
    }

    @Override
    public void close() {
        stopWatching();
        token = null;
        lastRecord = null;
        value.clearListeners();
    }

    private void deliver(String forToken, JsonNode record) {
        if (!forToken.equals(token)) {
            return;
        }
        lastRecord = record;
        value.update(handler.handle(this, forToken, record));
    }

    private void stopWatching() {
        cancelRecheck();
        watch.close();
        watch = Subscription.NONE;
    }

    private void cancelRecheck() {
        if (recheck != null) {
            recheck.cancel(false);
            recheck = null;
        }
    }
}
