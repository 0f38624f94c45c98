package cloud.anchorwatch.sdk.stream;

import cloud.anchorwatch.sdk.store.Subscription;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Observable holder of a current value. Subscribers receive the current value immediately and then every distinct
 * new value.
 *
 * @param <T> value type
 */
public final class LiveValue<T> {

    private static final Logger LOGGER = Logger.getLogger(LiveValue.class.getName());

    private final List<Consumer<? super T>> listeners = new CopyOnWriteArrayList<>();
    private volatile T value;

    public LiveValue(T initial) {
        this.value = initial;
    }

    public T get() {
        return value;
    }

    public Subscription subscribe(Consumer<? super T> listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        listener.accept(value);
        return () -> listeners.remove(listener);
    }

    void update(T next) {
        if (Objects.equals(value, next)) {
            return;
        }
        value = next;
        for (Consumer<? super T> listener : listeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] live value listener failed", ex);
            }
        }
    }

    void clearListeners() {
        listeners.clear();
    }
}
