package cloud.anchorwatch.sdk.store;

/**
 * Handle for a live registration (store watch, listener). Closing is idempotent; once closed no further callbacks
 * are delivered, even ones already queued.
 */
@FunctionalInterface
public interface Subscription extends AutoCloseable {

    Subscription NONE = () -> { };

    @Override
    void close();
}
