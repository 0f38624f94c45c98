package cloud.anchorwatch.sdk.store;

import java.util.Objects;
import java.util.concurrent.Flow;

/**
 * Line subscriber turning a {@code text/event-stream} body into (event, data) pairs. Multiple {@code data:} lines
 * of one event are joined with a newline; comments and unknown fields are ignored.
 */
final class EventStreamSubscriber implements Flow.Subscriber<String> {

    interface Handler {
        void onEvent(EventStreamSubscriber source, String event, String data);

        void onClosed(EventStreamSubscriber source, Throwable error);
    }

    private final Handler handler;
    private volatile Flow.Subscription subscription;
    private volatile boolean cancelled;
    private String event;
    private StringBuilder data;

    EventStreamSubscriber(Handler handler) {
        this.handler = Objects.requireNonNull(handler, "handler");
    }

    @Override
    public void onSubscribe(Flow.Subscription subscription) {
        this.subscription = subscription;
        if (cancelled) {
            subscription.cancel();
            return;
        }
        subscription.request(Long.MAX_VALUE);
    }

    @Override
    public void onNext(String line) {
        if (!cancelled) {
            accept(line);
        }
    }

    @Override
    public void onError(Throwable throwable) {
        if (!cancelled) {
            handler.onClosed(this, throwable);
        }
    }

    @Override
    public void onComplete() {
        if (!cancelled) {
            handler.onClosed(this, null);
        }
    }

    void cancel() {
        cancelled = true;
        Flow.Subscription current = subscription;
        if (current != null) {
            current.cancel();
        }
    }

    void accept(String line) {
        if (line == null) {
            return;
        }
        if (line.isEmpty()) {
            dispatch();
            return;
        }
        if (line.startsWith(":")) {
            return;
        }
        int colon = line.indexOf(':');
        String field = colon < 0 ? line : line.substring(0, colon);
        String value = colon < 0 ? "" : line.substring(colon + 1);
        if (value.startsWith(" ")) {
            value = value.substring(1);
        }
        switch (field) {
            case "event":
                event = value;
                break;
            case "data":
                if (data == null) {
                    data = new StringBuilder(value);
                } else {
                    data.append('\n').append(value);
                }
                break;
            default:
                break;
        }
    }

    private void dispatch() {
        String name = event == null ? "message" : event;
        String payload = data == null ? "" : data.toString();
        event = null;
        data = null;
        if (name.isEmpty() && payload.isEmpty()) {
            return;
        }
        handler.onEvent(this, name, payload);
    }
}
