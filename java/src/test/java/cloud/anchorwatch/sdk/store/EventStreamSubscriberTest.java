package cloud.anchorwatch.sdk.store;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Flow;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventStreamSubscriberTest {

    private final List<String> events = new ArrayList<>();
    private final List<Throwable> closes = new ArrayList<>();
    private final EventStreamSubscriber subscriber = new EventStreamSubscriber(new EventStreamSubscriber.Handler() {
        @Override
        public void onEvent(EventStreamSubscriber source, String event, String data) {
            events.add(event + "|" + data);
        }

        @Override
        public void onClosed(EventStreamSubscriber source, Throwable error) {
            closes.add(error);
        }
    });

    @Test
    void dispatchesOnBlankLine() {
        subscriber.accept("event: put");
        subscriber.accept("data: {\"path\":\"/\",\"data\":1}");
        assertTrue(events.isEmpty());

        subscriber.accept("");

        assertEquals(List.of("put|{\"path\":\"/\",\"data\":1}"), events);
    }

    @Test
    void joinsMultipleDataLines() {
        subscriber.accept("event: patch");
        subscriber.accept("data: first");
        subscriber.accept("data:second");
        subscriber.accept("");

        assertEquals(List.of("patch|first\nsecond"), events);
    }

    @Test
    void defaultsEventNameAndSkipsComments() {
        subscriber.accept(": heartbeat");
        subscriber.accept("id: 7");
        subscriber.accept("data: hello");
        subscriber.accept("");
        subscriber.accept("");

        assertEquals(List.of("message|hello"), events);
    }

    @Test
    void cancelStopsDeliveryAndCancelsUpstream() {
        AtomicBoolean upstreamCancelled = new AtomicBoolean();
        subscriber.onSubscribe(new Flow.Subscription() {
            @Override
            public void request(long n) {
            }

            @Override
            public void cancel() {
                upstreamCancelled.set(true);
            }
        });

        subscriber.cancel();
        subscriber.onNext("event: put");
        subscriber.onNext("data: 1");
        subscriber.onNext("");
        subscriber.onComplete();

        assertTrue(upstreamCancelled.get());
        assertTrue(events.isEmpty());
        assertTrue(closes.isEmpty());
    }

    @Test
    void completionAndFailureAreReported() {
        IllegalStateException failure = new IllegalStateException("reset");
        subscriber.onError(failure);
        subscriber.onComplete();

        assertEquals(2, closes.size());
        assertEquals(failure, closes.get(0));
        assertEquals(null, closes.get(1));
    }
}
