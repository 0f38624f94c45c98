package cloud.anchorwatch.sdk.stream;

import cloud.anchorwatch.sdk.store.Subscription;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class LiveValueTest {

    @Test
    void subscribersGetCurrentValueThenDistinctChanges() {
        LiveValue<String> value = new LiveValue<>("a");
        List<String> seen = new ArrayList<>();

        Subscription subscription = value.subscribe(seen::add);
        value.update("a");
        value.update("b");
        value.update("b");
        subscription.close();
        value.update("c");

        assertEquals(List.of("a", "b"), seen);
        assertEquals("c", value.get());
    }

    @Test
    void failingListenerDoesNotBlockOthers() {
        LiveValue<Integer> value = new LiveValue<>(0);
        List<Integer> seen = new ArrayList<>();
        value.subscribe(next -> {
            if (next > 0) {
                throw new IllegalStateException("listener bug");
            }
        });
        value.subscribe(seen::add);

        value.update(1);

        assertEquals(List.of(0, 1), seen);
    }
}
