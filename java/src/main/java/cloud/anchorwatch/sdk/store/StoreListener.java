package cloud.anchorwatch.sdk.store;

import cloud.anchorwatch.sdk.PairingException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Receives the value stored at a watched path.
 */
@FunctionalInterface
public interface StoreListener {

    /**
     * @param value current value at the path, or {@code null} when nothing is stored there.
     */
    void onValue(JsonNode value);

    default void onError(PairingException error) {
        // default no-op
    }
}
