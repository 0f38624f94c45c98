package cloud.anchorwatch.sdk.store;

import cloud.anchorwatch.sdk.PairingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Thin adapter over a shared document / key-value backend addressed by slash separated paths (see
 * {@link StorePaths}). The backend is passive: it enforces no invariants beyond its access rules, and concurrent
 * writers resolve by last-writer-wins.
 *
 * <p>Failures surface as {@link cloud.anchorwatch.sdk.StoreException} subtypes:
 * {@link cloud.anchorwatch.sdk.PermissionDeniedException} after one identity refresh and retry,
 * {@link cloud.anchorwatch.sdk.QuotaExceededException} on resource exhaustion and
 * {@link cloud.anchorwatch.sdk.StoreUnavailableException} when the backend cannot be reached.</p>
 */
public interface RemoteStore {

    /**
     * Ensures the device is authenticated and returns its stable identity.
     */
    String identity() throws PairingException;

    /**
     * @return the value at {@code path}, or {@code null} when absent.
     */
    JsonNode get(String path) throws PairingException;

    /**
     * Lightweight read that only establishes whether the caller may read {@code path} and whether something is
     * stored there.
     */
    boolean probe(String path) throws PairingException;

    /**
     * Replaces the value at {@code path}. A {@code null} value deletes it.
     */
    void set(String path, Object value) throws PairingException;

    /**
     * Multi-location update relative to {@code path}; keys may themselves be nested paths and {@code null} values
     * delete the addressed child.
     */
    void update(String path, Map<String, ?> values) throws PairingException;

    void delete(String path) throws PairingException;

    /**
     * Registers {@code listener} for the value at {@code path}. The listener is called once with the current value
     * and again after every change, on the store's callback executor.
     */
    Subscription watch(String path, StoreListener listener);
}
