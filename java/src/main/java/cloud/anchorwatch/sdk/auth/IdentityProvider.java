package cloud.anchorwatch.sdk.auth;

import cloud.anchorwatch.sdk.PairingException;

/**
 * Contract for obtaining the device identity and the credential the store expects.
 */
public interface IdentityProvider {

    IdentityToken token() throws PairingException;

    /**
     * Returns the stable identity without forcing a network round trip when it is already known.
     */
    default String uid() throws PairingException {
        return token().getUid();
    }

    default void invalidate() {
        // default no-op
    }

    default IdentityToken forceRefresh() throws PairingException {
        invalidate();
        return token();
    }
}
