package cloud.anchorwatch.sdk;

/**
 * Transport level failure (offline, timeout, interrupted request).
 */
public class StoreUnavailableException extends StoreException {

    private static final long serialVersionUID = 1L;

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
