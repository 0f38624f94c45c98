package cloud.anchorwatch.sdk;

/**
 * Raised when the requested session does not exist in the remote store.
 */
public class SessionNotFoundException extends PairingException {

    private static final long serialVersionUID = 1L;

    public SessionNotFoundException(String message) {
        super(message);
    }

    public SessionNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
