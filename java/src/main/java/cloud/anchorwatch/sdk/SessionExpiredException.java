package cloud.anchorwatch.sdk;

/**
 * Raised when a session has passed its {@code expiresAt} instant.
 */
public class SessionExpiredException extends PairingException {

    private static final long serialVersionUID = 1L;

    public SessionExpiredException(String message) {
        super(message);
    }

    public SessionExpiredException(String message, Throwable cause) {
        super(message, cause);
    }
}
