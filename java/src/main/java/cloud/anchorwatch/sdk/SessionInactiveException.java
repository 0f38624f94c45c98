package cloud.anchorwatch.sdk;

/**
 * Raised when a session was ended by its primary device.
 */
public class SessionInactiveException extends PairingException {

    private static final long serialVersionUID = 1L;

    public SessionInactiveException(String message) {
        super(message);
    }

    public SessionInactiveException(String message, Throwable cause) {
        super(message, cause);
    }
}
