package cloud.anchorwatch.sdk;

/**
 * Raised when an operation reserved for the active primary device is invoked in another role.
 */
public class NotPrimaryException extends PairingException {

    private static final long serialVersionUID = 1L;

    public NotPrimaryException(String message) {
        super(message);
    }

    public NotPrimaryException(String message, Throwable cause) {
        super(message, cause);
    }
}
