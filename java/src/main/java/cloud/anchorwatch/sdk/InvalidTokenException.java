package cloud.anchorwatch.sdk;

/**
 * Raised when a session token does not match the 32 character upper-case alphanumeric format.
 */
public class InvalidTokenException extends PairingException {

    private static final long serialVersionUID = 1L;

    public InvalidTokenException(String message) {
        super(message);
    }

    public InvalidTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
