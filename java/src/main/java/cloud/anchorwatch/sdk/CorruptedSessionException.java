package cloud.anchorwatch.sdk;

/**
 * Raised when a remote session record cannot be decoded into a valid {@code PairingSession}.
 */
public class CorruptedSessionException extends PairingException {

    private static final long serialVersionUID = 1L;

    public CorruptedSessionException(String message) {
        super(message);
    }

    public CorruptedSessionException(String message, Throwable cause) {
        super(message, cause);
    }
}
