package cloud.anchorwatch.sdk;

/**
 * Base exception thrown by the Anchorwatch pairing SDK.
 */
public class PairingException extends Exception {

    private static final long serialVersionUID = 1L;

    public PairingException(String message) {
        super(message);
    }

    public PairingException(String message, Throwable cause) {
        super(message, cause);
    }
}
