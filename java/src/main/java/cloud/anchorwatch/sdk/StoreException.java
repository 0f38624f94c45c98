package cloud.anchorwatch.sdk;

/**
 * Exception representing a failure reported by the remote store. When the backend responds with a non-2xx status
 * the SDK hydrates this type (or one of its subclasses) so callers can inspect both the HTTP status and the backend
 * error code.
 */
public class StoreException extends PairingException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;
    private final String code;

    public StoreException(int statusCode, String code, String message) {
        super(message == null || message.isBlank() ? defaultMessage(statusCode, code) : message);
        this.statusCode = statusCode;
        this.code = code;
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
        this.code = null;
    }

    /**
     * @return HTTP status code returned by the store, or {@code 0} when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * @return backend error code (nullable when the response body did not include one).
     */
    public String getCode() {
        return code;
    }

    private static String defaultMessage(int status, String code) {
        if (code == null || code.isBlank()) {
            return "store request failed with status " + status;
        }
        return "store request failed with status " + status + " (" + code + ")";
    }
}
