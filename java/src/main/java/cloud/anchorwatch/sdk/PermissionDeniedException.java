package cloud.anchorwatch.sdk;

/**
 * The store rejected the request for the current identity. The store adapter refreshes the identity and retries
 * once before surfacing this exception.
 */
public class PermissionDeniedException extends StoreException {

    private static final long serialVersionUID = 1L;

    public PermissionDeniedException(int statusCode, String code, String message) {
        super(statusCode, code, message);
    }
}
