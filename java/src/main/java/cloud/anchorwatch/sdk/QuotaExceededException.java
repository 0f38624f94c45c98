package cloud.anchorwatch.sdk;

/**
 * The backend ran out of quota. Remote operations keep failing until the quota is restored; local-only operation
 * continues.
 */
public class QuotaExceededException extends StoreException {

    private static final long serialVersionUID = 1L;

    public QuotaExceededException(int statusCode, String code, String message) {
        super(statusCode, code, message);
    }
}
