package cloud.anchorwatch.sdk;

import java.time.Duration;

/**
 * Raised when session creation is attempted again inside the creation cooldown. The condition is transient:
 * callers may retry once {@link #getRetryAfter()} has elapsed.
 */
public class RateLimitedException extends PairingException {

    private static final long serialVersionUID = 1L;

    private final Duration retryAfter;

    public RateLimitedException(String message, Duration retryAfter) {
        super(message);
        this.retryAfter = retryAfter == null || retryAfter.isNegative() ? Duration.ZERO : retryAfter;
    }

    /**
     * @return remaining cooldown at the time the call was rejected.
     */
    public Duration getRetryAfter() {
        return retryAfter;
    }
}
