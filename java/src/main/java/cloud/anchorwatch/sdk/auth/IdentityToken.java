package cloud.anchorwatch.sdk.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Represents an issued identity token for an anonymous account.
 */
public final class IdentityToken {
    private final String idToken;
    private final String refreshToken;
    private final String uid;
    private final Instant expiry;

    public IdentityToken(String idToken, String refreshToken, String uid, Instant expiry) {
        this.idToken = Objects.requireNonNull(idToken, "idToken");
        this.refreshToken = refreshToken;
        this.uid = Objects.requireNonNull(uid, "uid");
        this.expiry = Objects.requireNonNull(expiry, "expiry");
    }

    public String getIdToken() {
        return idToken;
    }

    public String getRefreshToken() {
        return refreshToken;
    }

    /**
     * @return stable account id; used as owner identity and device id in pairing sessions.
     */
    public String getUid() {
        return uid;
    }

    public Instant getExpiry() {
        return expiry;
    }
}
