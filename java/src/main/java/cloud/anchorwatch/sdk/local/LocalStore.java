package cloud.anchorwatch.sdk.local;

import java.io.IOException;

/**
 * Key-value persistence that survives process restarts. Implementations must make a completed
 * {@link #setString(String, String)} visible to every later {@link #getString(String)}.
 */
public interface LocalStore {

    String KEY_SESSION_TOKEN = "sessionToken";
    String KEY_ROLE = "role";
    String KEY_AUTH_UID = "authUid";
    String KEY_AUTH_REFRESH_TOKEN = "authRefreshToken";

    String getString(String key);

    /**
     * Stores {@code value} under {@code key}; {@code null} removes the entry.
     *
     * @throws IOException when the value could not be made durable.
     */
    void setString(String key, String value) throws IOException;
}
