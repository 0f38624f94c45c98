package cloud.anchorwatch.sdk.session;

import java.util.Locale;

/**
 * Role a device plays inside a pairing session.
 */
public enum DeviceRole {
    PRIMARY("primary"),
    SECONDARY("secondary");

    private final String wireName;

    DeviceRole(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Unknown or missing values decode to {@link #SECONDARY}; only an explicit {@code primary} grants ownership.
     */
    public static DeviceRole fromWire(String value) {
        if (value != null && PRIMARY.wireName.equals(value.trim().toLowerCase(Locale.ROOT))) {
            return PRIMARY;
        }
        return SECONDARY;
    }
}
