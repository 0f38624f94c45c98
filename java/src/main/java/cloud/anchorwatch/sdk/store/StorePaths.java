package cloud.anchorwatch.sdk.store;

import java.util.Objects;

/**
 * Path scheme of the shared store.
 *
 * <pre>
 * sessions/{token}                      session record
 * sessions/{token}/devices/{deviceId}   device entry, written by the device itself
 * sessions/{token}/alarms/{alarmId}     active alarm published by the primary
 * deviceSessions/{identity}             reverse index: owner identity -> token
 * </pre>
 */
public final class StorePaths {

    public static final String SESSIONS = "sessions";
    public static final String DEVICE_SESSIONS = "deviceSessions";

    public static final String FIELD_DEVICES = "devices";
    public static final String FIELD_IS_ACTIVE = "isActive";
    public static final String FIELD_ANCHOR = "anchor";
    public static final String FIELD_BOAT_POSITION = "boatPosition";
    public static final String FIELD_LATEST_POSITION = "latestPosition";
    public static final String FIELD_ALARMS = "alarms";
    public static final String FIELD_ALARM = "alarm";
    public static final String FIELD_MONITORING_ACTIVE = "monitoringActive";

    private StorePaths() {
    }

    public static String session(String token) {
        return SESSIONS + "/" + segment(token);
    }

    public static String sessionField(String token, String field) {
        return session(token) + "/" + segment(field);
    }

    public static String device(String token, String deviceId) {
        return session(token) + "/" + FIELD_DEVICES + "/" + segment(deviceId);
    }

    public static String alarms(String token) {
        return session(token) + "/" + FIELD_ALARMS;
    }

    public static String alarm(String token, String alarmId) {
        return alarms(token) + "/" + segment(alarmId);
    }

    public static String deviceSession(String identity) {
        return DEVICE_SESSIONS + "/" + segment(identity);
    }

    /**
     * Validates a single path segment; the backend forbids {@code . # $ [ ]} and the separator itself.
     */
    public static String segment(String value) {
        Objects.requireNonNull(value, "path segment");
        if (value.isBlank()) {
            throw new IllegalArgumentException("path segment must be non-empty");
        }
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '.' || ch == '#' || ch == '$' || ch == '[' || ch == ']' || ch == '/' || Character.isISOControl(ch)) {
                throw new IllegalArgumentException("illegal character '" + ch + "' in path segment " + value);
            }
        }
        return value;
    }
}
