package cloud.anchorwatch.sdk.session;

import java.time.Instant;
import java.util.Objects;

/**
 * Device entry of a pairing session.
 *
 * @param deviceId   stable identity of the device
 * @param role       role inside the session
 * @param joinedAt   time the device (re)joined
 * @param lastSeenAt last heartbeat, nullable
 */
public record DeviceInfo(String deviceId, DeviceRole role, Instant joinedAt, Instant lastSeenAt) {

    public DeviceInfo {
        Objects.requireNonNull(deviceId, "deviceId");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(joinedAt, "joinedAt");
        if (deviceId.isBlank()) {
            throw new IllegalArgumentException("deviceId must be non-empty");
        }
    }

    public static DeviceInfo primary(String deviceId, Instant joinedAt) {
        return new DeviceInfo(deviceId, DeviceRole.PRIMARY, joinedAt, null);
    }

    public static DeviceInfo secondary(String deviceId, Instant joinedAt) {
        return new DeviceInfo(deviceId, DeviceRole.SECONDARY, joinedAt, null);
    }

    public DeviceInfo withLastSeenAt(Instant instant) {
        return new DeviceInfo(deviceId, role, joinedAt, instant);
    }
}
