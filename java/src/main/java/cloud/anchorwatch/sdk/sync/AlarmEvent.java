package cloud.anchorwatch.sdk.sync;

import java.time.Instant;
import java.util.Objects;

/**
 * Alarm raised by the monitoring engine. Only unacknowledged alarms are published to the session.
 */
public record AlarmEvent(
    String id,
    AlarmType type,
    AlarmSeverity severity,
    Instant timestamp,
    double latitude,
    double longitude,
    double distanceFromAnchor,
    boolean acknowledged,
    Instant acknowledgedAt
) {

    public AlarmEvent {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(timestamp, "timestamp");
        if (id.isBlank()) {
            throw new IllegalArgumentException("alarm id must be non-empty");
        }
        Coordinates.check(latitude, longitude);
        if (Double.isNaN(distanceFromAnchor) || distanceFromAnchor < 0) {
            throw new IllegalArgumentException("distance from anchor must be non-negative, got " + distanceFromAnchor);
        }
    }

    public AlarmEvent acknowledge(Instant at) {
        return new AlarmEvent(id, type, severity, timestamp, latitude, longitude, distanceFromAnchor, true, at);
    }
}
