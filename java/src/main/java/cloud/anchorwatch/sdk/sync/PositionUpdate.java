package cloud.anchorwatch.sdk.sync;

import java.time.Instant;
import java.util.Objects;

/**
 * GPS fix of the boat. Optional measurements are {@code null} when the receiver did not report them.
 */
public record PositionUpdate(
    Instant timestamp,
    double latitude,
    double longitude,
    Double speed,
    Double accuracy,
    Double altitude,
    Double heading
) {

    public PositionUpdate {
        Objects.requireNonNull(timestamp, "timestamp");
        Coordinates.check(latitude, longitude);
        Coordinates.checkNonNegative("speed", speed);
        Coordinates.checkNonNegative("accuracy", accuracy);
        if (heading != null && (heading.isNaN() || heading < 0 || heading > 360)) {
            throw new IllegalArgumentException("heading must be between 0 and 360, got " + heading);
        }
    }

    public static PositionUpdate of(Instant timestamp, double latitude, double longitude) {
        return new PositionUpdate(timestamp, latitude, longitude, null, null, null, null);
    }
}
