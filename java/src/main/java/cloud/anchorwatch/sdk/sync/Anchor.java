package cloud.anchorwatch.sdk.sync;

import java.time.Instant;
import java.util.Objects;

/**
 * Anchor position and alarm radius (metres) set on the primary device.
 */
public record Anchor(String id, double latitude, double longitude, double radius, Instant createdAt, boolean isActive) {

    public static final double MIN_RADIUS = 20.0;
    public static final double MAX_RADIUS = 100.0;

    public Anchor {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(createdAt, "createdAt");
        if (id.isBlank()) {
            throw new IllegalArgumentException("anchor id must be non-empty");
        }
        Coordinates.check(latitude, longitude);
        if (radius < MIN_RADIUS || radius > MAX_RADIUS) {
            throw new IllegalArgumentException("radius must be between 20 and 100 metres, got " + radius);
        }
    }
}
