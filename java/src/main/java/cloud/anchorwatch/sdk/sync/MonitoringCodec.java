package cloud.anchorwatch.sdk.sync;

import cloud.anchorwatch.sdk.internal.Json;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.format.DateTimeFormatter;

/**
 * Store representation of the published monitoring data.
 */
public final class MonitoringCodec {

    private MonitoringCodec() {
    }

    /**
     * {@code sessions/{t}/anchor}: {@code {lat, lon, radius, isActive, createdAt}} with epoch milliseconds.
     */
    public static ObjectNode anchor(Anchor anchor) {
        ObjectNode node = Json.mapper().createObjectNode();
        node.put("lat", anchor.latitude());
        node.put("lon", anchor.longitude());
        node.put("radius", anchor.radius());
        node.put("isActive", anchor.isActive());
        node.put("createdAt", anchor.createdAt().toEpochMilli());
        return node;
    }

    /**
     * {@code sessions/{t}/boatPosition}: compact form read by secondaries, ISO-8601 timestamp.
     */
    public static ObjectNode boatPosition(PositionUpdate position) {
        ObjectNode node = Json.mapper().createObjectNode();
        node.put("lat", position.latitude());
        node.put("lon", position.longitude());
        if (position.speed() != null) {
            node.put("speed", position.speed());
        }
        if (position.accuracy() != null) {
            node.put("accuracy", position.accuracy());
        }
        node.put("timestamp", DateTimeFormatter.ISO_INSTANT.format(position.timestamp()));
        return node;
    }

    /**
     * {@code sessions/{t}/latestPosition}: the full fix.
     */
    public static ObjectNode latestPosition(PositionUpdate position) {
        ObjectNode node = Json.mapper().createObjectNode();
        node.put("timestamp", position.timestamp().toEpochMilli());
        node.put("latitude", position.latitude());
        node.put("longitude", position.longitude());
        putOptional(node, "speed", position.speed());
        putOptional(node, "accuracy", position.accuracy());
        putOptional(node, "altitude", position.altitude());
        putOptional(node, "heading", position.heading());
        return node;
    }

    /**
     * {@code sessions/{t}/alarms/{id}}.
     */
    public static ObjectNode alarm(AlarmEvent alarm) {
        ObjectNode node = Json.mapper().createObjectNode();
        node.put("type", alarm.type().wireName());
        node.put("severity", alarm.severity().wireName());
        node.put("timestamp", alarm.timestamp().toEpochMilli());
        node.put("latitude", alarm.latitude());
        node.put("longitude", alarm.longitude());
        node.put("distanceFromAnchor", alarm.distanceFromAnchor());
        node.put("acknowledged", alarm.acknowledged());
        if (alarm.acknowledgedAt() != null) {
            node.put("acknowledgedAt", alarm.acknowledgedAt().toEpochMilli());
        }
        return node;
    }

    private static void putOptional(ObjectNode node, String field, Double value) {
        if (value != null) {
            node.put(field, value);
        }
    }
}
