package cloud.anchorwatch.sdk.session;

import cloud.anchorwatch.sdk.CorruptedSessionException;
import cloud.anchorwatch.sdk.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single translation point between {@link PairingSession} and its store representation.
 *
 * <pre>
 * { "primaryUserId": "...", "createdAt": 1700000000000, "expiresAt": 1700086400000, "isActive": true,
 *   "devices": { "uid": { "deviceId": "uid", "role": "primary", "joinedAt": 1700000000000 } } }
 * </pre>
 *
 * Timestamps are epoch milliseconds. Fields other than the ones above (published monitoring data) are ignored.
 */
public final class SessionCodec {

    static final String FIELD_PRIMARY_USER_ID = "primaryUserId";
    static final String FIELD_CREATED_AT = "createdAt";
    static final String FIELD_EXPIRES_AT = "expiresAt";
    static final String FIELD_IS_ACTIVE = "isActive";
    static final String FIELD_DEVICES = "devices";
    static final String FIELD_DEVICE_ID = "deviceId";
    static final String FIELD_ROLE = "role";
    static final String FIELD_JOINED_AT = "joinedAt";
    static final String FIELD_LAST_SEEN_AT = "lastSeenAt";

    private SessionCodec() {
    }

    public static ObjectNode encode(PairingSession session) {
        ObjectNode node = Json.mapper().createObjectNode();
        node.put(FIELD_PRIMARY_USER_ID, session.ownerIdentity());
        ObjectNode devices = node.putObject(FIELD_DEVICES);
        session.devices().forEach((id, device) -> devices.set(id, encodeDevice(device)));
        node.put(FIELD_CREATED_AT, session.createdAt().toEpochMilli());
        node.put(FIELD_EXPIRES_AT, session.expiresAt().toEpochMilli());
        node.put(FIELD_IS_ACTIVE, session.isActive());
        return node;
    }

    public static ObjectNode encodeDevice(DeviceInfo device) {
        ObjectNode node = Json.mapper().createObjectNode();
        node.put(FIELD_DEVICE_ID, device.deviceId());
        node.put(FIELD_ROLE, device.role().wireName());
        node.put(FIELD_JOINED_AT, device.joinedAt().toEpochMilli());
        if (device.lastSeenAt() != null) {
            node.put(FIELD_LAST_SEEN_AT, device.lastSeenAt().toEpochMilli());
        }
        return node;
    }

    /**
     * Decodes the record stored at {@code sessions/{token}}.
     *
     * @throws CorruptedSessionException when a required field is missing, has the wrong shape, or the decoded
     *                                   record violates the session invariants.
     */
    public static PairingSession decode(String token, JsonNode node) throws CorruptedSessionException {
        if (node == null || !node.isObject()) {
            throw new CorruptedSessionException("session " + token + " is not an object");
        }
        String owner = requireText(token, node, FIELD_PRIMARY_USER_ID);
        Instant createdAt = requireInstant(token, node, FIELD_CREATED_AT);
        Instant expiresAt = requireInstant(token, node, FIELD_EXPIRES_AT);
        JsonNode active = node.get(FIELD_IS_ACTIVE);
        boolean isActive = true;
        if (active != null && !active.isNull()) {
            if (!active.isBoolean()) {
                throw new CorruptedSessionException("session " + token + " has a non-boolean \"" + FIELD_IS_ACTIVE + "\"");
            }
            isActive = active.booleanValue();
        }

        JsonNode rawDevices = node.get(FIELD_DEVICES);
        if (rawDevices == null || rawDevices.isNull()) {
            throw new CorruptedSessionException("session " + token + " is missing \"" + FIELD_DEVICES + "\"");
        }
        if (!rawDevices.isObject()) {
            throw new CorruptedSessionException("session " + token + " has an invalid \"" + FIELD_DEVICES + "\" field");
        }
        Map<String, DeviceInfo> devices = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> entries = rawDevices.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            DeviceInfo device = decodeDevice(token, entry.getKey(), entry.getValue());
            devices.put(device.deviceId(), device);
        }

        try {
            return new PairingSession(token, owner, devices, createdAt, expiresAt, isActive);
        } catch (IllegalArgumentException ex) {
            throw new CorruptedSessionException("session " + token + " is invalid: " + ex.getMessage(), ex);
        }
    }

    static DeviceInfo decodeDevice(String token, String key, JsonNode node) throws CorruptedSessionException {
        if (node == null || !node.isObject()) {
            throw new CorruptedSessionException("session " + token + " has an invalid device entry " + key);
        }
        String deviceId = node.hasNonNull(FIELD_DEVICE_ID) ? node.get(FIELD_DEVICE_ID).asText() : key;
        DeviceRole role = DeviceRole.fromWire(node.path(FIELD_ROLE).asText(null));
        Instant joinedAt = requireInstant(token, node, FIELD_JOINED_AT);
        Instant lastSeenAt = node.hasNonNull(FIELD_LAST_SEEN_AT) ? requireInstant(token, node, FIELD_LAST_SEEN_AT) : null;
        try {
            return new DeviceInfo(deviceId, role, joinedAt, lastSeenAt);
        } catch (IllegalArgumentException ex) {
            throw new CorruptedSessionException("session " + token + " has an invalid device entry " + key, ex);
        }
    }

    private static String requireText(String token, JsonNode node, String field) throws CorruptedSessionException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new CorruptedSessionException("session " + token + " is missing \"" + field + "\"");
        }
        return value.asText();
    }

    private static Instant requireInstant(String token, JsonNode node, String field) throws CorruptedSessionException {
        JsonNode value = node.get(field);
        if (value == null || !value.isNumber()) {
            throw new CorruptedSessionException("session " + token + " is missing numeric \"" + field + "\"");
        }
        return Instant.ofEpochMilli(value.asLong());
    }
}
