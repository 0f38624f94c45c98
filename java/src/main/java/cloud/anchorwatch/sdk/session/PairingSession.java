package cloud.anchorwatch.sdk.session;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable pairing session record shared through the remote store.
 *
 * <p>Every instance satisfies the session invariants: a non-blank token, at least one device, {@code expiresAt}
 * after {@code createdAt}, and exactly one primary device whose id is the owner identity. Violations raise
 * {@link IllegalArgumentException}; {@link SessionCodec} turns them into corruption errors when decoding.</p>
 */
public record PairingSession(
    String token,
    String ownerIdentity,
    Map<String, DeviceInfo> devices,
    Instant createdAt,
    Instant expiresAt,
    boolean isActive
) {

    public PairingSession {
        Objects.requireNonNull(token, "token");
        Objects.requireNonNull(ownerIdentity, "ownerIdentity");
        Objects.requireNonNull(devices, "devices");
        Objects.requireNonNull(createdAt, "createdAt");
        Objects.requireNonNull(expiresAt, "expiresAt");
        if (token.isBlank()) {
            throw new IllegalArgumentException("token must be non-empty");
        }
        if (ownerIdentity.isBlank()) {
            throw new IllegalArgumentException("ownerIdentity must be non-empty");
        }
        if (devices.isEmpty()) {
            throw new IllegalArgumentException("session " + token + " has no devices");
        }
        if (!expiresAt.isAfter(createdAt)) {
            throw new IllegalArgumentException("session " + token + " expires before it was created");
        }
        int primaries = 0;
        for (Map.Entry<String, DeviceInfo> entry : devices.entrySet()) {
            DeviceInfo device = Objects.requireNonNull(entry.getValue(), "device");
            if (!entry.getKey().equals(device.deviceId())) {
                throw new IllegalArgumentException("device key " + entry.getKey() + " does not match " + device.deviceId());
            }
            if (device.role() == DeviceRole.PRIMARY) {
                primaries++;
                if (!device.deviceId().equals(ownerIdentity)) {
                    throw new IllegalArgumentException("primary device " + device.deviceId() + " is not the owner");
                }
            }
        }
        if (primaries != 1) {
            throw new IllegalArgumentException("session " + token + " must have exactly one primary device, found " + primaries);
        }
        devices = Collections.unmodifiableMap(new LinkedHashMap<>(devices));
    }

    /**
     * Creates a fresh session owned by {@code ownerIdentity}, with the owner installed as the primary device.
     */
    public static PairingSession create(String token, String ownerIdentity, Instant now, Duration ttl) {
        DeviceInfo owner = DeviceInfo.primary(ownerIdentity, now);
        return new PairingSession(token, ownerIdentity, Map.of(ownerIdentity, owner), now, now.plus(ttl), true);
    }

    public Optional<DeviceInfo> device(String deviceId) {
        return Optional.ofNullable(devices.get(deviceId));
    }

    /**
     * Adds or replaces the entry with the same device id.
     */
    public PairingSession withDevice(DeviceInfo device) {
        Map<String, DeviceInfo> next = new LinkedHashMap<>(devices);
        next.put(device.deviceId(), device);
        return new PairingSession(token, ownerIdentity, next, createdAt, expiresAt, isActive);
    }

    /**
     * Removes a device entry; the owner's entry is never removed.
     */
    public PairingSession withoutDevice(String deviceId) {
        if (ownerIdentity.equals(deviceId) || !devices.containsKey(deviceId)) {
            return this;
        }
        Map<String, DeviceInfo> next = new LinkedHashMap<>(devices);
        next.remove(deviceId);
        return new PairingSession(token, ownerIdentity, next, createdAt, expiresAt, isActive);
    }

    public PairingSession withActive(boolean active) {
        return new PairingSession(token, ownerIdentity, devices, createdAt, expiresAt, active);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * @return {@code true} when the session is active and has not reached {@code expiresAt}.
     */
    public boolean isUsable(Instant now) {
        return isActive && !isExpired(now);
    }

    public boolean isOwnedBy(String identity) {
        return ownerIdentity.equals(identity);
    }
}
