package cloud.anchorwatch.sdk.role;

import cloud.anchorwatch.sdk.session.DeviceRole;

import java.util.Objects;
import java.util.Optional;

/**
 * Local view of this device's place in a pairing: its role plus the token of the session it owns (primary) or
 * joined (secondary). Only one of the two tokens is ever set, matching the role.
 */
public record PairingRoleState(
    DeviceRole role,
    String localSessionToken,
    String remoteSessionToken,
    String ownerIdentity
) {

    private static final PairingRoleState UNPAIRED = new PairingRoleState(DeviceRole.PRIMARY, null, null, null);

    public PairingRoleState {
        Objects.requireNonNull(role, "role");
        if (role == DeviceRole.PRIMARY && remoteSessionToken != null) {
            throw new IllegalArgumentException("a primary device cannot hold a joined session token");
        }
        if (role == DeviceRole.SECONDARY && localSessionToken != null) {
            throw new IllegalArgumentException("a secondary device cannot hold an owned session token");
        }
    }

    /**
     * Initial state of a fresh install: primary role, no session.
     */
    public static PairingRoleState unpaired() {
        return UNPAIRED;
    }

    public static PairingRoleState activePrimary(String token, String ownerIdentity) {
        return new PairingRoleState(DeviceRole.PRIMARY, Objects.requireNonNull(token, "token"), null, ownerIdentity);
    }

    public static PairingRoleState activeSecondary(String token, String ownerIdentity) {
        return new PairingRoleState(DeviceRole.SECONDARY, null, Objects.requireNonNull(token, "token"), ownerIdentity);
    }

    /**
     * @return the token in use, preferring a joined session over an owned one.
     */
    public Optional<String> effectiveSessionToken() {
        return Optional.ofNullable(remoteSessionToken != null ? remoteSessionToken : localSessionToken);
    }

    public boolean isPrimary() {
        return role == DeviceRole.PRIMARY;
    }

    public boolean isSecondary() {
        return role == DeviceRole.SECONDARY;
    }

    public boolean isActivePrimary() {
        return isPrimary() && localSessionToken != null;
    }

    public boolean isActiveSecondary() {
        return isSecondary() && remoteSessionToken != null;
    }

    public boolean isUnpaired() {
        return effectiveSessionToken().isEmpty();
    }
}
