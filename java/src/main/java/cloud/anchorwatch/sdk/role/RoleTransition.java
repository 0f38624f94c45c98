package cloud.anchorwatch.sdk.role;

import java.util.Objects;

/**
 * A change of {@link PairingRoleState} together with what caused it.
 */
public record RoleTransition(PairingRoleState previous, PairingRoleState current, Cause cause) {

    public enum Cause {
        /** State loaded from local persistence at startup. */
        RESTORED,
        STARTED_PRIMARY,
        JOINED_SECONDARY,
        DISCONNECTED,
        ENDED,
        /** The session expired, was deleted, or became unreadable. */
        SESSION_LOST
    }

    public RoleTransition {
        Objects.requireNonNull(previous, "previous");
        Objects.requireNonNull(current, "current");
        Objects.requireNonNull(cause, "cause");
    }

    /**
     * @return {@code true} when the effective session token differs between the two states.
     */
    public boolean tokenChanged() {
        return !previous.effectiveSessionToken().equals(current.effectiveSessionToken());
    }
}
