package cloud.anchorwatch.sdk.role;

import cloud.anchorwatch.sdk.CorruptedSessionException;
import cloud.anchorwatch.sdk.InvalidTokenException;
import cloud.anchorwatch.sdk.NotPrimaryException;
import cloud.anchorwatch.sdk.PairingException;
import cloud.anchorwatch.sdk.SessionExpiredException;
import cloud.anchorwatch.sdk.SessionNotFoundException;
import cloud.anchorwatch.sdk.StoreUnavailableException;
import cloud.anchorwatch.sdk.internal.EventLoop;
import cloud.anchorwatch.sdk.local.LocalStore;
import cloud.anchorwatch.sdk.session.DeviceRole;
import cloud.anchorwatch.sdk.session.PairingSession;
import cloud.anchorwatch.sdk.session.PairingSessionManager;
import cloud.anchorwatch.sdk.store.Subscription;

import java.io.IOException;
import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the device's role state and is the only component allowed to change it.
 *
 * <p>States: unpaired primary, active primary (owns a session) and active secondary (joined a session). Every
 * mutation is serialized by a lock and persisted to the {@link LocalStore} before the new state becomes visible;
 * listeners then receive a {@link RoleTransition} on the event loop. Leaving a pairing (disconnect, end, session
 * loss) never fails because of the store or local persistence: those failures are logged and the device resets
 * anyway.</p>
 */
public final class PairingRoleCoordinator {

    private static final Logger LOGGER = Logger.getLogger(PairingRoleCoordinator.class.getName());

    private final PairingSessionManager sessions;
    private final LocalStore localStore;
    private final EventLoop loop;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<RoleTransitionListener> listeners = new CopyOnWriteArrayList<>();
    private volatile PairingRoleState state = PairingRoleState.unpaired();

    public PairingRoleCoordinator(PairingSessionManager sessions, LocalStore localStore, EventLoop loop, Clock clock) {
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.localStore = Objects.requireNonNull(localStore, "localStore");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Restores the persisted state, announces it as {@link RoleTransition.Cause#RESTORED} and schedules a
     * background check of the restored session. Never blocks on the store.
     */
    public void start() {
        lock.lock();
        try {
            String token = localStore.getString(LocalStore.KEY_SESSION_TOKEN);
            DeviceRole role = DeviceRole.PRIMARY;
            String savedRole = localStore.getString(LocalStore.KEY_ROLE);
            if (savedRole != null && DeviceRole.SECONDARY.wireName().equals(savedRole)) {
                role = DeviceRole.SECONDARY;
            }
            PairingRoleState restored;
            if (token == null || token.isBlank()) {
                restored = PairingRoleState.unpaired();
            } else if (role == DeviceRole.PRIMARY) {
                restored = PairingRoleState.activePrimary(token, null);
            } else {
                restored = PairingRoleState.activeSecondary(token, null);
            }
            PairingRoleState previous = state;
            state = restored;
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[anchorwatch] restored pairing state: role=%s, token=%s",
                restored.role().wireName(), restored.effectiveSessionToken().orElse("none")));
            publish(previous, restored, RoleTransition.Cause.RESTORED);

            if (!restored.isUnpaired()) {
                String restoredToken = restored.effectiveSessionToken().get();
                loop.execute(() -> verifyRestoredSession(restoredToken));
            }
        } finally {
            lock.unlock();
        }
    }

    public PairingRoleState state() {
        return state;
    }

    public DeviceRole role() {
        return state.role();
    }

    public Optional<String> effectiveSessionToken() {
        return state.effectiveSessionToken();
    }

    public Subscription addListener(RoleTransitionListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Moves to active primary, reusing the owned session while it is still usable and creating a new one
     * otherwise. A joined session is left once the new one is in place.
     *
     * @return the token of the session this device now owns
     */
    public String startPrimarySession() throws PairingException {
        lock.lock();
        try {
            PairingRoleState before = state;
            LOGGER.info("[anchorwatch] starting primary session");
            String token = before.localSessionToken() == null
                ? sessions.createSession()
                : reuseOrRecreate(before.localSessionToken());

            persist(token, DeviceRole.PRIMARY);
            if (before.isActiveSecondary() && !before.remoteSessionToken().equals(token)) {
                sessions.leaveSession(before.remoteSessionToken());
            }
            String owner = sessions.currentSession()
                .filter(session -> session.token().equals(token))
                .map(PairingSession::ownerIdentity)
                .orElse(before.ownerIdentity());
            PairingRoleState next = PairingRoleState.activePrimary(token, owner);
            state = next;
            publish(before, next, RoleTransition.Cause.STARTED_PRIMARY);
            LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] primary session %s started", token));
            return token;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Joins {@code token} as a secondary. Every failure propagates and leaves the state unchanged.
     */
    public PairingSession joinSecondarySession(String token) throws PairingException {
        lock.lock();
        try {
            PairingRoleState before = state;
            LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] joining session %s as secondary", token));
            PairingSession session = sessions.joinSession(token);
            try {
                persist(token, DeviceRole.SECONDARY);
            } catch (PairingException ex) {
                sessions.leaveSession(token);
                throw ex;
            }
            PairingRoleState next = PairingRoleState.activeSecondary(token, session.ownerIdentity());
            state = next;
            publish(before, next, RoleTransition.Cause.JOINED_SECONDARY);

            if (before.isActiveSecondary() && !before.remoteSessionToken().equals(token)) {
                sessions.leaveSession(before.remoteSessionToken());
            }
            return session;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Leaves a joined session and resets to unpaired primary. A logged no-op while primary.
     */
    public void disconnect() {
        lock.lock();
        try {
            PairingRoleState before = state;
            if (before.isPrimary()) {
                LOGGER.info("[anchorwatch] disconnect called on primary; no action needed");
                return;
            }
            if (before.remoteSessionToken() != null) {
                sessions.leaveSession(before.remoteSessionToken());
            }
            reset(before, RoleTransition.Cause.DISCONNECTED);
            LOGGER.info("[anchorwatch] disconnected; device is now an unpaired primary");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Ends the owned session and resets to unpaired primary.
     *
     * @throws NotPrimaryException when the device does not own an active session
     */
    public void endSession() throws NotPrimaryException {
        lock.lock();
        try {
            PairingRoleState before = state;
            if (!before.isActivePrimary()) {
                LOGGER.warning("[anchorwatch] cannot end session: device is not an active primary");
                throw new NotPrimaryException("only the primary device can end a session");
            }
            sessions.endSession(before.localSessionToken());
            reset(before, RoleTransition.Cause.ENDED);
            LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] session %s ended", before.localSessionToken()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resets the device after the session behind {@code token} expired, disappeared or became unreadable. Ignored
     * when {@code token} is no longer the effective token.
     *
     * @return {@code true} when the state was reset
     */
    public boolean handleSessionLost(String token, String reason) {
        lock.lock();
        try {
            PairingRoleState before = state;
            if (token == null || !before.effectiveSessionToken().equals(Optional.of(token))) {
                return false;
            }
            LOGGER.warning(() -> String.format(Locale.ROOT, "[anchorwatch] session %s lost (%s); resetting", token, reason));
            if (before.isActivePrimary() && !loop.isClosed()) {
                sessions.removeReverseIndex(token);
            }
            sessions.forget(token);
            reset(before, RoleTransition.Cause.SESSION_LOST);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops all listeners. Pending notifications are discarded with the event loop.
     */
    public void close() {
        listeners.clear();
    }

    private String reuseOrRecreate(String localToken) throws PairingException {
        try {
            PairingSession existing = sessions.fetchSession(localToken);
            if (existing.isUsable(clock.instant())) {
                LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] reusing active session %s", localToken));
                return localToken;
            }
            LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] session %s is inactive; replacing it", localToken));
            try {
                sessions.deleteSession(localToken);
            } catch (PairingException ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] could not delete inactive session " + localToken, ex);
            }
        } catch (SessionExpiredException | CorruptedSessionException | SessionNotFoundException | InvalidTokenException ex) {
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[anchorwatch] session %s unusable (%s); creating a new one", localToken, ex.getMessage()));
        } catch (StoreUnavailableException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] store unreachable; keeping local session " + localToken, ex);
            return localToken;
        }
        sessions.forget(localToken);
        return sessions.createSession();
    }

    private void verifyRestoredSession(String token) {
        if (loop.isClosed()) {
            return;
        }
        String reason;
        try {
            PairingSession session = sessions.fetchSession(token);
            LOGGER.fine(() -> String.format(Locale.ROOT, "[anchorwatch] restored session %s is %s", token,
                session.isActive() ? "active" : "inactive"));
            return;
        } catch (SessionExpiredException ex) {
            reason = "expired";
        } catch (CorruptedSessionException | InvalidTokenException ex) {
            reason = "corrupted";
        } catch (SessionNotFoundException ex) {
            if (state.isPrimary()) {
                LOGGER.info(() -> String.format(Locale.ROOT,
                    "[anchorwatch] restored session %s is not in the store; keeping it for local-only use", token));
                return;
            }
            reason = "not found";
        } catch (PairingException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] could not verify restored session " + token, ex);
            return;
        }
        if (loop.isClosed()) {
            return;
        }
        handleSessionLost(token, reason);
    }

    private void reset(PairingRoleState before, RoleTransition.Cause cause) {
        clearPersisted();
        PairingRoleState next = PairingRoleState.unpaired();
        state = next;
        publish(before, next, cause);
    }

    private void persist(String token, DeviceRole role) throws PairingException {
        String previousToken = localStore.getString(LocalStore.KEY_SESSION_TOKEN);
        String previousRole = localStore.getString(LocalStore.KEY_ROLE);
        try {
            localStore.setString(LocalStore.KEY_SESSION_TOKEN, token);
            localStore.setString(LocalStore.KEY_ROLE, role.wireName());
        } catch (IOException ex) {
            try {
                localStore.setString(LocalStore.KEY_SESSION_TOKEN, previousToken);
                localStore.setString(LocalStore.KEY_ROLE, previousRole);
            } catch (IOException restoreFailure) {
                ex.addSuppressed(restoreFailure);
            }
            throw new PairingException("persist pairing state: " + ex.getMessage(), ex);
        }
    }

    private void clearPersisted() {
        try {
            localStore.setString(LocalStore.KEY_SESSION_TOKEN, null);
            localStore.setString(LocalStore.KEY_ROLE, null);
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] could not clear persisted pairing state", ex);
        }
    }

    private void publish(PairingRoleState previous, PairingRoleState current, RoleTransition.Cause cause) {
        RoleTransition transition = new RoleTransition(previous, current, cause);
        loop.execute(() -> {
            for (RoleTransitionListener listener : listeners) {
                try {
                    listener.onTransition(transition);
                } catch (RuntimeException ex) {
                    LOGGER.log(Level.WARNING, "[anchorwatch] role transition listener failed", ex);
                }
            }
        });
    }
}
