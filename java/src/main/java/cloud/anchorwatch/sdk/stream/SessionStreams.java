package cloud.anchorwatch.sdk.stream;

import cloud.anchorwatch.sdk.CorruptedSessionException;
import cloud.anchorwatch.sdk.PairingException;
import cloud.anchorwatch.sdk.internal.EventLoop;
import cloud.anchorwatch.sdk.role.PairingRoleCoordinator;
import cloud.anchorwatch.sdk.role.PairingRoleState;
import cloud.anchorwatch.sdk.role.RoleTransition;
import cloud.anchorwatch.sdk.role.RoleTransitionListener;
import cloud.anchorwatch.sdk.session.PairingSession;
import cloud.anchorwatch.sdk.session.PairingSessionManager;
import cloud.anchorwatch.sdk.session.SessionCodec;
import cloud.anchorwatch.sdk.store.RemoteStore;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only live projections of the session records selected by the role state, plus the self-healing that runs
 * when one of them turns out to be expired, corrupted or gone.
 *
 * <ul>
 *     <li>{@link #localSessionData()}, {@link #remoteSessionData()} and {@link #effectiveSessionData()} follow the
 *     owned, joined and effective token respectively;</li>
 *     <li>{@link #primarySession()} follows the owned session while the device is an active primary; a missing
 *     record is tolerated because the session may not be published yet;</li>
 *     <li>{@link #secondarySession()} follows the joined session while the device is an active secondary and resets
 *     the device once the primary ends or removes the session.</li>
 * </ul>
 *
 * <p>Self-healing runs on the event loop at most once per token: the remote record is deleted (best effort) and
 * the role coordinator resets the device to an unpaired primary.</p>
 */
public final class SessionStreams implements RoleTransitionListener, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SessionStreams.class.getName());

    private final PairingRoleCoordinator coordinator;
    private final PairingSessionManager sessions;
    private final EventLoop loop;
    private final Clock clock;
    private final Set<String> healed = ConcurrentHashMap.newKeySet();

    private final SessionDataView<JsonNode> local;
    private final SessionDataView<JsonNode> remote;
    private final SessionDataView<JsonNode> effective;
    private final SessionDataView<PairingSession> primary;
    private final SessionDataView<PairingSession> secondary;
    private volatile boolean closed;

    public SessionStreams(
        RemoteStore store,
        PairingRoleCoordinator coordinator,
        PairingSessionManager sessions,
        EventLoop loop,
        Clock clock
    ) {
        Objects.requireNonNull(store, "store");
        this.coordinator = Objects.requireNonNull(coordinator, "coordinator");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.local = new SessionDataView<>("local", store, loop, this::rawRecord);
        this.remote = new SessionDataView<>("remote", store, loop, this::rawRecord);
        this.effective = new SessionDataView<>("effective", store, loop, this::rawRecord);
        this.primary = new SessionDataView<>("primary", store, loop, this::primaryRecord);
        this.secondary = new SessionDataView<>("secondary", store, loop, this::secondaryRecord);
    }

    public LiveValue<Optional<JsonNode>> localSessionData() {
        return local.value();
    }

    public LiveValue<Optional<JsonNode>> remoteSessionData() {
        return remote.value();
    }

    public LiveValue<Optional<JsonNode>> effectiveSessionData() {
        return effective.value();
    }

    public LiveValue<Optional<PairingSession>> primarySession() {
        return primary.value();
    }

    public LiveValue<Optional<PairingSession>> secondarySession() {
        return secondary.value();
    }

    @Override
    public void onTransition(RoleTransition transition) {
        if (closed) {
            return;
        }
        PairingRoleState state = transition.current();
        state.effectiveSessionToken().ifPresent(healed::remove);
        local.retarget(state.localSessionToken());
        remote.retarget(state.remoteSessionToken());
        effective.retarget(state.effectiveSessionToken().orElse(null));
        primary.retarget(state.isActivePrimary() ? state.localSessionToken() : null);
        secondary.retarget(state.isActiveSecondary() ? state.remoteSessionToken() : null);
    }

    /**
     * Closes every watch and pending recheck; queued self-healing work is abandoned.
     */
    @Override
    public void close() {
        closed = true;
        List.of(local, remote, effective, primary, secondary).forEach(SessionDataView::close);
    }

    private Optional<JsonNode> rawRecord(SessionDataView<JsonNode> view, String token, JsonNode record) {
        if (record == null) {
            return Optional.empty();
        }
        return validate(view, token, record).map(session -> record);
    }

    private Optional<PairingSession> primaryRecord(SessionDataView<PairingSession> view, String token, JsonNode record) {
        if (record == null) {
            LOGGER.fine(() -> String.format(Locale.ROOT, "[anchorwatch] primary session %s not in the store", token));
            return Optional.empty();
        }
        return validate(view, token, record);
    }

    private Optional<PairingSession> secondaryRecord(SessionDataView<PairingSession> view, String token, JsonNode record) {
        if (record == null) {
            reset(token, "session removed by the primary");
            return Optional.empty();
        }
        Optional<PairingSession> session = validate(view, token, record);
        if (session.isPresent() && !session.get().isActive()) {
            reset(token, "session ended by the primary");
            return Optional.empty();
        }
        return session;
    }

    private Optional<PairingSession> validate(SessionDataView<?> view, String token, JsonNode record) {
        PairingSession session;
        try {
            session = SessionCodec.decode(token, record);
        } catch (CorruptedSessionException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] session " + token + " is corrupted", ex);
            heal(token, "corrupted");
            return Optional.empty();
        }
        Instant now = clock.instant();
        if (session.isExpired(now)) {
            heal(token, "expired");
            return Optional.empty();
        }
        view.recheckAfter(Duration.between(now, session.expiresAt()));
        return Optional.of(session);
    }

    /**
     * Deletes the remote record, then resets the device.
     */
    private void heal(String token, String reason) {
        if (!healed.add(token)) {
            return;
        }
        loop.execute(() -> {
            if (closed || loop.isClosed()) {
                return;
            }
            LOGGER.warning(() -> String.format(Locale.ROOT, "[anchorwatch] removing %s session %s", reason, token));
            try {
                sessions.deleteSession(token);
            } catch (PairingException ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] could not delete " + reason + " session " + token, ex);
            }
            if (closed || loop.isClosed()) {
                return;
            }
            coordinator.handleSessionLost(token, reason);
        });
    }

    /**
     * Resets the device without touching the remote record.
     */
    private void reset(String token, String reason) {
        if (!healed.add(token)) {
            return;
        }
        loop.execute(() -> {
            if (closed || loop.isClosed()) {
                return;
            }
            coordinator.handleSessionLost(token, reason);
        });
    }
}
