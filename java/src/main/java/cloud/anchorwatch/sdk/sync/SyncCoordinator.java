package cloud.anchorwatch.sdk.sync;

import cloud.anchorwatch.sdk.PairingException;
import cloud.anchorwatch.sdk.internal.EventLoop;
import cloud.anchorwatch.sdk.internal.Json;
import cloud.anchorwatch.sdk.role.PairingRoleState;
import cloud.anchorwatch.sdk.role.RoleTransition;
import cloud.anchorwatch.sdk.role.RoleTransitionListener;
import cloud.anchorwatch.sdk.session.PairingSessionManager;
import cloud.anchorwatch.sdk.store.RemoteStore;
import cloud.anchorwatch.sdk.store.StorePaths;
import cloud.anchorwatch.sdk.store.Subscription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Publishes the primary device's monitoring data into its session while the device is an active primary.
 *
 * <p>Publication starts on the transition into active primary (fresh start or restored at launch) and stops on
 * leaving it. Every value is compared with the last one written successfully, so unchanged data causes no write and
 * a failed write is retried on the next change. Position writes are throttled to one per publish interval.</p>
 *
 * <p>All work runs on the event loop.</p>
 */
public final class SyncCoordinator implements RoleTransitionListener, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(SyncCoordinator.class.getName());

    private final RemoteStore store;
    private final PairingSessionManager sessions;
    private final MonitoringDataSource source;
    private final EventLoop loop;
    private final Duration positionInterval;

    private volatile String activeToken;
    private volatile Subscription dataSubscription = Subscription.NONE;
    private volatile ScheduledFuture<?> positionTimer;
    private boolean remoteReady;
    private boolean anchorPublished;
    private JsonNode lastAnchor;
    private PositionUpdate lastPosition;
    private PositionUpdate pendingPosition;
    private Map<String, JsonNode> publishedAlarms;

    public SyncCoordinator(
        RemoteStore store,
        PairingSessionManager sessions,
        MonitoringDataSource source,
        EventLoop loop,
        Duration positionInterval
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.source = Objects.requireNonNull(source, "source");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.positionInterval = positionInterval == null || positionInterval.isNegative() ? Duration.ZERO : positionInterval;
    }

    @Override
    public void onTransition(RoleTransition transition) {
        PairingRoleState next = transition.current();
        String current = activeToken;
        if (next.isActivePrimary()) {
            String token = next.localSessionToken();
            if (token.equals(current)) {
                return;
            }
            if (current != null) {
                stop(true);
            }
            start(token);
        } else if (current != null) {
            stop(transition.cause() != RoleTransition.Cause.SESSION_LOST);
        }
    }

    /**
     * @return token of the session currently published to, or {@code null} when idle.
     */
    public String activeToken() {
        return activeToken;
    }

    @Override
    public void close() {
        activeToken = null;
        dataSubscription.close();
        dataSubscription = Subscription.NONE;
        cancelTimer();
    }

    private void start(String token) {
        LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] starting monitoring sync for session %s", token));
        activeToken = token;
        resetMemory();
        dataSubscription = source.subscribe(ignored -> loop.execute(() -> onData(token)));
        if (!ensureReady(token)) {
            return;
        }
        MonitoringState state = source.current();
        publishAnchor(token, state.anchor());
        if (state.position() != null) {
            writePosition(token, state.position());
        }
        publishAlarms(token, state.activeAlarms());
    }

    private void stop(boolean markInactive) {
        String token = activeToken;
        LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] stopping monitoring sync for session %s", token));
        boolean wasReady = remoteReady;
        close();
        resetMemory();
        if (markInactive && wasReady && token != null) {
            try {
                store.update(StorePaths.session(token), Map.of(StorePaths.FIELD_MONITORING_ACTIVE, false));
            } catch (PairingException ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] could not clear monitoring flag for session " + token, ex);
            }
        }
    }

    private void onData(String token) {
        if (!token.equals(activeToken)) {
            return;
        }
        if (!ensureReady(token)) {
            return;
        }
        MonitoringState state = source.current();
        publishAnchor(token, state.anchor());
        schedulePosition(token, state.position());
        publishAlarms(token, state.activeAlarms());
    }

    private boolean ensureReady(String token) {
        if (remoteReady) {
            return true;
        }
        try {
            sessions.ensureRemoteSession(token);
            store.update(StorePaths.session(token), Map.of(StorePaths.FIELD_MONITORING_ACTIVE, true));
            remoteReady = true;
            return true;
        } catch (PairingException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] monitoring sync for session " + token
                + " could not start; retrying on the next data change", ex);
            return false;
        }
    }

    private void publishAnchor(String token, Anchor anchor) {
        JsonNode node = anchor == null ? null : MonitoringCodec.anchor(anchor);
        if (anchorPublished && Objects.equals(lastAnchor, node)) {
            return;
        }
        try {
            store.update(StorePaths.session(token), Collections.singletonMap(StorePaths.FIELD_ANCHOR, node));
            anchorPublished = true;
            lastAnchor = node;
            LOGGER.fine(() -> String.format(Locale.ROOT, "[anchorwatch] published anchor for session %s", token));
        } catch (PairingException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] failed to publish anchor for session " + token, ex);
        }
    }

    private void schedulePosition(String token, PositionUpdate position) {
        if (position == null || position.equals(lastPosition)) {
            return;
        }
        if (positionInterval.isZero()) {
            writePosition(token, position);
            return;
        }
        pendingPosition = position;
        if (positionTimer == null) {
            positionTimer = loop.schedule(() -> flushPosition(token), positionInterval);
        }
    }

    private void flushPosition(String token) {
        positionTimer = null;
        PositionUpdate position = pendingPosition;
        pendingPosition = null;
        if (position == null || !token.equals(activeToken) || position.equals(lastPosition)) {
            return;
        }
        writePosition(token, position);
    }

    private void writePosition(String token, PositionUpdate position) {
        try {
            store.set(StorePaths.sessionField(token, StorePaths.FIELD_LATEST_POSITION), MonitoringCodec.latestPosition(position));
            store.update(StorePaths.session(token),
                Map.of(StorePaths.FIELD_BOAT_POSITION, MonitoringCodec.boatPosition(position)));
            lastPosition = position;
            LOGGER.fine(() -> String.format(Locale.ROOT, "[anchorwatch] published position for session %s", token));
        } catch (PairingException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] failed to publish position for session " + token, ex);
        }
    }

    private void publishAlarms(String token, List<AlarmEvent> active) {
        Map<String, JsonNode> desired = new LinkedHashMap<>();
        active.forEach(alarm -> desired.put(alarm.id(), MonitoringCodec.alarm(alarm)));
        if (desired.equals(publishedAlarms)) {
            return;
        }
        try {
            if (publishedAlarms == null) {
                ObjectNode subtree = Json.mapper().createObjectNode();
                desired.forEach(subtree::set);
                store.set(StorePaths.alarms(token), subtree.isEmpty() ? null : subtree);
            } else {
                for (Map.Entry<String, JsonNode> entry : desired.entrySet()) {
                    if (!entry.getValue().equals(publishedAlarms.get(entry.getKey()))) {
                        store.set(StorePaths.alarm(token, entry.getKey()), entry.getValue());
                    }
                }
                for (String id : publishedAlarms.keySet()) {
                    if (!desired.containsKey(id)) {
                        store.delete(StorePaths.alarm(token, id));
                    }
                }
            }
            if (desired.isEmpty()) {
                store.update(StorePaths.session(token), Collections.singletonMap(StorePaths.FIELD_ALARM, null));
            }
            publishedAlarms = new HashMap<>(desired);
            LOGGER.fine(() -> String.format(Locale.ROOT, "[anchorwatch] published %d active alarms for session %s",
                desired.size(), token));
        } catch (PairingException | IllegalArgumentException ex) {
            publishedAlarms = null;
            LOGGER.log(Level.WARNING, "[anchorwatch] failed to publish alarms for session " + token, ex);
        }
    }

    private void cancelTimer() {
        ScheduledFuture<?> timer = positionTimer;
        positionTimer = null;
        if (timer != null) {
            timer.cancel(false);
        }
    }

    private void resetMemory() {
        remoteReady = false;
        anchorPublished = false;
        lastAnchor = null;
        lastPosition = null;
        pendingPosition = null;
        publishedAlarms = null;
    }
}
