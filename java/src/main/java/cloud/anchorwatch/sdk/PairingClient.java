package cloud.anchorwatch.sdk;

import cloud.anchorwatch.sdk.auth.AnonymousIdentityManager;
import cloud.anchorwatch.sdk.internal.EventLoop;
import cloud.anchorwatch.sdk.local.LocalStore;
import cloud.anchorwatch.sdk.role.PairingRoleCoordinator;
import cloud.anchorwatch.sdk.role.PairingRoleState;
import cloud.anchorwatch.sdk.role.RoleTransitionListener;
import cloud.anchorwatch.sdk.session.DeviceRole;
import cloud.anchorwatch.sdk.session.PairingSession;
import cloud.anchorwatch.sdk.session.PairingSessionManager;
import cloud.anchorwatch.sdk.store.RealtimeDatabaseStore;
import cloud.anchorwatch.sdk.store.RemoteStore;
import cloud.anchorwatch.sdk.store.Subscription;
import cloud.anchorwatch.sdk.stream.LiveValue;
import cloud.anchorwatch.sdk.stream.SessionStreams;
import cloud.anchorwatch.sdk.sync.MonitoringDataSource;
import cloud.anchorwatch.sdk.sync.SyncCoordinator;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for pairing a device with others through the shared store.
 *
 * <p>A client wires the session manager, the role coordinator, the sync coordinator and the session stream views
 * around one event loop. Construct one per device, call {@link #start()} once to restore the persisted pairing, and
 * {@link #close()} on shutdown to cancel every watch, timer and pending task.</p>
 *
 * <h2>Key behaviours</h2>
 * <ul>
 *   <li>Lifecycle operations block the calling thread and report failures as {@link PairingException} subtypes.</li>
 *   <li>While the device is an active primary its monitoring data is published to the session automatically.</li>
 *   <li>Expired, corrupted or removed sessions are cleaned up in the background and the device falls back to an
 *       unpaired primary.</li>
 * </ul>
 */
public final class PairingClient implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(PairingClient.class.getName());
    private static final AtomicInteger CLIENT_IDS = new AtomicInteger();

    private final PairingConfig config;
    private final EventLoop loop;
    private final RemoteStore store;
    private final PairingSessionManager sessions;
    private final PairingRoleCoordinator coordinator;
    private final SyncCoordinator sync;
    private final SessionStreams streams;

    private final Object startLock = new Object();
    private boolean started;
    private volatile boolean closed;

    /**
     * Builds a client talking to the realtime database named by {@link PairingConfig#getDatabaseUrl()}, signing in
     * anonymously with {@link PairingConfig#getApiKey()}.
     */
    public PairingClient(PairingConfig config, LocalStore localStore, MonitoringDataSource monitoringData) {
        this(config, localStore, monitoringData, null);
    }

    /**
     * Builds a client on a caller-supplied store; {@code storeFactory} receives the client's event loop, which the
     * store should use to deliver watch callbacks.
     */
    public PairingClient(
        PairingConfig config,
        LocalStore localStore,
        MonitoringDataSource monitoringData,
        Function<EventLoop, RemoteStore> storeFactory
    ) {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(localStore, "localStore");
        Objects.requireNonNull(monitoringData, "monitoringData");
        this.config = config.withDefaults();
        this.loop = new EventLoop("anchorwatch-pairing-" + CLIENT_IDS.incrementAndGet());
        try {
            this.store = storeFactory != null
                ? Objects.requireNonNull(storeFactory.apply(loop), "storeFactory returned null")
                : realtimeStore(this.config, localStore, loop);
        } catch (RuntimeException ex) {
            loop.close();
            throw ex;
        }
        this.sessions = new PairingSessionManager(
            store,
            loop,
            this.config.getClock(),
            this.config.getCreationCooldown(),
            this.config.getSessionTtl(),
            this.config.getStaleSessionRetention()
        );
        this.coordinator = new PairingRoleCoordinator(sessions, localStore, loop, this.config.getClock());
        this.sync = new SyncCoordinator(store, sessions, monitoringData, loop, this.config.getPositionPublishInterval());
        this.streams = new SessionStreams(store, coordinator, sessions, loop, this.config.getClock());
        coordinator.addListener(sync);
        coordinator.addListener(streams);
    }

    private static RemoteStore realtimeStore(PairingConfig config, LocalStore localStore, EventLoop loop) {
        if (config.getDatabaseUrl() == null) {
            throw new IllegalArgumentException("DatabaseUrl is required");
        }
        if (config.getApiKey() == null) {
            throw new IllegalArgumentException("ApiKey is required");
        }
        AnonymousIdentityManager identity = new AnonymousIdentityManager(
            config.getHttpClient(),
            config.getIdentityUrl(),
            config.getSecureTokenUrl(),
            config.getApiKey(),
            localStore,
            config.getTokenLeeway(),
            config.getHttpTimeout(),
            config.getClock()
        );
        return new RealtimeDatabaseStore(
            config.getHttpClient(),
            config.getDatabaseUrl(),
            identity,
            config.getHttpTimeout(),
            config.getWatchReconnectDelay(),
            loop
        );
    }

    /**
     * Restores the persisted pairing state. Idempotent; never blocks on the store.
     *
     * @throws IllegalStateException when the client has been closed
     */
    public void start() {
        synchronized (startLock) {
            ensureOpen();
            if (started) {
                return;
            }
            started = true;
            coordinator.start();
        }
    }

    public PairingRoleState state() {
        return coordinator.state();
    }

    public DeviceRole role() {
        return coordinator.role();
    }

    public Optional<String> effectiveSessionToken() {
        return coordinator.effectiveSessionToken();
    }

    /**
     * Becomes (or stays) the primary of a session this device owns.
     *
     * @return token to hand to secondary devices
     */
    public String startPrimarySession() throws PairingException {
        start();
        return coordinator.startPrimarySession();
    }

    public PairingSession joinSecondarySession(String token) throws PairingException {
        start();
        return coordinator.joinSecondarySession(token);
    }

    public void disconnect() {
        start();
        coordinator.disconnect();
    }

    public void endSession() throws PairingException {
        start();
        coordinator.endSession();
    }

    public Subscription addRoleListener(RoleTransitionListener listener) {
        return coordinator.addListener(listener);
    }

    public LiveValue<Optional<JsonNode>> localSessionData() {
        return streams.localSessionData();
    }

    public LiveValue<Optional<JsonNode>> remoteSessionData() {
        return streams.remoteSessionData();
    }

    public LiveValue<Optional<JsonNode>> effectiveSessionData() {
        return streams.effectiveSessionData();
    }

    public LiveValue<Optional<PairingSession>> primarySession() {
        return streams.primarySession();
    }

    public LiveValue<Optional<PairingSession>> secondarySession() {
        return streams.secondarySession();
    }

    public PairingSessionManager sessions() {
        return sessions;
    }

    public PairingConfig config() {
        return config;
    }

    /**
     * Cancels every store watch, timer and queued task. Work already running on the event loop stops at its next
     * liveness check.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        streams.close();
        sync.close();
        coordinator.close();
        if (store instanceof AutoCloseable) {
            try {
                ((AutoCloseable) store).close();
            } catch (Exception ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] failed to close remote store", ex);
            }
        }
        loop.close();
        LOGGER.info("[anchorwatch] pairing client closed");
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("pairing client is closed");
        }
    }
}
