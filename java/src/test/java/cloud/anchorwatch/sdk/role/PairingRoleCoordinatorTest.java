package cloud.anchorwatch.sdk.role;

import cloud.anchorwatch.sdk.InvalidTokenException;
import cloud.anchorwatch.sdk.NotPrimaryException;
import cloud.anchorwatch.sdk.PairingException;
import cloud.anchorwatch.sdk.QuotaExceededException;
import cloud.anchorwatch.sdk.internal.EventLoop;
import cloud.anchorwatch.sdk.local.InMemoryLocalStore;
import cloud.anchorwatch.sdk.local.LocalStore;
import cloud.anchorwatch.sdk.session.DeviceRole;
import cloud.anchorwatch.sdk.session.PairingSession;
import cloud.anchorwatch.sdk.session.PairingSessionManager;
import cloud.anchorwatch.sdk.store.MemoryDatabase;
import cloud.anchorwatch.sdk.store.MemoryRemoteStore;
import cloud.anchorwatch.sdk.support.Await;
import cloud.anchorwatch.sdk.support.FailingLocalStore;
import cloud.anchorwatch.sdk.support.FaultyStore;
import cloud.anchorwatch.sdk.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PairingRoleCoordinatorTest {

    private final MemoryDatabase database = new MemoryDatabase();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private EventLoop loop;
    private Device boat;
    private Device phone;

    @BeforeEach
    void setUp() {
        loop = new EventLoop("role-coordinator-test");
        boat = new Device("boat-1", new InMemoryLocalStore());
        phone = new Device("phone-1", new InMemoryLocalStore());
    }

    @AfterEach
    void tearDown() {
        loop.close();
    }

    @Test
    void freshInstallRestoresUnpairedPrimary() {
        boat.coordinator.start();

        assertTrue(boat.coordinator.state().isUnpaired());
        assertEquals(DeviceRole.PRIMARY, boat.coordinator.role());
        Await.until("restored transition", () -> boat.causes().equals(List.of(RoleTransition.Cause.RESTORED)));
    }

    @Test
    void startingPrimaryCreatesAndPersistsSession() throws Exception {
        boat.coordinator.start();

        String token = boat.coordinator.startPrimarySession();

        PairingRoleState state = boat.coordinator.state();
        assertTrue(state.isActivePrimary());
        assertEquals(token, state.localSessionToken());
        assertNull(state.remoteSessionToken());
        assertEquals("boat-1", state.ownerIdentity());
        assertEquals(token, boat.localStore.getString(LocalStore.KEY_SESSION_TOKEN));
        assertEquals("primary", boat.localStore.getString(LocalStore.KEY_ROLE));
        Await.until("started transition", () -> boat.causes().contains(RoleTransition.Cause.STARTED_PRIMARY));
    }

    @Test
    void startingPrimaryAgainReusesUsableSession() throws Exception {
        String first = boat.coordinator.startPrimarySession();
        String second = boat.coordinator.startPrimarySession();

        assertEquals(first, second);
        assertEquals(1, database.snapshot("sessions").size());
    }

    @Test
    void startingPrimaryReplacesExpiredSession() throws Exception {
        String first = boat.coordinator.startPrimarySession();
        clock.advance(Duration.ofHours(25));

        String second = boat.coordinator.startPrimarySession();

        assertNotEquals(first, second);
        assertEquals(second, boat.coordinator.state().localSessionToken());
        Await.until("expired record removal", () -> database.snapshot("sessions/" + first) == null);
    }

    @Test
    void startingPrimaryReplacesEndedSession() throws Exception {
        String first = boat.coordinator.startPrimarySession();
        boat.view.update("sessions/" + first, Map.of("isActive", false));
        clock.advance(Duration.ofSeconds(10));

        String second = boat.coordinator.startPrimarySession();

        assertNotEquals(first, second);
        assertNull(database.snapshot("sessions/" + first));
    }

    @Test
    void startingPrimaryOfflineKeepsLocalSession() throws Exception {
        String first = boat.coordinator.startPrimarySession();
        boat.view.setOnline(false);

        assertEquals(first, boat.coordinator.startPrimarySession());
    }

    @Test
    void joiningMakesDeviceActiveSecondary() throws Exception {
        String token = boat.coordinator.startPrimarySession();

        PairingSession session = phone.coordinator.joinSecondarySession(token);

        PairingRoleState state = phone.coordinator.state();
        assertTrue(state.isActiveSecondary());
        assertEquals(token, state.remoteSessionToken());
        assertNull(state.localSessionToken());
        assertEquals("boat-1", state.ownerIdentity());
        assertEquals(2, session.devices().size());
        assertEquals("secondary", phone.localStore.getString(LocalStore.KEY_ROLE));
        Await.until("joined transition", () -> phone.causes().contains(RoleTransition.Cause.JOINED_SECONDARY));
    }

    @Test
    void failedJoinLeavesStateUntouched() {
        assertThrows(InvalidTokenException.class, () -> phone.coordinator.joinSecondarySession("bogus"));

        assertTrue(phone.coordinator.state().isUnpaired());
        assertNull(phone.localStore.getString(LocalStore.KEY_SESSION_TOKEN));
    }

    @Test
    void joinIsUndoneWhenStateCannotBePersisted() throws Exception {
        String token = boat.coordinator.startPrimarySession();
        FailingLocalStore failing = new FailingLocalStore();
        failing.failWrites(true);
        Device flaky = new Device("tablet-1", failing);

        assertThrows(PairingException.class, () -> flaky.coordinator.joinSecondarySession(token));

        assertTrue(flaky.coordinator.state().isUnpaired());
        assertFalse(database.snapshot("sessions/" + token + "/devices").has("tablet-1"));
    }

    @Test
    void startingPrimaryFromSecondaryLeavesJoinedSession() throws Exception {
        String boatToken = boat.coordinator.startPrimarySession();
        phone.coordinator.joinSecondarySession(boatToken);

        String phoneToken = phone.coordinator.startPrimarySession();

        assertNotEquals(boatToken, phoneToken);
        assertTrue(phone.coordinator.state().isActivePrimary());
        assertFalse(database.snapshot("sessions/" + boatToken + "/devices").has("phone-1"));
        assertEquals("primary", phone.localStore.getString(LocalStore.KEY_ROLE));
    }

    @Test
    void secondaryStaysInJoinedSessionWhenNewSessionCannotBeCreated() throws Exception {
        String boatToken = boat.coordinator.startPrimarySession();
        phone.coordinator.joinSecondarySession(boatToken);
        phone.faults.failOn("set sessions/", new QuotaExceededException(429, null, "quota exceeded"));

        assertThrows(QuotaExceededException.class, phone.coordinator::startPrimarySession);

        assertTrue(phone.coordinator.state().isActiveSecondary());
        assertEquals(boatToken, phone.coordinator.state().remoteSessionToken());
        assertTrue(database.snapshot("sessions/" + boatToken + "/devices").has("phone-1"));
        assertEquals("secondary", phone.localStore.getString(LocalStore.KEY_ROLE));
    }

    @Test
    void disconnectResetsSecondary() throws Exception {
        String token = boat.coordinator.startPrimarySession();
        phone.coordinator.joinSecondarySession(token);

        phone.coordinator.disconnect();

        assertTrue(phone.coordinator.state().isUnpaired());
        assertNull(phone.localStore.getString(LocalStore.KEY_SESSION_TOKEN));
        assertNull(phone.localStore.getString(LocalStore.KEY_ROLE));
        assertFalse(database.snapshot("sessions/" + token + "/devices").has("phone-1"));
        assertTrue(database.snapshot("sessions/" + token + "/isActive").booleanValue());
        Await.until("disconnected transition", () -> phone.causes().contains(RoleTransition.Cause.DISCONNECTED));
    }

    @Test
    void disconnectOnPrimaryIsNoOp() throws Exception {
        String token = boat.coordinator.startPrimarySession();

        boat.coordinator.disconnect();

        assertEquals(token, boat.coordinator.state().localSessionToken());
        assertEquals(token, boat.localStore.getString(LocalStore.KEY_SESSION_TOKEN));
    }

    @Test
    void onlyActivePrimaryCanEndSession() throws Exception {
        assertThrows(NotPrimaryException.class, () -> boat.coordinator.endSession());

        String token = boat.coordinator.startPrimarySession();
        phone.coordinator.joinSecondarySession(token);
        assertThrows(NotPrimaryException.class, () -> phone.coordinator.endSession());
        assertTrue(phone.coordinator.state().isActiveSecondary());
    }

    @Test
    void endSessionMarksInactiveAndResets() throws Exception {
        String token = boat.coordinator.startPrimarySession();

        boat.coordinator.endSession();

        assertFalse(database.snapshot("sessions/" + token + "/isActive").booleanValue());
        assertNull(database.snapshot("deviceSessions/boat-1"));
        assertTrue(boat.coordinator.state().isUnpaired());
        assertNull(boat.localStore.getString(LocalStore.KEY_SESSION_TOKEN));
        Await.until("ended transition", () -> boat.causes().contains(RoleTransition.Cause.ENDED));
    }

    @Test
    void restartRestoresPersistedRole() throws Exception {
        String token = boat.coordinator.startPrimarySession();
        phone.coordinator.joinSecondarySession(token);

        Device restartedBoat = new Device("boat-1", boat.localStore);
        Device restartedPhone = new Device("phone-1", phone.localStore);
        restartedBoat.coordinator.start();
        restartedPhone.coordinator.start();

        assertEquals(PairingRoleState.activePrimary(token, null), restartedBoat.coordinator.state());
        assertEquals(PairingRoleState.activeSecondary(token, null), restartedPhone.coordinator.state());
        Await.drain(loop);
        assertTrue(restartedBoat.coordinator.state().isActivePrimary());
        assertTrue(restartedPhone.coordinator.state().isActiveSecondary());
    }

    @Test
    void restoredExpiredSessionIsDroppedAtStartup() throws Exception {
        String token = boat.coordinator.startPrimarySession();
        clock.advance(Duration.ofHours(25));

        Device restarted = new Device("boat-1", boat.localStore);
        restarted.coordinator.start();

        Await.until("session lost", () -> restarted.causes().contains(RoleTransition.Cause.SESSION_LOST));
        assertTrue(restarted.coordinator.state().isUnpaired());
        assertNull(boat.localStore.getString(LocalStore.KEY_SESSION_TOKEN));
        Await.until("expired record removal", () -> database.snapshot("sessions/" + token) == null);
        assertNull(database.snapshot("deviceSessions/boat-1"));
    }

    @Test
    void restoredSecondaryWithoutSessionIsReset() throws Exception {
        InMemoryLocalStore stored = new InMemoryLocalStore();
        stored.setString(LocalStore.KEY_SESSION_TOKEN, "QQQQQQQQQQQQQQQQQQQQQQQQQQQQQQQQ");
        stored.setString(LocalStore.KEY_ROLE, "secondary");
        Device restarted = new Device("phone-1", stored);

        restarted.coordinator.start();

        Await.until("session lost", () -> restarted.coordinator.state().isUnpaired());
        assertNull(stored.getString(LocalStore.KEY_ROLE));
    }

    @Test
    void restoredPrimaryWithoutRecordKeepsLocalSession() throws Exception {
        InMemoryLocalStore stored = new InMemoryLocalStore();
        stored.setString(LocalStore.KEY_SESSION_TOKEN, "QQQQQQQQQQQQQQQQQQQQQQQQQQQQQQQQ");
        stored.setString(LocalStore.KEY_ROLE, "primary");
        Device restarted = new Device("boat-1", stored);

        restarted.coordinator.start();
        Await.drain(loop);

        assertEquals("QQQQQQQQQQQQQQQQQQQQQQQQQQQQQQQQ", restarted.coordinator.state().localSessionToken());
    }

    @Test
    void sessionLossForAnotherTokenIsIgnored() throws Exception {
        String token = boat.coordinator.startPrimarySession();

        assertFalse(boat.coordinator.handleSessionLost("QQQQQQQQQQQQQQQQQQQQQQQQQQQQQQQQ", "expired"));
        assertEquals(token, boat.coordinator.state().localSessionToken());

        assertTrue(boat.coordinator.handleSessionLost(token, "expired"));
        assertTrue(boat.coordinator.state().isUnpaired());
        assertNull(database.snapshot("deviceSessions/boat-1"));
    }

    @Test
    void listenersRunOnLoopInOrder() throws Exception {
        List<Boolean> onLoop = new CopyOnWriteArrayList<>();
        boat.coordinator.addListener(transition -> onLoop.add(loop.inLoop()));
        boat.coordinator.start();
        String token = boat.coordinator.startPrimarySession();
        boat.coordinator.endSession();

        Await.until("three transitions", () -> boat.transitions.size() == 3);
        assertEquals(List.of(RoleTransition.Cause.RESTORED, RoleTransition.Cause.STARTED_PRIMARY,
            RoleTransition.Cause.ENDED), boat.causes());
        assertEquals(token, boat.transitions.get(1).current().localSessionToken());
        assertTrue(boat.transitions.get(2).tokenChanged());
        assertEquals(List.of(true, true, true), onLoop);
    }

    private final class Device {
        private final LocalStore localStore;
        private final MemoryRemoteStore view;
        private final FaultyStore faults;
        private final PairingRoleCoordinator coordinator;
        private final List<RoleTransition> transitions = new CopyOnWriteArrayList<>();

        private Device(String uid, LocalStore localStore) {
            this.localStore = localStore;
            this.view = database.connect(uid, loop);
            this.faults = new FaultyStore(view);
            PairingSessionManager sessions = new PairingSessionManager(faults, loop, clock, Duration.ofSeconds(5),
                Duration.ofHours(24), Duration.ofHours(24));
            this.coordinator = new PairingRoleCoordinator(sessions, localStore, loop, clock);
            coordinator.addListener(transitions::add);
        }

        private List<RoleTransition.Cause> causes() {
            return transitions.stream().map(RoleTransition::cause).collect(Collectors.toList());
        }
    }
}
