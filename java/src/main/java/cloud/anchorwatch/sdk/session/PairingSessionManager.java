package cloud.anchorwatch.sdk.session;

import cloud.anchorwatch.sdk.CorruptedSessionException;
import cloud.anchorwatch.sdk.InvalidTokenException;
import cloud.anchorwatch.sdk.PairingException;
import cloud.anchorwatch.sdk.QuotaExceededException;
import cloud.anchorwatch.sdk.RateLimitedException;
import cloud.anchorwatch.sdk.SessionExpiredException;
import cloud.anchorwatch.sdk.SessionInactiveException;
import cloud.anchorwatch.sdk.SessionNotFoundException;
import cloud.anchorwatch.sdk.internal.EventLoop;
import cloud.anchorwatch.sdk.store.RemoteStore;
import cloud.anchorwatch.sdk.store.StorePaths;
import com.fasterxml.jackson.databind.JsonNode;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Create, join and end operations on the shared session record.
 *
 * <p>Creation is guarded twice against duplicates: a cooldown rejects repeated calls in quick succession, and the
 * reverse index {@code deviceSessions/{identity}} lets a device adopt the session it already owns instead of
 * writing a second one. When the store cannot be written for reasons other than quota exhaustion the new session
 * is kept in memory only and published later through {@link #ensureRemoteSession(String)}.</p>
 */
public final class PairingSessionManager {

    private static final Logger LOGGER = Logger.getLogger(PairingSessionManager.class.getName());

    private final RemoteStore store;
    private final EventLoop loop;
    private final Clock clock;
    private final Duration creationCooldown;
    private final Duration sessionTtl;
    private final Duration staleRetention;
    private final SecureRandom random = new SecureRandom();

    private final ReentrantLock lock = new ReentrantLock();
    private volatile PairingSession current;
    private volatile boolean published;
    private Instant lastCreation;

    public PairingSessionManager(
        RemoteStore store,
        EventLoop loop,
        Clock clock,
        Duration creationCooldown,
        Duration sessionTtl,
        Duration staleRetention
    ) {
        this.store = Objects.requireNonNull(store, "store");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.creationCooldown = Objects.requireNonNull(creationCooldown, "creationCooldown");
        this.sessionTtl = Objects.requireNonNull(sessionTtl, "sessionTtl");
        this.staleRetention = Objects.requireNonNull(staleRetention, "staleRetention");
    }

    /**
     * Creates a session owned by this device, or adopts the one it already owns.
     *
     * @return the token of the created or adopted session
     * @throws RateLimitedException  when called within the creation cooldown of the previous successful call
     * @throws QuotaExceededException when the store refuses the write for lack of resources
     */
    public String createSession() throws PairingException {
        lock.lock();
        try {
            Instant now = now();
            if (lastCreation != null) {
                Instant allowedAt = lastCreation.plus(creationCooldown);
                if (now.isBefore(allowedAt)) {
                    LOGGER.warning("[anchorwatch] blocking duplicate session creation inside the cooldown");
                    throw new RateLimitedException("session creation blocked: too frequent attempts",
                        Duration.between(now, allowedAt));
                }
            }

            String identity = store.identity();
            Optional<PairingSession> existing = adoptableSession(identity, now);
            if (existing.isPresent()) {
                PairingSession adopted = existing.get();
                current = adopted;
                published = true;
                lastCreation = now();
                LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] adopted existing session %s", adopted.token()));
                return adopted.token();
            }

            deleteStaleSessions();

            PairingSession session = PairingSession.create(SessionTokens.generate(random), identity, now, sessionTtl);
            boolean written = false;
            try {
                store.set(StorePaths.session(session.token()), SessionCodec.encode(session));
                store.set(StorePaths.deviceSession(identity), session.token());
                written = true;
                LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] session %s created", session.token()));
            } catch (QuotaExceededException ex) {
                LOGGER.warning("[anchorwatch] store quota exceeded; session not created");
                throw ex;
            } catch (PairingException ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] session " + session.token()
                    + " could not be written; operating in local-only mode", ex);
            }
            current = session;
            published = written;
            lastCreation = now();
            return session.token();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Joins an existing session as a secondary device.
     *
     * @return the session as stored after the device entry was written
     */
    public PairingSession joinSession(String token) throws PairingException {
        if (!SessionTokens.isValid(token)) {
            throw new InvalidTokenException("invalid session token format");
        }
        String identity = store.identity();
        String path = StorePaths.session(token);
        if (!store.probe(path)) {
            throw new SessionNotFoundException("session " + token + " not found");
        }
        PairingSession session;
        try {
            session = decodeStored(token, store.get(path));
        } catch (CorruptedSessionException ex) {
            deleteInBackground(token, "corrupted");
            throw ex;
        }
        Instant now = now();
        if (session.isExpired(now)) {
            deleteInBackground(token, "expired");
            throw new SessionExpiredException("session " + token + " has expired");
        }
        if (!session.isActive()) {
            throw new SessionInactiveException("session " + token + " is not active");
        }
        if (session.isOwnedBy(identity)) {
            throw new PairingException("session " + token + " is owned by this device and cannot be joined");
        }

        store.set(StorePaths.device(token, identity), SessionCodec.encodeDevice(DeviceInfo.secondary(identity, now)));
        PairingSession joined = decodeStored(token, store.get(path));
        current = joined;
        published = true;
        LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] joined session %s as %s", token, identity));
        return joined;
    }

    /**
     * Ends the in-memory session, if any.
     */
    public void endSession() {
        PairingSession session = current;
        if (session == null) {
            return;
        }
        endSession(session.token());
    }

    /**
     * Marks {@code token} inactive and removes the reverse index entry. Store failures are logged; the in-memory
     * state is cleared in every case.
     */
    public void endSession(String token) {
        Objects.requireNonNull(token, "token");
        String path = StorePaths.session(token);
        try {
            if (store.probe(path)) {
                store.update(path, Map.of(StorePaths.FIELD_IS_ACTIVE, false));
            }
            LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] session %s ended", token));
        } catch (PairingException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] failed to end session " + token + " remotely; clearing local state", ex);
        }
        removeReverseIndex(token);
        forget(token);
    }

    /**
     * Reads and validates a session.
     *
     * <p>Expired and corrupted records are scheduled for deletion in the background before the matching exception
     * is raised. Inactive sessions are returned as they are.</p>
     */
    public PairingSession fetchSession(String token) throws PairingException {
        if (!SessionTokens.isValid(token)) {
            throw new InvalidTokenException("invalid session token format");
        }
        JsonNode node = store.get(StorePaths.session(token));
        if (node == null) {
            throw new SessionNotFoundException("session " + token + " not found");
        }
        PairingSession session;
        try {
            session = SessionCodec.decode(token, node);
        } catch (CorruptedSessionException ex) {
            deleteInBackground(token, "corrupted");
            throw ex;
        }
        if (session.isExpired(now())) {
            deleteInBackground(token, "expired");
            throw new SessionExpiredException("session " + token + " has expired");
        }
        return session;
    }

    /**
     * Removes this device's entry from a joined session. Best effort.
     */
    public void leaveSession(String token) {
        Objects.requireNonNull(token, "token");
        try {
            String identity = store.identity();
            store.delete(StorePaths.device(token, identity));
            LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] left session %s", token));
        } catch (PairingException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] could not remove device from session " + token, ex);
        }
        forget(token);
    }

    public void deleteSession(String token) throws PairingException {
        store.delete(StorePaths.session(token));
        LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] deleted session %s", token));
    }

    /**
     * Makes sure the record for a session owned by this device exists in the store, writing it when it was created
     * offline or went missing while the device was not running.
     *
     * @return the stored session
     * @throws CorruptedSessionException when the stored record cannot be decoded
     */
    public PairingSession ensureRemoteSession(String token) throws PairingException {
        PairingSession session = current;
        if (session != null && session.token().equals(token) && published) {
            return session;
        }
        String path = StorePaths.session(token);
        JsonNode node = store.get(path);
        if (node != null) {
            PairingSession stored = SessionCodec.decode(token, node);
            current = stored;
            published = true;
            return stored;
        }

        String identity = store.identity();
        PairingSession record = session != null && session.token().equals(token)
            ? session
            : PairingSession.create(token, identity, now(), sessionTtl);
        store.set(path, SessionCodec.encode(record));
        store.set(StorePaths.deviceSession(identity), token);
        current = record;
        published = true;
        LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] published session %s", token));
        return record;
    }

    /**
     * Best-effort garbage collection: deletes sessions past their expiry, and inactive sessions created longer ago
     * than the retention window. Records that cannot be read are skipped.
     *
     * @return number of sessions deleted
     */
    public int deleteStaleSessions() {
        JsonNode sessions;
        try {
            sessions = store.get(StorePaths.SESSIONS);
        } catch (PairingException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] could not list sessions for cleanup", ex);
            return 0;
        }
        if (sessions == null || !sessions.isObject()) {
            return 0;
        }

        long now = now().toEpochMilli();
        long retentionCutoff = now - staleRetention.toMillis();
        List<String> stale = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> entries = sessions.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            JsonNode record = entry.getValue();
            JsonNode expiresAt = record.path(SessionCodec.FIELD_EXPIRES_AT);
            if (!expiresAt.isNumber()) {
                continue;
            }
            boolean expired = expiresAt.asLong() <= now;
            JsonNode createdAt = record.path(SessionCodec.FIELD_CREATED_AT);
            boolean inactive = record.path(SessionCodec.FIELD_IS_ACTIVE).isBoolean()
                && !record.path(SessionCodec.FIELD_IS_ACTIVE).booleanValue();
            boolean retired = inactive && createdAt.isNumber() && createdAt.asLong() < retentionCutoff;
            if (expired || retired) {
                stale.add(entry.getKey());
            }
        }

        int deleted = 0;
        for (String token : stale) {
            try {
                store.delete(StorePaths.session(token));
                deleted++;
            } catch (PairingException | IllegalArgumentException ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] could not delete stale session " + token, ex);
            }
        }
        int removed = deleted;
        LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] cleanup removed %d stale sessions", removed));
        return removed;
    }

    public Optional<PairingSession> currentSession() {
        return Optional.ofNullable(current);
    }

    /**
     * @return {@code true} when the in-memory session has been written to the store.
     */
    public boolean isPublished() {
        return current != null && published;
    }

    /**
     * Drops the in-memory session when it matches {@code token}.
     */
    public void forget(String token) {
        PairingSession session = current;
        if (session != null && session.token().equals(token)) {
            current = null;
            published = false;
        }
    }

    /**
     * Removes {@code deviceSessions/{identity}} when it still points at {@code token}. Best effort.
     */
    public void removeReverseIndex(String token) {
        try {
            String identity = store.identity();
            String path = StorePaths.deviceSession(identity);
            JsonNode indexed = store.get(path);
            if (indexed != null && token.equals(indexed.asText())) {
                store.delete(path);
            }
        } catch (PairingException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] could not remove reverse index for session " + token, ex);
        }
    }

    private Optional<PairingSession> adoptableSession(String identity, Instant now) {
        String indexPath = StorePaths.deviceSession(identity);
        String token;
        try {
            JsonNode indexed = store.get(indexPath);
            token = indexed == null || !indexed.isTextual() ? null : indexed.asText();
        } catch (PairingException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] reverse index lookup failed; assuming no existing session", ex);
            return Optional.empty();
        }
        if (token == null || !SessionTokens.isValid(token)) {
            return Optional.empty();
        }

        PairingSession session = null;
        try {
            JsonNode node = store.get(StorePaths.session(token));
            session = node == null ? null : SessionCodec.decode(token, node);
        } catch (CorruptedSessionException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] indexed session " + token + " is corrupted", ex);
        } catch (PairingException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] could not read indexed session " + token, ex);
            return Optional.empty();
        }

        if (session != null && session.isOwnedBy(identity) && session.isUsable(now)) {
            return Optional.of(session);
        }

        PairingSession stale = session;
        LOGGER.warning(() -> String.format(Locale.ROOT,
            "[anchorwatch] cleaning up stale session reference %s (active: %s, expired: %s)", token,
            stale == null ? "n/a" : stale.isActive(), stale == null ? "n/a" : stale.isExpired(now)));
        try {
            if (stale == null || stale.isOwnedBy(identity)) {
                store.delete(StorePaths.session(token));
            }
            store.delete(indexPath);
        } catch (PairingException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] could not clean up stale session " + token, ex);
        }
        return Optional.empty();
    }

    private PairingSession decodeStored(String token, JsonNode node) throws PairingException {
        if (node == null) {
            throw new SessionNotFoundException("session " + token + " not found");
        }
        return SessionCodec.decode(token, node);
    }

    private void deleteInBackground(String token, String reason) {
        loop.execute(() -> {
            if (loop.isClosed()) {
                return;
            }
            try {
                deleteSession(token);
                LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] removed %s session %s", reason, token));
            } catch (PairingException ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] could not remove " + reason + " session " + token, ex);
            }
        });
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
