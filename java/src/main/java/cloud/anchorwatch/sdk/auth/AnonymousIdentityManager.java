package cloud.anchorwatch.sdk.auth;

import cloud.anchorwatch.sdk.PairingException;
import cloud.anchorwatch.sdk.StoreException;
import cloud.anchorwatch.sdk.StoreUnavailableException;
import cloud.anchorwatch.sdk.internal.HttpUtil;
import cloud.anchorwatch.sdk.internal.Json;
import cloud.anchorwatch.sdk.internal.StoreErrorDecoder;
import cloud.anchorwatch.sdk.local.LocalStore;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * IdentityProvider performing anonymous sign-up and refresh-token exchange against an identity toolkit style
 * service.
 *
 * <p>The account id and refresh token are persisted in the {@link LocalStore}, so the identity survives restarts and
 * {@link #uid()} answers offline once the device has signed up. The short-lived id token is cached in memory and
 * refreshed when it comes within the configured leeway of its expiry.</p>
 */
public final class AnonymousIdentityManager implements IdentityProvider {

    private static final Logger LOGGER = Logger.getLogger(AnonymousIdentityManager.class.getName());
    private static final Duration DEFAULT_LEEWAY = Duration.ofSeconds(30);
    private static final long DEFAULT_EXPIRES_IN = 3600L;

    private final HttpClient httpClient;
    private final String identityUrl;
    private final String secureTokenUrl;
    private final String apiKey;
    private final LocalStore localStore;
    private final Duration leeway;
    private final Duration requestTimeout;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private volatile IdentityToken cached;

    public AnonymousIdentityManager(
        HttpClient httpClient,
        String identityUrl,
        String secureTokenUrl,
        String apiKey,
        LocalStore localStore,
        Duration leeway,
        Duration requestTimeout,
        Clock clock
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.identityUrl = Objects.requireNonNull(identityUrl, "identityUrl");
        this.secureTokenUrl = Objects.requireNonNull(secureTokenUrl, "secureTokenUrl");
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.localStore = Objects.requireNonNull(localStore, "localStore");
        this.leeway = leeway == null || leeway.isZero() || leeway.isNegative() ? DEFAULT_LEEWAY : leeway;
        this.requestTimeout = requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()
            ? Duration.ofSeconds(30) : requestTimeout;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public IdentityToken token() throws PairingException {
        IdentityToken current = cached;
        if (current != null && isFresh(current)) {
            return current;
        }

        lock.lock();
        try {
            current = cached;
            if (current != null && isFresh(current)) {
                return current;
            }
            IdentityToken fresh = obtain(current);
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String uid() throws PairingException {
        IdentityToken current = cached;
        if (current != null) {
            return current.getUid();
        }
        String persisted = localStore.getString(LocalStore.KEY_AUTH_UID);
        if (persisted != null && !persisted.isBlank()) {
            return persisted;
        }
        return token().getUid();
    }

    @Override
    public void invalidate() {
        cached = null;
    }

    @Override
    public IdentityToken forceRefresh() throws PairingException {
        lock.lock();
        try {
            IdentityToken fresh = obtain(cached);
            cached = fresh;
            return fresh;
        } finally {
            lock.unlock();
        }
    }

    private boolean isFresh(IdentityToken token) {
        Instant refreshAt = token.getExpiry().minus(leeway);
        return clock.instant().isBefore(refreshAt);
    }

    private IdentityToken obtain(IdentityToken previous) throws PairingException {
        String refreshToken = previous != null ? previous.getRefreshToken() : null;
        if (refreshToken == null || refreshToken.isBlank()) {
            refreshToken = localStore.getString(LocalStore.KEY_AUTH_REFRESH_TOKEN);
        }

        IdentityToken fresh;
        if (refreshToken == null || refreshToken.isBlank()) {
            fresh = signUp();
        } else {
            try {
                fresh = refresh(refreshToken);
            } catch (StoreUnavailableException ex) {
                throw ex;
            } catch (StoreException ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] refresh token rejected; signing up a new anonymous account", ex);
                fresh = signUp();
            }
        }
        persist(fresh);
        return fresh;
    }

    private IdentityToken signUp() throws PairingException {
        LOGGER.info(() -> "[anchorwatch] signing up anonymous account");
        URI uri = URI.create(identityUrl + "/v1/accounts:signUp?key=" + HttpUtil.queryParam(apiKey));
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .POST(HttpRequest.BodyPublishers.ofString("{\"returnSecureToken\":true}"))
            .header("Content-Type", "application/json")
            .timeout(requestTimeout)
            .build();

        JsonNode node = send(request, "sign up");
        String idToken = node.path("idToken").asText();
        String uid = node.path("localId").asText();
        if (idToken.isBlank() || uid.isBlank()) {
            throw new PairingException("sign up response missing idToken or localId");
        }
        long expiresIn = positiveOrDefault(node.path("expiresIn").asLong(DEFAULT_EXPIRES_IN));
        IdentityToken token = new IdentityToken(idToken, emptyToNull(node.path("refreshToken").asText()), uid,
            clock.instant().plusSeconds(expiresIn));
        LOGGER.info(() -> String.format(Locale.ROOT, "[anchorwatch] anonymous account %s signed up", uid));
        return token;
    }

    private IdentityToken refresh(String refreshToken) throws PairingException {
        LOGGER.fine(() -> "[anchorwatch] refreshing identity token");
        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "refresh_token");
        form.put("refresh_token", refreshToken);
        URI uri = URI.create(secureTokenUrl + "/v1/token?key=" + HttpUtil.queryParam(apiKey));
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .POST(HttpRequest.BodyPublishers.ofString(HttpUtil.formEncode(form)))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .timeout(requestTimeout)
            .build();

        JsonNode node = send(request, "refresh token");
        String idToken = node.path("id_token").asText();
        String uid = node.path("user_id").asText();
        if (idToken.isBlank() || uid.isBlank()) {
            throw new PairingException("refresh response missing id_token or user_id");
        }
        long expiresIn = positiveOrDefault(node.path("expires_in").asLong(DEFAULT_EXPIRES_IN));
        String rotated = emptyToNull(node.path("refresh_token").asText());
        return new IdentityToken(idToken, rotated == null ? refreshToken : rotated, uid,
            clock.instant().plusSeconds(expiresIn));
    }

    private JsonNode send(HttpRequest request, String operation) throws PairingException {
        HttpResponse<byte[]> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new StoreUnavailableException(operation + " interrupted", ex);
        } catch (IOException ex) {
            throw new StoreUnavailableException(operation + ": " + HttpUtil.describe(ex), ex);
        }

        if (response.statusCode() >= 400) {
            throw StoreErrorDecoder.decode(response.statusCode(), response.body());
        }
        try {
            return Json.mapper().readTree(response.body());
        } catch (IOException ex) {
            throw new PairingException("decode " + operation + " response: " + HttpUtil.describe(ex), ex);
        }
    }

    private void persist(IdentityToken token) {
        try {
            localStore.setString(LocalStore.KEY_AUTH_UID, token.getUid());
            localStore.setString(LocalStore.KEY_AUTH_REFRESH_TOKEN, token.getRefreshToken());
        } catch (IOException ex) {
            LOGGER.log(Level.WARNING, "[anchorwatch] could not persist identity; it will be re-created after restart", ex);
        }
    }

    private static long positiveOrDefault(long value) {
        return value <= 0 ? DEFAULT_EXPIRES_IN : value;
    }

    private static String emptyToNull(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value;
    }
}
