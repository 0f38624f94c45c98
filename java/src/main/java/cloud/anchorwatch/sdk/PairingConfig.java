package cloud.anchorwatch.sdk;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Immutable configuration container used to bootstrap {@link PairingClient} instances.
 *
 * <p>{@code databaseUrl} and {@code apiKey} are only required when the client talks to the realtime database
 * itself; clients built on a supplied store may leave them unset.</p>
 */
public final class PairingConfig {

    public static final String DEFAULT_IDENTITY_URL = "https://identitytoolkit.googleapis.com";
    public static final String DEFAULT_SECURE_TOKEN_URL = "https://securetoken.googleapis.com";
    public static final Duration DEFAULT_HTTP_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_TOKEN_LEEWAY = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CREATION_COOLDOWN = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SESSION_TTL = Duration.ofHours(24);
    public static final Duration DEFAULT_STALE_SESSION_RETENTION = Duration.ofHours(24);
    public static final Duration DEFAULT_POSITION_PUBLISH_INTERVAL = Duration.ofSeconds(5);
    public static final Duration DEFAULT_WATCH_RECONNECT_DELAY = Duration.ofSeconds(2);

    private final String databaseUrl;
    private final String apiKey;
    private final String identityUrl;
    private final String secureTokenUrl;
    private final HttpClient httpClient;
    private final Duration httpTimeout;
    private final Duration tokenLeeway;
    private final Duration creationCooldown;
    private final Duration sessionTtl;
    private final Duration staleSessionRetention;
    private final Duration positionPublishInterval;
    private final Duration watchReconnectDelay;
    private final Clock clock;

    private PairingConfig(Builder builder) {
        this.databaseUrl = builder.databaseUrl;
        this.apiKey = builder.apiKey;
        this.identityUrl = builder.identityUrl;
        this.secureTokenUrl = builder.secureTokenUrl;
        this.httpClient = builder.httpClient;
        this.httpTimeout = builder.httpTimeout;
        this.tokenLeeway = builder.tokenLeeway;
        this.creationCooldown = builder.creationCooldown;
        this.sessionTtl = builder.sessionTtl;
        this.staleSessionRetention = builder.staleSessionRetention;
        this.positionPublishInterval = builder.positionPublishInterval;
        this.watchReconnectDelay = builder.watchReconnectDelay;
        this.clock = builder.clock;
    }

    public static Builder builder() {
        return new Builder();
    }

    public PairingConfig withDefaults() {
        String resolvedDatabaseUrl = databaseUrl == null || databaseUrl.isBlank() ? null : sanitizeUrl(databaseUrl);
        String resolvedApiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
        String resolvedIdentityUrl = sanitizeUrl(Optional.ofNullable(identityUrl).orElse(DEFAULT_IDENTITY_URL));
        String resolvedSecureTokenUrl = sanitizeUrl(Optional.ofNullable(secureTokenUrl).orElse(DEFAULT_SECURE_TOKEN_URL));

        Duration resolvedTimeout = positive(httpTimeout, DEFAULT_HTTP_TIMEOUT);
        Duration resolvedLeeway = positive(tokenLeeway, DEFAULT_TOKEN_LEEWAY);
        Duration resolvedTtl = positive(sessionTtl, DEFAULT_SESSION_TTL);
        Duration resolvedRetention = positive(staleSessionRetention, DEFAULT_STALE_SESSION_RETENTION);
        Duration resolvedReconnect = positive(watchReconnectDelay, DEFAULT_WATCH_RECONNECT_DELAY);

        Duration resolvedCooldown = Optional.ofNullable(creationCooldown).orElse(DEFAULT_CREATION_COOLDOWN);
        if (resolvedCooldown.isNegative()) {
            throw new IllegalArgumentException("CreationCooldown cannot be negative");
        }
        Duration resolvedPublishInterval = Optional.ofNullable(positionPublishInterval)
            .orElse(DEFAULT_POSITION_PUBLISH_INTERVAL);
        if (resolvedPublishInterval.isNegative()) {
            throw new IllegalArgumentException("PositionPublishInterval cannot be negative");
        }

        HttpClient resolvedClient = httpClient;
        if (resolvedClient == null) {
            resolvedClient = HttpClient.newBuilder()
                .connectTimeout(resolvedTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        }

        return new Builder()
            .databaseUrl(resolvedDatabaseUrl)
            .apiKey(resolvedApiKey)
            .identityUrl(resolvedIdentityUrl)
            .secureTokenUrl(resolvedSecureTokenUrl)
            .httpClient(resolvedClient)
            .httpTimeout(resolvedTimeout)
            .tokenLeeway(resolvedLeeway)
            .creationCooldown(resolvedCooldown)
            .sessionTtl(resolvedTtl)
            .staleSessionRetention(resolvedRetention)
            .positionPublishInterval(resolvedPublishInterval)
            .watchReconnectDelay(resolvedReconnect)
            .clock(Optional.ofNullable(clock).orElse(Clock.systemUTC()))
            .buildInternal();
    }

    private static Duration positive(Duration value, Duration fallback) {
        Duration resolved = Optional.ofNullable(value).orElse(fallback);
        if (resolved.isNegative() || resolved.isZero()) {
            return fallback;
        }
        return resolved;
    }

    private static String sanitizeUrl(String url) {
        String trimmed = Optional.ofNullable(url).map(String::trim).orElse("");
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("URL must be non-empty");
        }
        try {
            URI uri = new URI(trimmed);
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new IllegalArgumentException("URL must include scheme and host");
            }
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("Invalid URL: " + trimmed, ex);
        }
        if (trimmed.endsWith("/")) {
            return trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * @return realtime database root, e.g. {@code https://project-default-rtdb.firebaseio.com}; {@code null} when
     * the client uses a supplied store.
     */
    public String getDatabaseUrl() {
        return databaseUrl;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getIdentityUrl() {
        return identityUrl;
    }

    public String getSecureTokenUrl() {
        return secureTokenUrl;
    }

    public HttpClient getHttpClient() {
        return httpClient;
    }

    public Duration getHttpTimeout() {
        return httpTimeout;
    }

    public Duration getTokenLeeway() {
        return tokenLeeway;
    }

    public Duration getCreationCooldown() {
        return creationCooldown;
    }

    public Duration getSessionTtl() {
        return sessionTtl;
    }

    public Duration getStaleSessionRetention() {
        return staleSessionRetention;
    }

    /**
     * @return minimum spacing between position writes; zero publishes every change immediately.
     */
    public Duration getPositionPublishInterval() {
        return positionPublishInterval;
    }

    public Duration getWatchReconnectDelay() {
        return watchReconnectDelay;
    }

    public Clock getClock() {
        return clock;
    }

    public static final class Builder {
        private String databaseUrl;
        private String apiKey;
        private String identityUrl;
        private String secureTokenUrl;
        private HttpClient httpClient;
        private Duration httpTimeout;
        private Duration tokenLeeway;
        private Duration creationCooldown;
        private Duration sessionTtl;
        private Duration staleSessionRetention;
        private Duration positionPublishInterval;
        private Duration watchReconnectDelay;
        private Clock clock;

        public Builder databaseUrl(String databaseUrl) {
            this.databaseUrl = databaseUrl;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder identityUrl(String identityUrl) {
            this.identityUrl = identityUrl;
            return this;
        }

        public Builder secureTokenUrl(String secureTokenUrl) {
            this.secureTokenUrl = secureTokenUrl;
            return this;
        }

        public Builder httpClient(HttpClient httpClient) {
            this.httpClient = httpClient;
            return this;
        }

        public Builder httpTimeout(Duration httpTimeout) {
            this.httpTimeout = httpTimeout;
            return this;
        }

        public Builder tokenLeeway(Duration tokenLeeway) {
            this.tokenLeeway = tokenLeeway;
            return this;
        }

        public Builder creationCooldown(Duration creationCooldown) {
            this.creationCooldown = creationCooldown;
            return this;
        }

        public Builder sessionTtl(Duration sessionTtl) {
            this.sessionTtl = sessionTtl;
            return this;
        }

        public Builder staleSessionRetention(Duration staleSessionRetention) {
            this.staleSessionRetention = staleSessionRetention;
            return this;
        }

        public Builder positionPublishInterval(Duration positionPublishInterval) {
            this.positionPublishInterval = positionPublishInterval;
            return this;
        }

        public Builder watchReconnectDelay(Duration watchReconnectDelay) {
            this.watchReconnectDelay = watchReconnectDelay;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public PairingConfig build() {
            return new PairingConfig(this).withDefaults();
        }

        private PairingConfig buildInternal() {
            return new PairingConfig(this);
        }
    }
}
