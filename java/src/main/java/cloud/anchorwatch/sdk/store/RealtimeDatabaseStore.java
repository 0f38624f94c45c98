package cloud.anchorwatch.sdk.store;

import cloud.anchorwatch.sdk.PairingException;
import cloud.anchorwatch.sdk.PermissionDeniedException;
import cloud.anchorwatch.sdk.StoreException;
import cloud.anchorwatch.sdk.StoreUnavailableException;
import cloud.anchorwatch.sdk.auth.IdentityProvider;
import cloud.anchorwatch.sdk.auth.IdentityToken;
import cloud.anchorwatch.sdk.internal.EventLoop;
import cloud.anchorwatch.sdk.internal.HttpUtil;
import cloud.anchorwatch.sdk.internal.Json;
import cloud.anchorwatch.sdk.internal.JsonTree;
import cloud.anchorwatch.sdk.internal.StoreErrorDecoder;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link RemoteStore} backed by the REST and streaming interface of a realtime database.
 *
 * <p>Reads and writes map to {@code GET/PUT/PATCH/DELETE {databaseUrl}/{path}.json?auth={idToken}}. A request that
 * is rejected with a permission error is retried once after forcing an identity refresh. Watches use the
 * server-sent event stream of the same URL; the stream is re-established after transport failures for as long as
 * the watch stays open.</p>
 */
public final class RealtimeDatabaseStore implements RemoteStore, AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(RealtimeDatabaseStore.class.getName());
    private static final String WRAPPER_FIELD = "value";

    private final HttpClient httpClient;
    private final String databaseUrl;
    private final IdentityProvider identityProvider;
    private final Duration requestTimeout;
    private final Duration reconnectDelay;
    private final EventLoop loop;
    private final Set<WatchStream> streams = ConcurrentHashMap.newKeySet();

    public RealtimeDatabaseStore(
        HttpClient httpClient,
        String databaseUrl,
        IdentityProvider identityProvider,
        Duration requestTimeout,
        Duration reconnectDelay,
        EventLoop loop
    ) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
        this.databaseUrl = stripTrailingSlash(Objects.requireNonNull(databaseUrl, "databaseUrl"));
        this.identityProvider = Objects.requireNonNull(identityProvider, "identityProvider");
        this.requestTimeout = requestTimeout;
        this.reconnectDelay = reconnectDelay == null || reconnectDelay.isNegative() ? Duration.ofSeconds(2) : reconnectDelay;
        this.loop = Objects.requireNonNull(loop, "loop");
    }

    @Override
    public String identity() throws PairingException {
        return identityProvider.uid();
    }

    @Override
    public JsonNode get(String path) throws PairingException {
        return call("get " + path, "GET", path, null, null);
    }

    @Override
    public boolean probe(String path) throws PairingException {
        return call("probe " + path, "GET", path, "shallow=true", null) != null;
    }

    @Override
    public void set(String path, Object value) throws PairingException {
        JsonNode node = Json.toNode(value);
        if (Json.isAbsent(node)) {
            delete(path);
            return;
        }
        call("set " + path, "PUT", path, null, node);
    }

    @Override
    public void update(String path, Map<String, ?> values) throws PairingException {
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            return;
        }
        ObjectNode body = Json.mapper().createObjectNode();
        values.forEach((key, value) -> body.set(key, Json.toNode(value)));
        call("update " + path, "PATCH", path, null, body);
    }

    @Override
    public void delete(String path) throws PairingException {
        call("delete " + path, "DELETE", path, null, null);
    }

    @Override
    public Subscription watch(String path, StoreListener listener) {
        WatchStream stream = new WatchStream(path, Objects.requireNonNull(listener, "listener"));
        streams.add(stream);
        loop.execute(stream::open);
        return stream;
    }

    /**
     * Closes every open watch stream.
     */
    @Override
    public void close() {
        new ArrayList<>(streams).forEach(WatchStream::close);
    }

    private JsonNode call(String operation, String method, String path, String query, JsonNode payload)
        throws PairingException {
        IdentityToken token = identityProvider.token();
        try {
            return send(operation, method, path, query, payload, token);
        } catch (PermissionDeniedException ex) {
            LOGGER.info(() -> String.format(Locale.ROOT,
                "[anchorwatch] %s denied; refreshing identity and retrying once", operation));
            IdentityToken refreshed = identityProvider.forceRefresh();
            return send(operation, method, path, query, payload, refreshed);
        }
    }

    private JsonNode send(String operation, String method, String path, String query, JsonNode payload,
                          IdentityToken token) throws PairingException {
        HttpResponse<byte[]> response;
        try {
            response = HttpUtil.sendJson(httpClient, method, uri(path, query, token), payload, requestTimeout);
        } catch (IOException | InterruptedException ex) {
            if (ex instanceof InterruptedException) {
                Thread.currentThread().interrupt();
                throw new StoreUnavailableException(operation + " interrupted", ex);
            }
            throw new StoreUnavailableException(operation + " request: " + HttpUtil.describe(ex), ex);
        }

        if (response.statusCode() >= 400) {
            throw StoreErrorDecoder.decode(response.statusCode(), response.body());
        }
        byte[] body = response.body();
        if (body == null || body.length == 0) {
            return null;
        }
        try {
            JsonNode node = Json.mapper().readTree(body);
            return Json.isAbsent(node) ? null : node;
        } catch (IOException ex) {
            throw new StoreException("decode " + operation + " response: " + HttpUtil.describe(ex), ex);
        }
    }

    private URI uri(String path, String query, IdentityToken token) {
        StringBuilder url = new StringBuilder(databaseUrl).append('/');
        List<String> segments = JsonTree.split(path);
        url.append(String.join("/", segments)).append(".json?auth=").append(HttpUtil.queryParam(token.getIdToken()));
        if (query != null && !query.isBlank()) {
            url.append('&').append(query);
        }
        return URI.create(url.toString());
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    /**
     * One streaming watch. All state is touched on the event loop only.
     */
    private final class WatchStream implements Subscription {
        private final String path;
        private final StoreListener listener;
        private final ObjectNode snapshot = Json.mapper().createObjectNode();
        private volatile EventStreamSubscriber current;
        private volatile ScheduledFuture<?> reconnect;
        private boolean delivered;
        private JsonNode lastDelivered;
        private boolean refreshIdentity;
        private volatile boolean closed;

        private WatchStream(String path, StoreListener listener) {
            this.path = path;
            this.listener = listener;
        }

        private void open() {
            if (closed || loop.isClosed()) {
                return;
            }
            IdentityToken token;
            try {
                token = refreshIdentity ? identityProvider.forceRefresh() : identityProvider.token();
                refreshIdentity = false;
            } catch (PairingException ex) {
                LOGGER.log(Level.FINE, "[anchorwatch] watch " + path + " could not obtain identity", ex);
                listener.onError(ex);
                scheduleReconnect();
                return;
            }

            EventStreamSubscriber subscriber = new EventStreamSubscriber(new EventStreamSubscriber.Handler() {
                @Override
                public void onEvent(EventStreamSubscriber source, String event, String data) {
                    loop.execute(() -> handleEvent(source, event, data));
                }

                @Override
                public void onClosed(EventStreamSubscriber source, Throwable error) {
                    loop.execute(() -> handleClosed(source, error));
                }
            });
            current = subscriber;

            HttpRequest request = HttpRequest.newBuilder(uri(path, null, token))
                .header("Accept", "text/event-stream")
                .GET()
                .build();
            httpClient.sendAsync(request, info -> {
                if (info.statusCode() >= 400) {
                    return HttpResponse.BodySubscribers.mapping(
                        HttpResponse.BodySubscribers.ofString(StandardCharsets.UTF_8),
                        body -> {
                            StoreException error = StoreErrorDecoder.decode(info.statusCode(), body);
                            loop.execute(() -> handleRejected(subscriber, error));
                            return null;
                        });
                }
                return HttpResponse.BodySubscribers.fromLineSubscriber(subscriber);
            }).whenComplete((response, error) -> {
                if (error != null) {
                    loop.execute(() -> handleClosed(subscriber, error));
                }
            });
            LOGGER.fine(() -> "[anchorwatch] watch stream opened for " + path);
        }

        private void handleEvent(EventStreamSubscriber source, String event, String data) {
            if (closed || source != current) {
                return;
            }
            switch (event) {
                case "put":
                case "patch":
                    apply(event, data);
                    break;
                case "keep-alive":
                    break;
                case "cancel":
                    LOGGER.warning(() -> "[anchorwatch] watch " + path + " cancelled by the store: " + data);
                    current.cancel();
                    current = null;
                    listener.onError(new PermissionDeniedException(401, "cancel", "watch cancelled: " + path));
                    break;
                case "auth_revoked":
                    LOGGER.info(() -> "[anchorwatch] watch " + path + " credential revoked; reconnecting");
                    current.cancel();
                    current = null;
                    refreshIdentity = true;
                    open();
                    break;
                default:
                    LOGGER.fine(() -> "[anchorwatch] ignoring stream event " + event);
                    break;
            }
        }

        private void apply(String event, String data) {
            JsonNode message;
            try {
                message = Json.mapper().readTree(data);
            } catch (IOException ex) {
                LOGGER.log(Level.WARNING, "[anchorwatch] unreadable stream event for " + path, ex);
                return;
            }
            List<String> target = new ArrayList<>();
            target.add(WRAPPER_FIELD);
            target.addAll(JsonTree.split(message.path("path").asText("/")));
            JsonNode payload = message.get("data");
            if ("put".equals(event)) {
                JsonTree.set(snapshot, target, payload);
            } else if (payload != null && payload.isObject()) {
                Map<String, JsonNode> children = new LinkedHashMap<>();
                Iterator<Map.Entry<String, JsonNode>> fields = payload.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    children.put(field.getKey(), field.getValue());
                }
                JsonTree.merge(snapshot, target, children);
            }
            JsonNode value = JsonTree.get(snapshot, List.of(WRAPPER_FIELD));
            if (delivered && Objects.equals(lastDelivered, value)) {
                return;
            }
            delivered = true;
            lastDelivered = value;
            listener.onValue(value == null ? null : value.deepCopy());
        }

        private void handleRejected(EventStreamSubscriber subscriber, StoreException error) {
            if (closed || subscriber != current) {
                return;
            }
            current = null;
            LOGGER.log(Level.FINE, "[anchorwatch] watch " + path + " rejected", error);
            if (error instanceof PermissionDeniedException) {
                refreshIdentity = true;
            }
            listener.onError(error);
            scheduleReconnect();
        }

        private void handleClosed(EventStreamSubscriber subscriber, Throwable error) {
            if (closed || subscriber != current) {
                return;
            }
            current = null;
            if (error != null) {
                LOGGER.log(Level.FINE, "[anchorwatch] watch stream for " + path + " failed", error);
                listener.onError(new StoreUnavailableException("watch " + path + ": " + HttpUtil.describe(error), error));
            }
            scheduleReconnect();
        }

        private void scheduleReconnect() {
            if (closed || loop.isClosed()) {
                return;
            }
            reconnect = loop.schedule(this::open, reconnectDelay);
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            streams.remove(this);
            ScheduledFuture<?> pending = reconnect;
            if (pending != null) {
                pending.cancel(false);
            }
            EventStreamSubscriber active = current;
            if (active != null) {
                active.cancel();
            }
            current = null;
        }
    }
}
