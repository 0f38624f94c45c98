package cloud.anchorwatch.sdk.store;

import cloud.anchorwatch.sdk.PairingException;
import cloud.anchorwatch.sdk.PermissionDeniedException;
import cloud.anchorwatch.sdk.QuotaExceededException;
import cloud.anchorwatch.sdk.StoreUnavailableException;
import cloud.anchorwatch.sdk.auth.IdentityProvider;
import cloud.anchorwatch.sdk.auth.IdentityToken;
import cloud.anchorwatch.sdk.internal.EventLoop;
import cloud.anchorwatch.sdk.support.Await;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RealtimeDatabaseStoreTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private HttpServer server;
    private ExecutorService serverExecutor;
    private URI baseUri;
    private EventLoop loop;
    private RealtimeDatabaseStore store;
    private final StubIdentity identity = new StubIdentity();
    private final List<Recorded> requests = new CopyOnWriteArrayList<>();
    private final AtomicInteger streamRequests = new AtomicInteger();
    private final CountDownLatch releaseStreams = new CountDownLatch(1);
    private volatile Responder responder = request -> new Reply(200, "null");
    private volatile StreamResponder streamResponder = (exchange, attempt) -> {
        exchange.sendResponseHeaders(200, 0);
        exchange.close();
    };

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress(0), 0);
        serverExecutor = Executors.newCachedThreadPool();
        server.setExecutor(serverExecutor);
        server.createContext("/", exchange -> {
            String accept = exchange.getRequestHeaders().getFirst("Accept");
            if (accept != null && accept.contains("text/event-stream")) {
                requests.add(record(exchange, ""));
                streamResponder.handle(exchange, streamRequests.incrementAndGet());
                return;
            }
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            Recorded request = record(exchange, body);
            requests.add(request);
            Reply reply = responder.reply(request);
            byte[] payload = reply.body().getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(reply.status(), payload.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(payload);
            }
        });
        server.start();
        baseUri = URI.create("http://localhost:" + server.getAddress().getPort());
        loop = new EventLoop("rtdb-test");
        store = new RealtimeDatabaseStore(HttpClient.newHttpClient(), baseUri + "/", identity,
            Duration.ofSeconds(5), Duration.ofMillis(50), loop);
    }

    @AfterEach
    void tearDown() {
        store.close();
        loop.close();
        releaseStreams.countDown();
        if (server != null) {
            server.stop(0);
        }
        serverExecutor.shutdownNow();
    }

    @Test
    void getAddressesJsonPathWithAuthParameter() throws Exception {
        responder = request -> new Reply(200, "{\"primaryUserId\":\"uid-1\"}");

        JsonNode value = store.get("sessions/ABC");

        assertEquals("uid-1", value.path("primaryUserId").asText());
        Recorded request = requests.get(0);
        assertEquals("GET", request.method());
        assertEquals("/sessions/ABC.json", request.path());
        assertEquals("auth=token-1", request.query());
    }

    @Test
    void absentValueReadsAsNull() throws Exception {
        assertNull(store.get("sessions/MISSING"));
    }

    @Test
    void probeUsesShallowRead() throws Exception {
        responder = request -> new Reply(200, "true");
        assertTrue(store.probe("sessions/ABC"));
        assertTrue(requests.get(0).query().contains("shallow=true"));

        responder = request -> new Reply(200, "null");
        assertFalse(store.probe("sessions/ABC"));
    }

    @Test
    void setPutsValueAndNullDeletes() throws Exception {
        store.set("deviceSessions/uid-1", "TOKEN");
        store.set("deviceSessions/uid-1", null);

        assertEquals("PUT", requests.get(0).method());
        assertEquals("\"TOKEN\"", requests.get(0).body());
        assertEquals("DELETE", requests.get(1).method());
        assertEquals("/deviceSessions/uid-1.json", requests.get(1).path());
    }

    @Test
    void updatePatchesChildrenKeepingNulls() throws Exception {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("isActive", false);
        values.put("alarm", null);

        store.update("sessions/ABC", values);

        Recorded request = requests.get(0);
        assertEquals("PATCH", request.method());
        JsonNode body = MAPPER.readTree(request.body());
        assertFalse(body.path("isActive").booleanValue());
        assertTrue(body.has("alarm"));
        assertTrue(body.get("alarm").isNull());
    }

    @Test
    void emptyUpdateSendsNothing() throws Exception {
        store.update("sessions/ABC", Collections.emptyMap());

        assertTrue(requests.isEmpty());
    }

    @Test
    void permissionDeniedIsRetriedOnceWithRefreshedIdentity() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        responder = request -> calls.incrementAndGet() == 1
            ? new Reply(401, "{\"error\":\"Permission denied\"}")
            : new Reply(200, "{\"ok\":true}");

        JsonNode value = store.get("sessions/ABC");

        assertTrue(value.path("ok").booleanValue());
        assertEquals(1, identity.refreshes.get());
        assertEquals("auth=token-2", requests.get(1).query());
    }

    @Test
    void persistentPermissionDeniedPropagates() {
        responder = request -> new Reply(403, "{\"error\":\"Permission denied\"}");

        assertThrows(PermissionDeniedException.class, () -> store.get("sessions/ABC"));
        assertEquals(2, requests.size());
    }

    @Test
    void quotaErrorsAreNotRetried() {
        responder = request -> new Reply(429, "{\"error\":\"Quota exceeded\"}");

        assertThrows(QuotaExceededException.class, () -> store.set("sessions/ABC", Map.of("a", 1)));
        assertEquals(1, requests.size());
    }

    @Test
    void unreachableBackendIsUnavailable() {
        server.stop(0);
        server = null;

        StoreUnavailableException error = assertThrows(StoreUnavailableException.class, () -> store.get("sessions/ABC"));
        assertFalse(error.getMessage().endsWith("null"), error.getMessage());
    }

    @Test
    void watchAppliesPutAndPatchEvents() {
        streamResponder = (exchange, attempt) -> {
            exchange.getResponseHeaders().add("Content-Type", "text/event-stream");
            exchange.sendResponseHeaders(200, 0);
            OutputStream os = exchange.getResponseBody();
            write(os, "event: put\ndata: {\"path\":\"/\",\"data\":{\"a\":1,\"nested\":{\"x\":1}}}\n\n");
            write(os, ": comment\nevent: keep-alive\ndata: null\n\n");
            write(os, "event: patch\ndata: {\"path\":\"/\",\"data\":{\"b\":2}}\n\n");
            write(os, "event: put\ndata: {\"path\":\"/nested/x\",\"data\":null}\n\n");
            awaitRelease();
            exchange.close();
        };
        List<JsonNode> values = new CopyOnWriteArrayList<>();

        store.watch("sessions/ABC", values::add);

        Await.until("three snapshots", () -> values.size() >= 3);
        assertEquals(1, values.get(0).path("a").asInt());
        assertEquals(2, values.get(1).path("b").asInt());
        assertEquals(1, values.get(1).path("a").asInt());
        assertTrue(values.get(2).path("nested").isMissingNode());
        assertEquals("/sessions/ABC.json", requests.get(0).path());
    }

    @Test
    void cancelledWatchReportsErrorAndStops() throws Exception {
        streamResponder = (exchange, attempt) -> {
            exchange.sendResponseHeaders(200, 0);
            OutputStream os = exchange.getResponseBody();
            write(os, "event: cancel\ndata: null\n\n");
            awaitRelease();
            exchange.close();
        };
        List<PairingException> errors = new CopyOnWriteArrayList<>();

        store.watch("sessions/ABC", new StoreListener() {
            @Override
            public void onValue(JsonNode value) {
            }

            @Override
            public void onError(PairingException error) {
                errors.add(error);
            }
        });

        Await.until("cancel error", () -> !errors.isEmpty());
        assertInstanceOf(PermissionDeniedException.class, errors.get(0));
        Thread.sleep(300);
        assertEquals(1, streamRequests.get());
    }

    @Test
    void rejectedWatchReconnectsWithRefreshedIdentity() {
        streamResponder = (exchange, attempt) -> {
            if (attempt == 1) {
                byte[] payload = "{\"error\":\"Permission denied\"}".getBytes(StandardCharsets.UTF_8);
                exchange.sendResponseHeaders(401, payload.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(payload);
                }
                return;
            }
            exchange.sendResponseHeaders(200, 0);
            OutputStream os = exchange.getResponseBody();
            write(os, "event: put\ndata: {\"path\":\"/\",\"data\":\"value\"}\n\n");
            awaitRelease();
            exchange.close();
        };
        List<JsonNode> values = new CopyOnWriteArrayList<>();
        List<PairingException> errors = new CopyOnWriteArrayList<>();

        store.watch("deviceSessions/uid-1", new StoreListener() {
            @Override
            public void onValue(JsonNode value) {
                values.add(value);
            }

            @Override
            public void onError(PairingException error) {
                errors.add(error);
            }
        });

        Await.until("value after reconnect", () -> !values.isEmpty());
        assertEquals("value", values.get(0).asText());
        assertInstanceOf(PermissionDeniedException.class, errors.get(0));
        assertEquals(1, identity.refreshes.get());
        assertEquals("auth=token-2", requests.get(1).query());
    }

    @Test
    void closingWatchStopsDelivery() throws Exception {
        CountDownLatch opened = new CountDownLatch(1);
        CountDownLatch proceed = new CountDownLatch(1);
        streamResponder = (exchange, attempt) -> {
            exchange.sendResponseHeaders(200, 0);
            OutputStream os = exchange.getResponseBody();
            opened.countDown();
            try {
                proceed.await(5, TimeUnit.SECONDS);
                write(os, "event: put\ndata: {\"path\":\"/\",\"data\":1}\n\n");
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            } catch (IOException ignored) {
                // client went away
            }
            exchange.close();
        };
        List<JsonNode> values = new CopyOnWriteArrayList<>();

        Subscription subscription = store.watch("sessions/ABC", values::add);
        assertTrue(opened.await(5, TimeUnit.SECONDS));
        subscription.close();
        proceed.countDown();

        Thread.sleep(300);
        assertTrue(values.isEmpty());
        assertEquals(1, streamRequests.get());
    }

    private void awaitRelease() {
        try {
            releaseStreams.await(5, TimeUnit.SECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        }
    }

    private static void write(OutputStream os, String chunk) throws IOException {
        os.write(chunk.getBytes(StandardCharsets.UTF_8));
        os.flush();
    }

    private static Recorded record(HttpExchange exchange, String body) {
        URI uri = exchange.getRequestURI();
        return new Recorded(exchange.getRequestMethod(), uri.getPath(), uri.getRawQuery(), body);
    }

    private record Recorded(String method, String path, String query, String body) {
    }

    private record Reply(int status, String body) {
    }

    @FunctionalInterface
    private interface Responder {
        Reply reply(Recorded request);
    }

    @FunctionalInterface
    private interface StreamResponder {
        void handle(HttpExchange exchange, int attempt) throws IOException;
    }

    private static final class StubIdentity implements IdentityProvider {
        private final AtomicInteger refreshes = new AtomicInteger();
        private volatile String idToken = "token-1";

        @Override
        public IdentityToken token() {
            return new IdentityToken(idToken, null, "uid-1", Instant.now().plusSeconds(3600));
        }

        @Override
        public IdentityToken forceRefresh() {
            idToken = "token-" + (refreshes.incrementAndGet() + 1);
            return token();
        }
    }
}
