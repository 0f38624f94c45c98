package cloud.anchorwatch.sdk.internal;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Helper methods for issuing HTTP requests with JSON payloads.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    public static HttpResponse<byte[]> sendJson(HttpClient client, String method, URI uri, Object payload, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder().uri(uri);

        if (payload == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            byte[] body = Json.mapper().writeValueAsBytes(payload);
            builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
            builder.header("Content-Type", "application/json");
        }

        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            builder.timeout(timeout);
        }
        builder.header("Accept", "application/json");

        return client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
    }

    public static String formEncode(Map<String, String> fields) {
        StringBuilder form = new StringBuilder();
        for (Map.Entry<String, String> entry : fields.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            if (form.length() > 0) {
                form.append('&');
            }
            form.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
                .append('=')
                .append(URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8));
        }
        return form.toString();
    }

    /**
     * Message of {@code error}, or its class name when the message is missing (connection refusals carry none).
     */
    public static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.getClass().getName() : message;
    }

    public static String queryParam(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
