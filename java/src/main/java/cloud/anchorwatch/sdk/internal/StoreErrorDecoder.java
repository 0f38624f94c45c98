package cloud.anchorwatch.sdk.internal;

import cloud.anchorwatch.sdk.PermissionDeniedException;
import cloud.anchorwatch.sdk.QuotaExceededException;
import cloud.anchorwatch.sdk.StoreException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Maps error responses from the realtime store and the identity endpoints onto the SDK exception taxonomy.
 *
 * <p>The database answers {@code {"error": "Permission denied"}}; the identity service answers
 * {@code {"error": {"code": 400, "message": "TOKEN_EXPIRED", "status": "INVALID_ARGUMENT"}}}. Both shapes are
 * understood.</p>
 */
public final class StoreErrorDecoder {

    private StoreErrorDecoder() {
    }

    public static StoreException decode(int statusCode, byte[] body) {
        String code = null;
        String message = null;
        if (body != null && body.length > 0) {
            try {
                JsonNode node = Json.mapper().readTree(body);
                JsonNode error = node.path("error");
                if (error.isTextual()) {
                    message = error.asText();
                } else if (error.isObject()) {
                    message = error.hasNonNull("message") ? error.get("message").asText() : null;
                    code = error.hasNonNull("status") ? error.get("status").asText() : null;
                } else {
                    code = node.hasNonNull("code") ? node.get("code").asText() : null;
                    message = node.hasNonNull("message") ? node.get("message").asText() : null;
                }
            } catch (IOException ex) {
                message = new String(body, StandardCharsets.UTF_8);
            }
        }
        return classify(statusCode, code, message);
    }

    public static StoreException decode(int statusCode, String body) {
        return decode(statusCode, body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    static StoreException classify(int statusCode, String code, String message) {
        if (isQuota(statusCode, code, message)) {
            return new QuotaExceededException(statusCode, code, message);
        }
        if (statusCode == 401 || statusCode == 403 || mentions(message, "permission denied")) {
            return new PermissionDeniedException(statusCode, code, message);
        }
        return new StoreException(statusCode, code, message);
    }

    private static boolean isQuota(int statusCode, String code, String message) {
        return statusCode == 429
            || mentions(code, "resource_exhausted")
            || mentions(message, "resource_exhausted")
            || mentions(message, "quota exceeded");
    }

    private static boolean mentions(String value, String needle) {
        return value != null && value.toLowerCase(Locale.ROOT).contains(needle);
    }
}
