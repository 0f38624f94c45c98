package cloud.anchorwatch.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Path-addressed mutations on a JSON document tree, following realtime-database semantics: writing {@code null}
 * deletes, intermediate objects are created on demand and emptied parents are pruned.
 */
public final class JsonTree {

    private JsonTree() {
    }

    public static List<String> split(String path) {
        if (path == null || path.isBlank() || "/".equals(path)) {
            return List.of();
        }
        List<String> segments = new ArrayList<>();
        Arrays.stream(path.split("/"))
            .filter(part -> !part.isEmpty())
            .forEach(segments::add);
        return segments;
    }

    /**
     * @return a deep copy of the value at {@code segments}, or {@code null} when absent.
     */
    public static JsonNode get(ObjectNode root, List<String> segments) {
        JsonNode current = root;
        for (String segment : segments) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(segment);
        }
        if (Json.isAbsent(current)) {
            return null;
        }
        return current.deepCopy();
    }

    public static void set(ObjectNode root, List<String> segments, JsonNode value) {
        if (segments.isEmpty()) {
            root.removeAll();
            if (!Json.isAbsent(value) && value.isObject()) {
                root.setAll((ObjectNode) value.deepCopy());
            }
            return;
        }
        if (Json.isAbsent(value)) {
            remove(root, segments);
            return;
        }
        ObjectNode parent = root;
        for (int i = 0; i < segments.size() - 1; i++) {
            JsonNode child = parent.get(segments.get(i));
            if (child == null || !child.isObject()) {
                child = parent.putObject(segments.get(i));
            }
            parent = (ObjectNode) child;
        }
        parent.set(segments.get(segments.size() - 1), value.deepCopy());
    }

    /**
     * Multi-location update: every key of {@code children} is a path relative to {@code segments}.
     */
    public static void merge(ObjectNode root, List<String> segments, Map<String, JsonNode> children) {
        for (Map.Entry<String, JsonNode> entry : children.entrySet()) {
            List<String> target = new ArrayList<>(segments);
            target.addAll(split(entry.getKey()));
            set(root, target, entry.getValue());
        }
    }

    private static void remove(ObjectNode root, List<String> segments) {
        List<ObjectNode> chain = new ArrayList<>();
        ObjectNode parent = root;
        chain.add(parent);
        for (int i = 0; i < segments.size() - 1; i++) {
            JsonNode child = parent.get(segments.get(i));
            if (child == null || !child.isObject()) {
                return;
            }
            parent = (ObjectNode) child;
            chain.add(parent);
        }
        parent.remove(segments.get(segments.size() - 1));
        for (int i = chain.size() - 1; i > 0; i--) {
            if (chain.get(i).size() > 0) {
                break;
            }
            chain.get(i - 1).remove(segments.get(i - 1));
        }
    }
}
