package cloud.anchorwatch.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonTreeTest {

    @Test
    void splitIgnoresEmptySegments() {
        assertEquals(List.of("sessions", "ABC", "devices"), JsonTree.split("/sessions//ABC/devices/"));
        assertTrue(JsonTree.split("/").isEmpty());
        assertTrue(JsonTree.split(null).isEmpty());
    }

    @Test
    void setCreatesIntermediateObjects() {
        ObjectNode root = Json.mapper().createObjectNode();
        JsonTree.set(root, JsonTree.split("a/b/c"), IntNode.valueOf(7));

        assertEquals(7, root.path("a").path("b").path("c").asInt());
        assertEquals(IntNode.valueOf(7), JsonTree.get(root, JsonTree.split("a/b/c")));
    }

    @Test
    void writingNullDeletesAndPrunesEmptyParents() {
        ObjectNode root = Json.mapper().createObjectNode();
        JsonTree.set(root, JsonTree.split("a/b/c"), IntNode.valueOf(1));
        JsonTree.set(root, JsonTree.split("a/x"), TextNode.valueOf("keep"));

        JsonTree.set(root, JsonTree.split("a/b/c"), NullNode.getInstance());

        assertNull(JsonTree.get(root, JsonTree.split("a/b")));
        assertEquals("keep", root.path("a").path("x").asText());

        JsonTree.set(root, JsonTree.split("a/x"), null);
        assertEquals(0, root.size());
    }

    @Test
    void emptyObjectsReadAsAbsent() {
        ObjectNode root = Json.mapper().createObjectNode();
        JsonTree.set(root, JsonTree.split("a"), Json.mapper().createObjectNode());

        assertNull(JsonTree.get(root, JsonTree.split("a")));
        assertNull(JsonTree.get(root, JsonTree.split("missing/deeper")));
    }

    @Test
    void getReturnsDetachedCopy() {
        ObjectNode root = Json.mapper().createObjectNode();
        JsonTree.set(root, JsonTree.split("a/b"), IntNode.valueOf(1));

        JsonNode copy = JsonTree.get(root, JsonTree.split("a"));
        ((ObjectNode) copy).put("b", 2);

        assertEquals(1, root.path("a").path("b").asInt());
    }

    @Test
    void mergeTreatsKeysAsRelativePaths() {
        ObjectNode root = Json.mapper().createObjectNode();
        JsonTree.set(root, JsonTree.split("s/keep"), TextNode.valueOf("yes"));
        JsonTree.set(root, JsonTree.split("s/drop"), TextNode.valueOf("soon"));

        Map<String, JsonNode> children = new LinkedHashMap<>();
        children.put("nested/value", IntNode.valueOf(3));
        children.put("drop", NullNode.getInstance());
        JsonTree.merge(root, JsonTree.split("s"), children);

        assertEquals("yes", root.path("s").path("keep").asText());
        assertEquals(3, root.path("s").path("nested").path("value").asInt());
        assertTrue(root.path("s").path("drop").isMissingNode());
    }

    @Test
    void settingRootReplacesDocument() {
        ObjectNode root = Json.mapper().createObjectNode();
        JsonTree.set(root, JsonTree.split("old"), IntNode.valueOf(1));
        ObjectNode replacement = Json.mapper().createObjectNode().put("new", 2);

        JsonTree.set(root, List.of(), replacement);

        assertTrue(root.path("old").isMissingNode());
        assertEquals(2, root.path("new").asInt());
    }
}
