package cloud.anchorwatch.sdk.local;

import cloud.anchorwatch.sdk.internal.Json;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * {@link LocalStore} backed by a single JSON object file. Every write rewrites the file through a temporary sibling
 * and an atomic move, so a crash never leaves a half-written document behind.
 */
public final class FileLocalStore implements LocalStore {

    private final Path file;
    private final Object lock = new Object();
    private final Map<String, String> values;

    public FileLocalStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
        try {
            this.values = read(file);
        } catch (IOException ex) {
            throw new UncheckedIOException("read local store " + file, ex);
        }
    }

    @Override
    public String getString(String key) {
        Objects.requireNonNull(key, "key");
        synchronized (lock) {
            return values.get(key);
        }
    }

    @Override
    public void setString(String key, String value) throws IOException {
        Objects.requireNonNull(key, "key");
        synchronized (lock) {
            Map<String, String> next = new LinkedHashMap<>(values);
            if (value == null) {
                next.remove(key);
            } else {
                next.put(key, value);
            }
            write(next);
            values.clear();
            values.putAll(next);
        }
    }

    private static Map<String, String> read(Path file) throws IOException {
        Map<String, String> out = new LinkedHashMap<>();
        if (!Files.exists(file)) {
            return out;
        }
        JsonNode root = Json.mapper().readTree(file.toFile());
        if (root == null || !root.isObject()) {
            return out;
        }
        root.fields().forEachRemaining(entry -> {
            if (entry.getValue() != null && entry.getValue().isTextual()) {
                out.put(entry.getKey(), entry.getValue().asText());
            }
        });
        return out;
    }

    private void write(Map<String, String> next) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ObjectNode root = Json.mapper().createObjectNode();
        new TreeMap<>(next).forEach(root::put);
        Path temp = file.resolveSibling(file.getFileName() + ".tmp");
        Json.mapper().writerWithDefaultPrettyPrinter().writeValue(temp.toFile(), root);
        try {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException ex) {
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
