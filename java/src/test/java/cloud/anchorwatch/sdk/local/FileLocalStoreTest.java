package cloud.anchorwatch.sdk.local;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileLocalStoreTest {

    @TempDir
    Path dir;

    @Test
    void valuesSurviveReopening() throws Exception {
        Path file = dir.resolve("nested/pairing.json");
        FileLocalStore store = new FileLocalStore(file);
        store.setString(LocalStore.KEY_SESSION_TOKEN, "ABCDEFGHIJKLMNOPQRSTUVWXYZ012345");
        store.setString(LocalStore.KEY_ROLE, "primary");

        FileLocalStore reopened = new FileLocalStore(file);

        assertEquals("ABCDEFGHIJKLMNOPQRSTUVWXYZ012345", reopened.getString(LocalStore.KEY_SESSION_TOKEN));
        assertEquals("primary", reopened.getString(LocalStore.KEY_ROLE));
        assertFalse(Files.exists(dir.resolve("nested/pairing.json.tmp")));
    }

    @Test
    void nullRemovesKey() throws Exception {
        Path file = dir.resolve("pairing.json");
        FileLocalStore store = new FileLocalStore(file);
        store.setString(LocalStore.KEY_ROLE, "secondary");
        store.setString(LocalStore.KEY_ROLE, null);

        assertNull(store.getString(LocalStore.KEY_ROLE));
        assertNull(new FileLocalStore(file).getString(LocalStore.KEY_ROLE));
    }

    @Test
    void missingFileStartsEmpty() {
        FileLocalStore store = new FileLocalStore(dir.resolve("absent.json"));

        assertNull(store.getString(LocalStore.KEY_SESSION_TOKEN));
    }

    @Test
    void nonTextualEntriesAreIgnored() throws Exception {
        Path file = dir.resolve("pairing.json");
        Files.writeString(file, "{\"role\":\"primary\",\"sessionToken\":42}", StandardCharsets.UTF_8);

        FileLocalStore store = new FileLocalStore(file);

        assertEquals("primary", store.getString(LocalStore.KEY_ROLE));
        assertNull(store.getString(LocalStore.KEY_SESSION_TOKEN));
    }

    @Test
    void unreadableFileIsRejected() throws Exception {
        Path file = dir.resolve("pairing.json");
        Files.writeString(file, "{not json", StandardCharsets.UTF_8);

        UncheckedIOException error = assertThrows(UncheckedIOException.class, () -> new FileLocalStore(file));
        assertTrue(error.getMessage().contains("pairing.json"));
    }
}
