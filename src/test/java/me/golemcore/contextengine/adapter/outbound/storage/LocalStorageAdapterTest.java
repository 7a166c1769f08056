package me.golemcore.contextengine.adapter.outbound.storage;

import me.golemcore.contextengine.infrastructure.config.ContextEngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LocalStorageAdapterTest {

    @TempDir
    Path tempDir;

    private LocalStorageAdapter adapter;

    @BeforeEach
    void setUp() {
        ContextEngineProperties properties = new ContextEngineProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        adapter = new LocalStorageAdapter(properties);
        adapter.init();
    }

    @Test
    void shouldCreateStoreDirectoryOnInit() {
        assertTrue(Files.isDirectory(tempDir.resolve("store")));
    }

    @Test
    void shouldReturnNullForMissingFile() {
        assertNull(adapter.getText("store", "missing.json").join());
    }

    @Test
    void shouldWriteAndReadText() {
        adapter.putTextAtomic("store", "table.json", "[1,2]", false).join();

        assertEquals("[1,2]", adapter.getText("store", "table.json").join());
        assertFalse(Files.exists(tempDir.resolve("store/table.json.tmp")));
        assertFalse(Files.exists(tempDir.resolve("store/table.json.bak")));
    }

    @Test
    void shouldKeepPreviousVersionAsBackup() throws Exception {
        adapter.putTextAtomic("store", "table.json", "v1", true).join();
        adapter.putTextAtomic("store", "table.json", "v2", true).join();

        assertEquals("v2", adapter.getText("store", "table.json").join());
        assertEquals("v1", Files.readString(tempDir.resolve("store/table.json.bak")));
    }

    @Test
    void shouldCreateNestedDirectories() {
        adapter.ensureDirectory("store/archive").join();
        adapter.putTextAtomic("store/archive", "old.json", "[]", false).join();

        assertEquals("[]", adapter.getText("store/archive", "old.json").join());
    }

    @Test
    void shouldBlockPathTraversal() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.putTextAtomic("store", "../../escape.json", "x", false).join());

        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
        assertFalse(Files.exists(tempDir.getParent().resolve("escape.json")));
    }
}
