package me.golemcore.cognition.adapter.outbound.storage;

import me.golemcore.cognition.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.*;

class LocalStorageAdapterTest {

    private static final String DIRECTORY = "cognition";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
    }

    @Test
    void initCreatesConcernDirectories() {
        for (String dir : LocalStorageAdapter.DIRECTORIES) {
            assertTrue(Files.isDirectory(tempDir.resolve(dir)));
        }
    }

    @Test
    void putAndGetText() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(DIRECTORY, "state.json", "{\"mode\":\"AWAKE\"}", false).get();

        assertEquals("{\"mode\":\"AWAKE\"}", storageAdapter.getText(DIRECTORY, "state.json").get());
    }

    @Test
    void getTextReturnsNullForMissingFile() throws ExecutionException, InterruptedException {
        assertNull(storageAdapter.getText(DIRECTORY, "missing.json").get());
        assertFalse(Files.exists(tempDir.resolve(DIRECTORY).resolve("missing.json")));
    }

    @Test
    void appendTextAccumulatesLines() throws ExecutionException, InterruptedException {
        storageAdapter.appendText("relationships", "trust-history.jsonl", "{\"a\":1}\n").get();
        storageAdapter.appendText("relationships", "trust-history.jsonl", "{\"a\":2}\n").get();

        assertEquals("{\"a\":1}\n{\"a\":2}\n", storageAdapter.getText("relationships", "trust-history.jsonl").get());
    }

    @Test
    void atomicWriteReplacesContentAndKeepsBackup() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(DIRECTORY, "tasks.json", "[1]", true).get();
        storageAdapter.putTextAtomic(DIRECTORY, "tasks.json", "[1,2]", true).get();

        assertEquals("[1,2]", storageAdapter.getText(DIRECTORY, "tasks.json").get());
        assertEquals("[1]", storageAdapter.getText(DIRECTORY, "tasks.json.bak").get());
        assertFalse(Files.exists(tempDir.resolve(DIRECTORY).resolve("tasks.json.tmp")));
    }

    @Test
    void listObjectsReturnsSortedRelativePaths() throws ExecutionException, InterruptedException {
        storageAdapter.appendText(DIRECTORY, "decisions-2026-03-02.jsonl", "b\n").get();
        storageAdapter.appendText(DIRECTORY, "decisions-2026-03-01.jsonl", "a\n").get();
        storageAdapter.putTextAtomic("knowledge", "concepts.json", "[]", false).get();

        List<String> files = storageAdapter.listObjects(DIRECTORY, "").get();

        assertEquals(List.of("decisions-2026-03-01.jsonl", "decisions-2026-03-02.jsonl"), files);
    }

    @Test
    void atomicWriteWithoutBackupLeavesNoSiblings() throws ExecutionException, InterruptedException {
        storageAdapter.putTextAtomic(DIRECTORY, "state.json", "{}", false).get();
        storageAdapter.putTextAtomic(DIRECTORY, "state.json", "{\"mode\":\"SLEEPING\"}", false).get();

        assertEquals(List.of("state.json"), storageAdapter.listObjects(DIRECTORY, "").get());
    }

    @Test
    void pathTraversalIsBlocked() {
        assertThrows(ExecutionException.class,
                () -> storageAdapter.getText(DIRECTORY, "../../etc/passwd").get());
    }
}
