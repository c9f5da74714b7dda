package io.contextrunr.storage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SQLiteRecordStoreTest {

    @TempDir
    Path tempDir;

    private SQLiteRecordStore store;

    @BeforeEach
    void setUp() {
        store = new SQLiteRecordStore(tempDir.resolve("nested/context.db").toString());
        store.init();
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void shouldStoreAndGetRecord() {
        store.set("session:abc", "{}");

        assertEquals("{}", store.get("session:abc").orElseThrow());
    }

    @Test
    void shouldUpsertRecord() {
        store.set("memory:m1", "old");
        store.set("memory:m1", "new");

        assertEquals("new", store.get("memory:m1").orElseThrow());
        assertEquals(1, store.scan("memory:").size());
    }

    @Test
    void shouldDeleteRecord() {
        store.set("memory:m1", "value");

        assertTrue(store.delete("memory:m1"));
        assertFalse(store.delete("memory:m1"));
    }

    @Test
    void shouldScanByExactPrefix() {
        store.set("session:1", "a");
        store.set("SESSION:2", "b");
        store.set("session_3", "c");
        store.set("memory:1", "d");

        assertEquals(List.of("session:1"), store.scan("session:"));
    }

    @Test
    void shouldPersistAcrossReopen() {
        store.set("session:keep", "data");
        store.close();

        store = new SQLiteRecordStore(tempDir.resolve("nested/context.db").toString());
        store.init();
        assertEquals("data", store.get("session:keep").orElseThrow());
    }

    @Test
    void shouldReportHealthy() {
        assertTrue(store.healthCheck());
    }
}
