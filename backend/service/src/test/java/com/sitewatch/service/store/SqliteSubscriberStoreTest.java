package com.sitewatch.service.store;

import com.sitewatch.monitor.api.CapacityExceededException;
import com.sitewatch.monitor.api.StorageException;
import com.sitewatch.monitor.api.StorageInitException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SqliteSubscriberStoreTest {
    @TempDir
    Path tempDir;

    @Test
    void initializesSchemaIncludingMissingParentDirectories() {
        Path db = tempDir.resolve("nested/dir/subscribers.db");
        SqliteSubscriberStore store = new SqliteSubscriberStore(db, 10);

        store.ensureInitialized();
        store.ensureInitialized();

        assertTrue(db.toFile().exists());
        assertEquals(0, store.count());
        assertEquals(Set.of(), store.listSubscribed());
    }

    @Test
    void subscribeIsIdempotent() {
        SqliteSubscriberStore store = initialized(10);

        assertTrue(store.subscribe(42L));
        assertFalse(store.subscribe(42L));

        assertEquals(1, store.count());
        assertEquals(Set.of(42L), store.listSubscribed());
        assertTrue(store.isSubscribed(42L));
    }

    @Test
    void unsubscribeClearsTheFlagAndKeepsTheRow() {
        SqliteSubscriberStore store = initialized(10);
        store.subscribe(42L);
        store.subscribe(7L);

        assertTrue(store.unsubscribe(42L));
        assertFalse(store.unsubscribe(42L));
        assertFalse(store.unsubscribe(99L));

        assertFalse(store.isSubscribed(42L));
        assertFalse(store.isSubscribed(99L));
        assertEquals(Set.of(7L), store.listSubscribed());
        assertEquals(2, store.count());
    }

    @Test
    void resubscribingFlipsTheExistingRow() {
        SqliteSubscriberStore store = initialized(10);
        store.subscribe(42L);
        store.unsubscribe(42L);

        assertTrue(store.subscribe(42L));

        assertTrue(store.isSubscribed(42L));
        assertEquals(1, store.count());
    }

    @Test
    void capacityRejectsNewUsersAndLeavesStateUnchanged() {
        SqliteSubscriberStore store = initialized(2);
        store.subscribe(1L);
        store.subscribe(2L);

        CapacityExceededException error = assertThrows(CapacityExceededException.class, () -> store.subscribe(3L));

        assertEquals(2, error.cap());
        assertEquals(2, store.count());
        assertFalse(store.isSubscribed(3L));
        assertEquals(Set.of(1L, 2L), store.listSubscribed());
    }

    @Test
    void inactiveRowsCountTowardCapacityButMayResubscribe() {
        SqliteSubscriberStore store = initialized(2);
        store.subscribe(1L);
        store.subscribe(2L);
        store.unsubscribe(2L);

        assertThrows(CapacityExceededException.class, () -> store.subscribe(3L));
        store.subscribe(2L);

        assertEquals(Set.of(1L, 2L), store.listSubscribed());
    }

    @Test
    void stateSurvivesANewStoreInstance() {
        Path db = tempDir.resolve("subscribers.db");
        SqliteSubscriberStore first = new SqliteSubscriberStore(db, 10);
        first.ensureInitialized();
        first.subscribe(11L);
        first.subscribe(12L);
        first.unsubscribe(12L);

        SqliteSubscriberStore second = new SqliteSubscriberStore(db, 10);
        second.ensureInitialized();

        assertEquals(2, second.count());
        assertEquals(Set.of(11L), second.listSubscribed());
    }

    @Test
    void failedWriteRollsBackAndSurfacesStorageException() throws Exception {
        Path db = tempDir.resolve("subscribers.db");
        SqliteSubscriberStore store = new SqliteSubscriberStore(db, 10);
        store.ensureInitialized();
        store.subscribe(1L);
        try (Connection connection = DriverManager.getConnection("jdbc:sqlite:" + db.toAbsolutePath());
             Statement statement = connection.createStatement()) {
            statement.execute("""
                    CREATE TRIGGER reject_666 BEFORE INSERT ON subscribers
                    WHEN NEW.user_id = 666
                    BEGIN SELECT RAISE(ABORT, 'rejected by trigger'); END
                    """);
        }

        StorageException error = assertThrows(StorageException.class, () -> store.subscribe(666L));

        assertTrue(error.getMessage().contains("rejected by trigger"));
        assertEquals(1, store.count());
        assertFalse(store.isSubscribed(666L));
    }

    @Test
    void unusableDatabasePathFailsInitialization() {
        SqliteSubscriberStore store = new SqliteSubscriberStore(tempDir, 10);

        StorageInitException error = assertThrows(StorageInitException.class, store::ensureInitialized);

        assertTrue(error.getMessage().contains(tempDir.toString()));
    }

    @Test
    void operationsOnAnUninitializedDatabaseRaiseStorageException() {
        SqliteSubscriberStore store = new SqliteSubscriberStore(tempDir.resolve("never-created.db"), 10);

        assertThrows(StorageException.class, store::listSubscribed);
    }

    @Test
    void concurrentSubscribesNeverExceedTheCap() throws Exception {
        SqliteSubscriberStore store = initialized(5);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Future<Boolean>> attempts = new ArrayList<>();
        try {
            for (long userId = 1; userId <= 12; userId++) {
                long id = userId;
                attempts.add(pool.submit(() -> {
                    try {
                        store.subscribe(id);
                        return true;
                    } catch (CapacityExceededException e) {
                        return false;
                    }
                }));
            }
            int accepted = 0;
            for (Future<Boolean> attempt : attempts) {
                if (attempt.get(30, TimeUnit.SECONDS)) {
                    accepted++;
                }
            }

            assertEquals(5, accepted);
            assertEquals(5, store.count());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new SqliteSubscriberStore(tempDir.resolve("x.db"), 0));
    }

    private SqliteSubscriberStore initialized(long cap) {
        SqliteSubscriberStore store = new SqliteSubscriberStore(tempDir.resolve("subscribers.db"), cap);
        store.ensureInitialized();
        return store;
    }
}
