package com.umitunal.taskq.storage;

import com.umitunal.taskq.config.StorageConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class RocksKeyValueStoreTest extends KeyValueStoreContractTest {

    @TempDir
    Path tempDir;

    @Override
    protected KeyValueStore createStore() throws Exception {
        return new RocksKeyValueStore(StorageConfig.newBuilder(tempDir.resolve("db").toString())
                .withDurableWrites(false)
                .build());
    }

    @Test
    @DisplayName("Should keep data across close and reopen")
    void testPersistence() throws Exception {
        // Given
        store.set(KeyPath.of("jobs", "job-1"), "payload".getBytes(UTF_8));
        store.close();

        // When
        store = createStore();

        // Then
        assertThat(store.get(KeyPath.of("jobs", "job-1")))
                .hasValueSatisfying(value -> assertThat(new String(value, UTF_8)).isEqualTo("payload"));
    }

    @Test
    @DisplayName("Should report an estimated key count")
    void testApproximateSize() throws Exception {
        for (int i = 0; i < 10; i++) {
            store.set(KeyPath.of("jobs", "job-" + i), new byte[]{1});
        }

        assertThat(((RocksKeyValueStore) store).approximateSize()).isGreaterThanOrEqualTo(0);
        assertThat(((RocksKeyValueStore) store).getConflictCount()).isZero();
    }
}
