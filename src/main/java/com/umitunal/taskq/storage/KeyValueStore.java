package com.umitunal.taskq.storage;

import com.umitunal.taskq.core.StoreException;

import java.util.List;
import java.util.Optional;

/**
 * Minimal durable store the queue and scheduler persist through: point reads and writes,
 * ordered prefix listing and checked multi-key atomic writes.
 */
public interface KeyValueStore extends AutoCloseable {

    Optional<byte[]> get(KeyPath key) throws StoreException;

    void set(KeyPath key, byte[] value) throws StoreException;

    /**
     * Remove a key. Removing an absent key is not an error.
     */
    void delete(KeyPath key) throws StoreException;

    /**
     * List entries under a prefix in key order.
     *
     * @param prefix path every returned key starts with
     * @param startAfter exclusive lower bound, or null to start at the beginning of the prefix
     * @param limit maximum number of entries
     */
    List<Entry> list(KeyPath prefix, KeyPath startAfter, int limit) throws StoreException;

    default List<Entry> list(KeyPath prefix) throws StoreException {
        return list(prefix, null, Integer.MAX_VALUE);
    }

    /**
     * Count keys under a prefix without decoding values.
     */
    default long count(KeyPath prefix) throws StoreException {
        return list(prefix).size();
    }

    /**
     * Apply every mutation of the write if and only if all of its checks hold.
     *
     * @return false if a check failed or a concurrent writer won; nothing was written in that case
     */
    boolean commit(AtomicWrite write) throws StoreException;

    default AtomicWrite atomic() {
        return new AtomicWrite(this);
    }

    @Override
    void close();

    /**
     * One listed key-value pair.
     */
    final class Entry {
        private final KeyPath key;
        private final byte[] value;

        public Entry(KeyPath key, byte[] value) {
            this.key = key;
            this.value = value;
        }

        public KeyPath getKey() { return key; }
        public byte[] getValue() { return value; }
    }
}
