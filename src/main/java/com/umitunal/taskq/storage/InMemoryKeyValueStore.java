package com.umitunal.taskq.storage;

import com.umitunal.taskq.core.StoreException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Non-durable KeyValueStore kept in an ordered in-process map.
 * Suitable for tests and for embedding where losing queued work on restart is acceptable.
 */
public class InMemoryKeyValueStore implements KeyValueStore {
    private final ConcurrentSkipListMap<byte[], byte[]> entries =
            new ConcurrentSkipListMap<>(Arrays::compareUnsigned);
    private final Object writeLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    @Override
    public Optional<byte[]> get(KeyPath key) throws StoreException {
        ensureOpen();
        byte[] value = entries.get(key.encodedView());
        return value != null ? Optional.of(value.clone()) : Optional.empty();
    }

    @Override
    public void set(KeyPath key, byte[] value) throws StoreException {
        ensureOpen();
        synchronized (writeLock) {
            entries.put(key.toBytes(), value.clone());
        }
    }

    @Override
    public void delete(KeyPath key) throws StoreException {
        ensureOpen();
        synchronized (writeLock) {
            entries.remove(key.encodedView());
        }
    }

    @Override
    public List<Entry> list(KeyPath prefix, KeyPath startAfter, int limit) throws StoreException {
        ensureOpen();
        byte[] prefixBytes = prefix.encodedView();
        NavigableMap<byte[], byte[]> range = startAfter != null && startAfter.compareTo(prefix) > 0
                ? entries.tailMap(startAfter.encodedView(), false)
                : entries.tailMap(prefixBytes, true);

        List<Entry> result = new ArrayList<>();
        for (Map.Entry<byte[], byte[]> entry : range.entrySet()) {
            if (result.size() >= limit || !KeyPath.hasPrefix(entry.getKey(), prefixBytes)) {
                break;
            }
            result.add(new Entry(KeyPath.fromBytes(entry.getKey()), entry.getValue().clone()));
        }
        return result;
    }

    @Override
    public boolean commit(AtomicWrite write) throws StoreException {
        ensureOpen();
        synchronized (writeLock) {
            for (AtomicWrite.Check check : write.getChecks()) {
                byte[] current = entries.get(check.getKey().encodedView());
                if (!Arrays.equals(current, check.getExpected())) {
                    return false;
                }
            }
            for (AtomicWrite.Mutation mutation : write.getMutations()) {
                if (mutation.isDelete()) {
                    entries.remove(mutation.getKey().encodedView());
                } else {
                    entries.put(mutation.getKey().toBytes(), mutation.getValue().clone());
                }
            }
            return true;
        }
    }

    public int size() {
        return entries.size();
    }

    @Override
    public void close() {
        closed.set(true);
    }

    private void ensureOpen() throws StoreException {
        if (closed.get()) {
            throw new StoreException("Store is closed");
        }
    }
}
