package com.umitunal.taskq.storage;

import com.umitunal.taskq.core.StoreException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A group of checks and mutations committed all-or-nothing.
 *
 * <pre>
 * boolean ok = store.atomic()
 *         .check(key, expectedBytes)
 *         .set(key, newBytes)
 *         .delete(indexKey)
 *         .commit();
 * </pre>
 */
public final class AtomicWrite {
    private final KeyValueStore store;
    private final List<Check> checks = new ArrayList<>();
    private final List<Mutation> mutations = new ArrayList<>();

    AtomicWrite(KeyValueStore store) {
        this.store = store;
    }

    /**
     * Require the current value of {@code key} to equal {@code expected}; null requires the key to be absent.
     */
    public AtomicWrite check(KeyPath key, byte[] expected) {
        checks.add(new Check(key, expected));
        return this;
    }

    public AtomicWrite set(KeyPath key, byte[] value) {
        mutations.add(new Mutation(key, value));
        return this;
    }

    public AtomicWrite delete(KeyPath key) {
        mutations.add(new Mutation(key, null));
        return this;
    }

    public boolean commit() throws StoreException {
        return store.commit(this);
    }

    public List<Check> getChecks() {
        return Collections.unmodifiableList(checks);
    }

    public List<Mutation> getMutations() {
        return Collections.unmodifiableList(mutations);
    }

    public static final class Check {
        private final KeyPath key;
        private final byte[] expected;

        private Check(KeyPath key, byte[] expected) {
            this.key = key;
            this.expected = expected;
        }

        public KeyPath getKey() { return key; }
        public byte[] getExpected() { return expected; }
    }

    public static final class Mutation {
        private final KeyPath key;
        private final byte[] value;

        private Mutation(KeyPath key, byte[] value) {
            this.key = key;
            this.value = value;
        }

        public KeyPath getKey() { return key; }

        /**
         * The value to write, or null for a delete.
         */
        public byte[] getValue() { return value; }

        public boolean isDelete() { return value == null; }
    }
}
