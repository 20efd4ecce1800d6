package com.umitunal.taskq.storage;

import com.umitunal.taskq.core.StoreException;
import com.umitunal.taskq.model.ScheduleRecord;
import com.umitunal.taskq.serialization.CodecException;
import com.umitunal.taskq.serialization.JsonCodec;
import com.umitunal.taskq.serialization.PayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Persistence of schedule definitions as JSON under {@code ["schedules", name]}.
 */
public class ScheduleStore {
    private static final Logger log = LoggerFactory.getLogger(ScheduleStore.class);
    private static final KeyPath SCHEDULES_PREFIX = KeyPath.of("schedules");

    private final KeyValueStore store;
    private final PayloadCodec<ScheduleRecord> codec;

    public ScheduleStore(KeyValueStore store) {
        this(store, new JsonCodec<>(ScheduleRecord.class));
    }

    public ScheduleStore(KeyValueStore store, PayloadCodec<ScheduleRecord> codec) {
        this.store = store;
        this.codec = codec;
    }

    public void save(ScheduleRecord record) throws StoreException {
        store.set(SCHEDULES_PREFIX.child(record.getName()), codec.encode(record));
    }

    public Optional<ScheduleRecord> load(String name) throws StoreException {
        Optional<byte[]> bytes = store.get(SCHEDULES_PREFIX.child(name));
        return bytes.isPresent() ? Optional.of(decode(bytes.get())) : Optional.empty();
    }

    /**
     * Every readable schedule record. Records that cannot be decoded are logged and left out.
     */
    public List<ScheduleRecord> loadAll() throws StoreException {
        List<ScheduleRecord> records = new ArrayList<>();
        for (KeyValueStore.Entry entry : store.list(SCHEDULES_PREFIX)) {
            try {
                records.add(codec.decode(entry.getValue()));
            } catch (CodecException e) {
                log.error("Skipping stored schedule '{}': record cannot be decoded", entry.getKey().last(), e);
            }
        }
        return records;
    }

    public void delete(String name) throws StoreException {
        store.delete(SCHEDULES_PREFIX.child(name));
    }

    private ScheduleRecord decode(byte[] bytes) throws StoreException {
        try {
            return codec.decode(bytes);
        } catch (CodecException e) {
            throw new StoreException("Failed to decode schedule record", e);
        }
    }
}
