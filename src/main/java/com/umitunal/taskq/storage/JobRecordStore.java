package com.umitunal.taskq.storage;

import com.umitunal.taskq.core.Job;
import com.umitunal.taskq.core.Page;
import com.umitunal.taskq.core.StoreException;
import com.umitunal.taskq.model.JobRecord;
import com.umitunal.taskq.model.JobRecordSerializer;
import com.umitunal.taskq.serialization.CodecException;
import com.umitunal.taskq.serialization.PayloadCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Persistence of job records on a KeyValueStore.
 *
 * Key layout:
 * <pre>
 * ["jobs", id]                                              -&gt; serialized record
 * ["jobs_by_status", status, id]                            -&gt; empty
 * ["jobs_by_name", name, id]                                -&gt; empty
 * ["queue", "pending", invertedPriority, createdAt, id]     -&gt; empty, only while pending
 * </pre>
 * The record and its index entries always change in one atomic write, so the indexes never
 * disagree with the records they point at.
 *
 * <p>Listings skip records that can no longer be decoded (for example after a payload class
 * changed) and log them, so one unreadable job does not hide every other job.
 *
 * @param <T> the type of job payload
 */
public class JobRecordStore<T> {
    private static final Logger log = LoggerFactory.getLogger(JobRecordStore.class);

    private static final String JOBS = "jobs";
    private static final String BY_STATUS = "jobs_by_status";
    private static final String BY_NAME = "jobs_by_name";
    private static final KeyPath JOBS_PREFIX = KeyPath.of(JOBS);
    private static final KeyPath PENDING_PREFIX = KeyPath.of("queue", "pending");
    private static final int MAX_WRITE_ATTEMPTS = 8;
    private static final byte[] EMPTY = new byte[0];

    private final KeyValueStore store;
    private final JobRecordSerializer<T> serializer;
    private final Clock clock;

    public JobRecordStore(KeyValueStore store, PayloadCodec<T> codec) {
        this(store, codec, Clock.systemUTC());
    }

    public JobRecordStore(KeyValueStore store, PayloadCodec<T> codec, Clock clock) {
        this.store = store;
        this.serializer = new JobRecordSerializer<>(codec);
        this.clock = clock;
    }

    /**
     * Store a new job unless a job with the same id exists.
     *
     * @return false if the id was already taken
     */
    public boolean insert(JobRecord<T> job) throws StoreException {
        JobRecord<T> stamped = job.withUpdatedAt(now());
        AtomicWrite write = store.atomic().check(jobKey(job.getId()), null);
        addIndexWrites(write, stamped);
        return write.commit();
    }

    /**
     * Upsert a job, overwriting any record with the same id and moving its index entries.
     */
    public JobRecord<T> put(JobRecord<T> job) throws StoreException {
        JobRecord<T> stamped = job.withUpdatedAt(now());
        for (int attempt = 0; attempt < MAX_WRITE_ATTEMPTS; attempt++) {
            Optional<byte[]> previous = store.get(jobKey(job.getId()));
            AtomicWrite write = store.atomic().check(jobKey(job.getId()), previous.orElse(null));
            if (previous.isPresent()) {
                removeIndexWrites(write, decode(previous.get()));
            }
            addIndexWrites(write, stamped);
            if (write.commit()) {
                return stamped;
            }
        }
        throw new StoreException("Gave up writing job " + job.getId() + " after concurrent modifications");
    }

    /**
     * Replace a job only if the stored record is still the one the caller read
     * (same status and version). This is the compare-and-set behind claiming a job.
     *
     * @return the stored replacement, or empty if the record changed or disappeared
     */
    public Optional<JobRecord<T>> replace(JobRecord<T> expected, JobRecord<T> updated) throws StoreException {
        Optional<byte[]> current = store.get(jobKey(expected.getId()));
        if (current.isEmpty()) {
            return Optional.empty();
        }
        JobRecord<T> stored = decode(current.get());
        if (stored.getVersion() != expected.getVersion() || stored.getStatus() != expected.getStatus()) {
            return Optional.empty();
        }

        JobRecord<T> stamped = updated.withUpdatedAt(now());
        AtomicWrite write = store.atomic().check(jobKey(expected.getId()), current.get());
        removeIndexWrites(write, stored);
        addIndexWrites(write, stamped);
        return write.commit() ? Optional.of(stamped) : Optional.empty();
    }

    public Optional<JobRecord<T>> get(String id) throws StoreException {
        Optional<byte[]> bytes = store.get(jobKey(id));
        return bytes.isPresent() ? Optional.of(decode(bytes.get())) : Optional.empty();
    }

    /**
     * Remove a job and its index entries. Removing an unknown id is not an error.
     */
    public boolean delete(String id) throws StoreException {
        for (int attempt = 0; attempt < MAX_WRITE_ATTEMPTS; attempt++) {
            Optional<byte[]> previous = store.get(jobKey(id));
            if (previous.isEmpty()) {
                return false;
            }
            AtomicWrite write = store.atomic().check(jobKey(id), previous.get());
            removeIndexWrites(write, decode(previous.get()));
            if (write.commit()) {
                return true;
            }
        }
        throw new StoreException("Gave up deleting job " + id + " after concurrent modifications");
    }

    /**
     * Pending jobs whose run time has been reached, highest priority first, then oldest first.
     */
    public List<JobRecord<T>> listPending(Instant now) throws StoreException {
        List<JobRecord<T>> due = new ArrayList<>();
        for (KeyValueStore.Entry entry : store.list(PENDING_PREFIX)) {
            Optional<JobRecord<T>> job = readListed(entry.getKey().last());
            if (job.isPresent() && job.get().isDue(now)) {
                due.add(job.get());
            }
        }
        return due;
    }

    /**
     * One page of jobs with the given status, ordered by id.
     *
     * @param cursor id of the last job of the previous page, or null for the first page
     */
    public Page<JobRecord<T>> listByStatus(Job.Status status, int limit, String cursor) throws StoreException {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be at least 1: " + limit);
        }
        KeyPath prefix = statusPrefix(status);
        KeyPath startAfter = cursor != null ? prefix.child(cursor) : null;
        // One extra entry tells whether another page follows
        List<KeyValueStore.Entry> entries = store.list(prefix, startAfter, limit + 1);

        List<JobRecord<T>> jobs = new ArrayList<>();
        for (KeyValueStore.Entry entry : entries.subList(0, Math.min(limit, entries.size()))) {
            readListed(entry.getKey().last()).ifPresent(jobs::add);
        }
        String next = entries.size() > limit ? entries.get(limit - 1).getKey().last() : null;
        return new Page<>(jobs, next);
    }

    public List<JobRecord<T>> listByStatus(Job.Status status) throws StoreException {
        return loadAll(statusPrefix(status));
    }

    public List<JobRecord<T>> listByName(String name) throws StoreException {
        return loadAll(KeyPath.of(BY_NAME, name));
    }

    public List<JobRecord<T>> listAll() throws StoreException {
        List<JobRecord<T>> jobs = new ArrayList<>();
        for (KeyValueStore.Entry entry : store.list(JOBS_PREFIX)) {
            decodeListed(entry.getKey().last(), entry.getValue()).ifPresent(jobs::add);
        }
        return jobs;
    }

    public long count(Job.Status status) throws StoreException {
        return store.count(statusPrefix(status));
    }

    private List<JobRecord<T>> loadAll(KeyPath indexPrefix) throws StoreException {
        List<JobRecord<T>> jobs = new ArrayList<>();
        for (KeyValueStore.Entry entry : store.list(indexPrefix)) {
            readListed(entry.getKey().last()).ifPresent(jobs::add);
        }
        return jobs;
    }

    private Optional<JobRecord<T>> readListed(String id) throws StoreException {
        Optional<byte[]> bytes = store.get(jobKey(id));
        return bytes.isPresent() ? decodeListed(id, bytes.get()) : Optional.empty();
    }

    private Optional<JobRecord<T>> decodeListed(String id, byte[] bytes) {
        try {
            return Optional.of(serializer.deserialize(bytes));
        } catch (CodecException e) {
            log.error("Skipping job {}: stored record cannot be decoded", id, e);
            return Optional.empty();
        }
    }

    private void addIndexWrites(AtomicWrite write, JobRecord<T> job) {
        write.set(jobKey(job.getId()), serializer.serialize(job));
        write.set(statusPrefix(job.getStatus()).child(job.getId()), EMPTY);
        write.set(KeyPath.of(BY_NAME, job.getName(), job.getId()), EMPTY);
        if (job.getStatus() == Job.Status.PENDING) {
            write.set(pendingKey(job), EMPTY);
        }
    }

    private void removeIndexWrites(AtomicWrite write, JobRecord<T> job) {
        write.delete(jobKey(job.getId()));
        write.delete(statusPrefix(job.getStatus()).child(job.getId()));
        write.delete(KeyPath.of(BY_NAME, job.getName(), job.getId()));
        if (job.getStatus() == Job.Status.PENDING) {
            write.delete(pendingKey(job));
        }
    }

    private JobRecord<T> decode(byte[] bytes) throws StoreException {
        try {
            return serializer.deserialize(bytes);
        } catch (CodecException e) {
            throw new StoreException("Failed to decode job record", e);
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static KeyPath jobKey(String id) {
        return KeyPath.of(JOBS, id);
    }

    private static KeyPath statusPrefix(Job.Status status) {
        return KeyPath.of(BY_STATUS, status.name().toLowerCase(Locale.ROOT));
    }

    /**
     * Fixed-width decimal segments sort numerically; inverting the priority puts higher priorities first.
     */
    private static KeyPath pendingKey(JobRecord<?> job) {
        return PENDING_PREFIX
                .child(String.format("%010d", Integer.MAX_VALUE - job.getPriority()))
                .child(String.format("%019d", job.getCreatedAt().toEpochMilli()))
                .child(job.getId());
    }
}
