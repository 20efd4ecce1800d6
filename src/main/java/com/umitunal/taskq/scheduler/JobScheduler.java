package com.umitunal.taskq.scheduler;

import com.umitunal.taskq.config.SchedulerConfig;
import com.umitunal.taskq.core.StoreException;
import com.umitunal.taskq.cron.CronExpression;
import com.umitunal.taskq.cron.InvalidCronExpressionException;
import com.umitunal.taskq.model.Outcome;
import com.umitunal.taskq.model.ScheduleRecord;
import com.umitunal.taskq.storage.ScheduleStore;
import com.umitunal.taskq.worker.HandlerRegistry;
import com.umitunal.taskq.worker.PollingLoop;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Runs named handlers on cron schedules.
 *
 * <p>A background loop checks every {@link SchedulerConfig#getCheckInterval() check interval} for
 * enabled schedules whose next run has been reached, runs their handlers one after another, and
 * advances each to its next cron time whether the handler succeeded or not.
 *
 * <p>Schedules registered with {@link #schedulePersistent} are also written to a {@link ScheduleStore}
 * and can be restored after a restart with {@link #loadSchedules(ScheduleHandlerFactory)}.
 */
public class JobScheduler implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final SchedulerConfig config;
    private final Clock clock;
    private final ScheduleStore scheduleStore;
    private final HandlerRegistry<Entry> entries;
    private final Object lifecycleLock = new Object();

    private volatile PollingLoop loop;

    private JobScheduler(Builder builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.scheduleStore = builder.scheduleStore;
        this.entries = new HandlerRegistry<>("schedule", config.getScheduleRegistration());
    }

    public Schedule schedule(String name, String cron, ScheduleHandler handler) {
        return schedule(name, cron, handler, ScheduleOptions.defaults());
    }

    /**
     * Register a schedule that lives in memory only. The first run is the next cron time after now.
     *
     * @throws InvalidCronExpressionException if the cron expression is invalid
     */
    public Schedule schedule(String name, String cron, ScheduleHandler handler, ScheduleOptions options) {
        Entry entry = newEntry(name, cron, handler, options, null, null);
        Entry previous = entries.register(name, entry);
        if (previous != null) {
            retire(previous);
            if (previous.isPersistent()) {
                deleteQuietly(name);
            }
        }
        log.info("Scheduled '{}' ({}) next run at {}", name, cron, entry.nextRun);
        return entry.snapshot();
    }

    /**
     * Register a schedule and save it to the schedule store. {@code jobName} and {@code jobData} are
     * stored so that {@link #loadSchedules(ScheduleHandlerFactory)} can rebuild the handler.
     *
     * @throws IllegalStateException if no schedule store is configured
     */
    public Schedule schedulePersistent(String name, String cron, String jobName, Map<String, Object> jobData,
                                       ScheduleHandler handler, ScheduleOptions options) throws StoreException {
        requireStore();
        if (jobName == null || jobName.isBlank()) {
            throw new IllegalArgumentException("jobName must not be blank");
        }
        Entry entry = newEntry(name, cron, handler, options, jobName, jobData != null ? jobData : Map.of());
        Entry previous = entries.register(name, entry);
        if (previous != null) {
            retire(previous);
        }
        try {
            scheduleStore.save(entry.toRecord());
        } catch (StoreException e) {
            if (entries.revert(name, entry, previous) && previous != null) {
                synchronized (previous) {
                    previous.removed = false;
                }
            }
            throw e;
        }
        log.info("Scheduled persistent '{}' ({}) for job {}, next run at {}", name, cron, jobName, entry.nextRun);
        return entry.snapshot();
    }

    /**
     * Restore every saved schedule, rebuilding handlers with the factory. A saved next run that is
     * missing or already past is recomputed from now. Names already registered are left alone.
     *
     * @return number of schedules restored
     */
    public int loadSchedules(ScheduleHandlerFactory factory) throws StoreException {
        requireStore();
        Instant now = now();
        int loaded = 0;
        for (ScheduleRecord record : scheduleStore.loadAll()) {
            if (entries.contains(record.getName())) {
                log.warn("Schedule '{}' is already registered, stored definition not loaded", record.getName());
                continue;
            }
            Entry entry;
            try {
                entry = restore(record, factory, now);
            } catch (InvalidCronExpressionException | DateTimeException e) {
                log.error("Skipping stored schedule '{}': {}", record.getName(), e.getMessage());
                continue;
            }
            entries.register(record.getName(), entry);
            scheduleStore.save(entry.toRecord());
            loaded++;
        }
        log.info("Loaded {} persistent schedule(s)", loaded);
        return loaded;
    }

    /**
     * Remove a schedule, and its stored definition if it is persistent.
     *
     * @return false if no schedule had that name
     */
    public boolean unschedule(String name) throws StoreException {
        Optional<Entry> removed = entries.remove(name);
        if (removed.isEmpty()) {
            return false;
        }
        Entry entry = removed.get();
        synchronized (entry) {
            entry.removed = true;
        }
        if (entry.isPersistent() && scheduleStore != null) {
            scheduleStore.delete(name);
        }
        log.info("Unscheduled '{}'", name);
        return true;
    }

    /**
     * Enable a schedule. A next run that went by while it was disabled is moved to the next cron time
     * after now, so the missed run is not made up.
     *
     * @throws InvalidCronExpressionException if the cron expression has no run time left within its horizon
     *
     * @return false if no schedule had that name
     */
    public boolean enable(String name) throws StoreException {
        Optional<Entry> found = entries.find(name);
        if (found.isEmpty()) {
            return false;
        }
        Entry entry = found.get();
        Instant now = now();
        synchronized (entry) {
            if (entry.nextRun == null || !entry.nextRun.isAfter(now)) {
                entry.nextRun = entry.cron.nextRun(now, entry.zone);
            }
            entry.enabled = true;
        }
        persist(entry);
        log.info("Enabled schedule '{}', next run at {}", name, entry.snapshot().getNextRun());
        return true;
    }

    /**
     * @return false if no schedule had that name
     */
    public boolean disable(String name) throws StoreException {
        Optional<Entry> found = entries.find(name);
        if (found.isEmpty()) {
            return false;
        }
        Entry entry = found.get();
        synchronized (entry) {
            entry.enabled = false;
        }
        persist(entry);
        log.info("Disabled schedule '{}'", name);
        return true;
    }

    public Optional<Schedule> getSchedule(String name) {
        return entries.find(name).map(Entry::snapshot);
    }

    /**
     * All schedules, ordered by name.
     */
    public List<Schedule> getSchedules() {
        return entries.handlers().stream()
                .map(Entry::snapshot)
                .sorted(Comparator.comparing(Schedule::getName))
                .collect(Collectors.toList());
    }

    /**
     * Run a schedule's handler now on the calling thread, whether or not it is enabled or due.
     * The run is counted and the next run recomputed even when the handler fails.
     *
     * @throws ScheduleNotFoundException if no schedule has that name
     * @throws ScheduleExecutionException if the handler threw
     */
    public Schedule trigger(String name) throws ScheduleExecutionException, StoreException {
        Entry entry = entries.find(name).orElseThrow(() -> new ScheduleNotFoundException(name));
        Exception failure = execute(entry);
        if (failure != null) {
            throw new ScheduleExecutionException(name, failure);
        }
        return entry.snapshot();
    }

    /**
     * Run every enabled schedule that is due, one after another on the calling thread. Handler and
     * store failures are logged and do not stop the remaining schedules.
     *
     * @return number of schedules run
     */
    public int runDue() {
        Instant now = now();
        List<Entry> due = entries.handlers().stream()
                .filter(entry -> entry.isDue(now))
                .sorted(Comparator.comparing((Entry entry) -> entry.name))
                .collect(Collectors.toList());

        int ran = 0;
        for (Entry entry : due) {
            entry.runLock.lock();
            try {
                // A trigger or an earlier tick may have run it since it was selected
                if (!entry.isDue(now)) {
                    continue;
                }
                Exception failure = execute(entry);
                if (failure != null) {
                    log.error("Schedule '{}' failed: {}", entry.name, Outcome.failure(failure).getMessage(), failure);
                }
                ran++;
            } catch (StoreException e) {
                log.error("Failed to save state of schedule '{}'", entry.name, e);
                ran++;
            } catch (RuntimeException e) {
                log.error("Unexpected failure running schedule '{}'", entry.name, e);
            } finally {
                entry.runLock.unlock();
            }
        }
        return ran;
    }

    /**
     * Begin checking for due schedules in the background. Calling it while already running does nothing.
     */
    public void start() {
        synchronized (lifecycleLock) {
            if (loop != null) {
                return;
            }
            loop = new PollingLoop("taskq-scheduler", config.getCheckInterval(), this::runDue,
                    config.getShutdownTimeout());
            loop.start();
            log.info("Scheduler started with {} schedule(s), check interval {}",
                    entries.names().size(), config.getCheckInterval());
        }
    }

    /**
     * Stop the background loop, waiting for the schedule it is running to finish.
     */
    public void stop() {
        PollingLoop stopping;
        synchronized (lifecycleLock) {
            stopping = loop;
            loop = null;
        }
        if (stopping != null) {
            stopping.stop();
            log.info("Scheduler stopped");
        }
    }

    public boolean isRunning() {
        PollingLoop current = loop;
        return current != null && current.isRunning();
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Run the handler and record the run.
     *
     * @return the handler's exception, or null if it succeeded
     */
    private Exception execute(Entry entry) throws StoreException {
        entry.runLock.lock();
        try {
            Instant startedAt = now();
            Exception failure = null;
            try {
                entry.handler.run();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failure = e;
            } catch (Exception e) {
                failure = e;
            }

            Instant nextRun = null;
            String exhausted = null;
            try {
                nextRun = entry.cron.nextRun(startedAt, entry.zone);
            } catch (InvalidCronExpressionException e) {
                exhausted = e.getMessage();
            }

            long runCount;
            synchronized (entry) {
                runCount = ++entry.runCount;
                entry.lastRun = startedAt;
                entry.lastError = failure != null ? Outcome.failure(failure).getMessage() : exhausted;
                entry.nextRun = nextRun;
                if (exhausted != null) {
                    entry.enabled = false;
                }
            }
            persist(entry);
            if (exhausted != null) {
                log.error("Schedule '{}' disabled after run {}: {}", entry.name, runCount, exhausted);
            } else {
                log.debug("Ran schedule '{}' (run {}), next run at {}", entry.name, runCount, nextRun);
            }
            return failure;
        } finally {
            entry.runLock.unlock();
        }
    }

    /**
     * Keep a replaced entry's in-flight run from writing its state over the new entry.
     */
    private static void retire(Entry previous) {
        synchronized (previous) {
            previous.removed = true;
        }
    }

    private Entry newEntry(String name, String cron, ScheduleHandler handler, ScheduleOptions options,
                           String jobName, Map<String, Object> jobData) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("schedule name must not be blank");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        ScheduleOptions opts = options != null ? options : ScheduleOptions.defaults();
        CronExpression expression = CronExpression.parse(cron);
        ZoneId zone = opts.getZone() != null ? opts.getZone() : config.getDefaultZone();

        Entry entry = new Entry(name, expression, zone, handler, jobName, jobData);
        entry.enabled = opts.isEnabled();
        entry.nextRun = expression.nextRun(now(), zone);
        return entry;
    }

    private Entry restore(ScheduleRecord record, ScheduleHandlerFactory factory, Instant now) {
        CronExpression expression = CronExpression.parse(record.getCron());
        ZoneId zone = record.getZone() != null ? ZoneId.of(record.getZone()) : config.getDefaultZone();
        ScheduleHandler handler = factory.create(record.getJobName(), record.getJobData());

        Entry entry = new Entry(record.getName(), expression, zone, handler, record.getJobName(), record.getJobData());
        entry.enabled = record.isEnabled();
        entry.runCount = record.getRunCount();
        entry.lastRun = record.getLastRun() != null ? Instant.ofEpochMilli(record.getLastRun()) : null;
        Instant saved = record.getNextRun() != null ? Instant.ofEpochMilli(record.getNextRun()) : null;
        entry.nextRun = saved != null && saved.isAfter(now) ? saved : expression.nextRun(now, zone);
        return entry;
    }

    private void persist(Entry entry) throws StoreException {
        if (!entry.isPersistent() || scheduleStore == null) {
            return;
        }
        ScheduleRecord record;
        synchronized (entry) {
            if (entry.removed) {
                return;
            }
            record = entry.toRecord();
        }
        scheduleStore.save(record);
    }

    private void deleteQuietly(String name) {
        if (scheduleStore == null) {
            return;
        }
        try {
            scheduleStore.delete(name);
        } catch (StoreException e) {
            log.warn("Failed to delete stored schedule '{}' after it was replaced", name, e);
        }
    }

    private void requireStore() {
        if (scheduleStore == null) {
            throw new IllegalStateException("No schedule store configured");
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SchedulerConfig config = SchedulerConfig.defaults();
        private Clock clock = Clock.systemUTC();
        private ScheduleStore scheduleStore;

        private Builder() {
        }

        public Builder withConfig(SchedulerConfig config) {
            this.config = config;
            return this;
        }

        public Builder withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * Store used by persistent schedules. Optional.
         */
        public Builder withScheduleStore(ScheduleStore scheduleStore) {
            this.scheduleStore = scheduleStore;
            return this;
        }

        public JobScheduler build() {
            if (config == null || clock == null) {
                throw new IllegalArgumentException("config and clock are required");
            }
            return new JobScheduler(this);
        }
    }

    /**
     * Mutable state of one schedule. Fields below the handler are guarded by the entry's monitor;
     * {@code runLock} keeps two runs of the same schedule from overlapping.
     */
    private static final class Entry {
        final String name;
        final CronExpression cron;
        final ZoneId zone;
        final ScheduleHandler handler;
        final String jobName;
        final Map<String, Object> jobData;
        final ReentrantLock runLock = new ReentrantLock();

        boolean enabled;
        // null once the cron expression has no run time left within its horizon
        Instant nextRun;
        Instant lastRun;
        long runCount;
        String lastError;
        boolean removed;

        Entry(String name, CronExpression cron, ZoneId zone, ScheduleHandler handler,
              String jobName, Map<String, Object> jobData) {
            this.name = name;
            this.cron = cron;
            this.zone = zone;
            this.handler = handler;
            this.jobName = jobName;
            this.jobData = jobData;
        }

        boolean isPersistent() {
            return jobName != null;
        }

        synchronized boolean isDue(Instant now) {
            return enabled && !removed && nextRun != null && !nextRun.isAfter(now);
        }

        synchronized Schedule snapshot() {
            return new Schedule(name, cron.getExpression(), zone, enabled, nextRun, lastRun, runCount,
                    lastError, jobName);
        }

        synchronized ScheduleRecord toRecord() {
            return new ScheduleRecord(name, cron.getExpression(), zone.getId(), enabled,
                    nextRun != null ? nextRun.toEpochMilli() : null,
                    lastRun != null ? lastRun.toEpochMilli() : null,
                    runCount, jobName, jobData);
        }
    }
}
