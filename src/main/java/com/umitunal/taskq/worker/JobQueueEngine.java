package com.umitunal.taskq.worker;

import com.umitunal.taskq.config.QueueConfig;
import com.umitunal.taskq.core.Job;
import com.umitunal.taskq.core.JobFilter;
import com.umitunal.taskq.core.JobHandler;
import com.umitunal.taskq.core.JobOptions;
import com.umitunal.taskq.core.JobQueue;
import com.umitunal.taskq.core.QueueStats;
import com.umitunal.taskq.core.StoreException;
import com.umitunal.taskq.model.JobLifecycle;
import com.umitunal.taskq.model.JobRecord;
import com.umitunal.taskq.model.Outcome;
import com.umitunal.taskq.serialization.PayloadCodec;
import com.umitunal.taskq.storage.JobRecordStore;
import com.umitunal.taskq.storage.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Job queue that polls the record store for due jobs and runs them on a fixed worker pool.
 *
 * <p>Each tick claims at most as many due jobs as there are free worker slots, highest priority
 * first. Claiming is a compare-and-set on the stored record, so a job is never dispatched twice.
 * Failed attempts go back to pending with a backed-off run time until retries run out.
 *
 * <p>Only one started engine may work on a given store at a time.
 *
 * @param <T> the type of job payload
 */
public class JobQueueEngine<T> implements JobQueue<T> {
    private static final Logger log = LoggerFactory.getLogger(JobQueueEngine.class);
    static final String INTERRUPTED_ERROR = "Interrupted before completion";

    private final JobRecordStore<T> store;
    private final QueueConfig config;
    private final Clock clock;
    private final HandlerRegistry<JobHandler<T>> handlers;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicLong completedCount = new AtomicLong(0);
    private final AtomicLong failedAttemptCount = new AtomicLong(0);
    private final Object lifecycleLock = new Object();

    private volatile PollingLoop loop;
    private volatile ExecutorService workers;

    private JobQueueEngine(Builder<T> builder) {
        this.config = builder.config;
        this.clock = builder.clock;
        this.store = new JobRecordStore<>(builder.kvStore, builder.codec, builder.clock);
        this.handlers = new HandlerRegistry<>("job handler", config.getHandlerRegistration());
    }

    @Override
    public String add(String name, T data, JobOptions options) throws StoreException {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        if (options == null) {
            throw new IllegalArgumentException("options must not be null");
        }

        Instant now = now();
        String id = options.getJobId() != null ? options.getJobId() : UUID.randomUUID().toString();
        int priority = options.getPriority() != null ? options.getPriority() : config.getDefaultPriority();
        int maxRetries = options.getMaxRetries() != null ? options.getMaxRetries() : config.getDefaultMaxRetries();
        Instant runAt = options.resolveRunAt(now).truncatedTo(ChronoUnit.MILLIS);

        JobRecord<T> job = JobRecord.pending(id, name, data, priority, maxRetries, runAt, now);
        if (!store.insert(job)) {
            if (store.get(id).isEmpty()) {
                throw new StoreException("Concurrent modification while adding job " + id);
            }
            log.debug("Job {} already exists, not added again", id);
            return id;
        }

        log.debug("Added job {} ({}) priority={} runAt={}", id, name, priority, runAt);
        PollingLoop current = loop;
        if (current != null && !runAt.isAfter(now)) {
            // Due already, so dispatch it without waiting out the poll interval
            current.wakeUp();
        }
        return id;
    }

    /**
     * Register the handler for jobs of the given name. Whether a second registration replaces the
     * first or is rejected depends on {@link QueueConfig#getHandlerRegistration()}.
     */
    @Override
    public void process(String name, JobHandler<T> handler) {
        handlers.register(name, handler);
    }

    /**
     * Recover jobs left running by a previous process, then start polling.
     */
    @Override
    public void start() throws StoreException {
        synchronized (lifecycleLock) {
            if (loop != null) {
                return;
            }
            int recovered = recoverInterrupted();

            workers = Executors.newFixedThreadPool(config.getMaxConcurrency(), new WorkerThreadFactory());
            loop = new PollingLoop("taskq-poller", config.getPollInterval(), this::dispatchDue,
                    config.getShutdownTimeout());
            loop.start();
            log.info("Job queue started (maxConcurrency={}, pollInterval={}, recovered={})",
                    config.getMaxConcurrency(), config.getPollInterval(), recovered);
        }
    }

    /**
     * Stop dispatching and wait up to the shutdown timeout for running handlers. Handlers still
     * running after that keep running; their jobs are recovered by the next start().
     */
    @Override
    public void stop() {
        PollingLoop stoppingLoop;
        ExecutorService stoppingWorkers;
        synchronized (lifecycleLock) {
            stoppingLoop = loop;
            stoppingWorkers = workers;
            loop = null;
            workers = null;
        }
        if (stoppingLoop == null) {
            return;
        }

        stoppingLoop.stop();
        stoppingWorkers.shutdown();
        try {
            long timeoutMillis = config.getShutdownTimeout().toMillis();
            if (!stoppingWorkers.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Job queue stopped with {} job(s) still running after {}",
                        inFlight.size(), config.getShutdownTimeout());
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Job queue stopped");
    }

    @Override
    public boolean isRunning() {
        PollingLoop current = loop;
        return current != null && current.isRunning();
    }

    /**
     * Claim and run every due job on the calling thread, in dispatch order.
     *
     * @return number of jobs executed
     */
    public int processDue() throws StoreException {
        Instant now = now();
        int executed = 0;
        for (JobRecord<T> job : store.listPending(now)) {
            Optional<JobRecord<T>> claimed = claim(job, now);
            if (claimed.isEmpty()) {
                continue;
            }
            inFlight.add(job.getId());
            try {
                execute(claimed.get());
            } finally {
                inFlight.remove(job.getId());
            }
            executed++;
        }
        return executed;
    }

    /**
     * Fail every running job this engine is not executing, as if its handler had thrown.
     * Such jobs were left behind by a process that stopped mid-execution.
     *
     * @return number of jobs recovered
     */
    public int recoverInterrupted() throws StoreException {
        Instant now = now();
        int recovered = 0;
        for (JobRecord<T> job : store.listByStatus(Job.Status.RUNNING)) {
            if (inFlight.contains(job.getId())) {
                continue;
            }
            JobRecord<T> failed = JobLifecycle.fail(job, INTERRUPTED_ERROR, now, config.getRetryBackoff());
            if (store.replace(job, failed).isPresent()) {
                log.warn("Recovered interrupted job {} ({}) as {}", job.getId(), job.getName(), failed.getStatus());
                recovered++;
            }
        }
        return recovered;
    }

    @Override
    public Optional<Job<T>> getJob(String id) throws StoreException {
        return store.get(id).map(job -> (Job<T>) job);
    }

    /**
     * Jobs matching the filter, ordered by id. Name and status filters are served from their indexes.
     */
    @Override
    public List<Job<T>> listJobs(JobFilter filter) throws StoreException {
        List<JobRecord<T>> candidates;
        if (filter.getName() != null) {
            candidates = store.listByName(filter.getName());
        } else if (filter.getStatus() != null) {
            candidates = store.listByStatus(filter.getStatus());
        } else {
            candidates = store.listAll();
        }
        return candidates.stream()
                .filter(filter::matches)
                .skip(filter.getOffset())
                .limit(filter.getLimit())
                .map(job -> (Job<T>) job)
                .collect(Collectors.toList());
    }

    @Override
    public QueueStats getStats() throws StoreException {
        return new QueueStats(
                store.count(Job.Status.PENDING),
                store.count(Job.Status.RUNNING),
                store.count(Job.Status.COMPLETED),
                store.count(Job.Status.FAILED));
    }

    @Override
    public void delete(String id) throws StoreException {
        if (store.delete(id)) {
            log.debug("Deleted job {}", id);
        }
    }

    @Override
    public long cleanup(Instant olderThan) throws StoreException {
        long deleted = 0;
        for (Job.Status status : List.of(Job.Status.COMPLETED, Job.Status.FAILED)) {
            for (JobRecord<T> job : store.listByStatus(status)) {
                Instant completedAt = job.getCompletedAt();
                if (completedAt != null && completedAt.isBefore(olderThan) && store.delete(job.getId())) {
                    deleted++;
                }
            }
        }
        if (deleted > 0) {
            log.info("Cleaned up {} job(s) completed before {}", deleted, olderThan);
        }
        return deleted;
    }

    /**
     * Delete terminal jobs older than the configured retention.
     */
    public long cleanup() throws StoreException {
        return cleanup(now().minus(config.getCleanupRetention()));
    }

    public int getInFlightCount() {
        return inFlight.size();
    }

    public long getCompletedCount() {
        return completedCount.get();
    }

    /**
     * Number of attempts that ended in failure, retried or not.
     */
    public long getFailedAttemptCount() {
        return failedAttemptCount.get();
    }

    public QueueConfig getConfig() {
        return config;
    }

    @Override
    public void close() {
        stop();
    }

    private void dispatchDue() throws StoreException {
        int freeSlots = config.getMaxConcurrency() - inFlight.size();
        if (freeSlots <= 0) {
            return;
        }

        Instant now = now();
        for (JobRecord<T> job : store.listPending(now)) {
            ExecutorService pool = workers;
            if (freeSlots == 0 || pool == null) {
                break;
            }
            Optional<JobRecord<T>> claimed = claim(job, now);
            if (claimed.isEmpty()) {
                continue;
            }
            freeSlots--;
            submit(pool, claimed.get());
        }
    }

    private void submit(ExecutorService pool, JobRecord<T> job) {
        inFlight.add(job.getId());
        try {
            pool.execute(() -> {
                try {
                    execute(job);
                } finally {
                    inFlight.remove(job.getId());
                }
            });
        } catch (RejectedExecutionException e) {
            inFlight.remove(job.getId());
            log.warn("Worker pool shut down before job {} could run; it will be recovered on next start", job.getId());
        }
    }

    private Optional<JobRecord<T>> claim(JobRecord<T> job, Instant now) throws StoreException {
        Optional<JobRecord<T>> claimed = store.replace(job, JobLifecycle.start(job, now));
        if (claimed.isPresent()) {
            log.debug("Claimed job {} ({}) attempt {}", job.getId(), job.getName(), claimed.get().getAttempts());
        }
        return claimed;
    }

    private void execute(JobRecord<T> job) {
        Outcome outcome = invoke(job);
        JobRecord<T> finished = JobLifecycle.finish(job, outcome, now(), config.getRetryBackoff());

        try {
            if (store.replace(job, finished).isEmpty()) {
                log.debug("Job {} changed while running, outcome {} discarded", job.getId(), outcome);
                return;
            }
        } catch (StoreException e) {
            log.error("Failed to record outcome of job {} ({})", job.getId(), job.getName(), e);
            return;
        }

        if (outcome.isSuccess()) {
            completedCount.incrementAndGet();
            log.debug("Job {} ({}) completed on attempt {}", job.getId(), job.getName(), job.getAttempts());
            return;
        }
        failedAttemptCount.incrementAndGet();
        if (finished.getStatus() == Job.Status.PENDING) {
            log.warn("Job {} ({}) failed on attempt {}/{}, retrying at {}: {}", job.getId(), job.getName(),
                    job.getAttempts(), job.getMaxRetries() + 1, finished.getRunAt(), outcome.getMessage());
        } else {
            log.error("Job {} ({}) failed permanently after {} attempt(s): {}", job.getId(), job.getName(),
                    job.getAttempts(), outcome.getMessage());
        }
    }

    private Outcome invoke(JobRecord<T> job) {
        Optional<JobHandler<T>> handler = handlers.find(job.getName());
        if (handler.isEmpty()) {
            return Outcome.failure("No handler registered for job: " + job.getName());
        }
        try {
            handler.get().handle(job);
            return Outcome.success();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Outcome.failure(e);
        } catch (Exception e) {
            return Outcome.failure(e);
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public static <T> Builder<T> builder(KeyValueStore kvStore, PayloadCodec<T> codec) {
        return new Builder<>(kvStore, codec);
    }

    public static class Builder<T> {
        private final KeyValueStore kvStore;
        private final PayloadCodec<T> codec;
        private QueueConfig config = QueueConfig.defaults();
        private Clock clock = Clock.systemUTC();

        private Builder(KeyValueStore kvStore, PayloadCodec<T> codec) {
            this.kvStore = kvStore;
            this.codec = codec;
        }

        public Builder<T> withConfig(QueueConfig config) {
            this.config = config;
            return this;
        }

        public Builder<T> withClock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public JobQueueEngine<T> build() {
            if (kvStore == null || codec == null || config == null || clock == null) {
                throw new IllegalArgumentException("store, codec, config and clock are required");
            }
            return new JobQueueEngine<>(this);
        }
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);

        @Override
        public Thread newThread(Runnable task) {
            Thread thread = new Thread(task, "taskq-worker-" + counter.incrementAndGet());
            thread.setDaemon(false);
            return thread;
        }
    }
}
