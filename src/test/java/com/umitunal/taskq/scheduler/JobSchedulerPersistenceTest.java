package com.umitunal.taskq.scheduler;

import com.umitunal.taskq.config.StorageConfig;
import com.umitunal.taskq.core.Job;
import com.umitunal.taskq.core.JobFilter;
import com.umitunal.taskq.core.StoreException;
import com.umitunal.taskq.cron.CronPatterns;
import com.umitunal.taskq.model.ScheduleRecord;
import com.umitunal.taskq.serialization.JsonCodec;
import com.umitunal.taskq.storage.InMemoryKeyValueStore;
import com.umitunal.taskq.storage.KeyPath;
import com.umitunal.taskq.storage.KeyValueStore;
import com.umitunal.taskq.storage.RocksKeyValueStore;
import com.umitunal.taskq.storage.ScheduleStore;
import com.umitunal.taskq.testing.MutableClock;
import com.umitunal.taskq.worker.JobQueueEngine;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.assertj.core.api.Assertions.*;

class JobSchedulerPersistenceTest {

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private KeyValueStore kv;

    @BeforeEach
    void setUp() throws Exception {
        clock = MutableClock.at("2024-03-10T08:15:00Z");
        kv = openStore();
    }

    @AfterEach
    void tearDown() {
        kv.close();
    }

    private KeyValueStore openStore() throws Exception {
        return new RocksKeyValueStore(StorageConfig.newBuilder(tempDir.resolve("db").toString())
                .withDurableWrites(false)
                .build());
    }

    private JobScheduler scheduler(KeyValueStore store) {
        return JobScheduler.builder()
                .withClock(clock)
                .withScheduleStore(new ScheduleStore(store))
                .build();
    }

    @Test
    @DisplayName("Persistent schedule is saved with its job name and data")
    void testSchedulePersistent() throws Exception {
        // Given
        JobScheduler scheduler = scheduler(kv);

        // When
        Schedule schedule = scheduler.schedulePersistent("nightly-cleanup", CronPatterns.DAILY_3AM, "cleanup-temp",
                Map.of("dir", "/tmp"), () -> { }, ScheduleOptions.defaults());

        // Then
        ScheduleRecord stored = new ScheduleStore(kv).load("nightly-cleanup").orElseThrow();
        assertThat(schedule.isPersistent()).isTrue();
        assertThat(schedule.getJobName()).isEqualTo("cleanup-temp");
        assertThat(stored.getCron()).isEqualTo(CronPatterns.DAILY_3AM);
        assertThat(stored.getJobData()).containsEntry("dir", "/tmp");
        assertThat(stored.getNextRun()).isEqualTo(Instant.parse("2024-03-11T03:00:00Z").toEpochMilli());
        assertThat(stored.isEnabled()).isTrue();
    }

    @Test
    @DisplayName("Runs, enable state and unschedule are written through to the store")
    void testStateIsPersisted() throws Exception {
        JobScheduler scheduler = scheduler(kv);
        ScheduleStore store = new ScheduleStore(kv);
        scheduler.schedulePersistent("tick", CronPatterns.EVERY_MINUTE, "noop", Map.of(), () -> { },
                ScheduleOptions.defaults());

        scheduler.trigger("tick");
        assertThat(store.load("tick").orElseThrow().getRunCount()).isEqualTo(1);
        assertThat(store.load("tick").orElseThrow().getLastRun()).isEqualTo(clock.instant().toEpochMilli());

        scheduler.disable("tick");
        assertThat(store.load("tick").orElseThrow().isEnabled()).isFalse();

        scheduler.unschedule("tick");
        assertThat(store.load("tick")).isEmpty();
    }

    @Test
    @DisplayName("Replacing a persistent schedule with an in-memory one deletes the stored record")
    void testReplaceDropsStoredRecord() throws Exception {
        JobScheduler scheduler = scheduler(kv);
        scheduler.schedulePersistent("report", CronPatterns.DAILY, "report", Map.of(), () -> { },
                ScheduleOptions.defaults());

        scheduler.schedule("report", CronPatterns.DAILY, () -> { });

        assertThat(new ScheduleStore(kv).load("report")).isEmpty();
        assertThat(scheduler.getSchedule("report").orElseThrow().isPersistent()).isFalse();
    }

    @Test
    @DisplayName("Restored schedules enqueue jobs through the factory after a restart")
    void testRestoreAfterRestart() throws Exception {
        // Given a schedule saved by a previous process
        JobScheduler first = scheduler(kv);
        first.schedulePersistent("hourly-report", CronPatterns.EVERY_HOUR, "build-report",
                Map.of("format", "pdf"), () -> { }, ScheduleOptions.defaults());
        first.trigger("hourly-report");
        first.close();
        kv.close();

        // When the process restarts two hours later
        clock.advance(Duration.ofHours(2));
        kv = openStore();
        JobQueueEngine<Map<String, Object>> queue = JobQueueEngine.builder(kv, JsonCodec.forMap())
                .withClock(clock)
                .build();
        List<Map<String, Object>> handled = new CopyOnWriteArrayList<>();
        queue.process("build-report", job -> handled.add(job.getData()));
        JobScheduler restored = scheduler(kv);
        int loaded = restored.loadSchedules(ScheduleHandlerFactory.enqueueing(queue));

        // Then the stale next run is recomputed from now and history is kept
        Schedule schedule = restored.getSchedule("hourly-report").orElseThrow();
        assertThat(loaded).isEqualTo(1);
        assertThat(schedule.getRunCount()).isEqualTo(1);
        assertThat(schedule.getNextRun()).isEqualTo(Instant.parse("2024-03-10T11:00:00Z"));

        // When the schedule fires
        clock.set(Instant.parse("2024-03-10T11:00:00Z"));
        assertThat(restored.runDue()).isEqualTo(1);
        queue.processDue();

        // Then the job it enqueued has been processed
        assertThat(handled).containsExactly(Map.of("format", "pdf"));
        assertThat(queue.listJobs(JobFilter.byStatus(Job.Status.COMPLETED)))
                .extracting(Job::getName).containsExactly("build-report");
        queue.close();
        restored.close();
    }

    @Test
    @DisplayName("Loading keeps already registered schedules and skips unreadable definitions")
    void testLoadSkipsRegisteredAndInvalid() throws Exception {
        // Given
        InMemoryKeyValueStore memory = new InMemoryKeyValueStore();
        ScheduleStore store = new ScheduleStore(memory);
        store.save(new ScheduleRecord("valid", CronPatterns.EVERY_HOUR, "UTC", true, null, null, 0, "job", Map.of()));
        store.save(new ScheduleRecord("bad-cron", "99 * * * *", "UTC", true, null, null, 0, "job", Map.of()));
        store.save(new ScheduleRecord("bad-zone", CronPatterns.EVERY_HOUR, "Mars/Olympus", true, null, null, 0,
                "job", Map.of()));
        store.save(new ScheduleRecord("taken", CronPatterns.EVERY_HOUR, "UTC", true, null, null, 0, "job", Map.of()));
        JobScheduler scheduler = JobScheduler.builder().withClock(clock).withScheduleStore(store).build();
        scheduler.schedule("taken", CronPatterns.DAILY, () -> { });

        // When
        int loaded = scheduler.loadSchedules((jobName, jobData) -> () -> { });

        // Then
        assertThat(loaded).isEqualTo(1);
        assertThat(scheduler.getSchedules()).extracting(Schedule::getName).containsExactly("taken", "valid");
        assertThat(scheduler.getSchedule("taken").orElseThrow().getCron()).isEqualTo(CronPatterns.DAILY);
        assertThat(scheduler.getSchedule("valid").orElseThrow().getNextRun())
                .isEqualTo(Instant.parse("2024-03-10T09:00:00Z"));
    }

    @Test
    @DisplayName("A failed save leaves the schedule unregistered")
    void testSaveFailureRollsBack() throws Exception {
        // Given
        InMemoryKeyValueStore memory = new InMemoryKeyValueStore();
        JobScheduler scheduler = JobScheduler.builder().withClock(clock)
                .withScheduleStore(new ScheduleStore(memory)).build();
        memory.close();

        // When / Then
        assertThatThrownBy(() -> scheduler.schedulePersistent("p", CronPatterns.DAILY, "job", Map.of(), () -> { },
                ScheduleOptions.defaults()))
                .isInstanceOf(StoreException.class);
        assertThat(scheduler.getSchedule("p")).isEmpty();
    }

    @Test
    @DisplayName("A failed save puts back the schedule it was meant to replace")
    void testSaveFailureRestoresPrevious() throws Exception {
        // Given
        InMemoryKeyValueStore memory = new InMemoryKeyValueStore();
        JobScheduler scheduler = JobScheduler.builder().withClock(clock)
                .withScheduleStore(new ScheduleStore(memory)).build();
        AtomicInteger runs = new AtomicInteger();
        scheduler.schedule("p", CronPatterns.EVERY_MINUTE, runs::incrementAndGet);
        memory.close();

        // When
        assertThatThrownBy(() -> scheduler.schedulePersistent("p", CronPatterns.DAILY, "job", Map.of(), () -> { },
                ScheduleOptions.defaults()))
                .isInstanceOf(StoreException.class);

        // Then
        Schedule kept = scheduler.getSchedule("p").orElseThrow();
        assertThat(kept.isPersistent()).isFalse();
        assertThat(kept.getCron()).isEqualTo(CronPatterns.EVERY_MINUTE);
        clock.advance(Duration.ofMinutes(1));
        assertThat(scheduler.runDue()).isEqualTo(1);
        assertThat(runs).hasValue(1);
    }

    @Test
    @DisplayName("Loading restores readable schedules when another stored record is corrupt")
    void testLoadSkipsCorruptRecord() throws Exception {
        // Given
        ScheduleStore store = new ScheduleStore(kv);
        store.save(new ScheduleRecord("hourly", CronPatterns.EVERY_HOUR, "UTC", true, null, null, 0, "job", Map.of()));
        kv.set(KeyPath.of("schedules", "broken"), "{not json".getBytes(UTF_8));
        JobScheduler scheduler = scheduler(kv);

        // When
        int loaded = scheduler.loadSchedules((jobName, jobData) -> () -> { });

        // Then
        assertThat(loaded).isEqualTo(1);
        assertThat(scheduler.getSchedules()).extracting(Schedule::getName).containsExactly("hourly");
    }

    @Test
    @DisplayName("Stored definitions are plain JSON")
    void testStoredFormat() throws Exception {
        scheduler(kv).schedulePersistent("json", CronPatterns.WEEKLY, "weekly-digest", Map.of("top", 10), () -> { },
                ScheduleOptions.defaults());

        String json = new String(kv.get(KeyPath.of("schedules", "json")).orElseThrow(), UTF_8);

        assertThat(json).contains("\"cron\":\"0 0 * * 0\"").contains("\"jobName\":\"weekly-digest\"");
    }
}
