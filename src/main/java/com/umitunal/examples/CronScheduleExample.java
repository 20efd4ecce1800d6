package com.umitunal.examples;

import com.umitunal.taskq.config.StorageConfig;
import com.umitunal.taskq.cron.CronPatterns;
import com.umitunal.taskq.scheduler.JobScheduler;
import com.umitunal.taskq.scheduler.Schedule;
import com.umitunal.taskq.scheduler.ScheduleHandlerFactory;
import com.umitunal.taskq.scheduler.ScheduleOptions;
import com.umitunal.taskq.serialization.JsonCodec;
import com.umitunal.taskq.storage.RocksKeyValueStore;
import com.umitunal.taskq.storage.ScheduleStore;
import com.umitunal.taskq.worker.JobQueueEngine;

import java.time.ZoneId;
import java.util.Map;

/**
 * Cron schedules that enqueue jobs, saved so they survive a restart.
 */
public class CronScheduleExample {

    public static void main(String[] args) {
        System.out.println("=== Cron Schedule Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/taskq-cron")
                .withDurableWrites(false)
                .build();

        try (RocksKeyValueStore kv = new RocksKeyValueStore(storage);
             JobQueueEngine<Map<String, Object>> queue = JobQueueEngine.builder(kv, JsonCodec.forMap()).build()) {

            queue.process("cleanup-temp", job -> System.out.println("  Cleaning " + job.getData().get("dir")));
            ScheduleHandlerFactory factory = ScheduleHandlerFactory.enqueueing(queue);

            try (JobScheduler scheduler = JobScheduler.builder()
                    .withScheduleStore(new ScheduleStore(kv))
                    .build()) {

                Map<String, Object> data = Map.of("dir", "/tmp/uploads");
                scheduler.schedulePersistent("nightly-cleanup", CronPatterns.DAILY_3AM, "cleanup-temp", data,
                        factory.create("cleanup-temp", data),
                        ScheduleOptions.newBuilder().withZone(ZoneId.of("Europe/Istanbul")).build());
                scheduler.schedule("heartbeat", CronPatterns.EVERY_MINUTE,
                        () -> System.out.println("  heartbeat"));

                for (Schedule schedule : scheduler.getSchedules()) {
                    System.out.println(schedule);
                }

                // Run the nightly job now instead of waiting for 3 AM
                scheduler.trigger("nightly-cleanup");
                System.out.println("\nTriggered: " + scheduler.getSchedule("nightly-cleanup").orElseThrow());
            }

            System.out.println("Processed " + queue.processDue() + " queued job(s)");

            // A new scheduler restores the saved definition
            try (JobScheduler restored = JobScheduler.builder()
                    .withScheduleStore(new ScheduleStore(kv))
                    .build()) {
                restored.loadSchedules(ScheduleHandlerFactory.enqueueing(queue));
                System.out.println("Restored: " + restored.getSchedules());
            }

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
