package com.umitunal.examples;

import com.umitunal.taskq.config.QueueConfig;
import com.umitunal.taskq.config.StorageConfig;
import com.umitunal.taskq.core.JobOptions;
import com.umitunal.taskq.serialization.JsonCodec;
import com.umitunal.taskq.storage.RocksKeyValueStore;
import com.umitunal.taskq.worker.JobQueueEngine;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Basic job processing example: add jobs, register handlers, let the background loop run them.
 */
public class BasicExample {

    public static void main(String[] args) {
        System.out.println("=== Basic Job Processing Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/taskq-basic")
                .withDurableWrites(false)
                .build();
        QueueConfig config = QueueConfig.newBuilder()
                .withPollInterval(Duration.ofMillis(200))
                .build();

        try (RocksKeyValueStore kv = new RocksKeyValueStore(storage);
             JobQueueEngine<Map<String, Object>> queue = JobQueueEngine.builder(kv, JsonCodec.forMap())
                     .withConfig(config)
                     .build()) {

            queue.process("send-email", job ->
                    System.out.println("  Sending email to " + job.getData().get("to") + " (" + job.getId() + ")"));
            queue.process("resize-image", job ->
                    System.out.println("  Resizing " + job.getData().get("file") + " (" + job.getId() + ")"));

            queue.add("send-email", Map.of("to", "user@example.com"));
            queue.add("resize-image", Map.of("file", "avatar.png"),
                    JobOptions.newBuilder().withPriority(10).build());
            queue.add("send-email", Map.of("to", "later@example.com"),
                    JobOptions.newBuilder().withDelay(Duration.ofSeconds(1)).build());

            System.out.println("Added 3 jobs");
            System.out.println(queue.getStats());

            queue.start();
            Thread.sleep(2000);
            queue.stop();

            System.out.println("\n" + queue.getStats());
            System.out.println("Removed " + queue.cleanup(Instant.now().plusSeconds(1)) + " finished jobs");

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
