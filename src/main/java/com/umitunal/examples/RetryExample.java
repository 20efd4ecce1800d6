package com.umitunal.examples;

import com.umitunal.taskq.config.QueueConfig;
import com.umitunal.taskq.config.StorageConfig;
import com.umitunal.taskq.core.Job;
import com.umitunal.taskq.core.JobOptions;
import com.umitunal.taskq.model.RetryBackoff;
import com.umitunal.taskq.serialization.StringCodec;
import com.umitunal.taskq.storage.RocksKeyValueStore;
import com.umitunal.taskq.worker.JobQueueEngine;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retry mechanism example - a handler that fails twice before succeeding.
 */
public class RetryExample {

    public static void main(String[] args) {
        System.out.println("=== Retry Mechanism Example ===\n");

        StorageConfig storage = StorageConfig.newBuilder("/tmp/taskq-retry").build();
        QueueConfig config = QueueConfig.newBuilder()
                .withRetryBackoff(RetryBackoff.fixed(Duration.ofMillis(100)))
                .build();

        try (RocksKeyValueStore kv = new RocksKeyValueStore(storage);
             JobQueueEngine<String> queue = JobQueueEngine.builder(kv, new StringCodec())
                     .withConfig(config)
                     .build()) {

            AtomicInteger calls = new AtomicInteger();
            queue.process("flaky-job", job -> {
                int call = calls.incrementAndGet();
                System.out.println("Attempt " + job.getAttempts() + ": " + job.getData());
                if (call < 3) {
                    throw new IllegalStateException("Connection timeout");
                }
            });

            String id = queue.add("flaky-job", "Unreliable API call",
                    JobOptions.newBuilder().withMaxRetries(3).build());
            System.out.println("Submitted job with 3 retries");

            // Drive the queue by hand instead of starting the polling loop
            while (queue.getJob(id).map(job -> !job.getStatus().isTerminal()).orElse(false)) {
                queue.processDue();
                Thread.sleep(150);
            }

            Job<String> job = queue.getJob(id).orElseThrow();
            System.out.println("\nFinal: " + job.getStatus() + " after " + job.getAttempts()
                    + " attempts, last error: " + job.getLastError());
            System.out.println(queue.getStats());

        } catch (Exception e) {
            e.printStackTrace();
        }
    }
}
