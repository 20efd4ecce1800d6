package com.umitunal.taskq.model;

import com.umitunal.taskq.core.Job;
import com.umitunal.taskq.serialization.CodecException;
import com.umitunal.taskq.serialization.JsonCodec;
import com.umitunal.taskq.serialization.KryoCodec;
import com.umitunal.taskq.serialization.StringCodec;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class JobRecordSerializerTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00.123Z");

    @Test
    @DisplayName("Should serialize and deserialize a new pending job")
    void testPendingJob() {
        // Given
        JobRecordSerializer<String> serializer = new JobRecordSerializer<>(new StringCodec());
        JobRecord<String> original = JobRecord.pending("job-1", "send-email", "Task payload", 7, 2, T0.plusSeconds(5), T0);

        // When
        JobRecord<String> restored = serializer.deserialize(serializer.serialize(original));

        // Then
        assertThat(restored.getId()).isEqualTo("job-1");
        assertThat(restored.getName()).isEqualTo("send-email");
        assertThat(restored.getData()).isEqualTo("Task payload");
        assertThat(restored.getStatus()).isEqualTo(Job.Status.PENDING);
        assertThat(restored.getPriority()).isEqualTo(7);
        assertThat(restored.getMaxRetries()).isEqualTo(2);
        assertThat(restored.getRunAt()).isEqualTo(T0.plusSeconds(5));
        assertThat(restored.getCreatedAt()).isEqualTo(T0);
        assertThat(restored.getUpdatedAt()).isEqualTo(T0);
        assertThat(restored.getStartedAt()).isNull();
        assertThat(restored.getCompletedAt()).isNull();
        assertThat(restored.getLastError()).isNull();
    }

    @Test
    @DisplayName("Should preserve failure metadata and version")
    void testFailedJob() {
        // Given
        JobRecordSerializer<Map<String, Object>> serializer = new JobRecordSerializer<>(JsonCodec.forMap());
        JobRecord<Map<String, Object>> job = JobRecord.pending("job-2", "webhook",
                Map.<String, Object>of("url", "https://example.com", "n", 1), 5, 0, T0, T0);
        JobRecord<Map<String, Object>> failed = JobLifecycle.finish(JobLifecycle.start(job, T0),
                Outcome.failure("HTTP 503 service unavailable ü"), T0.plusSeconds(1), attempts -> Duration.ZERO);

        // When
        JobRecord<Map<String, Object>> restored = serializer.deserialize(serializer.serialize(failed));

        // Then
        assertThat(restored.getStatus()).isEqualTo(Job.Status.FAILED);
        assertThat(restored.getAttempts()).isEqualTo(1);
        assertThat(restored.getStartedAt()).isEqualTo(T0);
        assertThat(restored.getCompletedAt()).isEqualTo(T0.plusSeconds(1));
        assertThat(restored.getLastError()).isEqualTo("HTTP 503 service unavailable ü");
        assertThat(restored.getVersion()).isEqualTo(failed.getVersion());
        assertThat(restored.getData()).containsEntry("url", "https://example.com").containsEntry("n", 1);
    }

    @Test
    @DisplayName("Should handle a null payload")
    void testNullPayload() {
        JobRecordSerializer<TestPayload> serializer = new JobRecordSerializer<>(new KryoCodec<>(TestPayload.class));
        JobRecord<TestPayload> original = JobRecord.pending("job-3", "noop", null, 1, 0, T0, T0);

        JobRecord<TestPayload> restored = JobRecord.deserialize(original.serialize(new KryoCodec<>(TestPayload.class)),
                new KryoCodec<>(TestPayload.class));

        assertThat(restored.getData()).isNull();
        assertThat(serializer.deserialize(serializer.serialize(original)).getId()).isEqualTo("job-3");
    }

    @Test
    @DisplayName("Should reject truncated and unknown-format data")
    void testCorruptData() {
        JobRecordSerializer<String> serializer = new JobRecordSerializer<>(new StringCodec());
        byte[] bytes = serializer.serialize(JobRecord.pending("job-4", "x", "y", 1, 0, T0, T0));

        byte[] truncated = Arrays.copyOf(bytes, bytes.length / 2);
        byte[] unknownFormat = bytes.clone();
        unknownFormat[0] = 99;

        assertThatThrownBy(() -> serializer.deserialize(truncated)).isInstanceOf(CodecException.class);
        assertThatThrownBy(() -> serializer.deserialize(unknownFormat))
                .isInstanceOf(CodecException.class)
                .hasMessageContaining("format");
        assertThatThrownBy(() -> serializer.deserialize(new byte[0])).isInstanceOf(CodecException.class);
    }

    public static class TestPayload {
        public String value;
    }
}
