package com.umitunal.taskq.model;

import com.umitunal.taskq.core.Job;
import com.umitunal.taskq.serialization.CodecException;
import com.umitunal.taskq.serialization.PayloadCodec;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.time.Instant;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Binary serializer for JobRecord using ByteBuffer.
 *
 * Binary format:
 * - format version (1 byte)
 * - id length (4 bytes) + id bytes (UTF-8)
 * - name length (4 bytes) + name bytes (UTF-8)
 * - payload length (4 bytes, -1 for null) + payload bytes
 * - status ordinal (4 bytes)
 * - priority (4 bytes)
 * - maxRetries (4 bytes)
 * - attempts (4 bytes)
 * - runAt, createdAt, updatedAt, startedAt, completedAt (8 bytes each, epoch millis, -1 for absent)
 * - lastError length (4 bytes, -1 for null) + error bytes (UTF-8)
 * - version (8 bytes)
 *
 * @param <T> the type of job payload
 */
public class JobRecordSerializer<T> {
    static final byte FORMAT_VERSION = 1;
    private static final long ABSENT = -1L;

    private final PayloadCodec<T> payloadCodec;

    public JobRecordSerializer(PayloadCodec<T> payloadCodec) {
        this.payloadCodec = payloadCodec;
    }

    public byte[] serialize(JobRecord<T> job) {
        byte[] idBytes = job.getId().getBytes(UTF_8);
        byte[] nameBytes = job.getName().getBytes(UTF_8);
        byte[] payloadBytes = job.getData() != null ? payloadCodec.encode(job.getData()) : null;
        byte[] errorBytes = job.getLastError() != null ? job.getLastError().getBytes(UTF_8) : null;

        int totalSize = 1 +                                   // format version
                4 + idBytes.length +                          // id
                4 + nameBytes.length +                        // name
                4 + lengthOf(payloadBytes) +                  // payload
                4 +                                           // status
                4 + 4 + 4 +                                   // priority, maxRetries, attempts
                8 * 5 +                                       // timestamps
                4 + lengthOf(errorBytes) +                    // lastError
                8;                                            // version

        ByteBuffer buffer = ByteBuffer.allocate(totalSize);
        buffer.put(FORMAT_VERSION);
        putBytes(buffer, idBytes);
        putBytes(buffer, nameBytes);
        putBytes(buffer, payloadBytes);

        buffer.putInt(job.getStatus().ordinal());
        buffer.putInt(job.getPriority());
        buffer.putInt(job.getMaxRetries());
        buffer.putInt(job.getAttempts());

        putInstant(buffer, job.getRunAt());
        putInstant(buffer, job.getCreatedAt());
        putInstant(buffer, job.getUpdatedAt());
        putInstant(buffer, job.getStartedAt());
        putInstant(buffer, job.getCompletedAt());

        putBytes(buffer, errorBytes);
        buffer.putLong(job.getVersion());

        return buffer.array();
    }

    public JobRecord<T> deserialize(byte[] bytes) {
        try {
            ByteBuffer buffer = ByteBuffer.wrap(bytes);

            byte format = buffer.get();
            if (format != FORMAT_VERSION) {
                throw new CodecException("Unsupported job record format: " + format);
            }

            String id = new String(getBytes(buffer), UTF_8);
            String name = new String(getBytes(buffer), UTF_8);
            byte[] payloadBytes = getBytes(buffer);

            JobRecord.Builder<T> builder = JobRecord.<T>newBuilder(id, name)
                    .data(payloadBytes != null ? payloadCodec.decode(payloadBytes) : null)
                    .status(Job.Status.values()[buffer.getInt()])
                    .priority(buffer.getInt())
                    .maxRetries(buffer.getInt())
                    .attempts(buffer.getInt())
                    .runAt(getInstant(buffer))
                    .createdAt(getInstant(buffer))
                    .updatedAt(getInstant(buffer))
                    .startedAt(getInstant(buffer))
                    .completedAt(getInstant(buffer));

            byte[] errorBytes = getBytes(buffer);
            return builder
                    .lastError(errorBytes != null ? new String(errorBytes, UTF_8) : null)
                    .version(buffer.getLong())
                    .build();
        } catch (BufferUnderflowException | ArrayIndexOutOfBoundsException | NullPointerException e) {
            throw new CodecException("Corrupt job record", e);
        }
    }

    private static int lengthOf(byte[] bytes) {
        return bytes != null ? bytes.length : 0;
    }

    private static void putBytes(ByteBuffer buffer, byte[] bytes) {
        if (bytes == null) {
            buffer.putInt(-1);
            return;
        }
        buffer.putInt(bytes.length);
        buffer.put(bytes);
    }

    private static byte[] getBytes(ByteBuffer buffer) {
        int length = buffer.getInt();
        if (length < 0) {
            return null;
        }
        byte[] bytes = new byte[length];
        buffer.get(bytes);
        return bytes;
    }

    private static void putInstant(ByteBuffer buffer, Instant instant) {
        buffer.putLong(instant != null ? instant.toEpochMilli() : ABSENT);
    }

    private static Instant getInstant(ByteBuffer buffer) {
        long millis = buffer.getLong();
        return millis == ABSENT ? null : Instant.ofEpochMilli(millis);
    }
}
