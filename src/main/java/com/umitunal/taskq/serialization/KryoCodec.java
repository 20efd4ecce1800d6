package com.umitunal.taskq.serialization;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.KryoException;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

import java.io.ByteArrayOutputStream;

/**
 * Compact binary payload encoding using Kryo.
 * Each thread keeps its own Kryo instance since Kryo is not thread-safe; the queue
 * encodes on producer threads and decodes on worker threads.
 *
 * @param <T> the type to serialize
 */
public class KryoCodec<T> implements PayloadCodec<T> {
    private final ThreadLocal<Kryo> kryoThreadLocal;
    private final Class<T> type;

    public KryoCodec(Class<T> type) {
        this(type, KryoCodec::defaultKryo);
    }

    /**
     * Create a Kryo codec with custom Kryo instance configuration,
     * e.g. to register payload classes up front.
     */
    public KryoCodec(Class<T> type, KryoFactory factory) {
        this.type = type;
        this.kryoThreadLocal = ThreadLocal.withInitial(factory::create);
    }

    @Override
    public byte[] encode(T payload) {
        Kryo kryo = kryoThreadLocal.get();
        ByteArrayOutputStream baos = new ByteArrayOutputStream();

        try (Output output = new Output(baos)) {
            kryo.writeObject(output, payload);
            output.flush();
            return baos.toByteArray();
        } catch (KryoException e) {
            throw new CodecException("Failed to serialize " + type.getName() + " with Kryo", e);
        }
    }

    @Override
    public T decode(byte[] bytes) {
        Kryo kryo = kryoThreadLocal.get();

        try (Input input = new Input(bytes)) {
            return kryo.readObject(input, type);
        } catch (KryoException e) {
            throw new CodecException("Failed to deserialize " + type.getName() + " with Kryo", e);
        }
    }

    /**
     * Registration is not required so arbitrary payload classes work; references are
     * tracked so cyclic object graphs survive.
     */
    public static Kryo defaultKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(false);
        kryo.setReferences(true);
        return kryo;
    }

    /**
     * Factory interface for custom Kryo configuration.
     */
    @FunctionalInterface
    public interface KryoFactory {
        Kryo create();
    }
}
