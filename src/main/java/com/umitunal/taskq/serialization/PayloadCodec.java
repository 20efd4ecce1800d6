package com.umitunal.taskq.serialization;

/**
 * Converts job payloads to and from the bytes kept in the store.
 *
 * @param <T> the type of payload
 */
public interface PayloadCodec<T> {

    /**
     * Encode a payload to bytes.
     *
     * @throws CodecException if the payload cannot be encoded
     */
    byte[] encode(T payload);

    /**
     * Decode bytes to a payload.
     *
     * @throws CodecException if the bytes are not a valid encoding
     */
    T decode(byte[] bytes);
}
