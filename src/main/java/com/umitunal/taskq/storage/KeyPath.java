package com.umitunal.taskq.storage;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * Composite store key such as {@code ["jobs", id]}.
 * Encoded as UTF-8 segments each terminated by a 0x00 byte, so unsigned byte order of encoded keys
 * matches segment-by-segment string order and every key under a prefix path forms one contiguous range.
 */
public final class KeyPath implements Comparable<KeyPath> {
    private static final byte SEPARATOR = 0;

    private final List<String> segments;
    private final byte[] encoded;

    private KeyPath(List<String> segments) {
        this.segments = Collections.unmodifiableList(segments);
        this.encoded = encode(segments);
    }

    public static KeyPath of(String... segments) {
        if (segments.length == 0) {
            throw new IllegalArgumentException("key path needs at least one segment");
        }
        List<String> list = new ArrayList<>(segments.length);
        for (String segment : segments) {
            list.add(validate(segment));
        }
        return new KeyPath(list);
    }

    /**
     * Decode a key previously produced by {@link #toBytes()}.
     */
    public static KeyPath fromBytes(byte[] bytes) {
        List<String> segments = new ArrayList<>();
        int start = 0;
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == SEPARATOR) {
                segments.add(new String(bytes, start, i - start, UTF_8));
                start = i + 1;
            }
        }
        if (start != bytes.length || segments.isEmpty()) {
            throw new IllegalArgumentException("not an encoded key path");
        }
        return new KeyPath(segments);
    }

    public KeyPath child(String segment) {
        List<String> list = new ArrayList<>(segments);
        list.add(validate(segment));
        return new KeyPath(list);
    }

    public List<String> getSegments() {
        return segments;
    }

    public String last() {
        return segments.get(segments.size() - 1);
    }

    public int size() {
        return segments.size();
    }

    public boolean startsWith(KeyPath prefix) {
        return hasPrefix(encoded, prefix.encoded);
    }

    public byte[] toBytes() {
        return encoded.clone();
    }

    static boolean hasPrefix(byte[] key, byte[] prefix) {
        if (key.length < prefix.length) {
            return false;
        }
        return Arrays.equals(key, 0, prefix.length, prefix, 0, prefix.length);
    }

    byte[] encodedView() {
        return encoded;
    }

    @Override
    public int compareTo(KeyPath other) {
        return Arrays.compareUnsigned(encoded, other.encoded);
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof KeyPath && Arrays.equals(encoded, ((KeyPath) o).encoded));
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(encoded);
    }

    @Override
    public String toString() {
        return segments.toString();
    }

    private static String validate(String segment) {
        if (segment == null || segment.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("invalid key segment: " + segment);
        }
        return segment;
    }

    private static byte[] encode(List<String> segments) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (String segment : segments) {
            out.writeBytes(segment.getBytes(UTF_8));
            out.write(SEPARATOR);
        }
        return out.toByteArray();
    }
}
