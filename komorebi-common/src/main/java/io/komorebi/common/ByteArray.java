package io.komorebi.common;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

public final class ByteArray {

    private static final ByteArray EMPTY = new ByteArray(new byte[0]);

    private final byte[] data;

    private ByteArray(byte[] data) {
        this.data = data;
    }

    public static ByteArray of(byte... bytes) {
        if (bytes.length == 0) {
            return EMPTY;
        }
        return new ByteArray(bytes.clone());
    }

    public static ByteArray of(String text) {
        Objects.requireNonNull(text, "text must not be null");
        if (text.isEmpty()) {
            return EMPTY;
        }
        return new ByteArray(text.getBytes(StandardCharsets.UTF_8));
    }

    public static ByteArray copyOf(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        if (bytes.length == 0) {
            return EMPTY;
        }
        return new ByteArray(bytes.clone());
    }

    public static ByteArray copyOf(byte[] bytes, int offset, int length) {
        if (offset < 0 || length < 0 || offset + length > bytes.length) {
            throw new IndexOutOfBoundsException(
                "Invalid offset=%d, length=%d for array of size %d".formatted(offset, length, bytes.length)
            );
        }
        if (length == 0) {
            return EMPTY;
        }
        return new ByteArray(Arrays.copyOfRange(bytes, offset, offset + length));
    }

    public static ByteArray empty() {
        return EMPTY;
    }

    public int length() {
        return data.length;
    }

    public boolean isEmpty() {
        return data.length == 0;
    }

    public byte get(int index) {
        return data[index];
    }

    public ByteArray slice(int offset, int length) {
        return copyOf(data, offset, length);
    }

    public ByteArray concat(ByteArray suffix) {
        if (suffix.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return suffix;
        }
        byte[] joined = Arrays.copyOf(data, data.length + suffix.data.length);
        System.arraycopy(suffix.data, 0, joined, data.length, suffix.data.length);
        return new ByteArray(joined);
    }

    public boolean startsWith(ByteArray prefix) {
        if (prefix.data.length > data.length) {
            return false;
        }
        return Arrays.equals(data, 0, prefix.data.length, prefix.data, 0, prefix.data.length);
    }

    public byte[] toByteArray() {
        return data.clone();
    }

    public String toStringUtf8() {
        return new String(data, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof ByteArray other && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        if (data.length == 0) {
            return "ByteArray[]";
        }
        return "ByteArray[" + HexFormat.of().formatHex(data) + "]";
    }
}
