package io.komorebi.document.keyset;

import io.komorebi.common.CellKey;
import io.komorebi.common.Mutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record KeySet(List<CellKey> keys) {

    public KeySet {
        Objects.requireNonNull(keys, "keys must not be null");
        keys = List.copyOf(keys);
    }

    public static KeySet empty() {
        return new KeySet(List.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public int size() {
        return keys.size();
    }

    public boolean isEmpty() {
        return keys.isEmpty();
    }

    public boolean contains(CellKey key) {
        return keys.contains(key);
    }

    public byte[] encode() {
        return KeySetCodec.encode(this);
    }

    public static KeySet decode(byte[] encoded) {
        return KeySetCodec.decode(encoded);
    }

    public static final class Builder {

        private final List<CellKey> keys = new ArrayList<>();

        private Builder() {
        }

        public Builder add(CellKey key) {
            keys.add(Objects.requireNonNull(key, "key must not be null"));
            return this;
        }

        public Builder add(Mutation mutation) {
            return add(mutation.key());
        }

        public KeySet build() {
            return new KeySet(keys);
        }
    }
}
