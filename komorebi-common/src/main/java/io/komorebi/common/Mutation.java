package io.komorebi.common;

import java.util.Objects;

public sealed interface Mutation permits Mutation.Put, Mutation.Delete {

    ByteArray row();

    ByteArray family();

    ByteArray qualifier();

    ByteArray visibility();

    long timestamp();

    boolean isDelete();

    default CellKey key() {
        return new CellKey(row(), family(), qualifier(), visibility());
    }

    static Put put(String row, String family, String qualifier, String visibility, long timestamp, String value) {
        return new Put(ByteArray.of(row), ByteArray.of(family), ByteArray.of(qualifier), ByteArray.of(visibility),
            timestamp, ByteArray.of(value));
    }

    static Put put(CellKey key, long timestamp, ByteArray value) {
        return new Put(key.row(), key.family(), key.qualifier(), key.visibility(), timestamp, value);
    }

    static Delete delete(String row, String family, String qualifier, String visibility, long timestamp) {
        return new Delete(ByteArray.of(row), ByteArray.of(family), ByteArray.of(qualifier), ByteArray.of(visibility),
            timestamp);
    }

    static Delete delete(CellKey key, long timestamp) {
        return new Delete(key.row(), key.family(), key.qualifier(), key.visibility(), timestamp);
    }

    record Put(
        ByteArray row,
        ByteArray family,
        ByteArray qualifier,
        ByteArray visibility,
        long timestamp,
        ByteArray value
    ) implements Mutation {

        public Put {
            requireCoordinates(row, family, qualifier, visibility, timestamp);
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public boolean isDelete() {
            return false;
        }
    }

    record Delete(
        ByteArray row,
        ByteArray family,
        ByteArray qualifier,
        ByteArray visibility,
        long timestamp
    ) implements Mutation {

        public Delete {
            requireCoordinates(row, family, qualifier, visibility, timestamp);
        }

        @Override
        public boolean isDelete() {
            return true;
        }
    }

    private static void requireCoordinates(ByteArray row, ByteArray family, ByteArray qualifier,
                                           ByteArray visibility, long timestamp) {
        Objects.requireNonNull(row, "row must not be null");
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(qualifier, "qualifier must not be null");
        Objects.requireNonNull(visibility, "visibility must not be null");
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must be non-negative");
        }
    }
}
