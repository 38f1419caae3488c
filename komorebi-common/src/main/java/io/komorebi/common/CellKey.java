package io.komorebi.common;

import java.util.Objects;

public record CellKey(ByteArray row, ByteArray family, ByteArray qualifier, ByteArray visibility) {

    public CellKey {
        Objects.requireNonNull(row, "row must not be null");
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(qualifier, "qualifier must not be null");
        Objects.requireNonNull(visibility, "visibility must not be null");
    }

    public static CellKey of(String row, String family, String qualifier, String visibility) {
        return new CellKey(ByteArray.of(row), ByteArray.of(family), ByteArray.of(qualifier), ByteArray.of(visibility));
    }
}
