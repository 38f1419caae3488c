package io.komorebi.document;

import io.komorebi.common.ByteArray;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

@FunctionalInterface
public interface QualifierGenerator {

    ByteArray next();

    static QualifierGenerator random() {
        return RandomQualifierGenerator.INSTANCE;
    }

    static QualifierGenerator sequential(String prefix) {
        Objects.requireNonNull(prefix, "prefix must not be null");
        AtomicLong counter = new AtomicLong();
        return () -> ByteArray.of(prefix + counter.getAndIncrement());
    }
}
