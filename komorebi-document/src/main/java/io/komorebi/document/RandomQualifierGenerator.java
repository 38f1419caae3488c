package io.komorebi.document;

import io.komorebi.common.ByteArray;

import java.util.UUID;

final class RandomQualifierGenerator implements QualifierGenerator {

    static final RandomQualifierGenerator INSTANCE = new RandomQualifierGenerator();

    private RandomQualifierGenerator() {
    }

    @Override
    public ByteArray next() {
        UUID uuid;
        try {
            uuid = UUID.randomUUID();
        } catch (RuntimeException e) {
            throw new QualifierGenerationException("Failed to generate random qualifier", e);
        }
        return ByteArray.of(uuid.toString().replace("-", ""));
    }
}
