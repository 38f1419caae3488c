package io.komorebi.document;

import java.time.Clock;
import java.util.Objects;

public record DocumentConfig(Clock clock, QualifierGenerator qualifierGenerator) {

    public DocumentConfig {
        Objects.requireNonNull(clock, "clock must not be null");
        Objects.requireNonNull(qualifierGenerator, "qualifierGenerator must not be null");
    }

    public static DocumentConfig defaults() {
        return new DocumentConfig(Clock.systemUTC(), QualifierGenerator.random());
    }

    public DocumentConfig withClock(Clock clock) {
        return new DocumentConfig(clock, qualifierGenerator);
    }

    public DocumentConfig withQualifierGenerator(QualifierGenerator qualifierGenerator) {
        return new DocumentConfig(clock, qualifierGenerator);
    }
}
