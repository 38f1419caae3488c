package io.komorebi.common;

import java.time.Clock;
import java.time.Instant;

public final class Timestamps {

    private Timestamps() {
    }

    public static long toMillis(Instant instant) {
        return instant.toEpochMilli();
    }

    public static long now(Clock clock) {
        return clock.millis();
    }
}
