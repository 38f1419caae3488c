package io.komorebi.document;

import io.komorebi.common.Mutation;

import java.util.List;

public abstract sealed class AbstractRevision permits Revision, RevisionDelete {

    private final long timestampMs;

    protected AbstractRevision(long timestampMs) {
        if (timestampMs < 0) {
            throw new IllegalArgumentException("timestampMs must be non-negative");
        }
        this.timestampMs = timestampMs;
    }

    public long timestampMs() {
        return timestampMs;
    }

    public abstract List<Mutation> mutations();
}
