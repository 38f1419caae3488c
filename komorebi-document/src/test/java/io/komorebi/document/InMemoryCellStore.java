package io.komorebi.document;

import io.komorebi.common.ByteArray;
import io.komorebi.common.CellKey;
import io.komorebi.common.Mutation;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Versioned cells with delete markers that hide every version at or before
 * their timestamp, enough to check what a batch of mutations leaves visible.
 */
final class InMemoryCellStore {

    private final Map<CellKey, NavigableMap<Long, ByteArray>> versions = new HashMap<>();
    private final Map<CellKey, Long> deletedThrough = new HashMap<>();

    void apply(List<Mutation> mutations) {
        for (Mutation mutation : mutations) {
            if (mutation instanceof Mutation.Put put) {
                versions.computeIfAbsent(put.key(), k -> new TreeMap<>()).put(put.timestamp(), put.value());
            } else {
                deletedThrough.merge(mutation.key(), mutation.timestamp(), Math::max);
            }
        }
    }

    Optional<ByteArray> latest(CellKey key) {
        NavigableMap<Long, ByteArray> cell = versions.get(key);
        if (cell == null) {
            return Optional.empty();
        }
        long hiddenThrough = deletedThrough.getOrDefault(key, -1L);
        Map.Entry<Long, ByteArray> newest = cell.lastEntry();
        if (newest.getKey() <= hiddenThrough) {
            return Optional.empty();
        }
        return Optional.of(newest.getValue());
    }

    long visibleCells() {
        return versions.keySet().stream().filter(key -> latest(key).isPresent()).count();
    }
}
