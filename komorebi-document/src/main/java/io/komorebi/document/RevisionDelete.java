package io.komorebi.document;

import io.komorebi.common.CellKey;
import io.komorebi.common.Mutation;
import io.komorebi.common.Timestamps;
import io.komorebi.document.keyset.KeySet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class RevisionDelete extends AbstractRevision {

    private static final Logger log = LoggerFactory.getLogger(RevisionDelete.class);

    private final List<byte[]> encodedKeySets;

    public RevisionDelete(List<byte[]> encodedKeySets) {
        this(encodedKeySets, Timestamps.now(Clock.systemUTC()));
    }

    public RevisionDelete(List<byte[]> encodedKeySets, Instant timestamp) {
        this(encodedKeySets, Timestamps.toMillis(timestamp));
    }

    public RevisionDelete(List<byte[]> encodedKeySets, long timestampMs) {
        super(timestampMs);
        Objects.requireNonNull(encodedKeySets, "encodedKeySets must not be null");
        List<byte[]> copies = new ArrayList<>(encodedKeySets.size());
        for (byte[] encoded : encodedKeySets) {
            copies.add(Objects.requireNonNull(encoded, "encoded key set must not be null").clone());
        }
        this.encodedKeySets = List.copyOf(copies);
    }

    public static RevisionDelete fromMetadata(List<Mutation.Put> metadata) {
        return fromMetadata(metadata, Timestamps.now(Clock.systemUTC()));
    }

    public static RevisionDelete fromMetadata(List<Mutation.Put> metadata, long timestampMs) {
        List<byte[]> encoded = new ArrayList<>(metadata.size());
        for (Mutation.Put put : metadata) {
            if (!MetadataFamily.isMetadata(put.family())) {
                throw new IllegalArgumentException("Not a metadata cell: " + put.key());
            }
            encoded.add(put.value().toByteArray());
        }
        return new RevisionDelete(encoded, timestampMs);
    }

    public int manifestCount() {
        return encodedKeySets.size();
    }

    @Override
    public List<Mutation> mutations() {
        List<KeySet> keySets = new ArrayList<>(encodedKeySets.size());
        for (int i = 0; i < encodedKeySets.size(); i++) {
            try {
                keySets.add(KeySet.decode(encodedKeySets.get(i)));
            } catch (MalformedManifestException e) {
                log.warn("Rejecting delete: manifest {} of {} is malformed", i + 1, encodedKeySets.size());
                throw e;
            }
        }

        long timestamp = timestampMs();
        List<Mutation> mutations = new ArrayList<>();
        for (KeySet keySet : keySets) {
            for (CellKey key : keySet.keys()) {
                mutations.add(Mutation.delete(key, timestamp));
            }
        }
        log.debug("Compiled {} manifests into {} deletes at {}", keySets.size(), mutations.size(), timestamp);
        return mutations;
    }
}
