package io.komorebi.document;

import io.komorebi.common.ByteArray;
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

/**
 * Compiles components into the puts that store them.
 *
 * <p>For each component the output is its view puts in view order, then the
 * body put, then the metadata put whose value is the encoded {@link KeySet} of
 * all three kinds of key, the metadata key included. This order is stable.
 */
public final class Revision extends AbstractRevision {

    private static final Logger log = LoggerFactory.getLogger(Revision.class);

    private final List<Component> components;

    public Revision(List<Component> components) {
        this(components, Timestamps.now(Clock.systemUTC()));
    }

    public Revision(List<Component> components, Instant timestamp) {
        this(components, Timestamps.toMillis(timestamp));
    }

    public Revision(List<Component> components, long timestampMs) {
        super(timestampMs);
        Objects.requireNonNull(components, "components must not be null");
        this.components = List.copyOf(components);
    }

    public List<Component> components() {
        return components;
    }

    @Override
    public List<Mutation> mutations() {
        long timestamp = timestampMs();
        List<Mutation> mutations = new ArrayList<>();
        for (Component component : components) {
            List<Mutation.Put> viewMutations = new ArrayList<>(component.views().size());
            for (View view : component.views()) {
                viewMutations.add(view.mutation(timestamp));
            }
            Mutation.Put body = component.mutation(timestamp);
            KeySet manifest = manifest(viewMutations, body, component);
            Mutation.Put metadata = Mutation.put(component.metadataKey(), timestamp, ByteArray.copyOf(manifest.encode()));

            mutations.addAll(viewMutations);
            mutations.add(body);
            mutations.add(metadata);
        }
        log.debug("Compiled {} components into {} mutations at {}", components.size(), mutations.size(), timestamp);
        return mutations;
    }

    public List<KeySet> manifests() {
        long timestamp = timestampMs();
        List<KeySet> manifests = new ArrayList<>(components.size());
        for (Component component : components) {
            List<Mutation.Put> viewMutations = component.views().stream()
                .map(view -> view.mutation(timestamp))
                .toList();
            manifests.add(manifest(viewMutations, component.mutation(timestamp), component));
        }
        return manifests;
    }

    private static KeySet manifest(List<Mutation.Put> viewMutations, Mutation.Put body, Component component) {
        KeySet.Builder builder = KeySet.builder();
        viewMutations.forEach(builder::add);
        builder.add(body);
        builder.add(component.metadataKey());
        return builder.build();
    }
}
