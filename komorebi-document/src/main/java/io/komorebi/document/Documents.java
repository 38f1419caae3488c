package io.komorebi.document;

import io.komorebi.common.ByteArray;
import io.komorebi.common.Timestamps;

import java.util.List;
import java.util.Objects;

public final class Documents {

    private final DocumentConfig config;

    public Documents(DocumentConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    public static Documents create() {
        return new Documents(DocumentConfig.defaults());
    }

    public DocumentConfig config() {
        return config;
    }

    public View.Builder view(String lookupTerm) {
        return view(ByteArray.of(lookupTerm));
    }

    public View.Builder view(ByteArray lookupTerm) {
        return View.builder(lookupTerm, config.qualifierGenerator());
    }

    public Component.Builder component(String docId, String componentType) {
        return component(ByteArray.of(docId), ByteArray.of(componentType));
    }

    public Component.Builder component(ByteArray docId, ByteArray componentType) {
        return Component.builder(docId, componentType, config.qualifierGenerator());
    }

    public Revision revision(List<Component> components) {
        return new Revision(components, Timestamps.now(config.clock()));
    }

    public RevisionDelete delete(List<byte[]> encodedKeySets) {
        return new RevisionDelete(encodedKeySets, Timestamps.now(config.clock()));
    }
}
