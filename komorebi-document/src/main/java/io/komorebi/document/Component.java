package io.komorebi.document;

import io.komorebi.common.ByteArray;
import io.komorebi.common.CellKey;
import io.komorebi.common.Mutation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record Component(
    ByteArray docId,
    ByteArray componentType,
    ByteArray qualifier,
    ByteArray visibility,
    ByteArray content,
    List<View> views
) {

    public Component {
        Objects.requireNonNull(docId, "docId must not be null");
        Objects.requireNonNull(componentType, "componentType must not be null");
        Objects.requireNonNull(qualifier, "qualifier must not be null");
        Objects.requireNonNull(visibility, "visibility must not be null");
        Objects.requireNonNull(content, "content must not be null");
        Objects.requireNonNull(views, "views must not be null");
        if (MetadataFamily.isMetadata(componentType)) {
            throw new IllegalArgumentException("componentType must not start with the reserved metadata prefix");
        }
        views = List.copyOf(views);
    }

    public static Builder builder(String docId, String componentType) {
        return builder(ByteArray.of(docId), ByteArray.of(componentType));
    }

    public static Builder builder(ByteArray docId, ByteArray componentType) {
        return new Builder(docId, componentType, QualifierGenerator.random());
    }

    static Builder builder(ByteArray docId, ByteArray componentType, QualifierGenerator qualifierGenerator) {
        return new Builder(docId, componentType, qualifierGenerator);
    }

    public CellKey key() {
        return new CellKey(docId, componentType, qualifier, visibility);
    }

    public ByteArray metadataFamily() {
        return MetadataFamily.of(componentType);
    }

    public CellKey metadataKey() {
        return new CellKey(docId, metadataFamily(), qualifier, visibility);
    }

    public Mutation.Put mutation(long timestampMs) {
        return new Mutation.Put(docId, componentType, qualifier, visibility, timestampMs, content);
    }

    public static final class Builder {

        private final ByteArray docId;
        private final ByteArray componentType;
        private final QualifierGenerator qualifierGenerator;
        private final List<View> views = new ArrayList<>();
        private ByteArray qualifier;
        private ByteArray visibility = ByteArray.empty();
        private ByteArray content = ByteArray.empty();

        private Builder(ByteArray docId, ByteArray componentType, QualifierGenerator qualifierGenerator) {
            this.docId = Objects.requireNonNull(docId, "docId must not be null");
            this.componentType = Objects.requireNonNull(componentType, "componentType must not be null");
            this.qualifierGenerator = Objects.requireNonNull(qualifierGenerator, "qualifierGenerator must not be null");
        }

        public Builder qualifier(String qualifier) {
            return qualifier(ByteArray.of(qualifier));
        }

        public Builder qualifier(ByteArray qualifier) {
            this.qualifier = Objects.requireNonNull(qualifier, "qualifier must not be null");
            return this;
        }

        public Builder visibility(String visibility) {
            return visibility(ByteArray.of(visibility));
        }

        public Builder visibility(ByteArray visibility) {
            this.visibility = Objects.requireNonNull(visibility, "visibility must not be null");
            return this;
        }

        public Builder content(String content) {
            return content(ByteArray.of(content));
        }

        public Builder content(byte[] content) {
            return content(ByteArray.copyOf(content));
        }

        public Builder content(ByteArray content) {
            this.content = Objects.requireNonNull(content, "content must not be null");
            return this;
        }

        public Builder view(View view) {
            views.add(Objects.requireNonNull(view, "view must not be null"));
            return this;
        }

        public Builder views(List<View> views) {
            views.forEach(this::view);
            return this;
        }

        public Component build() {
            ByteArray resolved = qualifier != null ? qualifier : qualifierGenerator.next();
            return new Component(docId, componentType, resolved, visibility, content, views);
        }
    }
}
