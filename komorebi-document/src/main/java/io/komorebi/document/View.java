package io.komorebi.document;

import io.komorebi.common.ByteArray;
import io.komorebi.common.CellKey;
import io.komorebi.common.Mutation;

import java.util.Objects;

public record View(
    ByteArray lookupTerm,
    ByteArray qualifier,
    ByteArray visibility,
    ByteArray family,
    ByteArray value
) {

    public View {
        Objects.requireNonNull(lookupTerm, "lookupTerm must not be null");
        Objects.requireNonNull(qualifier, "qualifier must not be null");
        Objects.requireNonNull(visibility, "visibility must not be null");
        Objects.requireNonNull(family, "family must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (MetadataFamily.isMetadata(family)) {
            throw new IllegalArgumentException("family must not start with the reserved metadata prefix");
        }
    }

    public static Builder builder(String lookupTerm) {
        return builder(ByteArray.of(lookupTerm));
    }

    public static Builder builder(ByteArray lookupTerm) {
        return new Builder(lookupTerm, QualifierGenerator.random());
    }

    static Builder builder(ByteArray lookupTerm, QualifierGenerator qualifierGenerator) {
        return new Builder(lookupTerm, qualifierGenerator);
    }

    public CellKey key() {
        return new CellKey(lookupTerm, family, qualifier, visibility);
    }

    public Mutation.Put mutation(long timestampMs) {
        return new Mutation.Put(lookupTerm, family, qualifier, visibility, timestampMs, value);
    }

    public static final class Builder {

        private final ByteArray lookupTerm;
        private final QualifierGenerator qualifierGenerator;
        private ByteArray qualifier;
        private ByteArray visibility = ByteArray.empty();
        private ByteArray family = ByteArray.empty();
        private ByteArray value = ByteArray.empty();

        private Builder(ByteArray lookupTerm, QualifierGenerator qualifierGenerator) {
            this.lookupTerm = Objects.requireNonNull(lookupTerm, "lookupTerm must not be null");
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

        public Builder family(String family) {
            return family(ByteArray.of(family));
        }

        public Builder family(ByteArray family) {
            this.family = Objects.requireNonNull(family, "family must not be null");
            return this;
        }

        public Builder value(String value) {
            return value(ByteArray.of(value));
        }

        public Builder value(byte[] value) {
            return value(ByteArray.copyOf(value));
        }

        public Builder value(ByteArray value) {
            this.value = Objects.requireNonNull(value, "value must not be null");
            return this;
        }

        public View build() {
            ByteArray resolved = qualifier != null ? qualifier : qualifierGenerator.next();
            return new View(lookupTerm, resolved, visibility, family, value);
        }
    }
}
