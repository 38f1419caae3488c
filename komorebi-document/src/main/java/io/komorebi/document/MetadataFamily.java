package io.komorebi.document;

import io.komorebi.common.ByteArray;

public final class MetadataFamily {

    public static final ByteArray PREFIX = ByteArray.of("_meta\u0000");

    private MetadataFamily() {
    }

    public static ByteArray of(ByteArray componentType) {
        return PREFIX.concat(componentType);
    }

    public static boolean isMetadata(ByteArray family) {
        return family.startsWith(PREFIX);
    }

    public static ByteArray componentType(ByteArray metadataFamily) {
        if (!isMetadata(metadataFamily)) {
            throw new IllegalArgumentException("Not a metadata family: " + metadataFamily);
        }
        return metadataFamily.slice(PREFIX.length(), metadataFamily.length() - PREFIX.length());
    }
}
