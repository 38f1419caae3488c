package io.komorebi.document.keyset;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import io.komorebi.common.ByteArray;
import io.komorebi.common.CellKey;
import io.komorebi.document.MalformedManifestException;
import io.komorebi.document.keyset.proto.KeySetProto;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Protobuf encoding of {@link KeySet}. Decoding is strict: bytes that do not
 * parse, or that parse but carry fields outside the schema, are rejected rather
 * than partially read.
 */
public final class KeySetCodec {

    private KeySetCodec() {
    }

    public static byte[] encode(KeySet keySet) {
        Objects.requireNonNull(keySet, "keySet must not be null");
        var builder = KeySetProto.KeySet.newBuilder();
        for (CellKey key : keySet.keys()) {
            builder.addKeys(toProto(key));
        }
        return builder.build().toByteArray();
    }

    public static KeySet decode(byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded must not be null");

        KeySetProto.KeySet proto;
        try {
            proto = KeySetProto.KeySet.parseFrom(encoded);
        } catch (InvalidProtocolBufferException e) {
            throw new MalformedManifestException("Failed to parse key set (" + encoded.length + " bytes)", e);
        }

        if (!proto.getUnknownFields().asMap().isEmpty()) {
            throw new MalformedManifestException("Key set carries unknown fields " + proto.getUnknownFields().asMap().keySet());
        }

        List<CellKey> keys = new ArrayList<>(proto.getKeysCount());
        for (int i = 0; i < proto.getKeysCount(); i++) {
            KeySetProto.Key key = proto.getKeys(i);
            if (!key.getUnknownFields().asMap().isEmpty()) {
                throw new MalformedManifestException("Key " + i + " carries unknown fields " + key.getUnknownFields().asMap().keySet());
            }
            keys.add(fromProto(key));
        }
        return new KeySet(keys);
    }

    static KeySetProto.Key toProto(CellKey key) {
        return KeySetProto.Key.newBuilder()
            .setRow(ByteString.copyFrom(key.row().toByteArray()))
            .setCf(ByteString.copyFrom(key.family().toByteArray()))
            .setCq(ByteString.copyFrom(key.qualifier().toByteArray()))
            .setVisibility(ByteString.copyFrom(key.visibility().toByteArray()))
            .build();
    }

    static CellKey fromProto(KeySetProto.Key proto) {
        return new CellKey(
            ByteArray.copyOf(proto.getRow().toByteArray()),
            ByteArray.copyOf(proto.getCf().toByteArray()),
            ByteArray.copyOf(proto.getCq().toByteArray()),
            ByteArray.copyOf(proto.getVisibility().toByteArray())
        );
    }
}
