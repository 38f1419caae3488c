package io.komorebi.document.keyset;

import io.komorebi.common.ByteArray;
import io.komorebi.common.CellKey;
import io.komorebi.document.MalformedManifestException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class KeySetCodecTest {

    @Test
    void roundTripPreservesOrder() {
        KeySet keySet = KeySet.builder()
            .add(CellKey.of("hello", "idx", "v1", "public"))
            .add(CellKey.of("d1", "text", "c1", "public"))
            .add(CellKey.of("d1", "_meta\u0000text", "c1", "public"))
            .build();

        KeySet decoded = KeySetCodec.decode(KeySetCodec.encode(keySet));

        assertThat(decoded).isEqualTo(keySet);
        assertThat(decoded.keys()).containsExactlyElementsOf(keySet.keys());
    }

    @Test
    void roundTripPreservesDuplicatesAndEmptyFields() {
        CellKey empty = CellKey.of("", "", "", "");
        KeySet keySet = new KeySet(List.of(empty, CellKey.of("r", "", "q", ""), empty));

        KeySet decoded = KeySetCodec.decode(KeySetCodec.encode(keySet));

        assertThat(decoded.keys()).containsExactly(empty, CellKey.of("r", "", "q", ""), empty);
    }

    @Test
    void roundTripPreservesArbitraryBytes() {
        byte[] large = new byte[100_000];
        for (int i = 0; i < large.length; i++) {
            large[i] = (byte) (i % 256);
        }
        CellKey key = new CellKey(ByteArray.copyOf(large), ByteArray.of((byte) 0, (byte) 0xFF),
            ByteArray.of((byte) 0x80), ByteArray.of("A&(B|C)"));

        KeySet decoded = KeySet.decode(new KeySet(List.of(key)).encode());

        assertThat(decoded.keys()).containsExactly(key);
    }

    @Test
    void emptyKeySetEncodesToEmptyBytes() {
        byte[] encoded = KeySetCodec.encode(KeySet.empty());

        assertThat(encoded).isEmpty();
        assertThat(KeySetCodec.decode(encoded).isEmpty()).isTrue();
    }

    @Test
    void truncatedInputRejected() {
        byte[] encoded = KeySetCodec.encode(new KeySet(List.of(CellKey.of("row", "family", "qualifier", "vis"))));
        byte[] truncated = java.util.Arrays.copyOf(encoded, encoded.length - 3);

        assertThatThrownBy(() -> KeySetCodec.decode(truncated))
            .isInstanceOf(MalformedManifestException.class);
    }

    @Test
    void invalidWireDataRejected() {
        assertThatThrownBy(() -> KeySetCodec.decode(new byte[]{(byte) 0xFF}))
            .isInstanceOf(MalformedManifestException.class);
    }

    @Test
    void unknownTopLevelFieldRejected() {
        // field 2, varint 1
        byte[] foreign = {0x10, 0x01};

        assertThatThrownBy(() -> KeySetCodec.decode(foreign))
            .isInstanceOf(MalformedManifestException.class)
            .hasMessageContaining("unknown fields");
    }

    @Test
    void unknownKeyFieldRejected() {
        // field 1 (Key, 2 bytes) holding field 5, varint 1
        byte[] foreign = {0x0A, 0x02, 0x28, 0x01};

        assertThatThrownBy(() -> KeySetCodec.decode(foreign))
            .isInstanceOf(MalformedManifestException.class)
            .hasMessageContaining("Key 0");
    }

    @Test
    void nullInputRejected() {
        assertThatThrownBy(() -> KeySetCodec.decode(null))
            .isInstanceOf(NullPointerException.class);
    }
}
