package org.example.encryptedqr.common;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SymmetricKeyTest {

    @Test
    void requiresExactly256Bits() {
        assertThatThrownBy(() -> SymmetricKey.of(new byte[16])).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SymmetricKey.of(null)).isInstanceOf(IllegalArgumentException.class);
        assertThat(SymmetricKey.of(new byte[32]).asSecretKey().getEncoded()).hasSize(32);
    }

    @Test
    void copiesInputAndHidesMaterialFromToString() {
        byte[] material = new byte[32];
        SymmetricKey key = SymmetricKey.of(material);
        material[0] = 1;

        assertThat(key).isEqualTo(SymmetricKey.of(new byte[32]));
        assertThat(key.toString()).startsWith("SymmetricKey[").hasSize("SymmetricKey[]".length() + 16);
        assertThat(key.fingerprint()).isEqualTo(SymmetricKey.of(new byte[32]).fingerprint());
    }
}
