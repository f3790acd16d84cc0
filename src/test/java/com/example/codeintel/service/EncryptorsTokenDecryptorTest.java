package com.example.codeintel.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.codeintel.config.TokenCryptoProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.encrypt.Encryptors;

class EncryptorsTokenDecryptorTest {

    private static final String SALT = "5c0744940b5c369b";

    private TokenCryptoProperties props;
    private EncryptorsTokenDecryptor decryptor;

    @BeforeEach
    void setUp() {
        props = new TokenCryptoProperties();
        props.setPassword("s3cret-pass");
        props.setSalt(SALT);
        decryptor = new EncryptorsTokenDecryptor(props);
    }

    @Test
    void decryptsTokenEncryptedWithSameKey() {
        String encrypted = Encryptors.delux("s3cret-pass", SALT).encrypt("ghp_abc123");

        assertThat(decryptor.decrypt(encrypted)).isEqualTo("ghp_abc123");
    }

    @Test
    void tokenEncryptedWithOtherKeyIsRejected() {
        String encrypted = Encryptors.delux("another-pass", SALT).encrypt("ghp_abc123");

        assertThatThrownBy(() -> decryptor.decrypt(encrypted))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("descifrar");
    }

    @Test
    void malformedInputIsRejected() {
        assertThatThrownBy(() -> decryptor.decrypt("not-hex!")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> decryptor.decrypt("   ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void missingKeyConfigurationIsReported() {
        props.setPassword("");

        assertThatThrownBy(() -> decryptor.decrypt("abcd")).isInstanceOf(IllegalStateException.class);
    }
}
