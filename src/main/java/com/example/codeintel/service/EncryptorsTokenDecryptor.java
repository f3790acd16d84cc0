package com.example.codeintel.service;

import com.example.codeintel.config.TokenCryptoProperties;
import org.springframework.security.crypto.encrypt.Encryptors;
import org.springframework.security.crypto.encrypt.TextEncryptor;
import org.springframework.stereotype.Component;

/**
 * Descifra tokens cifrados con AES-GCM ({@link Encryptors#delux}) usando la clave y el salt configurados.
 */
@Component
public class EncryptorsTokenDecryptor implements TokenDecryptor {

    private final TokenCryptoProperties props;

    public EncryptorsTokenDecryptor(TokenCryptoProperties props) {
        this.props = props;
    }

    @Override
    public String decrypt(String encrypted) {
        if (encrypted == null || encrypted.isBlank()) {
            throw new IllegalArgumentException("El token cifrado no puede estar vacio");
        }
        if (props.getPassword() == null || props.getPassword().isBlank()
                || props.getSalt() == null || props.getSalt().isBlank()) {
            throw new IllegalStateException("Falta codeintel.token-crypto.password o codeintel.token-crypto.salt");
        }
        try {
            return encryptor().decrypt(encrypted.trim());
        } catch (IllegalStateException | IllegalArgumentException e) {
            throw new IllegalArgumentException("No se pudo descifrar el token", e);
        }
    }

    TextEncryptor encryptor() {
        return Encryptors.delux(props.getPassword(), props.getSalt());
    }
}
