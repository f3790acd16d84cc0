package com.example.codeintel.service;

public interface TokenDecryptor {

    /**
     * @throws IllegalArgumentException si el texto cifrado esta vacio o no se puede descifrar
     */
    String decrypt(String encrypted);
}
