package com.example.codeintel.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Clave y salt (hex) con los que se cifraron los tokens de GitHub de los proyectos.
 */
@ConfigurationProperties(prefix = "codeintel.token-crypto")
public class TokenCryptoProperties {

    private String password;
    private String salt;

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public String getSalt() { return salt; }
    public void setSalt(String salt) { this.salt = salt; }
}
