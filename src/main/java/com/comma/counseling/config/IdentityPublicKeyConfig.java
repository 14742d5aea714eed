package com.comma.counseling.config;

import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.openssl.PEMParser;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.interfaces.RSAPublicKey;

/**
 * Public half of the identity service's signing key; user access tokens are verified against it.
 */
@Configuration
public class IdentityPublicKeyConfig {

    @Bean
    public RSAPublicKey identityPublicKey(@Value("${identity.auth.public-key}") Resource resource) throws Exception {
        try (PEMParser pemParser = new PEMParser(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            Object obj = pemParser.readObject();
            if (!(obj instanceof SubjectPublicKeyInfo keyInfo)) {
                throw new IllegalStateException("Expected an X.509 public key in " + resource.getDescription());
            }
            return (RSAPublicKey) CryptoProviderConfig.pemKeyConverter().getPublicKey(keyInfo);
        }
    }
}
