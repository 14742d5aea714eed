package com.comma.counseling.config;

import com.nimbusds.jose.jwk.RSAKey;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.RSAPublicKeySpec;

/**
 * Signing key for tokens this service presents to the identity service.
 * Accepts PKCS#1 ("BEGIN RSA PRIVATE KEY") and PKCS#8 ("BEGIN PRIVATE KEY") files.
 */
@Configuration
public class KeyConfig {

    private final JcaPEMKeyConverter converter = CryptoProviderConfig.pemKeyConverter();

    @Bean
    public RSAKey servicePrivateKey(@Value("${service.auth.private-key}") Resource resource,
                                    @Value("${service.auth.key-id:counseling-service}") String keyId)
            throws IOException, GeneralSecurityException {
        KeyPair keyPair = readKeyPair(resource);
        return new RSAKey.Builder((RSAPublicKey) keyPair.getPublic())
                .privateKey((RSAPrivateKey) keyPair.getPrivate())
                .keyID(keyId)
                .build();
    }

    private KeyPair readKeyPair(Resource resource) throws IOException, GeneralSecurityException {
        Object pem;
        try (PEMParser parser = new PEMParser(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            pem = parser.readObject();
        }
        if (pem instanceof PEMKeyPair pkcs1) {
            return converter.getKeyPair(pkcs1);
        }
        if (pem instanceof PrivateKeyInfo pkcs8) {
            // PKCS#8 carries no public half; rebuild it from the CRT parameters
            RSAPrivateCrtKey privateKey = (RSAPrivateCrtKey) converter.getPrivateKey(pkcs8);
            RSAPublicKeySpec publicSpec = new RSAPublicKeySpec(privateKey.getModulus(), privateKey.getPublicExponent());
            return new KeyPair(KeyFactory.getInstance("RSA").generatePublic(publicSpec), privateKey);
        }
        throw new IllegalStateException("Service key " + resource.getDescription() + " is not an RSA private key: "
                + (pem == null ? "empty file" : pem.getClass().getSimpleName()));
    }
}
