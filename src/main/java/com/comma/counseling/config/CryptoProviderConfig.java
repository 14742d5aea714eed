package com.comma.counseling.config;

import lombok.extern.slf4j.Slf4j;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.springframework.context.annotation.Configuration;

import java.security.Provider;
import java.security.Security;

/**
 * Registers BouncyCastle once per JVM and hands out PEM converters bound to it, so key
 * loading does not depend on which JCA provider the runtime prefers.
 */
@Slf4j
@Configuration
public class CryptoProviderConfig {

    private static final Provider PROVIDER = register();

    private static Provider register() {
        Provider installed = Security.getProvider(BouncyCastleProvider.PROVIDER_NAME);
        if (installed != null) {
            return installed;
        }
        Provider provider = new BouncyCastleProvider();
        Security.addProvider(provider);
        log.info("Registered JCA provider {} {}", provider.getName(), provider.getVersionStr());
        return provider;
    }

    static JcaPEMKeyConverter pemKeyConverter() {
        return new JcaPEMKeyConverter().setProvider(PROVIDER);
    }
}
