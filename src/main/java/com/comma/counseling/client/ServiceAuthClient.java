package com.comma.counseling.client;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Mints short-lived service tokens attached to calls against the identity service.
 */
@Component
public class ServiceAuthClient {

    private final RSAKey privateKey;
    private final Clock clock;
    @Value("${service-name:counseling}") private String serviceName;
    @Value("${service.auth.token-ttl-seconds:120}") private long tokenTtlSeconds;

    public ServiceAuthClient(RSAKey privateKey, Clock clock) {
        this.privateKey = privateKey;
        this.clock = clock;
    }

    public String createToken(String audience) {
        Instant now = clock.instant();

        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .issuer(serviceName)
                .subject(serviceName)
                .audience(audience)
                .issueTime(Date.from(now))
                .expirationTime(Date.from(now.plusSeconds(tokenTtlSeconds)))
                .build();

        SignedJWT jwt = new SignedJWT(
                new JWSHeader.Builder(JWSAlgorithm.RS256)
                        .keyID(privateKey.getKeyID())
                        .build(),
                claims
        );

        try {
            jwt.sign(new RSASSASigner(privateKey.toPrivateKey()));
            return jwt.serialize();
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign service token", e);
        }
    }
}
