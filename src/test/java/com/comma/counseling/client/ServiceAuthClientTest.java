package com.comma.counseling.client;

import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.gen.RSAKeyGenerator;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceAuthClientTest {

    @Test
    void tokenIsSignedForTheAudienceWithKeyId() throws Exception {
        Instant now = Instant.parse("2026-03-02T09:00:00Z");
        RSAKey key = new RSAKeyGenerator(2048).keyID("counseling-service").generate();
        ServiceAuthClient client = new ServiceAuthClient(key, Clock.fixed(now, ZoneOffset.UTC));
        ReflectionTestUtils.setField(client, "serviceName", "counseling");
        ReflectionTestUtils.setField(client, "tokenTtlSeconds", 120L);

        SignedJWT jwt = SignedJWT.parse(client.createToken("identity"));

        assertTrue(jwt.verify(new RSASSAVerifier(key.toRSAPublicKey())));
        assertEquals("counseling-service", jwt.getHeader().getKeyID());
        JWTClaimsSet claims = jwt.getJWTClaimsSet();
        assertEquals(List.of("identity"), claims.getAudience());
        assertEquals("counseling", claims.getSubject());
        assertEquals(Date.from(now.plusSeconds(120)), claims.getExpirationTime());
    }
}
