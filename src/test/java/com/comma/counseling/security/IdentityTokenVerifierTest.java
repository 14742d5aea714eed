package com.comma.counseling.security;

import com.comma.counseling.exceptions.InvalidCredentialException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.crypto.RSASSASigner;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IdentityTokenVerifierTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:00:00Z");

    private static KeyPair identityKeys;
    private static KeyPair otherKeys;

    private final IdentityTokenVerifier verifier = new IdentityTokenVerifier(
            (RSAPublicKey) identityKeys.getPublic(), Clock.fixed(NOW, ZoneOffset.UTC));

    @BeforeAll
    static void generateKeys() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        identityKeys = generator.generateKeyPair();
        otherKeys = generator.generateKeyPair();
    }

    @Test
    @DisplayName("a token signed by the identity service yields its subject")
    void validToken() throws Exception {
        UUID participantId = UUID.randomUUID();
        String token = sign(identityKeys.getPrivate(), participantId.toString(), NOW.plusSeconds(600));

        assertEquals(participantId, verifier.verifyParticipantId(token));
    }

    @Test
    @DisplayName("expired tokens are rejected")
    void expiredToken() throws Exception {
        String token = sign(identityKeys.getPrivate(), UUID.randomUUID().toString(), NOW.minusSeconds(1));

        InvalidCredentialException ex = assertThrows(InvalidCredentialException.class,
                () -> verifier.verifyParticipantId(token));
        assertEquals("Token expired", ex.getMessage());
    }

    @Test
    @DisplayName("tokens signed with another key are rejected")
    void foreignSignature() throws Exception {
        String token = sign(otherKeys.getPrivate(), UUID.randomUUID().toString(), NOW.plusSeconds(600));

        InvalidCredentialException ex = assertThrows(InvalidCredentialException.class,
                () -> verifier.verifyAndExtract(token));
        assertEquals("Invalid token signature", ex.getMessage());
    }

    @Test
    @DisplayName("garbage, blank and subject-less tokens are rejected")
    void malformedTokens() throws Exception {
        assertThrows(InvalidCredentialException.class, () -> verifier.verifyAndExtract("not.a.jwt"));
        assertThrows(InvalidCredentialException.class, () -> verifier.verifyAndExtract(" "));
        String noUuid = sign(identityKeys.getPrivate(), "admin", NOW.plusSeconds(600));
        assertThrows(InvalidCredentialException.class, () -> verifier.verifyParticipantId(noUuid));
    }

    private String sign(PrivateKey key, String subject, Instant expiresAt) throws Exception {
        JWTClaimsSet claims = new JWTClaimsSet.Builder()
                .subject(subject)
                .issueTime(Date.from(NOW.minusSeconds(60)))
                .expirationTime(Date.from(expiresAt))
                .build();
        SignedJWT jwt = new SignedJWT(new JWSHeader(JWSAlgorithm.RS256), claims);
        jwt.sign(new RSASSASigner(key));
        return jwt.serialize();
    }
}
