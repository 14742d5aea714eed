package com.comma.counseling.security;

import com.comma.counseling.exceptions.InvalidCredentialException;
import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.RSASSAVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import org.springframework.stereotype.Component;

import java.security.interfaces.RSAPublicKey;
import java.text.ParseException;
import java.time.Clock;
import java.util.Date;
import java.util.UUID;

/**
 * Verifies access tokens issued by the identity service and extracts the participant id.
 */
@Component
public class IdentityTokenVerifier {

    private final RSAPublicKey identityPublicKey;
    private final Clock clock;

    public IdentityTokenVerifier(RSAPublicKey identityPublicKey, Clock clock) {
        this.identityPublicKey = identityPublicKey;
        this.clock = clock;
    }

    public JWTClaimsSet verifyAndExtract(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidCredentialException("Missing token");
        }
        try {
            SignedJWT signedJWT = SignedJWT.parse(token);
            JWSVerifier verifier = new RSASSAVerifier(identityPublicKey);

            if (!signedJWT.verify(verifier)) {
                throw new InvalidCredentialException("Invalid token signature");
            }

            JWTClaimsSet claims = signedJWT.getJWTClaimsSet();
            Date now = Date.from(clock.instant());
            if (claims.getExpirationTime() == null || now.after(claims.getExpirationTime())) {
                throw new InvalidCredentialException("Token expired");
            }
            return claims;
        } catch (ParseException | JOSEException e) {
            throw new InvalidCredentialException("Invalid token", e);
        }
    }

    public UUID verifyParticipantId(String token) {
        String subject = verifyAndExtract(token).getSubject();
        if (subject == null) {
            throw new InvalidCredentialException("Invalid token: no participant id");
        }
        try {
            return UUID.fromString(subject);
        } catch (IllegalArgumentException e) {
            throw new InvalidCredentialException("Invalid token: malformed participant id", e);
        }
    }
}
