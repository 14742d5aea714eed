package com.comma.counseling.service;

import com.comma.counseling.client.IdentityClient;
import com.comma.counseling.dto.ParticipantDto;
import com.comma.counseling.exceptions.ForbiddenException;
import com.comma.counseling.models.ParticipantKind;
import com.comma.counseling.security.AuthenticatedParticipant;
import com.comma.counseling.security.IdentityTokenVerifier;
import com.github.benmanes.caffeine.cache.Cache;
import feign.FeignException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.UUID;

/**
 * Resolves a credential to exactly one active, non-staff user or active counselor.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ParticipantService {

    private final IdentityTokenVerifier tokenVerifier;
    private final IdentityClient identityClient;
    private final Cache<UUID, ParticipantDto> participantCache;

    public AuthenticatedParticipant authenticate(String token) {
        UUID participantId = tokenVerifier.verifyParticipantId(token);
        return resolve(participantId);
    }

    public AuthenticatedParticipant resolve(UUID participantId) {
        ParticipantDto dto;
        try {
            dto = participantCache.get(participantId, identityClient::getParticipant);
        } catch (FeignException.NotFound e) {
            throw new ForbiddenException("User not found or inactive");
        }
        if (dto == null || !dto.isActive()) {
            throw new ForbiddenException("User not found or inactive");
        }
        ParticipantKind kind = kindOf(dto.getRole());
        if (kind == null) {
            log.debug("Participant {} has role {} which cannot join counseling sessions", participantId, dto.getRole());
            throw new ForbiddenException("User not found or inactive");
        }
        return new AuthenticatedParticipant(dto.getId(), kind, dto.getDisplayName());
    }

    public void evict(UUID participantId) {
        participantCache.invalidate(participantId);
    }

    private ParticipantKind kindOf(String role) {
        if (role == null) return null;
        return switch (role.trim().toLowerCase(Locale.ROOT)) {
            case "user" -> ParticipantKind.USER;
            case "counselor" -> ParticipantKind.COUNSELOR;
            default -> null;
        };
    }
}
