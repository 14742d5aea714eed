package com.comma.counseling.service;

import com.comma.counseling.client.IdentityClient;
import com.comma.counseling.dto.ParticipantDto;
import com.comma.counseling.exceptions.ForbiddenException;
import com.comma.counseling.models.ParticipantKind;
import com.comma.counseling.security.AuthenticatedParticipant;
import com.comma.counseling.security.IdentityTokenVerifier;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import feign.FeignException;
import feign.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ParticipantServiceTest {

    @Mock
    private IdentityTokenVerifier tokenVerifier;
    @Mock
    private IdentityClient identityClient;

    private ParticipantService participantService;
    private final UUID participantId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        Cache<UUID, ParticipantDto> cache = Caffeine.newBuilder().build();
        participantService = new ParticipantService(tokenVerifier, identityClient, cache);
    }

    @Test
    @DisplayName("an active counselor resolves to a counselor participant and is cached")
    void activeCounselor() {
        when(tokenVerifier.verifyParticipantId("tok")).thenReturn(participantId);
        when(identityClient.getParticipant(participantId)).thenReturn(dto("Counselor", true));

        AuthenticatedParticipant first = participantService.authenticate("tok");
        AuthenticatedParticipant second = participantService.authenticate("tok");

        assertEquals(ParticipantKind.COUNSELOR, first.getKind());
        assertEquals(first, second);
        verify(identityClient, times(1)).getParticipant(participantId);
    }

    @Test
    @DisplayName("inactive accounts are refused")
    void inactive() {
        when(identityClient.getParticipant(participantId)).thenReturn(dto("user", false));

        ForbiddenException ex = assertThrows(ForbiddenException.class, () -> participantService.resolve(participantId));
        assertEquals("User not found or inactive", ex.getMessage());
    }

    @Test
    @DisplayName("staff roles other than counselor cannot take part")
    void otherStaffRole() {
        when(identityClient.getParticipant(participantId)).thenReturn(dto("admin", true));

        assertThrows(ForbiddenException.class, () -> participantService.resolve(participantId));
    }

    @Test
    @DisplayName("an identity unknown to the identity service is refused")
    void unknownIdentity() {
        Request request = Request.create(Request.HttpMethod.GET, "/internal/counseling/participants/" + participantId,
                Map.of(), null, StandardCharsets.UTF_8, null);
        when(identityClient.getParticipant(participantId))
                .thenThrow(new FeignException.NotFound("not found", request, null, null));

        assertThrows(ForbiddenException.class, () -> participantService.resolve(participantId));
    }

    private ParticipantDto dto(String role, boolean active) {
        return ParticipantDto.builder()
                .id(participantId)
                .displayName("Dr. Han")
                .role(role)
                .active(active)
                .build();
    }
}
