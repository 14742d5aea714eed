package com.comma.counseling.service.sessions;

import com.comma.counseling.exceptions.ForbiddenException;
import com.comma.counseling.exceptions.InvalidTransitionException;
import com.comma.counseling.exceptions.NotFoundException;
import com.comma.counseling.exceptions.ValidationException;
import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.ParticipantKind;
import com.comma.counseling.models.SessionStatus;
import com.comma.counseling.repo.ChatSessionJDBCRepository;
import com.comma.counseling.security.AuthenticatedParticipant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatSessionServiceTest {

    @Mock
    private ChatSessionJDBCRepository sessionRepo;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T11:00:00Z"), ZoneOffset.UTC);
    private ChatSessionService sessionService;

    private final UUID sessionId = UUID.randomUUID();
    private final UUID userId = UUID.randomUUID();
    private final UUID counselorId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        sessionService = new ChatSessionService(sessionRepo, clock);
    }

    @Test
    @DisplayName("a lookup naming neither a user nor a counselor is always denied")
    void neitherIdentity() {
        assertThrows(ForbiddenException.class, () -> sessionService.getSessionDetails(sessionId, null, null));
        verifyNoInteractions(sessionRepo);
    }

    @Test
    @DisplayName("the bound user and the bound counselor can read the session")
    void boundParticipantsCanRead() {
        ChatSession session = session(SessionStatus.PENDING);
        when(sessionRepo.findById(sessionId)).thenReturn(Optional.of(session));

        assertSame(session, sessionService.getSessionDetails(sessionId, userId, null));
        assertSame(session, sessionService.getForParticipant(sessionId,
                new AuthenticatedParticipant(counselorId, ParticipantKind.COUNSELOR, "Dr. Han")));
    }

    @Test
    @DisplayName("a user id passed as counselor does not match the counselor side")
    void wrongSide() {
        when(sessionRepo.findById(sessionId)).thenReturn(Optional.of(session(SessionStatus.PENDING)));

        assertThrows(ForbiddenException.class, () -> sessionService.getSessionDetails(sessionId, null, userId));
    }

    @Test
    @DisplayName("an unknown session is not found")
    void unknownSession() {
        when(sessionRepo.findById(sessionId)).thenReturn(Optional.empty());

        assertThrows(NotFoundException.class, () -> sessionService.getSessionDetails(sessionId, userId, null));
    }

    @Test
    @DisplayName("listing is scoped to the caller's side")
    void listScopedToSide() {
        AuthenticatedParticipant counselor = new AuthenticatedParticipant(counselorId, ParticipantKind.COUNSELOR, "Dr. Han");
        when(sessionRepo.findByCounselorId(counselorId, SessionStatus.ACTIVE, 0, 20)).thenReturn(List.of());

        sessionService.listForParticipant(counselor, SessionStatus.ACTIVE, 0, 20);

        verify(sessionRepo).findByCounselorId(counselorId, SessionStatus.ACTIVE, 0, 20);
    }

    @Test
    @DisplayName("feedback is stored for a completed session")
    void feedback() {
        when(sessionRepo.findById(sessionId)).thenReturn(Optional.of(session(SessionStatus.COMPLETED)));
        when(sessionRepo.saveFeedback(sessionId, userId, 5, "Helpful", clock.instant())).thenReturn(true);

        ChatSession rated = sessionService.submitFeedback(sessionId, userId, 5, "Helpful");

        assertEquals(5, rated.getRating());
        assertEquals("Helpful", rated.getUserFeedback());
    }

    @Test
    @DisplayName("feedback needs a completed session and a rating from 1 to 5")
    void feedbackRejected() {
        assertThrows(ValidationException.class, () -> sessionService.submitFeedback(sessionId, userId, 6, null));

        when(sessionRepo.findById(sessionId)).thenReturn(Optional.of(session(SessionStatus.ACTIVE)));
        assertThrows(InvalidTransitionException.class, () -> sessionService.submitFeedback(sessionId, userId, 4, null));
    }

    private ChatSession session(SessionStatus status) {
        return ChatSession.builder()
                .id(sessionId)
                .userId(userId)
                .counselorId(counselorId)
                .status(status)
                .build();
    }
}
