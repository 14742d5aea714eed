package com.comma.counseling.service.chats;

import com.comma.counseling.exceptions.ForbiddenException;
import com.comma.counseling.exceptions.InvalidTransitionException;
import com.comma.counseling.exceptions.ValidationException;
import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.Message;
import com.comma.counseling.models.ParticipantKind;
import com.comma.counseling.models.SessionStatus;
import com.comma.counseling.repo.ChatSessionJDBCRepository;
import com.comma.counseling.repo.MessageJDBCRepository;
import com.comma.counseling.security.AuthenticatedParticipant;
import com.comma.counseling.service.sessions.ChatSessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatServiceImpTest {

    @Mock
    private ChatSessionService sessionService;
    @Mock
    private ChatSessionJDBCRepository sessionRepo;
    @Mock
    private MessageJDBCRepository msgRepo;

    private final Clock clock = Clock.fixed(Instant.parse("2026-03-02T09:05:00Z"), ZoneOffset.UTC);
    private ChatServiceImp chatService;

    private final UUID sessionId = UUID.randomUUID();
    private final AuthenticatedParticipant user =
            new AuthenticatedParticipant(UUID.randomUUID(), ParticipantKind.USER, "Minji");

    @BeforeEach
    void setUp() {
        chatService = new ChatServiceImp(sessionService, sessionRepo, msgRepo, clock);
        ReflectionTestUtils.setField(chatService, "maxLength", 10);
    }

    @Test
    @DisplayName("a message in a pending session is stored trimmed and attributed to the sender")
    void sendInPendingSession() {
        when(sessionService.getForParticipant(sessionId, user)).thenReturn(session(SessionStatus.PENDING));
        when(msgRepo.insertIfSessionOpen(any(Message.class))).thenAnswer(inv -> Optional.of(inv.getArgument(0)));

        Message stored = chatService.sendMessage(sessionId, user, "  hello ");

        ArgumentCaptor<Message> captor = ArgumentCaptor.forClass(Message.class);
        verify(msgRepo).insertIfSessionOpen(captor.capture());
        assertEquals("hello", captor.getValue().getContent());
        assertEquals(user.getId(), stored.getSenderId());
        assertEquals(ParticipantKind.USER, stored.getSenderKind());
        assertEquals(clock.instant(), stored.getCreatedAt());
    }

    @Test
    @DisplayName("blank content is rejected before touching the session")
    void blankContent() {
        ValidationException ex = assertThrows(ValidationException.class,
                () -> chatService.sendMessage(sessionId, user, "   "));

        assertEquals("Message content cannot be empty", ex.getMessage());
        verify(sessionService, never()).getForParticipant(any(), any());
    }

    @Test
    @DisplayName("content longer than the limit is rejected")
    void tooLong() {
        assertThrows(ValidationException.class, () -> chatService.sendMessage(sessionId, user, "01234567890"));
    }

    @Test
    @DisplayName("a closed session refuses new messages")
    void closedSession() {
        when(sessionService.getForParticipant(sessionId, user)).thenReturn(session(SessionStatus.ACTIVE));
        when(msgRepo.insertIfSessionOpen(any(Message.class))).thenReturn(Optional.empty());
        when(sessionRepo.findById(sessionId)).thenReturn(Optional.of(session(SessionStatus.COMPLETED)));

        InvalidTransitionException ex = assertThrows(InvalidTransitionException.class,
                () -> chatService.sendMessage(sessionId, user, "hello"));

        assertEquals("Cannot send message to session with status: completed", ex.getMessage());
    }

    @Test
    @DisplayName("non participants cannot send")
    void notParticipant() {
        when(sessionService.getForParticipant(sessionId, user))
                .thenThrow(new ForbiddenException("Session not found or access denied"));

        assertThrows(ForbiddenException.class, () -> chatService.sendMessage(sessionId, user, "hello"));
        verify(msgRepo, never()).insertIfSessionOpen(any());
    }

    @Test
    @DisplayName("history checks access and pages in insertion order")
    void history() {
        Message first = Message.builder().id(UUID.randomUUID()).content("a").build();
        when(sessionService.getForParticipant(sessionId, user)).thenReturn(session(SessionStatus.ACTIVE));
        when(msgRepo.findBySessionId(sessionId, 0, 50)).thenReturn(List.of(first));

        assertEquals(List.of(first), chatService.getHistory(sessionId, user, 0, 50));
    }

    @Test
    @DisplayName("history rejects an out of range page size")
    void historyLimit() {
        assertThrows(ValidationException.class, () -> chatService.getHistory(sessionId, user, 0, 500));
        verify(msgRepo, never()).findBySessionId(any(), anyInt(), anyInt());
    }

    private ChatSession session(SessionStatus status) {
        return ChatSession.builder()
                .id(sessionId)
                .userId(user.getId())
                .counselorId(UUID.randomUUID())
                .status(status)
                .build();
    }
}
