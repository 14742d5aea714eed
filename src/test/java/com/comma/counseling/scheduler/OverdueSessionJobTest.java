package com.comma.counseling.scheduler;

import com.comma.counseling.exceptions.InvalidTransitionException;
import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.SessionStatus;
import com.comma.counseling.repo.ChatSessionJDBCRepository;
import com.comma.counseling.service.sessions.SessionLifecycleService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OverdueSessionJobTest {

    private static final LocalDate DAY = LocalDate.of(2026, 3, 2);

    @Mock(strictness = Mock.Strictness.LENIENT)
    private ChatSessionJDBCRepository sessionRepo;
    @Mock
    private SessionLifecycleService lifecycleService;

    @Test
    @DisplayName("a 09:00 pending session survives the 09:14 sweep and is cancelled at 09:16")
    void pendingGracePeriod() {
        ChatSession pending = session(SessionStatus.PENDING);
        when(sessionRepo.findByStatusScheduledOnOrBefore(SessionStatus.PENDING, DAY)).thenReturn(List.of(pending));

        jobAt("2026-03-02T09:14:00Z").sweep();
        verify(lifecycleService, never()).autoCancel(any(), any());

        jobAt("2026-03-02T09:16:00Z").sweep();
        verify(lifecycleService).autoCancel(pending.getId(), Duration.ofMinutes(15));
    }

    @Test
    @DisplayName("an active session is completed once its end is more than 30 minutes past")
    void activeGracePeriod() {
        ChatSession active = session(SessionStatus.ACTIVE);
        when(sessionRepo.findByStatusScheduledOnOrBefore(SessionStatus.ACTIVE, DAY)).thenReturn(List.of(active));

        jobAt("2026-03-02T10:19:00Z").sweep();
        verify(lifecycleService, never()).autoComplete(any(), any());

        jobAt("2026-03-02T10:21:00Z").sweep();
        verify(lifecycleService).autoComplete(active.getId(), Duration.ofMinutes(30));
    }

    @Test
    @DisplayName("a session another actor already moved is skipped and the sweep goes on")
    void lostRaceIsIsolated() {
        ChatSession first = session(SessionStatus.PENDING);
        ChatSession second = session(SessionStatus.PENDING);
        when(sessionRepo.findByStatusScheduledOnOrBefore(SessionStatus.PENDING, DAY)).thenReturn(List.of(first, second));
        when(lifecycleService.autoCancel(first.getId(), Duration.ofMinutes(15)))
                .thenThrow(new InvalidTransitionException(first.getId(), SessionStatus.ACTIVE, "cancel"));

        assertDoesNotThrow(() -> jobAt("2026-03-02T09:30:00Z").sweep());

        verify(lifecycleService).autoCancel(second.getId(), Duration.ofMinutes(15));
    }

    @Test
    @DisplayName("an unexpected failure on one session does not stop the others")
    void failureIsIsolated() {
        ChatSession first = session(SessionStatus.ACTIVE);
        ChatSession second = session(SessionStatus.ACTIVE);
        when(sessionRepo.findByStatusScheduledOnOrBefore(SessionStatus.ACTIVE, DAY)).thenReturn(List.of(first, second));
        when(lifecycleService.autoComplete(first.getId(), Duration.ofMinutes(30)))
                .thenThrow(new IllegalStateException("connection reset"));

        assertDoesNotThrow(() -> jobAt("2026-03-02T11:00:00Z").sweep());

        verify(lifecycleService).autoComplete(second.getId(), Duration.ofMinutes(30));
    }

    private OverdueSessionJob jobAt(String instant) {
        Clock clock = Clock.fixed(Instant.parse(instant), ZoneOffset.UTC);
        return new OverdueSessionJob(sessionRepo, lifecycleService, clock);
    }

    private ChatSession session(SessionStatus status) {
        return ChatSession.builder()
                .id(UUID.randomUUID())
                .userId(UUID.randomUUID())
                .counselorId(UUID.randomUUID())
                .status(status)
                .scheduledDate(DAY)
                .scheduledStartTime(LocalTime.of(9, 0))
                .scheduledEndTime(LocalTime.of(9, 50))
                .build();
    }
}
