package com.comma.counseling.service.sessions;

import com.comma.counseling.exceptions.ForbiddenException;
import com.comma.counseling.exceptions.InvalidTransitionException;
import com.comma.counseling.exceptions.NotFoundException;
import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.NotificationKind;
import com.comma.counseling.models.SessionStatus;
import com.comma.counseling.repo.ChatSessionJDBCRepository;
import com.comma.counseling.repo.CounselorProfileJDBCRepository;
import com.comma.counseling.repo.TimeSlotJDBCRepository;
import com.comma.counseling.service.NotificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Session state machine: {@code pending -> active -> completed} and {@code pending -> cancelled}.
 * <p>
 * Human actions and the scheduler both end up in the conditional updates of
 * {@link ChatSessionJDBCRepository}; whichever reaches the row first in the expected
 * state wins and the other one gets an {@link InvalidTransitionException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionLifecycleService {

    static final String AUTO_CANCEL_NOTE =
            "Auto-cancelled: Session was not started within %d minutes of scheduled time";
    static final String AUTO_COMPLETE_NOTE =
            "Auto-completed: Session exceeded scheduled end time by %d+ minutes";

    private final ChatSessionJDBCRepository sessionRepo;
    private final TimeSlotJDBCRepository slotRepo;
    private final CounselorProfileJDBCRepository counselorRepo;
    private final NotificationService notificationService;
    private final Clock clock;

    @Transactional
    public ChatSession start(UUID sessionId, UUID counselorId) {
        ChatSession session = load(sessionId);
        requireCounselor(session, counselorId);
        requireStatus(session, SessionStatus.PENDING, "start");

        Instant now = clock.instant();
        if (!sessionRepo.markStarted(sessionId, now)) {
            throw lostRace(sessionId, "start");
        }
        session.setStatus(SessionStatus.ACTIVE);
        session.setActualStartTime(now);
        session.setUpdatedAt(now);
        log.info("Session {} started by counselor {}", sessionId, counselorId);

        notificationService.notify(session.getUserId(), NotificationKind.SESSION_STARTED, payload(session));
        return session;
    }

    @Transactional
    public ChatSession complete(UUID sessionId, UUID counselorId, String notes) {
        ChatSession session = load(sessionId);
        requireCounselor(session, counselorId);
        requireStatus(session, SessionStatus.ACTIVE, "complete");

        Instant now = clock.instant();
        finish(session, now, notes, now);
        log.info("Session {} completed by counselor {} after {} minutes", sessionId, counselorId, session.getDuration());
        return session;
    }

    /**
     * Cancels a pending session on behalf of one of its participants. Active sessions
     * cannot be cancelled; they end through {@link #complete} or the overdue sweep.
     */
    @Transactional
    public ChatSession cancel(UUID sessionId, UUID actorId, String reason) {
        ChatSession session = load(sessionId);
        if (!session.isParticipant(actorId)) {
            throw new ForbiddenException("Session not found or access denied");
        }
        requireStatus(session, SessionStatus.PENDING, "cancel");

        String notes = reason == null || reason.isBlank()
                ? session.getCounselorNotes()
                : appendNote(session.getCounselorNotes(), "Cancellation reason: " + reason.trim());
        Instant now = clock.instant();
        cancelPending(session, notes, now);
        log.info("Session {} cancelled by {}", sessionId, actorId);

        Map<String, Object> payload = payload(session);
        payload.put("cancelled_by", actorId.equals(session.getUserId()) ? "user" : "counselor");
        if (reason != null && !reason.isBlank()) {
            payload.put("reason", reason.trim());
        }
        notificationService.notify(session.otherParticipant(actorId), NotificationKind.SESSION_CANCELLED, payload);
        return session;
    }

    /**
     * Scheduler path for a pending session that was never started.
     */
    @Transactional
    public ChatSession autoCancel(UUID sessionId, Duration grace) {
        ChatSession session = load(sessionId);
        requireStatus(session, SessionStatus.PENDING, "cancel");

        String notes = appendNote(session.getCounselorNotes(), String.format(AUTO_CANCEL_NOTE, grace.toMinutes()));
        cancelPending(session, notes, clock.instant());

        Map<String, Object> payload = payload(session);
        payload.put("cancelled_by", "system");
        notificationService.notify(session.getUserId(), NotificationKind.SESSION_CANCELLED, payload);
        return session;
    }

    /**
     * Scheduler path for an active session left running past its slot. The end time
     * is synthetic: scheduled end plus the grace period.
     */
    @Transactional
    public ChatSession autoComplete(UUID sessionId, Duration grace) {
        ChatSession session = load(sessionId);
        requireStatus(session, SessionStatus.ACTIVE, "complete");

        LocalDateTime syntheticEnd = session.scheduledEnd().plus(grace);
        Instant endedAt = syntheticEnd.atZone(clock.getZone()).toInstant();
        finish(session, endedAt, String.format(AUTO_COMPLETE_NOTE, grace.toMinutes()), clock.instant());
        return session;
    }

    private void finish(ChatSession session, Instant endedAt, String note, Instant now) {
        int duration = session.getActualStartTime() == null
                ? 0
                : (int) Math.max(0, Duration.between(session.getActualStartTime(), endedAt).toMinutes());
        String notes = note == null || note.isBlank()
                ? session.getCounselorNotes()
                : appendNote(session.getCounselorNotes(), note.trim());

        if (!sessionRepo.markCompleted(session.getId(), endedAt, duration, notes, now)) {
            throw lostRace(session.getId(), "complete");
        }
        counselorRepo.incrementTotalSessions(session.getCounselorId());

        session.setStatus(SessionStatus.COMPLETED);
        session.setActualEndTime(endedAt);
        session.setDuration(duration);
        session.setCounselorNotes(notes);
        session.setUpdatedAt(now);

        Map<String, Object> payload = payload(session);
        payload.put("duration", duration);
        notificationService.notify(session.getUserId(), NotificationKind.SESSION_COMPLETED, payload);
    }

    private void cancelPending(ChatSession session, String notes, Instant now) {
        if (!sessionRepo.markCancelled(session.getId(), notes, now)) {
            throw lostRace(session.getId(), "cancel");
        }
        if (session.getTimeSlotId() != null && !slotRepo.release(session.getTimeSlotId(), now)) {
            log.warn("Time slot {} of cancelled session {} no longer exists", session.getTimeSlotId(), session.getId());
        }
        session.setStatus(SessionStatus.CANCELLED);
        session.setCounselorNotes(notes);
        session.setUpdatedAt(now);
    }

    private ChatSession load(UUID sessionId) {
        return sessionRepo.findById(sessionId)
                .orElseThrow(() -> new NotFoundException("Chat session", sessionId));
    }

    private void requireCounselor(ChatSession session, UUID counselorId) {
        if (!session.getCounselorId().equals(counselorId)) {
            throw new ForbiddenException("Only the session's counselor can do this");
        }
    }

    private void requireStatus(ChatSession session, SessionStatus expected, String action) {
        if (session.getStatus() != expected) {
            throw new InvalidTransitionException(session.getId(), session.getStatus(), action);
        }
    }

    private InvalidTransitionException lostRace(UUID sessionId, String action) {
        SessionStatus current = sessionRepo.findById(sessionId).map(ChatSession::getStatus).orElse(null);
        log.info("Concurrent transition on session {}, {} rejected (now {})", sessionId, action, current);
        return new InvalidTransitionException(sessionId, current, action);
    }

    private Map<String, Object> payload(ChatSession session) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("session_id", session.getId());
        payload.put("scheduled_start", session.scheduledStart().toString());
        return payload;
    }

    static String appendNote(String existing, String note) {
        if (existing == null || existing.isBlank()) {
            return note;
        }
        return existing + "\n\n" + note;
    }
}
