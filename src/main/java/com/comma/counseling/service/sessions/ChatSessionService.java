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
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ChatSessionService {

    private final ChatSessionJDBCRepository sessionRepo;
    private final Clock clock;

    /**
     * Loads a session scoped to one side of it. Exactly the bound user or the bound
     * counselor may read it; a call with neither identity is always denied.
     */
    public ChatSession getSessionDetails(UUID sessionId, UUID userId, UUID counselorId) {
        if (userId == null && counselorId == null) {
            throw new ForbiddenException("Session not found or access denied");
        }
        ChatSession session = sessionRepo.findById(sessionId)
                .orElseThrow(() -> new NotFoundException("Chat session", sessionId));
        if (userId != null && !userId.equals(session.getUserId())) {
            throw new ForbiddenException("Session not found or access denied");
        }
        if (counselorId != null && !counselorId.equals(session.getCounselorId())) {
            throw new ForbiddenException("Session not found or access denied");
        }
        return session;
    }

    public ChatSession getForParticipant(UUID sessionId, AuthenticatedParticipant participant) {
        return participant.getKind() == ParticipantKind.COUNSELOR
                ? getSessionDetails(sessionId, null, participant.getId())
                : getSessionDetails(sessionId, participant.getId(), null);
    }

    public List<ChatSession> listForParticipant(AuthenticatedParticipant participant, SessionStatus status,
                                                int skip, int limit) {
        return participant.getKind() == ParticipantKind.COUNSELOR
                ? sessionRepo.findByCounselorId(participant.getId(), status, skip, limit)
                : sessionRepo.findByUserId(participant.getId(), status, skip, limit);
    }

    @Transactional
    public ChatSession submitFeedback(UUID sessionId, UUID userId, int rating, String feedback) {
        if (rating < 1 || rating > 5) {
            throw new ValidationException("Rating must be between 1 and 5");
        }
        ChatSession session = getSessionDetails(sessionId, userId, null);
        if (session.getStatus() != SessionStatus.COMPLETED) {
            throw new InvalidTransitionException(sessionId, session.getStatus(), "rate");
        }
        if (!sessionRepo.saveFeedback(sessionId, userId, rating, feedback, clock.instant())) {
            throw new NotFoundException("Chat session", sessionId);
        }
        session.setRating(rating);
        session.setUserFeedback(feedback);
        return session;
    }
}
