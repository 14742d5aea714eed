package com.comma.counseling.controller;

import com.comma.counseling.dto.BookSessionRequest;
import com.comma.counseling.dto.CancelSessionRequest;
import com.comma.counseling.dto.ChatSessionResponse;
import com.comma.counseling.dto.FeedbackRequest;
import com.comma.counseling.dto.MessageResponse;
import com.comma.counseling.dto.SessionPresenceResponse;
import com.comma.counseling.dto.events.ParticipantPresence;
import com.comma.counseling.exceptions.CounselingException;
import com.comma.counseling.exceptions.ForbiddenException;
import com.comma.counseling.exceptions.ValidationException;
import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.SessionStatus;
import com.comma.counseling.security.AuthenticatedParticipant;
import com.comma.counseling.service.AuditService;
import com.comma.counseling.service.booking.BookingService;
import com.comma.counseling.service.chats.ChatService;
import com.comma.counseling.service.sessions.ChatSessionService;
import com.comma.counseling.service.sessions.SessionLifecycleService;
import com.comma.counseling.ws.ConnectionRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
@Validated
@Slf4j
public class ChatSessionController {

    private final BookingService bookingService;
    private final ChatSessionService sessionService;
    private final SessionLifecycleService lifecycleService;
    private final ChatService chatService;
    private final ConnectionRegistry registry;
    private final AuditService auditService;

    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ChatSessionResponse> book(@AuthenticationPrincipal AuthenticatedParticipant caller,
                                                    @Valid @RequestBody BookSessionRequest req) {
        if (caller.isCounselor()) {
            throw new ForbiddenException("Only users can book counseling sessions");
        }
        ChatSession session = bookingService.book(caller.getId(), req);
        return ResponseEntity.status(HttpStatus.CREATED).body(ChatSessionResponse.from(session));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<ChatSessionResponse>> list(@AuthenticationPrincipal AuthenticatedParticipant caller,
                                                          @RequestParam(required = false) String status,
                                                          @RequestParam(defaultValue = "0") int skip,
                                                          @RequestParam(defaultValue = "20") int limit) {
        if (skip < 0 || limit < 1 || limit > 100) {
            throw new ValidationException("skip must be >= 0 and limit between 1 and 100");
        }
        List<ChatSession> sessions = sessionService.listForParticipant(caller, parseStatus(status), skip, limit);
        return ResponseEntity.ok(sessions.stream().map(ChatSessionResponse::from).toList());
    }

    @GetMapping(value = "/{sessionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ChatSessionResponse> details(@AuthenticationPrincipal AuthenticatedParticipant caller,
                                                       @PathVariable UUID sessionId) {
        return ResponseEntity.ok(ChatSessionResponse.from(sessionService.getForParticipant(sessionId, caller)));
    }

    @GetMapping(value = "/{sessionId}/connections", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<SessionPresenceResponse> connections(@AuthenticationPrincipal AuthenticatedParticipant caller,
                                                               @PathVariable UUID sessionId) {
        ChatSession session = sessionService.getForParticipant(sessionId, caller);
        List<ParticipantPresence> participants = registry.listParticipants(sessionId);
        return ResponseEntity.ok(new SessionPresenceResponse(
                session.getId(), session.getStatus(), registry.isActive(sessionId), participants, participants.size()));
    }

    @GetMapping(value = "/{sessionId}/messages", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<List<MessageResponse>> history(@AuthenticationPrincipal AuthenticatedParticipant caller,
                                                         @PathVariable UUID sessionId,
                                                         @RequestParam(defaultValue = "0") int skip,
                                                         @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(chatService.getHistory(sessionId, caller, skip, limit).stream()
                .map(MessageResponse::from)
                .toList());
    }

    @PostMapping(value = "/{sessionId}/cancel", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ChatSessionResponse> cancel(@AuthenticationPrincipal AuthenticatedParticipant caller,
                                                      @PathVariable UUID sessionId,
                                                      @Valid @RequestBody(required = false) CancelSessionRequest req) {
        String reason = req == null ? null : req.getReason();
        try {
            ChatSession session = lifecycleService.cancel(sessionId, caller.getId(), reason);
            auditService.success(caller.getId(), "cancel_session", sessionId);
            return ResponseEntity.ok(ChatSessionResponse.from(session));
        } catch (CounselingException e) {
            auditService.rejected(caller.getId(), "cancel_session", sessionId, e.getMessage());
            throw e;
        }
    }

    @PostMapping(value = "/{sessionId}/feedback", consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ChatSessionResponse> feedback(@AuthenticationPrincipal AuthenticatedParticipant caller,
                                                        @PathVariable UUID sessionId,
                                                        @Valid @RequestBody FeedbackRequest req) {
        if (caller.isCounselor()) {
            throw new ForbiddenException("Only the session's user can leave feedback");
        }
        ChatSession session = sessionService.submitFeedback(sessionId, caller.getId(), req.getRating(), req.getFeedback());
        return ResponseEntity.ok(ChatSessionResponse.from(session));
    }

    private SessionStatus parseStatus(String status) {
        if (status == null || status.isBlank()) {
            return null;
        }
        try {
            return SessionStatus.fromCode(status);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown session status: " + status);
        }
    }
}
