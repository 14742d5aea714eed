package com.comma.counseling.ws;

import com.comma.counseling.dto.MessageResponse;
import com.comma.counseling.dto.events.ErrorData;
import com.comma.counseling.dto.events.EventType;
import com.comma.counseling.dto.events.InboundEvent;
import com.comma.counseling.dto.events.ServerEvent;
import com.comma.counseling.dto.events.SessionEndedData;
import com.comma.counseling.dto.events.SessionInfoData;
import com.comma.counseling.dto.events.SessionStartedData;
import com.comma.counseling.dto.events.TypingData;
import com.comma.counseling.exceptions.CounselingException;
import com.comma.counseling.exceptions.ForbiddenException;
import com.comma.counseling.exceptions.InvalidCredentialException;
import com.comma.counseling.exceptions.NotFoundException;
import com.comma.counseling.exceptions.RateLimitException;
import com.comma.counseling.models.ChatSession;
import com.comma.counseling.models.Message;
import com.comma.counseling.security.AuthenticatedParticipant;
import com.comma.counseling.security.RateLimiter;
import com.comma.counseling.service.AuditService;
import com.comma.counseling.service.ParticipantService;
import com.comma.counseling.service.chats.ChatService;
import com.comma.counseling.service.sessions.ChatSessionService;
import com.comma.counseling.service.sessions.SessionLifecycleService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Clock;
import java.util.UUID;

/**
 * Drives one live connection: authenticates the connect, dispatches inbound frames
 * and fans results out through the {@link ConnectionRegistry}.
 * <p>
 * Connect failures close the socket with a coded reason. Once connected, failures
 * are reported to the sender as {@code error} events and the socket stays open.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RealtimeSessionCoordinator {

    public static final CloseStatus INVALID_TOKEN = new CloseStatus(4001);
    public static final CloseStatus INELIGIBLE_IDENTITY = new CloseStatus(4002);
    public static final CloseStatus ACCESS_DENIED = new CloseStatus(4003);
    public static final CloseStatus SERVER_ERROR = new CloseStatus(4000);

    static final String PARTICIPANT_ATTR = "counseling.participant";
    static final String SESSION_ATTR = "counseling.sessionId";

    private final ParticipantService participantService;
    private final ChatSessionService sessionService;
    private final SessionLifecycleService lifecycleService;
    private final ChatService chatService;
    private final ConnectionRegistry registry;
    private final RateLimiter rateLimiter;
    private final AuditService auditService;
    private final ObjectMapper json;
    private final Clock clock;

    public void connect(WebSocketSession handle, String rawSessionId, String token) {
        AuthenticatedParticipant participant;
        ChatSession session;
        try {
            participant = participantService.authenticate(token);
        } catch (InvalidCredentialException e) {
            close(handle, INVALID_TOKEN.withReason(e.getMessage()));
            return;
        } catch (ForbiddenException e) {
            close(handle, INELIGIBLE_IDENTITY.withReason(e.getMessage()));
            return;
        } catch (RuntimeException e) {
            log.error("WebSocket authentication error: {}", e.getMessage(), e);
            close(handle, SERVER_ERROR.withReason("Authentication failed"));
            return;
        }

        try {
            session = sessionService.getForParticipant(UUID.fromString(rawSessionId), participant);
        } catch (IllegalArgumentException | NotFoundException | ForbiddenException e) {
            log.info("Participant {} denied access to session {}", participant.getId(), rawSessionId);
            close(handle, ACCESS_DENIED.withReason("Access denied to session"));
            return;
        } catch (RuntimeException e) {
            log.error("WebSocket error for session {}: {}", rawSessionId, e.getMessage(), e);
            close(handle, SERVER_ERROR.withReason("Server error"));
            return;
        }

        handle.getAttributes().put(PARTICIPANT_ATTR, participant);
        handle.getAttributes().put(SESSION_ATTR, session.getId());
        registry.join(session.getId(), participant.getId(), participant.getKind(), handle);

        registry.send(handle, event(EventType.SESSION_INFO, new SessionInfoData(
                session.getId(),
                session.getStatus(),
                registry.listParticipants(session.getId()),
                "Connected to chat session")));
    }

    public void handleInbound(WebSocketSession handle, String payload) {
        AuthenticatedParticipant participant = (AuthenticatedParticipant) handle.getAttributes().get(PARTICIPANT_ATTR);
        UUID sessionId = (UUID) handle.getAttributes().get(SESSION_ATTR);
        if (participant == null || sessionId == null) {
            log.debug("Ignoring frame on unauthenticated socket {}", handle.getId());
            return;
        }

        InboundEvent inbound;
        try {
            inbound = json.readValue(payload, InboundEvent.class);
        } catch (JsonProcessingException e) {
            sendError(handle, "Invalid message format");
            return;
        }
        // a literal "null" frame parses without error
        if (inbound == null) {
            sendError(handle, "Invalid message format");
            return;
        }

        String type = inbound.getType();
        try {
            if (InboundEvent.CHAT_MESSAGE.equals(type)) {
                onChatMessage(handle, sessionId, participant, inbound);
            } else if (InboundEvent.TYPING.equals(type)) {
                onTyping(handle, sessionId, participant, inbound);
            } else if (InboundEvent.SESSION_ACTION.equals(type)) {
                onSessionAction(handle, sessionId, participant, inbound);
            } else {
                sendError(handle, "Unknown message type: " + type);
            }
        } catch (CounselingException e) {
            sendError(handle, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing {} from {} in session {}: {}", type, participant.getId(), sessionId, e.getMessage(), e);
            sendError(handle, "Server error processing message");
        }
    }

    public void disconnect(WebSocketSession handle) {
        registry.leave(handle);
    }

    private void onChatMessage(WebSocketSession handle, UUID sessionId, AuthenticatedParticipant sender,
                               InboundEvent inbound) {
        if (!rateLimiter.allow(sender.getId())) {
            throw new RateLimitException("Too many messages, please slow down");
        }
        Message message = chatService.sendMessage(sessionId, sender, inbound.getContent());
        registry.broadcast(sessionId, event(EventType.NEW_MESSAGE, MessageResponse.from(message)), null);
    }

    private void onTyping(WebSocketSession handle, UUID sessionId, AuthenticatedParticipant sender,
                          InboundEvent inbound) {
        TypingData data = new TypingData(sender.getId(), sender.getKind(), Boolean.TRUE.equals(inbound.getIsTyping()));
        registry.broadcast(sessionId, event(EventType.TYPING_INDICATOR, data), handle);
    }

    private void onSessionAction(WebSocketSession handle, UUID sessionId, AuthenticatedParticipant actor,
                                 InboundEvent inbound) {
        String action = inbound.getAction();
        boolean known = InboundEvent.START_SESSION.equals(action) || InboundEvent.END_SESSION.equals(action);
        if (!actor.isCounselor() || !known) {
            auditService.rejected(actor.getId(), action, sessionId, "unauthorized or unknown action");
            sendError(handle, "Invalid or unauthorized action: " + action);
            return;
        }

        try {
            if (InboundEvent.START_SESSION.equals(action)) {
                ChatSession started = lifecycleService.start(sessionId, actor.getId());
                auditService.success(actor.getId(), action, sessionId);
                registry.broadcast(sessionId, event(EventType.SESSION_STARTED, new SessionStartedData(
                        sessionId, actor.getId(), started.getActualStartTime(),
                        "Session has been started by the counselor")), null);
            } else {
                ChatSession ended = lifecycleService.complete(sessionId, actor.getId(), inbound.getCounselorNotes());
                auditService.success(actor.getId(), action, sessionId);
                registry.broadcast(sessionId, event(EventType.SESSION_ENDED, new SessionEndedData(
                        sessionId, actor.getId(), ended.getActualEndTime(), ended.getDuration(),
                        "Session has been completed by the counselor")), null);
            }
        } catch (CounselingException e) {
            auditService.rejected(actor.getId(), action, sessionId, e.getMessage());
            throw e;
        }
    }

    private void sendError(WebSocketSession handle, String message) {
        registry.send(handle, event(EventType.ERROR, new ErrorData(message)));
    }

    private ServerEvent event(EventType type, Object data) {
        return ServerEvent.of(type, data, clock.instant());
    }

    private void close(WebSocketSession handle, CloseStatus status) {
        try {
            handle.close(status);
        } catch (IOException e) {
            log.warn("Failed to close socket {} with {}: {}", handle.getId(), status, e.getMessage());
        }
    }
}
